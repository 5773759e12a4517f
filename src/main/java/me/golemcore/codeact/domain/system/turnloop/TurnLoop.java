/*
 * Copyright 2026 Aleksei Kuleshov
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 *
 * Contact: alex@kuleshov.tech
 */


package me.golemcore.codeact.domain.system.turnloop;

import me.golemcore.codeact.domain.model.AgentEvent;
import reactor.core.publisher.Flux;

/**
 * Drives one exchange: model step, action dispatch, results fed back, repeated
 * until the model proposes nothing or the round budget runs out.
 */
public interface TurnLoop {

    /**
     * @param prompt
     *            user input
     * @param maxTurns
     *            maximum number of dispatch rounds, or {@code null} for no limit
     * @return events of the exchange; errors are fatal model or persistence
     *         failures
     */
    Flux<AgentEvent> runTurn(String prompt, Integer maxTurns);

    /**
     * Marks the loop cancelled. A running turn stops after its current
     * dispatch and is logged as incomplete instead of with its own status.
     */
    void cancel();
}
