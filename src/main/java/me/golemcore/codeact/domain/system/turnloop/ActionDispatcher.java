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
import me.golemcore.codeact.domain.model.Message;
import reactor.core.publisher.Flux;

import java.util.List;

/**
 * Dispatches the action proposals of one model step.
 */
public interface ActionDispatcher {

    /**
     * Runs all proposals concurrently. Each proposal's result is recorded in
     * {@code results} under its position before the returned flux completes.
     */
    Flux<AgentEvent> dispatch(List<Message.ToolCall> calls, RoundResults results);
}
