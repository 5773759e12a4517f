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


package me.golemcore.codeact.port.outbound;

import me.golemcore.codeact.domain.model.ExecutionUpdate;
import me.golemcore.codeact.domain.resource.ManagedResource;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

/**
 * Port for the sandboxed execution back-end. One session belongs to exactly one
 * agent instance and runs one cell at a time.
 */
public interface ExecutionSession extends ManagedResource {

    /**
     * Runs a code cell. Cancelling the subscription stops the execution.
     *
     * @return output chunks and nested tool approvals, then exactly one
     *         {@link ExecutionUpdate.Result}
     */
    Flux<ExecutionUpdate> execute(String code);

    /**
     * Discards all session state.
     */
    Mono<Void> reset();
}
