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

import me.golemcore.codeact.domain.model.Message;
import me.golemcore.codeact.domain.model.ModelChunk;
import me.golemcore.codeact.domain.model.ToolDefinition;
import me.golemcore.codeact.domain.resource.ManagedResource;
import reactor.core.publisher.Flux;

import java.util.List;

/**
 * Port for one agent instance's exclusive, stateful model session.
 */
public interface ModelSession extends ManagedResource {

    /**
     * Requests the next model step.
     *
     * @param history
     *            conversation so far, ending with the newest user message or
     *            tool results
     * @param tools
     *            actions the model may propose
     * @return thought and text deltas followed by one chunk with
     *         {@code done = true} carrying the proposals; errors signal a model
     *         failure
     */
    Flux<ModelChunk> stream(List<Message> history, List<ToolDefinition> tools);
}
