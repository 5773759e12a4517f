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

import me.golemcore.codeact.domain.model.ToolDefinition;
import me.golemcore.codeact.domain.resource.ManagedResource;
import reactor.core.publisher.Mono;

import java.util.List;
import java.util.Map;

/**
 * Port for a tool back-end serving a set of named tools.
 */
public interface ToolConnection extends ManagedResource {

    /**
     * Server name, used as the prefix of the tool names exposed to the model.
     */
    String serverName();

    /**
     * Tools offered by the server, unprefixed. Valid after {@link #start()}.
     */
    List<ToolDefinition> listTools();

    /**
     * Invokes a tool by its unprefixed name.
     *
     * @return textual result; errors signal a declared or transport failure
     */
    Mono<String> callTool(String toolName, Map<String, Object> arguments);
}
