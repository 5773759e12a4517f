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

import me.golemcore.codeact.domain.model.ToolDefinition;
import me.golemcore.codeact.port.outbound.ToolConnection;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Actions an agent instance may propose: the built-in code, reset and
 * delegation actions plus every tool of its tool connections, exposed as
 * {@code <server>_<tool>}.
 */
@Slf4j
public class ToolCatalog {

    public static final String EXECUTE_CODE = "execute_code";
    public static final String RESET_EXECUTION = "reset_execution";
    public static final String SUBAGENT_TASK = "subagent_task";

    private final List<ToolDefinition> definitions;
    private final Set<String> builtins;
    private final Map<String, Binding> connectionTools;

    private ToolCatalog(List<ToolDefinition> definitions, Set<String> builtins, Map<String, Binding> connectionTools) {
        this.definitions = List.copyOf(definitions);
        this.builtins = Set.copyOf(builtins);
        this.connectionTools = Map.copyOf(connectionTools);
    }

    /**
     * Builds the catalog from started tool connections.
     *
     * @param delegationEnabled
     *            whether {@value #SUBAGENT_TASK} is offered
     */
    public static ToolCatalog build(List<ToolConnection> connections, boolean delegationEnabled) {
        List<ToolDefinition> definitions = new ArrayList<>();
        definitions.add(executeCodeDefinition());
        definitions.add(ToolDefinition.simple(RESET_EXECUTION,
                "Reset the code execution session, discarding all variables, imports and definitions."));
        if (delegationEnabled) {
            definitions.add(subagentTaskDefinition());
        }
        Set<String> builtins = new HashSet<>();
        for (ToolDefinition definition : definitions) {
            builtins.add(definition.getName());
        }

        Map<String, Binding> bindings = new LinkedHashMap<>();
        for (ToolConnection connection : connections) {
            for (ToolDefinition tool : connection.listTools()) {
                String exposed = connection.serverName() + "_" + tool.getName();
                if (builtins.contains(exposed) || bindings.containsKey(exposed)) {
                    log.warn("[Tools] Skipping duplicate tool name {}", exposed);
                    continue;
                }
                bindings.put(exposed, new Binding(connection, tool.getName()));
                definitions.add(tool.renamed(exposed));
            }
        }
        log.debug("[Tools] Catalog: {} built-in, {} connection tool(s)", builtins.size(), bindings.size());
        return new ToolCatalog(definitions, builtins, bindings);
    }

    public List<ToolDefinition> definitions() {
        return definitions;
    }

    public boolean contains(String name) {
        return builtins.contains(name) || connectionTools.containsKey(name);
    }

    public boolean isBuiltin(String name) {
        return builtins.contains(name);
    }

    /**
     * Connection and unprefixed tool name behind an exposed tool name.
     *
     * @return binding, or {@code null} if the name is not a connection tool
     */
    public Binding binding(String name) {
        return connectionTools.get(name);
    }

    private static ToolDefinition executeCodeDefinition() {
        return ToolDefinition.builder()
                .name(EXECUTE_CODE)
                .description("Execute code in the execution session. "
                        + "Returns the printed output and paths of produced images.")
                .inputSchema(Map.of(
                        "type", "object",
                        "properties", Map.of(
                                "code", Map.of("type", "string", "description", "Code to execute")),
                        "required", List.of("code")))
                .build();
    }

    private static ToolDefinition subagentTaskDefinition() {
        return ToolDefinition.builder()
                .name(SUBAGENT_TASK)
                .description("Delegate a self-contained task to a subagent with a fresh execution session. "
                        + "Returns the subagent's final answer.")
                .inputSchema(Map.of(
                        "type", "object",
                        "properties", Map.of(
                                "prompt", Map.of("type", "string", "description", "Task for the subagent"),
                                "max_turns", Map.of("type", "integer",
                                        "description", "Maximum number of tool-execution rounds")),
                        "required", List.of("prompt")))
                .build();
    }

    /**
     * A connection tool.
     */
    public record Binding(ToolConnection connection, String toolName) {
    }
}
