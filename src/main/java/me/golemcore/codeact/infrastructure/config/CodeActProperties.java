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


package me.golemcore.codeact.infrastructure.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Configuration properties for the agent engine, bound from
 * application.properties.
 *
 * <p>
 * All configuration is organized under the {@code codeact.*} prefix:
 * <ul>
 * <li>{@link ModelProperties} - chat model provider settings</li>
 * <li>{@link ExecutionProperties} - code execution and approval budgets</li>
 * <li>{@link SubagentProperties} - delegation limits</li>
 * <li>{@link StorageProperties} - session log location</li>
 * <li>{@link ToolResultProperties} - large tool result handling</li>
 * <li>{@link McpServerProperties} - tool servers, keyed by server name</li>
 * </ul>
 */
@Component
@ConfigurationProperties(prefix = "codeact")
@Data
public class CodeActProperties {

    private ModelProperties model = new ModelProperties();
    private ExecutionProperties execution = new ExecutionProperties();
    private SubagentProperties subagents = new SubagentProperties();
    private StorageProperties storage = new StorageProperties();
    private ToolResultProperties toolResults = new ToolResultProperties();
    private Map<String, McpServerProperties> mcpServers = new LinkedHashMap<>();

    @Data
    public static class ModelProperties {
        private String provider = "openai";
        private String name = "gpt-4o";
        private String apiKey;
        private String baseUrl;
        private Double temperature;
        private Duration requestTimeout = Duration.ofSeconds(120);
        private String systemPrompt = "You are a code-action agent. Solve tasks by writing and executing code "
                + "with the execute_code tool. Reply without tool calls once the task is done.";
    }

    @Data
    public static class ExecutionProperties {
        private List<String> command = new ArrayList<>(List.of("python3", "-u", "-"));
        private String workspacePath = "${user.home}/.golemcore/codeact/workspace";
        private Duration executionTimeout = Duration.ofSeconds(300);
        private Duration approvalTimeout;
    }

    @Data
    public static class SubagentProperties {
        private boolean enabled = true;
        private int maxSubagents = 5;
        private int defaultMaxTurns = 10;
    }

    @Data
    public static class StorageProperties {
        private String basePath = "${user.home}/.golemcore/codeact";
        private String sessionsDirectory = "sessions";
        private boolean persistenceEnabled = true;
        private boolean flushAfterAppend = false;
    }

    @Data
    public static class ToolResultProperties {
        private int inlineMaxBytes = 32768;
        private int previewLines = 10;
    }

    @Data
    public static class McpServerProperties {
        private String command;
        private Map<String, String> env = new HashMap<>();
        private List<String> excludedTools = new ArrayList<>();
        private int startupTimeoutSeconds = 30;
    }
}
