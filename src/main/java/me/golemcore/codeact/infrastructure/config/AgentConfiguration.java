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

import me.golemcore.codeact.domain.model.AgentSettings;
import me.golemcore.codeact.domain.model.McpServerConfig;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.Map;

/**
 * Spring configuration for the agent engine: shared infrastructure beans and
 * the root {@link AgentSettings} snapshot derived from {@link CodeActProperties}.
 */
@Configuration
@Slf4j
public class AgentConfiguration {

    @Bean
    public static Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public static ObjectMapper objectMapper() {
        ObjectMapper mapper = new ObjectMapper();
        mapper.registerModule(new JavaTimeModule());
        mapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        mapper.disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
        return mapper;
    }

    @Bean
    public AgentSettings agentSettings(CodeActProperties properties) {
        AgentSettings settings = toSettings(properties);
        log.info("Model: {} ({})", properties.getModel().getName(), properties.getModel().getProvider());
        log.info("Storage Path: {}, persistence {}", properties.getStorage().getBasePath(),
                settings.isPersistenceEnabled() ? "enabled" : "disabled");
        log.info("Tool servers: {}", properties.getMcpServers().keySet());
        return settings;
    }

    static AgentSettings toSettings(CodeActProperties properties) {
        CodeActProperties.ExecutionProperties execution = properties.getExecution();
        CodeActProperties.SubagentProperties subagents = properties.getSubagents();
        CodeActProperties.StorageProperties storage = properties.getStorage();
        CodeActProperties.ToolResultProperties toolResults = properties.getToolResults();

        AgentSettings.AgentSettingsBuilder builder = AgentSettings.builder()
                .systemPrompt(properties.getModel().getSystemPrompt())
                .executionTimeout(execution.getExecutionTimeout())
                .approvalTimeout(execution.getApprovalTimeout())
                .subagentsEnabled(subagents.isEnabled())
                .maxSubagents(subagents.getMaxSubagents())
                .subagentMaxTurns(subagents.getDefaultMaxTurns())
                .persistenceEnabled(storage.isPersistenceEnabled())
                .flushAfterAppend(storage.isFlushAfterAppend())
                .inlineMaxBytes(toolResults.getInlineMaxBytes())
                .previewLines(toolResults.getPreviewLines());

        for (Map.Entry<String, CodeActProperties.McpServerProperties> entry : properties.getMcpServers()
                .entrySet()) {
            CodeActProperties.McpServerProperties server = entry.getValue();
            if (server.getCommand() == null || server.getCommand().isBlank()) {
                log.warn("[MCP:{}] No command configured, skipping", entry.getKey());
                continue;
            }
            builder.mcpServer(McpServerConfig.builder()
                    .name(entry.getKey())
                    .command(server.getCommand())
                    .env(new HashMap<>(server.getEnv()))
                    .excludedTools(new ArrayList<>(server.getExcludedTools()))
                    .startupTimeoutSeconds(server.getStartupTimeoutSeconds())
                    .build());
        }
        return builder.build();
    }
}
