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


package me.golemcore.codeact.adapter.outbound.llm;

import me.golemcore.codeact.domain.model.AgentSettings;
import me.golemcore.codeact.infrastructure.config.CodeActProperties;
import me.golemcore.codeact.port.outbound.ModelSession;
import me.golemcore.codeact.port.outbound.ModelSessionFactory;
import com.fasterxml.jackson.databind.ObjectMapper;
import dev.langchain4j.model.anthropic.AnthropicChatModel;
import dev.langchain4j.model.chat.ChatModel;
import dev.langchain4j.model.openai.OpenAiChatModel;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Builds langchain4j chat models from {@code codeact.model.*}. Anthropic is
 * used for provider {@code anthropic}; every other provider goes through the
 * OpenAI-compatible API.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class Langchain4jModelSessionFactory implements ModelSessionFactory {

    private static final String PROVIDER_ANTHROPIC = "anthropic";

    private final CodeActProperties properties;
    private final ObjectMapper objectMapper;

    private ChatModel chatModel;

    @Override
    public ModelSession create(String agentId, AgentSettings settings) {
        return new Langchain4jModelSession(agentId, getChatModel(), settings.getSystemPrompt(), objectMapper);
    }

    private synchronized ChatModel getChatModel() {
        if (chatModel == null) {
            chatModel = createModel(properties.getModel());
            log.info("[LLM] Initialized {} model {}", properties.getModel().getProvider(),
                    properties.getModel().getName());
        }
        return chatModel;
    }

    private ChatModel createModel(CodeActProperties.ModelProperties config) {
        if (PROVIDER_ANTHROPIC.equalsIgnoreCase(config.getProvider())) {
            var builder = AnthropicChatModel.builder()
                    .apiKey(config.getApiKey())
                    .modelName(config.getName())
                    .maxTokens(4096)
                    .timeout(config.getRequestTimeout());
            if (config.getBaseUrl() != null) {
                builder.baseUrl(config.getBaseUrl());
            }
            if (config.getTemperature() != null) {
                builder.temperature(config.getTemperature());
            }
            return builder.build();
        }

        var builder = OpenAiChatModel.builder()
                .apiKey(config.getApiKey())
                .modelName(config.getName())
                .timeout(config.getRequestTimeout());
        if (config.getBaseUrl() != null) {
            builder.baseUrl(config.getBaseUrl());
        }
        if (config.getTemperature() != null) {
            builder.temperature(config.getTemperature());
        }
        return builder.build();
    }
}
