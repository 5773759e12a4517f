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

import me.golemcore.codeact.domain.exception.ModelFailureException;
import me.golemcore.codeact.domain.model.Message;
import me.golemcore.codeact.domain.model.ModelChunk;
import me.golemcore.codeact.domain.model.ToolDefinition;
import me.golemcore.codeact.port.outbound.ModelSession;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import dev.langchain4j.agent.tool.ToolExecutionRequest;
import dev.langchain4j.agent.tool.ToolSpecification;
import dev.langchain4j.data.message.AiMessage;
import dev.langchain4j.data.message.ChatMessage;
import dev.langchain4j.data.message.SystemMessage;
import dev.langchain4j.data.message.ToolExecutionResultMessage;
import dev.langchain4j.data.message.UserMessage;
import dev.langchain4j.model.chat.ChatModel;
import dev.langchain4j.model.chat.request.ChatRequest;
import dev.langchain4j.model.chat.request.json.JsonArraySchema;
import dev.langchain4j.model.chat.request.json.JsonBooleanSchema;
import dev.langchain4j.model.chat.request.json.JsonEnumSchema;
import dev.langchain4j.model.chat.request.json.JsonIntegerSchema;
import dev.langchain4j.model.chat.request.json.JsonNumberSchema;
import dev.langchain4j.model.chat.request.json.JsonObjectSchema;
import dev.langchain4j.model.chat.request.json.JsonSchemaElement;
import dev.langchain4j.model.chat.request.json.JsonStringSchema;
import dev.langchain4j.model.chat.response.ChatResponse;
import lombok.extern.slf4j.Slf4j;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;

/**
 * Model session backed by a langchain4j {@link ChatModel}.
 *
 * <p>
 * The blocking chat call runs on the bounded elastic scheduler. The whole
 * response arrives as one text chunk followed by the final chunk with the tool
 * calls; no thinking deltas are produced.
 */
@Slf4j
public class Langchain4jModelSession implements ModelSession {

    private static final String SCHEMA_KEY_PROPERTIES = "properties";
    private static final TypeReference<Map<String, Object>> MAP_TYPE_REF = new TypeReference<>() {
    };

    private final String agentId;
    private final ChatModel chatModel;
    private final String systemPrompt;
    private final ObjectMapper objectMapper;
    private volatile boolean started;

    public Langchain4jModelSession(String agentId, ChatModel chatModel, String systemPrompt,
            ObjectMapper objectMapper) {
        this.agentId = agentId;
        this.chatModel = chatModel;
        this.systemPrompt = systemPrompt;
        this.objectMapper = objectMapper;
    }

    @Override
    public String resourceName() {
        return "model-session:" + agentId;
    }

    @Override
    public void start() {
        started = true;
    }

    @Override
    public void stop() {
        started = false;
    }

    @Override
    public Flux<ModelChunk> stream(List<Message> history, List<ToolDefinition> tools) {
        return Mono.fromCallable(() -> chat(history, tools))
                .subscribeOn(Schedulers.boundedElastic())
                .flatMapMany(this::toChunks);
    }

    private ChatResponse chat(List<Message> history, List<ToolDefinition> tools) {
        if (!started) {
            throw new ModelFailureException("Model session of " + agentId + " is not started");
        }
        List<ChatMessage> messages = convertMessages(history);
        List<ToolSpecification> specifications = convertTools(tools);
        log.trace("[LLM] {} calling model with {} message(s), {} tool(s)", agentId, messages.size(),
                specifications.size());
        try {
            ChatRequest.Builder request = ChatRequest.builder().messages(messages);
            if (!specifications.isEmpty()) {
                request.toolSpecifications(specifications);
            }
            return chatModel.chat(request.build());
        } catch (RuntimeException e) {
            throw new ModelFailureException("LLM chat failed: " + e.getMessage(), e);
        }
    }

    private Flux<ModelChunk> toChunks(ChatResponse response) {
        AiMessage aiMessage = response.aiMessage();
        List<ModelChunk> chunks = new ArrayList<>(2);
        if (aiMessage.text() != null && !aiMessage.text().isEmpty()) {
            chunks.add(ModelChunk.text(aiMessage.text()));
        }

        List<Message.ToolCall> toolCalls = List.of();
        if (aiMessage.hasToolExecutionRequests()) {
            toolCalls = aiMessage.toolExecutionRequests().stream()
                    .map(ter -> Message.ToolCall.builder()
                            .id(ter.id())
                            .name(ter.name())
                            .arguments(parseJsonArgs(ter.arguments()))
                            .build())
                    .toList();
            log.trace("[LLM] Parsed {} tool calls from response", toolCalls.size());
        }
        chunks.add(ModelChunk.done(toolCalls));
        return Flux.fromIterable(chunks);
    }

    List<ChatMessage> convertMessages(List<Message> history) {
        List<ChatMessage> messages = new ArrayList<>();
        if (systemPrompt != null && !systemPrompt.isBlank()) {
            messages.add(SystemMessage.from(systemPrompt));
        }

        for (Message msg : history) {
            switch (msg.getRole()) {
            case Message.ROLE_USER -> messages.add(UserMessage.from(msg.getContent()));
            case Message.ROLE_ASSISTANT -> {
                String text = msg.getContent() != null ? msg.getContent() : "";
                if (msg.hasToolCalls()) {
                    List<ToolExecutionRequest> toolRequests = msg.getToolCalls().stream()
                            .map(tc -> ToolExecutionRequest.builder()
                                    .id(tc.getId())
                                    .name(tc.getName())
                                    .arguments(convertArgsToJson(tc.getArguments()))
                                    .build())
                            .toList();
                    messages.add(text.isEmpty() ? AiMessage.from(toolRequests) : AiMessage.from(text, toolRequests));
                } else {
                    messages.add(AiMessage.from(text));
                }
            }
            case Message.ROLE_TOOL -> messages.add(ToolExecutionResultMessage.from(
                    msg.getToolCallId(),
                    msg.getToolName(),
                    msg.getContent() != null ? msg.getContent() : ""));
            default -> log.warn("[LLM] Unknown message role: {}, skipping", msg.getRole());
            }
        }
        return messages;
    }

    private List<ToolSpecification> convertTools(List<ToolDefinition> tools) {
        if (tools == null || tools.isEmpty()) {
            return Collections.emptyList();
        }
        return tools.stream()
                .map(this::convertToolDefinition)
                .toList();
    }

    @SuppressWarnings("unchecked")
    ToolSpecification convertToolDefinition(ToolDefinition tool) {
        ToolSpecification.Builder builder = ToolSpecification.builder()
                .name(tool.getName())
                .description(tool.getDescription());

        if (tool.getInputSchema() != null) {
            Map<String, Object> schema = tool.getInputSchema();
            Map<String, Object> properties = (Map<String, Object>) schema.get(SCHEMA_KEY_PROPERTIES);
            List<String> required = (List<String>) schema.get("required");

            if (properties != null) {
                JsonObjectSchema.Builder schemaBuilder = JsonObjectSchema.builder();
                for (Map.Entry<String, Object> entry : properties.entrySet()) {
                    schemaBuilder.addProperty(entry.getKey(),
                            toJsonSchemaElement((Map<String, Object>) entry.getValue()));
                }
                if (required != null && !required.isEmpty()) {
                    schemaBuilder.required(required);
                }
                builder.parameters(schemaBuilder.build());
            }
        }
        return builder.build();
    }

    @SuppressWarnings("unchecked")
    private JsonSchemaElement toJsonSchemaElement(Map<String, Object> paramSchema) {
        String type = (String) paramSchema.get("type");
        String description = (String) paramSchema.get("description");
        List<String> enumValues = (List<String>) paramSchema.get("enum");
        boolean described = description != null && !description.isBlank();

        if (enumValues != null && !enumValues.isEmpty()) {
            JsonEnumSchema.Builder builder = JsonEnumSchema.builder().enumValues(enumValues);
            if (described) {
                builder.description(description);
            }
            return builder.build();
        }

        switch (type != null ? type : "string") {
        case "integer" -> {
            JsonIntegerSchema.Builder builder = JsonIntegerSchema.builder();
            if (described) {
                builder.description(description);
            }
            return builder.build();
        }
        case "number" -> {
            JsonNumberSchema.Builder builder = JsonNumberSchema.builder();
            if (described) {
                builder.description(description);
            }
            return builder.build();
        }
        case "boolean" -> {
            JsonBooleanSchema.Builder builder = JsonBooleanSchema.builder();
            if (described) {
                builder.description(description);
            }
            return builder.build();
        }
        case "array" -> {
            JsonArraySchema.Builder builder = JsonArraySchema.builder();
            if (described) {
                builder.description(description);
            }
            Object items = paramSchema.get("items");
            builder.items(items instanceof Map
                    ? toJsonSchemaElement((Map<String, Object>) items)
                    : JsonStringSchema.builder().build());
            return builder.build();
        }
        case "object" -> {
            JsonObjectSchema.Builder builder = JsonObjectSchema.builder();
            if (described) {
                builder.description(description);
            }
            Object nested = paramSchema.get(SCHEMA_KEY_PROPERTIES);
            if (nested instanceof Map) {
                for (Map.Entry<String, Object> entry : ((Map<String, Object>) nested).entrySet()) {
                    builder.addProperty(entry.getKey(), toJsonSchemaElement((Map<String, Object>) entry.getValue()));
                }
            }
            return builder.build();
        }
        default -> {
            // Unknown types fall back to string
            JsonStringSchema.Builder builder = JsonStringSchema.builder();
            if (described) {
                builder.description(description);
            }
            return builder.build();
        }
        }
    }

    private String convertArgsToJson(Map<String, Object> args) {
        if (args == null || args.isEmpty()) {
            return "{}";
        }
        try {
            return objectMapper.writeValueAsString(args);
        } catch (Exception e) {
            log.warn("[LLM] Failed to serialize tool arguments: {}", e.getMessage());
            return "{}";
        }
    }

    private Map<String, Object> parseJsonArgs(String json) {
        if (json == null || json.isBlank()) {
            return Collections.emptyMap();
        }
        try {
            return objectMapper.readValue(json, MAP_TYPE_REF);
        } catch (Exception e) {
            log.warn("[LLM] Failed to parse tool arguments: {}", e.getMessage());
            return Collections.emptyMap();
        }
    }
}
