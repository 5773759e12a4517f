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


package me.golemcore.codeact.adapter.outbound.mcp;

import me.golemcore.codeact.domain.model.McpServerConfig;
import me.golemcore.codeact.domain.model.ToolDefinition;
import me.golemcore.codeact.port.outbound.ToolConnection;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Mono;

import java.io.BufferedReader;
import java.io.BufferedWriter;
import java.io.IOException;
import java.io.InputStreamReader;
import java.io.OutputStreamWriter;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * JSON-RPC 2.0 client for a single MCP (Model Context Protocol) server over
 * stdio, used as one agent instance's tool connection.
 *
 * <p>
 * Lifecycle:
 * <ol>
 * <li>Start the server process (via shell command)
 * <li>Send initialize request and the initialized notification
 * <li>Fetch available tools (tools/list), dropping excluded ones
 * <li>Call tools (tools/call)
 * <li>Stop the process
 * </ol>
 *
 * <p>
 * Responses are read by a reader thread and matched to requests by JSON-RPC
 * id; stderr is drained to the DEBUG log.
 *
 * <p>
 * MCP protocol version: 2024-11-05
 */
public class McpClient implements ToolConnection {

    private static final Logger log = LoggerFactory.getLogger(McpClient.class);
    private static final String JSONRPC_VERSION = "2.0";
    private static final String MCP_PROTOCOL_VERSION = "2024-11-05";
    private static final long REQUEST_TIMEOUT_SECONDS = 60;
    private static final TypeReference<Map<String, Object>> MAP_TYPE_REF = new TypeReference<>() {
    };

    private final McpServerConfig config;
    private final ObjectMapper objectMapper;

    private Process process;
    private BufferedWriter writer;

    private final AtomicInteger nextId = new AtomicInteger(1);
    private final Map<Integer, CompletableFuture<JsonNode>> pendingRequests = new ConcurrentHashMap<>();

    private volatile boolean running;
    private List<ToolDefinition> cachedTools = List.of();

    public McpClient(McpServerConfig config, ObjectMapper objectMapper) {
        this.config = config;
        this.objectMapper = objectMapper;
    }

    @Override
    public String resourceName() {
        return "mcp:" + config.getName();
    }

    @Override
    public String serverName() {
        return config.getName();
    }

    @Override
    public List<ToolDefinition> listTools() {
        return cachedTools;
    }

    /**
     * Start the MCP server process, send initialize, and fetch available tools.
     */
    @Override
    public void start() {
        log.info("[MCP:{}] Starting server: {}", config.getName(), config.getCommand());

        ProcessBuilder pb = new ProcessBuilder("/bin/sh", "-c", config.getCommand());
        pb.redirectErrorStream(false);
        if (config.getEnv() != null) {
            pb.environment().putAll(config.getEnv());
        }

        try {
            process = pb.start();
        } catch (IOException e) {
            throw new IllegalStateException("Failed to start MCP server " + config.getName() + ": "
                    + e.getMessage(), e);
        }
        running = true;
        writer = new BufferedWriter(new OutputStreamWriter(process.getOutputStream(), StandardCharsets.UTF_8));

        Thread readerThread = new Thread(this::readLoop, "mcp-reader-" + config.getName());
        readerThread.setDaemon(true);
        readerThread.start();

        Thread stderrThread = new Thread(this::stderrDrain, "mcp-stderr-" + config.getName());
        stderrThread.setDaemon(true);
        stderrThread.start();

        try {
            int timeoutSeconds = config.getStartupTimeoutSeconds();
            JsonNode initResult = sendRequest("initialize", Map.of(
                    "protocolVersion", MCP_PROTOCOL_VERSION,
                    "capabilities", Map.of(),
                    "clientInfo", Map.of(
                            "name", "golemcore-codeact",
                            "version", "1.0.0")))
                    .get(timeoutSeconds, TimeUnit.SECONDS);
            log.debug("[MCP:{}] Initialized: {}", config.getName(), initResult);

            sendNotification("notifications/initialized", Map.of());

            JsonNode toolsResult = sendRequest("tools/list", Map.of())
                    .get(timeoutSeconds, TimeUnit.SECONDS);
            cachedTools = parseToolDefinitions(toolsResult);
            log.info("[MCP:{}] Available tools: {}", config.getName(),
                    cachedTools.stream().map(ToolDefinition::getName).toList());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            stop();
            throw new IllegalStateException("MCP server " + config.getName() + " initialization interrupted", e);
        } catch (ExecutionException | TimeoutException | RuntimeException e) {
            log.error("[MCP:{}] Initialization failed, cleaning up: {}", config.getName(), e.getMessage());
            stop();
            throw new IllegalStateException("MCP server " + config.getName() + " initialization failed: "
                    + e.getMessage(), e);
        }
    }

    @Override
    public Mono<String> callTool(String toolName, Map<String, Object> arguments) {
        return Mono.defer(() -> Mono.fromFuture(sendRequest("tools/call", Map.of(
                "name", toolName,
                "arguments", arguments != null ? arguments : Map.of())), true))
                .flatMap(result -> parseToolCallResult(toolName, result));
    }

    CompletableFuture<JsonNode> sendRequest(String method, Map<String, Object> params) {
        int id = nextId.getAndIncrement();
        CompletableFuture<JsonNode> future = new CompletableFuture<JsonNode>()
                .orTimeout(REQUEST_TIMEOUT_SECONDS, TimeUnit.SECONDS)
                .whenComplete((result, ex) -> pendingRequests.remove(id));
        pendingRequests.put(id, future);

        Map<String, Object> request = new LinkedHashMap<>();
        request.put("jsonrpc", JSONRPC_VERSION);
        request.put("id", id);
        request.put("method", method);
        request.put("params", params);

        try {
            String json = objectMapper.writeValueAsString(request);
            log.debug("[MCP:{}] → {}", config.getName(), json);
            synchronized (writer) {
                writer.write(json);
                writer.newLine();
                writer.flush();
            }
        } catch (IOException e) {
            pendingRequests.remove(id);
            future.completeExceptionally(e);
        }
        return future;
    }

    void sendNotification(String method, Map<String, Object> params) {
        Map<String, Object> notification = new LinkedHashMap<>();
        notification.put("jsonrpc", JSONRPC_VERSION);
        notification.put("method", method);
        if (params != null && !params.isEmpty()) {
            notification.put("params", params);
        }

        try {
            String json = objectMapper.writeValueAsString(notification);
            log.debug("[MCP:{}] → (notification) {}", config.getName(), json);
            synchronized (writer) {
                writer.write(json);
                writer.newLine();
                writer.flush();
            }
        } catch (IOException e) {
            log.warn("[MCP:{}] Failed to send notification: {}", config.getName(), e.getMessage());
        }
    }

    private void readLoop() {
        Process p = this.process;
        if (p == null) {
            return;
        }
        try (BufferedReader reader = new BufferedReader(
                new InputStreamReader(p.getInputStream(), StandardCharsets.UTF_8))) {
            String line;
            while (running && (line = reader.readLine()) != null) {
                line = line.trim();
                if (!line.isEmpty()) {
                    handleMessage(line);
                }
            }
        } catch (IOException e) {
            if (running) {
                log.warn("[MCP:{}] Reader thread error: {}", config.getName(), e.getMessage());
            }
        } finally {
            failPending("MCP process closed");
        }
    }

    void handleMessage(String line) {
        log.debug("[MCP:{}] ← {}", config.getName(), line);
        try {
            JsonNode message = objectMapper.readTree(line);
            JsonNode idNode = message.get("id");
            if (idNode == null || !idNode.isInt()) {
                String method = message.has("method") ? message.get("method").asText() : "unknown";
                log.debug("[MCP:{}] Server notification: {}", config.getName(), method);
                return;
            }
            CompletableFuture<JsonNode> pending = pendingRequests.remove(idNode.asInt());
            if (pending == null) {
                log.warn("[MCP:{}] Received response for unknown id: {}", config.getName(), idNode.asInt());
                return;
            }
            JsonNode error = message.get("error");
            if (error != null && !error.isNull()) {
                pending.completeExceptionally(new McpException(
                        error.has("code") ? error.get("code").asInt() : -1,
                        error.has("message") ? error.get("message").asText() : "Unknown MCP error"));
            } else {
                pending.complete(message.get("result"));
            }
        } catch (JsonProcessingException e) {
            log.warn("[MCP:{}] Failed to parse response: {}", config.getName(), e.getMessage());
        }
    }

    private void stderrDrain() {
        Process p = this.process;
        if (p == null) {
            return;
        }
        try (BufferedReader reader = new BufferedReader(
                new InputStreamReader(p.getErrorStream(), StandardCharsets.UTF_8))) {
            String line;
            while (running && (line = reader.readLine()) != null) {
                log.debug("[MCP:{}] stderr: {}", config.getName(), line);
            }
        } catch (IOException e) {
            if (running) {
                log.debug("[MCP:{}] Stderr drain ended: {}", config.getName(), e.getMessage());
            }
        }
    }

    List<ToolDefinition> parseToolDefinitions(JsonNode result) {
        if (result == null) {
            return List.of();
        }
        JsonNode toolsNode = result.get("tools");
        if (toolsNode == null || !toolsNode.isArray()) {
            return List.of();
        }

        List<ToolDefinition> tools = new ArrayList<>();
        for (JsonNode toolNode : toolsNode) {
            String name = toolNode.has("name") ? toolNode.get("name").asText() : null;
            if (name == null) {
                continue;
            }
            if (config.getExcludedTools() != null && config.getExcludedTools().contains(name)) {
                log.debug("[MCP:{}] Excluding tool {}", config.getName(), name);
                continue;
            }
            String description = toolNode.has("description") ? toolNode.get("description").asText() : "";

            Map<String, Object> inputSchema = Map.of("type", "object", "properties", Map.of());
            if (toolNode.has("inputSchema")) {
                try {
                    inputSchema = objectMapper.convertValue(toolNode.get("inputSchema"), MAP_TYPE_REF);
                } catch (IllegalArgumentException e) {
                    log.warn("[MCP:{}] Failed to parse inputSchema for tool '{}': {}", config.getName(), name,
                            e.getMessage());
                }
            }

            tools.add(ToolDefinition.builder()
                    .name(name)
                    .description(description)
                    .inputSchema(inputSchema)
                    .build());
        }
        return tools;
    }

    Mono<String> parseToolCallResult(String toolName, JsonNode result) {
        if (result == null) {
            return Mono.error(new McpException(McpException.TOOL_ERROR, "No result from MCP tool: " + toolName));
        }
        boolean isError = result.has("isError") && result.get("isError").asBoolean(false);

        StringBuilder output = new StringBuilder();
        JsonNode contentNode = result.get("content");
        if (contentNode != null && contentNode.isArray()) {
            for (JsonNode item : contentNode) {
                String type = item.has("type") ? item.get("type").asText() : "text";
                if ("text".equals(type) && item.has("text")) {
                    if (!output.isEmpty()) {
                        output.append("\n");
                    }
                    output.append(item.get("text").asText());
                }
            }
        }

        if (isError) {
            return Mono.error(new McpException(McpException.TOOL_ERROR,
                    output.isEmpty() ? "MCP tool error" : output.toString()));
        }
        if (output.isEmpty() && result.has("structuredContent")) {
            return Mono.just(result.get("structuredContent").toString());
        }
        return Mono.just(output.isEmpty() ? "(no output)" : output.toString());
    }

    public boolean isRunning() {
        return running && process != null && process.isAlive();
    }

    @Override
    public void stop() {
        log.info("[MCP:{}] Closing client", config.getName());
        running = false;
        failPending("MCP client closing");

        if (writer != null) {
            try {
                writer.close();
            } catch (IOException e) {
                log.debug("[MCP:{}] Error closing writer: {}", config.getName(), e.getMessage());
            }
        }

        if (process != null && process.isAlive()) {
            process.destroy();
            try {
                if (!process.waitFor(5, TimeUnit.SECONDS)) {
                    process.destroyForcibly();
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                process.destroyForcibly();
            }
        }
    }

    private void failPending(String reason) {
        for (CompletableFuture<JsonNode> future : pendingRequests.values()) {
            future.completeExceptionally(new IOException(reason));
        }
        pendingRequests.clear();
    }
}
