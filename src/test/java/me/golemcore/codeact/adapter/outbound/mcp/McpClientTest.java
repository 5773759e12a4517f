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
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.test.util.ReflectionTestUtils;
import reactor.core.publisher.Mono;
import reactor.test.StepVerifier;

import java.io.BufferedWriter;
import java.io.StringWriter;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * Tests for McpClient JSON-RPC framing, tool parsing and tool call results.
 * The process is never started; a StringWriter stands in for its stdin.
 */
class McpClientTest {

    private static final String SERVER = "github";
    private static final String TOOL_CREATE_ISSUE = "create_issue";
    private static final String FIELD_WRITER = "writer";

    private final ObjectMapper objectMapper = new ObjectMapper();

    private McpClient client;
    private StringWriter sent;

    @BeforeEach
    void setUp() {
        McpServerConfig config = McpServerConfig.builder()
                .name(SERVER)
                .command("unused")
                .excludedTools(List.of("delete_repo"))
                .build();
        client = new McpClient(config, objectMapper);
        sent = new StringWriter();
        ReflectionTestUtils.setField(client, FIELD_WRITER, new BufferedWriter(sent));
    }

    @Test
    void shouldNameResourceAfterServer() {
        assertEquals("mcp:github", client.resourceName());
        assertEquals(SERVER, client.serverName());
        assertTrue(client.listTools().isEmpty());
        assertFalse(client.isRunning());
    }

    // ==================== Tool definitions ====================

    @Test
    void shouldParseToolDefinitionsAndDropExcluded() throws Exception {
        JsonNode result = objectMapper.readTree("""
                {
                  "tools": [
                    {
                      "name": "create_issue",
                      "description": "Create a GitHub issue",
                      "inputSchema": {
                        "type": "object",
                        "properties": {
                          "title": {"type": "string", "description": "Issue title"}
                        },
                        "required": ["title"]
                      }
                    },
                    {"name": "delete_repo", "description": "Delete a repository"},
                    {"name": "list_repos"},
                    {"description": "nameless"}
                  ]
                }
                """);

        List<ToolDefinition> tools = client.parseToolDefinitions(result);

        assertEquals(List.of(TOOL_CREATE_ISSUE, "list_repos"), tools.stream().map(ToolDefinition::getName).toList());
        ToolDefinition createIssue = tools.get(0);
        assertEquals("Create a GitHub issue", createIssue.getDescription());
        assertEquals(List.of("title"), createIssue.getInputSchema().get("required"));

        ToolDefinition listRepos = tools.get(1);
        assertEquals("", listRepos.getDescription());
        assertEquals("object", listRepos.getInputSchema().get("type"));
    }

    @Test
    void shouldReturnNoToolsForMissingList() throws Exception {
        assertTrue(client.parseToolDefinitions(null).isEmpty());
        assertTrue(client.parseToolDefinitions(objectMapper.readTree("{}")).isEmpty());
    }

    // ==================== Tool call results ====================

    @Test
    void shouldJoinTextContent() throws Exception {
        JsonNode result = objectMapper.readTree("""
                {"content": [
                  {"type": "text", "text": "Issue #42 created"},
                  {"type": "image", "data": "..."},
                  {"type": "text", "text": "https://github.com/acme/app/issues/42"}
                ]}
                """);

        StepVerifier.create(client.parseToolCallResult(TOOL_CREATE_ISSUE, result))
                .expectNext("Issue #42 created\nhttps://github.com/acme/app/issues/42")
                .verifyComplete();
    }

    @Test
    void shouldFailWhenServerReportsToolError() throws Exception {
        JsonNode result = objectMapper.readTree("""
                {"isError": true, "content": [{"type": "text", "text": "Repository not found"}]}
                """);

        StepVerifier.create(client.parseToolCallResult("get_repo", result))
                .expectErrorSatisfies(error -> {
                    McpException mcpError = assertInstanceOf(McpException.class, error);
                    assertEquals(McpException.TOOL_ERROR, mcpError.getCode());
                    assertEquals("Repository not found", mcpError.getMessage());
                })
                .verify();
    }

    @Test
    void shouldFallBackToStructuredContent() throws Exception {
        JsonNode result = objectMapper.readTree("""
                {"content": [], "structuredContent": {"count": 3}}
                """);

        StepVerifier.create(client.parseToolCallResult("count_repos", result))
                .expectNext("{\"count\":3}")
                .verifyComplete();
    }

    @Test
    void shouldReportEmptyOutput() throws Exception {
        StepVerifier.create(client.parseToolCallResult("noop", objectMapper.readTree("{\"content\": []}")))
                .expectNext("(no output)")
                .verifyComplete();
    }

    @Test
    void shouldFailOnMissingResult() {
        StepVerifier.create(client.parseToolCallResult("noop", null))
                .expectErrorMessage("No result from MCP tool: noop")
                .verify();
    }

    // ==================== JSON-RPC framing ====================

    @Test
    void shouldWriteRequestLineAndCompleteOnResponse() throws Exception {
        CompletableFuture<JsonNode> future = client.sendRequest("tools/list", Map.of());

        JsonNode request = objectMapper.readTree(sent.toString().trim());
        assertEquals("2.0", request.get("jsonrpc").asText());
        assertEquals("tools/list", request.get("method").asText());
        int id = request.get("id").asInt();

        client.handleMessage("{\"jsonrpc\":\"2.0\",\"id\":" + id + ",\"result\":{\"tools\":[]}}");

        JsonNode result = future.get(1, TimeUnit.SECONDS);
        assertTrue(result.get("tools").isArray());
    }

    @Test
    void shouldFailRequestOnErrorResponse() {
        CompletableFuture<JsonNode> future = client.sendRequest("tools/call", Map.of("name", "x"));

        client.handleMessage("{\"jsonrpc\":\"2.0\",\"id\":1,\"error\":{\"code\":-32601,\"message\":\"Method not found\"}}");

        ExecutionException error = assertThrows(ExecutionException.class, () -> future.get(1, TimeUnit.SECONDS));
        McpException mcpError = assertInstanceOf(McpException.class, error.getCause());
        assertEquals(-32601, mcpError.getCode());
        assertEquals("Method not found", mcpError.getMessage());
    }

    @Test
    void shouldIgnoreNotificationsAndUnknownIds() {
        CompletableFuture<JsonNode> future = client.sendRequest("tools/list", Map.of());

        client.handleMessage("{\"jsonrpc\":\"2.0\",\"method\":\"notifications/progress\"}");
        client.handleMessage("{\"jsonrpc\":\"2.0\",\"id\":99,\"result\":{}}");
        client.handleMessage("not json");

        assertFalse(future.isDone());
    }

    @Test
    void shouldOmitEmptyParamsFromNotification() throws Exception {
        client.sendNotification("notifications/initialized", Map.of());

        JsonNode notification = objectMapper.readTree(sent.toString().trim());
        assertEquals("notifications/initialized", notification.get("method").asText());
        assertFalse(notification.has("id"));
        assertFalse(notification.has("params"));
    }

    @Test
    void shouldRelayToolCallThroughConnection() throws Exception {
        Mono<String> result = client.callTool(TOOL_CREATE_ISSUE, Map.of("title", "Bug"));

        StepVerifier.create(result)
                .then(() -> {
                    try {
                        JsonNode request = objectMapper.readTree(sent.toString().trim());
                        assertEquals("tools/call", request.get("method").asText());
                        assertEquals("Bug", request.get("params").get("arguments").get("title").asText());
                        client.handleMessage("{\"jsonrpc\":\"2.0\",\"id\":" + request.get("id").asInt()
                                + ",\"result\":{\"content\":[{\"type\":\"text\",\"text\":\"Issue #42\"}]}}");
                    } catch (Exception e) {
                        throw new AssertionError(e);
                    }
                })
                .expectNext("Issue #42")
                .verifyComplete();
    }

    @Test
    void stopFailsPendingRequests() {
        CompletableFuture<JsonNode> future = client.sendRequest("tools/list", Map.of());

        client.stop();

        assertTrue(future.isCompletedExceptionally());
    }
}
