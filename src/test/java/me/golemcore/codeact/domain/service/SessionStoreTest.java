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


package me.golemcore.codeact.domain.service;

import me.golemcore.codeact.adapter.outbound.storage.LocalStorageAdapter;
import me.golemcore.codeact.domain.exception.PersistenceException;
import me.golemcore.codeact.domain.model.Message;
import me.golemcore.codeact.domain.model.Turn;
import me.golemcore.codeact.domain.model.TurnStatus;
import me.golemcore.codeact.infrastructure.config.AgentConfiguration;
import me.golemcore.codeact.infrastructure.config.CodeActProperties;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class SessionStoreTest {

    private static final String SESSION_ID = "session-1";
    private static final String MAIN = "main";
    private static final Instant NOW = Instant.parse("2026-02-14T00:00:00Z");

    @TempDir
    Path tempDir;

    private final ObjectMapper objectMapper = AgentConfiguration.objectMapper();
    private SessionStore store;
    private Path logFile;

    @BeforeEach
    void setUp() {
        CodeActProperties properties = new CodeActProperties();
        properties.getStorage().setBasePath(tempDir.toString());
        LocalStorageAdapter storage = new LocalStorageAdapter(properties);
        storage.init();

        store = new SessionStore(storage, objectMapper, Clock.fixed(NOW, ZoneOffset.UTC), "sessions", SESSION_ID,
                false);
        logFile = tempDir.resolve("sessions").resolve(SESSION_ID).resolve("main.jsonl");
    }

    private Turn turn(String prompt, String answer) {
        List<Message> messages = new ArrayList<>();
        messages.add(Message.user(prompt));
        messages.add(Message.assistant(answer, null, null));
        return Turn.builder().messages(messages).status(TurnStatus.COMPLETED).build();
    }

    private Turn toolTurn() {
        Message.ToolCall call = Message.ToolCall.builder()
                .id("call_1")
                .name("execute_code")
                .arguments(Map.of("code", "print(2+2)"))
                .build();
        List<Message> messages = new ArrayList<>();
        messages.add(Message.user("compute 2+2"));
        messages.add(Message.assistant("", "Use Python", List.of(call)));
        messages.add(Message.toolResult(call, "4"));
        messages.add(Message.assistant("4", null, null));
        return Turn.builder().messages(messages).status(TurnStatus.COMPLETED).build();
    }

    private void appendRaw(String line) throws IOException {
        Files.createDirectories(logFile.getParent());
        Files.writeString(logFile, line, StandardOpenOption.CREATE, StandardOpenOption.APPEND);
    }

    // ==================== Append and load ====================

    @Test
    void shouldLoadTurnsInAppendOrder() {
        store.append(MAIN, List.of(turn("one", "1")));
        store.append(MAIN, List.of(turn("two", "2"), turn("three", "3")));

        List<Turn> turns = store.load(MAIN);

        assertEquals(3, turns.size());
        assertEquals("one", turns.get(0).getMessages().get(0).getContent());
        assertEquals("three", turns.get(2).getMessages().get(0).getContent());
    }

    @Test
    void shouldMergeRecordsOfOneTurn() {
        Turn round = turn("compute", "");
        round.setId("t1");
        round.setStatus(TurnStatus.IN_PROGRESS);
        Turn closing = Turn.builder()
                .id("t1")
                .messages(new ArrayList<>(List.of(Message.assistant("done", null, null))))
                .status(TurnStatus.COMPLETED)
                .build();
        store.append(MAIN, List.of(round));
        store.append(MAIN, List.of(closing));
        store.append(MAIN, List.of(turn("next", "ok")));

        List<Turn> turns = store.load(MAIN);

        assertEquals(2, turns.size());
        assertEquals("t1", turns.get(0).getId());
        assertEquals(TurnStatus.COMPLETED, turns.get(0).getStatus());
        assertEquals(List.of("compute", "", "done"),
                turns.get(0).getMessages().stream().map(Message::getContent).toList());
    }

    @Test
    void shouldLoadUnclosedTurnAsIncomplete() {
        Turn round = turn("compute", "");
        round.setId("t1");
        round.setStatus(TurnStatus.IN_PROGRESS);
        store.append(MAIN, List.of(round));

        Turn loaded = store.load(MAIN).get(0);

        assertEquals(TurnStatus.INCOMPLETE, loaded.getStatus());
        assertEquals(2, loaded.getMessages().size());
    }

    @Test
    void shouldNotMergeRecordsWithoutId() {
        Turn first = turn("one", "1");
        first.setStatus(TurnStatus.IN_PROGRESS);
        store.append(MAIN, List.of(first, turn("two", "2")));

        List<Turn> turns = store.load(MAIN);

        assertEquals(2, turns.size());
        assertEquals(TurnStatus.INCOMPLETE, turns.get(0).getStatus());
    }

    @Test
    void shouldRoundTripToolCallsAndStatus() {
        store.append(MAIN, List.of(toolTurn()));

        Turn loaded = store.load(MAIN).get(0);

        assertEquals(TurnStatus.COMPLETED, loaded.getStatus());
        assertEquals(4, loaded.getMessages().size());
        Message assistant = loaded.getMessages().get(1);
        assertTrue(assistant.hasToolCalls());
        assertEquals("Use Python", assistant.getThoughts());
        assertEquals("execute_code", assistant.getToolCalls().get(0).getName());
        assertEquals("print(2+2)", assistant.getToolCalls().get(0).getArguments().get("code"));
        Message tool = loaded.getMessages().get(2);
        assertEquals(Message.ROLE_TOOL, tool.getRole());
        assertEquals("call_1", tool.getToolCallId());
        assertEquals("4", tool.getContent());
    }

    @Test
    void shouldWriteVersionedEnvelopePerLine() throws IOException {
        store.append(MAIN, List.of(turn("one", "1"), turn("two", "2")));

        List<String> lines = Files.readAllLines(logFile);

        assertEquals(2, lines.size());
        JsonNode envelope = objectMapper.readTree(lines.get(0));
        assertEquals(1, envelope.get("v").asInt());
        assertTrue(envelope.get("turn").isObject());
        assertEquals("2026-02-14T00:00:00Z", envelope.get("meta").get("ts").asText());
        assertFalse(envelope.get("meta").has("agent_id"));
    }

    @Test
    void shouldKeepOneFilePerAgent() {
        store.append(MAIN, List.of(turn("root", "r")));
        store.append("sub-1a2b", List.of(turn("child", "c")));

        assertEquals(1, store.load(MAIN).size());
        assertEquals("child", store.load("sub-1a2b").get(0).getMessages().get(0).getContent());
        assertTrue(Files.exists(tempDir.resolve("sessions").resolve(SESSION_ID).resolve("sub-1a2b.jsonl")));
    }

    @Test
    void shouldReturnEmptyListForMissingLog() {
        assertTrue(store.load(MAIN).isEmpty());
    }

    // ==================== Recovery and validation ====================

    @Test
    void shouldIgnoreTruncatedFinalLine() throws IOException {
        store.append(MAIN, List.of(turn("one", "1"), turn("two", "2")));
        appendRaw("{\"v\":1,\"turn\":{\"messages\":[{\"role\":\"us");

        List<Turn> turns = store.load(MAIN);

        assertEquals(2, turns.size());
    }

    @Test
    void shouldFailOnMalformedMiddleLine() throws IOException {
        store.append(MAIN, List.of(turn("one", "1")));
        appendRaw("not json\n");
        store.append(MAIN, List.of(turn("two", "2")));

        PersistenceException error = assertThrows(PersistenceException.class, () -> store.load(MAIN));

        assertTrue(error.getMessage().contains("line 2"), error.getMessage());
    }

    @Test
    void shouldFailOnUnsupportedVersion() throws IOException {
        appendRaw("{\"v\":2,\"turn\":{\"messages\":[]},\"meta\":{\"ts\":\"2026-02-14T00:00:00Z\"}}\n");

        PersistenceException error = assertThrows(PersistenceException.class, () -> store.load(MAIN));

        assertTrue(error.getMessage().contains("Unsupported session envelope version"), error.getMessage());
    }

    @Test
    void shouldFailOnEnvelopeWithoutMeta() throws IOException {
        appendRaw("{\"v\":1,\"turn\":{\"messages\":[]}}\n");

        assertThrows(PersistenceException.class, () -> store.load(MAIN));
    }

    @Test
    void shouldFailOnAgentIdInMeta() throws IOException {
        appendRaw("{\"v\":1,\"turn\":{\"messages\":[]},\"meta\":{\"ts\":\"x\",\"agent_id\":\"main\"}}\n");

        PersistenceException error = assertThrows(PersistenceException.class, () -> store.load(MAIN));

        assertTrue(error.getMessage().contains("agent_id"), error.getMessage());
    }

    @Test
    void shouldFailOnNonObjectLine() throws IOException {
        appendRaw("[1,2,3]\n");

        assertThrows(PersistenceException.class, () -> store.load(MAIN));
    }

    // ==================== Tool results ====================

    @Test
    void shouldStoreToolResultUnderSessionDirectory() throws IOException {
        Path stored = store.saveToolResult("large output", "txt");

        assertTrue(stored.startsWith(tempDir.resolve("sessions").resolve(SESSION_ID).resolve("tool-results")));
        assertTrue(stored.getFileName().toString().endsWith(".txt"));
        assertEquals("large output", Files.readString(stored));
    }
}
