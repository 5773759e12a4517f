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

import me.golemcore.codeact.domain.exception.PersistenceException;
import me.golemcore.codeact.domain.model.Turn;
import me.golemcore.codeact.domain.model.TurnStatus;
import me.golemcore.codeact.port.outbound.StoragePort;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import lombok.extern.slf4j.Slf4j;

import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletionException;

/**
 * Append-only JSONL log of turns, one file per agent id under the session
 * directory.
 *
 * <p>
 * Each line is a versioned envelope:
 *
 * <pre>
 * {"v":1,"turn":{...},"meta":{"ts":"2026-01-01T00:00:00Z"}}
 * </pre>
 *
 * <p>
 * A turn may span several records sharing the turn id; {@link #load(String)}
 * merges them. A turn whose last record is still
 * {@link TurnStatus#IN_PROGRESS} is loaded as {@link TurnStatus#INCOMPLETE}.
 *
 * <p>
 * {@link #load(String)} tolerates an unparsable final line, which is what a
 * crash during append leaves behind. Any other malformed line is a
 * {@link PersistenceException}.
 */
@Slf4j
public class SessionStore {

    static final int ENVELOPE_VERSION = 1;
    static final String TOOL_RESULTS_DIR = "tool-results";

    private final StoragePort storage;
    private final ObjectMapper objectMapper;
    private final Clock clock;
    private final String sessionDirectory;
    private final String sessionId;
    private final boolean flushAfterAppend;

    public SessionStore(StoragePort storage, ObjectMapper objectMapper, Clock clock, String sessionsDirectory,
            String sessionId, boolean flushAfterAppend) {
        this.storage = storage;
        this.objectMapper = objectMapper;
        this.clock = clock;
        this.sessionDirectory = sessionsDirectory + "/" + sessionId;
        this.sessionId = sessionId;
        this.flushAfterAppend = flushAfterAppend;
    }

    public String getSessionId() {
        return sessionId;
    }

    /**
     * Appends turn records to the log of {@code agentId}, creating it on demand.
     */
    public void append(String agentId, List<Turn> turns) {
        if (turns.isEmpty()) {
            return;
        }
        StringBuilder lines = new StringBuilder();
        for (Turn turn : turns) {
            ObjectNode envelope = objectMapper.createObjectNode();
            envelope.put("v", ENVELOPE_VERSION);
            envelope.set("turn", objectMapper.valueToTree(turn));
            envelope.putObject("meta").put("ts", clock.instant().toString());
            try {
                lines.append(objectMapper.writeValueAsString(envelope)).append('\n');
            } catch (JsonProcessingException e) {
                throw new PersistenceException("Failed to serialize turn for " + agentId, e);
            }
        }
        try {
            storage.appendText(sessionDirectory, logFile(agentId), lines.toString(), flushAfterAppend).join();
        } catch (CompletionException e) {
            throw new PersistenceException("Failed to append to session log " + sessionDirectory + "/"
                    + logFile(agentId), unwrap(e));
        }
        log.debug("[Session] Appended {} turn(s) to {}/{}", turns.size(), sessionDirectory, logFile(agentId));
    }

    /**
     * Loads every persisted turn of {@code agentId} in append order.
     *
     * @return turns, empty when the log does not exist
     * @throws PersistenceException
     *             if the log cannot be read or a non-final line is malformed
     */
    public List<Turn> load(String agentId) {
        String location = sessionDirectory + "/" + logFile(agentId);
        String content;
        try {
            content = storage.getText(sessionDirectory, logFile(agentId)).join();
        } catch (CompletionException e) {
            throw new PersistenceException("Failed to read session log " + location, unwrap(e));
        }
        if (content == null) {
            return List.of();
        }

        List<String> lines = content.lines().toList();
        List<Turn> turns = new ArrayList<>();
        for (int index = 0; index < lines.size(); index++) {
            int lineNo = index + 1;
            JsonNode envelope;
            try {
                envelope = objectMapper.readTree(lines.get(index));
            } catch (JsonProcessingException e) {
                if (index == lines.size() - 1) {
                    log.warn("[Session] Ignoring truncated final line {} in {}", lineNo, location);
                    break;
                }
                throw new PersistenceException("Malformed JSONL line " + lineNo + " in " + location, e);
            }
            validateEnvelope(envelope, lineNo, location);
            Turn record;
            try {
                record = objectMapper.treeToValue(envelope.get("turn"), Turn.class);
            } catch (JsonProcessingException | IllegalArgumentException e) {
                throw new PersistenceException("Malformed turn on line " + lineNo + " in " + location, e);
            }
            if (continues(turns, record)) {
                Turn open = turns.get(turns.size() - 1);
                open.getMessages().addAll(record.getMessages());
                open.setStatus(record.getStatus());
            } else {
                turns.add(record);
            }
        }
        for (Turn turn : turns) {
            if (turn.getStatus() == TurnStatus.IN_PROGRESS) {
                turn.setStatus(TurnStatus.INCOMPLETE);
            }
        }
        log.debug("[Session] Loaded {} turn(s) from {} line(s) of {}", turns.size(), lines.size(), location);
        return turns;
    }

    private static boolean continues(List<Turn> turns, Turn record) {
        if (turns.isEmpty() || record.getId() == null) {
            return false;
        }
        Turn open = turns.get(turns.size() - 1);
        return record.getId().equals(open.getId()) && open.getStatus() == TurnStatus.IN_PROGRESS;
    }

    /**
     * Stores a large tool result next to the logs.
     *
     * @return absolute path of the stored file
     */
    public Path saveToolResult(String content, String extension) {
        String fileName = CorrelationIds.randomHex(12) + "." + extension;
        String directory = sessionDirectory + "/" + TOOL_RESULTS_DIR;
        try {
            storage.putText(directory, fileName, content).join();
        } catch (CompletionException e) {
            throw new PersistenceException("Failed to store tool result " + directory + "/" + fileName, unwrap(e));
        }
        log.debug("[Session] Stored tool result ({} bytes) as {}/{}",
                content.getBytes(StandardCharsets.UTF_8).length, directory, fileName);
        return storage.resolve(directory, fileName);
    }

    private void validateEnvelope(JsonNode envelope, int lineNo, String location) {
        if (envelope == null || !envelope.isObject()) {
            throw malformed(lineNo, location);
        }
        if (!envelope.has("v") || !envelope.has("turn") || !envelope.has("meta")) {
            throw malformed(lineNo, location);
        }
        JsonNode version = envelope.get("v");
        if (!version.isInt() || version.intValue() != ENVELOPE_VERSION) {
            throw new PersistenceException("Unsupported session envelope version on line " + lineNo + " in "
                    + location);
        }
        JsonNode meta = envelope.get("meta");
        if (!meta.isObject()) {
            throw malformed(lineNo, location);
        }
        if (meta.has("agent_id")) {
            throw new PersistenceException("Invalid session envelope on line " + lineNo + " in " + location
                    + ": meta.agent_id is forbidden");
        }
        if (!meta.has("ts")) {
            throw malformed(lineNo, location);
        }
    }

    private static PersistenceException malformed(int lineNo, String location) {
        return new PersistenceException("Malformed JSONL line " + lineNo + " in " + location);
    }

    private static String logFile(String agentId) {
        return agentId + ".jsonl";
    }

    private static Throwable unwrap(CompletionException e) {
        return e.getCause() != null ? e.getCause() : e;
    }
}
