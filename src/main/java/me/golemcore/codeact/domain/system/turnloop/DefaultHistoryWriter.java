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

import me.golemcore.codeact.domain.exception.PersistenceException;
import me.golemcore.codeact.domain.model.Message;
import me.golemcore.codeact.domain.model.Turn;
import me.golemcore.codeact.domain.model.TurnStatus;
import me.golemcore.codeact.domain.service.SessionStore;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

/**
 * In-memory history with round-granular persistence. A turn's messages become
 * part of the history as they are produced and are appended to the log of this
 * agent id whenever a round finishes and when the turn ends. An aborted turn
 * keeps its committed rounds; only the uncommitted tail is removed.
 */
@Slf4j
public class DefaultHistoryWriter implements HistoryWriter {

    private final String agentId;
    private final SessionStore sessionStore;
    private final Clock clock;
    private final List<Message> history = new ArrayList<>();
    private Turn currentTurn;
    private int turnStart;
    private int committed;

    /**
     * @param sessionStore
     *            log to append to, or {@code null} when persistence is disabled
     */
    public DefaultHistoryWriter(String agentId, SessionStore sessionStore, Clock clock) {
        this.agentId = agentId;
        this.sessionStore = sessionStore;
        this.clock = clock;
    }

    @Override
    public synchronized List<Message> snapshot() {
        return List.copyOf(history);
    }

    @Override
    public synchronized void restore(List<Turn> turns) {
        if (!history.isEmpty() || currentTurn != null) {
            throw new IllegalStateException("History of " + agentId + " already in use");
        }
        for (Turn turn : turns) {
            history.addAll(turn.getMessages());
        }
        log.info("[History] {} restored {} turn(s), {} message(s)", agentId, turns.size(), history.size());
    }

    @Override
    public synchronized void beginTurn(String prompt) {
        if (currentTurn != null) {
            throw new IllegalStateException("Turn of " + agentId + " already in progress");
        }
        currentTurn = Turn.builder().id(UUID.randomUUID().toString()).build();
        turnStart = history.size();
        committed = 0;
        Message user = Message.user(prompt);
        user.setTimestamp(clock.instant());
        add(user);
    }

    @Override
    public synchronized void appendAssistant(Message assistant) {
        assistant.setTimestamp(clock.instant());
        add(assistant);
    }

    @Override
    public synchronized void appendToolResults(List<ActionOutcome> outcomes) {
        for (ActionOutcome outcome : outcomes) {
            Message toolMsg = Message.builder()
                    .role(Message.ROLE_TOOL)
                    .toolCallId(outcome.toolCallId())
                    .toolName(outcome.toolName())
                    .content(outcome.messageContent())
                    .timestamp(clock.instant())
                    .build();
            add(toolMsg);
        }
    }

    @Override
    public synchronized void commitRound() {
        int count = persistPending(TurnStatus.IN_PROGRESS);
        log.debug("[History] {} committed round with {} message(s)", agentId, count);
    }

    @Override
    public synchronized void completeTurn(TurnStatus status) {
        Turn turn = requireTurn();
        turn.setStatus(status);
        persistPending(status);
        currentTurn = null;
        log.debug("[History] {} completed turn with {} message(s): {}", agentId, turn.getMessages().size(), status);
    }

    @Override
    public synchronized void abortTurn() {
        if (currentTurn == null) {
            return;
        }
        Turn turn = currentTurn;
        currentTurn = null;
        int kept = turnStart + committed;
        int dropped = history.size() - kept;
        history.subList(kept, history.size()).clear();
        turn.getMessages().subList(committed, turn.getMessages().size()).clear();
        turn.setStatus(TurnStatus.INCOMPLETE);
        log.debug("[History] {} aborted turn, kept {} and dropped {} message(s)", agentId, committed, dropped);
        if (committed > 0 && sessionStore != null) {
            try {
                sessionStore.append(agentId, List.of(record(turn, List.of(), TurnStatus.INCOMPLETE)));
            } catch (PersistenceException e) {
                log.warn("[History] {} could not mark turn {} incomplete, it will load as incomplete: {}",
                        agentId, turn.getId(), e.getMessage());
            }
        }
    }

    private int persistPending(TurnStatus status) {
        Turn turn = requireTurn();
        List<Message> messages = turn.getMessages();
        List<Message> pending = new ArrayList<>(messages.subList(committed, messages.size()));
        if (sessionStore != null) {
            sessionStore.append(agentId, List.of(record(turn, pending, status)));
        }
        committed = messages.size();
        return pending.size();
    }

    private static Turn record(Turn turn, List<Message> messages, TurnStatus status) {
        return Turn.builder()
                .id(turn.getId())
                .messages(new ArrayList<>(messages))
                .status(status)
                .build();
    }

    private void add(Message message) {
        requireTurn().getMessages().add(message);
        history.add(message);
    }

    private Turn requireTurn() {
        if (currentTurn == null) {
            throw new IllegalStateException("No turn in progress for " + agentId);
        }
        return currentTurn;
    }
}
