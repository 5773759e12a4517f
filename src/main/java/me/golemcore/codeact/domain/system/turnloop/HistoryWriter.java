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

import me.golemcore.codeact.domain.model.Message;
import me.golemcore.codeact.domain.model.Turn;
import me.golemcore.codeact.domain.model.TurnStatus;

import java.util.List;

/**
 * Owns an agent's conversation history and writes it to the session log round
 * by round.
 */
public interface HistoryWriter {

    /**
     * Snapshot of the history to send to the model.
     */
    List<Message> snapshot();

    /**
     * Rehydrates history from persisted turns. Only valid before the first turn.
     */
    void restore(List<Turn> turns);

    void beginTurn(String prompt);

    void appendAssistant(Message assistant);

    void appendToolResults(List<ActionOutcome> outcomes);

    /**
     * Persists the messages added since the last commit as a finished round of
     * the current turn. Committed messages survive {@link #abortTurn()}.
     *
     * @throws me.golemcore.codeact.domain.exception.PersistenceException
     *             if the session log cannot be appended
     */
    void commitRound();

    /**
     * Persists the rest of the current turn with its final status.
     *
     * @throws me.golemcore.codeact.domain.exception.PersistenceException
     *             if the session log cannot be appended
     */
    void completeTurn(TurnStatus status);

    /**
     * Drops the uncommitted messages of the current turn from history. If
     * rounds were already committed, the turn is logged as
     * {@link TurnStatus#INCOMPLETE}.
     */
    void abortTurn();
}
