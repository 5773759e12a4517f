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

import me.golemcore.codeact.domain.exception.ModelFailureException;
import me.golemcore.codeact.domain.model.AgentEvent;
import me.golemcore.codeact.domain.model.Message;
import me.golemcore.codeact.domain.model.ModelChunk;
import me.golemcore.codeact.domain.model.ToolFailureKind;
import me.golemcore.codeact.domain.model.ToolResult;
import me.golemcore.codeact.domain.model.TurnStatus;
import me.golemcore.codeact.domain.service.CorrelationIds;
import me.golemcore.codeact.port.outbound.ModelSession;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.util.ArrayList;
import java.util.List;

/**
 * Turn loop orchestrator.
 *
 * <p>
 * One {@link #runTurn} call: 1) model step streamed as thought and response
 * events, 2) proposals dispatched concurrently, 3) results fed back, repeated
 * until the model answers without proposals. A rejected or expired approval
 * ends the turn with a fixed notice; a round budget ends it after the last
 * allowed round. Each finished round is persisted as soon as its tool results
 * are in, and the turn's final status is persisted when it ends. Model and
 * persistence failures abort the turn: rounds already persisted stay in history
 * and the turn is logged as incomplete, the unfinished round is dropped. After
 * {@link #cancel()} the turn is aborted the same way and never logged as
 * rejected.
 */
public class DefaultTurnLoop implements TurnLoop {

    private static final Logger log = LoggerFactory.getLogger(DefaultTurnLoop.class);

    private final String agentId;
    private final ModelSession modelSession;
    private final ActionDispatcher dispatcher;
    private final HistoryWriter historyWriter;
    private final ToolCatalog catalog;
    private volatile boolean cancelled;

    public DefaultTurnLoop(String agentId, ModelSession modelSession, ActionDispatcher dispatcher,
            HistoryWriter historyWriter, ToolCatalog catalog) {
        this.agentId = agentId;
        this.modelSession = modelSession;
        this.dispatcher = dispatcher;
        this.historyWriter = historyWriter;
        this.catalog = catalog;
    }

    @Override
    public Flux<AgentEvent> runTurn(String prompt, Integer maxTurns) {
        if (maxTurns != null && maxTurns < 1) {
            return Flux.error(new IllegalArgumentException("maxTurns must be positive: " + maxTurns));
        }
        return Flux.defer(() -> {
            historyWriter.beginTurn(prompt);
            TurnState state = new TurnState(maxTurns);
            return nextStep(state)
                    .concatWith(Mono.<AgentEvent>fromRunnable(() -> {
                        if (cancelled) {
                            log.info("[TurnLoop] {} turn cancelled after {} round(s)", agentId, state.rounds);
                            historyWriter.abortTurn();
                            return;
                        }
                        historyWriter.completeTurn(state.status);
                        log.info("[TurnLoop] {} turn ended after {} round(s): {}", agentId, state.rounds,
                                state.status);
                    }))
                    .doOnError(e -> {
                        log.error("[TurnLoop] {} turn failed: {}", agentId, e.getMessage());
                        historyWriter.abortTurn();
                    })
                    .doOnCancel(historyWriter::abortTurn);
        });
    }

    @Override
    public void cancel() {
        cancelled = true;
    }

    private Flux<AgentEvent> nextStep(TurnState state) {
        return Flux.defer(() -> {
            ModelStep step = new ModelStep();
            Flux<AgentEvent> modelEvents = modelSession.stream(historyWriter.snapshot(), catalog.definitions())
                    .onErrorMap(e -> !(e instanceof ModelFailureException),
                            e -> new ModelFailureException("Model session failed: " + e.getMessage(), e))
                    .concatMapIterable(step::accept)
                    .concatWith(Flux.defer(() -> Flux.fromIterable(step.terminalEvents())));
            return modelEvents.concatWith(Flux.defer(() -> afterModelStep(step, state)));
        });
    }

    private Flux<AgentEvent> afterModelStep(ModelStep step, TurnState state) {
        Message assistant = Message.assistant(step.text(), step.thoughts(), step.toolCalls);
        historyWriter.appendAssistant(assistant);
        if (!assistant.hasToolCalls()) {
            state.status = TurnStatus.COMPLETED;
            return Flux.empty();
        }

        List<Message.ToolCall> calls = assistant.getToolCalls();
        RoundResults results = new RoundResults(calls.size());
        return dispatcher.dispatch(calls, results)
                .concatWith(Flux.defer(() -> afterDispatch(calls, results, state)));
    }

    private Flux<AgentEvent> afterDispatch(List<Message.ToolCall> calls, RoundResults results, TurnState state) {
        if (cancelled) {
            return Flux.empty();
        }
        boolean truncated = results.isTruncated();
        List<ActionOutcome> outcomes = new ArrayList<>(calls.size());
        for (int index = 0; index < calls.size(); index++) {
            ToolResult result = results.get(index);
            if (result == null) {
                result = ToolResult.failure(ToolFailureKind.EXECUTION_FAILED, "No result produced");
            }
            if (truncated && !result.isTruncating()) {
                result = ToolResult.failure(ToolFailureKind.DISCARDED, DefaultActionDispatcher.DISCARDED_NOTICE);
            }
            outcomes.add(ActionOutcome.of(calls.get(index), result));
        }
        historyWriter.appendToolResults(outcomes);
        historyWriter.commitRound();
        state.rounds++;

        if (truncated) {
            state.status = TurnStatus.REJECTED;
            String notice = results.truncation() == ToolFailureKind.APPROVAL_TIMEOUT
                    ? DefaultActionDispatcher.APPROVAL_TIMEOUT_NOTICE
                    : DefaultActionDispatcher.REJECTION_NOTICE;
            String corrId = CorrelationIds.newCorrId();
            return Flux.just(
                    new AgentEvent.ResponseChunk(agentId, corrId, notice),
                    new AgentEvent.Response(agentId, corrId, notice));
        }

        if (state.maxTurns != null && state.rounds >= state.maxTurns) {
            log.info("[TurnLoop] {} reached max turns ({}), stopping", agentId, state.maxTurns);
            state.status = TurnStatus.MAX_TURNS_REACHED;
            return Flux.empty();
        }
        return nextStep(state);
    }

    private static final class TurnState {
        private final Integer maxTurns;
        private int rounds;
        private TurnStatus status = TurnStatus.COMPLETED;

        private TurnState(Integer maxTurns) {
            this.maxTurns = maxTurns;
        }
    }

    /**
     * Accumulates one model step. Thought and response chunks use separate
     * corrIds so each family closes with its own terminal event.
     */
    private final class ModelStep {
        private final String thoughtsCorrId = CorrelationIds.newCorrId();
        private final String responseCorrId = CorrelationIds.newCorrId();
        private final StringBuilder thoughts = new StringBuilder();
        private final StringBuilder text = new StringBuilder();
        private List<Message.ToolCall> toolCalls = List.of();

        private List<AgentEvent> accept(ModelChunk chunk) {
            List<AgentEvent> events = new ArrayList<>(2);
            if (chunk.getThoughtsDelta() != null && !chunk.getThoughtsDelta().isEmpty()) {
                thoughts.append(chunk.getThoughtsDelta());
                events.add(new AgentEvent.ThoughtsChunk(agentId, thoughtsCorrId, chunk.getThoughtsDelta()));
            }
            if (chunk.getTextDelta() != null && !chunk.getTextDelta().isEmpty()) {
                text.append(chunk.getTextDelta());
                events.add(new AgentEvent.ResponseChunk(agentId, responseCorrId, chunk.getTextDelta()));
            }
            if (chunk.isDone() && chunk.getToolCalls() != null) {
                toolCalls = normalize(chunk.getToolCalls());
            }
            return events;
        }

        private List<AgentEvent> terminalEvents() {
            List<AgentEvent> events = new ArrayList<>(2);
            if (thoughts.length() > 0) {
                events.add(new AgentEvent.Thoughts(agentId, thoughtsCorrId, thoughts.toString()));
            }
            if (text.length() > 0) {
                events.add(new AgentEvent.Response(agentId, responseCorrId, text.toString()));
            }
            return events;
        }

        private String text() {
            return text.toString();
        }

        private String thoughts() {
            return thoughts.length() > 0 ? thoughts.toString() : null;
        }

        private List<Message.ToolCall> normalize(List<Message.ToolCall> calls) {
            List<Message.ToolCall> normalized = new ArrayList<>(calls.size());
            for (Message.ToolCall call : calls) {
                if (call.getId() == null || call.getId().isBlank()) {
                    call = Message.ToolCall.builder()
                            .id("call_" + CorrelationIds.newCorrId())
                            .name(call.getName())
                            .arguments(call.getArguments())
                            .build();
                }
                normalized.add(call);
            }
            return normalized;
        }
    }
}
