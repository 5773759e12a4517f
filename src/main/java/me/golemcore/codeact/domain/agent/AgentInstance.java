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


package me.golemcore.codeact.domain.agent;

import me.golemcore.codeact.domain.model.AgentEvent;
import me.golemcore.codeact.domain.model.AgentSettings;
import me.golemcore.codeact.domain.resource.ManagedResource;
import me.golemcore.codeact.domain.resource.ResourceSupervisor;
import me.golemcore.codeact.domain.service.ApprovalGate;
import me.golemcore.codeact.domain.service.SessionStore;
import me.golemcore.codeact.domain.service.ToolResultMaterializer;
import me.golemcore.codeact.domain.system.subagent.SubagentRunner;
import me.golemcore.codeact.domain.system.turnloop.DefaultActionDispatcher;
import me.golemcore.codeact.domain.system.turnloop.DefaultTurnLoop;
import me.golemcore.codeact.domain.system.turnloop.HistoryWriter;
import me.golemcore.codeact.domain.system.turnloop.ToolCatalog;
import me.golemcore.codeact.domain.system.turnloop.TurnLoop;
import me.golemcore.codeact.port.outbound.ExecutionSession;
import me.golemcore.codeact.port.outbound.ModelSession;
import me.golemcore.codeact.port.outbound.ToolConnection;
import lombok.Builder;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Sinks;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * One agent: a model session, an exclusive execution session and tool
 * connections under one {@link ResourceSupervisor}, its conversation history,
 * its approval gate and, for delegating agents, a subagent runner.
 *
 * <p>
 * Lifecycle: {@link #start()} once, any number of sequential
 * {@link #stream(String, Integer)} calls, then {@link #stop()} or
 * {@link #cancel()}. Only one stream may be active at a time.
 */
@Slf4j
public class AgentInstance {

    public static final String MAIN_AGENT_ID = "main";

    private enum State {
        NEW, RUNNING, STOPPED
    }

    @Getter
    private final String agentId;
    @Getter
    private final String sessionId;
    @Getter
    private final AgentSettings settings;
    private final ModelSession modelSession;
    private final ExecutionSession executionSession;
    private final List<ToolConnection> toolConnections;
    private final ResourceSupervisor supervisor;
    private final ApprovalGate approvalGate;
    private final HistoryWriter historyWriter;
    private final SessionStore sessionStore;
    private final ToolResultMaterializer materializer;
    private final SubagentRunner subagentRunner;

    private final Sinks.One<Boolean> cancellation = Sinks.one();
    private final AtomicBoolean streaming = new AtomicBoolean();
    private volatile State state = State.NEW;
    private volatile TurnLoop turnLoop;

    @Builder
    AgentInstance(String agentId, String sessionId, AgentSettings settings, ModelSession modelSession,
            ExecutionSession executionSession, List<ToolConnection> toolConnections, ApprovalGate approvalGate,
            HistoryWriter historyWriter, SessionStore sessionStore, ToolResultMaterializer materializer,
            SubagentRunner subagentRunner) {
        this.agentId = agentId;
        this.sessionId = sessionId;
        this.settings = settings;
        this.modelSession = modelSession;
        this.executionSession = executionSession;
        this.toolConnections = toolConnections != null ? List.copyOf(toolConnections) : List.of();
        this.approvalGate = approvalGate;
        this.historyWriter = historyWriter;
        this.sessionStore = sessionStore;
        this.materializer = materializer;
        this.subagentRunner = subagentRunner;

        List<ManagedResource> resources = new ArrayList<>();
        resources.add(modelSession);
        resources.add(executionSession);
        resources.addAll(this.toolConnections);
        this.supervisor = new ResourceSupervisor(agentId, resources);
    }

    /**
     * Replays the persisted history (root instance only) and starts all
     * resources.
     *
     * @throws me.golemcore.codeact.domain.exception.PersistenceException
     *             if the session log is unreadable
     * @throws me.golemcore.codeact.domain.exception.ResourceStartException
     *             if a resource fails to start; nothing is left running
     */
    public synchronized void start() {
        if (state != State.NEW) {
            throw new IllegalStateException("Agent " + agentId + " cannot be started in state " + state);
        }
        if (MAIN_AGENT_ID.equals(agentId) && sessionStore != null) {
            historyWriter.restore(sessionStore.load(agentId));
        }
        supervisor.start();
        try {
            ToolCatalog catalog = ToolCatalog.build(toolConnections, subagentRunner != null);
            DefaultActionDispatcher dispatcher = new DefaultActionDispatcher(agentId, approvalGate, executionSession,
                    catalog, subagentRunner, materializer, settings);
            turnLoop = new DefaultTurnLoop(agentId, modelSession, dispatcher, historyWriter, catalog);
        } catch (RuntimeException e) {
            supervisor.stop();
            throw e;
        }
        state = State.RUNNING;
        log.info("[Agent] {} started{}", agentId, sessionId != null ? " (session " + sessionId + ")" : "");
    }

    /**
     * Runs one exchange. Every emitted {@link me.golemcore.codeact.domain.model.ApprovalRequest}
     * must be resolved for the stream to progress.
     *
     * @param maxTurns
     *            maximum number of dispatch rounds, or {@code null} for no limit
     */
    public Flux<AgentEvent> stream(String prompt, Integer maxTurns) {
        return Flux.defer(() -> {
            TurnLoop loop = turnLoop;
            if (state != State.RUNNING || loop == null) {
                return Flux.error(new IllegalStateException("Agent " + agentId + " is not running"));
            }
            if (!streaming.compareAndSet(false, true)) {
                return Flux.error(new IllegalStateException("Agent " + agentId + " is already streaming"));
            }
            return loop.runTurn(prompt, maxTurns)
                    .takeUntilOther(cancellation.asMono())
                    .doFinally(signal -> streaming.set(false));
        });
    }

    /**
     * Hard cancellation: marks the turn loop cancelled so the running turn is
     * not logged with its own status, rejects pending approvals, stops the
     * active stream and its executions, cancels live subagents, then stops own
     * resources.
     */
    public void cancel() {
        log.info("[Agent] {} cancelling", agentId);
        TurnLoop loop = turnLoop;
        if (loop != null) {
            loop.cancel();
        }
        approvalGate.rejectAllPending();
        cancellation.tryEmitValue(Boolean.TRUE);
        if (subagentRunner != null) {
            subagentRunner.cancelAll();
        }
        stop();
    }

    /**
     * Stops all resources. Idempotent.
     */
    public synchronized void stop() {
        if (state == State.STOPPED) {
            return;
        }
        state = State.STOPPED;
        supervisor.stop();
        log.info("[Agent] {} stopped", agentId);
    }

    public boolean isRunning() {
        return state == State.RUNNING;
    }

    public ApprovalGate approvalGate() {
        return approvalGate;
    }

    public HistoryWriter history() {
        return historyWriter;
    }
}
