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

import me.golemcore.codeact.domain.model.AgentEvent;
import me.golemcore.codeact.domain.model.AgentSettings;
import me.golemcore.codeact.domain.model.ApprovalDecision;
import me.golemcore.codeact.domain.model.ApprovalRequest;
import me.golemcore.codeact.domain.model.ExecutionUpdate;
import me.golemcore.codeact.domain.model.Message;
import me.golemcore.codeact.domain.model.ToolFailureKind;
import me.golemcore.codeact.domain.model.ToolResult;
import me.golemcore.codeact.domain.service.ApprovalGate;
import me.golemcore.codeact.domain.service.CorrelationIds;
import me.golemcore.codeact.domain.service.ToolResultMaterializer;
import me.golemcore.codeact.domain.system.subagent.AdmissionLimiter;
import me.golemcore.codeact.domain.system.subagent.SubagentRunner;
import me.golemcore.codeact.port.outbound.ExecutionSession;
import lombok.extern.slf4j.Slf4j;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeoutException;

/**
 * Dispatches the proposals of one model step concurrently.
 *
 * <p>
 * Every known proposal gets its own corrId and an {@link ApprovalRequest},
 * emitted before anything runs. The action starts only once the request is
 * approved. Actions needing the execution session take the execution lock, so
 * code cells and resets of one instance never overlap even though their
 * approvals are pending together.
 *
 * <p>
 * A rejected or expired approval records a truncating result and emits no
 * terminal event for its corrId. Approved siblings still run to completion,
 * whenever their approval arrives; the turn loop discards their results from
 * the next model input.
 */
@Slf4j
public class DefaultActionDispatcher implements ActionDispatcher {

    public static final String REJECTION_NOTICE = "Tool call rejected";
    public static final String APPROVAL_TIMEOUT_NOTICE = "Approval request timed out";
    public static final String DISCARDED_NOTICE = "Result discarded: another tool call of the same step was rejected";
    public static final String RESET_SUCCESS = "Execution session reset successfully.";

    private final String agentId;
    private final ApprovalGate approvalGate;
    private final ExecutionSession executionSession;
    private final AdmissionLimiter executionLock;
    private final ToolCatalog catalog;
    private final SubagentRunner subagentRunner;
    private final ToolResultMaterializer materializer;
    private final AgentSettings settings;

    /**
     * @param subagentRunner
     *            runner for delegations, or {@code null} when delegation is
     *            disabled
     */
    public DefaultActionDispatcher(String agentId, ApprovalGate approvalGate, ExecutionSession executionSession,
            ToolCatalog catalog, SubagentRunner subagentRunner, ToolResultMaterializer materializer,
            AgentSettings settings) {
        this.agentId = agentId;
        this.approvalGate = approvalGate;
        this.executionSession = executionSession;
        this.executionLock = new AdmissionLimiter(agentId + "-execution", 1);
        this.catalog = catalog;
        this.subagentRunner = subagentRunner;
        this.materializer = materializer;
        this.settings = settings;
    }

    @Override
    public Flux<AgentEvent> dispatch(List<Message.ToolCall> calls, RoundResults results) {
        List<Flux<AgentEvent>> actions = new ArrayList<>(calls.size());
        for (int index = 0; index < calls.size(); index++) {
            actions.add(dispatchOne(index, calls.get(index), results));
        }
        log.debug("[Dispatch] {} dispatching {} proposal(s)", agentId, calls.size());
        return Flux.merge(actions);
    }

    private Flux<AgentEvent> dispatchOne(int index, Message.ToolCall call, RoundResults results) {
        String name = call.getName();
        Map<String, Object> args = call.getArguments() != null ? call.getArguments() : Map.of();

        if (!catalog.contains(name)) {
            log.warn("[Dispatch] {} proposed unknown tool: {}", agentId, name);
            results.record(index, ToolResult.failure(ToolFailureKind.UNKNOWN_TOOL, "Unknown tool name: " + name));
            return Flux.empty();
        }

        String corrId = CorrelationIds.newCorrId();
        ApprovalRequest approval = approvalGate.request(agentId, corrId, name, args, false);
        return Flux.<AgentEvent>just(approval)
                .concatWith(approvalGate.await(approval)
                        .flatMapMany(decision -> afterApproval(decision, index, name, args, corrId, results)));
    }

    private Flux<AgentEvent> afterApproval(ApprovalDecision decision, int index, String name,
            Map<String, Object> args, String corrId, RoundResults results) {
        return switch (decision) {
        case REJECTED -> {
            log.info("[Dispatch] {} tool call rejected: {} [{}]", agentId, name, corrId);
            results.record(index, ToolResult.failure(ToolFailureKind.REJECTED, REJECTION_NOTICE));
            yield Flux.empty();
        }
        case TIMED_OUT -> {
            results.record(index, ToolResult.failure(ToolFailureKind.APPROVAL_TIMEOUT, APPROVAL_TIMEOUT_NOTICE));
            yield Flux.empty();
        }
        case APPROVED -> {
            if (results.isTruncated()) {
                log.debug("[Dispatch] {} running {} [{}] in a truncated round, its result will be discarded",
                        agentId, name, corrId);
            }
            yield execute(index, name, args, corrId, results);
        }
        };
    }

    private Flux<AgentEvent> execute(int index, String name, Map<String, Object> args, String corrId,
            RoundResults results) {
        if (ToolCatalog.EXECUTE_CODE.equals(name)) {
            return executeCode(index, stringArg(args, "code"), corrId, results);
        }
        if (ToolCatalog.RESET_EXECUTION.equals(name)) {
            return resetExecution(index, corrId, results);
        }
        if (ToolCatalog.SUBAGENT_TASK.equals(name)) {
            return delegate(index, args, corrId, results);
        }
        return callTool(index, name, args, corrId, results);
    }

    // ==================== Code actions ====================

    private Flux<AgentEvent> executeCode(int index, String code, String corrId, RoundResults results) {
        CodeRun run = new CodeRun();
        Flux<AgentEvent> execution = Flux.usingWhen(
                executionLock.acquire(),
                permit -> withExecutionTimeout(executionSession.execute(code))
                        .concatMap(update -> onExecutionUpdate(update, corrId, run)),
                permit -> Mono.fromRunnable(permit::release));

        return execution
                .concatWith(Flux.defer(() -> finishCode(index, corrId, run, results)))
                .onErrorResume(e -> executionFailed(index, corrId, e, results));
    }

    private Flux<ExecutionUpdate> withExecutionTimeout(Flux<ExecutionUpdate> updates) {
        Duration timeout = settings.getExecutionTimeout();
        if (timeout == null) {
            return updates;
        }
        return Flux.defer(() -> {
            ExecutionDeadline deadline = new ExecutionDeadline(timeout);
            return updates.timeout(deadline.expiry(), item -> item instanceof ExecutionUpdate.ToolApproval nested
                    ? deadline.pausedUntil(nested.reply())
                    : deadline.expiry());
        });
    }

    private Flux<AgentEvent> onExecutionUpdate(ExecutionUpdate update, String corrId, CodeRun run) {
        if (update instanceof ExecutionUpdate.OutputChunk chunk) {
            return Flux.just(new AgentEvent.CodeExecutionOutputChunk(agentId, corrId, chunk.text()));
        }
        if (update instanceof ExecutionUpdate.ToolApproval nested) {
            return nestedApproval(nested, corrId, run);
        }
        if (update instanceof ExecutionUpdate.Result result) {
            run.result = result;
        }
        return Flux.empty();
    }

    private Flux<AgentEvent> nestedApproval(ExecutionUpdate.ToolApproval nested, String corrId, CodeRun run) {
        ApprovalRequest request = approvalGate.request(agentId, corrId, nested.qualifiedName(), nested.toolArgs(),
                true);
        Mono<AgentEvent> decision = approvalGate.await(request)
                .doOnNext(value -> {
                    if (value != ApprovalDecision.APPROVED && run.denial == null) {
                        run.denial = value;
                    }
                    nested.reply().complete(value == ApprovalDecision.APPROVED);
                })
                .then(Mono.empty());
        return Flux.<AgentEvent>just(request).concatWith(decision);
    }

    private Flux<AgentEvent> finishCode(int index, String corrId, CodeRun run, RoundResults results) {
        ExecutionUpdate.Result result = run.result != null ? run.result : new ExecutionUpdate.Result(null, List.of());
        if (run.denial != null) {
            boolean timedOut = run.denial == ApprovalDecision.TIMED_OUT;
            results.record(index, ToolResult.failure(
                    timedOut ? ToolFailureKind.APPROVAL_TIMEOUT : ToolFailureKind.REJECTED,
                    timedOut ? APPROVAL_TIMEOUT_NOTICE : REJECTION_NOTICE));
            return Flux.just(new AgentEvent.CodeExecutionOutput(agentId, corrId, result.text(), result.images(),
                    false));
        }

        ToolResultMaterializer.Materialized materialized = materializer.materialize(result.text());
        AgentEvent.CodeExecutionOutput output = new AgentEvent.CodeExecutionOutput(agentId, corrId,
                materialized.content(), result.images(), materialized.overflowed());
        results.record(index, ToolResult.success(output.format()));
        return Flux.just(output);
    }

    private Flux<AgentEvent> executionFailed(int index, String corrId, Throwable error, RoundResults results) {
        String message = error instanceof TimeoutException
                ? "Execution timed out after " + settings.getExecutionTimeout().toSeconds() + "s"
                : describe(error);
        log.warn("[Exec] {} code action [{}] failed: {}", agentId, corrId, message);
        results.record(index, ToolResult.failure(ToolFailureKind.EXECUTION_FAILED, message));
        return Flux.just(
                new AgentEvent.CodeExecutionOutputChunk(agentId, corrId, message),
                new AgentEvent.CodeExecutionOutput(agentId, corrId, message, List.of(), false));
    }

    private Flux<AgentEvent> resetExecution(int index, String corrId, RoundResults results) {
        Mono<ToolResult> reset = Mono.usingWhen(
                executionLock.acquire(),
                permit -> executionSession.reset().thenReturn(ToolResult.success(RESET_SUCCESS)),
                permit -> Mono.fromRunnable(permit::release))
                .onErrorResume(e -> {
                    log.warn("[Exec] {} reset failed: {}", agentId, describe(e));
                    return Mono.just(ToolResult.failure(ToolFailureKind.EXECUTION_FAILED,
                            "Execution session reset failed: " + describe(e)));
                });
        return reset.map(result -> toolOutput(index, corrId, result, results)).flux();
    }

    // ==================== Delegation and tools ====================

    private Flux<AgentEvent> delegate(int index, Map<String, Object> args, String corrId, RoundResults results) {
        String prompt = stringArg(args, "prompt");
        int maxTurns = intArg(args, "max_turns", settings.getSubagentMaxTurns());
        return subagentRunner.run(prompt, maxTurns, corrId)
                .doOnNext(event -> {
                    if (event instanceof AgentEvent.ToolOutput output && agentId.equals(output.agentId())
                            && corrId.equals(output.corrId())) {
                        results.record(index, ToolResult.success(output.content()));
                    }
                });
    }

    private Flux<AgentEvent> callTool(int index, String name, Map<String, Object> args, String corrId,
            RoundResults results) {
        ToolCatalog.Binding binding = catalog.binding(name);
        return Mono.defer(() -> binding.connection().callTool(binding.toolName(), args))
                .map(text -> ToolResult.success(materializer.materialize(text).content()))
                .onErrorResume(e -> {
                    log.warn("[Dispatch] {} tool {} [{}] failed: {}", agentId, name, corrId, describe(e));
                    return Mono.just(ToolResult.failure(ToolFailureKind.EXECUTION_FAILED,
                            "Tool call failed: " + describe(e)));
                })
                .map(result -> toolOutput(index, corrId, result, results))
                .flux();
    }

    private AgentEvent toolOutput(int index, String corrId, ToolResult result, RoundResults results) {
        results.record(index, result);
        return new AgentEvent.ToolOutput(agentId, corrId, result.toModelText());
    }

    private static String stringArg(Map<String, Object> args, String key) {
        Object value = args.get(key);
        return value != null ? value.toString() : "";
    }

    private static int intArg(Map<String, Object> args, String key, int defaultValue) {
        Object value = args.get(key);
        if (value instanceof Number number) {
            return number.intValue();
        }
        if (value instanceof String text && !text.isBlank()) {
            try {
                return Integer.parseInt(text.trim());
            } catch (NumberFormatException e) {
                log.debug("[Dispatch] Ignoring non-numeric {}: {}", key, text);
            }
        }
        return defaultValue;
    }

    private static String describe(Throwable error) {
        return error.getMessage() != null ? error.getMessage() : error.getClass().getSimpleName();
    }

    /**
     * Active-time budget of one code action. Time spent waiting for a nested
     * approval moves the deadline forward.
     */
    private static final class ExecutionDeadline {
        private long deadlineNanos;

        private ExecutionDeadline(Duration budget) {
            this.deadlineNanos = System.nanoTime() + budget.toNanos();
        }

        private Mono<Long> expiry() {
            return Mono.defer(() -> Mono.delay(remaining()));
        }

        private Mono<Long> pausedUntil(CompletableFuture<Boolean> reply) {
            long pausedAt = System.nanoTime();
            return Mono.fromFuture(reply, true)
                    .onErrorReturn(Boolean.FALSE)
                    .then(Mono.defer(() -> {
                        extend(System.nanoTime() - pausedAt);
                        return Mono.delay(remaining());
                    }));
        }

        private synchronized void extend(long nanos) {
            deadlineNanos += nanos;
        }

        private synchronized Duration remaining() {
            return Duration.ofNanos(Math.max(0L, deadlineNanos - System.nanoTime()));
        }
    }

    private static final class CodeRun {
        private volatile ExecutionUpdate.Result result;
        private volatile ApprovalDecision denial;
    }
}
