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

import me.golemcore.codeact.domain.model.ApprovalDecision;
import me.golemcore.codeact.domain.model.ApprovalRequest;
import lombok.extern.slf4j.Slf4j;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.TimeoutException;

/**
 * Creates approval requests for one agent instance and suspends actions until
 * they are resolved.
 *
 * <p>
 * Creating a request never blocks, so it can be emitted before anyone waits on
 * it. {@link #await(ApprovalRequest)} completes with the decision; if an
 * approval timeout is configured and expires first, the request is resolved as
 * {@link ApprovalDecision#TIMED_OUT} and a late {@code approve()} fails like any
 * second resolution.
 */
@Slf4j
public class ApprovalGate {

    private final Duration approvalTimeout;
    private final Set<ApprovalRequest> pending = ConcurrentHashMap.newKeySet();

    /**
     * @param approvalTimeout
     *            maximum wait per request, or {@code null} to wait indefinitely
     */
    public ApprovalGate(Duration approvalTimeout) {
        this.approvalTimeout = approvalTimeout;
    }

    public ApprovalRequest request(String agentId, String corrId, String toolName, Map<String, Object> toolArgs,
            boolean ptc) {
        ApprovalRequest request = new ApprovalRequest(agentId, corrId, toolName, toolArgs, ptc);
        pending.add(request);
        log.debug("[Approval] {} requested approval for {} [{}]{}", agentId, toolName, corrId,
                ptc ? " (programmatic)" : "");
        return request;
    }

    public Mono<ApprovalDecision> await(ApprovalRequest request) {
        Mono<ApprovalDecision> decision = Mono.fromFuture(request.decision(), true);
        if (approvalTimeout != null) {
            decision = decision
                    .timeout(approvalTimeout)
                    .onErrorResume(TimeoutException.class, e -> {
                        if (request.resolveIfPending(ApprovalDecision.TIMED_OUT)) {
                            log.warn("[Approval] {} approval for {} [{}] timed out after {}", request.agentId(),
                                    request.toolName(), request.corrId(), approvalTimeout);
                        }
                        return Mono.fromFuture(request.decision(), true);
                    });
        }
        return decision
                .doOnNext(value -> log.debug("[Approval] {} [{}] resolved: {}", request.toolName(),
                        request.corrId(), value))
                .doFinally(signal -> pending.remove(request));
    }

    /**
     * Resolves every pending request as rejected.
     *
     * @return number of requests this call resolved
     */
    public int rejectAllPending() {
        int rejected = 0;
        for (ApprovalRequest request : Set.copyOf(pending)) {
            if (request.resolveIfPending(ApprovalDecision.REJECTED)) {
                rejected++;
            }
            pending.remove(request);
        }
        if (rejected > 0) {
            log.info("[Approval] Rejected {} pending approval(s)", rejected);
        }
        return rejected;
    }

    public int pendingCount() {
        return pending.size();
    }
}
