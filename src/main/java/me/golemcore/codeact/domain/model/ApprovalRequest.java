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


package me.golemcore.codeact.domain.model;

import me.golemcore.codeact.domain.exception.ApprovalAlreadyResolvedException;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.CompletableFuture;

/**
 * Request for approval of a proposed action, emitted before the action runs.
 *
 * <p>
 * The request embeds a one-shot resolution cell. The consumer resolves it with
 * {@link #approve(boolean)} exactly once; a second call throws
 * {@link ApprovalAlreadyResolvedException} and leaves the original decision
 * untouched. The producer suspends on {@link #approved()} or
 * {@link #decision()} until the cell is resolved.
 *
 * <p>
 * Nested approvals raised by running code carry {@code ptc = true} and share
 * the corrId of the code action that raised them.
 */
public final class ApprovalRequest implements AgentEvent {

    private final String agentId;
    private final String corrId;
    private final String toolName;
    private final Map<String, Object> toolArgs;
    private final boolean ptc;
    private final CompletableFuture<ApprovalDecision> resolution = new CompletableFuture<>();

    public ApprovalRequest(String agentId, String corrId, String toolName, Map<String, Object> toolArgs,
            boolean ptc) {
        this.agentId = agentId;
        this.corrId = corrId;
        this.toolName = toolName;
        this.toolArgs = toolArgs != null
                ? Collections.unmodifiableMap(new LinkedHashMap<>(toolArgs))
                : Map.of();
        this.ptc = ptc;
    }

    @Override
    public String agentId() {
        return agentId;
    }

    @Override
    public String corrId() {
        return corrId;
    }

    public String toolName() {
        return toolName;
    }

    public Map<String, Object> toolArgs() {
        return toolArgs;
    }

    /**
     * Whether this approval was raised by code calling a tool programmatically.
     */
    public boolean ptc() {
        return ptc;
    }

    /**
     * Resolves the request.
     *
     * @param decision
     *            {@code true} to let the action run, {@code false} to reject it
     * @throws ApprovalAlreadyResolvedException
     *             if the request was already approved, rejected, or expired
     */
    public void approve(boolean decision) {
        ApprovalDecision value = decision ? ApprovalDecision.APPROVED : ApprovalDecision.REJECTED;
        if (!resolution.complete(value)) {
            throw new ApprovalAlreadyResolvedException(toolName, corrId, resolution.join());
        }
    }

    /**
     * Future completing with {@code true} only if the request was approved.
     */
    public CompletableFuture<Boolean> approved() {
        return resolution.thenApply(ApprovalDecision.APPROVED::equals);
    }

    /**
     * Future completing with the full decision, distinguishing rejection from
     * expiry.
     */
    public CompletableFuture<ApprovalDecision> decision() {
        return resolution;
    }

    public boolean isResolved() {
        return resolution.isDone();
    }

    /**
     * Resolves the request without an external decision. Used on expiry and on
     * hard cancellation.
     *
     * @return {@code true} if this call resolved the request
     */
    public boolean resolveIfPending(ApprovalDecision decision) {
        return resolution.complete(decision);
    }

    @Override
    public <R> R accept(Visitor<R> visitor) {
        return visitor.visitApprovalRequest(this);
    }

    @Override
    public String toString() {
        return "ApprovalRequest{agentId=" + agentId + ", corrId=" + corrId + ", toolName=" + toolName
                + ", ptc=" + ptc + ", resolved=" + isResolved() + "}";
    }
}
