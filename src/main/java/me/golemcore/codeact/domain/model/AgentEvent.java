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

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Event emitted on an agent stream.
 *
 * <p>
 * Every event carries the {@code agentId} of the instance that produced it
 * ({@code "main"} for the root, {@code "sub-xxxx"} for subagents) and a
 * {@code corrId} linking streamed chunks to their terminal event. A chunk
 * family for a given corrId is closed by exactly one terminal event:
 * <ul>
 * <li>{@link ThoughtsChunk}* → {@link Thoughts}
 * <li>{@link ResponseChunk}* → {@link Response}
 * <li>{@link ApprovalRequest} → {@link CodeExecutionOutputChunk}* →
 * {@link CodeExecutionOutput} (code actions)
 * <li>{@link ApprovalRequest} → {@link ToolOutput} (tool calls, resets,
 * delegations)
 * </ul>
 * The approval families close only for approved proposals. A proposal that is
 * rejected or whose approval expires leaves its {@link ApprovalRequest} as the
 * only event of its corrId; the turn then ends with a {@link Response} carrying
 * the rejection notice under a fresh corrId. A proposal naming an unknown tool
 * emits no event at all; its outcome only reaches the model.
 *
 * <p>
 * The hierarchy is closed. JDK 17 has no pattern switch, so consumers that must
 * handle every variant go through {@link #accept(Visitor)}.
 */
public sealed interface AgentEvent permits AgentEvent.ResponseChunk, AgentEvent.Response,
        AgentEvent.ThoughtsChunk, AgentEvent.Thoughts, ApprovalRequest, AgentEvent.CodeExecutionOutputChunk,
        AgentEvent.CodeExecutionOutput, AgentEvent.ToolOutput {

    String agentId();

    String corrId();

    <R> R accept(Visitor<R> visitor);

    /**
     * Exhaustive handler over all event variants.
     */
    interface Visitor<R> {

        R visitResponseChunk(ResponseChunk event);

        R visitResponse(Response event);

        R visitThoughtsChunk(ThoughtsChunk event);

        R visitThoughts(Thoughts event);

        R visitApprovalRequest(ApprovalRequest event);

        R visitCodeExecutionOutputChunk(CodeExecutionOutputChunk event);

        R visitCodeExecutionOutput(CodeExecutionOutput event);

        R visitToolOutput(ToolOutput event);
    }

    /** Partial model response text. */
    record ResponseChunk(String agentId, String corrId, String content) implements AgentEvent {

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitResponseChunk(this);
        }
    }

    /** Complete model response text of one model step. */
    record Response(String agentId, String corrId, String content) implements AgentEvent {

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitResponse(this);
        }
    }

    /** Partial model thinking text. */
    record ThoughtsChunk(String agentId, String corrId, String content) implements AgentEvent {

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitThoughtsChunk(this);
        }
    }

    /** Complete model thinking text of one model step. */
    record Thoughts(String agentId, String corrId, String content) implements AgentEvent {

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitThoughts(this);
        }
    }

    /** Partial output of a running code action. */
    record CodeExecutionOutputChunk(String agentId, String corrId, String text) implements AgentEvent {

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitCodeExecutionOutputChunk(this);
        }
    }

    /**
     * Final output of a code action.
     *
     * @param text
     *            aggregated output, may be {@code null} when the code printed
     *            nothing
     * @param images
     *            artifact paths produced by the execution session
     * @param truncated
     *            whether {@code text} was replaced by an overflow notice
     */
    record CodeExecutionOutput(String agentId, String corrId, String text, List<Path> images,
            boolean truncated) implements AgentEvent {

        public CodeExecutionOutput {
            images = images != null ? List.copyOf(images) : List.of();
        }

        /**
         * Formats the output as tool-result text, appending one markdown image link
         * per produced artifact.
         */
        public String format() {
            List<String> parts = new ArrayList<>();
            if (text != null && !text.isEmpty()) {
                parts.add(text);
            }
            for (Path image : images) {
                parts.add("![Image](" + image + ")");
            }
            return String.join("\n", parts);
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitCodeExecutionOutput(this);
        }
    }

    /**
     * Output of a tool call, an execution reset, or a delegation. A delegation's
     * final text is reported here under the delegating agent's id.
     */
    record ToolOutput(String agentId, String corrId, String content) implements AgentEvent {

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitToolOutput(this);
        }
    }
}
