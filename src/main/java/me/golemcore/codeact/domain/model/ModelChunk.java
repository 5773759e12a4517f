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

import lombok.Builder;
import lombok.Data;

import java.util.List;

/**
 * Streaming unit returned by a model session. Deltas arrive first; the chunk
 * with {@code done = true} carries the action proposals of the step.
 */
@Data
@Builder
public class ModelChunk {

    private String thoughtsDelta;
    private String textDelta;
    private boolean done;
    private List<Message.ToolCall> toolCalls;

    public static ModelChunk text(String delta) {
        return ModelChunk.builder().textDelta(delta).build();
    }

    public static ModelChunk thoughts(String delta) {
        return ModelChunk.builder().thoughtsDelta(delta).build();
    }

    public static ModelChunk done(List<Message.ToolCall> toolCalls) {
        return ModelChunk.builder().done(true).toolCalls(toolCalls).build();
    }
}
