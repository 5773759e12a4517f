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
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;

/**
 * Item streamed by an execution session while running a code cell.
 */
public sealed interface ExecutionUpdate permits ExecutionUpdate.OutputChunk, ExecutionUpdate.ToolApproval,
        ExecutionUpdate.Result {

    /** Incremental output. */
    record OutputChunk(String text) implements ExecutionUpdate {
    }

    /**
     * The running code wants to call a tool. The session waits on {@code reply}
     * before proceeding.
     */
    record ToolApproval(String serverName, String toolName, Map<String, Object> toolArgs,
            CompletableFuture<Boolean> reply) implements ExecutionUpdate {

        public String qualifiedName() {
            return serverName + "_" + toolName;
        }
    }

    /** Aggregated output and produced artifacts. Always the last update. */
    record Result(String text, List<Path> images) implements ExecutionUpdate {

        public Result {
            images = images != null ? List.copyOf(images) : List.of();
        }
    }
}
