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
import lombok.Singular;
import lombok.Value;

import java.time.Duration;
import java.util.List;

/**
 * Immutable per-instance configuration snapshot. Children receive the parent's
 * snapshot with delegation turned off.
 */
@Value
@Builder(toBuilder = true)
public class AgentSettings {

    String systemPrompt;

    /** Active execution budget per code action; {@code null} means unbounded. */
    Duration executionTimeout;

    /** How long an approval may stay pending; {@code null} means wait forever. */
    Duration approvalTimeout;

    @Builder.Default
    boolean subagentsEnabled = true;

    @Builder.Default
    int maxSubagents = 5;

    @Builder.Default
    int subagentMaxTurns = 10;

    @Builder.Default
    boolean persistenceEnabled = true;

    @Builder.Default
    boolean flushAfterAppend = false;

    @Builder.Default
    int inlineMaxBytes = 32768;

    @Builder.Default
    int previewLines = 10;

    @Singular
    List<McpServerConfig> mcpServers;

    /**
     * Settings for a delegated child: same model, instructions and tool servers,
     * without the delegation action.
     */
    public AgentSettings forSubagent() {
        return toBuilder().subagentsEnabled(false).build();
    }
}
