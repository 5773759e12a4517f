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
import me.golemcore.codeact.domain.model.ToolResult;

/**
 * Result of one dispatched proposal, paired with the call that produced it.
 *
 * @param toolCallId
 *            the originating tool call ID
 * @param toolName
 *            the tool name
 * @param toolResult
 *            the result fed back to the model
 */
public record ActionOutcome(String toolCallId, String toolName, ToolResult toolResult) {

    public static ActionOutcome of(Message.ToolCall call, ToolResult result) {
        return new ActionOutcome(call.getId(), call.getName(), result);
    }

    public String messageContent() {
        return toolResult.toModelText();
    }
}
