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

/**
 * Why an action did not produce a normal result. None of these abort the
 * stream: the corresponding text is fed back to the model.
 */
public enum ToolFailureKind {
    /** The user declined the approval request. */
    REJECTED,
    /** No decision arrived within the approval timeout. */
    APPROVAL_TIMEOUT,
    /** The model named a tool that is not registered. */
    UNKNOWN_TOOL,
    /** The execution session or tool back-end failed. */
    EXECUTION_FAILED,
    /** The action was approved but its result was dropped because a sibling was rejected. */
    DISCARDED
}
