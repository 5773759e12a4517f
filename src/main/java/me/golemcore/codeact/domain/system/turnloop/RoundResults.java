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

import me.golemcore.codeact.domain.model.ToolFailureKind;
import me.golemcore.codeact.domain.model.ToolResult;

import java.util.concurrent.atomic.AtomicReference;
import java.util.concurrent.atomic.AtomicReferenceArray;

/**
 * Results of one fan-out round, indexed by proposal position. Written
 * concurrently by the dispatched actions.
 *
 * <p>
 * The first rejected or expired approval truncates the round; later results
 * are still recorded so every proposal has a paired result.
 */
public class RoundResults {

    private final AtomicReferenceArray<ToolResult> results;
    private final AtomicReference<ToolFailureKind> truncation = new AtomicReference<>();

    public RoundResults(int size) {
        this.results = new AtomicReferenceArray<>(size);
    }

    public void record(int index, ToolResult result) {
        results.set(index, result);
        if (result.isTruncating()) {
            truncation.compareAndSet(null, result.getFailureKind());
        }
    }

    public ToolResult get(int index) {
        return results.get(index);
    }

    public int size() {
        return results.length();
    }

    public boolean isTruncated() {
        return truncation.get() != null;
    }

    /**
     * Failure kind of the approval that truncated the round, or {@code null}.
     */
    public ToolFailureKind truncation() {
        return truncation.get();
    }
}
