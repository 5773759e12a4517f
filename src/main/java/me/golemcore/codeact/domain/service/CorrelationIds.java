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

import java.util.UUID;

/**
 * Generates short random identifiers for event correlation and subagents.
 */
public final class CorrelationIds {

    private CorrelationIds() {
    }

    /**
     * 8 hex characters linking an event family.
     */
    public static String newCorrId() {
        return randomHex(8);
    }

    /**
     * {@code sub-} followed by 4 hex characters.
     */
    public static String newSubagentId() {
        return "sub-" + randomHex(4);
    }

    static String randomHex(int length) {
        return UUID.randomUUID().toString().replace("-", "").substring(0, length);
    }
}
