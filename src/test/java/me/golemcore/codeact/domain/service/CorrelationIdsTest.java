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

import org.junit.jupiter.api.Test;

import java.util.HashSet;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

class CorrelationIdsTest {

    @Test
    void shouldGenerateEightHexCorrelationIds() {
        String corrId = CorrelationIds.newCorrId();

        assertTrue(corrId.matches("[0-9a-f]{8}"), corrId);
    }

    @Test
    void shouldGenerateSubagentIdsWithPrefix() {
        String agentId = CorrelationIds.newSubagentId();

        assertTrue(agentId.matches("sub-[0-9a-f]{4}"), agentId);
    }

    @Test
    void shouldRarelyRepeatCorrelationIds() {
        Set<String> ids = new HashSet<>();
        for (int i = 0; i < 200; i++) {
            ids.add(CorrelationIds.newCorrId());
        }

        assertEquals(200, ids.size());
    }
}
