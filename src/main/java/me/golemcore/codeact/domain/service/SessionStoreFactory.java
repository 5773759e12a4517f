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

import me.golemcore.codeact.infrastructure.config.CodeActProperties;
import me.golemcore.codeact.port.outbound.StoragePort;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;

import java.time.Clock;

/**
 * Opens the session store of a session id. Parent and subagents of one session
 * share the directory and write separate files.
 */
@Service
@RequiredArgsConstructor
public class SessionStoreFactory {

    private final StoragePort storagePort;
    private final ObjectMapper objectMapper;
    private final Clock clock;
    private final CodeActProperties properties;

    public SessionStore open(String sessionId) {
        CodeActProperties.StorageProperties storage = properties.getStorage();
        return new SessionStore(storagePort, objectMapper, clock, storage.getSessionsDirectory(), sessionId,
                storage.isFlushAfterAppend());
    }
}
