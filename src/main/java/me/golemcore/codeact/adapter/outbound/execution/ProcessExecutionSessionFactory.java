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


package me.golemcore.codeact.adapter.outbound.execution;

import me.golemcore.codeact.domain.model.AgentSettings;
import me.golemcore.codeact.infrastructure.config.CodeActProperties;
import me.golemcore.codeact.port.outbound.ExecutionSession;
import me.golemcore.codeact.port.outbound.ExecutionSessionFactory;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.UUID;

/**
 * Creates process-backed execution sessions, each with its own directory under
 * {@code codeact.execution.workspace-path}.
 */
@Component
@RequiredArgsConstructor
public class ProcessExecutionSessionFactory implements ExecutionSessionFactory {

    private final CodeActProperties properties;

    @Override
    public ExecutionSession create(String agentId, AgentSettings settings) {
        CodeActProperties.ExecutionProperties execution = properties.getExecution();
        Path root = Paths.get(execution.getWorkspacePath().replace("${user.home}", System.getProperty("user.home")))
                .toAbsolutePath().normalize();
        String directory = agentId + "-" + UUID.randomUUID().toString().substring(0, 8);
        return new ProcessExecutionSession(agentId, execution.getCommand(), root.resolve(directory));
    }
}
