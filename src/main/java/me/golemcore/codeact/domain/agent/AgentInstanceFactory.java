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


package me.golemcore.codeact.domain.agent;

import me.golemcore.codeact.domain.model.AgentSettings;
import me.golemcore.codeact.domain.model.McpServerConfig;
import me.golemcore.codeact.domain.service.ApprovalGate;
import me.golemcore.codeact.domain.service.CorrelationIds;
import me.golemcore.codeact.domain.service.SessionStore;
import me.golemcore.codeact.domain.service.SessionStoreFactory;
import me.golemcore.codeact.domain.service.ToolResultMaterializer;
import me.golemcore.codeact.domain.system.subagent.SubagentRunner;
import me.golemcore.codeact.domain.system.turnloop.DefaultHistoryWriter;
import me.golemcore.codeact.port.outbound.ExecutionSessionFactory;
import me.golemcore.codeact.port.outbound.ModelSessionFactory;
import me.golemcore.codeact.port.outbound.ToolConnection;
import me.golemcore.codeact.port.outbound.ToolConnectionFactory;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

/**
 * Assembles agent instances. Every instance gets fresh sessions and tool
 * connections; a subagent shares only configuration and the session id of its
 * parent.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class AgentInstanceFactory {

    private final ModelSessionFactory modelSessionFactory;
    private final ExecutionSessionFactory executionSessionFactory;
    private final ToolConnectionFactory toolConnectionFactory;
    private final SessionStoreFactory sessionStoreFactory;
    private final Clock clock;

    /**
     * Creates the root instance.
     *
     * @param sessionId
     *            session to resume, or {@code null} to start a new one
     * @throws IllegalArgumentException
     *             if a session id is given while persistence is disabled
     */
    public AgentInstance createMain(AgentSettings settings, String sessionId) {
        if (!settings.isPersistenceEnabled() && sessionId != null) {
            throw new IllegalArgumentException("Session id " + sessionId + " given but persistence is disabled");
        }
        String effectiveSessionId = null;
        if (settings.isPersistenceEnabled()) {
            effectiveSessionId = sessionId != null ? sessionId : UUID.randomUUID().toString();
        }
        return create(AgentInstance.MAIN_AGENT_ID, settings, effectiveSessionId);
    }

    /**
     * Creates a child for a delegation: new {@code sub-xxxx} id, delegation
     * disabled, same session id.
     */
    public AgentInstance createSubagent(AgentSettings parentSettings, String sessionId) {
        return create(CorrelationIds.newSubagentId(), parentSettings.forSubagent(), sessionId);
    }

    private AgentInstance create(String agentId, AgentSettings settings, String sessionId) {
        SessionStore sessionStore = sessionId != null ? sessionStoreFactory.open(sessionId) : null;
        ToolResultMaterializer materializer = new ToolResultMaterializer(sessionStore, settings.getInlineMaxBytes(),
                settings.getPreviewLines());

        List<ToolConnection> toolConnections = new ArrayList<>();
        for (McpServerConfig server : settings.getMcpServers()) {
            toolConnections.add(toolConnectionFactory.create(server));
        }

        SubagentRunner subagentRunner = settings.isSubagentsEnabled()
                ? new SubagentRunner(agentId, settings, sessionId, this, materializer)
                : null;

        log.debug("[Agent] Assembling {} with {} tool server(s)", agentId, toolConnections.size());
        return AgentInstance.builder()
                .agentId(agentId)
                .sessionId(sessionId)
                .settings(settings)
                .modelSession(modelSessionFactory.create(agentId, settings))
                .executionSession(executionSessionFactory.create(agentId, settings))
                .toolConnections(toolConnections)
                .approvalGate(new ApprovalGate(settings.getApprovalTimeout()))
                .historyWriter(new DefaultHistoryWriter(agentId, sessionStore, clock))
                .sessionStore(sessionStore)
                .materializer(materializer)
                .subagentRunner(subagentRunner)
                .build();
    }
}
