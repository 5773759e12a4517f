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


package me.golemcore.codeact.testsupport;

import me.golemcore.codeact.domain.agent.AgentInstanceFactory;
import me.golemcore.codeact.domain.model.AgentSettings;
import me.golemcore.codeact.domain.model.McpServerConfig;
import me.golemcore.codeact.domain.service.SessionStore;
import me.golemcore.codeact.domain.service.SessionStoreFactory;
import me.golemcore.codeact.infrastructure.config.AgentConfiguration;
import me.golemcore.codeact.infrastructure.config.CodeActProperties;
import me.golemcore.codeact.port.outbound.ExecutionSessionFactory;
import me.golemcore.codeact.port.outbound.ModelSessionFactory;
import me.golemcore.codeact.port.outbound.ToolConnectionFactory;

import java.time.Clock;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentLinkedDeque;
import java.util.function.Consumer;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

/**
 * Real {@link AgentInstanceFactory} over mocked session factories that hand out
 * fakes: the root gets {@link #mainModel()}, each subagent the next scripted
 * child model.
 */
public class AgentHarness {

    private final FakeModelSession mainModel;
    private final ConcurrentLinkedDeque<FakeModelSession> childModels = new ConcurrentLinkedDeque<>();
    private final List<FakeModelSession> spawnedChildren = Collections.synchronizedList(new ArrayList<>());
    private final Map<String, FakeExecutionSession> executions = new ConcurrentHashMap<>();
    private final List<String> lifecycle = Collections.synchronizedList(new ArrayList<>());
    private final InMemoryStoragePort storage = new InMemoryStoragePort();
    private final CodeActProperties properties = new CodeActProperties();
    private final AgentInstanceFactory factory;
    private volatile Consumer<FakeExecutionSession> executionSetup = session -> {
    };
    private volatile Consumer<FakeToolConnection> toolSetup = connection -> {
    };

    public AgentHarness() {
        mainModel = new FakeModelSession("model").recordLifecycleTo(lifecycle);

        ModelSessionFactory models = mock(ModelSessionFactory.class);
        when(models.create(anyString(), any(AgentSettings.class))).thenAnswer(invocation -> {
            String agentId = invocation.getArgument(0);
            if ("main".equals(agentId)) {
                return mainModel;
            }
            FakeModelSession child = childModels.pollFirst();
            if (child == null) {
                child = new FakeModelSession("model").thenRespond("");
            }
            spawnedChildren.add(child);
            return child;
        });

        ExecutionSessionFactory executionFactory = mock(ExecutionSessionFactory.class);
        when(executionFactory.create(anyString(), any(AgentSettings.class))).thenAnswer(invocation -> {
            FakeExecutionSession session = new FakeExecutionSession();
            if ("main".equals(invocation.getArgument(0))) {
                session.recordLifecycleTo(lifecycle);
            }
            executionSetup.accept(session);
            executions.put(invocation.getArgument(0), session);
            return session;
        });

        ToolConnectionFactory tools = mock(ToolConnectionFactory.class);
        when(tools.create(any(McpServerConfig.class))).thenAnswer(invocation -> {
            McpServerConfig config = invocation.getArgument(0);
            FakeToolConnection connection = new FakeToolConnection(config.getName()).recordLifecycleTo(lifecycle);
            toolSetup.accept(connection);
            return connection;
        });

        SessionStoreFactory stores = new SessionStoreFactory(storage, AgentConfiguration.objectMapper(),
                Clock.systemUTC(), properties);
        factory = new AgentInstanceFactory(models, executionFactory, tools, stores, Clock.systemUTC());
    }

    public AgentInstanceFactory factory() {
        return factory;
    }

    public FakeModelSession mainModel() {
        return mainModel;
    }

    public FakeModelSession addChild() {
        FakeModelSession child = new FakeModelSession("model");
        childModels.addLast(child);
        return child;
    }

    public List<FakeModelSession> spawnedChildren() {
        return List.copyOf(spawnedChildren);
    }

    public FakeExecutionSession execution(String agentId) {
        return executions.get(agentId);
    }

    public void onEachExecution(Consumer<FakeExecutionSession> setup) {
        this.executionSetup = setup;
    }

    public void onEachToolConnection(Consumer<FakeToolConnection> setup) {
        this.toolSetup = setup;
    }

    public List<String> lifecycle() {
        return List.copyOf(lifecycle);
    }

    public InMemoryStoragePort storage() {
        return storage;
    }

    public SessionStore sessionStore(String sessionId) {
        return new SessionStore(storage, AgentConfiguration.objectMapper(), Clock.systemUTC(), "sessions", sessionId,
                false);
    }
}
