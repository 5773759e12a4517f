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


package me.golemcore.codeact;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

/**
 * Main application class for the GolemCore code-action engine.
 *
 * <p>
 * The engine runs turns of a code-action agent: a model proposes code cells
 * and tool calls, each one is gated by an approval, executed, and fed back
 * until the model answers without proposals.
 *
 * <h2>Architecture</h2>
 * <p>
 * Hexagonal architecture (Ports & Adapters):
 *
 * <pre>
 * Domain Layer       → AgentInstance, TurnLoop, ApprovalGate, SubagentRunner, SessionStore
 * Ports              → ModelSession, ExecutionSession, ToolConnection, StoragePort
 * Infrastructure     → langchain4j, process execution, MCP, local storage adapters
 * </pre>
 *
 * <h2>Configuration</h2>
 * <p>
 * All configuration via {@code application.properties} under {@code codeact.*}
 * prefix.
 */
@SpringBootApplication
@ConfigurationPropertiesScan
public class CodeActApplication {

    public static void main(String[] args) {
        SpringApplication.run(CodeActApplication.class, args);
    }

}
