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


package me.golemcore.codeact.adapter.outbound.mcp;

import me.golemcore.codeact.domain.model.McpServerConfig;
import me.golemcore.codeact.port.outbound.ToolConnection;
import me.golemcore.codeact.port.outbound.ToolConnectionFactory;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

/**
 * Creates one MCP client per server and agent instance. Clients are started by
 * the owning instance's resource supervisor.
 */
@Component
@RequiredArgsConstructor
public class McpClientFactory implements ToolConnectionFactory {

    private final ObjectMapper objectMapper;

    @Override
    public ToolConnection create(McpServerConfig config) {
        return new McpClient(config, objectMapper);
    }
}
