/*
 * Copyright 2025 Mark Andrew Ray-Smith Cityline Ltd
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
 */

package dev.mars.agentflow.workflow.engine;

import dev.mars.agentflow.workflow.tools.ToolConfiguration;

import java.util.List;
import java.util.Objects;

/**
 * Everything an engine adapter needs to produce its steps. Built once per
 * compile after the engine has been selected.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-08-21
 * @version 1.0
 */
public final class EngineContext {

    private final EngineConfig config;
    private final ToolConfiguration tools;
    private final List<String> allowedDomains;
    private final boolean mcpConfigured;
    private final boolean safeOutputsEnabled;

    public EngineContext(EngineConfig config, ToolConfiguration tools, List<String> allowedDomains,
                         boolean mcpConfigured, boolean safeOutputsEnabled) {
        this.config = Objects.requireNonNull(config, "Engine config cannot be null");
        this.tools = Objects.requireNonNull(tools, "Tool configuration cannot be null");
        this.allowedDomains = List.copyOf(allowedDomains);
        this.mcpConfigured = mcpConfigured;
        this.safeOutputsEnabled = safeOutputsEnabled;
    }

    public EngineConfig getConfig() {
        return config;
    }

    public ToolConfiguration getTools() {
        return tools;
    }

    public List<String> getAllowedDomains() {
        return allowedDomains;
    }

    /**
     * @return true when an MCP configuration file is written before the agent runs
     */
    public boolean isMcpConfigured() {
        return mcpConfigured;
    }

    public boolean isSafeOutputsEnabled() {
        return safeOutputsEnabled;
    }
}
