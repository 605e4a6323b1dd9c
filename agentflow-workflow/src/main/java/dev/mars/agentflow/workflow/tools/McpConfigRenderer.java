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

package dev.mars.agentflow.workflow.tools;

import dev.mars.agentflow.workflow.emit.JsonSupport;
import dev.mars.agentflow.workflow.model.RunnerPaths;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;

/**
 * Builds the MCP servers file handed to the agent CLI.
 *
 * <p>Built-in servers read their credentials from environment placeholders
 * such as {@code ${GITHUB_MCP_SERVER_TOKEN}}; the setup step exports the
 * matching variables so no secret value is written into the file.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-08-21
 * @version 1.0
 */
public class McpConfigRenderer {

    public static final String SAFE_OUTPUTS_SERVER = "safeoutputs";
    public static final String GITHUB_TOKEN_VARIABLE = "GITHUB_MCP_SERVER_TOKEN";

    static final String GITHUB_MCP_IMAGE = "ghcr.io/github/github-mcp-server";

    private final String actionsDirectory;

    public McpConfigRenderer(String actionsDirectory) {
        this.actionsDirectory = Objects.requireNonNull(actionsDirectory, "Actions directory cannot be null");
    }

    /**
     * @return every server the agent will see, keyed and ordered by name
     */
    public Map<String, McpServerConfig> servers(ToolConfiguration tools, boolean safeOutputs) {
        Map<String, McpServerConfig> servers = new TreeMap<>(tools.getCustomServers());
        if (tools.getGitHub() != null) {
            servers.put(ToolConfiguration.GITHUB, githubServer(tools.getGitHub()));
        }
        if (tools.getPlaywright() != null) {
            servers.put(ToolConfiguration.PLAYWRIGHT, playwrightServer(tools.getPlaywright()));
        }
        if (safeOutputs) {
            servers.put(SAFE_OUTPUTS_SERVER, McpServerConfig.builder(SAFE_OUTPUTS_SERVER)
                    .command("node")
                    .args(List.of(actionsDirectory + "/safeoutputs/mcp-server.cjs"))
                    .env("AGENTFLOW_SAFE_OUTPUTS", "${AGENTFLOW_SAFE_OUTPUTS}")
                    .env("AGENTFLOW_SAFE_OUTPUTS_CONFIG_PATH", RunnerPaths.SAFE_OUTPUTS_CONFIG_FILE)
                    .build());
        }
        return servers;
    }

    /**
     * Renders {@code {"mcpServers": {...}}} as pretty JSON with sorted keys.
     */
    public String render(ToolConfiguration tools, boolean safeOutputs) {
        Map<String, Object> servers = new TreeMap<>();
        servers(tools, safeOutputs).forEach((name, server) -> servers.put(name, server.toJsonMap()));
        return JsonSupport.toPrettyJson(Map.of("mcpServers", servers));
    }

    private static McpServerConfig githubServer(ToolConfiguration.GitHubTool github) {
        List<String> args = new ArrayList<>(List.of("run", "-i", "--rm",
                "-e", "GITHUB_PERSONAL_ACCESS_TOKEN",
                "-e", "GITHUB_READ_ONLY",
                "-e", "GITHUB_TOOLSETS",
                GITHUB_MCP_IMAGE + ":" + github.getVersion()));
        return McpServerConfig.builder(ToolConfiguration.GITHUB)
                .command("docker")
                .args(args)
                .env("GITHUB_PERSONAL_ACCESS_TOKEN", "${" + GITHUB_TOKEN_VARIABLE + "}")
                .env("GITHUB_READ_ONLY", github.isReadOnly() ? "1" : "0")
                .env("GITHUB_TOOLSETS", String.join(",", github.getToolsets()))
                .allowed(github.getAllowed())
                .build();
    }

    private static McpServerConfig playwrightServer(ToolConfiguration.PlaywrightTool playwright) {
        return McpServerConfig.builder(ToolConfiguration.PLAYWRIGHT)
                .command("npx")
                .args(List.of("@playwright/mcp@" + playwright.getVersion(),
                        "--output-dir", "/tmp/agentflow/mcp-logs/playwright",
                        "--allowed-hosts", String.join(";", playwright.getAllowedDomains())))
                .build();
    }
}
