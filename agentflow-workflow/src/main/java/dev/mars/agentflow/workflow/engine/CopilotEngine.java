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

import dev.mars.agentflow.workflow.model.RunnerPaths;
import dev.mars.agentflow.workflow.model.Step;
import dev.mars.agentflow.workflow.tools.McpServerConfig;
import dev.mars.agentflow.workflow.tools.ToolConfiguration;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;

/**
 * GitHub Copilot CLI, the default engine.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-08-21
 * @version 1.0
 */
public class CopilotEngine extends BaseEngine {

    public static final String ID = "copilot";

    static final String DEFAULT_VERSION = "0.0.409";
    static final String NPM_PACKAGE = "@github/copilot";
    static final String SECRET = "COPILOT_GITHUB_TOKEN";
    static final String MODEL_VARIABLE = "COPILOT_MODEL";
    static final String MODEL_SETTINGS_KEY = "vars.AGENTFLOW_MODEL_AGENT_COPILOT";

    static final List<String> DOMAINS = List.of(
            "api.business.githubcopilot.com",
            "api.enterprise.githubcopilot.com",
            "api.github.com",
            "api.githubcopilot.com",
            "api.individual.githubcopilot.com",
            "github.com",
            "host.docker.internal",
            "raw.githubusercontent.com",
            "registry.npmjs.org",
            "telemetry.enterprise.githubcopilot.com");

    public CopilotEngine() {
        this(ID, "GitHub Copilot CLI", "Uses the GitHub Copilot CLI with MCP server support", false);
    }

    protected CopilotEngine(String id, String displayName, String description, boolean experimental) {
        super(id, displayName, description, experimental);
    }

    @Override
    public String getDefaultVersion() {
        return DEFAULT_VERSION;
    }

    @Override
    public List<String> getRequiredSecrets() {
        return List.of(SECRET);
    }

    @Override
    public List<String> getDefaultDomains() {
        return DOMAINS;
    }

    @Override
    public String getModelSettingsKey() {
        return MODEL_SETTINGS_KEY;
    }

    @Override
    protected List<Step> createInstallationSteps(String version) {
        return npmInstallSteps("GitHub Copilot CLI", NPM_PACKAGE, version);
    }

    @Override
    public List<Step> getExecutionSteps(EngineContext context) {
        EngineConfig config = context.getConfig();
        List<String> command = new ArrayList<>();
        command.add(executable(context, "copilot"));
        command.add("--add-dir " + RunnerPaths.ROOT);
        command.add("--log-level all");
        command.add("--log-dir " + RunnerPaths.AGENT_LOG_DIR);
        command.add("--disable-builtin-mcps");
        config.getModel().ifPresent(model -> command.add("--model " + shellQuote(model)));
        for (String tool : allowedTools(context)) {
            command.add("--allow-tool " + shellQuote(tool));
        }
        if (context.isMcpConfigured()) {
            command.add("--additional-mcp-config @" + RunnerPaths.MCP_CONFIG_FILE);
        }
        for (String arg : config.getArgs()) {
            command.add(shellQuote(arg));
        }
        command.add("--prompt \"$(cat " + RunnerPaths.PROMPT_FILE + ")\"");

        String script = "set -o pipefail\n"
                + String.join(" ", command) + " 2>&1 | tee " + RunnerPaths.AGENT_STDIO_LOG;

        Map<String, Object> env = agentEnvironment(context);
        env.put("XDG_CONFIG_HOME", "/home/runner");
        putModelVariable(env, context, MODEL_VARIABLE);

        return List.of(Step.builder("Execute " + getDisplayName())
                .id(EXECUTION_STEP_ID)
                .run(script)
                .env(env)
                .build());
    }

    /**
     * Values for {@code --allow-tool}, in lexical order. Unrestricted bash
     * allows the whole {@code shell} tool; MCP servers without an explicit
     * tool list are allowed as a whole.
     */
    static Set<String> allowedTools(EngineContext context) {
        ToolConfiguration tools = context.getTools();
        Set<String> allowed = new TreeSet<>();
        if (tools.isBashEnabled()) {
            if (tools.isBashUnrestricted()) {
                allowed.add("shell");
            } else {
                for (String command : tools.getBashCommands()) {
                    allowed.add("shell(" + command + ")");
                }
            }
        }
        if (tools.isEditEnabled()) {
            allowed.add("write");
        }
        if (tools.isWebFetchEnabled()) {
            allowed.add("web_fetch");
        }
        if (tools.getGitHub() != null) {
            addServer(allowed, ToolConfiguration.GITHUB, tools.getGitHub().getAllowed());
        }
        if (tools.getPlaywright() != null) {
            allowed.add(ToolConfiguration.PLAYWRIGHT);
        }
        for (McpServerConfig server : tools.getCustomServers().values()) {
            addServer(allowed, server.getName(), server.getAllowed());
        }
        if (context.isSafeOutputsEnabled()) {
            allowed.add("safeoutputs");
        }
        return allowed;
    }

    private static void addServer(Set<String> allowed, String server, List<String> tools) {
        if (tools.isEmpty() || tools.contains("*")) {
            allowed.add(server);
            return;
        }
        for (String tool : tools) {
            allowed.add(server + "(" + tool + ")");
        }
    }
}
