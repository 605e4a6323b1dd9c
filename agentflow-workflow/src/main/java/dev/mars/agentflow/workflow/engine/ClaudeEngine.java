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
 * Anthropic Claude Code CLI.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-08-21
 * @version 1.0
 */
public class ClaudeEngine extends BaseEngine {

    public static final String ID = "claude";

    static final String DEFAULT_VERSION = "2.1.39";
    static final String NPM_PACKAGE = "@anthropic-ai/claude-code";
    static final String MODEL_VARIABLE = "ANTHROPIC_MODEL";
    static final String MODEL_SETTINGS_KEY = "vars.AGENTFLOW_MODEL_AGENT_CLAUDE";

    static final List<String> BASELINE_TOOLS = List.of("Glob", "Grep", "LS", "Read", "Task", "TodoWrite");
    static final List<String> EDIT_TOOLS = List.of("Edit", "MultiEdit", "NotebookEdit", "Write");

    static final List<String> DOMAINS = List.of(
            "*.githubusercontent.com",
            "anthropic.com",
            "api.anthropic.com",
            "api.github.com",
            "codeload.github.com",
            "files.pythonhosted.org",
            "ghcr.io",
            "github.com",
            "host.docker.internal",
            "lfs.github.com",
            "objects.githubusercontent.com",
            "pypi.org",
            "raw.githubusercontent.com",
            "registry.npmjs.org",
            "sentry.io",
            "statsig.anthropic.com");

    public ClaudeEngine() {
        super(ID, "Claude Code", "Uses Claude Code with full MCP tool support and allow-listing", false);
    }

    @Override
    public String getDefaultVersion() {
        return DEFAULT_VERSION;
    }

    @Override
    public List<String> getRequiredSecrets() {
        return List.of("ANTHROPIC_API_KEY", "CLAUDE_CODE_OAUTH_TOKEN");
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
        return npmInstallSteps("Claude Code CLI", NPM_PACKAGE, version);
    }

    @Override
    public List<Step> getExecutionSteps(EngineContext context) {
        EngineConfig config = context.getConfig();
        List<String> command = new ArrayList<>();
        command.add(executable(context, "claude"));
        command.add("--print");
        config.getModel().ifPresent(model -> command.add("--model " + shellQuote(model)));
        config.getMaxTurns().ifPresent(turns -> command.add("--max-turns " + shellQuote(turns)));
        if (context.isMcpConfigured()) {
            command.add("--mcp-config " + RunnerPaths.MCP_CONFIG_FILE);
        }
        command.add("--allowed-tools " + shellQuote(String.join(",", allowedTools(context))));
        command.add("--permission-mode bypassPermissions");
        command.add("--verbose");
        command.add("--output-format stream-json");
        for (String arg : config.getArgs()) {
            command.add(shellQuote(arg));
        }
        command.add("\"$(cat " + RunnerPaths.PROMPT_FILE + ")\"");

        String script = "set -o pipefail\n"
                + String.join(" ", command) + " 2>&1 | tee " + RunnerPaths.AGENT_STDIO_LOG;

        Map<String, Object> env = agentEnvironment(context);
        env.put("DISABLE_TELEMETRY", "1");
        env.put("DISABLE_ERROR_REPORTING", "1");
        env.put("MCP_TIMEOUT", "120000");
        config.getMaxTurns().ifPresent(turns -> env.put("AGENTFLOW_MAX_TURNS", turns));
        putModelVariable(env, context, MODEL_VARIABLE);

        return List.of(Step.builder("Execute " + getDisplayName())
                .id(EXECUTION_STEP_ID)
                .run(script)
                .env(env)
                .build());
    }

    /**
     * Values for {@code --allowed-tools}, in lexical order.
     */
    static Set<String> allowedTools(EngineContext context) {
        ToolConfiguration tools = context.getTools();
        Set<String> allowed = new TreeSet<>(BASELINE_TOOLS);
        if (tools.isBashEnabled()) {
            if (tools.isBashUnrestricted()) {
                allowed.add("Bash");
            } else {
                for (String command : tools.getBashCommands()) {
                    allowed.add("Bash(" + command + ")");
                }
            }
        }
        if (tools.isEditEnabled()) {
            allowed.addAll(EDIT_TOOLS);
        }
        if (tools.isWebFetchEnabled()) {
            allowed.add("WebFetch");
        }
        if (tools.isWebSearchEnabled()) {
            allowed.add("WebSearch");
        }
        if (tools.getGitHub() != null) {
            addServer(allowed, ToolConfiguration.GITHUB, tools.getGitHub().getAllowed());
        }
        if (tools.getPlaywright() != null) {
            allowed.add("mcp__" + ToolConfiguration.PLAYWRIGHT);
        }
        for (McpServerConfig server : tools.getCustomServers().values()) {
            addServer(allowed, server.getName(), server.getAllowed());
        }
        if (context.isSafeOutputsEnabled()) {
            allowed.add("mcp__safeoutputs");
        }
        return allowed;
    }

    private static void addServer(Set<String> allowed, String server, List<String> tools) {
        if (tools.isEmpty() || tools.contains("*")) {
            allowed.add("mcp__" + server);
            return;
        }
        for (String tool : tools) {
            allowed.add("mcp__" + server + "__" + tool);
        }
    }
}
