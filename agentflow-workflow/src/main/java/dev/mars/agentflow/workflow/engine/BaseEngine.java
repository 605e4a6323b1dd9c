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

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;

/**
 * Shared behaviour of the engine adapters: secret validation, npm based
 * installation and the environment every agent step receives.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-08-21
 * @version 1.0
 */
public abstract class BaseEngine implements AgenticEngine {

    public static final String EXECUTION_STEP_ID = "agentic_execution";

    static final String SETUP_NODE_ACTION = "actions/setup-node@v4";
    static final String NODE_VERSION = "24";

    private final String id;
    private final String displayName;
    private final String description;
    private final boolean experimental;

    protected BaseEngine(String id, String displayName, String description, boolean experimental) {
        this.id = Objects.requireNonNull(id, "Engine id cannot be null");
        this.displayName = displayName;
        this.description = description;
        this.experimental = experimental;
    }

    @Override
    public String getId() {
        return id;
    }

    @Override
    public String getDisplayName() {
        return displayName;
    }

    @Override
    public String getDescription() {
        return description;
    }

    @Override
    public boolean isExperimental() {
        return experimental;
    }

    @Override
    public String getModelSettingsKey() {
        return null;
    }

    /**
     * One step that fails the job unless at least one required secret is set.
     */
    @Override
    public List<Step> getSecretValidationSteps(EngineContext context) {
        List<String> secrets = getRequiredSecrets();
        if (secrets.isEmpty()) {
            return List.of();
        }
        StringBuilder condition = new StringBuilder();
        for (String secret : secrets) {
            if (condition.length() > 0) {
                condition.append(" && ");
            }
            condition.append("[ -z \"$").append(secret).append("\" ]");
        }
        String names = String.join(" or ", secrets);
        String script = "if " + condition + "; then\n"
                + "  echo \"::error::" + names + " must be configured as a repository secret for the "
                + getDisplayName() + " engine\"\n"
                + "  exit 1\n"
                + "fi\n"
                + "echo \"" + names + " is configured\"";
        Step.Builder step = Step.builder("Validate " + names + " secret").run(script);
        for (String secret : secrets) {
            step.env(secret, "${{ secrets." + secret + " }}");
        }
        return List.of(step.build());
    }

    @Override
    public final List<Step> getInstallationSteps(EngineContext context) {
        if (context.getConfig().getCommand().isPresent()) {
            return List.of();
        }
        return createInstallationSteps(context.getConfig().getVersion().orElse(getDefaultVersion()));
    }

    /**
     * Steps that install the given CLI version.
     */
    protected abstract List<Step> createInstallationSteps(String version);

    protected static List<Step> npmInstallSteps(String displayName, String npmPackage, String version) {
        List<Step> steps = new ArrayList<>();
        steps.add(Step.builder("Setup Node.js")
                .uses(SETUP_NODE_ACTION)
                .with("node-version", NODE_VERSION)
                .with("package-manager-cache", false)
                .build());
        steps.add(Step.builder("Install " + displayName)
                .run("npm install -g --silent " + npmPackage + "@" + version)
                .build());
        return steps;
    }

    /**
     * The executable to run: {@code engine.command} when set, else the default.
     */
    protected static String executable(EngineContext context, String defaultCommand) {
        return context.getConfig().getCommand().orElse(defaultCommand);
    }

    /**
     * Environment shared by every agent step. Engine {@code env} entries win
     * over the generated ones.
     */
    protected Map<String, Object> agentEnvironment(EngineContext context) {
        Map<String, Object> env = new TreeMap<>();
        env.put("AGENTFLOW_PROMPT", RunnerPaths.PROMPT_FILE);
        env.put("AGENTFLOW_ALLOWED_DOMAINS", String.join(",", context.getAllowedDomains()));
        if (context.isMcpConfigured()) {
            env.put("AGENTFLOW_MCP_CONFIG", RunnerPaths.MCP_CONFIG_FILE);
        }
        if (context.isSafeOutputsEnabled()) {
            env.put("AGENTFLOW_SAFE_OUTPUTS", RunnerPaths.SAFE_OUTPUTS_FILE);
        }
        for (String secret : getRequiredSecrets()) {
            env.put(secret, "${{ secrets." + secret + " }}");
        }
        env.putAll(context.getConfig().getEnv());
        return env;
    }

    /**
     * Adds the model variable: unset when a model is configured, otherwise read
     * from the repository variable named by {@link #getModelSettingsKey()}.
     */
    protected void putModelVariable(Map<String, Object> env, EngineContext context, String variable) {
        if (context.getConfig().getModel().isEmpty() && getModelSettingsKey() != null) {
            env.putIfAbsent(variable, "${{ " + getModelSettingsKey() + " || '' }}");
        }
    }

    /**
     * Quotes a value for a POSIX shell command line.
     */
    protected static String shellQuote(String value) {
        if (value.matches("[A-Za-z0-9_@%+=:,./-]+")) {
            return value;
        }
        return "'" + value.replace("'", "'\\''") + "'";
    }

    @Override
    public String toString() {
        return getClass().getSimpleName() + "{id='" + id + "'}";
    }
}
