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

package dev.mars.agentflow.workflow.jobs;

import dev.mars.agentflow.config.CompilerConfiguration;
import dev.mars.agentflow.permissions.Permissions;
import dev.mars.agentflow.workflow.engine.AgenticEngine;
import dev.mars.agentflow.workflow.engine.EngineContext;
import dev.mars.agentflow.workflow.merge.BodyComposition;
import dev.mars.agentflow.workflow.merge.EffectiveConfiguration;
import dev.mars.agentflow.workflow.model.ActionPins;
import dev.mars.agentflow.workflow.model.Job;
import dev.mars.agentflow.workflow.model.RunnerPaths;
import dev.mars.agentflow.workflow.model.Step;
import dev.mars.agentflow.workflow.parser.Frontmatter;
import dev.mars.agentflow.workflow.parser.FrontmatterFields;
import dev.mars.agentflow.workflow.parser.YamlSupport;
import dev.mars.agentflow.workflow.safeoutputs.SafeOutputsWiring;
import dev.mars.agentflow.workflow.tools.McpConfigRenderer;
import dev.mars.agentflow.workflow.tools.ToolConfiguration;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Builds the job that runs the agent.
 *
 * <p>Step order: setup, checkout, author {@code steps}, secret validation,
 * engine installation, safe-outputs configuration, MCP configuration, prompt
 * creation, runtime import resolution, engine execution, author
 * {@code post-steps}, and finally output collection.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-08-23
 * @version 1.0
 */
public class AgentJobBuilder {
    private static final Logger logger = LoggerFactory.getLogger(AgentJobBuilder.class);

    public static final String JOB_ID = "agent";

    static final String PROMPT_EOF = "AGENTFLOW_PROMPT_EOF";
    static final String MCP_CONFIG_EOF = "AGENTFLOW_MCP_CONFIG_EOF";
    static final String DEFAULT_GITHUB_TOKEN = "${{ secrets.AGENTFLOW_GITHUB_TOKEN || secrets.GITHUB_TOKEN }}";

    private final CompilerConfiguration configuration;
    private final EffectiveConfiguration effective;
    private final AgenticEngine engine;
    private final EngineContext engineContext;
    private ToolConfiguration tools = ToolConfiguration.none();
    private SafeOutputsWiring safeOutputs;
    private Permissions permissions = Permissions.readAll();
    private BodyComposition bodyComposition = BodyComposition.REFERENCE;
    private String activationCondition;
    private String trialRepository;
    private Object runsOn;

    public AgentJobBuilder(CompilerConfiguration configuration, EffectiveConfiguration effective,
                           AgenticEngine engine, EngineContext engineContext) {
        this.configuration = Objects.requireNonNull(configuration, "Configuration cannot be null");
        this.effective = Objects.requireNonNull(effective, "Effective configuration cannot be null");
        this.engine = Objects.requireNonNull(engine, "Engine cannot be null");
        this.engineContext = Objects.requireNonNull(engineContext, "Engine context cannot be null");
        this.runsOn = configuration.getRunner();
    }

    public AgentJobBuilder tools(ToolConfiguration tools) {
        this.tools = tools;
        return this;
    }

    public AgentJobBuilder safeOutputs(SafeOutputsWiring safeOutputs) {
        this.safeOutputs = safeOutputs;
        return this;
    }

    public AgentJobBuilder permissions(Permissions permissions) {
        this.permissions = permissions;
        return this;
    }

    public AgentJobBuilder bodyComposition(BodyComposition bodyComposition) {
        this.bodyComposition = bodyComposition;
        return this;
    }

    /**
     * Makes the job wait for the pre-activation job.
     */
    public AgentJobBuilder activationCondition(String condition) {
        this.activationCondition = condition;
        return this;
    }

    public AgentJobBuilder trialRepository(String repository) {
        this.trialRepository = repository;
        return this;
    }

    public AgentJobBuilder runsOn(Object runsOn) {
        this.runsOn = runsOn;
        return this;
    }

    public Job build() {
        Frontmatter frontmatter = effective.getFrontmatter();
        String actionsDirectory = configuration.getActionsDirectory();
        Step setup = ActionPins.setupStep(configuration.getCompilerVersion(), actionsDirectory);

        Job.Builder job = Job.builder(JOB_ID)
                .runsOn(runsOn)
                .ifCondition(condition(frontmatter.getString(FrontmatterFields.IF).orElse(null)))
                .permissions(permissions)
                .environment(frontmatter.get(FrontmatterFields.ENVIRONMENT))
                .container(frontmatter.get(FrontmatterFields.CONTAINER))
                .timeoutMinutes(timeoutMinutes(frontmatter));
        if (activationCondition != null) {
            job.needs(PreActivationJobBuilder.JOB_ID);
        }

        job.step(setup);
        job.step(checkoutStep());
        job.steps(authorSteps(frontmatter, FrontmatterFields.STEPS));
        job.steps(engine.getSecretValidationSteps(engineContext));
        job.steps(engine.getInstallationSteps(engineContext));
        if (safeOutputs != null) {
            job.step(safeOutputs.configStep());
        }
        if (engineContext.isMcpConfigured()) {
            job.step(mcpSetupStep(frontmatter, actionsDirectory));
        }
        job.step(promptStep());
        if (bodyComposition == BodyComposition.REFERENCE) {
            job.step(Step.builder("Interpolate runtime imports")
                    .uses(ActionPins.GITHUB_SCRIPT)
                    .env("AGENTFLOW_PROMPT", RunnerPaths.PROMPT_FILE)
                    .with("script", ActionPins.requireScript(actionsDirectory, "runtime_import.cjs"))
                    .build());
        }
        job.steps(engine.getExecutionSteps(engineContext));
        job.steps(authorSteps(frontmatter, FrontmatterFields.POST_STEPS));
        if (safeOutputs != null) {
            job.steps(safeOutputs.collectionSteps());
            safeOutputs.agentJobOutputs().forEach(job::output);
        }
        Job built = job.build();
        logger.debug("Built agent job with {} steps for engine {}", built.getSteps().size(), engine.getId());
        return built;
    }

    private String condition(String authored) {
        if (activationCondition == null) {
            return authored;
        }
        if (authored == null || authored.isBlank()) {
            return activationCondition;
        }
        return "(" + activationCondition + ") && (" + authored.trim() + ")";
    }

    private Integer timeoutMinutes(Frontmatter frontmatter) {
        Object timeout = frontmatter.get(FrontmatterFields.TIMEOUT_MINUTES);
        if (timeout == null) {
            timeout = frontmatter.get(FrontmatterFields.TIMEOUT_MINUTES_LEGACY);
        }
        return timeout instanceof Integer ? (Integer) timeout : configuration.getAgentTimeoutMinutes();
    }

    private Step checkoutStep() {
        Step.Builder checkout = Step.builder("Checkout repository")
                .uses(ActionPins.CHECKOUT)
                .with("persist-credentials", false);
        if (trialRepository != null) {
            checkout.with("repository", trialRepository);
        }
        return checkout.build();
    }

    private static List<Step> authorSteps(Frontmatter frontmatter, String field) {
        List<Step> steps = new ArrayList<>();
        for (Object step : frontmatter.getList(field)) {
            Map<String, Object> map = YamlSupport.asMap(step);
            if (map != null) {
                steps.add(Step.fromMap(map));
            }
        }
        return steps;
    }

    private Step mcpSetupStep(Frontmatter frontmatter, String actionsDirectory) {
        String json = new McpConfigRenderer(actionsDirectory).render(tools, safeOutputs != null);
        String script = "mkdir -p " + RunnerPaths.MCP_CONFIG_DIR + "\n"
                + "cat > " + RunnerPaths.MCP_CONFIG_FILE + " << '" + MCP_CONFIG_EOF + "'\n"
                + json + "\n"
                + MCP_CONFIG_EOF;
        Step.Builder step = Step.builder("Setup MCPs").run(script);
        if (tools.getGitHub() != null) {
            step.env(McpConfigRenderer.GITHUB_TOKEN_VARIABLE,
                    frontmatter.getString(FrontmatterFields.GITHUB_TOKEN).orElse(DEFAULT_GITHUB_TOKEN));
        }
        return step.build();
    }

    private Step promptStep() {
        String script = "mkdir -p " + RunnerPaths.PROMPT_DIR + "\n"
                + "cat << '" + PROMPT_EOF + "' > \"$AGENTFLOW_PROMPT\"\n"
                + effective.getPrompt() + "\n"
                + PROMPT_EOF;
        return Step.builder("Create prompt")
                .run(script)
                .env("AGENTFLOW_PROMPT", RunnerPaths.PROMPT_FILE)
                .build();
    }
}
