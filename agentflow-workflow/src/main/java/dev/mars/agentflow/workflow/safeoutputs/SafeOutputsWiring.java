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

package dev.mars.agentflow.workflow.safeoutputs;

import dev.mars.agentflow.workflow.emit.JsonSupport;
import dev.mars.agentflow.workflow.model.ActionPins;
import dev.mars.agentflow.workflow.model.Job;
import dev.mars.agentflow.workflow.model.RunnerPaths;
import dev.mars.agentflow.workflow.model.Step;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Generates the steps and the job that carry agent requests out of the
 * read-only agent job.
 *
 * <p>The agent writes requests to a JSONL file through the safe-outputs MCP
 * server. A collection step validates them against the declared kinds and
 * exposes them as job outputs; the {@code safe_outputs} job then runs one
 * handler per declared kind, gated on the agent having produced that kind.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-08-22
 * @version 1.0
 */
public class SafeOutputsWiring {
    private static final Logger logger = LoggerFactory.getLogger(SafeOutputsWiring.class);

    public static final String JOB_ID = "safe_outputs";
    public static final String COLLECT_STEP_ID = "collect_output";
    public static final String ARTIFACT_NAME = "agent_output.json";

    static final String CONFIG_EOF = "AGENTFLOW_SAFE_OUTPUTS_CONFIG_EOF";

    private final SafeOutputsConfig config;
    private final String actionsDirectory;
    private final Step setupStep;

    public SafeOutputsWiring(SafeOutputsConfig config, String actionsDirectory, Step setupStep) {
        this.config = Objects.requireNonNull(config, "Safe outputs config cannot be null");
        this.actionsDirectory = Objects.requireNonNull(actionsDirectory, "Actions directory cannot be null");
        this.setupStep = Objects.requireNonNull(setupStep, "Setup step cannot be null");
        if (!config.isEnabled()) {
            throw new IllegalArgumentException("Safe outputs are not enabled");
        }
    }

    /**
     * Agent job step that writes the handler configuration read by the MCP server.
     */
    public Step configStep() {
        String script = "mkdir -p " + RunnerPaths.SAFE_OUTPUTS_DIR + "\n"
                + "touch " + RunnerPaths.SAFE_OUTPUTS_FILE + "\n"
                + "cat > " + RunnerPaths.SAFE_OUTPUTS_CONFIG_FILE + " << '" + CONFIG_EOF + "'\n"
                + config.toConfigJson() + "\n"
                + CONFIG_EOF;
        return Step.builder("Write Safe Outputs Config").run(script).build();
    }

    /**
     * Agent job steps that validate the collected requests and upload them.
     */
    public List<Step> collectionSteps() {
        List<Step> steps = new ArrayList<>();
        steps.add(Step.builder("Ingest agent output")
                .id(COLLECT_STEP_ID)
                .uses(ActionPins.GITHUB_SCRIPT)
                .env("AGENTFLOW_SAFE_OUTPUTS", RunnerPaths.SAFE_OUTPUTS_FILE)
                .env("AGENTFLOW_SAFE_OUTPUTS_CONFIG", config.toConfigJson())
                .env("AGENTFLOW_AGENT_OUTPUT", RunnerPaths.AGENT_OUTPUT_FILE)
                .with("script", ActionPins.requireScript(actionsDirectory, "safeoutputs/collect_output.cjs"))
                .build());
        steps.add(Step.builder("Upload agent output")
                .ifCondition("always()")
                .uses(ActionPins.UPLOAD_ARTIFACT)
                .with("name", ARTIFACT_NAME)
                .with("path", RunnerPaths.AGENT_OUTPUT_FILE)
                .with("if-no-files-found", "warn")
                .build());
        return steps;
    }

    /**
     * @return outputs the agent job must expose for the handler job
     */
    public Map<String, String> agentJobOutputs() {
        return Map.of(
                "output", "${{ steps." + COLLECT_STEP_ID + ".outputs.output }}",
                "output_types", "${{ steps." + COLLECT_STEP_ID + ".outputs.output_types }}");
    }

    /**
     * The job that performs the writes.
     *
     * @param agentJobId id of the job that ran the agent
     * @param runsOn     runner label, list or group object
     */
    public Job handlerJob(String agentJobId, Object runsOn) {
        Job.Builder job = Job.builder(JOB_ID)
                .runsOn(runsOn)
                .needs(agentJobId)
                .ifCondition("(!cancelled()) && needs." + agentJobId + ".result != 'skipped'")
                .permissions(config.requiredPermissions())
                .timeoutMinutes(15)
                .step(setupStep)
                .step(Step.builder("Download agent output artifact")
                        .uses(ActionPins.DOWNLOAD_ARTIFACT)
                        .with("name", ARTIFACT_NAME)
                        .with("path", RunnerPaths.SAFE_OUTPUTS_DIR + "/")
                        .continueOnError()
                        .build())
                .step(Step.builder("Setup agent output environment variable")
                        .run("echo \"AGENTFLOW_AGENT_OUTPUT=" + RunnerPaths.SAFE_OUTPUTS_DIR + "/" + ARTIFACT_NAME
                                + "\" >> \"$GITHUB_ENV\"")
                        .build());

        for (SafeOutputKind kind : config.getKinds()) {
            Step.Builder step = Step.builder("Process " + kind.yamlName())
                    .id(kind.toolName())
                    .ifCondition(handlerCondition(agentJobId, kind))
                    .uses(ActionPins.GITHUB_SCRIPT)
                    .env("AGENTFLOW_AGENT_OUTPUT", "${{ env.AGENTFLOW_AGENT_OUTPUT }}")
                    .env("AGENTFLOW_HANDLER_CONFIG", JsonSupport.toCompactJson(config.getSettings(kind)))
                    .with("github-token", "${{ secrets.GITHUB_TOKEN }}")
                    .with("script", ActionPins.requireScript(actionsDirectory,
                            "safeoutputs/" + kind.toolName() + ".cjs"));
            if (config.isStaged()) {
                step.env("AGENTFLOW_SAFE_OUTPUTS_STAGED", "true");
            }
            job.step(step.build());
        }
        logger.debug("Wired safe outputs job with kinds {}", config.getKinds());
        return job.build();
    }

    /**
     * Gates a handler on its tool name appearing as a whole entry of the
     * comma-separated {@code output_types} list.
     */
    static String handlerCondition(String agentJobId, SafeOutputKind kind) {
        return "contains(format(',{0},', needs." + agentJobId + ".outputs.output_types), '," + kind.toolName() + ",')";
    }
}
