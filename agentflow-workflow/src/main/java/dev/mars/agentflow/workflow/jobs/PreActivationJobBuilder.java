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
import dev.mars.agentflow.permissions.PermissionScope;
import dev.mars.agentflow.permissions.Permissions;
import dev.mars.agentflow.workflow.model.ActionPins;
import dev.mars.agentflow.workflow.model.Job;
import dev.mars.agentflow.workflow.model.Step;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Builds the {@code pre_activation} job that gates the agent on the actor's
 * repository role and on the stop time.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-08-23
 * @version 1.0
 */
public class PreActivationJobBuilder {

    public static final String JOB_ID = "pre_activation";
    public static final String ACTIVATED_OUTPUT = "activated";

    static final String MEMBERSHIP_STEP_ID = "check_membership";
    static final String STOP_TIME_STEP_ID = "check_stop_time";

    private final CompilerConfiguration configuration;
    private final Object runsOn;
    private List<String> roles = List.of();
    private String stopTime;
    private String workflowName;

    public PreActivationJobBuilder(CompilerConfiguration configuration, Object runsOn) {
        this.configuration = Objects.requireNonNull(configuration, "Configuration cannot be null");
        this.runsOn = Objects.requireNonNull(runsOn, "runs-on cannot be null");
    }

    /**
     * @param roles repository roles allowed to trigger the agent; empty means anyone
     */
    public PreActivationJobBuilder roles(List<String> roles) {
        this.roles = List.copyOf(roles);
        return this;
    }

    public PreActivationJobBuilder stopTime(String stopTime, String workflowName) {
        this.stopTime = stopTime;
        this.workflowName = workflowName;
        return this;
    }

    /**
     * @return true when there is anything to check
     */
    public boolean isRequired() {
        return !roles.isEmpty() || stopTime != null;
    }

    /**
     * @return the condition the agent job uses to wait for activation
     */
    public static String activationCondition() {
        return "needs." + JOB_ID + ".outputs." + ACTIVATED_OUTPUT + " == 'true'";
    }

    public Job build() {
        if (!isRequired()) {
            throw new IllegalStateException("Pre-activation has nothing to check");
        }
        String actionsDirectory = configuration.getActionsDirectory();
        Job.Builder job = Job.builder(JOB_ID)
                .runsOn(runsOn)
                .permissions(Permissions.read(PermissionScope.CONTENTS))
                .step(ActionPins.setupStep(configuration.getCompilerVersion(), actionsDirectory));

        List<String> checks = new ArrayList<>();
        if (!roles.isEmpty()) {
            job.step(Step.builder("Check team membership for workflow")
                    .id(MEMBERSHIP_STEP_ID)
                    .uses(ActionPins.GITHUB_SCRIPT)
                    .env("AGENTFLOW_REQUIRED_ROLES", String.join(",", roles))
                    .with("github-token", "${{ secrets.GITHUB_TOKEN }}")
                    .with("script", ActionPins.requireScript(actionsDirectory, "check_membership.cjs"))
                    .build());
            checks.add("steps." + MEMBERSHIP_STEP_ID + ".outputs.is_team_member == 'true'");
        }
        if (stopTime != null) {
            job.step(Step.builder("Check stop-time limit")
                    .id(STOP_TIME_STEP_ID)
                    .uses(ActionPins.GITHUB_SCRIPT)
                    .env("AGENTFLOW_STOP_TIME", stopTime)
                    .env("AGENTFLOW_WORKFLOW_NAME", workflowName)
                    .with("script", ActionPins.requireScript(actionsDirectory, "check_stop_time.cjs"))
                    .build());
            checks.add("steps." + STOP_TIME_STEP_ID + ".outputs.stop_time_ok == 'true'");
        }
        job.output(ACTIVATED_OUTPUT, "${{ " + String.join(" && ", checks) + " }}");
        return job.build();
    }
}
