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

import dev.mars.agentflow.workflow.model.Step;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Runs the author's own {@code engine.steps} or {@code engine.script}. The
 * steps are emitted as written; only the standard agent environment is
 * added, without overriding variables the step already sets.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-08-21
 * @version 1.0
 */
public class CustomEngine extends BaseEngine {

    public static final String ID = "custom";

    public CustomEngine() {
        super(ID, "Custom Steps", "Runs user-defined GitHub Actions steps instead of an AI agent CLI", false);
    }

    @Override
    public String getDefaultVersion() {
        return "";
    }

    @Override
    public List<String> getRequiredSecrets() {
        return List.of();
    }

    @Override
    public List<String> getDefaultDomains() {
        return List.of();
    }

    @Override
    protected List<Step> createInstallationSteps(String version) {
        return List.of();
    }

    @Override
    public List<Step> getExecutionSteps(EngineContext context) {
        EngineConfig config = context.getConfig();
        Map<String, String> env = new TreeMap<>();
        agentEnvironment(context).forEach((key, value) -> env.put(key, String.valueOf(value)));
        config.getMaxTurns().ifPresent(turns -> env.put("AGENTFLOW_MAX_TURNS", turns));
        if (!config.getArgs().isEmpty()) {
            env.put("AGENTFLOW_ARGS", String.join(" ", config.getArgs()));
        }

        List<Step> steps = new ArrayList<>();
        for (Map<String, Object> step : config.getSteps()) {
            steps.add(Step.fromMap(step).withDefaultEnv(env));
        }
        if (config.getScript().isPresent()) {
            steps.add(Step.builder("Run custom engine script")
                    .id(EXECUTION_STEP_ID)
                    .run(config.getScript().get())
                    .env(env)
                    .build());
        }
        if (steps.isEmpty()) {
            steps.add(Step.builder("Run custom engine")
                    .run("echo \"Custom engine has no steps configured\"")
                    .build());
        }
        return steps;
    }
}
