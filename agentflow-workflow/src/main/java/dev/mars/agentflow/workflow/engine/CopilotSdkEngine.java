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

import dev.mars.agentflow.workflow.emit.JsonSupport;
import dev.mars.agentflow.workflow.model.RunnerPaths;
import dev.mars.agentflow.workflow.model.Step;

import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Copilot CLI driven through its SDK: the CLI runs headless on a local port
 * and a Node.js client submits the prompt.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-08-21
 * @version 1.0
 */
public class CopilotSdkEngine extends CopilotEngine {

    public static final String ID = "copilot-sdk";

    static final int HEADLESS_PORT = 10002;
    static final String EVENT_LOG = "/tmp/agentflow/copilot-sdk/event-log.jsonl";

    private final String actionsDirectory;

    public CopilotSdkEngine(String actionsDirectory) {
        super(ID, "GitHub Copilot SDK", "Uses the GitHub Copilot SDK with the CLI in headless mode", true);
        this.actionsDirectory = actionsDirectory;
    }

    @Override
    public List<Step> getExecutionSteps(EngineContext context) {
        String headless = executable(context, "copilot") + " --headless --port " + HEADLESS_PORT + " &\n"
                + "COPILOT_PID=$!\n"
                + "echo \"COPILOT_PID=${COPILOT_PID}\" >> \"$GITHUB_ENV\"\n"
                + "sleep 5\n"
                + "if ! kill -0 \"${COPILOT_PID}\" 2>/dev/null; then\n"
                + "  echo \"::error::Copilot CLI failed to start\"\n"
                + "  exit 1\n"
                + "fi";

        Map<String, Object> clientConfig = new TreeMap<>();
        clientConfig.put("cliUrl", "http://host.docker.internal:" + HEADLESS_PORT);
        clientConfig.put("promptFile", RunnerPaths.PROMPT_FILE);
        clientConfig.put("eventLogFile", EVENT_LOG);
        clientConfig.put("logLevel", "info");
        context.getConfig().getModel().ifPresent(model -> clientConfig.put("session", Map.of("model", model)));

        Map<String, Object> env = agentEnvironment(context);
        env.put("AGENTFLOW_COPILOT_CONFIG", JsonSupport.toCompactJson(clientConfig));
        putModelVariable(env, context, MODEL_VARIABLE);

        return List.of(
                Step.builder("Start Copilot CLI in headless mode").run(headless).build(),
                Step.builder("Execute " + getDisplayName())
                        .id(EXECUTION_STEP_ID)
                        .run("set -o pipefail\n"
                                + "mkdir -p /tmp/agentflow/copilot-sdk/\n"
                                + "node " + actionsDirectory + "/copilot/copilot-client.js 2>&1 | tee "
                                + RunnerPaths.AGENT_STDIO_LOG)
                        .env(env)
                        .build());
    }
}
