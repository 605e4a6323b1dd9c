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

package dev.mars.agentflow.workflow.model;

/**
 * Versions of the third-party actions referenced by generated steps.
 */
public final class ActionPins {

    public static final String CHECKOUT = "actions/checkout@v5";
    public static final String GITHUB_SCRIPT = "actions/github-script@v8";
    public static final String UPLOAD_ARTIFACT = "actions/upload-artifact@v4";
    public static final String DOWNLOAD_ARTIFACT = "actions/download-artifact@v5";

    /**
     * Action that copies the runtime scripts into the actions directory.
     */
    public static final String SETUP_ACTION = "mraysmit/agentflow/actions/setup";

    private ActionPins() {
    }

    /**
     * @return the setup step for a job that runs the bundled scripts
     */
    public static Step setupStep(String compilerVersion, String actionsDirectory) {
        String ref = compilerVersion == null || compilerVersion.isBlank() || "dev".equals(compilerVersion)
                ? "main" : "v" + compilerVersion;
        return Step.builder("Setup Scripts")
                .uses(SETUP_ACTION + "@" + ref)
                .with("destination", actionsDirectory)
                .build();
    }

    /**
     * @return a github-script body that runs {@code main} from a bundled script
     */
    public static String requireScript(String actionsDirectory, String script) {
        return "const { main } = require('" + actionsDirectory + "/" + script + "');\nawait main();";
    }
}
