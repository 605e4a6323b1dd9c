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

import java.util.List;

/**
 * Adapter for one AI agent runtime. Implementations turn the selected engine
 * settings into the GitHub Actions steps that install and run the agent.
 * Step generation must not have side effects.
 */
public interface AgenticEngine {

    /**
     * Get the engine identifier used in the {@code engine} field
     */
    String getId();

    String getDisplayName();

    String getDescription();

    /**
     * Check if the engine is still experimental
     */
    boolean isExperimental();

    /**
     * Get the CLI version installed when {@code engine.version} is not set
     */
    String getDefaultVersion();

    /**
     * Get the secrets the agent step needs; at least one must be configured
     */
    List<String> getRequiredSecrets();

    /**
     * Get the domains the agent runtime itself must reach
     */
    List<String> getDefaultDomains();

    /**
     * Get the repository variable consulted when no model is configured, or null
     */
    String getModelSettingsKey();

    List<Step> getSecretValidationSteps(EngineContext context);

    /**
     * Steps that install the agent CLI. Empty when {@code engine.command} is set.
     */
    List<Step> getInstallationSteps(EngineContext context);

    List<Step> getExecutionSteps(EngineContext context);
}
