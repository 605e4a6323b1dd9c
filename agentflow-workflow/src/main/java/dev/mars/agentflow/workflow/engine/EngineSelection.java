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

import java.util.Objects;

/**
 * The engine chosen for a workflow together with its settings.
 */
public final class EngineSelection {

    private final AgenticEngine engine;
    private final EngineConfig config;

    public EngineSelection(AgenticEngine engine, EngineConfig config) {
        this.engine = Objects.requireNonNull(engine, "Engine cannot be null");
        this.config = Objects.requireNonNull(config, "Engine config cannot be null");
        if (!engine.getId().equals(config.getId())) {
            throw new IllegalArgumentException("Engine '" + engine.getId()
                    + "' does not match configuration for '" + config.getId() + "'");
        }
    }

    public AgenticEngine getEngine() {
        return engine;
    }

    public EngineConfig getConfig() {
        return config;
    }

    @Override
    public String toString() {
        return "EngineSelection{engine=" + engine.getId() + ", config=" + config + '}';
    }
}
