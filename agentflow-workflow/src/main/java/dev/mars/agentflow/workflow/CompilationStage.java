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

package dev.mars.agentflow.workflow;

/**
 * Stages a document passes through during one compile.
 * <pre>
 *   PARSED → IMPORTED → MERGED → ENGINE_SELECTED → SAFE_OUTPUTS_WIRED → EMITTED
 * </pre>
 * Stages are strictly sequential; none may be skipped or repeated.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @version 1.0
 * @since 2025-08-23
 */
public enum CompilationStage {

    /**
     * Frontmatter and body have been read and validated.
     */
    PARSED,

    /**
     * Transitive imports are loaded and checked for cycles and forbidden fields.
     */
    IMPORTED,

    /**
     * Fragments and the main workflow are folded into one effective configuration.
     */
    MERGED,

    /**
     * The engine adapter and its settings are chosen.
     */
    ENGINE_SELECTED,

    /**
     * Safe-output steps and jobs are generated and validated.
     */
    SAFE_OUTPUTS_WIRED,

    /**
     * YAML has been rendered and, unless suppressed, written. Terminal.
     */
    EMITTED;

    public boolean isTerminal() {
        return this == EMITTED;
    }

    /**
     * Checks whether the pipeline may move from this stage to {@code target}.
     *
     * @param target the requested stage
     * @return {@code true} only for the immediately following stage
     */
    public boolean canTransitionTo(CompilationStage target) {
        return switch (this) {
            case PARSED -> target == IMPORTED;
            case IMPORTED -> target == MERGED;
            case MERGED -> target == ENGINE_SELECTED;
            case ENGINE_SELECTED -> target == SAFE_OUTPUTS_WIRED;
            case SAFE_OUTPUTS_WIRED -> target == EMITTED;
            case EMITTED -> false;
        };
    }

    /**
     * @return the stages reachable from this one (empty when terminal)
     */
    public CompilationStage[] getValidTransitions() {
        return switch (this) {
            case PARSED -> new CompilationStage[]{IMPORTED};
            case IMPORTED -> new CompilationStage[]{MERGED};
            case MERGED -> new CompilationStage[]{ENGINE_SELECTED};
            case ENGINE_SELECTED -> new CompilationStage[]{SAFE_OUTPUTS_WIRED};
            case SAFE_OUTPUTS_WIRED -> new CompilationStage[]{EMITTED};
            case EMITTED -> new CompilationStage[0];
        };
    }
}
