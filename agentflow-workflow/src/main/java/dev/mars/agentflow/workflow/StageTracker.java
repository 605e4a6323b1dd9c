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

import dev.mars.agentflow.core.exceptions.InvalidTransitionException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;

/**
 * Current stage of one document's compile.
 */
final class StageTracker {
    private static final Logger logger = LoggerFactory.getLogger(StageTracker.class);

    private final String documentPath;
    private CompilationStage stage = CompilationStage.PARSED;

    StageTracker(String documentPath) {
        this.documentPath = Objects.requireNonNull(documentPath, "Document path cannot be null");
    }

    CompilationStage getStage() {
        return stage;
    }

    void advance(CompilationStage next) throws InvalidTransitionException {
        if (!stage.canTransitionTo(next)) {
            throw new InvalidTransitionException(documentPath, stage, next, stage.getValidTransitions());
        }
        logger.debug("{}: {} -> {}", documentPath, stage, next);
        stage = next;
    }
}
