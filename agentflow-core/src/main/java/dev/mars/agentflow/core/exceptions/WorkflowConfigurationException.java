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

package dev.mars.agentflow.core.exceptions;

import dev.mars.agentflow.core.SourcePosition;

import java.util.List;

/**
 * Exception thrown when a workflow is well-formed but semantically invalid:
 * an unknown engine or tool, a missing import, an undeclared side effect or a
 * strict-mode violation. Optionally carries ranked "did you mean" suggestions.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-08-18
 * @version 1.0
 */
public class WorkflowConfigurationException extends CompilationException {

    private final List<String> suggestions;

    public WorkflowConfigurationException(ErrorKind kind, String sourcePath, SourcePosition position,
                                          String fieldPath, String message) {
        this(kind, sourcePath, position, fieldPath, message, List.of());
    }

    public WorkflowConfigurationException(ErrorKind kind, String sourcePath, SourcePosition position,
                                          String fieldPath, String message, List<String> suggestions) {
        super(kind, sourcePath, position, fieldPath, message);
        this.suggestions = suggestions != null ? List.copyOf(suggestions) : List.of();
    }

    public List<String> getSuggestions() {
        return suggestions;
    }
}
