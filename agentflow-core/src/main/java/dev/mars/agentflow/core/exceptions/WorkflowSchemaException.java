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

/**
 * Exception thrown when a frontmatter field is unknown or has an invalid value.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-08-21
 * @version 1.0
 */
public class WorkflowSchemaException extends CompilationException {

    /**
     * Creates an unlocated schema error, typically raised by value parsers that
     * do not know which document they are reading.
     */
    public WorkflowSchemaException(String fieldPath, String message) {
        super(ErrorKind.INVALID_FIELD, null, SourcePosition.UNKNOWN, fieldPath, message);
    }

    public WorkflowSchemaException(ErrorKind kind, String sourcePath, SourcePosition position,
                                   String fieldPath, String message) {
        super(requireSchemaKind(kind), sourcePath, position, fieldPath, message);
    }

    public WorkflowSchemaException(ErrorKind kind, String sourcePath, SourcePosition position,
                                   String fieldPath, String message, Throwable cause) {
        super(requireSchemaKind(kind), sourcePath, position, fieldPath, message, cause);
    }

    private static ErrorKind requireSchemaKind(ErrorKind kind) {
        if (kind != ErrorKind.INVALID_FIELD && kind != ErrorKind.UNKNOWN_FIELD) {
            throw new IllegalArgumentException("Not a schema error kind: " + kind);
        }
        return kind;
    }
}
