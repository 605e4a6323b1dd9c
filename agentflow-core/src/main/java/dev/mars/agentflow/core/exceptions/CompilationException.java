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

import java.util.Objects;

/**
 * Exception thrown when a workflow document cannot be compiled.
 * Carries the source file, position and field path so callers can render a
 * positioned diagnostic.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-08-18
 * @version 1.0
 */
public class CompilationException extends AgentflowException {

    private final ErrorKind kind;
    private final String sourcePath;
    private final SourcePosition position;
    private final String fieldPath;

    public CompilationException(ErrorKind kind, String sourcePath, SourcePosition position,
                                String fieldPath, String message) {
        this(kind, sourcePath, position, fieldPath, message, null);
    }

    public CompilationException(ErrorKind kind, String sourcePath, SourcePosition position,
                                String fieldPath, String message, Throwable cause) {
        super(message, cause);
        this.kind = Objects.requireNonNull(kind, "Error kind cannot be null");
        this.sourcePath = sourcePath;
        this.position = position != null ? position : SourcePosition.UNKNOWN;
        this.fieldPath = fieldPath;
    }

    public ErrorKind getKind() {
        return kind;
    }

    public String getSourcePath() {
        return sourcePath;
    }

    public SourcePosition getPosition() {
        return position;
    }

    public int getLineNumber() {
        return position.getLine();
    }

    public int getColumn() {
        return position.getColumn();
    }

    public String getFieldPath() {
        return fieldPath;
    }

    /**
     * @return the message without the location prefix
     */
    public String getRawMessage() {
        return super.getMessage();
    }

    @Override
    public String getMessage() {
        StringBuilder sb = new StringBuilder();

        if (sourcePath != null) {
            sb.append(sourcePath);
            if (position.isKnown()) {
                sb.append(':').append(position.getLine()).append(':').append(position.getColumn());
            }
            sb.append(": ");
        }

        if (fieldPath != null && !fieldPath.isEmpty()) {
            sb.append("Field '").append(fieldPath).append("': ");
        }

        sb.append(super.getMessage());

        return sb.toString();
    }
}
