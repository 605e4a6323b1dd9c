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

package dev.mars.agentflow.workflow.parser;

import dev.mars.agentflow.core.SourcePosition;
import dev.mars.agentflow.core.exceptions.ErrorKind;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Result of validating one frontmatter block: ordered errors and warnings,
 * each positioned in the source document.
 */
public class ValidationResult {

    private final List<ValidationIssue> errors;
    private final List<ValidationIssue> warnings;

    public ValidationResult() {
        this.errors = new ArrayList<>();
        this.warnings = new ArrayList<>();
    }

    public void addError(ErrorKind kind, String fieldPath, SourcePosition position, String message) {
        errors.add(new ValidationIssue(ValidationIssue.Severity.ERROR, kind, fieldPath, position, message));
    }

    public void addWarning(String fieldPath, SourcePosition position, String message) {
        warnings.add(new ValidationIssue(ValidationIssue.Severity.WARNING, ErrorKind.INVALID_FIELD,
                fieldPath, position, message));
    }

    public List<ValidationIssue> getErrors() {
        return List.copyOf(errors);
    }

    public List<ValidationIssue> getWarnings() {
        return List.copyOf(warnings);
    }

    public boolean isValid() {
        return errors.isEmpty();
    }

    public boolean hasWarnings() {
        return !warnings.isEmpty();
    }

    public int getErrorCount() {
        return errors.size();
    }

    public int getWarningCount() {
        return warnings.size();
    }

    @Override
    public String toString() {
        return "ValidationResult{valid=" + isValid() +
                ", errors=" + errors.size() +
                ", warnings=" + warnings.size() + "}";
    }

    /**
     * Represents a single validation issue (error or warning).
     */
    public static class ValidationIssue {

        public enum Severity {
            ERROR, WARNING
        }

        private final Severity severity;
        private final ErrorKind kind;
        private final String fieldPath;
        private final SourcePosition position;
        private final String message;

        public ValidationIssue(Severity severity, ErrorKind kind, String fieldPath,
                               SourcePosition position, String message) {
            this.severity = Objects.requireNonNull(severity, "Severity cannot be null");
            this.kind = Objects.requireNonNull(kind, "Kind cannot be null");
            this.fieldPath = fieldPath;
            this.position = position != null ? position : SourcePosition.UNKNOWN;
            this.message = Objects.requireNonNull(message, "Message cannot be null");
        }

        public Severity getSeverity() {
            return severity;
        }

        public ErrorKind getKind() {
            return kind;
        }

        public String getFieldPath() {
            return fieldPath;
        }

        public SourcePosition getPosition() {
            return position;
        }

        public String getMessage() {
            return message;
        }

        @Override
        public boolean equals(Object o) {
            if (this == o) return true;
            if (o == null || getClass() != o.getClass()) return false;
            ValidationIssue that = (ValidationIssue) o;
            return severity == that.severity &&
                   kind == that.kind &&
                   Objects.equals(fieldPath, that.fieldPath) &&
                   position.equals(that.position) &&
                   message.equals(that.message);
        }

        @Override
        public int hashCode() {
            return Objects.hash(severity, kind, fieldPath, position, message);
        }

        @Override
        public String toString() {
            StringBuilder sb = new StringBuilder();
            sb.append(severity.name());

            if (position.isKnown()) {
                sb.append(" (").append(position).append(")");
            }

            if (fieldPath != null) {
                sb.append(" [").append(fieldPath).append("]");
            }

            sb.append(": ").append(message);

            return sb.toString();
        }
    }
}
