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

package dev.mars.agentflow.core;

import dev.mars.agentflow.core.exceptions.CompilationException;

/**
 * Renders a {@link CompilationException} as a compiler-style diagnostic:
 * <pre>
 * workflows/triage.md:4:3: error: Field 'permissions.issues': invalid level 'admin'
 *     3 | permissions:
 *     4 |   issues: admin
 *       |   ^
 *     5 | ---
 * </pre>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-08-21
 * @version 1.0
 */
public final class DiagnosticFormatter {

    private static final int CONTEXT_LINES = 1;

    private DiagnosticFormatter() {
    }

    /**
     * Formats the exception with surrounding source lines.
     *
     * @param e          the failure
     * @param sourceText the full text of the document the failure points into, may be null
     * @return the formatted diagnostic, never null
     */
    public static String format(CompilationException e, String sourceText) {
        StringBuilder sb = new StringBuilder();
        sb.append(e.getSourcePath() != null ? e.getSourcePath() : "<input>");
        SourcePosition position = e.getPosition();
        if (position.isKnown()) {
            sb.append(':').append(position.getLine()).append(':').append(position.getColumn());
        }
        sb.append(": error: ");
        if (e.getFieldPath() != null && !e.getFieldPath().isEmpty()) {
            sb.append("Field '").append(e.getFieldPath()).append("': ");
        }
        sb.append(e.getRawMessage());

        if (sourceText == null || !position.isKnown()) {
            return sb.toString();
        }

        String[] lines = sourceText.split("\r?\n", -1);
        int target = position.getLine();
        if (target > lines.length) {
            return sb.toString();
        }

        int first = Math.max(1, target - CONTEXT_LINES);
        int last = Math.min(lines.length, target + CONTEXT_LINES);
        int width = String.valueOf(last).length();
        for (int n = first; n <= last; n++) {
            sb.append('\n').append(pad(String.valueOf(n), width)).append(" | ").append(lines[n - 1]);
            if (n == target) {
                sb.append('\n').append(" ".repeat(width)).append(" | ")
                        .append(" ".repeat(position.getColumn() - 1)).append('^');
            }
        }
        return sb.toString();
    }

    private static String pad(String value, int width) {
        return " ".repeat(Math.max(0, width - value.length())) + value;
    }
}
