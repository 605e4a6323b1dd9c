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

import java.util.Objects;

/**
 * A one-based line and column inside a source document.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-08-18
 * @version 1.0
 */
public final class SourcePosition {

    public static final SourcePosition UNKNOWN = new SourcePosition(-1, -1);

    private final int line;
    private final int column;

    private SourcePosition(int line, int column) {
        this.line = line;
        this.column = column;
    }

    public static SourcePosition of(int line, int column) {
        if (line < 1) {
            throw new IllegalArgumentException("Line must be positive: " + line);
        }
        return new SourcePosition(line, Math.max(column, 1));
    }

    public int getLine() {
        return line;
    }

    public int getColumn() {
        return column;
    }

    public boolean isKnown() {
        return line > 0;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        SourcePosition that = (SourcePosition) o;
        return line == that.line && column == that.column;
    }

    @Override
    public int hashCode() {
        return Objects.hash(line, column);
    }

    @Override
    public String toString() {
        return isKnown() ? line + ":" + column : "?";
    }
}
