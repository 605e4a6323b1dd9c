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
 * Exception thrown when the transitive imports of a workflow form a cycle.
 * The chain starts and ends with the same file.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-08-18
 * @version 1.0
 */
public class ImportCycleException extends CompilationException {

    private final List<String> chain;

    public ImportCycleException(String sourcePath, SourcePosition position, List<String> chain) {
        super(ErrorKind.IMPORT_CYCLE, sourcePath, position, "imports",
                "Import cycle detected: " + String.join(" → ", chain));
        this.chain = List.copyOf(chain);
    }

    public List<String> getChain() {
        return chain;
    }
}
