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

import dev.mars.agentflow.core.exceptions.AgentflowException;

import java.nio.file.Path;
import java.util.Objects;
import java.util.Optional;

/**
 * Outcome of compiling one document: the YAML and where it was written, or
 * the error that stopped the compile.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-08-23
 * @version 1.0
 */
public final class CompilationResult {

    private final String sourcePath;
    private final Path outputPath;
    private final String yaml;
    private final boolean written;
    private final AgentflowException error;

    private CompilationResult(String sourcePath, Path outputPath, String yaml, boolean written,
                              AgentflowException error) {
        this.sourcePath = Objects.requireNonNull(sourcePath, "Source path cannot be null");
        this.outputPath = outputPath;
        this.yaml = yaml;
        this.written = written;
        this.error = error;
    }

    public static CompilationResult success(String sourcePath, Path outputPath, String yaml, boolean written) {
        return new CompilationResult(sourcePath, outputPath, Objects.requireNonNull(yaml, "YAML cannot be null"),
                written, null);
    }

    public static CompilationResult failure(String sourcePath, AgentflowException error) {
        return new CompilationResult(sourcePath, null, null, false,
                Objects.requireNonNull(error, "Error cannot be null"));
    }

    public boolean isSuccess() {
        return error == null;
    }

    public String getSourcePath() {
        return sourcePath;
    }

    public Optional<Path> getOutputPath() {
        return Optional.ofNullable(outputPath);
    }

    public Optional<String> getYaml() {
        return Optional.ofNullable(yaml);
    }

    /**
     * @return true when a lock file was written; false on failure or with no-emit
     */
    public boolean isWritten() {
        return written;
    }

    public Optional<AgentflowException> getError() {
        return Optional.ofNullable(error);
    }

    @Override
    public String toString() {
        return isSuccess()
                ? "CompilationResult{source='" + sourcePath + "', output=" + outputPath + ", written=" + written + '}'
                : "CompilationResult{source='" + sourcePath + "', error=" + error.getMessage() + '}';
    }
}
