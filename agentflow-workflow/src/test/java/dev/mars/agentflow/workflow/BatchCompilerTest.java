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

import dev.mars.agentflow.config.CompilerConfiguration;
import dev.mars.agentflow.core.SourcePosition;
import dev.mars.agentflow.core.exceptions.WorkflowParseException;
import dev.mars.agentflow.workflow.engine.EngineRegistry;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.api.io.TempDir;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.List;
import java.util.Properties;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

@DisplayName("Batch compilation")
class BatchCompilerTest {

    private static final String VALID = "---\non: push\n---\nDo the work\n";
    private static final String INVALID = "---\non: push\ntimeout-minutes: ten\n---\nDo the work\n";

    private static WorkflowCompiler compiler() {
        return new WorkflowCompiler(EngineRegistry.withDefaultEngines(), CompilerConfiguration.defaults(),
                CompilerOptions.defaults());
    }

    private static List<Path> write(Path dir, String... contents) throws Exception {
        List<Path> sources = new ArrayList<>();
        for (int i = 0; i < contents.length; i++) {
            Path source = dir.resolve("wf" + i + ".md");
            Files.writeString(source, contents[i]);
            sources.add(source);
        }
        return sources;
    }

    @Nested
    @DisplayName("With real compiles")
    class RealCompiles {

        @Test
        @DisplayName("Every source gets a result in input order")
        void inputOrder(@TempDir Path dir) throws Exception {
            List<Path> sources = write(dir, VALID, INVALID, VALID, VALID);

            List<CompilationResult> results = new BatchCompiler(compiler(), 3, false).compileAll(sources);

            assertEquals(4, results.size());
            assertTrue(results.get(0).isSuccess());
            assertFalse(results.get(1).isSuccess());
            assertTrue(results.get(1).getSourcePath().endsWith("wf1.md"));
            assertTrue(results.get(1).getError().isPresent());
            assertTrue(results.get(2).isSuccess());
            assertTrue(results.get(3).getSourcePath().endsWith("wf3.md"));
            assertTrue(Files.exists(dir.resolve("wf3.lock.yml")));
            assertFalse(Files.exists(dir.resolve("wf1.lock.yml")));
        }

        @Test
        @DisplayName("Fail-fast stops starting new compiles after a failure")
        void failFast(@TempDir Path dir) throws Exception {
            List<Path> sources = write(dir, INVALID, VALID, VALID);

            List<CompilationResult> results = new BatchCompiler(compiler(), 1, true).compileAll(sources);

            assertEquals(1, results.size());
            assertFalse(results.get(0).isSuccess());
            assertFalse(Files.exists(dir.resolve("wf1.lock.yml")));
        }

        @Test
        @DisplayName("Sources sharing a lock file are compiled one after another")
        void sharedOutput(@TempDir Path dir) throws Exception {
            Path markdown = dir.resolve("same.md");
            Path bare = dir.resolve("same");
            Files.writeString(markdown, VALID);
            Files.writeString(bare, "---\non: push\nname: Second\n---\nOther work\n");

            List<CompilationResult> results = new BatchCompiler(compiler(), 4, false).compileAll(List.of(markdown, bare));

            assertEquals(2, results.size());
            assertEquals(results.get(0).getOutputPath(), results.get(1).getOutputPath());
            assertEquals(results.get(1).getYaml().orElseThrow(), Files.readString(dir.resolve("same.lock.yml")));
        }

        @Test
        @DisplayName("An empty batch does nothing")
        void empty() throws Exception {
            assertTrue(new BatchCompiler(compiler(), false).compileAll(List.of()).isEmpty());
        }
    }

    @Nested
    @DisplayName("Worker handling")
    @ExtendWith(MockitoExtension.class)
    class Workers {

        @Mock
        private WorkflowCompiler compiler;

        @Test
        @DisplayName("A compile error becomes a failed result")
        void compileErrorIsResult() throws Exception {
            Path source = Paths.get("broken.md");
            when(compiler.lockFilePath(any())).thenReturn(Paths.get("broken.lock.yml"));
            when(compiler.compileFile(source)).thenThrow(
                    new WorkflowParseException("broken.md", SourcePosition.of(1, 1), "frontmatter is not closed"));

            List<CompilationResult> results = new BatchCompiler(compiler, 2, false).compileAll(List.of(source));

            assertEquals(1, results.size());
            assertEquals("broken.md", results.get(0).getSourcePath());
            assertTrue(results.get(0).getError().orElseThrow().getMessage().contains("frontmatter is not closed"));
            verify(compiler).compileFile(source);
        }

        @Test
        @DisplayName("Unexpected runtime failures propagate")
        void runtimeFailurePropagates() throws Exception {
            when(compiler.lockFilePath(any())).thenReturn(Paths.get("a.lock.yml"));
            when(compiler.compileFile(any())).thenThrow(new IllegalStateException("boom"));

            IllegalStateException e = assertThrows(IllegalStateException.class,
                    () -> new BatchCompiler(compiler, 1, false).compileAll(List.of(Paths.get("a.md"))));
            assertEquals("boom", e.getMessage());
        }

        @Test
        @DisplayName("Parallelism defaults to the configured value and must be positive")
        void parallelism() {
            Properties properties = new Properties();
            properties.setProperty(CompilerConfiguration.KEY_BATCH_MAX_PARALLEL, "0");
            when(compiler.getConfiguration()).thenReturn(new CompilerConfiguration(properties));

            assertDoesNotThrow(() -> new BatchCompiler(compiler, true));
            assertThrows(IllegalArgumentException.class, () -> new BatchCompiler(compiler, 0, true));
        }
    }
}
