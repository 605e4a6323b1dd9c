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
import dev.mars.agentflow.core.exceptions.CompilationException;
import dev.mars.agentflow.core.exceptions.ErrorKind;
import dev.mars.agentflow.core.exceptions.ImportCycleException;
import dev.mars.agentflow.core.exceptions.WorkflowConfigurationException;
import dev.mars.agentflow.workflow.emit.LockFileHeader;
import dev.mars.agentflow.workflow.engine.EngineRegistry;
import dev.mars.agentflow.workflow.merge.BodyComposition;
import dev.mars.agentflow.workflow.parser.WorkflowDocument;
import dev.mars.agentflow.workflow.parser.YamlSupport;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("Workflow compiler")
class WorkflowCompilerTest {

    private static final Clock CLOCK = Clock.fixed(Instant.parse("2025-08-20T10:00:00Z"), ZoneOffset.UTC);

    private static final String FRAGMENT = "---\n"
            + "permissions:\n"
            + "  issues: read\n"
            + "tools:\n"
            + "  bash: [ls]\n"
            + "---\n"
            + "Shared rules\n";

    private static final String MAIN = "---\n"
            + "on:\n"
            + "  issues:\n"
            + "    types: [opened]\n"
            + "imports:\n"
            + "  - shared/base.md\n"
            + "permissions:\n"
            + "  contents: read\n"
            + "  issues: write\n"
            + "---\n"
            + "# Issue triage\n"
            + "\n"
            + "Label issue ${{ github.event.issue.number }}.\n";

    private static WorkflowCompiler compiler(CompilerOptions options) {
        return compiler(options, CLOCK);
    }

    private static WorkflowCompiler compiler(CompilerOptions options, Clock clock) {
        return new WorkflowCompiler(EngineRegistry.withDefaultEngines(), CompilerConfiguration.defaults(), options, clock);
    }

    private static Path workspace(Path dir, String main) throws Exception {
        Files.createDirectories(dir.resolve("shared"));
        Files.writeString(dir.resolve("shared/base.md"), FRAGMENT);
        Path source = dir.resolve("triage.md");
        Files.writeString(source, main);
        return source;
    }

    private static Map<String, Object> load(String yaml) {
        return YamlSupport.asMap(YamlSupport.newLoader().load(yaml));
    }

    private static Map<String, Object> job(Map<String, Object> workflow, String id) {
        return YamlSupport.asMap(YamlSupport.asMap(workflow.get("jobs")).get(id));
    }

    private String compileVirtual(CompilerOptions.Builder options, String main) throws Exception {
        WorkflowCompiler compiler = compiler(options.virtualFile("wf/shared/base.md", FRAGMENT).build());
        WorkflowDocument document = compiler.parseWorkflowString(main, "wf/triage.md");
        return compiler.compileToYaml(document, "wf/triage.md");
    }

    @Nested
    @DisplayName("Compiling files")
    class FileCompilation {

        @Test
        @DisplayName("Writes the lock file next to the source")
        void writesLockFile(@TempDir Path dir) throws Exception {
            Path source = workspace(dir, MAIN);

            CompilationResult result = compiler(CompilerOptions.defaults()).compileFile(source);

            Path lockFile = dir.resolve("triage.lock.yml");
            assertTrue(result.isSuccess());
            assertTrue(result.isWritten());
            assertEquals(Optional.of(lockFile), result.getOutputPath());
            assertEquals(result.getYaml().orElseThrow(), Files.readString(lockFile));
            assertTrue(result.getError().isEmpty());
        }

        @Test
        @DisplayName("Imported read and main write permissions give the agent write")
        void mergedPermissions(@TempDir Path dir) throws Exception {
            String yaml = compiler(CompilerOptions.defaults()).compileFile(workspace(dir, MAIN)).getYaml().orElseThrow();

            Map<String, Object> workflow = load(yaml);
            assertEquals(Map.of(), workflow.get("permissions"));
            assertEquals(Map.of("contents", "read", "issues", "write"), job(workflow, "agent").get("permissions"));
            assertEquals("Issue triage", workflow.get("name"));
            assertEquals(Map.of("group", WorkflowCompiler.DEFAULT_CONCURRENCY_GROUP), workflow.get("concurrency"));
            assertEquals(Map.of("issues", Map.of("types", List.of("opened"))), workflow.get("on"));
        }

        @Test
        @DisplayName("The header lists the imports and the hash")
        void header(@TempDir Path dir) throws Exception {
            String yaml = compiler(CompilerOptions.defaults()).compileFile(workspace(dir, MAIN)).getYaml().orElseThrow();

            assertTrue(yaml.startsWith("# This file was automatically generated by agentflow"));
            assertTrue(yaml.contains("shared/base.md\n"));
            assertTrue(yaml.contains("# " + LockFileHeader.HASH_KEY + ": "));
            assertFalse(yaml.contains(LockFileHeader.STOP_TIME_KEY));
        }

        @Test
        @DisplayName("Recompiling unchanged sources gives identical bytes")
        void deterministic(@TempDir Path dir) throws Exception {
            Path source = workspace(dir, MAIN);
            WorkflowCompiler compiler = compiler(CompilerOptions.defaults());

            byte[] first = Files.readAllBytes(compiler.compileFile(source).getOutputPath().orElseThrow());
            byte[] second = Files.readAllBytes(
                    compiler(CompilerOptions.defaults(), Clock.offset(CLOCK, Duration.ofDays(3)))
                            .compileFile(source).getOutputPath().orElseThrow());

            assertArrayEquals(first, second);
        }

        @Test
        @DisplayName("No-emit returns the YAML without writing")
        void noEmit(@TempDir Path dir) throws Exception {
            CompilationResult result = compiler(CompilerOptions.builder().noEmit(true).build())
                    .compileFile(workspace(dir, MAIN));

            assertFalse(result.isWritten());
            assertTrue(result.getYaml().isPresent());
            assertFalse(Files.exists(dir.resolve("triage.lock.yml")));
        }

        @Test
        @DisplayName("An unreadable source is a parse error")
        void missingSource(@TempDir Path dir) {
            CompilationException e = assertThrows(CompilationException.class,
                    () -> compiler(CompilerOptions.defaults()).compileFile(dir.resolve("absent.md")));
            assertEquals(ErrorKind.MALFORMED_FRONTMATTER, e.getKind());
        }

        @Test
        @DisplayName("Lock file names replace the markdown extension")
        void lockFilePath() {
            WorkflowCompiler compiler = compiler(CompilerOptions.defaults());
            assertEquals(Paths.get("a/b.lock.yml"), compiler.lockFilePath(Paths.get("a/b.md")));
            assertEquals(Paths.get("a/b.txt.lock.yml"), compiler.lockFilePath(Paths.get("a/b.txt")));
        }
    }

    @Nested
    @DisplayName("Prompt composition")
    class Prompt {

        @Test
        @DisplayName("Reference mode emits runtime imports")
        void reference() throws Exception {
            String yaml = compileVirtual(CompilerOptions.builder(), MAIN);

            assertTrue(yaml.contains("{{#runtime-import shared/base.md}}"));
            assertTrue(yaml.contains("{{#runtime-import triage.md}}"));
            assertTrue(yaml.contains("Interpolate runtime imports"));
            assertFalse(yaml.contains("Shared rules"));
        }

        @Test
        @DisplayName("Inline mode embeds the bodies")
        void inline() throws Exception {
            String yaml = compileVirtual(CompilerOptions.builder().bodyComposition(BodyComposition.INLINE), MAIN);

            assertTrue(yaml.contains("Shared rules"));
            assertTrue(yaml.contains("Label issue ${{ github.event.issue.number }}."));
            assertFalse(yaml.contains("runtime-import"));
        }

        @Test
        @DisplayName("Imports with inputs or a section are inlined in reference mode")
        void parameterizedImportsInline() throws Exception {
            String main = "---\n"
                    + "on: push\n"
                    + "imports:\n"
                    + "  - shared/base.md\n"
                    + "  - path: shared/persona.md\n"
                    + "    inputs:\n"
                    + "      team: platform\n"
                    + "  - shared/guide.md#Labels\n"
                    + "---\n"
                    + "Do the work.\n";
            CompilerOptions.Builder options = CompilerOptions.builder()
                    .virtualFile("wf/shared/persona.md", "Act for the ${{ github.aw.inputs.team }} team.")
                    .virtualFile("wf/shared/guide.md", "# Tone\nBe brief.\n\n# Labels\nUse bug or feature.");

            String yaml = compileVirtual(options, main);

            assertTrue(yaml.contains("{{#runtime-import shared/base.md}}"));
            assertTrue(yaml.contains("Act for the platform team."));
            assertTrue(yaml.contains("Use bug or feature."));
            assertFalse(yaml.contains("Be brief."));
            assertFalse(yaml.contains("runtime-import shared/persona.md"));
            assertFalse(yaml.contains("github.aw.inputs"));
        }
    }

    @Nested
    @DisplayName("Import locations")
    class ImportLocations {

        @Test
        @DisplayName("A rooted import resolves inside the .github directory")
        void rootedImport() throws Exception {
            String main = "---\non: push\nimports: [/shared/a.md]\n---\nMain\n";
            WorkflowCompiler compiler = compiler(CompilerOptions.builder()
                    .virtualFile("shared/a.md", "Wrong copy")
                    .virtualFile(".github/shared/a.md", "Shared A")
                    .bodyComposition(BodyComposition.INLINE)
                    .build());

            String yaml = compiler.compileToYaml(compiler.parseWorkflowString(main, ".github/workflows/main.md"),
                    ".github/workflows/main.md");

            assertTrue(yaml.contains("Shared A"));
            assertFalse(yaml.contains("Wrong copy"));
            assertTrue(yaml.contains("#     - .github/shared/a.md"));
        }

        @Test
        @DisplayName("A configured import root is honoured")
        void configuredRoot() throws Exception {
            String main = "---\non: push\nimports: [/shared/a.md]\n---\nMain\n";
            WorkflowCompiler compiler = compiler(CompilerOptions.builder()
                    .importRoot(".")
                    .virtualFile("shared/a.md", "Repository copy")
                    .bodyComposition(BodyComposition.INLINE)
                    .build());

            String yaml = compiler.compileToYaml(compiler.parseWorkflowString(main, ".github/workflows/main.md"),
                    ".github/workflows/main.md");

            assertTrue(yaml.contains("Repository copy"));
        }

        @Test
        @DisplayName("Files outside the .github directory are never inlined")
        void escapingImport(@TempDir Path dir) throws Exception {
            Files.writeString(dir.resolve("secret.txt"), "TOP-SECRET-CONTENT");
            Path workflows = Files.createDirectories(dir.resolve("repo/.github/workflows"));
            Path source = workflows.resolve("main.md");
            Files.writeString(source, "---\non: push\nimports:\n  - ../../../secret.txt\n---\nMain\n");
            WorkflowCompiler compiler = compiler(CompilerOptions.builder()
                    .bodyComposition(BodyComposition.INLINE)
                    .build());

            WorkflowConfigurationException e = assertThrows(WorkflowConfigurationException.class,
                    () -> compiler.compileFile(source));

            assertEquals(ErrorKind.INVALID_CONFIGURATION, e.getKind());
            assertEquals("imports[0]", e.getFieldPath());
            assertFalse(e.getMessage().contains("TOP-SECRET-CONTENT"));
            assertFalse(Files.exists(workflows.resolve("main.lock.yml")));
        }
    }

    @Nested
    @DisplayName("Triggers")
    class Triggers {

        @Test
        @DisplayName("A missing trigger becomes manual dispatch")
        void defaultTrigger() throws Exception {
            String yaml = compileVirtual(CompilerOptions.builder(), "---\nname: Manual\n---\nDo it\n");
            assertEquals(Map.of("workflow_dispatch", Map.of()), load(yaml).get("on"));
        }

        @Test
        @DisplayName("Fuzzy schedules are scattered by workflow identifier")
        void schedule() throws Exception {
            String main = "---\non:\n  schedule: daily\n---\nReport\n";

            Map<String, Object> byFile = load(compileVirtual(CompilerOptions.builder(), main));
            Map<String, Object> byIdentifier = load(compileVirtual(
                    CompilerOptions.builder().workflowIdentifier("daily-report"), main));

            assertEquals(Map.of("schedule", List.of(Map.of("cron", "37 1 * * *"))), byFile.get("on"));
            assertEquals(Map.of("schedule", List.of(Map.of("cron", "59 13 * * *"))), byIdentifier.get("on"));
        }

        @Test
        @DisplayName("Trial mode dispatches manually against the logical repository")
        void trialMode() throws Exception {
            String yaml = compileVirtual(CompilerOptions.builder().trialMode("octo/real")
                    .bodyComposition(BodyComposition.INLINE), MAIN);

            Map<String, Object> workflow = load(yaml);
            Map<String, Object> dispatch = YamlSupport.asMap(YamlSupport.asMap(workflow.get("on")).get("workflow_dispatch"));
            Map<String, Object> input = YamlSupport.asMap(YamlSupport.asMap(dispatch.get("inputs")).get("issue_number"));
            assertEquals(Boolean.FALSE, input.get("required"));
            assertTrue(yaml.contains("Label issue ${{ inputs.issue_number }}."));
            assertTrue(yaml.contains("repository: octo/real"));
        }

        @Test
        @DisplayName("Trial mode needs a logical repository")
        void trialNeedsRepository() {
            assertThrows(IllegalArgumentException.class, () -> CompilerOptions.builder().trialMode(" ").build());
        }
    }

    @Nested
    @DisplayName("Stop time")
    class StopTime {

        private static final String STOPPING = "---\non:\n  issues:\n    types: [opened]\n  stop-after: +25h\n---\nTriage\n";

        @Test
        @DisplayName("stop-after becomes a pre-activation check")
        void preActivation(@TempDir Path dir) throws Exception {
            Path source = dir.resolve("stop.md");
            Files.writeString(source, STOPPING);

            String yaml = compiler(CompilerOptions.defaults()).compileFile(source).getYaml().orElseThrow();

            Map<String, Object> workflow = load(yaml);
            assertFalse(YamlSupport.asMap(workflow.get("on")).containsKey("stop-after"));
            assertTrue(yaml.contains("# AGENTFLOW_STOP_TIME: 2025-08-21 11:00:00\n"));
            assertEquals("pre_activation", job(workflow, "agent").get("needs"));
            assertEquals("needs.pre_activation.outputs.activated == 'true'", job(workflow, "agent").get("if"));
            assertNotNull(job(workflow, "pre_activation"));
        }

        @Test
        @DisplayName("A recompile keeps the recorded stop time unless refreshed")
        void preserved(@TempDir Path dir) throws Exception {
            Path source = dir.resolve("stop.md");
            Files.writeString(source, STOPPING);
            compiler(CompilerOptions.defaults()).compileFile(source);
            Clock later = Clock.offset(CLOCK, Duration.ofDays(2));

            String kept = compiler(CompilerOptions.defaults(), later).compileFile(source).getYaml().orElseThrow();
            String refreshed = compiler(CompilerOptions.builder().refreshStopTime(true).build(), later)
                    .compileFile(source).getYaml().orElseThrow();

            assertTrue(kept.contains("# AGENTFLOW_STOP_TIME: 2025-08-21 11:00:00\n"));
            assertTrue(refreshed.contains("# AGENTFLOW_STOP_TIME: 2025-08-23 11:00:00\n"));
        }
    }

    @Nested
    @DisplayName("Errors")
    class Errors {

        @Test
        @DisplayName("An unknown engine override suggests the closest engine")
        void unknownEngineOverride() {
            CompilationException e = assertThrows(CompilationException.class,
                    () -> compileVirtual(CompilerOptions.builder().engineOverride("gpt4"), MAIN));

            assertEquals(ErrorKind.UNKNOWN_ENGINE, e.getKind());
            assertTrue(e.getRawMessage().contains("Did you mean: custom?"));
        }

        @Test
        @DisplayName("The engine field selects the engine")
        void engineField() throws Exception {
            String yaml = compileVirtual(CompilerOptions.builder(), "---\non: push\nengine: claude\n---\nGo\n");
            assertTrue(yaml.contains("name: Execute Claude Code\n"));
            assertFalse(yaml.contains("COPILOT_GITHUB_TOKEN"));
        }

        @Test
        @DisplayName("Strict mode rejects write permissions on the agent")
        void strictPermissions() {
            WorkflowConfigurationException e = assertThrows(WorkflowConfigurationException.class,
                    () -> compileVirtual(CompilerOptions.builder().strict(true), MAIN));

            assertEquals(ErrorKind.STRICT_MODE_VIOLATION, e.getKind());
            assertEquals("permissions.issues", e.getFieldPath());
        }

        @Test
        @DisplayName("strict: true in frontmatter rejects a network wildcard")
        void strictNetwork() {
            WorkflowConfigurationException e = assertThrows(WorkflowConfigurationException.class,
                    () -> compileVirtual(CompilerOptions.builder(),
                            "---\non: push\nstrict: true\nnetwork:\n  allowed: [\"*\"]\n---\nGo\n"));

            assertEquals(ErrorKind.STRICT_MODE_VIOLATION, e.getKind());
            assertEquals("network.allowed", e.getFieldPath());
        }

        @Test
        @DisplayName("Import cycles are reported with their chain")
        void importCycle() {
            CompilerOptions options = CompilerOptions.builder()
                    .virtualFile("wf/a.md", "---\nimports: [b.md]\n---\nA\n")
                    .virtualFile("wf/b.md", "---\nimports: [a.md]\n---\nB\n")
                    .build();
            WorkflowCompiler compiler = compiler(options);

            ImportCycleException e = assertThrows(ImportCycleException.class, () -> compiler.compileToYaml(
                    compiler.parseWorkflowString("---\non: push\nimports: [a.md]\n---\nMain\n", "wf/main.md"),
                    "wf/main.md"));
            assertEquals(List.of("wf/a.md", "wf/b.md", "wf/a.md"), e.getChain());
        }

        @Test
        @DisplayName("A prompt asking for an undeclared safe output fails")
        void undeclaredSafeOutput() {
            CompilationException e = assertThrows(CompilationException.class,
                    () -> compileVirtual(CompilerOptions.builder(), "---\non: push\n---\nCall create_issue.\n"));
            assertEquals(ErrorKind.UNDECLARED_SAFE_OUTPUT, e.getKind());
        }

        @Test
        @DisplayName("Schema errors stop the compile unless validation is skipped")
        void schema() throws Exception {
            String invalid = "---\non: push\ntimeout-minutes: ten\n---\nGo\n";

            assertThrows(CompilationException.class, () -> compileVirtual(CompilerOptions.builder(), invalid));
            String yaml = compileVirtual(CompilerOptions.builder().skipValidation(true), invalid);
            assertEquals(20, job(load(yaml), "agent").get("timeout-minutes"));
        }
    }

    @Test
    @DisplayName("Safe outputs add a handler job after the agent")
    void safeOutputs() throws Exception {
        String yaml = compileVirtual(CompilerOptions.builder(),
                "---\non: push\nsafe-outputs:\n  create-issue:\n---\nUse create_issue for findings.\n");

        Map<String, Object> workflow = load(yaml);
        assertEquals(List.of("agent", "safe_outputs"), List.copyOf(YamlSupport.asMap(workflow.get("jobs")).keySet()));
        assertEquals(Map.of("contents", "read", "issues", "write"), job(workflow, "safe_outputs").get("permissions"));
        assertEquals("read-all", job(workflow, "agent").get("permissions"));
    }
}
