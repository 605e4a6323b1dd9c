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

package dev.mars.agentflow.workflow.imports;

import dev.mars.agentflow.core.exceptions.ErrorKind;
import dev.mars.agentflow.core.exceptions.ForbiddenFieldException;
import dev.mars.agentflow.core.exceptions.ImportCycleException;
import dev.mars.agentflow.core.exceptions.WorkflowConfigurationException;
import dev.mars.agentflow.core.exceptions.WorkflowSchemaException;
import dev.mars.agentflow.workflow.parser.FrontmatterParser;
import dev.mars.agentflow.workflow.parser.FrontmatterSchemaValidator;
import dev.mars.agentflow.workflow.parser.WorkflowDocument;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.*;

@DisplayName("ImportResolver")
class ImportResolverTest {

    private final FrontmatterParser parser = new FrontmatterParser();

    private ResolvedImports resolve(Map<String, String> files, String rootPath) throws Exception {
        WorkflowDocument root = parser.parse(files.get(rootPath), rootPath);
        return new ImportResolver(parser, new FrontmatterSchemaValidator(), new VirtualImportSource(files))
                .resolve(root);
    }

    private ResolvedImports resolve(Map<String, String> files, String rootPath, String importRoot) throws Exception {
        WorkflowDocument root = parser.parse(files.get(rootPath), rootPath);
        return new ImportResolver(parser, new FrontmatterSchemaValidator(), new VirtualImportSource(files), importRoot)
                .resolve(root);
    }

    private static Map<String, String> files(String... pathsAndContents) {
        Map<String, String> files = new LinkedHashMap<>();
        for (int i = 0; i < pathsAndContents.length; i += 2) {
            files.put(pathsAndContents[i], pathsAndContents[i + 1]);
        }
        return files;
    }

    @Nested
    @DisplayName("Traversal order")
    class Order {

        @Test
        @DisplayName("A fragment's own imports precede it and siblings keep declared order")
        void postOrder() throws Exception {
            Map<String, String> files = files(
                    "wf/main.md", "---\nimports: [shared/a.md, shared/c.md]\n---\nMain",
                    "wf/shared/a.md", "---\nimports: [b.md]\n---\nA",
                    "wf/shared/b.md", "B",
                    "wf/shared/c.md", "C");

            ResolvedImports resolved = resolve(files, "wf/main.md");

            assertEquals(List.of("wf/shared/b.md", "wf/shared/a.md", "wf/shared/c.md"),
                    resolved.getImportedPaths());
            assertEquals("wf/main.md", resolved.allDocuments().get(3).getSourcePath());
        }

        @Test
        @DisplayName("A diamond import is loaded once")
        void diamond() throws Exception {
            Map<String, String> files = files(
                    "main.md", "---\nimports: [left.md, right.md]\n---\n",
                    "left.md", "---\nimports: [base.md]\n---\nL",
                    "right.md", "---\nimports: [base.md]\n---\nR",
                    "base.md", "---\nlabels: [shared]\n---\nBase");

            ResolvedImports resolved = resolve(files, "main.md");

            assertEquals(List.of("base.md", "left.md", "right.md"), resolved.getImportedPaths());
            assertEquals(List.of("left.md", "right.md"), resolved.getGraph().getImports("main.md"));
        }

        @Test
        @DisplayName("Object entries with a path are accepted")
        void objectEntry() throws Exception {
            Map<String, String> files = files(
                    "main.md", "---\nimports:\n  - path: tools.md\n---\n",
                    "tools.md", "---\ntools:\n  edit:\n---\n");

            assertEquals(List.of("tools.md"), resolve(files, "main.md").getImportedPaths());
        }
    }

    @Nested
    @DisplayName("Errors")
    class Errors {

        @Test
        @DisplayName("A two-file cycle names both files")
        void cycle() {
            Map<String, String> files = files(
                    "a.md", "---\nimports: [b.md]\n---\nA",
                    "b.md", "---\nimports: [a.md]\n---\nB");

            ImportCycleException e = assertThrows(ImportCycleException.class, () -> resolve(files, "a.md"));

            assertEquals(ErrorKind.IMPORT_CYCLE, e.getKind());
            assertEquals(List.of("a.md", "b.md", "a.md"), e.getChain());
            assertTrue(e.getMessage().contains("a.md → b.md → a.md"));
        }

        @Test
        @DisplayName("A self import is a cycle")
        void selfImport() {
            Map<String, String> files = files("a.md", "---\nimports: [./a.md]\n---\n");
            ImportCycleException e = assertThrows(ImportCycleException.class, () -> resolve(files, "a.md"));
            assertEquals(List.of("a.md", "a.md"), e.getChain());
        }

        @Test
        @DisplayName("A fragment declaring 'on' is rejected at the field")
        void forbiddenOn() {
            Map<String, String> files = files(
                    "main.md", "---\non: push\nimports: [shared.md]\n---\n",
                    "shared.md", "---\nlabels: [x]\non: issues\n---\n");

            ForbiddenFieldException e = assertThrows(ForbiddenFieldException.class,
                    () -> resolve(files, "main.md"));

            assertEquals("on", e.getField());
            assertEquals("shared.md", e.getFragmentPath());
            assertEquals(3, e.getLineNumber());
        }

        @Test
        @DisplayName("Forbidden fields are checked before the schema")
        void forbiddenBeforeSchema() {
            Map<String, String> files = files(
                    "main.md", "---\nimports: [shared.md]\n---\n",
                    "shared.md", "---\ntimeout-minutes: never\n---\n");

            assertThrows(ForbiddenFieldException.class, () -> resolve(files, "main.md"));
        }

        @Test
        @DisplayName("A missing import is positioned at its imports entry")
        void missing() {
            Map<String, String> files = files("main.md", "---\nname: x\nimports:\n  - gone.md\n---\n");

            WorkflowConfigurationException e = assertThrows(WorkflowConfigurationException.class,
                    () -> resolve(files, "main.md"));

            assertEquals(ErrorKind.MISSING_IMPORT, e.getKind());
            assertEquals("imports[0]", e.getFieldPath());
            assertEquals(4, e.getLineNumber());
        }

        @Test
        @DisplayName("A section that the fragment does not contain is rejected at the entry")
        void missingSection() {
            Map<String, String> files = files(
                    "main.md", "---\nimports: ['shared.md#Tools']\n---\n",
                    "shared.md", "# Setup\nInstall things");

            WorkflowConfigurationException e = assertThrows(WorkflowConfigurationException.class,
                    () -> resolve(files, "main.md"));
            assertEquals(ErrorKind.INVALID_CONFIGURATION, e.getKind());
            assertEquals("imports[0]", e.getFieldPath());
            assertTrue(e.getMessage().contains("Section 'Tools' not found"));
        }

        @Test
        @DisplayName("Inputs must be a mapping")
        void scalarInputs() throws Exception {
            Map<String, String> files = files(
                    "main.md", "---\nimports:\n  - path: shared.md\n    inputs: platform\n---\n",
                    "shared.md", "Shared");
            WorkflowDocument root = parser.parse(files.get("main.md"), "main.md");

            WorkflowSchemaException e = assertThrows(WorkflowSchemaException.class,
                    () -> new ImportResolver(parser, null, new VirtualImportSource(files)).resolve(root));
            assertEquals("imports[0].inputs", e.getFieldPath());
        }

        @Test
        @DisplayName("Schema errors inside a fragment are reported against the fragment")
        void fragmentSchemaError() {
            Map<String, String> files = files(
                    "main.md", "---\nimports: [shared.md]\n---\n",
                    "shared.md", "---\nlabels: nope\n---\n");

            WorkflowSchemaException e = assertThrows(WorkflowSchemaException.class, () -> resolve(files, "main.md"));
            assertEquals("shared.md", e.getSourcePath());
        }

        @Test
        @DisplayName("A read failure is reported as a missing import")
        void readFailure() throws Exception {
            ImportSource source = mock(ImportSource.class);
            when(source.read("locked.md")).thenThrow(new IOException("permission denied"));
            WorkflowDocument root = parser.parse("---\nimports: [locked.md]\n---\n", "main.md");

            WorkflowConfigurationException e = assertThrows(WorkflowConfigurationException.class,
                    () -> new ImportResolver(parser, null, source).resolve(root));

            assertEquals(ErrorKind.MISSING_IMPORT, e.getKind());
            assertTrue(e.getMessage().contains("permission denied"));
            verify(source).read("locked.md");
        }
    }

    @Nested
    @DisplayName("Import root")
    class ImportRoot {

        @Test
        @DisplayName("A rooted reference resolves against the .github directory of the workflow")
        void rootedReference() throws Exception {
            Map<String, String> files = files(
                    ".github/workflows/main.md", "---\nimports: [/shared/a.md]\n---\nMain",
                    "shared/a.md", "Repository root copy",
                    ".github/shared/a.md", "Shared A");

            ResolvedImports resolved = resolve(files, ".github/workflows/main.md");

            assertEquals(List.of(".github/shared/a.md"), resolved.getImportedPaths());
            assertEquals("Shared A", resolved.getFragments().get(0).getBody());
        }

        @Test
        @DisplayName("A configured root replaces the default")
        void configuredRoot() throws Exception {
            Map<String, String> files = files(
                    "repo/workflows/main.md", "---\nimports: [/lib/common.md]\n---\nMain",
                    "repo/lib/common.md", "Common");

            ResolvedImports resolved = resolve(files, "repo/workflows/main.md", "repo");

            assertEquals(List.of("repo/lib/common.md"), resolved.getImportedPaths());
        }

        @Test
        @DisplayName("An import escaping the root is rejected before it is read")
        void escapingImport() throws Exception {
            ImportSource source = mock(ImportSource.class);
            WorkflowDocument root = parser.parse("---\nimports:\n  - ../../../secret.txt\n---\n",
                    "repo/.github/workflows/main.md");

            WorkflowConfigurationException e = assertThrows(WorkflowConfigurationException.class,
                    () -> new ImportResolver(parser, null, source).resolve(root));

            assertEquals(ErrorKind.INVALID_CONFIGURATION, e.getKind());
            assertEquals("imports[0]", e.getFieldPath());
            assertEquals(3, e.getLineNumber());
            assertTrue(e.getMessage().contains("outside the import root 'repo/.github'"));
            verify(source, never()).read(anyString());
        }

        @Test
        @DisplayName("A rooted reference cannot climb out of the root")
        void rootedEscape() {
            Map<String, String> files = files(
                    ".github/workflows/main.md", "---\nimports: [/../notes.md]\n---\n",
                    "notes.md", "Private notes");

            WorkflowConfigurationException e = assertThrows(WorkflowConfigurationException.class,
                    () -> resolve(files, ".github/workflows/main.md"));
            assertEquals(ErrorKind.INVALID_CONFIGURATION, e.getKind());
        }

        @Test
        @DisplayName("Compiled lock files cannot be imported")
        void lockFile() {
            Map<String, String> files = files(
                    "main.md", "---\nimports: [other.lock.yml]\n---\n",
                    "other.lock.yml", "name: other");

            WorkflowConfigurationException e = assertThrows(WorkflowConfigurationException.class,
                    () -> resolve(files, "main.md"));
            assertEquals(ErrorKind.INVALID_CONFIGURATION, e.getKind());
            assertTrue(e.getMessage().contains("import the source .md file instead"));
        }

        @ParameterizedTest(name = "{0} -> ''{1}''")
        @CsvSource({
                ".github/workflows/main.md, .github",
                "/repo/.github/workflows/nested/main.md, /repo/.github",
                "wf/main.md, wf",
                "main.md, ''"
        })
        @DisplayName("The default root is the enclosing .github directory or the workflow directory")
        void defaultRoot(String workflowPath, String expected) {
            assertEquals(expected, ImportResolver.defaultImportRoot(workflowPath));
        }
    }

    @Nested
    @DisplayName("Sections and inputs")
    class SectionsAndInputs {

        @Test
        @DisplayName("A section reference records the section and loads the whole file once")
        void sectionReference() throws Exception {
            Map<String, String> files = files(
                    "main.md", "---\nimports: ['shared.md#Tools']\n---\nMain",
                    "shared.md", "---\nlabels: [shared]\n---\n# Setup\nA\n\n# Tools\nUse bash");

            ResolvedImports resolved = resolve(files, "main.md");
            WorkflowDocument fragment = resolved.getFragments().get(0);
            ImportSpec spec = resolved.getSpec(fragment).orElseThrow();

            assertEquals("shared.md", fragment.getSourcePath());
            assertEquals("Tools", spec.getSection().orElseThrow());
            assertEquals("# Tools\nUse bash", spec.apply(fragment.getBody()));
            assertTrue(resolved.getSpec(resolved.getRoot()).isEmpty());
        }

        @Test
        @DisplayName("Object entries carry their inputs")
        void inputs() throws Exception {
            Map<String, String> files = files(
                    "main.md", "---\nimports:\n  - path: shared.md\n    inputs:\n      team: platform\n---\n",
                    "shared.md", "Page ${{ github.aw.inputs.team }}");

            ResolvedImports resolved = resolve(files, "main.md");
            ImportSpec spec = resolved.getSpec(resolved.getFragments().get(0)).orElseThrow();

            assertEquals(Map.of("team", "platform"), spec.getInputs());
            assertTrue(spec.requiresInlining());
            assertEquals("Page platform", spec.apply(resolved.getFragments().get(0).getBody()));
        }
    }

    @Nested
    @DisplayName("Sources")
    class Sources {

        @Test
        @DisplayName("Reads fragments from the file system relative to the importer")
        void fileSystem(@TempDir Path dir) throws Exception {
            Path workflows = Files.createDirectories(dir.resolve(".github/workflows"));
            Files.writeString(workflows.resolve("shared.md"), "---\nlabels: [fs]\n---\nShared");
            Path main = workflows.resolve("main.md");
            Files.writeString(main, "---\nimports: [shared.md]\n---\nMain");

            String rootPath = ImportSource.normalize(main.toString());
            WorkflowDocument root = parser.parse(Files.readString(main), rootPath);
            ResolvedImports resolved = new ImportResolver(parser, null, new FileSystemImportSource()).resolve(root);

            assertEquals(1, resolved.getFragments().size());
            assertEquals("Shared", resolved.getFragments().get(0).getBody());
        }

        @Test
        @DisplayName("Virtual files take precedence over the fallback")
        void virtualFallback() throws Exception {
            ImportSource fallback = mock(ImportSource.class);
            when(fallback.read("other.md")).thenReturn(Optional.of("from fallback"));
            VirtualImportSource source = new VirtualImportSource(Map.of("./mem.md", "from memory"), fallback);

            assertEquals("from memory", source.read("mem.md").orElseThrow());
            assertEquals("from fallback", source.read("other.md").orElseThrow());
            verify(fallback, never()).read("mem.md");
        }
    }
}
