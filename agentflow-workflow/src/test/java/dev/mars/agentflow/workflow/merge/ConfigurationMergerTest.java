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

package dev.mars.agentflow.workflow.merge;

import dev.mars.agentflow.permissions.PermissionLevel;
import dev.mars.agentflow.permissions.PermissionScope;
import dev.mars.agentflow.permissions.Permissions;
import dev.mars.agentflow.workflow.imports.ImportResolver;
import dev.mars.agentflow.workflow.imports.ResolvedImports;
import dev.mars.agentflow.workflow.imports.VirtualImportSource;
import dev.mars.agentflow.workflow.parser.Frontmatter;
import dev.mars.agentflow.workflow.parser.FrontmatterParser;
import dev.mars.agentflow.workflow.parser.WorkflowDocument;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("ConfigurationMerger")
class ConfigurationMergerTest {

    private final FrontmatterParser parser = new FrontmatterParser();

    private EffectiveConfiguration merge(BodyComposition composition, String root, String... fragments)
            throws Exception {
        Map<String, String> files = new LinkedHashMap<>();
        StringBuilder imports = new StringBuilder("imports:\n");
        for (int i = 0; i < fragments.length; i++) {
            String path = "shared/f" + i + ".md";
            files.put("wf/" + path, fragments[i]);
            imports.append("  - ").append(path).append('\n');
        }
        String rootContent = fragments.length > 0 ? "---\n" + imports + root.substring("---\n".length()) : root;
        WorkflowDocument document = parser.parse(rootContent, "wf/main.md");
        ResolvedImports resolved = new ImportResolver(parser, null, new VirtualImportSource(files)).resolve(document);
        return new ConfigurationMerger(composition).merge(resolved);
    }

    private EffectiveConfiguration merge(String root, String... fragments) throws Exception {
        return merge(BodyComposition.INLINE, root, fragments);
    }

    @Nested
    @DisplayName("Permissions")
    class PermissionMerge {

        @Test
        @DisplayName("Imported read and root write on the same scope yields write")
        void writeWins() throws Exception {
            EffectiveConfiguration effective = merge(
                    "---\npermissions:\n  issues: write\n---\nMain",
                    "---\npermissions:\n  issues: read\n  contents: read\n---\n");

            Permissions permissions = effective.getPermissions().orElseThrow();
            assertEquals(PermissionLevel.WRITE, permissions.get(PermissionScope.ISSUES).orElseThrow());
            assertEquals(PermissionLevel.READ, permissions.get(PermissionScope.CONTENTS).orElseThrow());
        }

        @Test
        @DisplayName("A fragment never downgrades the root")
        void noDowngrade() throws Exception {
            EffectiveConfiguration effective = merge(
                    "---\npermissions: write-all\n---\n",
                    "---\npermissions: read-all\n---\n");

            assertEquals(Permissions.writeAll(), effective.getPermissions().orElseThrow());
        }

        @Test
        @DisplayName("No permissions anywhere leaves them unset")
        void absent() throws Exception {
            assertTrue(merge("---\nlabels: [a]\n---\n").getPermissions().isEmpty());
        }

        @Test
        @DisplayName("Permissions are not copied into the effective frontmatter")
        void notInFrontmatter() throws Exception {
            EffectiveConfiguration effective = merge("---\npermissions: read-all\n---\n",
                    "---\nlabels: [x]\n---\n");
            assertFalse(effective.getFrontmatter().has("permissions"));
            assertFalse(effective.getFrontmatter().has("imports"));
        }
    }

    @Nested
    @DisplayName("Fields")
    class Fields {

        @Test
        @DisplayName("Lists union in first-seen order, fragments first")
        void listUnion() throws Exception {
            EffectiveConfiguration effective = merge(
                    "---\nlabels: [b, c]\n---\n",
                    "---\nlabels: [a, b]\n---\n");

            assertEquals(List.of("a", "b", "c"), effective.getFrontmatter().getList("labels"));
        }

        @Test
        @DisplayName("Tool maps deep merge, the root wins scalar conflicts and nested lists union")
        void toolsDeepMerge() throws Exception {
            EffectiveConfiguration effective = merge(
                    "---\ntools:\n  bash: [echo]\n  github:\n    read-only: true\n---\n",
                    "---\ntools:\n  bash: [ls]\n  edit:\n  github:\n    read-only: false\n    toolsets: [issues]\n---\n");

            Map<String, Object> tools = effective.getFrontmatter().getMap("tools");
            assertEquals(List.of("ls", "echo"), tools.get("bash"));
            assertTrue(tools.containsKey("edit"));
            @SuppressWarnings("unchecked")
            Map<String, Object> github = (Map<String, Object>) tools.get("github");
            assertEquals(true, github.get("read-only"));
            assertEquals(List.of("issues"), github.get("toolsets"));
        }

        @Test
        @DisplayName("Network defaults shorthand merges with explicit domains")
        void networkShorthand() throws Exception {
            EffectiveConfiguration effective = merge(
                    "---\nnetwork:\n  allowed: [example.com]\n---\n",
                    "---\nnetwork: defaults\n---\n");

            assertEquals(List.of("defaults", "example.com"),
                    effective.getFrontmatter().getMap("network").get("allowed"));
        }

        @Test
        @DisplayName("Scalars: root wins, else the first fragment that sets one")
        void scalars() throws Exception {
            EffectiveConfiguration effective = merge(
                    "---\nengine: claude\n---\n",
                    "---\nengine: copilot\ndescription: first\n---\n",
                    "---\ndescription: second\n---\n");

            Frontmatter frontmatter = effective.getFrontmatter();
            assertEquals("claude", frontmatter.get("engine"));
            assertEquals("first", frontmatter.get("description"));
        }

        @Test
        @DisplayName("Merging a fragment that repeats the root changes nothing")
        void idempotent() throws Exception {
            String root = "---\nlabels: [x]\nenv:\n  MODE: fast\n---\n";
            EffectiveConfiguration alone = merge(root);
            EffectiveConfiguration repeated = merge(root, "---\nlabels: [x]\nenv:\n  MODE: fast\n---\n");

            assertEquals(alone.getFrontmatter(), repeated.getFrontmatter());
        }

        @Test
        @DisplayName("Values merge without changing the inputs")
        void mergeValuesIsPure() {
            Map<String, Object> earlier = new LinkedHashMap<>(Map.of("a", List.of(1)));
            Map<String, Object> later = new LinkedHashMap<>(Map.of("a", List.of(2), "b", "x"));

            Object merged = ConfigurationMerger.mergeValues(earlier, later);

            assertEquals(Map.of("a", List.of(1, 2), "b", "x"), merged);
            assertEquals(Map.of("a", List.of(1)), earlier);
        }
    }

    @Nested
    @DisplayName("Prompt")
    class Prompt {

        @Test
        @DisplayName("Inline composition concatenates bodies, fragments first")
        void inline() throws Exception {
            EffectiveConfiguration effective = merge(BodyComposition.INLINE,
                    "---\nname: main\n---\nMain task", "---\nlabels: [a]\n---\nShared rules", "No frontmatter");

            assertEquals("Shared rules\n\nNo frontmatter\n\nMain task", effective.getPrompt());
        }

        @Test
        @DisplayName("Reference composition emits runtime-import macros")
        void reference() throws Exception {
            EffectiveConfiguration effective = merge(BodyComposition.REFERENCE,
                    "---\nname: main\n---\nMain task", "---\nlabels: [a]\n---\nShared rules", "---\nlabels: [b]\n---\n");

            assertEquals("{{#runtime-import shared/f0.md}}\n{{#runtime-import main.md}}", effective.getPrompt());
        }

        @Test
        @DisplayName("Paths under .github are kept from the .github directory")
        void githubPaths() {
            assertEquals(".github/workflows/shared/a.md",
                    PromptComposer.repositoryPath("/repo/.github/workflows/shared/a.md", "/repo/.github/workflows/main.md"));
            assertEquals(".github/workflows/main.md",
                    PromptComposer.repositoryPath(".github/workflows/main.md", ".github/workflows/main.md"));
        }
    }
}
