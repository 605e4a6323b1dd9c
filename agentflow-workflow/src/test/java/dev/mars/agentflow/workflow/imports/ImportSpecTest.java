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

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("ImportSpec")
class ImportSpecTest {

    private static final String GUIDE = "Intro\n"
            + "\n"
            + "# Review\n"
            + "Check the diff.\n"
            + "## Style\n"
            + "Use the house style.\n"
            + "#### Deep note\n"
            + "Still part of Style.\n"
            + "# Release\n"
            + "Tag it.\n";

    @Nested
    @DisplayName("References")
    class References {

        @Test
        @DisplayName("Splits the file from the section")
        void splitsSection() {
            ImportSpec spec = ImportSpec.of("shared/guide.md#Review", null);

            assertEquals("shared/guide.md", spec.getPath());
            assertEquals("Review", spec.getSection().orElseThrow());
            assertTrue(spec.requiresInlining());
            assertEquals("shared/guide.md#Review", spec.toString());
        }

        @Test
        @DisplayName("A plain reference is loaded at runtime")
        void plainReference() {
            ImportSpec spec = ImportSpec.of("shared/guide.md", Map.of());

            assertTrue(spec.getSection().isEmpty());
            assertFalse(spec.requiresInlining());
            assertEquals(GUIDE, spec.apply(GUIDE));
        }

        @Test
        @DisplayName("An empty section name is ignored")
        void emptySection() {
            assertTrue(ImportSpec.of("guide.md#", null).getSection().isEmpty());
        }
    }

    @Nested
    @DisplayName("Body selection")
    class BodySelection {

        @Test
        @DisplayName("A section runs until the next heading of the same or a higher level")
        void sectionBounds() {
            assertEquals("# Review\nCheck the diff.\n## Style\nUse the house style.\n#### Deep note\nStill part of Style.",
                    ImportSpec.of("guide.md#Review", null).apply(GUIDE));
            assertEquals("## Style\nUse the house style.\n#### Deep note\nStill part of Style.",
                    ImportSpec.of("guide.md#Style", null).apply(GUIDE));
            assertEquals("# Release\nTag it.", ImportSpec.of("guide.md#Release", null).apply(GUIDE));
        }

        @Test
        @DisplayName("H4 headings cannot start a section")
        void deepHeading() {
            assertEquals("", ImportSpec.of("guide.md#Deep note", null).apply(GUIDE));
        }

        @Test
        @DisplayName("Inputs replace their expressions and leave unknown ones alone")
        void inputs() {
            ImportSpec spec = ImportSpec.of("guide.md", Map.of("team", "platform", "limit", 3));

            assertEquals("Team platform may open 3 issues for ${{ github.aw.inputs.owner }}.",
                    spec.apply("Team ${{ github.aw.inputs.team }} may open ${{github.aw.inputs.limit}} issues"
                            + " for ${{ github.aw.inputs.owner }}."));
        }

        @Test
        @DisplayName("Input values are inserted literally")
        void literalValues() {
            ImportSpec spec = ImportSpec.of("guide.md", Map.of("pattern", "$1 \\d"));
            assertEquals("Match $1 \\d", spec.apply("Match ${{ github.aw.inputs.pattern }}"));
        }
    }
}
