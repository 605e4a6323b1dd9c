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

import dev.mars.agentflow.core.exceptions.ErrorKind;
import dev.mars.agentflow.core.exceptions.WorkflowSchemaException;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("FrontmatterSchemaValidator")
class FrontmatterSchemaValidatorTest {

    private static FrontmatterSchemaValidator validator;
    private final FrontmatterParser parser = new FrontmatterParser();

    @BeforeAll
    static void loadSchema() {
        validator = new FrontmatterSchemaValidator();
    }

    private WorkflowDocument parse(String frontmatter) throws Exception {
        return parser.parse("---\n" + frontmatter + "---\nPrompt\n", "workflow.md");
    }

    @Nested
    @DisplayName("Valid documents")
    class Valid {

        @Test
        @DisplayName("Accepts a typical workflow")
        void typicalWorkflow() throws Exception {
            WorkflowDocument document = parse(String.join("\n",
                    "on:",
                    "  issues:",
                    "    types: [opened]",
                    "permissions:",
                    "  contents: read",
                    "  issues: write",
                    "engine:",
                    "  id: claude",
                    "  max-turns: 5",
                    "tools:",
                    "  bash: [\"echo\", \"ls\"]",
                    "  github:",
                    "    toolsets: [issues]",
                    "safe-outputs:",
                    "  add-labels:",
                    "    max: 2",
                    "network:",
                    "  allowed: [example.com]",
                    "timeout-minutes: 10",
                    "roles: [admin, write]",
                    ""));

            assertDoesNotThrow(() -> validator.validate(document));
            assertTrue(validator.check(document).isValid());
        }

        @Test
        @DisplayName("A document without frontmatter is valid")
        void noFrontmatter() throws Exception {
            WorkflowDocument document = parser.parse("Only a prompt", "plain.md");
            assertTrue(validator.check(document).isValid());
        }

        @Test
        @DisplayName("The legacy timeout field is a warning, not an error")
        void legacyTimeoutWarns() throws Exception {
            ValidationResult result = validator.check(parse("timeout_minutes: 15\n"));
            assertTrue(result.isValid());
            assertTrue(result.hasWarnings());
            assertEquals("timeout_minutes", result.getWarnings().get(0).getFieldPath());
        }
    }

    @Nested
    @DisplayName("Invalid documents")
    class Invalid {

        @Test
        @DisplayName("Unknown top-level field suggests the closest name")
        void unknownField() throws Exception {
            WorkflowDocument document = parse("on: push\npermisions: read-all\n");

            WorkflowSchemaException e = assertThrows(WorkflowSchemaException.class,
                    () -> validator.validate(document));

            assertEquals(ErrorKind.UNKNOWN_FIELD, e.getKind());
            assertEquals("permisions", e.getFieldPath());
            assertEquals(3, e.getLineNumber());
            assertTrue(e.getMessage().contains("Did you mean: permissions?"));
        }

        @Test
        @DisplayName("Wrong type is reported at the field")
        void wrongType() throws Exception {
            WorkflowSchemaException e = assertThrows(WorkflowSchemaException.class,
                    () -> validator.validate(parse("on: push\ntimeout-minutes: ten\n")));

            assertEquals(ErrorKind.INVALID_FIELD, e.getKind());
            assertEquals("timeout-minutes", e.getFieldPath());
            assertEquals(3, e.getLineNumber());
        }

        @Test
        @DisplayName("id-token: read is rejected")
        void idTokenRead() throws Exception {
            WorkflowSchemaException e = assertThrows(WorkflowSchemaException.class,
                    () -> validator.validate(parse("permissions:\n  id-token: read\n")));

            assertEquals(ErrorKind.INVALID_FIELD, e.getKind());
            assertTrue(e.getFieldPath().startsWith("permissions"));
        }

        @Test
        @DisplayName("An unknown role is rejected")
        void unknownRole() throws Exception {
            assertFalse(validator.check(parse("roles: [owner]\n")).isValid());
        }

        @Test
        @DisplayName("A non-positive safe-output max is rejected")
        void safeOutputMax() throws Exception {
            assertFalse(validator.check(parse("safe-outputs:\n  create-issue:\n    max: 0\n")).isValid());
        }

        @Test
        @DisplayName("The first reported error is the same on every run")
        void deterministicFirstError() throws Exception {
            WorkflowDocument document = parse("timeout-minutes: ten\nstrict: maybe\nlabels: 3\n");

            WorkflowSchemaException first = assertThrows(WorkflowSchemaException.class,
                    () -> validator.validate(document));
            WorkflowSchemaException second = assertThrows(WorkflowSchemaException.class,
                    () -> validator.validate(document));

            assertEquals(first.getFieldPath(), second.getFieldPath());
            assertEquals(first.getMessage(), second.getMessage());
            assertTrue(first.getMessage().contains("more schema error"));
        }
    }

    @Test
    @DisplayName("JSON paths map to frontmatter field paths")
    void toFieldPath() {
        assertEquals("", FrontmatterSchemaValidator.toFieldPath("$"));
        assertEquals("tools.web-fetch", FrontmatterSchemaValidator.toFieldPath("$.tools['web-fetch']"));
        assertEquals("imports[0]", FrontmatterSchemaValidator.toFieldPath("$.imports[0]"));
    }
}
