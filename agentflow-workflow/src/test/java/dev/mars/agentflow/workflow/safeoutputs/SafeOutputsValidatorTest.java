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

package dev.mars.agentflow.workflow.safeoutputs;

import dev.mars.agentflow.core.exceptions.ErrorKind;
import dev.mars.agentflow.core.exceptions.WorkflowConfigurationException;
import dev.mars.agentflow.workflow.parser.FrontmatterParser;
import dev.mars.agentflow.workflow.parser.WorkflowDocument;
import dev.mars.agentflow.workflow.tools.ToolConfiguration;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("Undeclared safe output detection")
class SafeOutputsValidatorTest {

    private final FrontmatterParser parser = new FrontmatterParser();

    private void validate(String frontmatter, String body, WorkflowDocument... fragments) throws Exception {
        WorkflowDocument root = parser.parse("---\n" + frontmatter + "---\n" + body, "main.md");
        SafeOutputsConfig config = SafeOutputsConfig.parse(root.getFrontmatter(), root);
        ToolConfiguration tools = ToolConfiguration.parse(root.getFrontmatter(), root);
        List<WorkflowDocument> documents = new ArrayList<>(List.of(fragments));
        documents.add(root);
        SafeOutputsValidator.validate(config, tools, documents, root);
    }

    @Test
    @DisplayName("A prompt asking for an undeclared tool is rejected")
    void undeclaredInPrompt() {
        WorkflowConfigurationException e = assertThrows(WorkflowConfigurationException.class,
                () -> validate("on: push\n", "Use create_issue to report problems.\n"));

        assertEquals(ErrorKind.UNDECLARED_SAFE_OUTPUT, e.getKind());
        assertEquals("safe-outputs", e.getFieldPath());
        assertTrue(e.getRawMessage().contains("'main.md' asks for 'create_issue'"));
        assertTrue(e.getRawMessage().endsWith("does not declare 'create-issue'"));
    }

    @Test
    @DisplayName("Fragment bodies are scanned too")
    void undeclaredInFragment() throws Exception {
        WorkflowDocument fragment = parser.parse("Always add_comment when done.\n", "shared/rules.md");

        WorkflowConfigurationException e = assertThrows(WorkflowConfigurationException.class,
                () -> validate("on: push\n", "Main task\n", fragment));
        assertTrue(e.getRawMessage().contains("'shared/rules.md' asks for 'add_comment'"));
    }

    @Test
    @DisplayName("Declared kinds, reporting kinds and partial words pass")
    void accepted() {
        assertDoesNotThrow(() -> validate("safe-outputs:\n  create-issue:\n",
                "Use create_issue, or missing_tool and noop. Never create_issues_in_bulk.\n"));
        assertDoesNotThrow(() -> validate("on: push\n", "Report with missing_tool if stuck.\n"));
    }

    @Test
    @DisplayName("A GitHub write tool needs the matching safe output")
    void githubWriteTool() {
        WorkflowConfigurationException e = assertThrows(WorkflowConfigurationException.class,
                () -> validate("tools:\n  github:\n    allowed: [get_issue, push_files]\n", "Body\n"));

        assertTrue(e.getRawMessage().contains("the GitHub tool 'push_files' writes to the repository"));
        assertDoesNotThrow(() -> validate("tools:\n  github:\n    allowed: [push_files]\n"
                + "safe-outputs:\n  push-to-pull-request-branch:\n", "Body\n"));
    }
}
