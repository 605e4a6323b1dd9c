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
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class CompilationExceptionTest {

    @Test
    @DisplayName("Message carries file, position and field path")
    void testMessageFormat() {
        WorkflowSchemaException e = new WorkflowSchemaException(ErrorKind.UNKNOWN_FIELD, "wf.md",
                SourcePosition.of(4, 1), "tool", "Unknown property 'tool'");
        assertEquals("wf.md:4:1: Field 'tool': Unknown property 'tool'", e.getMessage());
        assertEquals("Unknown property 'tool'", e.getRawMessage());
        assertEquals(4, e.getLineNumber());
        assertEquals(1, e.getColumn());
        assertEquals(ErrorKind.UNKNOWN_FIELD, e.getKind());
    }

    @Test
    void testSchemaExceptionRejectsForeignKind() {
        assertThrows(IllegalArgumentException.class, () -> new WorkflowSchemaException(ErrorKind.IMPORT_CYCLE,
                "wf.md", SourcePosition.UNKNOWN, "x", "y"));
    }

    @Test
    void testImportCycleChain() {
        ImportCycleException e = new ImportCycleException("a.md", SourcePosition.of(3, 5), List.of("a.md", "b.md", "a.md"));
        assertEquals(List.of("a.md", "b.md", "a.md"), e.getChain());
        assertTrue(e.getMessage().contains("a.md → b.md → a.md"));
        assertEquals(ErrorKind.IMPORT_CYCLE, e.getKind());
    }

    @Test
    void testForbiddenField() {
        ForbiddenFieldException e = new ForbiddenFieldException("shared/x.md", SourcePosition.of(2, 1), "on");
        assertEquals("on", e.getField());
        assertEquals("shared/x.md", e.getFragmentPath());
        assertTrue(e.getMessage().contains("'on' cannot be used in imported fragment 'shared/x.md'"));
    }

    @Test
    void testConfigurationSuggestionsAreImmutable() {
        WorkflowConfigurationException e = new WorkflowConfigurationException(ErrorKind.UNKNOWN_ENGINE, null,
                SourcePosition.UNKNOWN, "engine", "bad", List.of("custom"));
        assertEquals(List.of("custom"), e.getSuggestions());
        assertThrows(UnsupportedOperationException.class, () -> e.getSuggestions().add("x"));
    }

    private enum Stage { A, B, C }

    @Test
    void testInvalidTransitionMessage() {
        InvalidTransitionException e = new InvalidTransitionException("wf.md", Stage.A, Stage.C, new Stage[]{Stage.B});
        assertEquals("Invalid stage transition for 'wf.md': A → C. Valid targets: [B]", e.getMessage());
        assertEquals(Stage.A, e.getCurrentState());
        assertEquals(Stage.C, e.getRequestedState());
    }
}
