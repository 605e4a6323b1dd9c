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

import dev.mars.agentflow.core.exceptions.InvalidTransitionException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("Compilation stages")
class CompilationStageTest {

    @Nested
    @DisplayName("Transitions")
    class Transitions {

        @ParameterizedTest
        @EnumSource(value = CompilationStage.class, names = "EMITTED", mode = EnumSource.Mode.EXCLUDE)
        @DisplayName("Each stage moves only to the next one")
        void onlyNext(CompilationStage stage) {
            CompilationStage next = CompilationStage.values()[stage.ordinal() + 1];
            for (CompilationStage target : CompilationStage.values()) {
                assertEquals(target == next, stage.canTransitionTo(target), stage + " -> " + target);
            }
            assertArrayEquals(new CompilationStage[]{next}, stage.getValidTransitions());
            assertFalse(stage.isTerminal());
        }

        @Test
        @DisplayName("EMITTED is terminal")
        void terminal() {
            assertTrue(CompilationStage.EMITTED.isTerminal());
            assertEquals(0, CompilationStage.EMITTED.getValidTransitions().length);
            for (CompilationStage target : CompilationStage.values()) {
                assertFalse(CompilationStage.EMITTED.canTransitionTo(target));
            }
        }
    }

    @Nested
    @DisplayName("Tracker")
    class Tracker {

        @Test
        @DisplayName("Walks the full pipeline in order")
        void fullPipeline() throws Exception {
            StageTracker tracker = new StageTracker("wf.md");
            assertEquals(CompilationStage.PARSED, tracker.getStage());

            tracker.advance(CompilationStage.IMPORTED);
            tracker.advance(CompilationStage.MERGED);
            tracker.advance(CompilationStage.ENGINE_SELECTED);
            tracker.advance(CompilationStage.SAFE_OUTPUTS_WIRED);
            tracker.advance(CompilationStage.EMITTED);

            assertEquals(CompilationStage.EMITTED, tracker.getStage());
        }

        @Test
        @DisplayName("Skipping a stage is rejected and leaves the stage unchanged")
        void skip() {
            StageTracker tracker = new StageTracker("wf.md");

            InvalidTransitionException e = assertThrows(InvalidTransitionException.class,
                    () -> tracker.advance(CompilationStage.MERGED));

            assertEquals("wf.md", e.getDocumentPath());
            assertEquals(CompilationStage.PARSED, e.getCurrentState());
            assertEquals(CompilationStage.MERGED, e.getRequestedState());
            assertArrayEquals(new CompilationStage[]{CompilationStage.IMPORTED}, e.getValidTransitions());
            assertTrue(e.getMessage().contains("PARSED → MERGED"));
            assertEquals(CompilationStage.PARSED, tracker.getStage());
        }

        @Test
        @DisplayName("Repeating a stage is rejected")
        void repeat() throws Exception {
            StageTracker tracker = new StageTracker("wf.md");
            tracker.advance(CompilationStage.IMPORTED);

            assertThrows(InvalidTransitionException.class, () -> tracker.advance(CompilationStage.IMPORTED));
        }
    }
}
