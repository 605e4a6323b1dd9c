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

package dev.mars.agentflow.workflow.model;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("Steps")
class StepTest {

    @Test
    @DisplayName("A step needs run or uses")
    void requiresAction() {
        IllegalArgumentException e = assertThrows(IllegalArgumentException.class,
                () -> Step.builder("Empty").build());
        assertTrue(e.getMessage().contains("'Empty'"));
    }

    @Test
    @DisplayName("Builder keeps field order and sorts env and with")
    void builder() {
        Step step = Step.builder("Build")
                .id("build")
                .ifCondition("always()")
                .uses("actions/setup-java@v4")
                .with("java-version", "17")
                .with("distribution", "temurin")
                .env("B", "2")
                .env("A", "1")
                .continueOnError()
                .build();

        Map<String, Object> map = step.toMap();
        assertEquals(List.of("name", "id", "if", "uses", "continue-on-error", "env", "with"),
                new ArrayList<>(map.keySet()));
        assertEquals(List.of("A", "B"), new ArrayList<>(step.getEnv().keySet()));
        assertEquals(List.of("distribution", "java-version"), new ArrayList<>(step.getWith().keySet()));
    }

    @Test
    @DisplayName("Author steps are copied and keep their own env values")
    void fromMap() {
        Map<String, Object> authored = new LinkedHashMap<>();
        authored.put("name", "Custom");
        authored.put("run", "make");
        authored.put("env", new LinkedHashMap<>(Map.of("MODE", "mine")));

        Step step = Step.fromMap(authored).withDefaultEnv(Map.of("MODE", "default", "EXTRA", "x"));
        authored.put("run", "changed");

        assertEquals("make", step.getRun());
        assertEquals(Map.of("MODE", "mine", "EXTRA", "x"), step.getEnv());
        assertNull(step.getId());
        assertTrue(step.getWith().isEmpty());
    }

    @Test
    @DisplayName("String mapping reaches nested values")
    void mapStrings() {
        Step step = Step.builder("Checkout")
                .uses("actions/checkout@v5")
                .with("repository", "${{ github.repository }}")
                .env("LIST", List.of("${{ github.repository }}"))
                .build();

        Step mapped = step.mapStrings(s -> s.replace("github.repository", "'octo/trial'"));

        assertEquals("${{ 'octo/trial' }}", mapped.getWith().get("repository"));
        assertEquals(List.of("${{ 'octo/trial' }}"), mapped.getEnv().get("LIST"));
        assertEquals("${{ github.repository }}", step.getWith().get("repository"));
    }

    @Test
    @DisplayName("Equal fields make equal steps")
    void equality() {
        assertEquals(Step.builder("A").run("x").build(), Step.builder("A").run("x").build());
        assertNotEquals(Step.builder("A").run("x").build(), Step.builder("A").run("y").build());
    }
}
