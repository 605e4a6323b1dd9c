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

package dev.mars.agentflow.workflow.emit;

import dev.mars.agentflow.workflow.parser.YamlSupport;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeSet;

/**
 * Key order of emitted workflows. Known keys come first in a fixed priority
 * order, any others follow lexically, and nested maps are lexical. The
 * trigger section is kept exactly as authored.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-08-22
 * @version 1.0
 */
public final class FieldOrdering {

    static final List<String> WORKFLOW_PRIORITY = List.of(
            "name", "on", "permissions", "concurrency", "run-name", "env", "jobs");
    static final List<String> JOB_PRIORITY = List.of(
            "name", "runs-on", "needs", "if", "permissions", "environment", "concurrency",
            "timeout-minutes", "outputs", "env", "steps");
    static final List<String> STEP_PRIORITY = List.of(
            "name", "id", "if", "run", "uses", "script", "env", "with");

    private FieldOrdering() {
    }

    public static Map<String, Object> orderWorkflow(Map<String, Object> workflow) {
        Map<String, Object> ordered = new LinkedHashMap<>();
        for (String key : keyOrder(workflow, WORKFLOW_PRIORITY)) {
            Object value = workflow.get(key);
            if ("on".equals(key)) {
                ordered.put(key, YamlSupport.mutableCopy(value));
            } else if ("jobs".equals(key) && value instanceof Map) {
                Map<String, Object> jobs = new LinkedHashMap<>();
                YamlSupport.asMap(value).forEach((id, job) -> jobs.put(id, orderJob(YamlSupport.asMap(job))));
                ordered.put(key, jobs);
            } else {
                ordered.put(key, orderNested(value));
            }
        }
        return ordered;
    }

    public static Map<String, Object> orderJob(Map<String, Object> job) {
        Map<String, Object> ordered = new LinkedHashMap<>();
        for (String key : keyOrder(job, JOB_PRIORITY)) {
            Object value = job.get(key);
            if ("steps".equals(key) && value instanceof List) {
                List<Object> steps = new ArrayList<>();
                for (Object step : YamlSupport.asList(value)) {
                    steps.add(step instanceof Map ? orderStep(YamlSupport.asMap(step)) : orderNested(step));
                }
                ordered.put(key, steps);
            } else {
                ordered.put(key, orderNested(value));
            }
        }
        return ordered;
    }

    public static Map<String, Object> orderStep(Map<String, Object> step) {
        Map<String, Object> ordered = new LinkedHashMap<>();
        for (String key : keyOrder(step, STEP_PRIORITY)) {
            ordered.put(key, orderNested(step.get(key)));
        }
        return ordered;
    }

    /**
     * Sorts map keys lexically at every depth; list order is kept.
     */
    static Object orderNested(Object value) {
        if (value instanceof Map) {
            Map<String, Object> map = YamlSupport.asMap(value);
            Map<String, Object> ordered = new LinkedHashMap<>();
            for (String key : new TreeSet<>(map.keySet())) {
                ordered.put(key, orderNested(map.get(key)));
            }
            return ordered;
        }
        if (value instanceof List) {
            List<Object> ordered = new ArrayList<>();
            for (Object item : YamlSupport.asList(value)) {
                ordered.add(orderNested(item));
            }
            return ordered;
        }
        return value;
    }

    private static List<String> keyOrder(Map<String, Object> map, List<String> priority) {
        List<String> keys = new ArrayList<>();
        for (String key : priority) {
            if (map.containsKey(key)) {
                keys.add(key);
            }
        }
        for (String key : new TreeSet<>(map.keySet())) {
            if (!priority.contains(key)) {
                keys.add(key);
            }
        }
        return keys;
    }
}
