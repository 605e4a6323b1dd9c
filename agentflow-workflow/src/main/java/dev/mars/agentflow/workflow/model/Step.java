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

import dev.mars.agentflow.workflow.parser.YamlSupport;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;
import java.util.function.UnaryOperator;

/**
 * One step of a compiled job.
 *
 * <p>Steps built by the compiler go through the {@link Builder}; steps written
 * by the author ({@code steps}, {@code post-steps}, custom engine steps) are
 * wrapped with {@link #fromMap(Map)} and keep every key they declare.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-08-21
 * @version 1.0
 */
public final class Step {

    private final Map<String, Object> fields;

    private Step(Map<String, Object> fields) {
        this.fields = fields;
    }

    public static Builder builder(String name) {
        return new Builder(name);
    }

    /**
     * Wraps an author-written step mapping.
     */
    public static Step fromMap(Map<String, Object> step) {
        Objects.requireNonNull(step, "Step cannot be null");
        @SuppressWarnings("unchecked")
        Map<String, Object> copy = (Map<String, Object>) YamlSupport.mutableCopy(step);
        return new Step(copy);
    }

    public String getName() {
        return (String) fields.get("name");
    }

    public String getId() {
        return (String) fields.get("id");
    }

    public String getRun() {
        return (String) fields.get("run");
    }

    public String getUses() {
        return (String) fields.get("uses");
    }

    public Map<String, Object> getEnv() {
        Map<String, Object> env = YamlSupport.asMap(fields.get("env"));
        return env == null ? Map.of() : env;
    }

    public Map<String, Object> getWith() {
        Map<String, Object> with = YamlSupport.asMap(fields.get("with"));
        return with == null ? Map.of() : with;
    }

    /**
     * @return a copy of this step with extra environment variables; existing keys win
     */
    public Step withDefaultEnv(Map<String, String> env) {
        Map<String, Object> copy = toMap();
        Map<String, Object> merged = new TreeMap<>(env);
        merged.putAll(getEnv());
        if (!merged.isEmpty()) {
            copy.put("env", merged);
        }
        return new Step(copy);
    }

    /**
     * @return a copy of this step with every string value passed through {@code mapper}
     */
    public Step mapStrings(UnaryOperator<String> mapper) {
        @SuppressWarnings("unchecked")
        Map<String, Object> mapped = (Map<String, Object>) mapValue(fields, mapper);
        return new Step(mapped);
    }

    private static Object mapValue(Object value, UnaryOperator<String> mapper) {
        if (value instanceof String) {
            return mapper.apply((String) value);
        }
        if (value instanceof Map) {
            Map<String, Object> result = new LinkedHashMap<>();
            YamlSupport.asMap(value).forEach((key, item) -> result.put(key, mapValue(item, mapper)));
            return result;
        }
        if (value instanceof List) {
            List<Object> result = new ArrayList<>();
            for (Object item : YamlSupport.asList(value)) {
                result.add(mapValue(item, mapper));
            }
            return result;
        }
        return value;
    }

    @SuppressWarnings("unchecked")
    public Map<String, Object> toMap() {
        return (Map<String, Object>) YamlSupport.mutableCopy(fields);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        return fields.equals(((Step) o).fields);
    }

    @Override
    public int hashCode() {
        return fields.hashCode();
    }

    @Override
    public String toString() {
        return "Step{" + fields + '}';
    }

    public static final class Builder {
        private final Map<String, Object> fields = new LinkedHashMap<>();
        private final Map<String, Object> env = new TreeMap<>();
        private final Map<String, Object> with = new TreeMap<>();

        private Builder(String name) {
            fields.put("name", Objects.requireNonNull(name, "Step name cannot be null"));
        }

        public Builder id(String id) {
            fields.put("id", id);
            return this;
        }

        public Builder ifCondition(String condition) {
            fields.put("if", condition);
            return this;
        }

        public Builder run(String script) {
            fields.put("run", script);
            return this;
        }

        public Builder uses(String action) {
            fields.put("uses", action);
            return this;
        }

        public Builder env(String key, Object value) {
            env.put(key, value);
            return this;
        }

        public Builder env(Map<String, ?> values) {
            env.putAll(values);
            return this;
        }

        public Builder with(String key, Object value) {
            with.put(key, value);
            return this;
        }

        public Builder continueOnError() {
            fields.put("continue-on-error", true);
            return this;
        }

        public Step build() {
            if (!fields.containsKey("run") && !fields.containsKey("uses")) {
                throw new IllegalArgumentException("Step '" + fields.get("name") + "' needs either run or uses");
            }
            Map<String, Object> result = new LinkedHashMap<>(fields);
            if (!env.isEmpty()) {
                result.put("env", new TreeMap<>(env));
            }
            if (!with.isEmpty()) {
                result.put("with", new TreeMap<>(with));
            }
            return new Step(result);
        }
    }
}
