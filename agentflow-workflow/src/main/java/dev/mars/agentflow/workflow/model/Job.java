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

import dev.mars.agentflow.permissions.Permissions;
import dev.mars.agentflow.permissions.PermissionsRenderer;
import dev.mars.agentflow.workflow.parser.YamlSupport;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;
import java.util.function.UnaryOperator;

/**
 * One job of a compiled workflow.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-08-21
 * @version 1.0
 */
public final class Job {

    private final String id;
    private final String name;
    private final Object runsOn;
    private final List<String> needs;
    private final String ifCondition;
    private final Permissions permissions;
    private final Object environment;
    private final Object concurrency;
    private final Object container;
    private final Integer timeoutMinutes;
    private final Map<String, String> outputs;
    private final Map<String, Object> env;
    private final List<Step> steps;

    private Job(Builder builder) {
        this.id = Objects.requireNonNull(builder.id, "Job id cannot be null");
        this.name = builder.name;
        this.runsOn = Objects.requireNonNull(builder.runsOn, "runs-on cannot be null");
        this.needs = List.copyOf(builder.needs);
        this.ifCondition = builder.ifCondition;
        this.permissions = Objects.requireNonNull(builder.permissions, "Job permissions cannot be null");
        this.environment = builder.environment;
        this.concurrency = builder.concurrency;
        this.container = builder.container;
        this.timeoutMinutes = builder.timeoutMinutes;
        this.outputs = new TreeMap<>(builder.outputs);
        this.env = new TreeMap<>(builder.env);
        this.steps = List.copyOf(builder.steps);
        if (steps.isEmpty()) {
            throw new IllegalArgumentException("Job '" + id + "' has no steps");
        }
    }

    public static Builder builder(String id) {
        return new Builder(id);
    }

    public String getId() {
        return id;
    }

    public String getName() {
        return name;
    }

    public Object getRunsOn() {
        return runsOn;
    }

    public List<String> getNeeds() {
        return needs;
    }

    public String getIfCondition() {
        return ifCondition;
    }

    public Permissions getPermissions() {
        return permissions;
    }

    public Integer getTimeoutMinutes() {
        return timeoutMinutes;
    }

    public Map<String, String> getOutputs() {
        return outputs;
    }

    public List<Step> getSteps() {
        return steps;
    }

    /**
     * @return a copy of this job with every step string and the condition passed through {@code mapper}
     */
    public Job mapStrings(UnaryOperator<String> mapper) {
        Builder copy = toBuilder();
        copy.ifCondition = ifCondition == null ? null : mapper.apply(ifCondition);
        copy.steps.clear();
        for (Step step : steps) {
            copy.steps.add(step.mapStrings(mapper));
        }
        return copy.build();
    }

    private Builder toBuilder() {
        Builder copy = new Builder(id)
                .name(name)
                .runsOn(runsOn)
                .ifCondition(ifCondition)
                .permissions(permissions)
                .environment(environment)
                .concurrency(concurrency)
                .container(container)
                .timeoutMinutes(timeoutMinutes);
        copy.needs.addAll(needs);
        copy.outputs.putAll(outputs);
        copy.env.putAll(env);
        copy.steps.addAll(steps);
        return copy;
    }

    public Map<String, Object> toMap() {
        Map<String, Object> map = new LinkedHashMap<>();
        if (name != null) {
            map.put("name", name);
        }
        map.put("runs-on", YamlSupport.mutableCopy(runsOn));
        if (!needs.isEmpty()) {
            map.put("needs", needs.size() == 1 ? needs.get(0) : new ArrayList<>(needs));
        }
        if (ifCondition != null) {
            map.put("if", ifCondition);
        }
        map.put("permissions", PermissionsRenderer.toYamlValue(permissions));
        if (environment != null) {
            map.put("environment", YamlSupport.mutableCopy(environment));
        }
        if (concurrency != null) {
            map.put("concurrency", YamlSupport.mutableCopy(concurrency));
        }
        if (container != null) {
            map.put("container", YamlSupport.mutableCopy(container));
        }
        if (timeoutMinutes != null) {
            map.put("timeout-minutes", timeoutMinutes);
        }
        if (!outputs.isEmpty()) {
            map.put("outputs", new TreeMap<>(outputs));
        }
        if (!env.isEmpty()) {
            map.put("env", YamlSupport.mutableCopy(env));
        }
        List<Object> stepMaps = new ArrayList<>();
        for (Step step : steps) {
            stepMaps.add(step.toMap());
        }
        map.put("steps", stepMaps);
        return map;
    }

    @Override
    public String toString() {
        return "Job{id='" + id + "', steps=" + steps.size() + '}';
    }

    public static final class Builder {
        private final String id;
        private String name;
        private Object runsOn;
        private final List<String> needs = new ArrayList<>();
        private String ifCondition;
        private Permissions permissions = Permissions.empty();
        private Object environment;
        private Object concurrency;
        private Object container;
        private Integer timeoutMinutes;
        private final Map<String, String> outputs = new TreeMap<>();
        private final Map<String, Object> env = new TreeMap<>();
        private final List<Step> steps = new ArrayList<>();

        private Builder(String id) {
            this.id = id;
        }

        public Builder name(String name) {
            this.name = name;
            return this;
        }

        public Builder runsOn(Object runsOn) {
            this.runsOn = runsOn;
            return this;
        }

        public Builder needs(String jobId) {
            this.needs.add(jobId);
            return this;
        }

        public Builder ifCondition(String condition) {
            this.ifCondition = condition;
            return this;
        }

        public Builder permissions(Permissions permissions) {
            this.permissions = permissions;
            return this;
        }

        public Builder environment(Object environment) {
            this.environment = environment;
            return this;
        }

        public Builder concurrency(Object concurrency) {
            this.concurrency = concurrency;
            return this;
        }

        public Builder container(Object container) {
            this.container = container;
            return this;
        }

        public Builder timeoutMinutes(Integer timeoutMinutes) {
            this.timeoutMinutes = timeoutMinutes;
            return this;
        }

        public Builder output(String name, String expression) {
            this.outputs.put(name, expression);
            return this;
        }

        public Builder env(Map<String, ?> values) {
            this.env.putAll(values);
            return this;
        }

        public Builder step(Step step) {
            this.steps.add(Objects.requireNonNull(step, "Step cannot be null"));
            return this;
        }

        public Builder steps(List<Step> steps) {
            for (Step step : steps) {
                step(step);
            }
            return this;
        }

        public Job build() {
            return new Job(this);
        }
    }
}
