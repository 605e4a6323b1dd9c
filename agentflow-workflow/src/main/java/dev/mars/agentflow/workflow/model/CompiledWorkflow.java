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

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.TreeMap;

/**
 * The GitHub Actions workflow produced from one markdown document, before
 * it is rendered to YAML.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-08-21
 * @version 1.0
 */
public final class CompiledWorkflow {

    private final String name;
    private final Object on;
    private final Permissions permissions;
    private final Object concurrency;
    private final String runName;
    private final Map<String, Object> env;
    private final Map<String, Job> jobs;

    private CompiledWorkflow(Builder builder) {
        this.name = Objects.requireNonNull(builder.name, "Workflow name cannot be null");
        this.on = Objects.requireNonNull(builder.on, "Workflow triggers cannot be null");
        this.permissions = builder.permissions;
        this.concurrency = builder.concurrency;
        this.runName = builder.runName;
        this.env = new TreeMap<>(builder.env);
        this.jobs = new LinkedHashMap<>(builder.jobs);
    }

    public static Builder builder(String name) {
        return new Builder(name);
    }

    public String getName() {
        return name;
    }

    public Object getOn() {
        return on;
    }

    public Permissions getPermissions() {
        return permissions;
    }

    public Map<String, Job> getJobs() {
        return jobs;
    }

    public Optional<Job> getJob(String id) {
        return Optional.ofNullable(jobs.get(id));
    }

    public Map<String, Object> toMap() {
        Map<String, Object> map = new LinkedHashMap<>();
        map.put("name", name);
        map.put("on", YamlSupport.mutableCopy(on));
        map.put("permissions", PermissionsRenderer.toYamlValue(permissions));
        if (concurrency != null) {
            map.put("concurrency", YamlSupport.mutableCopy(concurrency));
        }
        if (runName != null) {
            map.put("run-name", runName);
        }
        if (!env.isEmpty()) {
            map.put("env", YamlSupport.mutableCopy(env));
        }
        Map<String, Object> jobMaps = new LinkedHashMap<>();
        jobs.forEach((id, job) -> jobMaps.put(id, job.toMap()));
        map.put("jobs", jobMaps);
        return map;
    }

    @Override
    public String toString() {
        return "CompiledWorkflow{name='" + name + "', jobs=" + List.copyOf(jobs.keySet()) + '}';
    }

    public static final class Builder {
        private final String name;
        private Object on;
        private Permissions permissions = Permissions.empty();
        private Object concurrency;
        private String runName;
        private final Map<String, Object> env = new TreeMap<>();
        private final Map<String, Job> jobs = new LinkedHashMap<>();

        private Builder(String name) {
            this.name = name;
        }

        public Builder on(Object on) {
            this.on = on;
            return this;
        }

        public Builder permissions(Permissions permissions) {
            this.permissions = Objects.requireNonNull(permissions, "Permissions cannot be null");
            return this;
        }

        public Builder concurrency(Object concurrency) {
            this.concurrency = concurrency;
            return this;
        }

        public Builder runName(String runName) {
            this.runName = runName;
            return this;
        }

        public Builder env(Map<String, ?> values) {
            this.env.putAll(values);
            return this;
        }

        public Builder job(Job job) {
            if (jobs.putIfAbsent(job.getId(), job) != null) {
                throw new IllegalArgumentException("Duplicate job id: " + job.getId());
            }
            return this;
        }

        public CompiledWorkflow build() {
            if (jobs.isEmpty()) {
                throw new IllegalArgumentException("Workflow '" + name + "' has no jobs");
            }
            return new CompiledWorkflow(this);
        }
    }
}
