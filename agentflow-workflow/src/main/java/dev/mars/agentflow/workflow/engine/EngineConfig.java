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

package dev.mars.agentflow.workflow.engine;

import dev.mars.agentflow.core.SourcePosition;
import dev.mars.agentflow.core.exceptions.ErrorKind;
import dev.mars.agentflow.core.exceptions.WorkflowConfigurationException;
import dev.mars.agentflow.workflow.parser.YamlSupport;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.TreeMap;

/**
 * Settings of the {@code engine} section, in either of its forms:
 * <pre>
 * engine: claude
 *
 * engine:
 *   id: copilot
 *   model: gpt-5
 *   max-turns: 10
 * </pre>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-08-21
 * @version 1.0
 */
public final class EngineConfig {

    private final String id;
    private final String version;
    private final String model;
    private final String maxTurns;
    private final String command;
    private final Map<String, String> env;
    private final List<String> args;
    private final List<Map<String, Object>> steps;
    private final String script;

    private EngineConfig(String id, String version, String model, String maxTurns, String command,
                         Map<String, String> env, List<String> args, List<Map<String, Object>> steps,
                         String script) {
        this.id = Objects.requireNonNull(id, "Engine id cannot be null");
        this.version = version;
        this.model = model;
        this.maxTurns = maxTurns;
        this.command = command;
        this.env = Collections.unmodifiableMap(new TreeMap<>(env));
        this.args = List.copyOf(args);
        this.steps = List.copyOf(steps);
        this.script = script;
    }

    public static EngineConfig of(String id) {
        return new EngineConfig(id, null, null, null, null, Map.of(), List.of(), List.of(), null);
    }

    /**
     * Reads an {@code engine} value.
     *
     * @param value     the string or mapping from the frontmatter
     * @param sourcePath document reported in errors
     * @param position  position reported in errors
     * @throws WorkflowConfigurationException if the value has neither form or lacks an id
     */
    public static EngineConfig from(Object value, String sourcePath, SourcePosition position)
            throws WorkflowConfigurationException {
        if (value instanceof String) {
            return of(((String) value).trim());
        }
        Map<String, Object> map = YamlSupport.asMap(value);
        if (map == null || !(map.get("id") instanceof String)) {
            throw new WorkflowConfigurationException(ErrorKind.INVALID_CONFIGURATION, sourcePath, position,
                    "engine", "engine must be an engine name or a mapping with an 'id'");
        }

        Map<String, String> env = new TreeMap<>();
        Map<String, Object> envMap = YamlSupport.asMap(map.get("env"));
        if (envMap != null) {
            envMap.forEach((key, item) -> env.put(key, String.valueOf(item)));
        }
        List<String> args = new ArrayList<>();
        List<Object> argList = YamlSupport.asList(map.get("args"));
        if (argList != null) {
            for (Object arg : argList) {
                args.add(String.valueOf(arg));
            }
        }
        List<Map<String, Object>> steps = new ArrayList<>();
        List<Object> stepList = YamlSupport.asList(map.get("steps"));
        if (stepList != null) {
            for (int i = 0; i < stepList.size(); i++) {
                Map<String, Object> step = YamlSupport.asMap(stepList.get(i));
                if (step == null) {
                    throw new WorkflowConfigurationException(ErrorKind.INVALID_CONFIGURATION, sourcePath, position,
                            "engine.steps[" + i + "]", "engine steps must be mappings");
                }
                steps.add(step);
            }
        }

        return new EngineConfig(((String) map.get("id")).trim(), text(map.get("version")), text(map.get("model")),
                text(map.get("max-turns")), text(map.get("command")), env, args, steps, text(map.get("script")));
    }

    private static String text(Object value) {
        return value == null ? null : String.valueOf(value);
    }

    public String getId() {
        return id;
    }

    public Optional<String> getVersion() {
        return Optional.ofNullable(version);
    }

    public Optional<String> getModel() {
        return Optional.ofNullable(model);
    }

    public Optional<String> getMaxTurns() {
        return Optional.ofNullable(maxTurns);
    }

    /**
     * @return a custom executable; when present the engine is not installed
     */
    public Optional<String> getCommand() {
        return Optional.ofNullable(command);
    }

    public Map<String, String> getEnv() {
        return env;
    }

    public List<String> getArgs() {
        return args;
    }

    public List<Map<String, Object>> getSteps() {
        return steps;
    }

    public Optional<String> getScript() {
        return Optional.ofNullable(script);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        EngineConfig that = (EngineConfig) o;
        return id.equals(that.id) && Objects.equals(version, that.version) && Objects.equals(model, that.model)
                && Objects.equals(maxTurns, that.maxTurns) && Objects.equals(command, that.command)
                && env.equals(that.env) && args.equals(that.args) && steps.equals(that.steps)
                && Objects.equals(script, that.script);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id, version, model, maxTurns, command, env, args, steps, script);
    }

    @Override
    public String toString() {
        return "EngineConfig{id='" + id + "', version=" + version + ", model=" + model + '}';
    }
}
