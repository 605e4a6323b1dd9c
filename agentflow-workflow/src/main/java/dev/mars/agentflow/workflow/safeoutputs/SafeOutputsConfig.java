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
import dev.mars.agentflow.permissions.PermissionScope;
import dev.mars.agentflow.permissions.Permissions;
import dev.mars.agentflow.util.StringSimilarity;
import dev.mars.agentflow.workflow.emit.JsonSupport;
import dev.mars.agentflow.workflow.parser.Frontmatter;
import dev.mars.agentflow.workflow.parser.FrontmatterFields;
import dev.mars.agentflow.workflow.parser.WorkflowDocument;
import dev.mars.agentflow.workflow.parser.YamlSupport;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;

/**
 * The declared {@code safe-outputs} kinds with their limits.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-08-22
 * @version 1.0
 */
public final class SafeOutputsConfig {

    static final String STAGED = "staged";

    private static final SafeOutputsConfig DISABLED = new SafeOutputsConfig(Map.of(), false);

    private final Map<SafeOutputKind, Map<String, Object>> kinds;
    private final boolean staged;

    private SafeOutputsConfig(Map<SafeOutputKind, Map<String, Object>> kinds, boolean staged) {
        Map<SafeOutputKind, Map<String, Object>> copy = new EnumMap<>(SafeOutputKind.class);
        kinds.forEach((kind, settings) -> copy.put(kind, Collections.unmodifiableMap(new TreeMap<>(settings))));
        this.kinds = Collections.unmodifiableMap(copy);
        this.staged = staged;
    }

    public static SafeOutputsConfig disabled() {
        return DISABLED;
    }

    /**
     * Reads the effective {@code safe-outputs} section. When any kind is
     * declared the reporting kinds are added with their defaults.
     *
     * @throws WorkflowConfigurationException for unknown kinds or invalid limits
     */
    public static SafeOutputsConfig parse(Frontmatter effective, WorkflowDocument root)
            throws WorkflowConfigurationException {
        Map<String, Object> section = effective.getMap(FrontmatterFields.SAFE_OUTPUTS);
        Map<SafeOutputKind, Map<String, Object>> kinds = new EnumMap<>(SafeOutputKind.class);
        boolean staged = false;

        for (Map.Entry<String, Object> entry : section.entrySet()) {
            String fieldPath = FrontmatterFields.SAFE_OUTPUTS + "." + entry.getKey();
            if (STAGED.equals(entry.getKey())) {
                staged = Boolean.TRUE.equals(entry.getValue());
                continue;
            }
            SafeOutputKind kind = SafeOutputKind.fromYaml(entry.getKey()).orElse(null);
            if (kind == null) {
                List<String> names = new ArrayList<>();
                for (SafeOutputKind candidate : SafeOutputKind.values()) {
                    names.add(candidate.yamlName());
                }
                List<String> suggestions = StringSimilarity.closestMatches(entry.getKey(), names, 3, 4);
                String message = "Unknown safe output '" + entry.getKey() + "'";
                if (!suggestions.isEmpty()) {
                    message += ".\n\nDid you mean: " + suggestions.get(0) + "?";
                }
                throw new WorkflowConfigurationException(ErrorKind.INVALID_CONFIGURATION, root.getSourcePath(),
                        root.getSourceMap().positionOf(fieldPath), fieldPath, message, suggestions);
            }
            kinds.put(kind, settings(kind, entry.getValue(), fieldPath, root));
        }

        if (!kinds.isEmpty()) {
            for (SafeOutputKind kind : SafeOutputKind.values()) {
                if (kind.isAlwaysOn()) {
                    kinds.computeIfAbsent(kind, k -> Map.of("max", k.defaultMax()));
                }
            }
        }
        return kinds.isEmpty() ? DISABLED : new SafeOutputsConfig(kinds, staged);
    }

    private static Map<String, Object> settings(SafeOutputKind kind, Object value, String fieldPath,
                                                WorkflowDocument root) throws WorkflowConfigurationException {
        Map<String, Object> settings = new TreeMap<>();
        settings.put("max", kind.defaultMax());
        if (value == null) {
            return settings;
        }
        Map<String, Object> map = YamlSupport.asMap(value);
        if (map == null) {
            throw new WorkflowConfigurationException(ErrorKind.INVALID_CONFIGURATION, root.getSourcePath(),
                    root.getSourceMap().positionOf(fieldPath), fieldPath,
                    "Safe output '" + kind.yamlName() + "' must be empty or a mapping");
        }
        for (Map.Entry<String, Object> option : map.entrySet()) {
            settings.put(option.getKey(), YamlSupport.mutableCopy(option.getValue()));
        }
        Object max = settings.get("max");
        if (!(max instanceof Integer) || (Integer) max < 1) {
            throw new WorkflowConfigurationException(ErrorKind.INVALID_CONFIGURATION, root.getSourcePath(),
                    root.getSourceMap().positionOf(fieldPath + ".max"), fieldPath + ".max",
                    "max must be a positive integer");
        }
        return settings;
    }

    public boolean isEnabled() {
        return !kinds.isEmpty();
    }

    public boolean isStaged() {
        return staged;
    }

    public Set<SafeOutputKind> getKinds() {
        return kinds.keySet();
    }

    public boolean isDeclared(SafeOutputKind kind) {
        return kinds.containsKey(kind);
    }

    public int getMax(SafeOutputKind kind) {
        Map<String, Object> settings = kinds.get(kind);
        return settings == null ? 0 : (Integer) settings.get("max");
    }

    public Map<String, Object> getSettings(SafeOutputKind kind) {
        Map<String, Object> settings = kinds.get(kind);
        return settings == null ? Map.of() : settings;
    }

    /**
     * Permissions of the job that performs the writes: {@code contents: read}
     * merged with what every declared kind requires.
     */
    public Permissions requiredPermissions() {
        Permissions permissions = Permissions.read(PermissionScope.CONTENTS);
        for (SafeOutputKind kind : kinds.keySet()) {
            permissions = permissions.merge(kind.requiredPermissions());
        }
        return permissions;
    }

    /**
     * @return compact JSON of tool name to limits, the exact allow-list the output collector enforces
     */
    public String toConfigJson() {
        Map<String, Object> config = new TreeMap<>();
        kinds.forEach((kind, settings) -> config.put(kind.toolName(), settings));
        return JsonSupport.toCompactJson(config);
    }

    @Override
    public String toString() {
        return "SafeOutputsConfig{kinds=" + kinds.keySet() + ", staged=" + staged + '}';
    }
}
