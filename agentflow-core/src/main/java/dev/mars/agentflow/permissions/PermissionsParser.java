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

package dev.mars.agentflow.permissions;

import dev.mars.agentflow.core.exceptions.WorkflowSchemaException;
import org.yaml.snakeyaml.LoaderOptions;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.constructor.SafeConstructor;
import org.yaml.snakeyaml.error.YAMLException;

import java.util.EnumMap;
import java.util.Map;
import java.util.stream.Collectors;
import java.util.Arrays;

/**
 * Parses the {@code permissions} frontmatter value into a {@link Permissions}.
 *
 * <p>Accepted forms:</p>
 * <pre>
 * permissions: read-all
 * permissions:
 *   issues: write
 *   contents: read
 * permissions:
 *   all: read
 *   issues: write
 * </pre>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-08-19
 * @version 1.0
 */
public final class PermissionsParser {

    private static final String ALL_KEY = "all";

    private PermissionsParser() {
    }

    /**
     * Parses YAML text, as produced by {@link PermissionsRenderer#render(Permissions)}.
     */
    public static Permissions parse(String yamlText) throws WorkflowSchemaException {
        Object value;
        try {
            value = new Yaml(new SafeConstructor(new LoaderOptions())).load(yamlText);
        } catch (YAMLException e) {
            throw new WorkflowSchemaException("permissions", "Invalid permissions YAML: " + e.getMessage());
        }
        return parse(value, "permissions");
    }

    /**
     * Parses an already-loaded YAML value.
     *
     * @param value     a string shorthand, a map, or null
     * @param fieldPath the field path used in error messages
     */
    public static Permissions parse(Object value, String fieldPath) throws WorkflowSchemaException {
        if (value == null) {
            return Permissions.empty();
        }

        if (value instanceof String) {
            String text = ((String) value).trim();
            return ShorthandPermission.fromYaml(text)
                    .map(Permissions::shorthand)
                    .orElseThrow(() -> new WorkflowSchemaException(fieldPath,
                            "Invalid permissions shorthand '" + text + "'. Must be one of: "
                                    + joinNames(ShorthandPermission.values())));
        }

        if (!(value instanceof Map)) {
            throw new WorkflowSchemaException(fieldPath,
                    "Permissions must be a shorthand string or a map of scopes to levels");
        }

        Map<?, ?> map = (Map<?, ?>) value;
        Map<PermissionScope, PermissionLevel> levels = new EnumMap<>(PermissionScope.class);
        PermissionLevel blanket = null;

        for (Map.Entry<?, ?> entry : map.entrySet()) {
            String key = String.valueOf(entry.getKey());
            String entryPath = fieldPath + "." + key;
            PermissionLevel level = parseLevel(entry.getValue(), entryPath);

            if (ALL_KEY.equals(key)) {
                if (level == PermissionLevel.NONE) {
                    throw new WorkflowSchemaException(entryPath, "'all' must be 'read' or 'write'");
                }
                blanket = level;
                continue;
            }

            PermissionScope scope = PermissionScope.fromYaml(key)
                    .orElseThrow(() -> new WorkflowSchemaException(entryPath,
                            "Unknown permission scope '" + key + "'"));
            if (level == PermissionLevel.READ && !scope.supportsRead()) {
                throw new WorkflowSchemaException(entryPath,
                        "'" + scope + "' does not support 'read'; use 'write' or 'none'");
            }
            levels.put(scope, level);
        }

        return blanket != null ? Permissions.blanket(blanket, levels) : Permissions.explicit(levels);
    }

    private static PermissionLevel parseLevel(Object value, String fieldPath) throws WorkflowSchemaException {
        String text = value == null ? "null" : String.valueOf(value).trim();
        return PermissionLevel.fromYaml(text)
                .orElseThrow(() -> new WorkflowSchemaException(fieldPath,
                        "Invalid permission level '" + text + "'. Must be one of: "
                                + joinNames(PermissionLevel.values())));
    }

    private static String joinNames(Enum<?>[] values) {
        return Arrays.stream(values).map(Object::toString).collect(Collectors.joining(", "));
    }
}
