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

import org.yaml.snakeyaml.DumperOptions;
import org.yaml.snakeyaml.Yaml;

import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Renders {@link Permissions} in the form GitHub Actions accepts.
 *
 * <p>Shorthands render as a scalar. Everything else renders as a map in
 * lexical scope order without {@code metadata} and
 * {@code organization-projects}.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-08-19
 * @version 1.0
 */
public final class PermissionsRenderer {

    private PermissionsRenderer() {
    }

    /**
     * @return a {@link String} for shorthands, otherwise an ordered {@code Map<String, String>}
     */
    public static Object toYamlValue(Permissions permissions) {
        if (permissions instanceof ShorthandPermissions) {
            return ((ShorthandPermissions) permissions).getShorthand().yamlName();
        }
        Map<String, String> rendered = new LinkedHashMap<>();
        permissions.expand().entrySet().stream()
                .filter(e -> e.getKey().isRendered())
                .sorted(Comparator.comparing(e -> e.getKey().yamlName()))
                .forEach(e -> rendered.put(e.getKey().yamlName(), e.getValue().yamlName()));
        return rendered;
    }

    /**
     * Renders the permissions as a standalone YAML document.
     */
    public static String render(Permissions permissions) {
        DumperOptions options = new DumperOptions();
        options.setDefaultFlowStyle(DumperOptions.FlowStyle.BLOCK);
        return new Yaml(options).dump(toYamlValue(permissions));
    }
}
