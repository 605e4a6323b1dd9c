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

import java.util.Arrays;
import java.util.Optional;

/**
 * Single-word permission declarations. Declaration order is precedence order.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-08-19
 * @version 1.0
 */
public enum ShorthandPermission {
    NONE("none", PermissionLevel.NONE),
    READ_ALL("read-all", PermissionLevel.READ),
    WRITE_ALL("write-all", PermissionLevel.WRITE);

    private final String yamlName;
    private final PermissionLevel impliedLevel;

    ShorthandPermission(String yamlName, PermissionLevel impliedLevel) {
        this.yamlName = yamlName;
        this.impliedLevel = impliedLevel;
    }

    public String yamlName() {
        return yamlName;
    }

    public PermissionLevel impliedLevel() {
        return impliedLevel;
    }

    public static Optional<ShorthandPermission> fromYaml(String name) {
        return Arrays.stream(values()).filter(s -> s.yamlName.equals(name)).findFirst();
    }

    @Override
    public String toString() {
        return yamlName;
    }
}
