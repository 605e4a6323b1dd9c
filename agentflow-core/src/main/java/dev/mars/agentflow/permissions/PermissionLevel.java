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
 * Access level for a permission scope. Declaration order is precedence order:
 * {@code write} beats {@code read} beats {@code none}.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-08-19
 * @version 1.0
 */
public enum PermissionLevel {
    NONE("none"),
    READ("read"),
    WRITE("write");

    private final String yamlName;

    PermissionLevel(String yamlName) {
        this.yamlName = yamlName;
    }

    public String yamlName() {
        return yamlName;
    }

    /**
     * @return whichever of the two levels has higher precedence
     */
    public static PermissionLevel max(PermissionLevel a, PermissionLevel b) {
        return a.compareTo(b) >= 0 ? a : b;
    }

    public static Optional<PermissionLevel> fromYaml(String name) {
        return Arrays.stream(values()).filter(l -> l.yamlName.equals(name)).findFirst();
    }

    @Override
    public String toString() {
        return yamlName;
    }
}
