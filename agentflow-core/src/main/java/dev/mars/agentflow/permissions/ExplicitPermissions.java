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

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Permissions declared scope by scope.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-08-19
 * @version 1.0
 */
public final class ExplicitPermissions implements Permissions {

    static final ExplicitPermissions EMPTY = new ExplicitPermissions(Map.of());

    private final Map<PermissionScope, PermissionLevel> levels;

    ExplicitPermissions(Map<PermissionScope, PermissionLevel> levels) {
        Objects.requireNonNull(levels, "Permission levels cannot be null");
        Map<PermissionScope, PermissionLevel> copy = new EnumMap<>(PermissionScope.class);
        for (Map.Entry<PermissionScope, PermissionLevel> entry : levels.entrySet()) {
            PermissionScope scope = Objects.requireNonNull(entry.getKey(), "Scope cannot be null");
            PermissionLevel level = Objects.requireNonNull(entry.getValue(), "Level cannot be null");
            if (level == PermissionLevel.READ && !scope.supportsRead()) {
                throw new IllegalArgumentException("Scope '" + scope + "' does not support 'read'");
            }
            copy.put(scope, level);
        }
        this.levels = Collections.unmodifiableMap(copy);
    }

    public Map<PermissionScope, PermissionLevel> getLevels() {
        return levels;
    }

    @Override
    public Optional<PermissionLevel> get(PermissionScope scope) {
        return Optional.ofNullable(levels.get(scope));
    }

    @Override
    public Map<PermissionScope, PermissionLevel> expand() {
        return levels;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        return levels.equals(((ExplicitPermissions) o).levels);
    }

    @Override
    public int hashCode() {
        return levels.hashCode();
    }

    @Override
    public String toString() {
        return "ExplicitPermissions" + levels;
    }
}
