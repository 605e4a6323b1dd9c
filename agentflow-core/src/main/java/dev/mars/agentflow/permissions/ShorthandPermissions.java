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
 * Permissions declared with a single keyword.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-08-19
 * @version 1.0
 */
public final class ShorthandPermissions implements Permissions {

    private final ShorthandPermission shorthand;

    ShorthandPermissions(ShorthandPermission shorthand) {
        this.shorthand = Objects.requireNonNull(shorthand, "Shorthand cannot be null");
    }

    public ShorthandPermission getShorthand() {
        return shorthand;
    }

    @Override
    public Optional<PermissionLevel> get(PermissionScope scope) {
        PermissionLevel level = shorthand.impliedLevel();
        if (level == PermissionLevel.READ && !scope.supportsRead()) {
            return Optional.empty();
        }
        return Optional.of(level);
    }

    @Override
    public Map<PermissionScope, PermissionLevel> expand() {
        Map<PermissionScope, PermissionLevel> map = new EnumMap<>(PermissionScope.class);
        PermissionLevel level = shorthand.impliedLevel();
        if (level == PermissionLevel.NONE) {
            return Collections.unmodifiableMap(map);
        }
        for (PermissionScope scope : PermissionScope.values()) {
            if (level == PermissionLevel.READ && !scope.supportsRead()) {
                continue;
            }
            map.put(scope, level);
        }
        return Collections.unmodifiableMap(map);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        return shorthand == ((ShorthandPermissions) o).shorthand;
    }

    @Override
    public int hashCode() {
        return shorthand.hashCode();
    }

    @Override
    public String toString() {
        return "ShorthandPermissions{" + shorthand + '}';
    }
}
