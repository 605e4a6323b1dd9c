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
 * Permissions declared as {@code all: read} or {@code all: write}, with
 * optional per-scope exceptions that take precedence over the blanket level.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-08-19
 * @version 1.0
 */
public final class BlanketPermissions implements Permissions {

    private final PermissionLevel level;
    private final ExplicitPermissions overlay;

    BlanketPermissions(PermissionLevel level, Map<PermissionScope, PermissionLevel> overlay) {
        this.level = Objects.requireNonNull(level, "Blanket level cannot be null");
        if (level == PermissionLevel.NONE) {
            throw new IllegalArgumentException("Blanket level must be 'read' or 'write'");
        }
        this.overlay = new ExplicitPermissions(overlay != null ? overlay : Map.of());
    }

    public PermissionLevel getLevel() {
        return level;
    }

    public Map<PermissionScope, PermissionLevel> getOverlay() {
        return overlay.getLevels();
    }

    @Override
    public Optional<PermissionLevel> get(PermissionScope scope) {
        Optional<PermissionLevel> explicit = overlay.get(scope);
        if (explicit.isPresent()) {
            return explicit;
        }
        if (level == PermissionLevel.READ && !scope.supportsRead()) {
            return Optional.empty();
        }
        return Optional.of(level);
    }

    @Override
    public Map<PermissionScope, PermissionLevel> expand() {
        Map<PermissionScope, PermissionLevel> map = new EnumMap<>(PermissionScope.class);
        for (PermissionScope scope : PermissionScope.values()) {
            get(scope).ifPresent(l -> map.put(scope, l));
        }
        return Collections.unmodifiableMap(map);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        BlanketPermissions that = (BlanketPermissions) o;
        return level == that.level && overlay.equals(that.overlay);
    }

    @Override
    public int hashCode() {
        return Objects.hash(level, overlay);
    }

    @Override
    public String toString() {
        return "BlanketPermissions{all=" + level + ", overlay=" + overlay.getLevels() + '}';
    }
}
