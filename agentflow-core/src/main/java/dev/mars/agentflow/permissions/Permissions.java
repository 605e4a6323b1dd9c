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

import java.util.EnumMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * The permissions requested for a workflow or job.
 *
 * <p>Exactly one of three forms is active:</p>
 * <ul>
 *   <li>{@link ShorthandPermissions}: {@code read-all}, {@code write-all} or {@code none}</li>
 *   <li>{@link ExplicitPermissions}: a scope to level map</li>
 *   <li>{@link BlanketPermissions}: {@code all: read|write} plus explicit exceptions</li>
 * </ul>
 *
 * <p>All operations are pure and return new values. {@code id-token} never
 * receives {@code read} from a blanket or shorthand expansion.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-08-19
 * @version 1.0
 */
public sealed interface Permissions permits ShorthandPermissions, ExplicitPermissions, BlanketPermissions {

    /**
     * Returns the effective level of a scope.
     *
     * @param scope the scope to query
     * @return the level, or empty when the scope is not granted by this value
     */
    Optional<PermissionLevel> get(PermissionScope scope);

    /**
     * Expands this value into an explicit scope map. Shorthand {@code none}
     * expands to an empty map.
     *
     * @return an unmodifiable map
     */
    Map<PermissionScope, PermissionLevel> expand();

    /**
     * Sets one scope. Shorthand and blanket values are expanded first, so the
     * result is always explicit.
     */
    default Permissions with(PermissionScope scope, PermissionLevel level) {
        Objects.requireNonNull(scope, "Scope cannot be null");
        Objects.requireNonNull(level, "Level cannot be null");
        Map<PermissionScope, PermissionLevel> map = new EnumMap<>(PermissionScope.class);
        map.putAll(expand());
        map.put(scope, level);
        return new ExplicitPermissions(map);
    }

    /**
     * Merges two permission values, keeping the highest level per scope.
     *
     * <p>Two shorthands merge to the higher shorthand. In every other case both
     * sides are fully expanded, even when one of them is a shorthand.</p>
     */
    default Permissions merge(Permissions other) {
        Objects.requireNonNull(other, "Permissions to merge cannot be null");
        if (this instanceof ShorthandPermissions && other instanceof ShorthandPermissions) {
            ShorthandPermission mine = ((ShorthandPermissions) this).getShorthand();
            ShorthandPermission theirs = ((ShorthandPermissions) other).getShorthand();
            return mine.compareTo(theirs) >= 0 ? this : other;
        }

        Map<PermissionScope, PermissionLevel> merged = new EnumMap<>(PermissionScope.class);
        merged.putAll(expand());
        for (Map.Entry<PermissionScope, PermissionLevel> entry : other.expand().entrySet()) {
            merged.merge(entry.getKey(), entry.getValue(), PermissionLevel::max);
        }
        return new ExplicitPermissions(merged);
    }

    /**
     * Compares effective levels of every scope, treating an absent scope as
     * {@code none}.
     */
    default boolean isEquivalentTo(Permissions other) {
        for (PermissionScope scope : PermissionScope.values()) {
            PermissionLevel mine = get(scope).orElse(PermissionLevel.NONE);
            PermissionLevel theirs = other.get(scope).orElse(PermissionLevel.NONE);
            if (mine != theirs) {
                return false;
            }
        }
        return true;
    }

    /**
     * @return true when no scope is granted above {@code none}
     */
    default boolean isEmpty() {
        for (PermissionScope scope : PermissionScope.values()) {
            if (get(scope).orElse(PermissionLevel.NONE) != PermissionLevel.NONE) {
                return false;
            }
        }
        return true;
    }

    static Permissions empty() {
        return ExplicitPermissions.EMPTY;
    }

    static Permissions shorthand(ShorthandPermission shorthand) {
        return new ShorthandPermissions(shorthand);
    }

    static Permissions readAll() {
        return new ShorthandPermissions(ShorthandPermission.READ_ALL);
    }

    static Permissions writeAll() {
        return new ShorthandPermissions(ShorthandPermission.WRITE_ALL);
    }

    static Permissions explicit(Map<PermissionScope, PermissionLevel> levels) {
        return new ExplicitPermissions(levels);
    }

    /**
     * @return explicit permissions granting {@code read} on each scope
     */
    static Permissions read(PermissionScope... scopes) {
        return grant(PermissionLevel.READ, scopes);
    }

    /**
     * @return explicit permissions granting {@code write} on each scope
     */
    static Permissions write(PermissionScope... scopes) {
        return grant(PermissionLevel.WRITE, scopes);
    }

    private static Permissions grant(PermissionLevel level, PermissionScope... scopes) {
        Map<PermissionScope, PermissionLevel> levels = new EnumMap<>(PermissionScope.class);
        for (PermissionScope scope : scopes) {
            levels.put(scope, level);
        }
        return new ExplicitPermissions(levels);
    }

    static Permissions blanket(PermissionLevel level, Map<PermissionScope, PermissionLevel> overlay) {
        return new BlanketPermissions(level, overlay);
    }
}
