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

package dev.mars.agentflow.workflow.parser;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * Immutable, order-preserving view of a frontmatter block.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-08-18
 * @version 1.0
 */
public final class Frontmatter {

    public static final Frontmatter EMPTY = new Frontmatter(Map.of());

    private final Map<String, Object> fields;

    @SuppressWarnings("unchecked")
    public Frontmatter(Map<String, ?> fields) {
        Objects.requireNonNull(fields, "Frontmatter fields cannot be null");
        this.fields = (Map<String, Object>) YamlSupport.deepCopy(new LinkedHashMap<>(fields));
    }

    public boolean has(String field) {
        return fields.containsKey(field);
    }

    public Object get(String field) {
        return fields.get(field);
    }

    public Optional<String> getString(String field) {
        Object value = fields.get(field);
        return value == null ? Optional.empty() : Optional.of(String.valueOf(value));
    }

    public Map<String, Object> getMap(String field) {
        Map<String, Object> map = YamlSupport.asMap(fields.get(field));
        return map != null ? map : Map.of();
    }

    public List<Object> getList(String field) {
        List<Object> list = YamlSupport.asList(fields.get(field));
        return list != null ? list : List.of();
    }

    public Optional<Boolean> getBoolean(String field) {
        Object value = fields.get(field);
        return value instanceof Boolean ? Optional.of((Boolean) value) : Optional.empty();
    }

    public Set<String> fieldNames() {
        return fields.keySet();
    }

    public Map<String, Object> asMap() {
        return fields;
    }

    public boolean isEmpty() {
        return fields.isEmpty();
    }

    /**
     * @return a copy without the given fields
     */
    public Frontmatter without(Set<String> names) {
        Map<String, Object> copy = new LinkedHashMap<>(fields);
        copy.keySet().removeAll(names);
        return new Frontmatter(copy);
    }

    /**
     * @return a copy with one field replaced or added
     */
    public Frontmatter with(String name, Object value) {
        Map<String, Object> copy = new LinkedHashMap<>(fields);
        copy.put(name, value);
        return new Frontmatter(copy);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        return fields.equals(((Frontmatter) o).fields);
    }

    @Override
    public int hashCode() {
        return fields.hashCode();
    }

    @Override
    public String toString() {
        return "Frontmatter" + Collections.unmodifiableMap(fields);
    }
}
