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

import org.yaml.snakeyaml.DumperOptions;
import org.yaml.snakeyaml.LoaderOptions;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.constructor.SafeConstructor;
import org.yaml.snakeyaml.nodes.Node;
import org.yaml.snakeyaml.nodes.Tag;
import org.yaml.snakeyaml.representer.Represent;
import org.yaml.snakeyaml.representer.Representer;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Factory for the SnakeYAML instances used to read frontmatter and write lock
 * files, plus helpers for the plain Java values SnakeYAML produces.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-08-18
 * @version 1.0
 */
public final class YamlSupport {

    private YamlSupport() {
    }

    /**
     * Creates a safe loader. Duplicate keys are rejected. Yaml instances are not
     * thread safe, so callers create one per parse.
     */
    public static Yaml newLoader() {
        LoaderOptions loaderOptions = new LoaderOptions();
        loaderOptions.setAllowDuplicateKeys(false);
        DumperOptions dumperOptions = new DumperOptions();
        return new Yaml(new SafeConstructor(loaderOptions), new Representer(dumperOptions),
                dumperOptions, loaderOptions, new WorkflowYamlResolver());
    }

    /**
     * Creates a block-style dumper: two-space indentation, indented sequence
     * indicators, no line folding and literal blocks for multi-line strings.
     */
    public static Yaml newDumper() {
        DumperOptions dumperOptions = new DumperOptions();
        dumperOptions.setDefaultFlowStyle(DumperOptions.FlowStyle.BLOCK);
        dumperOptions.setIndent(2);
        dumperOptions.setIndicatorIndent(2);
        dumperOptions.setIndentWithIndicator(true);
        dumperOptions.setWidth(Integer.MAX_VALUE);
        dumperOptions.setSplitLines(false);
        dumperOptions.setLineBreak(DumperOptions.LineBreak.UNIX);
        LoaderOptions loaderOptions = new LoaderOptions();
        return new Yaml(new SafeConstructor(loaderOptions), new LiteralBlockRepresenter(dumperOptions),
                dumperOptions, loaderOptions, new WorkflowYamlResolver());
    }

    /**
     * Copies a loaded YAML value into unmodifiable, order-preserving collections
     * with string keys.
     */
    public static Object deepCopy(Object value) {
        if (value instanceof Map) {
            Map<String, Object> copy = new LinkedHashMap<>();
            for (Map.Entry<?, ?> entry : ((Map<?, ?>) value).entrySet()) {
                copy.put(String.valueOf(entry.getKey()), deepCopy(entry.getValue()));
            }
            return Collections.unmodifiableMap(copy);
        }
        if (value instanceof List) {
            List<Object> copy = new ArrayList<>();
            for (Object item : (List<?>) value) {
                copy.add(deepCopy(item));
            }
            return Collections.unmodifiableList(copy);
        }
        return value;
    }

    /**
     * Deep copy into mutable collections, for values about to be edited.
     */
    public static Object mutableCopy(Object value) {
        if (value instanceof Map) {
            Map<String, Object> copy = new LinkedHashMap<>();
            for (Map.Entry<?, ?> entry : ((Map<?, ?>) value).entrySet()) {
                copy.put(String.valueOf(entry.getKey()), mutableCopy(entry.getValue()));
            }
            return copy;
        }
        if (value instanceof List) {
            List<Object> copy = new ArrayList<>();
            for (Object item : (List<?>) value) {
                copy.add(mutableCopy(item));
            }
            return copy;
        }
        return value;
    }

    @SuppressWarnings("unchecked")
    public static Map<String, Object> asMap(Object value) {
        return value instanceof Map ? (Map<String, Object>) value : null;
    }

    @SuppressWarnings("unchecked")
    public static List<Object> asList(Object value) {
        return value instanceof List ? (List<Object>) value : null;
    }

    private static final class LiteralBlockRepresenter extends Representer {

        LiteralBlockRepresenter(DumperOptions options) {
            super(options);
            this.representers.put(String.class, new RepresentLiteralString());
        }

        private final class RepresentLiteralString implements Represent {
            @Override
            public Node representData(Object data) {
                String value = data.toString();
                if (value.indexOf('\n') >= 0) {
                    return representScalar(Tag.STR, value, DumperOptions.ScalarStyle.LITERAL);
                }
                return representScalar(Tag.STR, value);
            }
        }
    }
}
