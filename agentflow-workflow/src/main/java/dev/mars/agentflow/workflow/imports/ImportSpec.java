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

package dev.mars.agentflow.workflow.imports;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * One {@code imports} entry: the file reference, an optional {@code #Section}
 * and the {@code inputs} substituted into the fragment body at compile time.
 *
 * <p>A fragment imported with a section or with inputs cannot be loaded by a
 * runtime-import macro and is always inlined into the prompt.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-08-24
 * @version 1.0
 */
public final class ImportSpec {

    private static final Pattern INPUT_EXPRESSION =
            Pattern.compile("\\$\\{\\{\\s*github\\.aw\\.inputs\\.([A-Za-z0-9_-]+)\\s*}}");

    private final String path;
    private final String section;
    private final Map<String, Object> inputs;

    public ImportSpec(String path, String section, Map<String, Object> inputs) {
        this.path = Objects.requireNonNull(path, "Import path cannot be null");
        this.section = section;
        this.inputs = inputs == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(inputs));
    }

    /**
     * Splits {@code file.md#Section} into its file and section parts.
     */
    public static ImportSpec of(String reference, Map<String, Object> inputs) {
        int hash = reference.indexOf('#');
        if (hash < 0) {
            return new ImportSpec(reference, null, inputs);
        }
        String section = reference.substring(hash + 1).trim();
        return new ImportSpec(reference.substring(0, hash).trim(), section.isEmpty() ? null : section, inputs);
    }

    public String getPath() {
        return path;
    }

    public Optional<String> getSection() {
        return Optional.ofNullable(section);
    }

    public Map<String, Object> getInputs() {
        return inputs;
    }

    public boolean requiresInlining() {
        return section != null || !inputs.isEmpty();
    }

    /**
     * Returns the part of a fragment body this import contributes: the section
     * when one is named, with every {@code ${{ github.aw.inputs.<name> }}}
     * replaced by its input value. Expressions naming an unknown input are kept.
     */
    public String apply(String body) {
        String selected = section == null ? body : MarkdownSection.extract(body, section).orElse("");
        if (inputs.isEmpty()) {
            return selected;
        }
        Matcher matcher = INPUT_EXPRESSION.matcher(selected);
        StringBuilder result = new StringBuilder();
        while (matcher.find()) {
            String name = matcher.group(1);
            String replacement = inputs.containsKey(name) ? String.valueOf(inputs.get(name)) : matcher.group();
            matcher.appendReplacement(result, Matcher.quoteReplacement(replacement));
        }
        matcher.appendTail(result);
        return result.toString();
    }

    @Override
    public String toString() {
        return section == null ? path : path + "#" + section;
    }
}
