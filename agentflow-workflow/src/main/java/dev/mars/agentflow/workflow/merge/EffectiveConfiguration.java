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

package dev.mars.agentflow.workflow.merge;

import dev.mars.agentflow.permissions.Permissions;
import dev.mars.agentflow.workflow.imports.ResolvedImports;
import dev.mars.agentflow.workflow.parser.Frontmatter;

import java.util.Objects;
import java.util.Optional;

/**
 * The frontmatter of a workflow after all fragments have been folded in,
 * together with the merged permissions and the composed prompt.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-08-19
 * @version 1.0
 */
public final class EffectiveConfiguration {

    private final Frontmatter frontmatter;
    private final Permissions permissions;
    private final String prompt;
    private final ResolvedImports imports;

    public EffectiveConfiguration(Frontmatter frontmatter, Permissions permissions, String prompt,
                                  ResolvedImports imports) {
        this.frontmatter = Objects.requireNonNull(frontmatter, "Frontmatter cannot be null");
        this.permissions = permissions;
        this.prompt = prompt != null ? prompt : "";
        this.imports = Objects.requireNonNull(imports, "Resolved imports cannot be null");
    }

    public Frontmatter getFrontmatter() {
        return frontmatter;
    }

    /**
     * @return the merged permissions, or empty when no document declared any
     */
    public Optional<Permissions> getPermissions() {
        return Optional.ofNullable(permissions);
    }

    public String getPrompt() {
        return prompt;
    }

    public ResolvedImports getImports() {
        return imports;
    }

    @Override
    public String toString() {
        return "EffectiveConfiguration{" +
                "fields=" + frontmatter.fieldNames() +
                ", permissions=" + permissions +
                ", imports=" + imports.getImportedPaths() +
                '}';
    }
}
