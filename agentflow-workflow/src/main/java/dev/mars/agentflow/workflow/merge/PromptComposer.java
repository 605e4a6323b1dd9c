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

import dev.mars.agentflow.workflow.imports.ImportSpec;
import dev.mars.agentflow.workflow.imports.ResolvedImports;
import dev.mars.agentflow.workflow.parser.WorkflowDocument;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Builds the agent prompt from fragment bodies and the main body.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-08-19
 * @version 1.0
 */
public final class PromptComposer {

    static final String RUNTIME_IMPORT_MACRO = "{{#runtime-import %s}}";
    private static final String GITHUB_DIR = ".github/";

    private PromptComposer() {
    }

    /**
     * Composes the prompt. Fragment bodies come first in merge order, the main
     * body last. Fragments with an empty body are skipped. A fragment imported
     * with a section or with inputs is inlined in either mode.
     */
    public static String compose(ResolvedImports imports, BodyComposition composition) {
        List<String> parts = new ArrayList<>();
        WorkflowDocument root = imports.getRoot();
        for (WorkflowDocument document : imports.allDocuments()) {
            Optional<ImportSpec> spec = document == root ? Optional.empty() : imports.getSpec(document);
            String body = spec.map(s -> s.apply(document.getBody())).orElse(document.getBody());
            if (document != root && body.isBlank()) {
                continue;
            }
            boolean inline = composition == BodyComposition.INLINE
                    || spec.map(ImportSpec::requiresInlining).orElse(false);
            if (inline) {
                if (!body.isBlank()) {
                    parts.add(body);
                }
            } else {
                parts.add(String.format(RUNTIME_IMPORT_MACRO, repositoryPath(document.getSourcePath(), root.getSourcePath())));
            }
        }
        return String.join(composition == BodyComposition.INLINE ? "\n\n" : "\n", parts);
    }

    /**
     * Returns the path a runtime import resolves against: the part from
     * {@code .github/} onwards when present, otherwise the path relative to the
     * main workflow's directory.
     */
    static String repositoryPath(String path, String rootPath) {
        String normalized = path.replace('\\', '/');
        int github = normalized.startsWith(GITHUB_DIR) ? 0 : normalized.indexOf("/" + GITHUB_DIR);
        if (github >= 0) {
            return normalized.substring(github == 0 ? 0 : github + 1);
        }
        Path rootDir = Paths.get(rootPath).toAbsolutePath().normalize().getParent();
        Path target = Paths.get(path).toAbsolutePath().normalize();
        if (rootDir == null) {
            return normalized;
        }
        return rootDir.relativize(target).toString().replace('\\', '/');
    }
}
