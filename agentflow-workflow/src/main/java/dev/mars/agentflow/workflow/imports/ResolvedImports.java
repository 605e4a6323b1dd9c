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

import dev.mars.agentflow.workflow.parser.WorkflowDocument;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * The root document plus every transitively imported fragment in merge order.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-08-18
 * @version 1.0
 */
public final class ResolvedImports {

    private final WorkflowDocument root;
    private final List<WorkflowDocument> fragments;
    private final ImportGraph graph;
    private final Map<String, ImportSpec> specs;

    public ResolvedImports(WorkflowDocument root, List<WorkflowDocument> fragments, ImportGraph graph) {
        this(root, fragments, graph, Map.of());
    }

    /**
     * @param specs the import entry that first loaded each fragment, keyed by fragment path
     */
    public ResolvedImports(WorkflowDocument root, List<WorkflowDocument> fragments, ImportGraph graph,
                           Map<String, ImportSpec> specs) {
        this.root = Objects.requireNonNull(root, "Root document cannot be null");
        this.fragments = List.copyOf(fragments);
        this.graph = Objects.requireNonNull(graph, "Import graph cannot be null");
        this.specs = new LinkedHashMap<>(Objects.requireNonNull(specs, "Import specs cannot be null"));
    }

    public WorkflowDocument getRoot() {
        return root;
    }

    /**
     * @return fragments in merge order; dependencies precede their importers
     */
    public List<WorkflowDocument> getFragments() {
        return fragments;
    }

    public ImportGraph getGraph() {
        return graph;
    }

    /**
     * @return the import entry that loaded {@code fragment}, empty for the root document
     */
    public Optional<ImportSpec> getSpec(WorkflowDocument fragment) {
        return Optional.ofNullable(specs.get(fragment.getSourcePath()));
    }

    public List<String> getImportedPaths() {
        List<String> paths = new ArrayList<>();
        for (WorkflowDocument fragment : fragments) {
            paths.add(fragment.getSourcePath());
        }
        return paths;
    }

    /**
     * @return fragments followed by the root document
     */
    public List<WorkflowDocument> allDocuments() {
        List<WorkflowDocument> all = new ArrayList<>(fragments);
        all.add(root);
        return all;
    }
}
