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

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Directed graph of workflow files, keyed by normalized path, with an edge
 * for every {@code imports} entry. Edges keep their declaration order.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-08-18
 * @version 1.0
 */
public class ImportGraph {

    private final String root;
    private final Map<String, Set<String>> imports;

    public ImportGraph(String root) {
        this.root = Objects.requireNonNull(root, "Root path cannot be null");
        this.imports = new LinkedHashMap<>();
        this.imports.put(root, new LinkedHashSet<>());
    }

    public String getRoot() {
        return root;
    }

    /**
     * Adds a file to the graph. Adding an existing file is a no-op.
     */
    public void addNode(String path) {
        imports.computeIfAbsent(Objects.requireNonNull(path, "Path cannot be null"), p -> new LinkedHashSet<>());
    }

    /**
     * Records that {@code from} imports {@code to}. Both nodes are added if needed.
     */
    public void addEdge(String from, String to) {
        addNode(from);
        addNode(to);
        imports.get(from).add(to);
    }

    public Set<String> getNodes() {
        return Collections.unmodifiableSet(imports.keySet());
    }

    public List<String> getImports(String path) {
        return List.copyOf(imports.getOrDefault(path, Set.of()));
    }

    /**
     * Returns the merge order of the fragments: depth-first post-order from the
     * root, siblings in declaration order, each file once, root excluded.
     * {@link ImportResolver} rejects cycles before they reach the graph.
     */
    public List<String> mergeOrder() {
        List<String> order = new ArrayList<>();
        Set<String> visited = new HashSet<>();
        visited.add(root);
        postOrder(root, visited, order);
        return order;
    }

    private void postOrder(String node, Set<String> visited, List<String> order) {
        for (String next : imports.getOrDefault(node, Set.of())) {
            if (visited.add(next)) {
                postOrder(next, visited, order);
                order.add(next);
            }
        }
    }

    @Override
    public String toString() {
        return "ImportGraph{" +
               "root=" + root +
               ", imports=" + imports +
               '}';
    }
}
