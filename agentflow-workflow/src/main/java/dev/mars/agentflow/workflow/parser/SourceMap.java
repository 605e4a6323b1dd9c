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

import dev.mars.agentflow.core.SourcePosition;
import org.yaml.snakeyaml.error.Mark;
import org.yaml.snakeyaml.nodes.MappingNode;
import org.yaml.snakeyaml.nodes.Node;
import org.yaml.snakeyaml.nodes.NodeTuple;
import org.yaml.snakeyaml.nodes.ScalarNode;
import org.yaml.snakeyaml.nodes.SequenceNode;

import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Maps frontmatter field paths such as {@code permissions.issues} or
 * {@code imports[1]} to their position in the source document.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-08-18
 * @version 1.0
 */
public final class SourceMap {

    public static final SourceMap EMPTY = new SourceMap(Map.of());

    private final Map<String, SourcePosition> positions;

    private SourceMap(Map<String, SourcePosition> positions) {
        this.positions = Collections.unmodifiableMap(positions);
    }

    /**
     * Builds a source map from a composed node tree.
     *
     * @param root       the root node, may be null for an empty document
     * @param lineOffset number of document lines preceding the YAML text
     */
    public static SourceMap fromNode(Node root, int lineOffset) {
        Map<String, SourcePosition> positions = new HashMap<>();
        if (root != null) {
            walk(root, "", lineOffset, positions);
        }
        return new SourceMap(positions);
    }

    /**
     * Returns the position of the field, or of its nearest recorded ancestor.
     */
    public SourcePosition positionOf(String fieldPath) {
        String path = fieldPath == null ? "" : fieldPath;
        while (!path.isEmpty()) {
            SourcePosition position = positions.get(path);
            if (position != null) {
                return position;
            }
            path = parentOf(path);
        }
        return SourcePosition.UNKNOWN;
    }

    public boolean contains(String fieldPath) {
        return positions.containsKey(fieldPath);
    }

    public int size() {
        return positions.size();
    }

    static String parentOf(String path) {
        int dot = path.lastIndexOf('.');
        int bracket = path.lastIndexOf('[');
        int cut = Math.max(dot, bracket);
        return cut <= 0 ? "" : path.substring(0, cut);
    }

    private static void walk(Node node, String path, int lineOffset, Map<String, SourcePosition> positions) {
        if (node instanceof MappingNode) {
            for (NodeTuple tuple : ((MappingNode) node).getValue()) {
                Node keyNode = tuple.getKeyNode();
                String key = keyNode instanceof ScalarNode ? ((ScalarNode) keyNode).getValue() : String.valueOf(keyNode);
                String childPath = path.isEmpty() ? key : path + "." + key;
                positions.put(childPath, toPosition(keyNode.getStartMark(), lineOffset));
                walk(tuple.getValueNode(), childPath, lineOffset, positions);
            }
        } else if (node instanceof SequenceNode) {
            List<Node> items = ((SequenceNode) node).getValue();
            for (int i = 0; i < items.size(); i++) {
                String childPath = path + "[" + i + "]";
                positions.put(childPath, toPosition(items.get(i).getStartMark(), lineOffset));
                walk(items.get(i), childPath, lineOffset, positions);
            }
        }
    }

    static SourcePosition toPosition(Mark mark, int lineOffset) {
        if (mark == null) {
            return SourcePosition.UNKNOWN;
        }
        return SourcePosition.of(mark.getLine() + 1 + lineOffset, mark.getColumn() + 1);
    }
}
