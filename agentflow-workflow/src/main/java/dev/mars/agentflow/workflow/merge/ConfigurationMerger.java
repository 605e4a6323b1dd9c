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

import dev.mars.agentflow.core.exceptions.ErrorKind;
import dev.mars.agentflow.core.exceptions.WorkflowSchemaException;
import dev.mars.agentflow.permissions.Permissions;
import dev.mars.agentflow.permissions.PermissionsParser;
import dev.mars.agentflow.workflow.imports.ResolvedImports;
import dev.mars.agentflow.workflow.parser.Frontmatter;
import dev.mars.agentflow.workflow.parser.FrontmatterFields;
import dev.mars.agentflow.workflow.parser.WorkflowDocument;
import dev.mars.agentflow.workflow.parser.YamlSupport;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Folds imported fragments and the main workflow into one effective
 * configuration.
 *
 * <ul>
 *   <li>{@code permissions}: permission merge, highest level per scope</li>
 *   <li>list fields: union without duplicates, first-seen order</li>
 *   <li>map fields keyed by name: deep merge, the document closer to the root wins on scalar conflicts</li>
 *   <li>scalars: the main workflow's value, else the first fragment in merge order that sets one</li>
 * </ul>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-08-19
 * @version 1.0
 */
public class ConfigurationMerger {
    private static final Logger logger = LoggerFactory.getLogger(ConfigurationMerger.class);

    static final Set<String> LIST_FIELDS = Set.of(
            FrontmatterFields.LABELS, FrontmatterFields.STEPS, FrontmatterFields.POST_STEPS);

    static final Set<String> MAP_FIELDS = Set.of(
            FrontmatterFields.TOOLS, FrontmatterFields.MCP_SERVERS, FrontmatterFields.SAFE_OUTPUTS,
            FrontmatterFields.ENV, FrontmatterFields.NETWORK);

    private final BodyComposition bodyComposition;

    public ConfigurationMerger(BodyComposition bodyComposition) {
        this.bodyComposition = Objects.requireNonNull(bodyComposition, "Body composition cannot be null");
    }

    /**
     * Merges the resolved documents. Pure apart from logging.
     *
     * @throws WorkflowSchemaException if a permissions value is invalid (only
     *                                 reachable when schema validation was skipped)
     */
    public EffectiveConfiguration merge(ResolvedImports imports) throws WorkflowSchemaException {
        List<WorkflowDocument> fragments = imports.getFragments();
        WorkflowDocument root = imports.getRoot();
        List<WorkflowDocument> closestLast = imports.allDocuments();

        Map<String, Object> merged = new LinkedHashMap<>();
        for (String field : fieldsInOrder(root, fragments)) {
            if (FrontmatterFields.IMPORTS.equals(field) || FrontmatterFields.PERMISSIONS.equals(field)) {
                continue;
            }
            if (LIST_FIELDS.contains(field) || MAP_FIELDS.contains(field)) {
                Object value = null;
                for (WorkflowDocument document : closestLast) {
                    if (document.getFrontmatter().has(field)) {
                        value = mergeValues(value, normalize(field, document.getFrontmatter().get(field)));
                    }
                }
                merged.put(field, value);
            } else {
                merged.put(field, firstScalar(field, root, fragments));
            }
        }

        Permissions permissions = null;
        for (WorkflowDocument document : closestLast) {
            Frontmatter frontmatter = document.getFrontmatter();
            if (!frontmatter.has(FrontmatterFields.PERMISSIONS)) {
                continue;
            }
            Permissions declared = parsePermissions(document);
            permissions = permissions == null ? declared : permissions.merge(declared);
        }

        String prompt = PromptComposer.compose(imports, bodyComposition);
        logger.debug("Merged {} fragment(s) into {}: fields={}", fragments.size(), root.getSourcePath(), merged.keySet());
        return new EffectiveConfiguration(new Frontmatter(merged), permissions, prompt, imports);
    }

    /**
     * Deep-merges two values. Maps merge per key, lists union, and otherwise the
     * later value wins unless it is null.
     */
    static Object mergeValues(Object earlier, Object later) {
        if (earlier == null) {
            return YamlSupport.mutableCopy(later);
        }
        if (later == null) {
            return earlier;
        }
        Map<String, Object> earlierMap = YamlSupport.asMap(earlier);
        Map<String, Object> laterMap = YamlSupport.asMap(later);
        if (earlierMap != null && laterMap != null) {
            Map<String, Object> result = new LinkedHashMap<>(earlierMap);
            for (Map.Entry<String, Object> entry : laterMap.entrySet()) {
                if (result.containsKey(entry.getKey())) {
                    result.put(entry.getKey(), mergeValues(result.get(entry.getKey()), entry.getValue()));
                } else {
                    result.put(entry.getKey(), YamlSupport.mutableCopy(entry.getValue()));
                }
            }
            return result;
        }
        List<Object> earlierList = YamlSupport.asList(earlier);
        List<Object> laterList = YamlSupport.asList(later);
        if (earlierList != null && laterList != null) {
            List<Object> result = new ArrayList<>(earlierList);
            for (Object item : laterList) {
                if (!result.contains(item)) {
                    result.add(YamlSupport.mutableCopy(item));
                }
            }
            return result;
        }
        return YamlSupport.mutableCopy(later);
    }

    /**
     * {@code network: defaults} is shorthand for {@code network: {allowed: [defaults]}}.
     */
    private static Object normalize(String field, Object value) {
        if (FrontmatterFields.NETWORK.equals(field) && value instanceof String) {
            Map<String, Object> network = new LinkedHashMap<>();
            network.put("allowed", new ArrayList<>(List.of(value)));
            return network;
        }
        return value;
    }

    private static Object firstScalar(String field, WorkflowDocument root, List<WorkflowDocument> fragments) {
        if (root.getFrontmatter().has(field) && root.getFrontmatter().get(field) != null) {
            return root.getFrontmatter().get(field);
        }
        for (WorkflowDocument fragment : fragments) {
            Object value = fragment.getFrontmatter().get(field);
            if (value != null) {
                return value;
            }
        }
        return root.getFrontmatter().get(field);
    }

    private static List<String> fieldsInOrder(WorkflowDocument root, List<WorkflowDocument> fragments) {
        List<String> fields = new ArrayList<>(root.getFrontmatter().fieldNames());
        for (WorkflowDocument fragment : fragments) {
            for (String field : fragment.getFrontmatter().fieldNames()) {
                if (!fields.contains(field)) {
                    fields.add(field);
                }
            }
        }
        return fields;
    }

    private static Permissions parsePermissions(WorkflowDocument document) throws WorkflowSchemaException {
        try {
            return PermissionsParser.parse(document.getFrontmatter().get(FrontmatterFields.PERMISSIONS),
                    FrontmatterFields.PERMISSIONS);
        } catch (WorkflowSchemaException e) {
            throw new WorkflowSchemaException(ErrorKind.INVALID_FIELD, document.getSourcePath(),
                    document.getSourceMap().positionOf(e.getFieldPath()), e.getFieldPath(), e.getRawMessage(), e);
        }
    }
}
