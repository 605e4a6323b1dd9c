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
import dev.mars.agentflow.core.exceptions.WorkflowParseException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.error.MarkedYAMLException;
import org.yaml.snakeyaml.error.YAMLException;
import org.yaml.snakeyaml.nodes.Node;

import java.io.StringReader;
import java.util.Arrays;
import java.util.Map;
import java.util.Objects;

/**
 * Splits a markdown workflow into YAML frontmatter and prompt body.
 *
 * <p>The frontmatter is the text between a leading {@code ---} line and the
 * next {@code ---} line. A document without a leading delimiter has no
 * frontmatter. This class only reads structure; schema checks live in
 * {@link FrontmatterSchemaValidator}.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-08-18
 * @version 1.0
 */
public class FrontmatterParser {
    private static final Logger logger = LoggerFactory.getLogger(FrontmatterParser.class);

    private static final String DELIMITER = "---";
    private static final char BYTE_ORDER_MARK = '\uFEFF';
    private static final char NON_BREAKING_SPACE = '\u00A0';

    /** Lines before the first YAML line: the opening delimiter. */
    private static final int FRONTMATTER_LINE_OFFSET = 1;

    /**
     * Parses workflow content.
     *
     * @param content    the markdown text
     * @param sourcePath the path used in diagnostics and for import resolution
     * @return the parsed document
     * @throws WorkflowParseException if the delimiters or the YAML are malformed
     */
    public WorkflowDocument parse(String content, String sourcePath) throws WorkflowParseException {
        Objects.requireNonNull(content, "Content cannot be null");
        Objects.requireNonNull(sourcePath, "Source path cannot be null");

        String text = normalize(content);
        String[] lines = text.split("\n", -1);

        if (lines.length == 0 || !DELIMITER.equals(lines[0].trim())) {
            logger.debug("No frontmatter in {}", sourcePath);
            return new WorkflowDocument(sourcePath, text, Frontmatter.EMPTY, text.trim(), SourceMap.EMPTY);
        }

        int closing = -1;
        for (int i = 1; i < lines.length; i++) {
            if (DELIMITER.equals(lines[i].trim())) {
                closing = i;
                break;
            }
        }
        if (closing < 0) {
            throw new WorkflowParseException(sourcePath, SourcePosition.of(1, 1),
                    "Frontmatter is not closed: expected a second '---' line");
        }

        String yamlText = String.join("\n", Arrays.copyOfRange(lines, 1, closing)).replace(NON_BREAKING_SPACE, ' ');
        String body = String.join("\n", Arrays.copyOfRange(lines, closing + 1, lines.length)).trim();

        Yaml yaml = YamlSupport.newLoader();
        Object loaded;
        Node root;
        try {
            loaded = yaml.load(yamlText);
            root = yaml.compose(new StringReader(yamlText));
        } catch (MarkedYAMLException e) {
            SourcePosition position = SourceMap.toPosition(
                    e.getProblemMark() != null ? e.getProblemMark() : e.getContextMark(), FRONTMATTER_LINE_OFFSET);
            throw new WorkflowParseException(sourcePath, position,
                    "Invalid YAML in frontmatter: " + describe(e), e);
        } catch (YAMLException e) {
            throw new WorkflowParseException(sourcePath, SourcePosition.of(2, 1),
                    "Invalid YAML in frontmatter: " + e.getMessage(), e);
        }

        if (loaded == null) {
            return new WorkflowDocument(sourcePath, text, Frontmatter.EMPTY, body, SourceMap.EMPTY);
        }
        if (!(loaded instanceof Map)) {
            throw new WorkflowParseException(sourcePath, SourcePosition.of(2, 1),
                    "Frontmatter must be a YAML mapping, found " + loaded.getClass().getSimpleName());
        }

        @SuppressWarnings("unchecked")
        Map<String, Object> fields = (Map<String, Object>) YamlSupport.deepCopy(loaded);
        SourceMap sourceMap = SourceMap.fromNode(root, FRONTMATTER_LINE_OFFSET);
        logger.debug("Parsed {} frontmatter fields from {}", fields.size(), sourcePath);
        return new WorkflowDocument(sourcePath, text, new Frontmatter(fields), body, sourceMap);
    }

    /**
     * Resolves the display name of a workflow: the {@code name} field, else the
     * first level-one heading of the body, else the file name without extension.
     */
    public static String resolveWorkflowName(WorkflowDocument document) {
        String name = document.getFrontmatter().getString(FrontmatterFields.NAME).orElse("").trim();
        if (!name.isEmpty()) {
            return name;
        }
        for (String line : document.getBody().split("\n")) {
            String trimmed = line.trim();
            if (trimmed.startsWith("# ")) {
                return trimmed.substring(2).trim();
            }
        }
        return baseName(document.getSourcePath());
    }

    /**
     * @return the file name of the path without directories or a {@code .md} extension
     */
    public static String baseName(String path) {
        String normalized = path.replace('\\', '/');
        String fileName = normalized.substring(normalized.lastIndexOf('/') + 1);
        return fileName.endsWith(".md") ? fileName.substring(0, fileName.length() - 3) : fileName;
    }

    private static String normalize(String content) {
        String text = content;
        if (!text.isEmpty() && text.charAt(0) == BYTE_ORDER_MARK) {
            text = text.substring(1);
        }
        return text.replace("\r\n", "\n").replace('\r', '\n');
    }

    private static String describe(MarkedYAMLException e) {
        String problem = e.getProblem();
        if (problem == null || problem.isBlank()) {
            return e.getContext() != null ? e.getContext() : "syntax error";
        }
        return e.getContext() != null ? e.getContext() + ", " + problem : problem;
    }
}
