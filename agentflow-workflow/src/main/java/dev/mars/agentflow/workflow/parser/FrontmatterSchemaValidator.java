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

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.networknt.schema.JsonSchema;
import com.networknt.schema.JsonSchemaFactory;
import com.networknt.schema.SpecVersion;
import com.networknt.schema.ValidationMessage;
import dev.mars.agentflow.core.SourcePosition;
import dev.mars.agentflow.core.exceptions.ErrorKind;
import dev.mars.agentflow.core.exceptions.WorkflowSchemaException;
import dev.mars.agentflow.permissions.PermissionsParser;
import dev.mars.agentflow.util.StringSimilarity;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Validates frontmatter against the bundled JSON schema.
 *
 * <p>Checks run in order: unknown top-level fields (with suggestions), the
 * JSON schema, then semantic permission rules the schema cannot express.
 * Issues are ordered most specific path first so the reported error is
 * deterministic.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-08-21
 * @version 1.0
 */
public class FrontmatterSchemaValidator {
    private static final Logger logger = LoggerFactory.getLogger(FrontmatterSchemaValidator.class);

    static final String SCHEMA_RESOURCE = "/schemas/workflow_frontmatter_schema.json";

    private static final Pattern BRACKET_NAME = Pattern.compile("\\['([^']*)'\\]");
    private static final Pattern LOCATION_PREFIX = Pattern.compile("^\\$[^\\s:]*:\\s*");

    private static final Comparator<ValidationResult.ValidationIssue> MOST_SPECIFIC_FIRST =
            Comparator.<ValidationResult.ValidationIssue>comparingInt(i -> -depth(i.getFieldPath()))
                    .thenComparing(i -> i.getFieldPath() == null ? "" : i.getFieldPath())
                    .thenComparing(ValidationResult.ValidationIssue::getMessage);

    private final JsonSchema schema;
    private final ObjectMapper objectMapper;

    public FrontmatterSchemaValidator() {
        this.objectMapper = new ObjectMapper();
        JsonSchemaFactory factory = JsonSchemaFactory.getInstance(SpecVersion.VersionFlag.V7);
        try (InputStream input = FrontmatterSchemaValidator.class.getResourceAsStream(SCHEMA_RESOURCE)) {
            if (input == null) {
                throw new IllegalStateException("Frontmatter schema not found on classpath: " + SCHEMA_RESOURCE);
            }
            this.schema = factory.getSchema(input);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to load frontmatter schema", e);
        }
    }

    /**
     * Collects every issue without throwing.
     */
    public ValidationResult check(WorkflowDocument document) {
        ValidationResult result = new ValidationResult();
        Frontmatter frontmatter = document.getFrontmatter().without(FrontmatterFields.IGNORED_FIELDS);
        SourceMap sourceMap = document.getSourceMap();

        List<ValidationResult.ValidationIssue> errors = new ArrayList<>();
        for (String field : frontmatter.fieldNames()) {
            if (!FrontmatterFields.ALL.contains(field)) {
                errors.add(issue(ErrorKind.UNKNOWN_FIELD, field, sourceMap, unknownFieldMessage(field)));
            }
        }

        if (errors.isEmpty()) {
            JsonNode node = objectMapper.valueToTree(frontmatter.asMap());
            Set<ValidationMessage> messages = schema.validate(node);
            for (ValidationMessage message : messages) {
                errors.add(toIssue(message, sourceMap));
            }
        }

        if (errors.isEmpty() && frontmatter.has(FrontmatterFields.PERMISSIONS)) {
            try {
                PermissionsParser.parse(frontmatter.get(FrontmatterFields.PERMISSIONS), FrontmatterFields.PERMISSIONS);
            } catch (WorkflowSchemaException e) {
                errors.add(issue(ErrorKind.INVALID_FIELD, e.getFieldPath(), sourceMap, e.getRawMessage()));
            }
        }

        errors.sort(MOST_SPECIFIC_FIRST);
        for (ValidationResult.ValidationIssue error : errors) {
            result.addError(error.getKind(), error.getFieldPath(), error.getPosition(), error.getMessage());
        }

        if (frontmatter.has(FrontmatterFields.TIMEOUT_MINUTES_LEGACY)) {
            result.addWarning(FrontmatterFields.TIMEOUT_MINUTES_LEGACY,
                    sourceMap.positionOf(FrontmatterFields.TIMEOUT_MINUTES_LEGACY),
                    "'timeout_minutes' is deprecated, use 'timeout-minutes'");
        }
        return result;
    }

    /**
     * Validates the document and throws on the first error. Warnings are logged.
     *
     * @throws WorkflowSchemaException describing the most specific error; its
     *                                 message also counts the remaining errors
     */
    public void validate(WorkflowDocument document) throws WorkflowSchemaException {
        ValidationResult result = check(document);
        for (ValidationResult.ValidationIssue warning : result.getWarnings()) {
            logger.warn("{}:{}: {}", document.getSourcePath(), warning.getPosition(), warning.getMessage());
        }
        if (result.isValid()) {
            return;
        }

        ValidationResult.ValidationIssue first = result.getErrors().get(0);
        String message = first.getMessage();
        if (result.getErrorCount() > 1) {
            message += String.format(" (and %d more schema error%s)",
                    result.getErrorCount() - 1, result.getErrorCount() == 2 ? "" : "s");
        }
        throw new WorkflowSchemaException(first.getKind(), document.getSourcePath(), first.getPosition(),
                first.getFieldPath(), message);
    }

    private ValidationResult.ValidationIssue toIssue(ValidationMessage message, SourceMap sourceMap) {
        String location = toFieldPath(String.valueOf(message.getInstanceLocation()));
        String type = message.getType();

        if ("additionalProperties".equals(type) && message.getProperty() != null) {
            String fieldPath = location.isEmpty() ? message.getProperty() : location + "." + message.getProperty();
            return issue(ErrorKind.UNKNOWN_FIELD, fieldPath, sourceMap,
                    "Unknown property '" + message.getProperty() + "'");
        }

        String text = LOCATION_PREFIX.matcher(message.getMessage()).replaceFirst("");
        return issue(ErrorKind.INVALID_FIELD, location, sourceMap, text);
    }

    private static ValidationResult.ValidationIssue issue(ErrorKind kind, String fieldPath,
                                                          SourceMap sourceMap, String message) {
        SourcePosition position = sourceMap.positionOf(fieldPath);
        return new ValidationResult.ValidationIssue(ValidationResult.ValidationIssue.Severity.ERROR,
                kind, fieldPath, position, message);
    }

    private static String unknownFieldMessage(String field) {
        List<String> suggestions = StringSimilarity.closestMatches(field, FrontmatterFields.ALL, 1, 3);
        String message = "Unknown property '" + field + "'";
        return suggestions.isEmpty() ? message : message + ". Did you mean: " + suggestions.get(0) + "?";
    }

    /**
     * Converts a JSON path such as {@code $.tools['web-fetch']} or
     * {@code $.imports[0]} into a frontmatter field path.
     */
    static String toFieldPath(String jsonPath) {
        if (jsonPath == null || jsonPath.equals("$") || jsonPath.isEmpty()) {
            return "";
        }
        Matcher matcher = BRACKET_NAME.matcher(jsonPath);
        String dotted = matcher.replaceAll(".$1");
        if (dotted.startsWith("$.")) {
            return dotted.substring(2);
        }
        return dotted.startsWith("$") ? dotted.substring(1) : dotted;
    }

    private static int depth(String fieldPath) {
        if (fieldPath == null || fieldPath.isEmpty()) {
            return 0;
        }
        int depth = 1;
        for (char c : fieldPath.toCharArray()) {
            if (c == '.' || c == '[') {
                depth++;
            }
        }
        return depth;
    }
}
