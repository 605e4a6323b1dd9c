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

import dev.mars.agentflow.core.SourcePosition;
import dev.mars.agentflow.core.exceptions.CompilationException;
import dev.mars.agentflow.core.exceptions.ErrorKind;
import dev.mars.agentflow.core.exceptions.ForbiddenFieldException;
import dev.mars.agentflow.core.exceptions.ImportCycleException;
import dev.mars.agentflow.core.exceptions.WorkflowConfigurationException;
import dev.mars.agentflow.core.exceptions.WorkflowSchemaException;
import dev.mars.agentflow.workflow.parser.FrontmatterFields;
import dev.mars.agentflow.workflow.parser.FrontmatterParser;
import dev.mars.agentflow.workflow.parser.FrontmatterSchemaValidator;
import dev.mars.agentflow.workflow.parser.WorkflowDocument;
import dev.mars.agentflow.workflow.parser.YamlSupport;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Loads the transitive {@code imports} of a workflow.
 *
 * <p>Traversal is depth-first. A file that is re-entered while still on the
 * traversal stack is a cycle; a file that was already fully loaded (a diamond)
 * is not read again. Every fragment is checked for fields reserved to the main
 * workflow before it is schema-validated.</p>
 *
 * <p>References resolve against the importing file's directory, or against the
 * import root when they start with {@code /}. Every resolved path must stay
 * inside the import root, which defaults to the {@code .github} directory
 * holding the main workflow, or the main workflow's own directory when there
 * is none.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-08-18
 * @version 1.0
 */
public class ImportResolver {
    private static final Logger logger = LoggerFactory.getLogger(ImportResolver.class);

    private static final String GITHUB_DIR = ".github";
    private static final String LOCK_FILE_SUFFIX = ".lock.yml";

    private final FrontmatterParser parser;
    private final FrontmatterSchemaValidator validator;
    private final ImportSource source;
    private final String importRoot;

    public ImportResolver(FrontmatterParser parser, FrontmatterSchemaValidator validator, ImportSource source) {
        this(parser, validator, source, null);
    }

    /**
     * @param parser     parser for fragment files
     * @param validator  schema validator, or null to skip fragment schema validation
     * @param source     where fragment content comes from
     * @param importRoot directory that rooted references resolve against and that
     *                   confines every import, or null for the default
     */
    public ImportResolver(FrontmatterParser parser, FrontmatterSchemaValidator validator, ImportSource source,
                          String importRoot) {
        this.parser = Objects.requireNonNull(parser, "Parser cannot be null");
        this.validator = validator;
        this.source = Objects.requireNonNull(source, "Import source cannot be null");
        this.importRoot = importRoot;
    }

    /**
     * Resolves all imports of the given root document.
     *
     * @throws ImportCycleException           if the imports form a cycle
     * @throws ForbiddenFieldException        if a fragment declares a main-workflow-only field
     * @throws WorkflowConfigurationException if an imported file is missing, escapes the
     *                                        import root, is a lock file or lacks the named section
     * @throws CompilationException           for parse or schema errors inside fragments
     */
    public ResolvedImports resolve(WorkflowDocument root) throws CompilationException {
        String rootPath = ImportSource.normalize(root.getSourcePath());
        String rootDirectory = importRoot != null ? ImportSource.normalize(importRoot) : defaultImportRoot(rootPath);
        Traversal traversal = new Traversal(rootPath, rootDirectory);
        traversal.stack.addLast(rootPath);

        visit(root, rootPath, traversal);

        List<WorkflowDocument> fragments = new ArrayList<>();
        for (String path : traversal.graph.mergeOrder()) {
            fragments.add(traversal.loaded.get(path));
        }
        if (!fragments.isEmpty()) {
            logger.debug("Resolved {} import(s) for {}: {}", fragments.size(), rootPath,
                    traversal.graph.mergeOrder());
        }
        return new ResolvedImports(root, fragments, traversal.graph, traversal.specs);
    }

    /**
     * Rejects fragments that declare fields only the main workflow may set.
     * The first offending field in document order is reported.
     */
    public static void checkForbiddenFields(WorkflowDocument fragment) throws ForbiddenFieldException {
        for (String field : fragment.getFrontmatter().fieldNames()) {
            if (FrontmatterFields.FORBIDDEN_IN_FRAGMENTS.contains(field)) {
                throw new ForbiddenFieldException(fragment.getSourcePath(),
                        fragment.getSourceMap().positionOf(field), field);
            }
        }
    }

    /**
     * @return the {@code .github} directory enclosing the workflow, or the
     *         workflow's directory ({@code ""} for a bare file name)
     */
    public static String defaultImportRoot(String workflowPath) {
        Path parent = Paths.get(workflowPath).getParent();
        for (Path dir = parent; dir != null; dir = dir.getParent()) {
            Path name = dir.getFileName();
            if (name != null && GITHUB_DIR.equals(name.toString())) {
                return ImportSource.normalize(dir.toString());
            }
        }
        return parent == null ? "" : ImportSource.normalize(parent.toString());
    }

    /**
     * Resolves a reference from the importing file's directory, or from
     * {@code importRoot} when it starts with {@code /}.
     */
    static String resolvePath(String importingPath, String reference, String importRoot) {
        if (reference.startsWith("/")) {
            String rooted = reference.replaceFirst("^/+", "");
            return ImportSource.normalize(Paths.get(importRoot).resolve(rooted).toString());
        }
        Path base = Paths.get(importingPath).getParent();
        Path resolved = base == null ? Paths.get(reference) : base.resolve(reference);
        return ImportSource.normalize(resolved.toString());
    }

    static boolean isWithin(String path, String directory) {
        Path target = Paths.get(path).toAbsolutePath().normalize();
        return target.startsWith(Paths.get(directory).toAbsolutePath().normalize());
    }

    private void visit(WorkflowDocument document, String documentPath, Traversal traversal)
            throws CompilationException {
        List<Object> entries = document.getFrontmatter().getList(FrontmatterFields.IMPORTS);
        for (int i = 0; i < entries.size(); i++) {
            String fieldPath = FrontmatterFields.IMPORTS + "[" + i + "]";
            SourcePosition position = document.getSourceMap().positionOf(fieldPath);
            ImportSpec spec = specOf(entries.get(i), document, fieldPath, position);
            String path = resolvePath(documentPath, spec.getPath(), traversal.importRoot);
            checkAllowed(path, spec, traversal.importRoot, document, fieldPath, position);

            if (traversal.stack.contains(path)) {
                throw new ImportCycleException(document.getSourcePath(), position, cycleChain(traversal.stack, path));
            }
            traversal.graph.addEdge(documentPath, path);
            if (traversal.loaded.containsKey(path)) {
                continue;
            }

            WorkflowDocument fragment = load(path, spec, document, fieldPath, position);
            traversal.stack.addLast(path);
            visit(fragment, path, traversal);
            traversal.stack.removeLast();
            traversal.loaded.put(path, fragment);
            traversal.specs.put(path, spec);
        }
    }

    private static void checkAllowed(String path, ImportSpec spec, String importRoot, WorkflowDocument importer,
                                     String fieldPath, SourcePosition position) throws WorkflowConfigurationException {
        if (path.toLowerCase(Locale.ROOT).endsWith(LOCK_FILE_SUFFIX)) {
            throw new WorkflowConfigurationException(ErrorKind.INVALID_CONFIGURATION, importer.getSourcePath(),
                    position, fieldPath, "Cannot import compiled lock file '" + spec.getPath()
                            + "'; import the source .md file instead");
        }
        if (!isWithin(path, importRoot)) {
            throw new WorkflowConfigurationException(ErrorKind.INVALID_CONFIGURATION, importer.getSourcePath(),
                    position, fieldPath, "Import '" + spec.getPath() + "' resolves to '" + path
                            + "', outside the import root '" + (importRoot.isEmpty() ? "." : importRoot) + "'");
        }
    }

    private WorkflowDocument load(String path, ImportSpec spec, WorkflowDocument importer,
                                  String fieldPath, SourcePosition position) throws CompilationException {
        Optional<String> content;
        try {
            content = source.read(path);
        } catch (IOException e) {
            throw new WorkflowConfigurationException(ErrorKind.MISSING_IMPORT, importer.getSourcePath(), position,
                    fieldPath, "Import '" + spec.getPath() + "' could not be read: " + e.getMessage());
        }
        if (content.isEmpty()) {
            throw new WorkflowConfigurationException(ErrorKind.MISSING_IMPORT, importer.getSourcePath(), position,
                    fieldPath, "Import '" + spec.getPath() + "' not found (resolved to '" + path + "')");
        }

        WorkflowDocument fragment = parser.parse(content.get(), path);
        checkForbiddenFields(fragment);
        if (validator != null) {
            validator.validate(fragment);
        }
        if (spec.getSection().isPresent()
                && MarkdownSection.extract(fragment.getBody(), spec.getSection().get()).isEmpty()) {
            throw new WorkflowConfigurationException(ErrorKind.INVALID_CONFIGURATION, importer.getSourcePath(),
                    position, fieldPath, "Section '" + spec.getSection().get() + "' not found in '" + path + "'");
        }
        return fragment;
    }

    private static ImportSpec specOf(Object entry, WorkflowDocument document, String fieldPath,
                                     SourcePosition position) throws CompilationException {
        Object value = entry;
        Map<String, Object> inputs = null;
        if (entry instanceof Map) {
            Map<String, Object> map = YamlSupport.asMap(entry);
            value = map.get("path");
            Object declared = map.get("inputs");
            if (declared != null) {
                inputs = YamlSupport.asMap(declared);
                if (inputs == null) {
                    throw new WorkflowSchemaException(ErrorKind.INVALID_FIELD, document.getSourcePath(), position,
                            fieldPath + ".inputs", "Import 'inputs' must be an object");
                }
            }
        }
        if (!(value instanceof String) || ((String) value).isBlank()) {
            throw new WorkflowSchemaException(ErrorKind.INVALID_FIELD, document.getSourcePath(), position, fieldPath,
                    "Import must be a path string or an object with a 'path' field");
        }
        ImportSpec spec = ImportSpec.of(((String) value).trim(), inputs);
        if (spec.getPath().isEmpty()) {
            throw new WorkflowSchemaException(ErrorKind.INVALID_FIELD, document.getSourcePath(), position, fieldPath,
                    "Import '" + value + "' names a section but no file");
        }
        return spec;
    }

    private static List<String> cycleChain(Deque<String> stack, String reentered) {
        List<String> chain = new ArrayList<>();
        boolean inCycle = false;
        for (String path : stack) {
            inCycle = inCycle || path.equals(reentered);
            if (inCycle) {
                chain.add(path);
            }
        }
        chain.add(reentered);
        return chain;
    }

    private static final class Traversal {
        private final String importRoot;
        private final ImportGraph graph;
        private final Map<String, WorkflowDocument> loaded = new HashMap<>();
        private final Map<String, ImportSpec> specs = new LinkedHashMap<>();
        private final Deque<String> stack = new ArrayDeque<>();

        private Traversal(String rootPath, String importRoot) {
            this.importRoot = importRoot;
            this.graph = new ImportGraph(rootPath);
        }
    }
}
