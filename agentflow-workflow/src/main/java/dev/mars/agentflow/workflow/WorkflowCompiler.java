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

package dev.mars.agentflow.workflow;

import dev.mars.agentflow.config.CompilerConfiguration;
import dev.mars.agentflow.core.SourcePosition;
import dev.mars.agentflow.core.exceptions.CompilationException;
import dev.mars.agentflow.core.exceptions.InvalidTransitionException;
import dev.mars.agentflow.core.exceptions.WorkflowParseException;
import dev.mars.agentflow.permissions.Permissions;
import dev.mars.agentflow.workflow.emit.LockFileHeader;
import dev.mars.agentflow.workflow.emit.StopTimeResolver;
import dev.mars.agentflow.workflow.emit.YamlEmitter;
import dev.mars.agentflow.workflow.engine.AgenticEngine;
import dev.mars.agentflow.workflow.engine.EngineContext;
import dev.mars.agentflow.workflow.engine.EngineRegistry;
import dev.mars.agentflow.workflow.engine.EngineSelection;
import dev.mars.agentflow.workflow.imports.FileSystemImportSource;
import dev.mars.agentflow.workflow.imports.ImportResolver;
import dev.mars.agentflow.workflow.imports.ImportSource;
import dev.mars.agentflow.workflow.imports.ResolvedImports;
import dev.mars.agentflow.workflow.imports.VirtualImportSource;
import dev.mars.agentflow.workflow.jobs.AgentJobBuilder;
import dev.mars.agentflow.workflow.jobs.PreActivationJobBuilder;
import dev.mars.agentflow.workflow.merge.ConfigurationMerger;
import dev.mars.agentflow.workflow.merge.EffectiveConfiguration;
import dev.mars.agentflow.workflow.model.ActionPins;
import dev.mars.agentflow.workflow.model.CompiledWorkflow;
import dev.mars.agentflow.workflow.model.Job;
import dev.mars.agentflow.workflow.parser.Frontmatter;
import dev.mars.agentflow.workflow.parser.FrontmatterFields;
import dev.mars.agentflow.workflow.parser.FrontmatterParser;
import dev.mars.agentflow.workflow.parser.FrontmatterSchemaValidator;
import dev.mars.agentflow.workflow.parser.WorkflowDocument;
import dev.mars.agentflow.workflow.parser.YamlSupport;
import dev.mars.agentflow.workflow.safeoutputs.SafeOutputsConfig;
import dev.mars.agentflow.workflow.safeoutputs.SafeOutputsValidator;
import dev.mars.agentflow.workflow.safeoutputs.SafeOutputsWiring;
import dev.mars.agentflow.workflow.schedule.ScheduleScatter;
import dev.mars.agentflow.workflow.tools.NetworkPolicy;
import dev.mars.agentflow.workflow.tools.ToolConfiguration;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Clock;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Compiles markdown workflows into GitHub Actions lock files.
 *
 * <p>Each compile runs the stages of {@link CompilationStage} in order:
 * the document's imports are resolved, fragments are merged into one
 * effective configuration, an engine is selected, safe outputs are wired
 * and the workflow is rendered. The compiler holds only immutable
 * collaborators, so one instance may be shared between threads.</p>
 *
 * <pre>{@code
 * WorkflowCompiler compiler = new WorkflowCompiler(
 *         EngineRegistry.withDefaultEngines(), CompilerConfiguration.defaults(), CompilerOptions.defaults());
 * CompilationResult result = compiler.compileFile(Paths.get(".github/workflows/triage.md"));
 * }</pre>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-08-23
 * @version 1.0
 */
public class WorkflowCompiler {
    private static final Logger logger = LoggerFactory.getLogger(WorkflowCompiler.class);

    static final String DEFAULT_CONCURRENCY_GROUP = "agentflow-${{ github.workflow }}";
    static final String ISSUE_NUMBER_EXPRESSION = "github.event.issue.number";
    static final String TRIAL_ISSUE_NUMBER_EXPRESSION = "inputs.issue_number";
    static final String STOP_AFTER = "stop-after";

    private final EngineRegistry registry;
    private final CompilerConfiguration configuration;
    private final CompilerOptions options;
    private final Clock clock;
    private final FrontmatterParser parser = new FrontmatterParser();
    private final FrontmatterSchemaValidator validator = new FrontmatterSchemaValidator();
    private final YamlEmitter emitter = new YamlEmitter();

    public WorkflowCompiler(EngineRegistry registry, CompilerConfiguration configuration, CompilerOptions options) {
        this(registry, configuration, options, Clock.systemUTC());
    }

    public WorkflowCompiler(EngineRegistry registry, CompilerConfiguration configuration, CompilerOptions options,
                            Clock clock) {
        this.registry = Objects.requireNonNull(registry, "Engine registry cannot be null");
        this.configuration = Objects.requireNonNull(configuration, "Configuration cannot be null");
        this.options = Objects.requireNonNull(options, "Options cannot be null");
        this.clock = Objects.requireNonNull(clock, "Clock cannot be null");
    }

    public CompilerOptions getOptions() {
        return options;
    }

    public CompilerConfiguration getConfiguration() {
        return configuration;
    }

    /**
     * Parses workflow content and, unless validation is skipped, checks it
     * against the frontmatter schema.
     *
     * @param content  the markdown source
     * @param filename the path reported in diagnostics and used to resolve imports
     */
    public WorkflowDocument parseWorkflowString(String content, String filename) throws CompilationException {
        Objects.requireNonNull(content, "Content cannot be null");
        Objects.requireNonNull(filename, "Filename cannot be null");
        WorkflowDocument document = parser.parse(content, filename);
        if (options.isSkipValidation()) {
            logger.debug("Schema validation skipped for {}", filename);
        } else {
            validator.validate(document);
        }
        return document;
    }

    public WorkflowDocument parseWorkflowFile(Path path) throws CompilationException {
        Objects.requireNonNull(path, "Path cannot be null");
        String sourcePath = ImportSource.normalize(path.toString());
        String content;
        try {
            content = Files.readString(path, StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new WorkflowParseException(sourcePath, SourcePosition.UNKNOWN,
                    "cannot read workflow file: " + e.getMessage(), e);
        }
        return parseWorkflowString(content, sourcePath);
    }

    /**
     * Compiles a parsed document to lock file YAML without writing anything.
     *
     * @param document the parsed main workflow
     * @param filename the workflow path; locates the previous lock file and
     *                 names the workflow when nothing else does
     */
    public String compileToYaml(WorkflowDocument document, String filename)
            throws CompilationException, InvalidTransitionException {
        Objects.requireNonNull(document, "Document cannot be null");
        String path = filename != null ? filename : document.getSourcePath();
        return compile(document, lockFilePath(Paths.get(path)), false);
    }

    /**
     * Parses, compiles and, unless no-emit is set, writes the lock file next
     * to the source.
     */
    public CompilationResult compileFile(Path path) throws CompilationException, InvalidTransitionException {
        WorkflowDocument document = parseWorkflowFile(path);
        Path lockFile = lockFilePath(path);
        String yaml = compile(document, lockFile, !options.isNoEmit());
        return CompilationResult.success(document.getSourcePath(), lockFile, yaml, !options.isNoEmit());
    }

    /**
     * @return the lock file path for a workflow source: the {@code .md}
     *         extension replaced by the configured suffix
     */
    public Path lockFilePath(Path source) {
        String fileName = source.getFileName().toString();
        String base = fileName.endsWith(".md") ? fileName.substring(0, fileName.length() - 3) : fileName;
        return source.resolveSibling(base + configuration.getLockFileSuffix());
    }

    private String compile(WorkflowDocument document, Path lockFile, boolean write)
            throws CompilationException, InvalidTransitionException {
        String sourcePath = document.getSourcePath();
        StageTracker stages = new StageTracker(sourcePath);
        logger.info("Compiling workflow {}", sourcePath);

        ResolvedImports imports = new ImportResolver(parser, options.isSkipValidation() ? null : validator,
                importSource(), options.getImportRoot().orElse(null)).resolve(document);
        stages.advance(CompilationStage.IMPORTED);

        EffectiveConfiguration effective = new ConfigurationMerger(options.getBodyComposition()).merge(imports);
        Frontmatter frontmatter = effective.getFrontmatter();
        stages.advance(CompilationStage.MERGED);

        EngineSelection selection = registry.select(options.getEngineOverride().orElse(null),
                frontmatter.get(FrontmatterFields.ENGINE), configuration.getDefaultEngine(), sourcePath,
                document.getSourceMap().positionOf(FrontmatterFields.ENGINE));
        AgenticEngine engine = selection.getEngine();
        stages.advance(CompilationStage.ENGINE_SELECTED);
        logger.debug("{}: engine {} selected", sourcePath, engine.getId());

        ToolConfiguration tools = ToolConfiguration.parse(frontmatter, document);
        NetworkPolicy network = NetworkPolicy.parse(frontmatter, document);
        SafeOutputsConfig safeOutputs = SafeOutputsConfig.parse(frontmatter, document);
        SafeOutputsValidator.validate(safeOutputs, tools, imports.allDocuments(), document);

        Permissions agentPermissions = effective.getPermissions().orElse(Permissions.readAll());
        if (options.isStrict() || frontmatter.getBoolean(FrontmatterFields.STRICT).orElse(false)) {
            StrictModeValidator.validate(agentPermissions, network, document);
        }
        if (frontmatter.has(FrontmatterFields.TIMEOUT_MINUTES_LEGACY)) {
            logger.warn("{}: 'timeout_minutes' is deprecated; use 'timeout-minutes'", sourcePath);
        }

        String workflowName = frontmatter.getString(FrontmatterFields.NAME)
                .orElseGet(() -> FrontmatterParser.resolveWorkflowName(document));
        Object runsOn = frontmatter.get(FrontmatterFields.RUNS_ON) != null
                ? frontmatter.get(FrontmatterFields.RUNS_ON) : configuration.getRunner();

        Object on = YamlSupport.mutableCopy(frontmatter.get(FrontmatterFields.ON));
        String stopTime = null;
        Map<String, Object> triggers = YamlSupport.asMap(on);
        if (triggers != null && triggers.containsKey(STOP_AFTER)) {
            Object stopAfter = triggers.remove(STOP_AFTER);
            stopTime = new StopTimeResolver(clock).resolve(String.valueOf(stopAfter), lockFile,
                    options.isRefreshStopTime(), sourcePath,
                    document.getSourceMap().positionOf(FrontmatterFields.ON + "." + STOP_AFTER));
        }
        if (on == null) {
            Map<String, Object> dispatch = new LinkedHashMap<>();
            dispatch.put("workflow_dispatch", new LinkedHashMap<>());
            on = dispatch;
        }
        String identifier = options.getWorkflowIdentifier().orElseGet(() -> FrontmatterParser.baseName(sourcePath));
        on = new ScheduleScatter(identifier).apply(on);
        if (options.isTrialMode()) {
            on = trialTrigger();
        }

        PreActivationJobBuilder preActivation = new PreActivationJobBuilder(configuration, runsOn)
                .roles(roles(frontmatter))
                .stopTime(stopTime, workflowName);

        EngineContext engineContext = new EngineContext(selection.getConfig(), tools,
                network.allowedDomains(engine.getDefaultDomains()),
                tools.hasMcpServers() || safeOutputs.isEnabled(), safeOutputs.isEnabled());
        SafeOutputsWiring wiring = safeOutputs.isEnabled()
                ? new SafeOutputsWiring(safeOutputs, configuration.getActionsDirectory(),
                        ActionPins.setupStep(configuration.getCompilerVersion(), configuration.getActionsDirectory()))
                : null;

        AgentJobBuilder agentJob = new AgentJobBuilder(configuration, effective, engine, engineContext)
                .tools(tools)
                .safeOutputs(wiring)
                .permissions(agentPermissions)
                .bodyComposition(options.getBodyComposition())
                .runsOn(runsOn);
        if (preActivation.isRequired()) {
            agentJob.activationCondition(PreActivationJobBuilder.activationCondition());
        }
        options.getTrialLogicalRepository().ifPresent(agentJob::trialRepository);

        List<Job> jobs = new ArrayList<>();
        if (preActivation.isRequired()) {
            jobs.add(preActivation.build());
        }
        jobs.add(agentJob.build());
        if (wiring != null) {
            jobs.add(wiring.handlerJob(AgentJobBuilder.JOB_ID, runsOn));
        }
        stages.advance(CompilationStage.SAFE_OUTPUTS_WIRED);

        CompiledWorkflow.Builder workflow = CompiledWorkflow.builder(workflowName)
                .on(on)
                .permissions(Permissions.empty())
                .concurrency(frontmatter.get(FrontmatterFields.CONCURRENCY) != null
                        ? frontmatter.get(FrontmatterFields.CONCURRENCY)
                        : Map.of("group", DEFAULT_CONCURRENCY_GROUP))
                .runName(frontmatter.getString(FrontmatterFields.RUN_NAME).orElse(null))
                .env(frontmatter.getMap(FrontmatterFields.ENV));
        for (Job job : jobs) {
            workflow.job(options.isTrialMode()
                    ? job.mapStrings(s -> s.replace(ISSUE_NUMBER_EXPRESSION, TRIAL_ISSUE_NUMBER_EXPRESSION))
                    : job);
        }

        LockFileHeader header = new LockFileHeader(configuration.getCompilerVersion(), sourcePath,
                imports.getImportedPaths(),
                LockFileHeader.computeFrontmatterHash(frontmatter.asMap(), effective.getPrompt()),
                stopTime);
        String yaml = emitter.emit(workflow.build(), header);
        if (write) {
            emitter.write(lockFile, yaml, sourcePath);
            logger.info("Wrote {}", lockFile);
        }
        stages.advance(CompilationStage.EMITTED);
        logger.info("Compiled {} ({} jobs, engine {})", sourcePath, jobs.size(), engine.getId());
        return yaml;
    }

    private ImportSource importSource() {
        ImportSource fileSystem = new FileSystemImportSource();
        return options.getVirtualFiles().isEmpty()
                ? fileSystem
                : new VirtualImportSource(options.getVirtualFiles(), fileSystem);
    }

    private static List<String> roles(Frontmatter frontmatter) {
        List<Object> roles = YamlSupport.asList(frontmatter.get(FrontmatterFields.ROLES));
        if (roles == null) {
            return List.of();
        }
        List<String> names = new ArrayList<>();
        for (Object role : roles) {
            names.add(String.valueOf(role));
        }
        return names;
    }

    private static Map<String, Object> trialTrigger() {
        Map<String, Object> issueNumber = new LinkedHashMap<>();
        issueNumber.put("description", "Issue number to use in place of the triggering event");
        issueNumber.put("required", false);
        issueNumber.put("type", "string");
        Map<String, Object> dispatch = new LinkedHashMap<>();
        dispatch.put("inputs", Map.of("issue_number", issueNumber));
        Map<String, Object> on = new LinkedHashMap<>();
        on.put("workflow_dispatch", dispatch);
        return on;
    }
}
