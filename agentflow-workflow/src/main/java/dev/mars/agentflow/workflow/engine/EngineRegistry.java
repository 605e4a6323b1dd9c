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

package dev.mars.agentflow.workflow.engine;

import dev.mars.agentflow.config.CompilerConfiguration;
import dev.mars.agentflow.core.SourcePosition;
import dev.mars.agentflow.core.exceptions.ErrorKind;
import dev.mars.agentflow.core.exceptions.WorkflowConfigurationException;
import dev.mars.agentflow.util.StringSimilarity;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.TreeMap;

/**
 * The set of engines a compiler may select from. A registry is an ordinary
 * value: create one, register engines, and hand it to the compiler.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-08-21
 * @version 1.0
 */
public class EngineRegistry {
    private static final Logger logger = LoggerFactory.getLogger(EngineRegistry.class);

    private static final int MAX_SUGGESTIONS = 3;

    private final Map<String, AgenticEngine> engines = new TreeMap<>();

    public EngineRegistry() {
    }

    /**
     * Creates a registry with the built-in engines, using the default actions directory.
     */
    public static EngineRegistry withDefaultEngines() {
        return withDefaultEngines(CompilerConfiguration.defaults().getActionsDirectory());
    }

    public static EngineRegistry withDefaultEngines(String actionsDirectory) {
        EngineRegistry registry = new EngineRegistry();
        registry.register(new CopilotEngine());
        registry.register(new CopilotSdkEngine(actionsDirectory));
        registry.register(new ClaudeEngine());
        registry.register(new CustomEngine());
        logger.debug("Registered default engines: {}", registry.getEngineIds());
        return registry;
    }

    public void register(AgenticEngine engine) {
        Objects.requireNonNull(engine, "Engine cannot be null");
        if (engines.putIfAbsent(engine.getId(), engine) != null) {
            throw new IllegalArgumentException("Engine already registered: " + engine.getId());
        }
    }

    public boolean isValidEngine(String id) {
        return id != null && engines.containsKey(id);
    }

    /**
     * @return registered engine ids in lexical order
     */
    public Set<String> getEngineIds() {
        return Collections.unmodifiableSet(engines.keySet());
    }

    public AgenticEngine resolve(String id) throws WorkflowConfigurationException {
        return resolve(id, null, SourcePosition.UNKNOWN);
    }

    /**
     * Looks up an engine by id.
     *
     * @throws WorkflowConfigurationException ({@link ErrorKind#UNKNOWN_ENGINE}) naming the
     *         valid engines and the closest match
     */
    public AgenticEngine resolve(String id, String sourcePath, SourcePosition position)
            throws WorkflowConfigurationException {
        AgenticEngine engine = id == null ? null : engines.get(id);
        if (engine != null) {
            return engine;
        }
        List<String> suggestions = id == null ? List.of()
                : StringSimilarity.closestMatches(id, engines.keySet(), MAX_SUGGESTIONS);
        StringBuilder message = new StringBuilder("invalid engine value '").append(id)
                .append("'. Must be ").append(describeValidEngines()).append('.');
        if (!suggestions.isEmpty()) {
            message.append("\n\nDid you mean: ").append(suggestions.get(0)).append('?');
        }
        throw new WorkflowConfigurationException(ErrorKind.UNKNOWN_ENGINE, sourcePath, position, "engine",
                message.toString(), suggestions);
    }

    /**
     * Chooses the engine: the override, else the {@code engine} field, else the default.
     *
     * @param override    engine id forced by compile options, or null
     * @param engineField the effective {@code engine} value, or null
     * @param defaultId   engine used when nothing else selects one
     */
    public EngineSelection select(String override, Object engineField, String defaultId, String sourcePath,
                                  SourcePosition position) throws WorkflowConfigurationException {
        EngineConfig config;
        if (override != null && !override.isBlank()) {
            config = EngineConfig.of(override.trim());
            String declared = declaredEngineId(engineField);
            if (declared != null && !declared.equals(config.getId())) {
                logger.warn("{}: engine override '{}' replaces engine '{}' from the frontmatter",
                        sourcePath, config.getId(), declared);
            }
            position = SourcePosition.UNKNOWN;
        } else if (engineField != null) {
            config = EngineConfig.from(engineField, sourcePath, position);
        } else {
            config = EngineConfig.of(defaultId);
        }
        AgenticEngine engine = resolve(config.getId(), sourcePath, position);
        if (engine.isExperimental()) {
            logger.warn("Engine '{}' is experimental", engine.getId());
        }
        return new EngineSelection(engine, config);
    }

    private static String declaredEngineId(Object engineField) {
        if (engineField instanceof String) {
            return ((String) engineField).trim();
        }
        if (engineField instanceof Map && ((Map<?, ?>) engineField).get("id") != null) {
            return String.valueOf(((Map<?, ?>) engineField).get("id")).trim();
        }
        return null;
    }

    private String describeValidEngines() {
        List<String> quoted = new ArrayList<>();
        for (String id : engines.keySet()) {
            quoted.add("'" + id + "'");
        }
        if (quoted.size() <= 1) {
            return String.join("", quoted);
        }
        return String.join(", ", quoted.subList(0, quoted.size() - 1)) + ", or " + quoted.get(quoted.size() - 1);
    }
}
