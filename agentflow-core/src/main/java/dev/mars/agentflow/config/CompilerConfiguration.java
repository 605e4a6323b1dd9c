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

package dev.mars.agentflow.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Locale;
import java.util.Map;
import java.util.Properties;

/**
 * Configuration management for the workflow compiler.
 *
 * <p>Values are resolved in increasing order of precedence:</p>
 * <ol>
 *   <li>built-in defaults</li>
 *   <li>{@code agentflow.properties} from the working directory, {@code ~/.agentflow} or the classpath</li>
 *   <li>system properties starting with {@code agentflow.}</li>
 *   <li>environment variables, e.g. {@code AGENTFLOW_COMPILER_VERSION} for {@code agentflow.compiler.version}</li>
 * </ol>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-08-17
 * @version 1.0
 */
public class CompilerConfiguration {
    private static final Logger logger = LoggerFactory.getLogger(CompilerConfiguration.class);

    public static final String KEY_VERSION = "agentflow.compiler.version";
    public static final String KEY_LOCK_SUFFIX = "agentflow.compiler.lock.suffix";
    public static final String KEY_DEFAULT_ENGINE = "agentflow.compiler.default.engine";
    public static final String KEY_RUNNER = "agentflow.compiler.runner";
    public static final String KEY_ACTIONS_DIR = "agentflow.compiler.actions.dir";
    public static final String KEY_AGENT_TIMEOUT_MINUTES = "agentflow.compiler.agent.timeout.minutes";
    public static final String KEY_BATCH_MAX_PARALLEL = "agentflow.batch.max.parallel";

    private static final String PREFIX = "agentflow.";

    private static final String DEFAULT_LOCK_SUFFIX = ".lock.yml";
    private static final String DEFAULT_ENGINE = "copilot";
    private static final String DEFAULT_RUNNER = "ubuntu-latest";
    private static final String DEFAULT_ACTIONS_DIR = "/opt/agentflow/actions";
    private static final int DEFAULT_AGENT_TIMEOUT_MINUTES = 20;
    private static final int DEFAULT_BATCH_MAX_PARALLEL = 4;

    private final Properties properties;

    /**
     * Loads defaults, property files, system properties and environment overrides.
     */
    public CompilerConfiguration() {
        this.properties = new Properties();
        loadDefaultConfiguration();
        loadConfigurationFromFile();
        loadConfigurationFromSystemProperties();
        loadConfigurationFromEnvironment(System.getenv());
    }

    /**
     * Creates a configuration from defaults plus the given properties only.
     * Intended for tests and embedding.
     */
    public CompilerConfiguration(Properties properties) {
        this.properties = new Properties();
        loadDefaultConfiguration();
        if (properties != null) {
            this.properties.putAll(properties);
        }
    }

    public static CompilerConfiguration defaults() {
        return new CompilerConfiguration(null);
    }

    // Compiler
    public String getCompilerVersion() {
        return getStringProperty(KEY_VERSION, defaultVersion());
    }

    public String getLockFileSuffix() {
        return getStringProperty(KEY_LOCK_SUFFIX, DEFAULT_LOCK_SUFFIX);
    }

    public String getDefaultEngine() {
        return getStringProperty(KEY_DEFAULT_ENGINE, DEFAULT_ENGINE);
    }

    public String getRunner() {
        return getStringProperty(KEY_RUNNER, DEFAULT_RUNNER);
    }

    public String getActionsDirectory() {
        return getStringProperty(KEY_ACTIONS_DIR, DEFAULT_ACTIONS_DIR);
    }

    public int getAgentTimeoutMinutes() {
        return getIntProperty(KEY_AGENT_TIMEOUT_MINUTES, DEFAULT_AGENT_TIMEOUT_MINUTES);
    }

    // Batch
    public int getBatchMaxParallel() {
        int value = getIntProperty(KEY_BATCH_MAX_PARALLEL, DEFAULT_BATCH_MAX_PARALLEL);
        if (value < 1) {
            logger.warn("Property {} must be positive, got {}. Using default: {}",
                    KEY_BATCH_MAX_PARALLEL, value, DEFAULT_BATCH_MAX_PARALLEL);
            return DEFAULT_BATCH_MAX_PARALLEL;
        }
        return value;
    }

    // Generic property access
    public String getProperty(String key) {
        return properties.getProperty(key);
    }

    public String getProperty(String key, String defaultValue) {
        return properties.getProperty(key, defaultValue);
    }

    private String getStringProperty(String key, String defaultValue) {
        String value = properties.getProperty(key);
        return value == null || value.isBlank() ? defaultValue : value.trim();
    }

    private int getIntProperty(String key, int defaultValue) {
        String value = properties.getProperty(key);
        if (value != null) {
            try {
                return Integer.parseInt(value.trim());
            } catch (NumberFormatException e) {
                logger.warn("Invalid integer value for property {}: {}. Using default: {}", key, value, defaultValue);
            }
        }
        return defaultValue;
    }

    private static String defaultVersion() {
        String version = CompilerConfiguration.class.getPackage().getImplementationVersion();
        return version != null ? version : "dev";
    }

    private void loadDefaultConfiguration() {
        properties.setProperty(KEY_LOCK_SUFFIX, DEFAULT_LOCK_SUFFIX);
        properties.setProperty(KEY_DEFAULT_ENGINE, DEFAULT_ENGINE);
        properties.setProperty(KEY_RUNNER, DEFAULT_RUNNER);
        properties.setProperty(KEY_ACTIONS_DIR, DEFAULT_ACTIONS_DIR);
        properties.setProperty(KEY_AGENT_TIMEOUT_MINUTES, String.valueOf(DEFAULT_AGENT_TIMEOUT_MINUTES));
        properties.setProperty(KEY_BATCH_MAX_PARALLEL, String.valueOf(DEFAULT_BATCH_MAX_PARALLEL));
    }

    private void loadConfigurationFromFile() {
        String[] configFiles = {
                "agentflow.properties",
                System.getProperty("user.home") + "/.agentflow/agentflow.properties"
        };

        for (String configFile : configFiles) {
            Path configPath = Paths.get(configFile);
            if (Files.exists(configPath) && Files.isReadable(configPath)) {
                try (InputStream input = Files.newInputStream(configPath)) {
                    properties.load(input);
                    logger.info("Loaded configuration from: {}", configPath);
                    return;
                } catch (IOException e) {
                    logger.warn("Failed to load configuration from {}: {}", configPath, e.getMessage());
                }
            }
        }

        try (InputStream input = getClass().getClassLoader().getResourceAsStream("agentflow.properties")) {
            if (input != null) {
                properties.load(input);
                logger.debug("Loaded configuration from classpath");
            }
        } catch (IOException e) {
            logger.warn("Failed to load configuration from classpath: {}", e.getMessage());
        }
    }

    private void loadConfigurationFromSystemProperties() {
        System.getProperties().entrySet().stream()
                .filter(entry -> entry.getKey().toString().startsWith(PREFIX))
                .forEach(entry -> {
                    properties.setProperty(entry.getKey().toString(), entry.getValue().toString());
                    logger.debug("Override from system property: {}={}", entry.getKey(), entry.getValue());
                });
    }

    void loadConfigurationFromEnvironment(Map<String, String> environment) {
        for (String key : properties.stringPropertyNames()) {
            String value = environment.get(toEnvironmentName(key));
            if (value != null && !value.isBlank()) {
                properties.setProperty(key, value);
                logger.debug("Override from environment: {}", toEnvironmentName(key));
            }
        }
        String version = environment.get(toEnvironmentName(KEY_VERSION));
        if (version != null && !version.isBlank()) {
            properties.setProperty(KEY_VERSION, version);
        }
    }

    static String toEnvironmentName(String key) {
        return key.toUpperCase(Locale.ROOT).replace('.', '_');
    }

    @Override
    public String toString() {
        return "CompilerConfiguration{" +
                "version='" + getCompilerVersion() + '\'' +
                ", defaultEngine='" + getDefaultEngine() + '\'' +
                ", runner='" + getRunner() + '\'' +
                ", batchMaxParallel=" + getBatchMaxParallel() +
                '}';
    }
}
