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

package dev.mars.agentflow.workflow.tools;

import dev.mars.agentflow.core.exceptions.ErrorKind;
import dev.mars.agentflow.core.exceptions.WorkflowConfigurationException;
import dev.mars.agentflow.util.StringSimilarity;
import dev.mars.agentflow.workflow.parser.Frontmatter;
import dev.mars.agentflow.workflow.parser.FrontmatterFields;
import dev.mars.agentflow.workflow.parser.WorkflowDocument;
import dev.mars.agentflow.workflow.parser.YamlSupport;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import java.util.TreeSet;

/**
 * Typed view of the {@code tools} and {@code mcp-servers} sections.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-08-20
 * @version 1.0
 */
public final class ToolConfiguration {

    public static final String BASH = "bash";
    public static final String EDIT = "edit";
    public static final String WEB_FETCH = "web-fetch";
    public static final String WEB_SEARCH = "web-search";
    public static final String GITHUB = "github";
    public static final String PLAYWRIGHT = "playwright";

    static final Set<String> BUILTIN_TOOLS = Set.of(BASH, EDIT, WEB_FETCH, WEB_SEARCH, GITHUB, PLAYWRIGHT);

    private static final Set<String> WILDCARD_COMMANDS = Set.of("*", ":*");

    private final List<String> bashCommands;
    private final boolean bashUnrestricted;
    private final boolean edit;
    private final boolean webFetch;
    private final boolean webSearch;
    private final GitHubTool github;
    private final PlaywrightTool playwright;
    private final Map<String, McpServerConfig> customServers;

    private ToolConfiguration(List<String> bashCommands, boolean bashUnrestricted, boolean edit, boolean webFetch,
                              boolean webSearch, GitHubTool github, PlaywrightTool playwright,
                              Map<String, McpServerConfig> customServers) {
        this.bashCommands = bashCommands == null ? null : List.copyOf(new TreeSet<>(bashCommands));
        this.bashUnrestricted = bashUnrestricted;
        this.edit = edit;
        this.webFetch = webFetch;
        this.webSearch = webSearch;
        this.github = github;
        this.playwright = playwright;
        this.customServers = Collections.unmodifiableMap(new TreeMap<>(customServers));
    }

    public static ToolConfiguration none() {
        return new ToolConfiguration(null, false, false, false, false, null, null, Map.of());
    }

    /**
     * Parses the effective configuration.
     *
     * @param effective the merged frontmatter
     * @param root      the main workflow, used to position errors
     * @throws WorkflowConfigurationException for unknown tools or unusable MCP entries
     */
    public static ToolConfiguration parse(Frontmatter effective, WorkflowDocument root)
            throws WorkflowConfigurationException {
        Map<String, Object> tools = effective.getMap(FrontmatterFields.TOOLS);
        List<String> bash = null;
        boolean bashAll = false;
        GitHubTool github = null;
        PlaywrightTool playwright = null;
        Map<String, McpServerConfig> servers = new TreeMap<>();

        for (Map.Entry<String, Object> entry : tools.entrySet()) {
            String name = entry.getKey();
            Object value = entry.getValue();
            if (Boolean.FALSE.equals(value)) {
                continue;
            }
            switch (name) {
                case BASH:
                    List<Object> commands = YamlSupport.asList(value);
                    bash = new ArrayList<>();
                    if (commands == null) {
                        bashAll = true;
                    } else {
                        for (Object command : commands) {
                            String text = String.valueOf(command).trim();
                            if (WILDCARD_COMMANDS.contains(text)) {
                                bashAll = true;
                            } else {
                                bash.add(text);
                            }
                        }
                    }
                    break;
                case GITHUB:
                    github = GitHubTool.from(YamlSupport.asMap(value));
                    break;
                case PLAYWRIGHT:
                    playwright = PlaywrightTool.from(YamlSupport.asMap(value));
                    break;
                case EDIT:
                case WEB_FETCH:
                case WEB_SEARCH:
                    break;
                default:
                    Map<String, Object> config = YamlSupport.asMap(value);
                    if (config == null || !isMcpConfig(config)) {
                        List<String> suggestions = StringSimilarity.closestMatches(name, BUILTIN_TOOLS, 3, 3);
                        String message = "Unknown tool '" + name + "'. Custom tools need an MCP configuration "
                                + "with 'command', 'container' or 'url'";
                        if (!suggestions.isEmpty()) {
                            message += ".\n\nDid you mean: " + suggestions.get(0) + "?";
                        }
                        throw new WorkflowConfigurationException(ErrorKind.INVALID_CONFIGURATION,
                                root.getSourcePath(), root.getSourceMap().positionOf("tools." + name),
                                "tools." + name, message, suggestions);
                    }
                    servers.put(name, toServer(name, config, "tools." + name, root));
            }
        }

        for (Map.Entry<String, Object> entry : effective.getMap(FrontmatterFields.MCP_SERVERS).entrySet()) {
            String fieldPath = FrontmatterFields.MCP_SERVERS + "." + entry.getKey();
            Map<String, Object> config = YamlSupport.asMap(entry.getValue());
            if (config == null || !isMcpConfig(config)) {
                throw new WorkflowConfigurationException(ErrorKind.INVALID_CONFIGURATION, root.getSourcePath(),
                        root.getSourceMap().positionOf(fieldPath), fieldPath,
                        "MCP server '" + entry.getKey() + "' needs 'command', 'container' or 'url'");
            }
            servers.put(entry.getKey(), toServer(entry.getKey(), config, fieldPath, root));
        }

        return new ToolConfiguration(bash, bashAll, enabled(tools, EDIT), enabled(tools, WEB_FETCH),
                enabled(tools, WEB_SEARCH), github, playwright, servers);
    }

    private static boolean enabled(Map<String, Object> tools, String name) {
        return tools.containsKey(name) && !Boolean.FALSE.equals(tools.get(name));
    }

    private static boolean isMcpConfig(Map<String, Object> config) {
        return config.containsKey("command") || config.containsKey("container") || config.containsKey("url");
    }

    private static McpServerConfig toServer(String name, Map<String, Object> config, String fieldPath,
                                            WorkflowDocument root) throws WorkflowConfigurationException {
        McpServerConfig.Builder builder = McpServerConfig.builder(name);
        Map<String, Object> env = YamlSupport.asMap(config.get("env"));
        if (env != null) {
            env.forEach((key, value) -> builder.env(key, String.valueOf(value)));
        }
        builder.allowed(strings(config.get("allowed")));

        if (config.containsKey("url")) {
            if (config.containsKey("command") || config.containsKey("container")) {
                throw new WorkflowConfigurationException(ErrorKind.INVALID_CONFIGURATION, root.getSourcePath(),
                        root.getSourceMap().positionOf(fieldPath), fieldPath,
                        "MCP server '" + name + "' cannot combine 'url' with 'command' or 'container'");
            }
            builder.url(String.valueOf(config.get("url")));
            Map<String, Object> headers = YamlSupport.asMap(config.get("headers"));
            if (headers != null) {
                headers.forEach((key, value) -> builder.header(key, String.valueOf(value)));
            }
            return builder.build();
        }

        if (config.containsKey("container")) {
            List<String> args = new ArrayList<>(List.of("run", "-i", "--rm"));
            if (env != null) {
                for (String key : new TreeSet<>(env.keySet())) {
                    args.add("-e");
                    args.add(key);
                }
            }
            args.add(String.valueOf(config.get("container")));
            args.addAll(strings(config.get("args")));
            return builder.command("docker").args(args).build();
        }

        return builder.command(String.valueOf(config.get("command"))).args(strings(config.get("args"))).build();
    }

    static List<String> strings(Object value) {
        List<Object> list = YamlSupport.asList(value);
        List<String> result = new ArrayList<>();
        if (list != null) {
            for (Object item : list) {
                result.add(String.valueOf(item));
            }
        }
        return result;
    }

    /**
     * @return allowed bash commands in lexical order, or null when bash is not enabled
     */
    public List<String> getBashCommands() {
        return bashCommands;
    }

    public boolean isBashEnabled() {
        return bashCommands != null;
    }

    public boolean isBashUnrestricted() {
        return bashUnrestricted;
    }

    public boolean isEditEnabled() {
        return edit;
    }

    public boolean isWebFetchEnabled() {
        return webFetch;
    }

    public boolean isWebSearchEnabled() {
        return webSearch;
    }

    public GitHubTool getGitHub() {
        return github;
    }

    public PlaywrightTool getPlaywright() {
        return playwright;
    }

    public Map<String, McpServerConfig> getCustomServers() {
        return customServers;
    }

    public boolean hasMcpServers() {
        return github != null || playwright != null || !customServers.isEmpty();
    }

    /**
     * GitHub MCP server settings.
     */
    public static final class GitHubTool {
        static final String DEFAULT_VERSION = "v0.30.3";

        private final List<String> toolsets;
        private final List<String> allowed;
        private final boolean readOnly;
        private final String version;

        GitHubTool(List<String> toolsets, List<String> allowed, boolean readOnly, String version) {
            this.toolsets = List.copyOf(toolsets);
            this.allowed = List.copyOf(new TreeSet<>(allowed));
            this.readOnly = readOnly;
            this.version = version;
        }

        static GitHubTool from(Map<String, Object> config) {
            if (config == null) {
                return new GitHubTool(List.of("default"), List.of(), true, DEFAULT_VERSION);
            }
            List<String> toolsets = strings(config.get("toolsets"));
            Object version = config.get("version");
            return new GitHubTool(toolsets.isEmpty() ? List.of("default") : toolsets,
                    strings(config.get("allowed")),
                    !Boolean.FALSE.equals(config.get("read-only")),
                    version == null ? DEFAULT_VERSION : String.valueOf(version));
        }

        /**
         * @return the GitHub MCP server image tag
         */
        public String getVersion() {
            return version;
        }

        public List<String> getToolsets() {
            return toolsets;
        }

        public List<String> getAllowed() {
            return allowed;
        }

        public boolean isReadOnly() {
            return readOnly;
        }
    }

    /**
     * Playwright browser automation settings.
     */
    public static final class PlaywrightTool {
        static final String DEFAULT_VERSION = "0.0.64";

        private final String version;
        private final List<String> allowedDomains;

        PlaywrightTool(String version, List<String> allowedDomains) {
            this.version = version;
            this.allowedDomains = List.copyOf(new TreeSet<>(allowedDomains));
        }

        static PlaywrightTool from(Map<String, Object> config) {
            if (config == null) {
                return new PlaywrightTool(DEFAULT_VERSION, List.of("localhost", "127.0.0.1"));
            }
            Object version = config.get("version");
            List<String> domains = strings(config.get("allowed_domains"));
            return new PlaywrightTool(version == null ? DEFAULT_VERSION : String.valueOf(version),
                    domains.isEmpty() ? List.of("localhost", "127.0.0.1") : domains);
        }

        public String getVersion() {
            return version;
        }

        public List<String> getAllowedDomains() {
            return allowedDomains;
        }
    }
}
