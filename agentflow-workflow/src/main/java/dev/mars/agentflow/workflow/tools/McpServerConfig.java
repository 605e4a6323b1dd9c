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

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;

/**
 * One MCP server the agent can talk to, either a local process or an HTTP
 * endpoint.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-08-20
 * @version 1.0
 */
public final class McpServerConfig {

    private final String name;
    private final String command;
    private final List<String> args;
    private final Map<String, String> env;
    private final String url;
    private final Map<String, String> headers;
    private final List<String> allowed;

    private McpServerConfig(Builder builder) {
        this.name = Objects.requireNonNull(builder.name, "Server name cannot be null");
        this.command = builder.command;
        this.args = List.copyOf(builder.args);
        this.env = new TreeMap<>(builder.env);
        this.url = builder.url;
        this.headers = new TreeMap<>(builder.headers);
        this.allowed = List.copyOf(builder.allowed);
        if ((command == null) == (url == null)) {
            throw new IllegalArgumentException("MCP server '" + name + "' needs exactly one of a command or a url");
        }
    }

    public static Builder builder(String name) {
        return new Builder(name);
    }

    public String getName() {
        return name;
    }

    public boolean isHttp() {
        return url != null;
    }

    public String getCommand() {
        return command;
    }

    public List<String> getArgs() {
        return args;
    }

    public Map<String, String> getEnv() {
        return env;
    }

    public String getUrl() {
        return url;
    }

    public Map<String, String> getHeaders() {
        return headers;
    }

    /**
     * @return allowed tool names, empty meaning every tool of the server
     */
    public List<String> getAllowed() {
        return allowed;
    }

    /**
     * @return the JSON object written into the MCP configuration file
     */
    public Map<String, Object> toJsonMap() {
        Map<String, Object> json = new TreeMap<>();
        if (isHttp()) {
            json.put("type", "http");
            json.put("url", url);
            if (!headers.isEmpty()) {
                json.put("headers", headers);
            }
        } else {
            json.put("type", "stdio");
            json.put("command", command);
            json.put("args", args);
            if (!env.isEmpty()) {
                json.put("env", env);
            }
        }
        if (!allowed.isEmpty()) {
            json.put("tools", allowed);
        }
        return json;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        McpServerConfig that = (McpServerConfig) o;
        return name.equals(that.name) && toJsonMap().equals(that.toJsonMap());
    }

    @Override
    public int hashCode() {
        return Objects.hash(name, toJsonMap());
    }

    @Override
    public String toString() {
        return "McpServerConfig{name='" + name + "', " + (isHttp() ? "url='" + url + "'" : "command='" + command + "'") + '}';
    }

    public static final class Builder {
        private final String name;
        private String command;
        private final List<String> args = new ArrayList<>();
        private final Map<String, String> env = new TreeMap<>();
        private String url;
        private final Map<String, String> headers = new TreeMap<>();
        private final List<String> allowed = new ArrayList<>();

        private Builder(String name) {
            this.name = name;
        }

        public Builder command(String command) {
            this.command = command;
            return this;
        }

        public Builder args(List<String> args) {
            this.args.addAll(args);
            return this;
        }

        public Builder env(String key, String value) {
            this.env.put(key, value);
            return this;
        }

        public Builder url(String url) {
            this.url = url;
            return this;
        }

        public Builder header(String key, String value) {
            this.headers.put(key, value);
            return this;
        }

        public Builder allowed(List<String> allowed) {
            this.allowed.addAll(allowed);
            return this;
        }

        public McpServerConfig build() {
            return new McpServerConfig(this);
        }
    }
}
