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

import java.util.List;
import java.util.Set;

/**
 * Names of the recognized frontmatter fields.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-08-18
 * @version 1.0
 */
public final class FrontmatterFields {

    public static final String ON = "on";
    public static final String NAME = "name";
    public static final String DESCRIPTION = "description";
    public static final String SOURCE = "source";
    public static final String IMPORTS = "imports";
    public static final String PERMISSIONS = "permissions";
    public static final String ENGINE = "engine";
    public static final String TOOLS = "tools";
    public static final String MCP_SERVERS = "mcp-servers";
    public static final String SAFE_OUTPUTS = "safe-outputs";
    public static final String NETWORK = "network";
    public static final String STEPS = "steps";
    public static final String POST_STEPS = "post-steps";
    public static final String LABELS = "labels";
    public static final String ENV = "env";
    public static final String TIMEOUT_MINUTES = "timeout-minutes";
    public static final String TIMEOUT_MINUTES_LEGACY = "timeout_minutes";
    public static final String STRICT = "strict";
    public static final String ROLES = "roles";
    public static final String RUN_NAME = "run-name";
    public static final String RUNS_ON = "runs-on";
    public static final String CONCURRENCY = "concurrency";
    public static final String IF = "if";
    public static final String CONTAINER = "container";
    public static final String ENVIRONMENT = "environment";
    public static final String SANDBOX = "sandbox";
    public static final String FEATURES = "features";
    public static final String GITHUB_TOKEN = "github-token";
    public static final String TRACKER_ID = "tracker-id";

    /** Every top-level field the schema accepts. */
    public static final Set<String> ALL = Set.of(
            ON, NAME, DESCRIPTION, SOURCE, IMPORTS, PERMISSIONS, ENGINE, TOOLS, MCP_SERVERS,
            SAFE_OUTPUTS, NETWORK, STEPS, POST_STEPS, LABELS, ENV, TIMEOUT_MINUTES, TIMEOUT_MINUTES_LEGACY,
            STRICT, ROLES, RUN_NAME, RUNS_ON, CONCURRENCY, IF, CONTAINER, ENVIRONMENT, SANDBOX, FEATURES,
            GITHUB_TOKEN, TRACKER_ID);

    /** Fields only the main workflow may declare, in reporting order. */
    public static final List<String> FORBIDDEN_IN_FRAGMENTS = List.of(
            ON, RUN_NAME, RUNS_ON, CONCURRENCY, IF, TIMEOUT_MINUTES, TIMEOUT_MINUTES_LEGACY, CONTAINER,
            ENVIRONMENT, SANDBOX, FEATURES, ROLES, GITHUB_TOKEN, STRICT, TRACKER_ID);

    /**
     * Fields accepted but dropped before validation. Intentionally empty: an
     * unknown field is an error unless it is added here on purpose.
     */
    public static final Set<String> IGNORED_FIELDS = Set.of();

    private FrontmatterFields() {
    }
}
