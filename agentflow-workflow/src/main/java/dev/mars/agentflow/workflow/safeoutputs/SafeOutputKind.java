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

package dev.mars.agentflow.workflow.safeoutputs;

import dev.mars.agentflow.permissions.PermissionScope;
import dev.mars.agentflow.permissions.Permissions;

import java.util.Arrays;
import java.util.Optional;

/**
 * Write operations the agent may request through the safe-outputs MCP server.
 * The agent itself never holds write permissions; a separate job performs the
 * operation with the permissions listed here.
 */
public enum SafeOutputKind {
    CREATE_ISSUE("create-issue", 1, Permissions.write(PermissionScope.ISSUES)),
    ADD_COMMENT("add-comment", 1,
            Permissions.write(PermissionScope.ISSUES, PermissionScope.PULL_REQUESTS, PermissionScope.DISCUSSIONS)),
    CREATE_PULL_REQUEST("create-pull-request", 1,
            Permissions.write(PermissionScope.CONTENTS, PermissionScope.PULL_REQUESTS)),
    ADD_LABELS("add-labels", 3, Permissions.write(PermissionScope.ISSUES, PermissionScope.PULL_REQUESTS)),
    CREATE_DISCUSSION("create-discussion", 1, Permissions.write(PermissionScope.DISCUSSIONS)),
    UPDATE_ISSUE("update-issue", 1, Permissions.write(PermissionScope.ISSUES)),
    CLOSE_ISSUE("close-issue", 1, Permissions.write(PermissionScope.ISSUES)),
    CREATE_PULL_REQUEST_REVIEW_COMMENT("create-pull-request-review-comment", 10,
            Permissions.write(PermissionScope.PULL_REQUESTS)),
    PUSH_TO_PULL_REQUEST_BRANCH("push-to-pull-request-branch", 1,
            Permissions.write(PermissionScope.CONTENTS, PermissionScope.PULL_REQUESTS)),
    MISSING_TOOL("missing-tool", 20, Permissions.empty()),
    NOOP("noop", 1, Permissions.empty());

    private final String yamlName;
    private final int defaultMax;
    private final Permissions requiredPermissions;

    SafeOutputKind(String yamlName, int defaultMax, Permissions requiredPermissions) {
        this.yamlName = yamlName;
        this.defaultMax = defaultMax;
        this.requiredPermissions = requiredPermissions;
    }

    public String yamlName() {
        return yamlName;
    }

    /**
     * @return the MCP tool name the agent calls, for example {@code create_issue}
     */
    public String toolName() {
        return yamlName.replace('-', '_');
    }

    public int defaultMax() {
        return defaultMax;
    }

    public Permissions requiredPermissions() {
        return requiredPermissions;
    }

    /**
     * @return true for the reporting kinds enabled whenever any kind is declared
     */
    public boolean isAlwaysOn() {
        return this == MISSING_TOOL || this == NOOP;
    }

    public static Optional<SafeOutputKind> fromYaml(String name) {
        return Arrays.stream(values()).filter(kind -> kind.yamlName.equals(name)).findFirst();
    }

    @Override
    public String toString() {
        return yamlName;
    }
}
