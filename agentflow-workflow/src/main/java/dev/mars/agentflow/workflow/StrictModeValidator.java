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

import dev.mars.agentflow.core.exceptions.ErrorKind;
import dev.mars.agentflow.core.exceptions.WorkflowConfigurationException;
import dev.mars.agentflow.permissions.PermissionLevel;
import dev.mars.agentflow.permissions.PermissionScope;
import dev.mars.agentflow.permissions.Permissions;
import dev.mars.agentflow.workflow.parser.FrontmatterFields;
import dev.mars.agentflow.workflow.parser.WorkflowDocument;
import dev.mars.agentflow.workflow.tools.NetworkPolicy;

import java.util.List;

/**
 * Extra rules applied in strict mode: the agent may not hold write access to
 * repository content or conversations, and may not reach arbitrary domains.
 */
final class StrictModeValidator {

    static final List<PermissionScope> WRITE_RESTRICTED_SCOPES = List.of(
            PermissionScope.CONTENTS, PermissionScope.ISSUES, PermissionScope.PULL_REQUESTS,
            PermissionScope.DISCUSSIONS);

    private StrictModeValidator() {
    }

    static void validate(Permissions agentPermissions, NetworkPolicy network, WorkflowDocument root)
            throws WorkflowConfigurationException {
        for (PermissionScope scope : WRITE_RESTRICTED_SCOPES) {
            if (agentPermissions.get(scope).orElse(PermissionLevel.NONE) == PermissionLevel.WRITE) {
                String fieldPath = FrontmatterFields.PERMISSIONS + "." + scope.yamlName();
                throw new WorkflowConfigurationException(ErrorKind.STRICT_MODE_VIOLATION, root.getSourcePath(),
                        root.getSourceMap().positionOf(fieldPath), fieldPath,
                        "strict mode does not allow '" + scope.yamlName() + ": write'; declare safe-outputs instead");
            }
        }
        if (network.hasWildcard()) {
            String fieldPath = FrontmatterFields.NETWORK + ".allowed";
            throw new WorkflowConfigurationException(ErrorKind.STRICT_MODE_VIOLATION, root.getSourcePath(),
                    root.getSourceMap().positionOf(fieldPath), fieldPath,
                    "strict mode does not allow the wildcard domain '*'; list the domains the agent needs");
        }
    }
}
