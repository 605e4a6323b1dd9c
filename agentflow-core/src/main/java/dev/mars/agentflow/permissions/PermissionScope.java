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

package dev.mars.agentflow.permissions;

import java.util.Arrays;
import java.util.Optional;

/**
 * A GitHub token permission scope.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-08-19
 * @version 1.0
 */
public enum PermissionScope {
    ACTIONS("actions"),
    ATTESTATIONS("attestations"),
    CHECKS("checks"),
    CONTENTS("contents"),
    DEPLOYMENTS("deployments"),
    DISCUSSIONS("discussions"),
    ID_TOKEN("id-token"),
    ISSUES("issues"),
    METADATA("metadata"),
    MODELS("models"),
    PACKAGES("packages"),
    PAGES("pages"),
    PULL_REQUESTS("pull-requests"),
    REPOSITORY_PROJECTS("repository-projects"),
    ORGANIZATION_PROJECTS("organization-projects"),
    SECURITY_EVENTS("security-events"),
    STATUSES("statuses");

    private final String yamlName;

    PermissionScope(String yamlName) {
        this.yamlName = yamlName;
    }

    public String yamlName() {
        return yamlName;
    }

    /**
     * Whether a {@code read} level is meaningful for this scope.
     * {@code id-token} only supports {@code write} and {@code none}.
     */
    public boolean supportsRead() {
        return this != ID_TOKEN;
    }

    /**
     * Whether the scope is written to the emitted workflow. GitHub Actions
     * rejects {@code organization-projects} at workflow level and always grants
     * {@code metadata: read}.
     */
    public boolean isRendered() {
        return this != METADATA && this != ORGANIZATION_PROJECTS;
    }

    public static Optional<PermissionScope> fromYaml(String name) {
        return Arrays.stream(values()).filter(s -> s.yamlName.equals(name)).findFirst();
    }

    @Override
    public String toString() {
        return yamlName;
    }
}
