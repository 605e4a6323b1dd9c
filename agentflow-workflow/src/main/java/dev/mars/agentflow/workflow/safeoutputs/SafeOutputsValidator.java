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

import dev.mars.agentflow.core.exceptions.ErrorKind;
import dev.mars.agentflow.core.exceptions.WorkflowConfigurationException;
import dev.mars.agentflow.workflow.parser.WorkflowDocument;
import dev.mars.agentflow.workflow.tools.ToolConfiguration;

import java.util.List;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * Best-effort check that every side effect the workflow implies has a
 * matching {@code safe-outputs} declaration.
 *
 * <p>Two signals are checked: a prompt body that names a safe-output tool
 * such as {@code create_issue}, and a GitHub MCP tool allow-list that grants
 * a write tool.</p>
 */
public final class SafeOutputsValidator {

    static final Map<String, SafeOutputKind> GITHUB_WRITE_TOOLS = Map.of(
            "create_issue", SafeOutputKind.CREATE_ISSUE,
            "update_issue", SafeOutputKind.UPDATE_ISSUE,
            "add_issue_comment", SafeOutputKind.ADD_COMMENT,
            "create_pull_request", SafeOutputKind.CREATE_PULL_REQUEST,
            "add_pull_request_review_comment", SafeOutputKind.CREATE_PULL_REQUEST_REVIEW_COMMENT,
            "push_files", SafeOutputKind.PUSH_TO_PULL_REQUEST_BRANCH,
            "create_or_update_file", SafeOutputKind.PUSH_TO_PULL_REQUEST_BRANCH);

    private SafeOutputsValidator() {
    }

    /**
     * @param documents the fragments and the main workflow, whose bodies are scanned
     * @param root      the main workflow, used to position the error
     * @throws WorkflowConfigurationException ({@link ErrorKind#UNDECLARED_SAFE_OUTPUT})
     */
    public static void validate(SafeOutputsConfig config, ToolConfiguration tools,
                                List<WorkflowDocument> documents, WorkflowDocument root)
            throws WorkflowConfigurationException {
        for (SafeOutputKind kind : SafeOutputKind.values()) {
            if (kind.isAlwaysOn() || config.isDeclared(kind)) {
                continue;
            }
            Pattern mention = Pattern.compile("\\b" + Pattern.quote(kind.toolName()) + "\\b");
            for (WorkflowDocument document : documents) {
                if (mention.matcher(document.getBody()).find()) {
                    throw undeclared(root, kind, "the prompt in '" + document.getSourcePath()
                            + "' asks for '" + kind.toolName() + "'");
                }
            }
        }

        if (tools.getGitHub() != null) {
            for (String tool : tools.getGitHub().getAllowed()) {
                SafeOutputKind kind = GITHUB_WRITE_TOOLS.get(tool);
                if (kind != null && !config.isDeclared(kind)) {
                    throw undeclared(root, kind, "the GitHub tool '" + tool + "' writes to the repository");
                }
            }
        }
    }

    private static WorkflowConfigurationException undeclared(WorkflowDocument root, SafeOutputKind kind,
                                                             String reason) {
        return new WorkflowConfigurationException(ErrorKind.UNDECLARED_SAFE_OUTPUT, root.getSourcePath(),
                root.getSourceMap().positionOf("safe-outputs"), "safe-outputs",
                reason + " but safe-outputs does not declare '" + kind.yamlName() + "'");
    }
}
