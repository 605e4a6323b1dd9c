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

package dev.mars.agentflow.workflow.model;

/**
 * Fixed file locations on the runner shared by the generated steps.
 */
public final class RunnerPaths {

    public static final String ROOT = "/tmp/agentflow/";
    public static final String PROMPT_DIR = "/tmp/agentflow/aw-prompts";
    public static final String PROMPT_FILE = PROMPT_DIR + "/prompt.txt";
    public static final String MCP_CONFIG_DIR = "/tmp/agentflow/mcp-config";
    public static final String MCP_CONFIG_FILE = MCP_CONFIG_DIR + "/mcp-servers.json";
    public static final String AGENT_LOG_DIR = "/tmp/agentflow/sandbox/agent/logs/";
    public static final String AGENT_STDIO_LOG = "/tmp/agentflow/agent-stdio.log";
    public static final String SAFE_OUTPUTS_DIR = "/tmp/agentflow/safeoutputs";
    public static final String SAFE_OUTPUTS_FILE = SAFE_OUTPUTS_DIR + "/outputs.jsonl";
    public static final String SAFE_OUTPUTS_CONFIG_FILE = SAFE_OUTPUTS_DIR + "/config.json";
    public static final String AGENT_OUTPUT_FILE = "/tmp/agentflow/agent_output.json";

    private RunnerPaths() {
    }
}
