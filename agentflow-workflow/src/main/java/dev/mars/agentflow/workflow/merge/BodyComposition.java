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

package dev.mars.agentflow.workflow.merge;

/**
 * How fragment bodies are combined with the main body into the agent prompt.
 */
public enum BodyComposition {

    /** Emit runtime-import macros; bodies are resolved when the workflow runs. */
    REFERENCE,

    /** Concatenate the bodies into the lock file. */
    INLINE
}
