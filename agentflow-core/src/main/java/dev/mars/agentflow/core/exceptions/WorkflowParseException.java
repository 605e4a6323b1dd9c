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

package dev.mars.agentflow.core.exceptions;

import dev.mars.agentflow.core.SourcePosition;

/**
 * Exception thrown when the frontmatter of a workflow document cannot be read,
 * either because the delimiters are broken or the YAML is malformed.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-08-18
 * @version 1.0
 */
public class WorkflowParseException extends CompilationException {

    public WorkflowParseException(String sourcePath, SourcePosition position, String message) {
        super(ErrorKind.MALFORMED_FRONTMATTER, sourcePath, position, null, message);
    }

    public WorkflowParseException(String sourcePath, SourcePosition position, String message, Throwable cause) {
        super(ErrorKind.MALFORMED_FRONTMATTER, sourcePath, position, null, message, cause);
    }
}
