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

/**
 * Classification of compilation failures. Each kind maps to exactly one
 * exception type in this package.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-08-18
 * @version 1.0
 */
public enum ErrorKind {

    /** Frontmatter delimiters or YAML syntax are broken. */
    MALFORMED_FRONTMATTER,

    /** A recognized field has a value of the wrong type or shape. */
    INVALID_FIELD,

    /** A field that the frontmatter schema does not know. */
    UNKNOWN_FIELD,

    /** The import graph contains a cycle. */
    IMPORT_CYCLE,

    /** An imported fragment declares a field reserved for the main workflow. */
    FORBIDDEN_FIELD,

    /** An imported file does not exist. */
    MISSING_IMPORT,

    /** The requested engine is not registered. */
    UNKNOWN_ENGINE,

    /** Semantically invalid configuration, e.g. an unknown tool. */
    INVALID_CONFIGURATION,

    /** A side effect is implied but not declared as a safe output. */
    UNDECLARED_SAFE_OUTPUT,

    /** A strict-mode rule was violated. */
    STRICT_MODE_VIOLATION,

    /** The compiled workflow could not be rendered or written. */
    EMISSION_FAILURE
}
