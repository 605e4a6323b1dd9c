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

package dev.mars.agentflow.workflow.imports;

import java.io.IOException;
import java.nio.file.Paths;
import java.util.Optional;

/**
 * Supplies the content of imported files.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-08-18
 * @version 1.0
 */
public interface ImportSource {

    /**
     * Reads a file.
     *
     * @param path a normalized path, as resolved by {@link ImportResolver}
     * @return the content, or empty when the file does not exist
     * @throws IOException if the file exists but cannot be read
     */
    Optional<String> read(String path) throws IOException;

    /**
     * Normalizes a path and converts it to forward slashes.
     */
    static String normalize(String path) {
        return Paths.get(path).normalize().toString().replace('\\', '/');
    }
}
