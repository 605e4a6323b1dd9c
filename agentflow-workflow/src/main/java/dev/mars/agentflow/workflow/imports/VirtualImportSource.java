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
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Serves imports from an in-memory file map, for embedded callers that have
 * no file system. Paths not in the map are delegated to an optional fallback.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-08-18
 * @version 1.0
 */
public class VirtualImportSource implements ImportSource {

    private final Map<String, String> files;
    private final ImportSource fallback;

    public VirtualImportSource(Map<String, String> files) {
        this(files, null);
    }

    public VirtualImportSource(Map<String, String> files, ImportSource fallback) {
        Objects.requireNonNull(files, "Virtual files cannot be null");
        this.files = new LinkedHashMap<>();
        files.forEach((path, content) -> this.files.put(ImportSource.normalize(path), content));
        this.fallback = fallback;
    }

    @Override
    public Optional<String> read(String path) throws IOException {
        String content = files.get(ImportSource.normalize(path));
        if (content != null) {
            return Optional.of(content);
        }
        return fallback != null ? fallback.read(path) : Optional.empty();
    }

    public int size() {
        return files.size();
    }
}
