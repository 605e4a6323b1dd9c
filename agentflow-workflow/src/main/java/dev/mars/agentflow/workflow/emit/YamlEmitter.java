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

package dev.mars.agentflow.workflow.emit;

import dev.mars.agentflow.core.exceptions.EmissionException;
import dev.mars.agentflow.workflow.model.CompiledWorkflow;
import dev.mars.agentflow.workflow.parser.YamlSupport;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.nio.file.StandardOpenOption;
import java.util.Map;

/**
 * Renders a {@link CompiledWorkflow} as GitHub Actions YAML and writes lock files.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-08-22
 * @version 1.0
 */
public class YamlEmitter {
    private static final Logger logger = LoggerFactory.getLogger(YamlEmitter.class);

    /**
     * @return the header followed by the workflow YAML, ending in a single newline
     */
    public String emit(CompiledWorkflow workflow, LockFileHeader header) {
        Map<String, Object> ordered = FieldOrdering.orderWorkflow(workflow.toMap());
        String yaml = YamlSupport.newDumper().dump(ordered);
        return header.render() + "\n" + yaml;
    }

    /**
     * Writes {@code content} through a temporary file in the target directory
     * and moves it into place, so readers never see a partial lock file.
     *
     * @throws EmissionException if the file cannot be written
     */
    public void write(Path target, String content, String sourcePath) throws EmissionException {
        Path directory = target.toAbsolutePath().getParent();
        Path temp = null;
        try {
            Files.createDirectories(directory);
            temp = Files.createTempFile(directory, "." + target.getFileName(), ".tmp");
            Files.writeString(temp, content, StandardCharsets.UTF_8, StandardOpenOption.TRUNCATE_EXISTING);
            try {
                Files.move(temp, target, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
            } catch (AtomicMoveNotSupportedException e) {
                logger.debug("Atomic move not supported for {}, falling back to replace", target);
                Files.move(temp, target, StandardCopyOption.REPLACE_EXISTING);
            }
            logger.debug("Wrote {} ({} bytes)", target, content.length());
        } catch (IOException e) {
            deleteQuietly(temp);
            throw new EmissionException(sourcePath, "Failed to write lock file '" + target + "': " + e.getMessage(), e);
        }
    }

    private static void deleteQuietly(Path temp) {
        if (temp == null) {
            return;
        }
        try {
            Files.deleteIfExists(temp);
        } catch (IOException e) {
            logger.warn("Could not delete temporary file {}: {}", temp, e.getMessage());
        }
    }
}
