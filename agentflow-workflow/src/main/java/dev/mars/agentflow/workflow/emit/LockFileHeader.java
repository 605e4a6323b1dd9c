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

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Comment block at the top of every lock file. Contains no wall-clock values,
 * so identical inputs produce identical headers.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-08-22
 * @version 1.0
 */
public final class LockFileHeader {

    public static final String STOP_TIME_KEY = "AGENTFLOW_STOP_TIME";
    public static final String HASH_KEY = "frontmatter-hash";

    private static final Pattern STOP_TIME_LINE =
            Pattern.compile("^#\\s*" + STOP_TIME_KEY + ":\\s*(.+?)\\s*$", Pattern.MULTILINE);
    private static final String HASH_ALGORITHM = "SHA-256";

    private final String compilerVersion;
    private final String sourcePath;
    private final List<String> imports;
    private final String frontmatterHash;
    private final String stopTime;

    public LockFileHeader(String compilerVersion, String sourcePath, List<String> imports,
                          String frontmatterHash, String stopTime) {
        this.compilerVersion = Objects.requireNonNull(compilerVersion, "Compiler version cannot be null");
        this.sourcePath = Objects.requireNonNull(sourcePath, "Source path cannot be null");
        this.imports = List.copyOf(imports);
        this.frontmatterHash = Objects.requireNonNull(frontmatterHash, "Frontmatter hash cannot be null");
        this.stopTime = stopTime;
    }

    /**
     * SHA-256 of the canonical JSON of the effective configuration and prompt.
     */
    public static String computeFrontmatterHash(Map<String, Object> effectiveFrontmatter, String prompt) {
        Map<String, Object> canonical = new LinkedHashMap<>();
        canonical.put("frontmatter", effectiveFrontmatter);
        canonical.put("prompt", prompt);
        return sha256Hex(JsonSupport.toCompactJson(canonical));
    }

    static String sha256Hex(String text) {
        try {
            MessageDigest digest = MessageDigest.getInstance(HASH_ALGORITHM);
            byte[] hash = digest.digest(text.getBytes(StandardCharsets.UTF_8));
            StringBuilder result = new StringBuilder();
            for (byte b : hash) {
                result.append(String.format("%02x", b));
            }
            return result.toString();
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("Unsupported hash algorithm: " + HASH_ALGORITHM, e);
        }
    }

    /**
     * Reads the stop time recorded in an existing lock file.
     */
    public static Optional<String> parseStopTime(String lockFileContent) {
        if (lockFileContent == null) {
            return Optional.empty();
        }
        Matcher matcher = STOP_TIME_LINE.matcher(lockFileContent);
        return matcher.find() ? Optional.of(matcher.group(1)) : Optional.empty();
    }

    public String getFrontmatterHash() {
        return frontmatterHash;
    }

    public Optional<String> getStopTime() {
        return Optional.ofNullable(stopTime);
    }

    public String render() {
        StringBuilder header = new StringBuilder();
        header.append("# This file was automatically generated by agentflow ").append(compilerVersion)
                .append(". DO NOT EDIT.\n");
        header.append("#\n");
        header.append("# To update this file, edit the source workflow and recompile it.\n");
        header.append("#\n");
        header.append("# Source: ").append(sourcePath).append('\n');
        if (!imports.isEmpty()) {
            header.append("#\n");
            header.append("# Resolved workflow manifest:\n");
            header.append("#   Imports:\n");
            for (String path : imports) {
                header.append("#     - ").append(path).append('\n');
            }
        }
        header.append("#\n");
        header.append("# ").append(HASH_KEY).append(": ").append(frontmatterHash).append('\n');
        if (stopTime != null) {
            header.append("# ").append(STOP_TIME_KEY).append(": ").append(stopTime).append('\n');
        }
        return header.toString();
    }

    @Override
    public String toString() {
        return render();
    }
}
