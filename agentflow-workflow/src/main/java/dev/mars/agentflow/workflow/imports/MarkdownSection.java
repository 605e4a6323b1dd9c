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

import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Extracts a headed section from markdown. A section starts at an H1 to H3
 * heading with the given title and runs until the next heading of the same or
 * a higher level.
 */
final class MarkdownSection {

    private static final Pattern HEADING = Pattern.compile("^(#{1,3})[ \\t]+(.*?)[ \\t]*$");

    private MarkdownSection() {
    }

    static Optional<String> extract(String markdown, String title) {
        StringBuilder section = new StringBuilder();
        int level = 0;
        for (String line : markdown.split("\n", -1)) {
            Matcher heading = HEADING.matcher(line);
            if (level == 0) {
                if (heading.matches() && heading.group(2).equals(title)) {
                    level = heading.group(1).length();
                    section.append(line).append('\n');
                }
                continue;
            }
            if (heading.matches() && heading.group(1).length() <= level) {
                break;
            }
            section.append(line).append('\n');
        }
        return level == 0 ? Optional.empty() : Optional.of(section.toString().strip());
    }
}
