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

package dev.mars.agentflow.workflow.parser;

import java.util.Objects;

/**
 * One parsed markdown file: its frontmatter, prompt body and source location
 * data. Immutable.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-08-18
 * @version 1.0
 */
public final class WorkflowDocument {

    private final String sourcePath;
    private final String sourceText;
    private final Frontmatter frontmatter;
    private final String body;
    private final SourceMap sourceMap;

    public WorkflowDocument(String sourcePath, String sourceText, Frontmatter frontmatter,
                            String body, SourceMap sourceMap) {
        this.sourcePath = Objects.requireNonNull(sourcePath, "Source path cannot be null");
        this.sourceText = sourceText != null ? sourceText : "";
        this.frontmatter = Objects.requireNonNull(frontmatter, "Frontmatter cannot be null");
        this.body = body != null ? body : "";
        this.sourceMap = sourceMap != null ? sourceMap : SourceMap.EMPTY;
    }

    public String getSourcePath() {
        return sourcePath;
    }

    public String getSourceText() {
        return sourceText;
    }

    public Frontmatter getFrontmatter() {
        return frontmatter;
    }

    public String getBody() {
        return body;
    }

    public SourceMap getSourceMap() {
        return sourceMap;
    }

    @Override
    public String toString() {
        return "WorkflowDocument{" +
                "sourcePath='" + sourcePath + '\'' +
                ", fields=" + frontmatter.fieldNames() +
                ", bodyLength=" + body.length() +
                '}';
    }
}
