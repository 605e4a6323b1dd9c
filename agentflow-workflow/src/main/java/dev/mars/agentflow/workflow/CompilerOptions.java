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

package dev.mars.agentflow.workflow;

import dev.mars.agentflow.workflow.merge.BodyComposition;

import java.util.Collections;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;

/**
 * Per-run switches for {@link WorkflowCompiler}. Immutable; use {@link #builder()}.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-08-23
 * @version 1.0
 */
public final class CompilerOptions {

    private static final CompilerOptions DEFAULTS = builder().build();

    private final boolean noEmit;
    private final boolean skipValidation;
    private final String workflowIdentifier;
    private final BodyComposition bodyComposition;
    private final boolean strict;
    private final String engineOverride;
    private final boolean trialMode;
    private final String trialLogicalRepository;
    private final boolean refreshStopTime;
    private final String importRoot;
    private final Map<String, String> virtualFiles;

    private CompilerOptions(Builder builder) {
        this.noEmit = builder.noEmit;
        this.skipValidation = builder.skipValidation;
        this.workflowIdentifier = builder.workflowIdentifier;
        this.bodyComposition = builder.bodyComposition;
        this.strict = builder.strict;
        this.engineOverride = builder.engineOverride;
        this.trialMode = builder.trialMode;
        this.trialLogicalRepository = builder.trialLogicalRepository;
        this.refreshStopTime = builder.refreshStopTime;
        this.importRoot = builder.importRoot;
        this.virtualFiles = Collections.unmodifiableMap(new TreeMap<>(builder.virtualFiles));
        if (trialMode && (trialLogicalRepository == null || trialLogicalRepository.isBlank())) {
            throw new IllegalArgumentException("Trial mode requires a logical repository");
        }
    }

    public static CompilerOptions defaults() {
        return DEFAULTS;
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * @return true when YAML is produced but no lock file is written
     */
    public boolean isNoEmit() {
        return noEmit;
    }

    public boolean isSkipValidation() {
        return skipValidation;
    }

    /**
     * @return the identifier used to scatter fuzzy schedules, when it should not be the file base name
     */
    public Optional<String> getWorkflowIdentifier() {
        return Optional.ofNullable(workflowIdentifier);
    }

    public BodyComposition getBodyComposition() {
        return bodyComposition;
    }

    public boolean isStrict() {
        return strict;
    }

    public Optional<String> getEngineOverride() {
        return Optional.ofNullable(engineOverride);
    }

    public boolean isTrialMode() {
        return trialMode;
    }

    public Optional<String> getTrialLogicalRepository() {
        return Optional.ofNullable(trialLogicalRepository);
    }

    public boolean isRefreshStopTime() {
        return refreshStopTime;
    }

    /**
     * @return the directory rooted imports resolve against and every import must stay
     *         inside; empty for the {@code .github} directory holding the workflow
     */
    public Optional<String> getImportRoot() {
        return Optional.ofNullable(importRoot);
    }

    /**
     * @return in-memory files consulted before the file system when resolving imports
     */
    public Map<String, String> getVirtualFiles() {
        return virtualFiles;
    }

    @Override
    public String toString() {
        return "CompilerOptions{noEmit=" + noEmit + ", skipValidation=" + skipValidation
                + ", bodyComposition=" + bodyComposition + ", strict=" + strict
                + ", engineOverride=" + engineOverride + ", trialMode=" + trialMode
                + ", importRoot=" + importRoot
                + ", virtualFiles=" + virtualFiles.size() + '}';
    }

    public static final class Builder {
        private boolean noEmit;
        private boolean skipValidation;
        private String workflowIdentifier;
        private BodyComposition bodyComposition = BodyComposition.REFERENCE;
        private boolean strict;
        private String engineOverride;
        private boolean trialMode;
        private String trialLogicalRepository;
        private boolean refreshStopTime;
        private String importRoot;
        private final Map<String, String> virtualFiles = new TreeMap<>();

        private Builder() {
        }

        public Builder noEmit(boolean noEmit) {
            this.noEmit = noEmit;
            return this;
        }

        public Builder skipValidation(boolean skipValidation) {
            this.skipValidation = skipValidation;
            return this;
        }

        public Builder workflowIdentifier(String workflowIdentifier) {
            this.workflowIdentifier = workflowIdentifier;
            return this;
        }

        public Builder bodyComposition(BodyComposition bodyComposition) {
            this.bodyComposition = bodyComposition == null ? BodyComposition.REFERENCE : bodyComposition;
            return this;
        }

        public Builder strict(boolean strict) {
            this.strict = strict;
            return this;
        }

        public Builder engineOverride(String engineOverride) {
            this.engineOverride = engineOverride;
            return this;
        }

        /**
         * Compiles for a trial run against {@code logicalRepository}.
         */
        public Builder trialMode(String logicalRepository) {
            this.trialMode = true;
            this.trialLogicalRepository = logicalRepository;
            return this;
        }

        public Builder refreshStopTime(boolean refreshStopTime) {
            this.refreshStopTime = refreshStopTime;
            return this;
        }

        public Builder importRoot(String importRoot) {
            this.importRoot = importRoot;
            return this;
        }

        public Builder virtualFile(String path, String content) {
            this.virtualFiles.put(path, content);
            return this;
        }

        public Builder virtualFiles(Map<String, String> files) {
            this.virtualFiles.putAll(files);
            return this;
        }

        public CompilerOptions build() {
            return new CompilerOptions(this);
        }
    }
}
