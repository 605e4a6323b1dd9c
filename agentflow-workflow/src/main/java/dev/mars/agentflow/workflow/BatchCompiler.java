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

import dev.mars.agentflow.core.exceptions.CompilationException;
import dev.mars.agentflow.core.exceptions.InvalidTransitionException;
import dev.mars.agentflow.workflow.imports.ImportSource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Compiles many workflows on a bounded worker pool.
 *
 * <p>Sources that map to the same lock file are compiled one after another
 * by the same worker, so no output path is ever written concurrently. With
 * fail-fast enabled no new compile starts once one has failed, and only the
 * attempted documents appear in the result list.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-08-24
 * @version 1.0
 */
public class BatchCompiler {
    private static final Logger logger = LoggerFactory.getLogger(BatchCompiler.class);

    private final WorkflowCompiler compiler;
    private final int maxParallel;
    private final boolean failFast;

    public BatchCompiler(WorkflowCompiler compiler, boolean failFast) {
        this(compiler, compiler.getConfiguration().getBatchMaxParallel(), failFast);
    }

    public BatchCompiler(WorkflowCompiler compiler, int maxParallel, boolean failFast) {
        this.compiler = Objects.requireNonNull(compiler, "Compiler cannot be null");
        if (maxParallel < 1) {
            throw new IllegalArgumentException("maxParallel must be at least 1, got " + maxParallel);
        }
        this.maxParallel = maxParallel;
        this.failFast = failFast;
    }

    /**
     * @param sources workflow files to compile
     * @return one result per attempted source, in input order
     * @throws InterruptedException if interrupted while waiting for workers
     */
    public List<CompilationResult> compileAll(List<Path> sources) throws InterruptedException {
        Objects.requireNonNull(sources, "Sources cannot be null");
        if (sources.isEmpty()) {
            return List.of();
        }

        Map<Path, List<Integer>> byOutput = new LinkedHashMap<>();
        for (int i = 0; i < sources.size(); i++) {
            Path lockFile = compiler.lockFilePath(sources.get(i).toAbsolutePath().normalize());
            byOutput.computeIfAbsent(lockFile, k -> new ArrayList<>()).add(i);
        }

        CompilationResult[] results = new CompilationResult[sources.size()];
        AtomicBoolean failed = new AtomicBoolean(false);
        int threads = Math.min(maxParallel, byOutput.size());
        logger.info("Compiling {} workflows with {} workers (fail-fast: {})", sources.size(), threads, failFast);

        ExecutorService executor = Executors.newFixedThreadPool(threads, new BatchThreadFactory());
        try {
            List<Future<?>> futures = new ArrayList<>();
            for (List<Integer> group : byOutput.values()) {
                futures.add(executor.submit(() -> {
                    for (int index : group) {
                        if (failFast && failed.get()) {
                            logger.debug("Skipping {} after an earlier failure", sources.get(index));
                            return;
                        }
                        results[index] = compileOne(sources.get(index));
                        if (!results[index].isSuccess()) {
                            failed.set(true);
                        }
                    }
                }));
            }
            for (Future<?> future : futures) {
                await(future);
            }
        } finally {
            executor.shutdownNow();
        }

        List<CompilationResult> attempted = new ArrayList<>();
        int failures = 0;
        for (CompilationResult result : results) {
            if (result != null) {
                attempted.add(result);
                if (!result.isSuccess()) {
                    failures++;
                }
            }
        }
        logger.info("Batch finished: {} compiled, {} failed, {} skipped",
                attempted.size() - failures, failures, sources.size() - attempted.size());
        return attempted;
    }

    private CompilationResult compileOne(Path source) {
        try {
            return compiler.compileFile(source);
        } catch (CompilationException | InvalidTransitionException e) {
            logger.warn("Failed to compile {}: {}", source, e.getMessage());
            return CompilationResult.failure(ImportSource.normalize(source.toString()), e);
        }
    }

    private static void await(Future<?> future) throws InterruptedException {
        try {
            future.get();
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof RuntimeException) {
                throw (RuntimeException) cause;
            }
            if (cause instanceof Error) {
                throw (Error) cause;
            }
            throw new IllegalStateException("Batch worker failed", cause);
        }
    }

    private static final class BatchThreadFactory implements ThreadFactory {
        private final AtomicInteger counter = new AtomicInteger();

        @Override
        public Thread newThread(Runnable runnable) {
            Thread thread = new Thread(runnable, "agentflow-batch-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        }
    }
}
