/*
 * Copyright (c) nosqlbench
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *   http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package io.cdxjtools.command.common;

import picocli.CommandLine;

import java.nio.file.Path;

/**
 * Shared parallel execution options for merging.
 * Provides {@code --parallel}, {@code --threads} and {@code --temp-dir}. With more than
 * one thread, shards are merged in groups on separate workers and the group outputs,
 * kept under the temporary directory, are merged last.
 */
public class ParallelExecutionOption {

    @CommandLine.Option(
        names = {"-p", "--parallel"},
        description = "Merge shard groups in parallel (auto-sizes based on available CPU cores)"
    )
    private boolean parallel = false;

    @CommandLine.Option(
        names = {"--threads"},
        description = "Number of shard groups merged concurrently (default: 1, or cores - 1 with --parallel)"
    )
    private Integer explicitThreads;

    @CommandLine.Option(
        names = {"--temp-dir"},
        description = "Directory for group outputs of a parallel merge (default: next to the output, or system temp)"
    )
    private Path tempDir;

    /**
     * Checks if parallel execution is enabled.
     *
     * @return true if parallel is enabled
     */
    public boolean isParallel() {
        return parallel;
    }

    /**
     * Gets the explicitly specified thread count, if any.
     *
     * @return the thread count, or null if auto-detect should be used
     */
    public Integer getExplicitThreads() {
        return explicitThreads;
    }

    /**
     * Calculates the thread count. Auto-detection leaves one core free.
     *
     * @return the thread count, at least 1
     */
    public int getOptimalThreadCount() {
        if (explicitThreads != null) {
            return Math.max(1, explicitThreads);
        } else if (parallel) {
            return Math.max(1, Runtime.getRuntime().availableProcessors() - 1);
        } else {
            return 1;
        }
    }

    /**
     * Checks if the user explicitly specified more threads than available cores.
     *
     * @return true if thread count exceeds available cores
     */
    public boolean exceedsAvailableCores() {
        if (explicitThreads == null) {
            return false;
        }
        return explicitThreads >= Runtime.getRuntime().availableProcessors();
    }

    /**
     * Resolves the directory for group outputs.
     *
     * @param output the final output path, or null for standard output
     * @return the explicit temp dir, else the output's directory, else the system temp dir
     */
    public Path resolveTempDir(Path output) {
        if (tempDir != null) {
            return tempDir.normalize();
        }
        if (output != null && output.toAbsolutePath().getParent() != null) {
            return output.toAbsolutePath().getParent();
        }
        return Path.of(System.getProperty("java.io.tmpdir"));
    }
}
