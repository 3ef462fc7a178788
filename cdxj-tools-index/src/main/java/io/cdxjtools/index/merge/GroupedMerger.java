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

package io.cdxjtools.index.merge;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.IOException;
import java.io.OutputStream;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.stream.Stream;

/// Merge which partitions its inputs into groups, merges the groups concurrently, and
/// then merges the group outputs.
///
/// This is valid because merging is associative over sorted inputs. The groups are
/// contiguous runs of the input list and the group outputs are re-merged in group
/// order, so equal keys still come out ordered by input index and then by their
/// position within the input, exactly as with a single {@link KWayMerger}.
///
/// Group outputs are written to a private working directory under the configured
/// temporary directory and are deleted when the merge finishes, whether or not it
/// succeeded. No state is shared between groups beyond the final merge.
public class GroupedMerger implements ShardMerger {
    private static final Logger logger = LogManager.getLogger(GroupedMerger.class);

    private final MergeSettings settings;
    private final int threads;
    private final Path tempDir;

    /// @param settings settings used for every group and for the final merge
    /// @param threads number of groups merged concurrently
    /// @param tempDir directory for group outputs
    public GroupedMerger(MergeSettings settings, int threads, Path tempDir) {
        if (threads < 1) {
            throw new IllegalArgumentException("threads must be at least 1: " + threads);
        }
        this.settings = settings;
        this.threads = threads;
        this.tempDir = tempDir;
    }

    @Override
    public MergeStats merge(List<MergeInput> inputs, OutputStream out) throws IOException {
        long liveInputs = inputs.stream().filter(MergeInput::isLive).count();
        if (liveInputs > 1) {
            throw new IllegalArgumentException("At most one live input may be merged, found " + liveInputs);
        }
        int groupCount = Math.min(threads, inputs.size() / 2);
        if (groupCount < 2) {
            logger.debug("Too few inputs to group, merging {} inputs directly", inputs.size());
            return new KWayMerger(settings).merge(inputs, out);
        }

        List<List<MergeInput>> groups = partition(inputs, groupCount);
        Files.createDirectories(tempDir);
        Path workDir = Files.createTempDirectory(tempDir, "cdxj-merge-");
        ExecutorService executor = Executors.newFixedThreadPool(groupCount, r -> {
            Thread t = new Thread(r, "cdxj-merge-group");
            t.setDaemon(true);
            return t;
        });
        try {
            List<Future<MergeStats>> futures = new ArrayList<>(groupCount);
            List<MergeInput> groupOutputs = new ArrayList<>(groupCount);
            for (int g = 0; g < groups.size(); g++) {
                List<MergeInput> group = groups.get(g);
                Path groupFile = workDir.resolve(String.format("group-%04d.cdxj", g));
                groupOutputs.add(MergeInput.of(groupFile));
                futures.add(executor.submit(() -> {
                    try (OutputStream groupOut = Files.newOutputStream(groupFile)) {
                        return new KWayMerger(settings).merge(group, groupOut);
                    }
                }));
            }

            List<String> names = new ArrayList<>(inputs.size());
            inputs.forEach(i -> names.add(i.name()));
            MergeStats combined = new MergeStats(names);
            int offset = 0;
            for (int g = 0; g < futures.size(); g++) {
                MergeStats groupStats = await(futures.get(g));
                for (int i = 0; i < groupStats.inputNames().size(); i++) {
                    combined.addRecords(offset + i, groupStats.recordsFrom(i));
                }
                groupStats.skippedInputs().forEach(combined::markSkipped);
                offset += groupStats.inputNames().size();
                logger.debug("Group {} of {}: {}", g + 1, groups.size(), groupStats);
            }

            MergeStats finalStats = new KWayMerger(settings).merge(groupOutputs, out);
            if (finalStats.totalRecords() != combined.totalRecords()) {
                throw new IllegalStateException(String.format(
                    "Group outputs held %d records but the final merge wrote %d",
                    combined.totalRecords(), finalStats.totalRecords()));
            }
            logger.info("Grouped merge complete over {} groups: {}", groups.size(), combined);
            return combined;
        } finally {
            executor.shutdownNow();
            deleteDirectory(workDir);
        }
    }

    private static MergeStats await(Future<MergeStats> future) throws IOException {
        try {
            return future.get();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IOException("Interrupted while waiting for a group merge", e);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof IOException io) {
                throw io;
            }
            if (cause instanceof RuntimeException re) {
                throw re;
            }
            throw new IOException("Group merge failed", cause);
        }
    }

    /// Split a list into contiguous groups whose sizes differ by at most one.
    /// @param items the list to split
    /// @param groupCount the number of groups
    /// @param <T> element type
    /// @return the groups, in order
    static <T> List<List<T>> partition(List<T> items, int groupCount) {
        List<List<T>> groups = new ArrayList<>(groupCount);
        int base = items.size() / groupCount;
        int remainder = items.size() % groupCount;
        int start = 0;
        for (int g = 0; g < groupCount; g++) {
            int size = base + (g < remainder ? 1 : 0);
            groups.add(new ArrayList<>(items.subList(start, start + size)));
            start += size;
        }
        return groups;
    }

    private static void deleteDirectory(Path dir) {
        if (!Files.exists(dir)) {
            return;
        }
        try (Stream<Path> paths = Files.walk(dir)) {
            paths.sorted(Comparator.reverseOrder()).forEach(path -> {
                try {
                    Files.delete(path);
                } catch (IOException e) {
                    logger.warn("Could not delete: " + path, e);
                }
            });
        } catch (IOException | UncheckedIOException e) {
            logger.warn("Could not clean up merge directory {}", dir, e);
        }
    }
}
