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

package io.cdxjtools.index.pipeline;

import io.cdxjtools.index.OrderViolationPolicy;
import io.cdxjtools.index.excessive.DetectionStats;
import io.cdxjtools.index.excessive.ExcessiveKey;
import io.cdxjtools.index.excessive.ExcessiveKeyCache;
import io.cdxjtools.index.excessive.ExcessiveKeyDetector;
import io.cdxjtools.index.excessive.ExcessiveKeyFilter;
import io.cdxjtools.index.excessive.FilterSettings;
import io.cdxjtools.index.excessive.FilterStats;
import io.cdxjtools.index.excessive.FreshnessToken;
import io.cdxjtools.index.fileio.AtomicFileOutput;
import io.cdxjtools.index.merge.GroupedMerger;
import io.cdxjtools.index.merge.KWayMerger;
import io.cdxjtools.index.merge.MergeInput;
import io.cdxjtools.index.merge.MergeSettings;
import io.cdxjtools.index.merge.MergeStats;
import io.cdxjtools.index.merge.ShardMerger;
import io.cdxjtools.index.record.CdxjLineReader;
import io.cdxjtools.index.record.CdxjRecordReader;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/// Builds the master index of a collection from its sorted shards, and optionally a
/// filtered copy without excessive keys.
///
/// ```text
///   shards ─► merge ─► [tag] ─► master ─┬─► detect (or cache) ─► entries
///                                       └──────────────┬──────────┘
///                                                   filter ─► filtered
/// ```
///
/// Every artifact is written through an {@link AtomicFileOutput}, so the master and
/// the filtered index only appear under their final names after the stage that writes
/// them completed. A failing stage leaves the previous artifact, if any, in place.
public class IndexPipeline {
    private static final Logger logger = LogManager.getLogger(IndexPipeline.class);

    private final List<MergeInput> shards;
    private final Path masterPath;
    private final Path filteredPath;
    private final String collection;
    private final long threshold;
    private final ExcessiveKeyCache cache;
    private final MergeSettings mergeSettings;
    private final FilterSettings filterSettings;
    private final int threads;
    private final Path tempDir;

    private IndexPipeline(Builder builder) {
        this.shards = List.copyOf(builder.shards);
        this.masterPath = Objects.requireNonNull(builder.masterPath, "master path is required");
        this.filteredPath = builder.filteredPath;
        this.collection = builder.collection;
        this.threshold = builder.threshold;
        this.cache = builder.cache;
        this.mergeSettings = builder.mergeSettings;
        this.filterSettings = builder.filterSettings;
        this.threads = builder.threads;
        this.tempDir = builder.tempDir;
        if (shards.isEmpty()) {
            throw new IllegalArgumentException("At least one shard is required");
        }
        if (cache != null && filteredPath != null) {
            ExcessiveKeyCache.fileName(cacheKey());
        }
    }

    public static Builder builder() {
        return new Builder();
    }

    /// Run every configured stage in order.
    /// @return what each stage did
    /// @throws IOException if a stage fails on I/O
    public PipelineReport run() throws IOException {
        MergeStats mergeStats = merge();

        TagStats tagStats = null;
        if (collection != null) {
            tagStats = transformInPlace(masterPath, new CollectionTagger(collection));
        }

        if (filteredPath == null) {
            return new PipelineReport(mergeStats, tagStats, null, false, -1, null);
        }

        FreshnessToken token = cache != null ? cache.tokenFor(masterPath, threshold) : null;
        Optional<List<ExcessiveKey>> cached = cache != null ? cache.lookup(cacheKey(), token) : Optional.empty();
        List<ExcessiveKey> entries;
        DetectionStats detection = null;
        if (cached.isPresent()) {
            entries = cached.get();
        } else {
            entries = new ArrayList<>();
            ExcessiveKeyDetector detector = new ExcessiveKeyDetector(threshold, filterSettings.orderViolationPolicy());
            try (CdxjRecordReader reader = new CdxjRecordReader(
                CdxjLineReader.open(masterPath, filterSettings.bufferSize()))) {
                detection = detector.detect(reader, entries::add);
            }
            if (cache != null) {
                cache.store(cacheKey(), token, entries);
            }
        }

        FilterStats filterStats;
        FilterStage filter = new FilterStage(new ExcessiveKeyFilter(filterSettings), entries);
        try (AtomicFileOutput out = AtomicFileOutput.create(filteredPath)) {
            try (InputStream in = Files.newInputStream(masterPath)) {
                filterStats = filter.run(masterPath.toString(), in, out.stream());
            }
            out.commit();
        }
        return new PipelineReport(mergeStats, tagStats, detection, cached.isPresent(), entries.size(), filterStats);
    }

    private MergeStats merge() throws IOException {
        ShardMerger merger = threads > 1
            ? new GroupedMerger(mergeSettings, threads, tempDir != null ? tempDir : masterPath.toAbsolutePath().getParent())
            : new KWayMerger(mergeSettings);
        logger.info("Merging {} shards into {}", shards.size(), masterPath);
        try (AtomicFileOutput out = AtomicFileOutput.create(masterPath)) {
            MergeStats stats = merger.merge(shards, out.stream());
            out.commit();
            return stats;
        }
    }

    private <R> R transformInPlace(Path path, StreamStage<R> stage) throws IOException {
        try (AtomicFileOutput out = AtomicFileOutput.create(path)) {
            R report;
            try (InputStream in = Files.newInputStream(path)) {
                report = stage.run(path.toString(), in, out.stream());
            }
            out.commit();
            return report;
        }
    }

    private String cacheKey() {
        return collection != null ? collection : String.valueOf(masterPath.getFileName());
    }

    /// Builder for {@link IndexPipeline}.
    public static final class Builder {
        private final List<MergeInput> shards = new ArrayList<>();
        private Path masterPath;
        private Path filteredPath;
        private String collection;
        private long threshold = ExcessiveKeyDetector.DEFAULT_THRESHOLD;
        private ExcessiveKeyCache cache;
        private MergeSettings mergeSettings = MergeSettings.defaults();
        private FilterSettings filterSettings = FilterSettings.defaults();
        private int threads = 1;
        private Path tempDir;

        private Builder() {
        }

        public Builder shard(MergeInput shard) {
            shards.add(shard);
            return this;
        }

        public Builder shards(List<MergeInput> inputs) {
            shards.addAll(inputs);
            return this;
        }

        public Builder masterPath(Path path) {
            this.masterPath = path;
            return this;
        }

        /// @param path where the filtered index goes; null skips detection and filtering
        /// @return this builder
        public Builder filteredPath(Path path) {
            this.filteredPath = path;
            return this;
        }

        /// @param name collection label added to every payload, and the cache key; null for neither
        /// @return this builder
        public Builder collection(String name) {
            this.collection = name;
            return this;
        }

        public Builder threshold(long value) {
            this.threshold = value;
            return this;
        }

        public Builder cache(ExcessiveKeyCache value) {
            this.cache = value;
            return this;
        }

        public Builder mergeSettings(MergeSettings value) {
            this.mergeSettings = Objects.requireNonNull(value);
            return this;
        }

        public Builder filterSettings(FilterSettings value) {
            this.filterSettings = Objects.requireNonNull(value);
            return this;
        }

        public Builder orderViolationPolicy(OrderViolationPolicy policy) {
            this.mergeSettings = mergeSettings.withOrderViolationPolicy(policy);
            this.filterSettings = filterSettings.withOrderViolationPolicy(policy);
            return this;
        }

        public Builder threads(int value) {
            this.threads = value;
            return this;
        }

        public Builder tempDir(Path value) {
            this.tempDir = value;
            return this;
        }

        public IndexPipeline build() {
            return new IndexPipeline(this);
        }
    }
}
