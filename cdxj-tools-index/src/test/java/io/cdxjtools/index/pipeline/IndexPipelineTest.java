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

import io.cdxjtools.index.UnsortedInputException;
import io.cdxjtools.index.excessive.DigestMode;
import io.cdxjtools.index.excessive.ExcessiveKeyCache;
import io.cdxjtools.index.merge.MergeInput;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.stream.Stream;

import static org.assertj.core.api.Assertions.*;

@DisplayName("IndexPipeline")
class IndexPipelineTest {

    @TempDir
    Path tempDir;

    private Path shardA;
    private Path shardB;
    private Path master;
    private Path filtered;

    @BeforeEach
    void setUp() throws IOException {
        StringBuilder trap = new StringBuilder();
        for (int i = 0; i < 6; i++) {
            trap.append(String.format("com,example)/calendar 2020%02d {\"i\": %d}%n", i, i));
        }
        shardA = tempDir.resolve("a.cdxj");
        Files.writeString(shardA, ("com,example)/ 2020 {\"s\": \"a\"}\n" + trap).replace("\r\n", "\n"),
            StandardCharsets.UTF_8);
        shardB = tempDir.resolve("b.cdxj");
        Files.writeString(shardB, "com,example)/about 2021 {\"s\": \"b\"}\norg,archive)/ 2019 {}\n",
            StandardCharsets.UTF_8);
        master = tempDir.resolve("out/master.cdxj");
        filtered = tempDir.resolve("out/filtered.cdxj");
    }

    private List<String> lines(Path path) throws IOException {
        return new ArrayList<>(Files.readAllLines(path, StandardCharsets.UTF_8));
    }

    @Test
    @DisplayName("should merge the shards into the master")
    void shouldMergeOnly() throws IOException {
        PipelineReport report = IndexPipeline.builder()
            .shards(List.of(MergeInput.of(shardA), MergeInput.of(shardB)))
            .masterPath(master)
            .build()
            .run();

        assertThat(lines(master)).hasSize(9).first().isEqualTo("com,example)/ 2020 {\"s\": \"a\"}");
        assertThat(lines(master).get(1)).isEqualTo("com,example)/about 2021 {\"s\": \"b\"}");
        assertThat(report.merge().totalRecords()).isEqualTo(9);
        assertThat(report.filter()).isNull();
        assertThat(report.excessiveKeys()).isEqualTo(-1);
    }

    @Test
    @DisplayName("should tag, detect and filter in one run")
    void shouldRunAllStages() throws IOException {
        PipelineReport report = IndexPipeline.builder()
            .shard(MergeInput.of(shardA))
            .shard(MergeInput.of(shardB))
            .masterPath(master)
            .filteredPath(filtered)
            .collection("AWP1")
            .threshold(5)
            .build()
            .run();

        assertThat(lines(master)).hasSize(9).allMatch(l -> l.endsWith(", \"collection\": \"AWP1\"}")
            || l.endsWith("{\"collection\": \"AWP1\"}"));
        assertThat(lines(filtered)).containsExactly(
            "com,example)/ 2020 {\"s\": \"a\", \"collection\": \"AWP1\"}",
            "com,example)/about 2021 {\"s\": \"b\", \"collection\": \"AWP1\"}",
            "org,archive)/ 2019 {\"collection\": \"AWP1\"}");
        assertThat(report.tag()).isEqualTo(new TagStats(9, 9));
        assertThat(report.excessiveKeys()).isEqualTo(1);
        assertThat(report.filter().recordsRemoved()).isEqualTo(6);
        assertThat(report.cacheHit()).isFalse();
    }

    @Test
    @DisplayName("should reuse cached entries while the master is unchanged")
    void shouldReuseCache() throws IOException {
        ExcessiveKeyCache cache = new ExcessiveKeyCache(tempDir.resolve("cache"), DigestMode.FULL);
        IndexPipeline pipeline = IndexPipeline.builder()
            .shards(List.of(MergeInput.of(shardA), MergeInput.of(shardB)))
            .masterPath(master)
            .filteredPath(filtered)
            .collection("AWP1")
            .threshold(5)
            .cache(cache)
            .build();

        PipelineReport first = pipeline.run();
        PipelineReport second = pipeline.run();

        assertThat(first.cacheHit()).isFalse();
        assertThat(first.detection()).isNotNull();
        assertThat(second.cacheHit()).isTrue();
        assertThat(second.detection()).isNull();
        assertThat(second.filter()).isEqualTo(first.filter());
        assertThat(cache.entriesPath("AWP1")).exists();
    }

    @Test
    @DisplayName("should cache entries for a collection name with a space")
    void shouldCacheAnyCollectionName() throws IOException {
        ExcessiveKeyCache cache = new ExcessiveKeyCache(tempDir.resolve("cache"));

        PipelineReport report = IndexPipeline.builder()
            .shards(List.of(MergeInput.of(shardA), MergeInput.of(shardB)))
            .masterPath(master)
            .filteredPath(filtered)
            .collection("RAQ 2018")
            .threshold(5)
            .cache(cache)
            .build()
            .run();

        assertThat(report.excessiveKeys()).isEqualTo(1);
        assertThat(lines(filtered)).hasSize(3);
        assertThat(Files.readString(tempDir.resolve("cache/RAQ%202018.urls"))).isEqualTo("com,example)/calendar 6\n");
    }

    @Test
    @DisplayName("should reject an unusable cache key before merging")
    void shouldRejectCacheKeyBeforeMerging() {
        assertThatThrownBy(() -> IndexPipeline.builder()
            .shards(List.of(MergeInput.of(shardA), MergeInput.of(shardB)))
            .masterPath(master)
            .filteredPath(filtered)
            .collection("")
            .cache(new ExcessiveKeyCache(tempDir.resolve("cache")))
            .build())
            .isInstanceOf(IllegalArgumentException.class);

        assertThat(master).doesNotExist();
        assertThat(tempDir.resolve("cache")).doesNotExist();
    }

    @Test
    @DisplayName("should produce the same master with grouped merging")
    void shouldMergeInGroups() throws IOException {
        List<MergeInput> shards = new ArrayList<>();
        for (int s = 0; s < 6; s++) {
            Path shard = tempDir.resolve("s" + s + ".cdxj");
            Files.writeString(shard, "k 1 {\"s\": " + s + "}\nz " + s + " {}\n", StandardCharsets.UTF_8);
            shards.add(MergeInput.of(shard));
        }
        Path grouped = tempDir.resolve("grouped.cdxj");

        IndexPipeline.builder().shards(shards).masterPath(master).build().run();
        IndexPipeline.builder().shards(shards).masterPath(grouped).threads(3).tempDir(tempDir.resolve("work")).build().run();

        assertThat(Files.readAllBytes(grouped)).isEqualTo(Files.readAllBytes(master));
    }

    @Test
    @DisplayName("should leave no master behind when the merge fails")
    void shouldNotPublishFailedMaster() throws IOException {
        Path unsorted = tempDir.resolve("unsorted.cdxj");
        Files.writeString(unsorted, "b 1 {}\na 1 {}\n", StandardCharsets.UTF_8);

        assertThatThrownBy(() -> IndexPipeline.builder()
            .shards(List.of(MergeInput.of(shardA), MergeInput.of(unsorted)))
            .masterPath(master)
            .build()
            .run())
            .isInstanceOf(UnsortedInputException.class);

        assertThat(master).doesNotExist();
        try (Stream<Path> left = Files.list(master.getParent())) {
            assertThat(left).isEmpty();
        }
    }

    @Test
    @DisplayName("should require shards and a master path")
    void shouldValidateBuilder() {
        assertThatThrownBy(() -> IndexPipeline.builder().masterPath(master).build())
            .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> IndexPipeline.builder().shard(MergeInput.of(shardA)).build())
            .isInstanceOf(NullPointerException.class);
    }
}
