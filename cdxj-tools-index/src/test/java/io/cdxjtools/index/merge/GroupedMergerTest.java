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

import io.cdxjtools.index.UnsortedInputException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.stream.Stream;

import static org.assertj.core.api.Assertions.*;

@DisplayName("GroupedMerger")
class GroupedMergerTest {

    @TempDir
    Path tempDir;

    private List<MergeInput> shards(int count, int recordsPerShard) throws IOException {
        Path shardDir = Files.createDirectories(tempDir.resolve("shards"));
        List<MergeInput> inputs = new ArrayList<>();
        for (int s = 0; s < count; s++) {
            StringBuilder content = new StringBuilder();
            for (int i = 0; i < recordsPerShard; i++) {
                // every shard repeats the same keys, so ties are everywhere
                content.append(String.format("com,example)/%03d 2020 {\"shard\": %d, \"i\": %d}%n", i / 3, s, i));
            }
            Path path = shardDir.resolve(String.format("shard-%02d.cdxj", s));
            Files.writeString(path, content.toString().replace("\r\n", "\n"), StandardCharsets.UTF_8);
            inputs.add(MergeInput.of(path));
        }
        return inputs;
    }

    @Test
    @DisplayName("should produce exactly the output of a single merge")
    void shouldMatchSingleMerge() throws IOException {
        List<MergeInput> inputs = shards(9, 60);
        Path work = Files.createDirectories(tempDir.resolve("work"));

        ByteArrayOutputStream single = new ByteArrayOutputStream();
        new KWayMerger().merge(inputs, single);
        ByteArrayOutputStream grouped = new ByteArrayOutputStream();
        MergeStats stats = new GroupedMerger(MergeSettings.defaults(), 4, work).merge(inputs, grouped);

        assertThat(grouped.toByteArray()).isEqualTo(single.toByteArray());
        assertThat(stats.totalRecords()).isEqualTo(9 * 60);
        assertThat(stats.inputNames()).hasSize(9);
        for (int i = 0; i < 9; i++) {
            assertThat(stats.recordsFrom(i)).isEqualTo(60);
        }
    }

    @Test
    @DisplayName("should leave no group files behind")
    void shouldCleanUp() throws IOException {
        List<MergeInput> inputs = shards(6, 10);
        Path work = Files.createDirectories(tempDir.resolve("work"));

        new GroupedMerger(MergeSettings.defaults(), 3, work).merge(inputs, new ByteArrayOutputStream());

        try (Stream<Path> left = Files.list(work)) {
            assertThat(left).isEmpty();
        }
    }

    @Test
    @DisplayName("should clean up and rethrow when a group fails")
    void shouldPropagateGroupFailure() throws IOException {
        List<MergeInput> inputs = new ArrayList<>(shards(4, 10));
        Path unsorted = tempDir.resolve("unsorted.cdxj");
        Files.writeString(unsorted, "b 1 {}\na 1 {}\n", StandardCharsets.UTF_8);
        inputs.add(MergeInput.of(unsorted));
        Path work = Files.createDirectories(tempDir.resolve("work"));

        assertThatThrownBy(() -> new GroupedMerger(MergeSettings.defaults(), 2, work)
            .merge(inputs, new ByteArrayOutputStream()))
            .isInstanceOf(UnsortedInputException.class);

        try (Stream<Path> left = Files.list(work)) {
            assertThat(left).isEmpty();
        }
    }

    @Test
    @DisplayName("should merge directly when there are too few inputs to group")
    void shouldFallBackForFewInputs() throws IOException {
        List<MergeInput> inputs = shards(3, 5);
        ByteArrayOutputStream out = new ByteArrayOutputStream();

        MergeStats stats = new GroupedMerger(MergeSettings.defaults(), 8, tempDir.resolve("unused")).merge(inputs, out);

        assertThat(stats.totalRecords()).isEqualTo(15);
        assertThat(tempDir.resolve("unused")).doesNotExist();
    }

    @Test
    @DisplayName("should partition into contiguous groups of near-equal size")
    void shouldPartitionContiguously() {
        List<List<Integer>> groups = GroupedMerger.partition(List.of(0, 1, 2, 3, 4, 5, 6), 3);

        assertThat(groups).containsExactly(List.of(0, 1, 2), List.of(3, 4), List.of(5, 6));
    }

    @Test
    @DisplayName("should reject a thread count below one")
    void shouldRejectZeroThreads() {
        assertThatThrownBy(() -> new GroupedMerger(MergeSettings.defaults(), 0, tempDir))
            .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    @DisplayName("should reject two live inputs even when they would land in different groups")
    void shouldRejectLiveInputsAcrossGroups() throws IOException {
        List<MergeInput> inputs = new ArrayList<>(shards(4, 2));
        ByteArrayInputStream stdin = new ByteArrayInputStream("a 1 {}\n".getBytes(StandardCharsets.UTF_8));
        inputs.set(0, MergeInput.live("<stdin>", stdin));
        inputs.set(3, MergeInput.live("<stdin>", stdin));
        Path work = tempDir.resolve("work");

        assertThatThrownBy(() -> new GroupedMerger(MergeSettings.defaults(), 2, work)
            .merge(inputs, new ByteArrayOutputStream()))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("live input");
        assertThat(work).doesNotExist();
    }
}
