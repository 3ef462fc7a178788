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

package io.cdxjtools.index.excessive;

import com.google.gson.JsonObject;
import com.google.gson.JsonParser;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.nio.file.attribute.FileTime;
import java.util.Arrays;
import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.*;

@DisplayName("ExcessiveKeyCache")
class ExcessiveKeyCacheTest {

    private static final List<ExcessiveKey> ENTRIES = List.of(ExcessiveKey.of("b", 1001), ExcessiveKey.of("d", 2000));

    @TempDir
    Path tempDir;

    private Path master;
    private Path cacheDir;

    @BeforeEach
    void setUp() throws IOException {
        master = tempDir.resolve("master.cdxj");
        Files.writeString(master, "a 1 {}\nb 1 {}\nc 1 {}\n", StandardCharsets.UTF_8);
        Files.setLastModifiedTime(master, FileTime.fromMillis(1_600_000_000_000L));
        cacheDir = tempDir.resolve("cache");
    }

    @Nested
    @DisplayName("freshness token")
    class Token {

        @Test
        @DisplayName("should describe size, threshold and a sha256 digest")
        void shouldDescribeSnapshot() throws IOException {
            FreshnessToken token = FreshnessToken.compute(master, 1000, DigestMode.SAMPLED);

            assertThat(token.size()).isEqualTo(21);
            assertThat(token.threshold()).isEqualTo(1000);
            assertThat(token.lastModifiedMillis()).isEqualTo(1_600_000_000_000L);
            assertThat(token.digest()).startsWith("sha256:").hasSize(7 + 64);
            assertThat(token.version()).isEqualTo(FreshnessToken.CURRENT_VERSION);
        }

        @Test
        @DisplayName("should digest small files the same way in both modes")
        void shouldAgreeOnSmallFiles() throws IOException {
            FreshnessToken sampled = FreshnessToken.compute(master, 1000, DigestMode.SAMPLED);
            FreshnessToken full = FreshnessToken.compute(master, 1000, DigestMode.FULL);

            assertThat(sampled.matches(full)).isFalse();
            assertThat(full.matches(FreshnessToken.compute(master, 1000, DigestMode.FULL))).isTrue();
        }

        @Test
        @DisplayName("should see a change in the middle of a large file only with a full digest")
        void shouldSampleHeadAndTail() throws IOException {
            Path big = tempDir.resolve("big.cdxj");
            byte[] content = new byte[3 * FreshnessToken.SAMPLE_BYTES];
            Arrays.fill(content, (byte) 'x');
            Files.write(big, content);
            FileTime mtime = FileTime.fromMillis(1_600_000_000_000L);
            Files.setLastModifiedTime(big, mtime);
            FreshnessToken sampledBefore = FreshnessToken.compute(big, 5, DigestMode.SAMPLED);
            FreshnessToken fullBefore = FreshnessToken.compute(big, 5, DigestMode.FULL);

            content[content.length / 2] = 'y';
            Files.write(big, content);
            Files.setLastModifiedTime(big, mtime);

            assertThat(FreshnessToken.compute(big, 5, DigestMode.SAMPLED).matches(sampledBefore)).isTrue();
            assertThat(FreshnessToken.compute(big, 5, DigestMode.FULL).matches(fullBefore)).isFalse();
        }
    }

    @Nested
    @DisplayName("lookup")
    class Lookup {

        @Test
        @DisplayName("should miss when nothing was stored")
        void shouldMissWhenEmpty() throws IOException {
            ExcessiveKeyCache cache = new ExcessiveKeyCache(cacheDir);

            assertThat(cache.lookup("awp1", cache.tokenFor(master, 1000))).isEmpty();
        }

        @Test
        @DisplayName("should hit for an unchanged master and threshold")
        void shouldHitWhenFresh() throws IOException {
            ExcessiveKeyCache cache = new ExcessiveKeyCache(cacheDir);
            cache.store("awp1", cache.tokenFor(master, 1000), ENTRIES);

            Optional<List<ExcessiveKey>> cached = cache.lookup("awp1", cache.tokenFor(master, 1000));

            assertThat(cached).contains(ENTRIES);
            assertThat(Files.readString(cache.entriesPath("awp1"))).isEqualTo("b 1001\nd 2000\n");
        }

        @Test
        @DisplayName("should write the token as JSON")
        void shouldWriteJsonToken() throws IOException {
            ExcessiveKeyCache cache = new ExcessiveKeyCache(cacheDir);
            cache.store("awp1", cache.tokenFor(master, 1000), ENTRIES);

            JsonObject json = JsonParser.parseString(Files.readString(cache.tokenPath("awp1"))).getAsJsonObject();

            assertThat(json.get("size").getAsLong()).isEqualTo(21);
            assertThat(json.get("threshold").getAsLong()).isEqualTo(1000);
            assertThat(json.get("digest_mode").getAsString()).isEqualTo("SAMPLED");
            assertThat(json.get("digest").getAsString()).startsWith("sha256:");
        }

        @Test
        @DisplayName("should miss after the master changes")
        void shouldMissAfterModification() throws IOException {
            ExcessiveKeyCache cache = new ExcessiveKeyCache(cacheDir);
            cache.store("awp1", cache.tokenFor(master, 1000), ENTRIES);

            Files.writeString(master, "d 1 {}\n", StandardCharsets.UTF_8, StandardOpenOption.APPEND);

            assertThat(cache.lookup("awp1", cache.tokenFor(master, 1000))).isEmpty();
        }

        @Test
        @DisplayName("should miss for another threshold")
        void shouldMissForOtherThreshold() throws IOException {
            ExcessiveKeyCache cache = new ExcessiveKeyCache(cacheDir);
            cache.store("awp1", cache.tokenFor(master, 1000), ENTRIES);

            assertThat(cache.lookup("awp1", cache.tokenFor(master, 500))).isEmpty();
        }

        @Test
        @DisplayName("should miss on a touched master with a sampled digest, but hit with a full one")
        void shouldTreatModificationTimeByMode() throws IOException {
            ExcessiveKeyCache sampled = new ExcessiveKeyCache(cacheDir.resolve("sampled"), DigestMode.SAMPLED);
            ExcessiveKeyCache full = new ExcessiveKeyCache(cacheDir.resolve("full"), DigestMode.FULL);
            sampled.store("awp1", sampled.tokenFor(master, 1000), ENTRIES);
            full.store("awp1", full.tokenFor(master, 1000), ENTRIES);

            Files.setLastModifiedTime(master, FileTime.fromMillis(1_700_000_000_000L));

            assertThat(sampled.lookup("awp1", sampled.tokenFor(master, 1000))).isEmpty();
            assertThat(full.lookup("awp1", full.tokenFor(master, 1000))).contains(ENTRIES);
        }

        @Test
        @DisplayName("should treat an unreadable token as a miss")
        void shouldMissOnCorruptToken() throws IOException {
            ExcessiveKeyCache cache = new ExcessiveKeyCache(cacheDir);
            cache.store("awp1", cache.tokenFor(master, 1000), ENTRIES);
            Files.writeString(cache.tokenPath("awp1"), "{ not json", StandardCharsets.UTF_8);

            assertThat(cache.lookup("awp1", cache.tokenFor(master, 1000))).isEmpty();
        }

        @Test
        @DisplayName("should treat entries without a token as a miss")
        void shouldMissWithoutToken() throws IOException {
            ExcessiveKeyCache cache = new ExcessiveKeyCache(cacheDir);
            cache.store("awp1", cache.tokenFor(master, 1000), ENTRIES);
            Files.delete(cache.tokenPath("awp1"));

            assertThat(cache.lookup("awp1", cache.tokenFor(master, 1000))).isEmpty();
        }

        @Test
        @DisplayName("should store collection names with spaces and slashes inside the cache directory")
        void shouldEncodeCollectionNames() throws IOException {
            ExcessiveKeyCache cache = new ExcessiveKeyCache(cacheDir);
            cache.store("RAQ 2018", cache.tokenFor(master, 1000), ENTRIES);

            assertThat(cache.entriesPath("RAQ 2018")).isEqualTo(cacheDir.resolve("RAQ%202018.urls"));
            assertThat(cache.lookup("RAQ 2018", cache.tokenFor(master, 1000))).contains(ENTRIES);
            assertThat(cache.entriesPath("../escape").getParent()).isEqualTo(cacheDir);
            assertThat(cache.tokenPath(".hidden").getFileName().toString()).isEqualTo("%2Ehidden.urls.json");
        }

        @Test
        @DisplayName("should keep distinct collection names in distinct files")
        void shouldNotConfuseEncodedNames() {
            assertThat(ExcessiveKeyCache.fileName("awp1.v2")).isEqualTo("awp1.v2");
            assertThat(ExcessiveKeyCache.fileName("a b")).isNotEqualTo(ExcessiveKeyCache.fileName("a%20b"));
            assertThat(ExcessiveKeyCache.fileName("a%20b")).isEqualTo("a%2520b");
            assertThat(ExcessiveKeyCache.fileName("größe")).isEqualTo("gr%C3%B6%C3%9Fe");
        }

        @Test
        @DisplayName("should reject an empty collection name")
        void shouldRejectEmptyName() {
            ExcessiveKeyCache cache = new ExcessiveKeyCache(cacheDir);

            assertThatThrownBy(() -> cache.tokenPath("")).isInstanceOf(IllegalArgumentException.class);
            assertThatThrownBy(() -> cache.entriesPath(null)).isInstanceOf(IllegalArgumentException.class);
        }
    }
}
