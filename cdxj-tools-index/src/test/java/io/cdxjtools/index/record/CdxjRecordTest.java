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

package io.cdxjtools.index.record;

import io.cdxjtools.index.MalformedRecordException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.nio.charset.StandardCharsets;

import static org.assertj.core.api.Assertions.*;

@DisplayName("CdxjRecord")
class CdxjRecordTest {

    @Nested
    @DisplayName("parsing")
    class Parsing {

        @Test
        @DisplayName("should split surt, timestamp and payload")
        void shouldSplitFields() {
            CdxjRecord record = CdxjRecord.parse("com,example)/page 20200101120000 {\"url\": \"http://example.com/page\"}");

            assertThat(record.surt()).isEqualTo("com,example)/page");
            assertThat(record.timestamp()).isEqualTo("20200101120000");
            assertThat(record.payload()).isEqualTo("{\"url\": \"http://example.com/page\"}");
        }

        @Test
        @DisplayName("should treat tabs and whitespace runs as one boundary")
        void shouldAcceptWhitespaceRuns() {
            CdxjRecord record = CdxjRecord.parse("a\t \t1   {}");

            assertThat(record.surt()).isEqualTo("a");
            assertThat(record.timestamp()).isEqualTo("1");
            assertThat(record.payload()).isEqualTo("{}");
        }

        @Test
        @DisplayName("should keep whitespace inside the payload")
        void shouldKeepPayloadWhitespace() {
            CdxjRecord record = CdxjRecord.parse("a 1 {\"k\": \"v w\"}  ");

            assertThat(record.payload()).isEqualTo("{\"k\": \"v w\"}  ");
        }

        @Test
        @DisplayName("should allow an empty payload after the second separator")
        void shouldAllowEmptyPayload() {
            CdxjRecord record = CdxjRecord.parse("a 1 ");

            assertThat(record.payloadBytes()).isEmpty();
        }

        @ParameterizedTest(name = "[{index}] \"{0}\"")
        @ValueSource(strings = {"", "a", "a 1", " a 1 {}", "a   "})
        @DisplayName("should reject lines with fewer than two boundaries")
        void shouldRejectMalformed(String line) {
            assertThatThrownBy(() -> CdxjRecord.parse(line))
                .isInstanceOf(MalformedRecordException.class);
        }

        @Test
        @DisplayName("should report source, line and offset of a malformed line")
        void shouldLocateMalformedLine() {
            byte[] bytes = "nonsense".getBytes(StandardCharsets.UTF_8);

            assertThatThrownBy(() -> CdxjRecord.parse(bytes, "shard-3.cdxj", 7, 120))
                .isInstanceOfSatisfying(MalformedRecordException.class, e -> {
                    assertThat(e.getSource()).isEqualTo("shard-3.cdxj");
                    assertThat(e.getLineNumber()).isEqualTo(7);
                    assertThat(e.getByteOffset()).isEqualTo(120);
                    assertThat(e.getMessage()).contains("shard-3.cdxj").contains("line 7").contains("byte 120");
                });
        }
    }

    @Nested
    @DisplayName("bytes")
    class Bytes {

        @Test
        @DisplayName("should write the line back exactly, with one terminator")
        void shouldWriteVerbatim() throws IOException {
            String line = "org,archive)/ 19961231235959 {\"mime\": \"text/html\", \"note\": \"été\"}";
            ByteArrayOutputStream out = new ByteArrayOutputStream();

            CdxjRecord.parse(line).writeTo(out);

            assertThat(out.toString(StandardCharsets.UTF_8)).isEqualTo(line + "\n");
        }

        @Test
        @DisplayName("should compare surts by unsigned byte value")
        void shouldCompareUnsigned() {
            CdxjRecord ascii = CdxjRecord.parse("z 1 {}");
            byte[] accented = "é".getBytes(StandardCharsets.UTF_8);

            assertThat(ascii.compareSurtTo(accented)).isNegative();
            assertThat(ascii.hasSurt("z".getBytes(StandardCharsets.UTF_8))).isTrue();
            assertThat(ascii.hasSurt("z,".getBytes(StandardCharsets.UTF_8))).isFalse();
        }

        @Test
        @DisplayName("should be equal when the lines are equal")
        void shouldCompareEquality() {
            assertThat(CdxjRecord.parse("a 1 {}")).isEqualTo(CdxjRecord.parse("a 1 {}"))
                .hasSameHashCodeAs(CdxjRecord.parse("a 1 {}"));
            assertThat(CdxjRecord.parse("a 1 {}")).isNotEqualTo(CdxjRecord.parse("a 1  {}"));
        }
    }
}
