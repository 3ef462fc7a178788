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

import io.cdxjtools.index.MalformedRecordException;
import io.cdxjtools.index.UnsortedInputException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.List;

import static org.assertj.core.api.Assertions.*;

@DisplayName("ExcessiveKeyFile")
class ExcessiveKeyFileTest {

    private static List<ExcessiveKey> read(String text) throws IOException {
        return ExcessiveKeyFile.read("entries", new ByteArrayInputStream(text.getBytes(StandardCharsets.UTF_8)));
    }

    @Test
    @DisplayName("should read entries, skipping blank and comment lines")
    void shouldRead() throws IOException {
        List<ExcessiveKey> entries = read("# generated\ncom,example)/ 1500\n\ncom,example)/cal 2001\r\n");

        assertThat(entries).containsExactly(ExcessiveKey.of("com,example)/", 1500), ExcessiveKey.of("com,example)/cal", 2001));
    }

    @Test
    @DisplayName("should write one '<surt> <count>' line per entry")
    void shouldWrite() throws IOException {
        ByteArrayOutputStream out = new ByteArrayOutputStream();

        ExcessiveKeyFile.write(List.of(ExcessiveKey.of("a", 1001), ExcessiveKey.of("b", 2)), out);

        assertThat(out.toString(StandardCharsets.UTF_8)).isEqualTo("a 1001\nb 2\n");
    }

    @ParameterizedTest(name = "[{index}] \"{0}\"")
    @ValueSource(strings = {"a\n", "a x\n", "a 0\n", "a -5\n", " 5\n"})
    @DisplayName("should reject malformed entries")
    void shouldRejectMalformed(String text) {
        assertThatThrownBy(() -> read(text)).isInstanceOf(MalformedRecordException.class);
    }

    @Test
    @DisplayName("should reject entries out of order or repeated")
    void shouldRejectUnsorted() {
        assertThatThrownBy(() -> read("b 5\na 5\n"))
            .isInstanceOfSatisfying(UnsortedInputException.class, e -> assertThat(e.getLineNumber()).isEqualTo(2));
        assertThatThrownBy(() -> read("a 5\na 6\n")).isInstanceOf(UnsortedInputException.class);
    }
}
