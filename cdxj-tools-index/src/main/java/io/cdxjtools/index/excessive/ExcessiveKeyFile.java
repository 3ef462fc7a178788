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
import io.cdxjtools.index.record.CdxjLineReader;

import java.io.BufferedOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/// Reads and writes excessive-key entries in their line form, `<surt> <count>`.
///
/// Blank lines and lines starting with `#` are ignored on read. Entries must be in
/// strictly ascending surt order, since the filter relies on it to make its single
/// forward pass; anything else is rejected when the file is read.
public final class ExcessiveKeyFile {

    private ExcessiveKeyFile() {
    }

    public static List<ExcessiveKey> read(Path path) throws IOException {
        try (InputStream in = Files.newInputStream(path)) {
            return read(path.toString(), in);
        }
    }

    /// @param sourceName name used in diagnostics
    /// @param in the entries stream; not closed
    /// @return the entries in file order
    /// @throws IOException if the stream fails
    public static List<ExcessiveKey> read(String sourceName, InputStream in) throws IOException {
        CdxjLineReader lines = new CdxjLineReader(sourceName, in, 8192);
        List<ExcessiveKey> entries = new ArrayList<>();
        ExcessiveKey previous = null;
        byte[] line;
        while ((line = lines.readLine()) != null) {
            if (line.length == 0 || line[0] == '#') {
                continue;
            }
            ExcessiveKey entry = parseLine(line, sourceName, lines.lineNumber(), lines.lineOffset());
            if (previous != null && entry.compareTo(previous) <= 0) {
                throw new UnsortedInputException(
                    "Entry '" + entry.surt() + "' does not sort after '" + previous.surt() + "'",
                    sourceName, lines.lineNumber(), lines.lineOffset());
            }
            entries.add(entry);
            previous = entry;
        }
        return entries;
    }

    static ExcessiveKey parseLine(byte[] line, String source, long lineNumber, long offset) {
        int i = 0;
        while (i < line.length && !isWhitespace(line[i])) {
            i++;
        }
        int surtEnd = i;
        while (i < line.length && isWhitespace(line[i])) {
            i++;
        }
        int countStart = i;
        int end = line.length;
        while (end > countStart && (isWhitespace(line[end - 1]) || line[end - 1] == '\r')) {
            end--;
        }
        if (surtEnd == 0 || countStart == end) {
            throw new MalformedRecordException("Expected '<surt> <count>'", source, lineNumber, offset);
        }
        String countText = new String(line, countStart, end - countStart, StandardCharsets.US_ASCII);
        long count;
        try {
            count = Long.parseLong(countText);
        } catch (NumberFormatException e) {
            throw new MalformedRecordException("Invalid count '" + countText + "'", source, lineNumber, offset);
        }
        if (count <= 0) {
            throw new MalformedRecordException("Count must be positive, was " + count, source, lineNumber, offset);
        }
        return new ExcessiveKey(Arrays.copyOf(line, surtEnd), count);
    }

    private static boolean isWhitespace(byte b) {
        return b == ' ' || b == '\t';
    }

    /// @param entries the entries to write, in order
    /// @param out the stream to write to; flushed, not closed
    /// @throws IOException if the stream fails
    public static void write(List<ExcessiveKey> entries, OutputStream out) throws IOException {
        OutputStream buffered = new BufferedOutputStream(out);
        for (ExcessiveKey entry : entries) {
            buffered.write(entry.rawSurt());
            buffered.write(' ');
            buffered.write(Long.toString(entry.count()).getBytes(StandardCharsets.US_ASCII));
            buffered.write('\n');
        }
        buffered.flush();
    }
}
