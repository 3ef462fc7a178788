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

import io.cdxjtools.index.CdxjIndexException;
import io.cdxjtools.index.MalformedRecordException;

import java.io.IOException;
import java.io.OutputStream;
import java.nio.charset.StandardCharsets;
import java.util.Arrays;

/// One CDXJ line, split into its `surt`, `timestamp` and `payload` fields.
///
/// The record keeps the raw line bytes and the boundaries of each field. Nothing is
/// decoded: the payload in particular is opaque JSON that must be written back out
/// exactly as it was read, so it is only ever exposed as a copy of the original bytes.
///
/// ```text
/// com,example)/page 20200101120000 {"url": "http://example.com/page", ...}
/// |--- surt ------| |-- timestamp -| |-- payload ---------------------------|
/// ```
///
/// Fields are separated by the first two whitespace runs, where whitespace is a space
/// or a tab. Everything after the second run belongs to the payload, including any
/// further whitespace.
public final class CdxjRecord {

    private final byte[] line;
    private final int surtEnd;
    private final int timestampStart;
    private final int timestampEnd;
    private final int payloadStart;

    private CdxjRecord(byte[] line, int surtEnd, int timestampStart, int timestampEnd, int payloadStart) {
        this.line = line;
        this.surtEnd = surtEnd;
        this.timestampStart = timestampStart;
        this.timestampEnd = timestampEnd;
        this.payloadStart = payloadStart;
    }

    /// Parse a line that was read from a named source.
    /// @param line the line bytes, without the line terminator; the array is retained, not copied
    /// @param source the source name, for diagnostics
    /// @param lineNumber the 1-based line number, for diagnostics
    /// @param byteOffset the byte offset of the line start, for diagnostics
    /// @return the parsed record
    /// @throws MalformedRecordException if the line has fewer than two whitespace boundaries
    public static CdxjRecord parse(byte[] line, String source, long lineNumber, long byteOffset) {
        int len = line.length;
        int i = 0;
        while (i < len && !isWhitespace(line[i])) {
            i++;
        }
        int surtEnd = i;
        if (surtEnd == 0) {
            throw new MalformedRecordException("Record has an empty surt field", source, lineNumber, byteOffset);
        }
        while (i < len && isWhitespace(line[i])) {
            i++;
        }
        int timestampStart = i;
        if (timestampStart == len) {
            throw new MalformedRecordException("Record has no timestamp field", source, lineNumber, byteOffset);
        }
        while (i < len && !isWhitespace(line[i])) {
            i++;
        }
        int timestampEnd = i;
        if (timestampEnd == len) {
            throw new MalformedRecordException("Record has no payload separator after the timestamp",
                source, lineNumber, byteOffset);
        }
        while (i < len && isWhitespace(line[i])) {
            i++;
        }
        return new CdxjRecord(line, surtEnd, timestampStart, timestampEnd, i);
    }

    /// Parse a single line given as text, mostly useful for tests and tooling.
    /// @param line the line, without terminator
    /// @return the parsed record
    public static CdxjRecord parse(String line) {
        return parse(line.getBytes(StandardCharsets.UTF_8), "<inline>",
            CdxjIndexException.UNKNOWN, CdxjIndexException.UNKNOWN);
    }

    static boolean isWhitespace(byte b) {
        return b == ' ' || b == '\t';
    }

    /// @return the surt field decoded as UTF-8
    public String surt() {
        return new String(line, 0, surtEnd, StandardCharsets.UTF_8);
    }

    /// @return a copy of the surt field bytes
    public byte[] surtBytes() {
        return Arrays.copyOf(line, surtEnd);
    }

    /// @return the timestamp field decoded as UTF-8
    public String timestamp() {
        return new String(line, timestampStart, timestampEnd - timestampStart, StandardCharsets.UTF_8);
    }

    /// @return a copy of the payload bytes, which may be empty
    public byte[] payloadBytes() {
        return Arrays.copyOfRange(line, payloadStart, line.length);
    }

    /// @return the payload decoded as UTF-8
    public String payload() {
        return new String(line, payloadStart, line.length - payloadStart, StandardCharsets.UTF_8);
    }

    /// @return the number of bytes in the line, terminator excluded
    public int length() {
        return line.length;
    }

    /// Compare this record's surt with a bare surt, by unsigned byte value.
    /// @param surt the surt bytes to compare with
    /// @return negative, zero or positive as this surt sorts before, equal to or after {@code surt}
    public int compareSurtTo(byte[] surt) {
        return Arrays.compareUnsigned(line, 0, surtEnd, surt, 0, surt.length);
    }

    /// @param surt the surt bytes to test
    /// @return true if this record belongs to the run of {@code surt}
    public boolean hasSurt(byte[] surt) {
        return Arrays.equals(line, 0, surtEnd, surt, 0, surt.length);
    }

    /// Write the line bytes followed by a single `\n`.
    /// @param out the stream to write to
    /// @throws IOException if the stream fails
    public void writeTo(OutputStream out) throws IOException {
        out.write(line);
        out.write('\n');
    }

    static int compareSurts(CdxjRecord a, CdxjRecord b) {
        return Arrays.compareUnsigned(a.line, 0, a.surtEnd, b.line, 0, b.surtEnd);
    }

    static int compareTimestamps(CdxjRecord a, CdxjRecord b) {
        return Arrays.compareUnsigned(
            a.line, a.timestampStart, a.timestampEnd,
            b.line, b.timestampStart, b.timestampEnd);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof CdxjRecord)) {
            return false;
        }
        return Arrays.equals(line, ((CdxjRecord) o).line);
    }

    @Override
    public int hashCode() {
        return Arrays.hashCode(line);
    }

    @Override
    public String toString() {
        return new String(line, StandardCharsets.UTF_8);
    }
}
