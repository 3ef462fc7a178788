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

import java.io.Closeable;
import java.io.IOException;

/// Reads parsed {@link CdxjRecord}s from a {@link CdxjLineReader}.
///
/// Malformed lines surface as {@link io.cdxjtools.index.MalformedRecordException}
/// located at the offending line.
public class CdxjRecordReader implements Closeable {

    private final CdxjLineReader lines;

    public CdxjRecordReader(CdxjLineReader lines) {
        this.lines = lines;
    }

    /// @return the next record, or null at end of stream
    /// @throws IOException if the underlying stream fails
    public CdxjRecord next() throws IOException {
        byte[] line = lines.readLine();
        if (line == null) {
            return null;
        }
        return CdxjRecord.parse(line, lines.sourceName(), lines.lineNumber(), lines.lineOffset());
    }

    public String sourceName() {
        return lines.sourceName();
    }

    public long lineNumber() {
        return lines.lineNumber();
    }

    public long lineOffset() {
        return lines.lineOffset();
    }

    /// @return the byte offset just past the last line read
    public long bytesConsumed() {
        return lines.bytesConsumed();
    }

    @Override
    public void close() throws IOException {
        lines.close();
    }
}
