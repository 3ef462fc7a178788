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

import io.cdxjtools.index.record.CdxjLineReader;
import io.cdxjtools.index.record.CdxjRecord;
import io.cdxjtools.index.record.CdxjRecordReader;

import java.io.Closeable;
import java.io.IOException;

/// Per-input merge state: the reader, the one buffered record, and an exhausted flag.
///
/// A cursor is owned by a single merge and closes its input as soon as the input is
/// exhausted, so at most one record per open input is ever held in memory.
final class MergeCursor implements Closeable {

    private final int index;
    private final MergeInput input;
    private final CdxjRecordReader reader;
    private CdxjRecord current;
    private CdxjRecord previous;
    private boolean exhausted;

    private MergeCursor(int index, MergeInput input, CdxjRecordReader reader) {
        this.index = index;
        this.input = input;
        this.reader = reader;
    }

    static MergeCursor open(int index, MergeInput input, int bufferSize) throws IOException {
        CdxjLineReader lines = new CdxjLineReader(input.name(), input.open(), bufferSize);
        return new MergeCursor(index, input, new CdxjRecordReader(lines));
    }

    /// Move to the next record, closing the input when there is none.
    /// @throws IOException if the input fails
    void advance() throws IOException {
        previous = current;
        current = reader.next();
        if (current == null) {
            exhausted = true;
            reader.close();
        }
    }

    int index() {
        return index;
    }

    MergeInput input() {
        return input;
    }

    CdxjRecord current() {
        return current;
    }

    /// @return the record that was current before the last advance, or null
    CdxjRecord previous() {
        return previous;
    }

    boolean isExhausted() {
        return exhausted;
    }

    long lineNumber() {
        return reader.lineNumber();
    }

    long lineOffset() {
        return reader.lineOffset();
    }

    long bytesConsumed() {
        return reader.bytesConsumed();
    }

    @Override
    public void close() throws IOException {
        exhausted = true;
        current = null;
        reader.close();
    }
}
