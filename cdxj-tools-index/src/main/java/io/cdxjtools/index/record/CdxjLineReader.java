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
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Arrays;

/// Forward-only, buffered line reader over a byte stream.
///
/// Lines are returned as raw bytes with the `\n` terminator removed. Nothing else is
/// stripped, so a `\r` before the terminator stays part of the line. The reader keeps
/// the scan state that the merge and the filter report on: the byte offset where the
/// current line starts, its 1-based line number, and whether it was terminated. The
/// last line of a stream may lack a terminator; {@link #lastLineTerminated()} tells
/// the caller so that a verbatim copy can reproduce the input byte for byte.
///
/// Memory use is one read buffer plus the longest line seen so far.
public class CdxjLineReader implements Closeable {

    /// Default size of the read buffer, in bytes
    public static final int DEFAULT_BUFFER_SIZE = 1 << 16;

    private final String sourceName;
    private final InputStream in;
    private final byte[] buffer;
    private int bufferPos;
    private int bufferLimit;
    private boolean endOfStream;

    private byte[] lineBuffer = new byte[512];
    private long nextOffset;
    private long lineOffset = -1;
    private long lineNumber;
    private boolean terminated;

    /// @param sourceName name used in diagnostics
    /// @param in the stream to read; it is closed with this reader
    /// @param bufferSize size of the read buffer in bytes
    public CdxjLineReader(String sourceName, InputStream in, int bufferSize) {
        if (bufferSize <= 0) {
            throw new IllegalArgumentException("Buffer size must be positive: " + bufferSize);
        }
        this.sourceName = sourceName;
        this.in = in;
        this.buffer = new byte[bufferSize];
    }

    public CdxjLineReader(String sourceName, InputStream in) {
        this(sourceName, in, DEFAULT_BUFFER_SIZE);
    }

    /// Open a reader on a file.
    /// @param path the file to read
    /// @param bufferSize size of the read buffer in bytes
    /// @return a new reader
    /// @throws IOException if the file cannot be opened
    public static CdxjLineReader open(Path path, int bufferSize) throws IOException {
        return new CdxjLineReader(path.toString(), Files.newInputStream(path), bufferSize);
    }

    /// Read the next line.
    /// @return the line bytes without terminator, or null at end of stream
    /// @throws IOException if the underlying stream fails
    public byte[] readLine() throws IOException {
        int length = 0;
        boolean sawBytes = false;
        while (true) {
            if (bufferPos >= bufferLimit && !fill()) {
                if (!sawBytes) {
                    return null;
                }
                terminated = false;
                break;
            }
            sawBytes = true;
            int newline = indexOfNewline();
            int end = newline >= 0 ? newline : bufferLimit;
            int chunk = end - bufferPos;
            ensureLineCapacity(length + chunk);
            System.arraycopy(buffer, bufferPos, lineBuffer, length, chunk);
            length += chunk;
            if (newline >= 0) {
                bufferPos = newline + 1;
                terminated = true;
                break;
            }
            bufferPos = bufferLimit;
        }
        lineOffset = nextOffset;
        nextOffset += length + (terminated ? 1 : 0);
        lineNumber++;
        return Arrays.copyOf(lineBuffer, length);
    }

    private int indexOfNewline() {
        for (int i = bufferPos; i < bufferLimit; i++) {
            if (buffer[i] == '\n') {
                return i;
            }
        }
        return -1;
    }

    private boolean fill() throws IOException {
        if (endOfStream) {
            return false;
        }
        int read;
        do {
            read = in.read(buffer, 0, buffer.length);
        } while (read == 0);
        if (read < 0) {
            endOfStream = true;
            return false;
        }
        bufferPos = 0;
        bufferLimit = read;
        return true;
    }

    private void ensureLineCapacity(int needed) {
        if (needed > lineBuffer.length) {
            lineBuffer = Arrays.copyOf(lineBuffer, Math.max(needed, lineBuffer.length * 2));
        }
    }

    /// @return the name of the source, for diagnostics
    public String sourceName() {
        return sourceName;
    }

    /// @return the byte offset where the most recently read line starts, or -1 before the first read
    public long lineOffset() {
        return lineOffset;
    }

    /// @return the 1-based number of the most recently read line, or 0 before the first read
    public long lineNumber() {
        return lineNumber;
    }

    /// @return the number of bytes consumed so far, terminators included
    public long bytesConsumed() {
        return nextOffset;
    }

    /// @return true if the most recently read line ended with `\n`
    public boolean lastLineTerminated() {
        return terminated;
    }

    @Override
    public void close() throws IOException {
        in.close();
    }
}
