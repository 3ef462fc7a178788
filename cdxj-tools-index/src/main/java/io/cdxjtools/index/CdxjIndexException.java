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

package io.cdxjtools.index;

/// Base type for failures raised while merging, scanning or filtering CDXJ streams.
///
/// A failure always names the source it was observed in. Where the failing line is
/// known, the 1-based line number and the byte offset of the start of that line are
/// carried as well, so the message can point a user at the exact spot in a file that
/// may be several terabytes long.
public class CdxjIndexException extends RuntimeException {

    /// Marker for a line number or byte offset that is not known
    public static final long UNKNOWN = -1L;

    private final String source;
    private final long lineNumber;
    private final long byteOffset;

    public CdxjIndexException(String message, String source, long lineNumber, long byteOffset) {
        super(locate(message, source, lineNumber, byteOffset));
        this.source = source;
        this.lineNumber = lineNumber;
        this.byteOffset = byteOffset;
    }

    public CdxjIndexException(String message, Throwable cause, String source, long lineNumber, long byteOffset) {
        super(locate(message, source, lineNumber, byteOffset), cause);
        this.source = source;
        this.lineNumber = lineNumber;
        this.byteOffset = byteOffset;
    }

    /// @return the name of the file or stream the failure was observed in
    public String getSource() {
        return source;
    }

    /// @return the 1-based line number, or {@link #UNKNOWN}
    public long getLineNumber() {
        return lineNumber;
    }

    /// @return the byte offset of the start of the failing line, or {@link #UNKNOWN}
    public long getByteOffset() {
        return byteOffset;
    }

    private static String locate(String message, String source, long lineNumber, long byteOffset) {
        StringBuilder sb = new StringBuilder(message).append(" [").append(source);
        if (lineNumber != UNKNOWN) {
            sb.append(", line ").append(lineNumber);
        }
        if (byteOffset != UNKNOWN) {
            sb.append(", byte ").append(byteOffset);
        }
        return sb.append(']').toString();
    }
}
