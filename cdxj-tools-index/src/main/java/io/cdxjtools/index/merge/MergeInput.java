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

import java.io.FilterInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Objects;

/// One sorted input to a merge: a shard file, or a live stream such as standard input.
///
/// A live input is never closed by the merge, since the stream belongs to the caller.
public final class MergeInput {

    /// Input specification which selects the live standard input stream
    public static final String LIVE_MARKER = "-";

    private final String name;
    private final Path path;
    private final InputStream live;

    private MergeInput(String name, Path path, InputStream live) {
        this.name = name;
        this.path = path;
        this.live = live;
    }

    /// @param path a sorted shard file
    /// @return an input which reads the file
    public static MergeInput of(Path path) {
        Objects.requireNonNull(path, "path cannot be null");
        return new MergeInput(path.toString(), path, null);
    }

    /// @param name name used in diagnostics
    /// @param stream a live sorted stream
    /// @return an input which reads the stream without closing it
    public static MergeInput live(String name, InputStream stream) {
        Objects.requireNonNull(stream, "stream cannot be null");
        return new MergeInput(name, null, stream);
    }

    /// Interpret a command-line input argument.
    /// @param argument a file path, or {@link #LIVE_MARKER}
    /// @param stdin the stream to use for the live marker
    /// @return the input
    public static MergeInput parse(String argument, InputStream stdin) {
        if (LIVE_MARKER.equals(argument)) {
            return live("<stdin>", stdin);
        }
        return of(Path.of(argument));
    }

    public String name() {
        return name;
    }

    /// @return the shard path, or null for a live input
    public Path path() {
        return path;
    }

    public boolean isLive() {
        return path == null;
    }

    InputStream open() throws IOException {
        if (path != null) {
            return Files.newInputStream(path);
        }
        return new FilterInputStream(live) {
            @Override
            public void close() {
                // owned by the caller
            }
        };
    }

    @Override
    public String toString() {
        return name;
    }
}
