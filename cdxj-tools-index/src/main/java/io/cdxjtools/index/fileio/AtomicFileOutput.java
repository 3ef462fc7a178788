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

package io.cdxjtools.index.fileio;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.BufferedOutputStream;
import java.io.Closeable;
import java.io.IOException;
import java.io.OutputStream;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.UUID;

/// Output file which only becomes visible under its final name once it is complete.
///
/// Bytes go to a hidden temporary sibling of the target. {@link #commit()} closes the
/// stream and renames the temporary file over the target in one atomic step.
/// Closing without a commit, for example when a stage fails or is cancelled, deletes
/// the temporary file, and any existing target is left untouched.
///
/// ```java
/// try (AtomicFileOutput output = AtomicFileOutput.create(target)) {
///     merger.merge(inputs, output.stream());
///     output.commit();
/// }
/// ```
public final class AtomicFileOutput implements Closeable {
    private static final Logger logger = LogManager.getLogger(AtomicFileOutput.class);

    private static final int BUFFER_SIZE = 1 << 16;

    private final Path target;
    private final Path tempPath;
    private final OutputStream stream;
    private boolean committed;
    private boolean closed;

    private AtomicFileOutput(Path target, Path tempPath, OutputStream stream) {
        this.target = target;
        this.tempPath = tempPath;
        this.stream = stream;
    }

    /// @param target the final path of the output
    /// @return an open output whose bytes are not yet visible at {@code target}
    /// @throws IOException if the temporary file cannot be created
    public static AtomicFileOutput create(Path target) throws IOException {
        Path absolute = target.toAbsolutePath().normalize();
        Path parent = absolute.getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        Path temp = absolute.resolveSibling(
            "." + absolute.getFileName() + "." + UUID.randomUUID().toString().substring(0, 8) + ".tmp");
        OutputStream out = new BufferedOutputStream(Files.newOutputStream(temp), BUFFER_SIZE);
        return new AtomicFileOutput(absolute, temp, out);
    }

    /// @return the stream to write to; do not close it directly
    public OutputStream stream() {
        return stream;
    }

    public Path target() {
        return target;
    }

    public Path tempPath() {
        return tempPath;
    }

    public boolean isCommitted() {
        return committed;
    }

    /// Publish the output under its final name.
    /// @throws IOException if the stream cannot be flushed or the rename fails
    public void commit() throws IOException {
        if (committed) {
            return;
        }
        if (closed) {
            throw new IllegalStateException("Output was discarded before commit: " + target);
        }
        stream.close();
        closed = true;
        try {
            Files.move(tempPath, target, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
        } catch (AtomicMoveNotSupportedException e) {
            logger.warn("Atomic rename not supported for {}, falling back to a plain replace", target);
            Files.move(tempPath, target, StandardCopyOption.REPLACE_EXISTING);
        }
        committed = true;
        logger.debug("Published {}", target);
    }

    /// Discard the output unless it was committed.
    @Override
    public void close() throws IOException {
        if (committed) {
            return;
        }
        try {
            if (!closed) {
                closed = true;
                stream.close();
            }
        } finally {
            if (Files.deleteIfExists(tempPath)) {
                logger.debug("Discarded partial output for {}", target);
            }
        }
    }
}
