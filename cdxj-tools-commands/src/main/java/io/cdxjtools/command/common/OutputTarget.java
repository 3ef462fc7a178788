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

package io.cdxjtools.command.common;

import io.cdxjtools.index.fileio.AtomicFileOutput;

import java.io.Closeable;
import java.io.IOException;
import java.io.OutputStream;

/// Where a command writes its result: an atomically published file, or standard output.
///
/// File output is only visible once {@link #commit()} is called; closing without a
/// commit discards it. Standard output is flushed on commit and never closed.
public final class OutputTarget implements Closeable {

    private final AtomicFileOutput file;
    private final OutputStream stdout;

    private OutputTarget(AtomicFileOutput file, OutputStream stdout) {
        this.file = file;
        this.stdout = stdout;
    }

    /// @param output the output specification
    /// @param stdout the stream used when the output is standard output
    /// @return an open target
    /// @throws IOException if the output file cannot be created
    public static OutputTarget open(OutputFileOption.OutputFile output, OutputStream stdout) throws IOException {
        if (output.isStdout()) {
            return new OutputTarget(null, stdout);
        }
        return new OutputTarget(AtomicFileOutput.create(output.path()), null);
    }

    public OutputStream stream() {
        return file != null ? file.stream() : stdout;
    }

    public void commit() throws IOException {
        if (file != null) {
            file.commit();
        } else {
            stdout.flush();
        }
    }

    @Override
    public void close() throws IOException {
        if (file != null) {
            file.close();
        }
    }
}
