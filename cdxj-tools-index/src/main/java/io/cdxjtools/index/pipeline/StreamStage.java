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

package io.cdxjtools.index.pipeline;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;

/// A pipeline stage that transforms one sorted CDXJ stream into another.
///
/// A stage reads its input to the end and writes its complete output; it flushes but
/// does not close the output. Whether the output is published is decided by the
/// caller, so a failing stage never leaves a partial artifact behind.
///
/// @param <R> the report a run of the stage produces
@FunctionalInterface
public interface StreamStage<R> {

    /// @param sourceName name of the input, for diagnostics
    /// @param in the input stream
    /// @param out the output stream
    /// @return the stage report
    /// @throws IOException if either stream fails
    R run(String sourceName, InputStream in, OutputStream out) throws IOException;
}
