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

import java.io.IOException;
import java.io.OutputStream;
import java.util.List;

/// Merges sorted inputs into one sorted output stream.
///
/// Every implementation writes each input record exactly once, in non-decreasing key
/// order, with equal keys ordered by ascending input index and then by their order
/// within the input. The output stream is flushed but not closed.
public interface ShardMerger {

    /// @param inputs the sorted inputs, in tie-break order; at most one may be live
    /// @param out the stream to write the merged records to
    /// @return what was written
    /// @throws IOException if the output fails, or an input fails under an aborting policy
    MergeStats merge(List<MergeInput> inputs, OutputStream out) throws IOException;
}
