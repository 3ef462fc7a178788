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

import io.cdxjtools.index.excessive.DetectionStats;
import io.cdxjtools.index.excessive.FilterStats;
import io.cdxjtools.index.merge.MergeStats;

/// What each stage of an {@link IndexPipeline} run did. Stages that did not run are null.
///
/// @param merge merge counts
/// @param tag tagging counts, or null without a collection
/// @param detection detection counts, or null when the entries came from the cache or no filtering was asked for
/// @param cacheHit true if the entries were reused from the cache
/// @param excessiveKeys number of flagged surts, or -1 when no filtering was asked for
/// @param filter filter counts, or null when no filtering was asked for
public record PipelineReport(
    MergeStats merge,
    TagStats tag,
    DetectionStats detection,
    boolean cacheHit,
    int excessiveKeys,
    FilterStats filter
) {
}
