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

package io.cdxjtools.index.excessive;

import io.cdxjtools.index.OrderViolationPolicy;
import io.cdxjtools.index.record.CdxjLineReader;

import java.util.Objects;

/// @param skipMode how runs are skipped
/// @param staleEntryPolicy what to do with entries that do not match their run
/// @param orderViolationPolicy what to do when the master stream is not sorted
/// @param bufferSize read buffer size, in bytes
public record FilterSettings(
    SkipMode skipMode,
    StaleEntryPolicy staleEntryPolicy,
    OrderViolationPolicy orderViolationPolicy,
    int bufferSize
) {

    public FilterSettings {
        Objects.requireNonNull(skipMode, "skipMode cannot be null");
        Objects.requireNonNull(staleEntryPolicy, "staleEntryPolicy cannot be null");
        Objects.requireNonNull(orderViolationPolicy, "orderViolationPolicy cannot be null");
        if (bufferSize <= 0) {
            throw new IllegalArgumentException("bufferSize must be positive: " + bufferSize);
        }
    }

    public static FilterSettings defaults() {
        return new FilterSettings(SkipMode.VERIFY, StaleEntryPolicy.ABORT, OrderViolationPolicy.ABORT,
            CdxjLineReader.DEFAULT_BUFFER_SIZE);
    }

    public FilterSettings withSkipMode(SkipMode mode) {
        return new FilterSettings(mode, staleEntryPolicy, orderViolationPolicy, bufferSize);
    }

    public FilterSettings withStaleEntryPolicy(StaleEntryPolicy policy) {
        return new FilterSettings(skipMode, policy, orderViolationPolicy, bufferSize);
    }

    public FilterSettings withOrderViolationPolicy(OrderViolationPolicy policy) {
        return new FilterSettings(skipMode, staleEntryPolicy, policy, bufferSize);
    }
}
