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

import io.cdxjtools.index.OrderViolationPolicy;
import io.cdxjtools.index.record.CdxjLineReader;

import java.util.Objects;

/// Settings shared by every merge strategy.
///
/// @param shardFailurePolicy what to do with an input that fails mid-stream
/// @param orderViolationPolicy what to do with an input that is not sorted
/// @param bufferSize read buffer size per input, in bytes
public record MergeSettings(
    ShardFailurePolicy shardFailurePolicy,
    OrderViolationPolicy orderViolationPolicy,
    int bufferSize
) {

    public MergeSettings {
        Objects.requireNonNull(shardFailurePolicy, "shardFailurePolicy cannot be null");
        Objects.requireNonNull(orderViolationPolicy, "orderViolationPolicy cannot be null");
        if (bufferSize <= 0) {
            throw new IllegalArgumentException("bufferSize must be positive: " + bufferSize);
        }
    }

    /// @return abort on any failure or ordering violation, default buffer size
    public static MergeSettings defaults() {
        return new MergeSettings(ShardFailurePolicy.ABORT, OrderViolationPolicy.ABORT,
            CdxjLineReader.DEFAULT_BUFFER_SIZE);
    }

    public MergeSettings withShardFailurePolicy(ShardFailurePolicy policy) {
        return new MergeSettings(policy, orderViolationPolicy, bufferSize);
    }

    public MergeSettings withOrderViolationPolicy(OrderViolationPolicy policy) {
        return new MergeSettings(shardFailurePolicy, policy, bufferSize);
    }

    public MergeSettings withBufferSize(int size) {
        return new MergeSettings(shardFailurePolicy, orderViolationPolicy, size);
    }
}
