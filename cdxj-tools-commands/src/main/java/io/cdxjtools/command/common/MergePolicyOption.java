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

import io.cdxjtools.index.OrderViolationPolicy;
import io.cdxjtools.index.merge.MergeSettings;
import io.cdxjtools.index.merge.ShardFailurePolicy;
import io.cdxjtools.index.record.CdxjLineReader;
import picocli.CommandLine;

/**
 * Shared merge options: what to do with a failing shard, and the per-shard buffer size.
 */
public class MergePolicyOption {

    /** Converter for {@link ShardFailurePolicy} values */
    public static class Converter extends EnumOptionConverter<ShardFailurePolicy> {
        public Converter() {
            super(ShardFailurePolicy.class);
        }
    }

    @CommandLine.Option(
        names = {"--shard-failure"},
        description = "On a shard read failure or malformed record: abort (default) or skip the shard with a warning",
        converter = Converter.class
    )
    private ShardFailurePolicy shardFailurePolicy = ShardFailurePolicy.ABORT;

    @CommandLine.Option(
        names = {"--buffer-size"},
        description = "Read buffer per shard, in bytes (default: " + CdxjLineReader.DEFAULT_BUFFER_SIZE + ")"
    )
    private int bufferSize = CdxjLineReader.DEFAULT_BUFFER_SIZE;

    public ShardFailurePolicy getShardFailurePolicy() {
        return shardFailurePolicy;
    }

    public int getBufferSize() {
        return bufferSize;
    }

    /**
     * @param orderPolicy the ordering policy selected for the command
     * @return merge settings built from these options
     */
    public MergeSettings toSettings(OrderViolationPolicy orderPolicy) {
        return new MergeSettings(shardFailurePolicy, orderPolicy, bufferSize);
    }
}
