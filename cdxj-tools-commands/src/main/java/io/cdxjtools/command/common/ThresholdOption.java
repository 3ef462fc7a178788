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

import io.cdxjtools.index.excessive.ExcessiveKeyDetector;
import picocli.CommandLine;

/**
 * Shared run length threshold for excessive-key detection.
 */
public class ThresholdOption {

    @CommandLine.Option(
        names = {"-n", "--threshold"},
        description = "Runs of a surt longer than this are excessive (default: "
            + ExcessiveKeyDetector.DEFAULT_THRESHOLD + ")"
    )
    private long threshold = ExcessiveKeyDetector.DEFAULT_THRESHOLD;

    public long getThreshold() {
        return threshold;
    }

    /**
     * Validates the threshold is not negative.
     */
    public void validate() {
        if (threshold < 0) {
            throw new IllegalStateException("Threshold cannot be negative: " + threshold);
        }
    }
}
