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

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/// Counts of what a merge wrote, per input, and which inputs were dropped.
public final class MergeStats {

    private final List<String> inputNames;
    private final long[] recordsPerInput;
    private final List<String> skippedInputs = new ArrayList<>();

    MergeStats(List<String> inputNames) {
        this.inputNames = List.copyOf(inputNames);
        this.recordsPerInput = new long[inputNames.size()];
    }

    void recordWritten(int inputIndex) {
        recordsPerInput[inputIndex]++;
    }

    void addRecords(int inputIndex, long count) {
        recordsPerInput[inputIndex] += count;
    }

    void markSkipped(String inputName) {
        skippedInputs.add(inputName);
    }

    /// @return the names of the inputs in merge order
    public List<String> inputNames() {
        return inputNames;
    }

    /// @param inputIndex position of the input in merge order
    /// @return the number of records written from that input
    public long recordsFrom(int inputIndex) {
        return recordsPerInput[inputIndex];
    }

    /// @return the total number of records written
    public long totalRecords() {
        long total = 0;
        for (long count : recordsPerInput) {
            total += count;
        }
        return total;
    }

    /// @return names of inputs dropped under {@link ShardFailurePolicy#SKIP}
    public List<String> skippedInputs() {
        return Collections.unmodifiableList(skippedInputs);
    }

    @Override
    public String toString() {
        return String.format("merged %d records from %d inputs (%d skipped)",
            totalRecords(), inputNames.size(), skippedInputs.size());
    }
}
