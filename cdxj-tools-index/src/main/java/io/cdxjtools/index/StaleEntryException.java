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

package io.cdxjtools.index;

/// Thrown when an excessive-key entry no longer matches the run it describes.
///
/// This happens when the master file changed after the entries were computed. The
/// expected count is the one recorded in the entry, the observed count is what the
/// filter actually found at the run position.
public class StaleEntryException extends CdxjIndexException {

    private final String surt;
    private final long expectedCount;
    private final long observedCount;

    public StaleEntryException(String surt, long expectedCount, long observedCount, String detail,
                               String source, long lineNumber, long byteOffset) {
        super(String.format("Stale excessive-key entry '%s': expected %d records, %s",
                surt, expectedCount, detail),
            source, lineNumber, byteOffset);
        this.surt = surt;
        this.expectedCount = expectedCount;
        this.observedCount = observedCount;
    }

    public String getSurt() {
        return surt;
    }

    public long getExpectedCount() {
        return expectedCount;
    }

    public long getObservedCount() {
        return observedCount;
    }
}
