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

/// Thrown when a record is observed out of order relative to the record before it.
///
/// Neither the merge nor the filter can produce a correct result from unsorted input,
/// and neither would otherwise notice, so the check is made on every record read.
public class UnsortedInputException extends CdxjIndexException {

    public UnsortedInputException(String message, String source, long lineNumber, long byteOffset) {
        super(message, source, lineNumber, byteOffset);
    }
}
