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

/// What to do when a record is observed out of sort order.
public enum OrderViolationPolicy {
    /// Fail the whole stage with an {@link UnsortedInputException}
    ABORT,
    /// Log a warning and keep going; the output is then not guaranteed to be sorted
    WARN
}
