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

/// What a merge does when one of its inputs fails to read or holds a malformed record.
public enum ShardFailurePolicy {
    /// Fail the whole merge; a partially merged index would misrepresent the archive
    ABORT,
    /// Log a warning, drop the failing input and keep merging the others
    SKIP
}
