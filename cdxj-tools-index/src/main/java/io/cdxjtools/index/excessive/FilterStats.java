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

/// @param recordsRead lines read from the master stream
/// @param recordsRetained lines copied to the output
/// @param recordsRemoved lines dropped as part of a flagged run
/// @param staleEntries entries that did not match their run
public record FilterStats(long recordsRead, long recordsRetained, long recordsRemoved, long staleEntries) {
}
