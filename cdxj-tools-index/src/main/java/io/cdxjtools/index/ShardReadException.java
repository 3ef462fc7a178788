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

import java.io.IOException;

/// Thrown when the underlying stream of a shard fails while it is being read.
public class ShardReadException extends CdxjIndexException {

    public ShardReadException(String source, long lineNumber, long byteOffset, IOException cause) {
        super("Read failure: " + cause.getMessage(), cause, source, lineNumber, byteOffset);
    }

    @Override
    public synchronized IOException getCause() {
        return (IOException) super.getCause();
    }
}
