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

import java.nio.charset.StandardCharsets;
import java.util.Arrays;

/// A surt whose run in a sorted master file is longer than the detection threshold.
///
/// The count is the run length observed when the entry was computed. It is only
/// meaningful for the exact master file snapshot the detector read.
public final class ExcessiveKey implements Comparable<ExcessiveKey> {

    private final byte[] surt;
    private final long count;

    public ExcessiveKey(byte[] surt, long count) {
        if (surt.length == 0) {
            throw new IllegalArgumentException("surt cannot be empty");
        }
        if (count <= 0) {
            throw new IllegalArgumentException("count must be positive: " + count);
        }
        this.surt = surt.clone();
        this.count = count;
    }

    public static ExcessiveKey of(String surt, long count) {
        return new ExcessiveKey(surt.getBytes(StandardCharsets.UTF_8), count);
    }

    public String surt() {
        return new String(surt, StandardCharsets.UTF_8);
    }

    public byte[] surtBytes() {
        return surt.clone();
    }

    byte[] rawSurt() {
        return surt;
    }

    public long count() {
        return count;
    }

    /// Orders entries the way the master stream orders surts, by unsigned byte value.
    @Override
    public int compareTo(ExcessiveKey other) {
        return Arrays.compareUnsigned(surt, other.surt);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof ExcessiveKey)) {
            return false;
        }
        ExcessiveKey that = (ExcessiveKey) o;
        return count == that.count && Arrays.equals(surt, that.surt);
    }

    @Override
    public int hashCode() {
        return 31 * Arrays.hashCode(surt) + Long.hashCode(count);
    }

    /// @return the entry in its file form, `surt count`
    @Override
    public String toString() {
        return surt() + " " + count;
    }
}
