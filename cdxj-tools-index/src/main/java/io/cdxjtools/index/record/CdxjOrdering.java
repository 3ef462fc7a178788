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

package io.cdxjtools.index.record;

import java.util.Comparator;

/// The one collation every producer and consumer of a CDXJ index agrees on.
///
/// Records are ordered by their surt and then their timestamp, both compared as
/// unsigned bytes. This is the order `LC_ALL=C sort` produces for lines whose surt
/// holds no byte below the space character, and it never consults a locale. The
/// merge, the detector and the filter are only correct when every shard was sorted
/// under exactly this order.
public final class CdxjOrdering {

    /// Orders records by the full sort key, surt then timestamp
    public static final Comparator<CdxjRecord> BY_KEY = CdxjOrdering::compareKeys;

    /// Orders records by surt only; records that compare equal belong to the same run
    public static final Comparator<CdxjRecord> BY_SURT = CdxjRecord::compareSurts;

    private CdxjOrdering() {
    }

    /// @param a the first record
    /// @param b the second record
    /// @return the byte-wise comparison of {@code (surt, timestamp)}
    public static int compareKeys(CdxjRecord a, CdxjRecord b) {
        int bySurt = CdxjRecord.compareSurts(a, b);
        if (bySurt != 0) {
            return bySurt;
        }
        return CdxjRecord.compareTimestamps(a, b);
    }
}
