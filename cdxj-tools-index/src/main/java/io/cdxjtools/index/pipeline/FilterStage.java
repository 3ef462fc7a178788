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

package io.cdxjtools.index.pipeline;

import io.cdxjtools.index.excessive.ExcessiveKey;
import io.cdxjtools.index.excessive.ExcessiveKeyFilter;
import io.cdxjtools.index.excessive.FilterStats;
import io.cdxjtools.index.record.CdxjLineReader;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.util.List;

/// Stage form of {@link ExcessiveKeyFilter}, bound to one list of entries.
public class FilterStage implements StreamStage<FilterStats> {

    private final ExcessiveKeyFilter filter;
    private final List<ExcessiveKey> entries;

    public FilterStage(ExcessiveKeyFilter filter, List<ExcessiveKey> entries) {
        this.filter = filter;
        this.entries = List.copyOf(entries);
    }

    @Override
    public FilterStats run(String sourceName, InputStream in, OutputStream out) throws IOException {
        CdxjLineReader reader = new CdxjLineReader(sourceName, in, filter.settings().bufferSize());
        return filter.filter(reader, entries, out);
    }
}
