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

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import io.cdxjtools.index.record.CdxjLineReader;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.BufferedOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.nio.charset.StandardCharsets;

/// Labels every record with the collection it belongs to.
///
/// For each line whose last byte is `}` the field `"collection": "<name>"` is added
/// as the last member of the JSON payload. Other lines are copied unchanged. Keys are
/// not touched, so the output has the same order as the input.
///
/// ```text
/// com,example)/ 20200101 {"url": "http://example.com/"}
/// com,example)/ 20200101 {"url": "http://example.com/", "collection": "AWP1"}
/// ```
public class CollectionTagger implements StreamStage<TagStats> {
    private static final Logger logger = LogManager.getLogger(CollectionTagger.class);

    private static final Gson GSON = new GsonBuilder().disableHtmlEscaping().create();

    private final byte[] member;
    private final byte[] firstMember;

    /// @param collection the collection name; escaped as a JSON string
    public CollectionTagger(String collection) {
        if (collection == null || collection.isEmpty()) {
            throw new IllegalArgumentException("Collection name cannot be empty");
        }
        String field = "\"collection\": " + GSON.toJson(collection);
        this.member = (", " + field).getBytes(StandardCharsets.UTF_8);
        this.firstMember = field.getBytes(StandardCharsets.UTF_8);
    }

    @Override
    public TagStats run(String sourceName, InputStream in, OutputStream out) throws IOException {
        CdxjLineReader reader = new CdxjLineReader(sourceName, in);
        OutputStream buffered = new BufferedOutputStream(out, CdxjLineReader.DEFAULT_BUFFER_SIZE);
        long records = 0;
        long tagged = 0;
        byte[] line;
        while ((line = reader.readLine()) != null) {
            records++;
            int close = line.length - 1;
            if (close >= 0 && line[close] == '}') {
                buffered.write(line, 0, close);
                buffered.write(isEmptyObject(line, close) ? firstMember : member);
                buffered.write('}');
                tagged++;
            } else {
                buffered.write(line);
            }
            if (reader.lastLineTerminated()) {
                buffered.write('\n');
            }
        }
        buffered.flush();
        logger.debug("Tagged {} of {} records in {}", tagged, records, sourceName);
        return new TagStats(records, tagged);
    }

    private static boolean isEmptyObject(byte[] line, int close) {
        int i = close - 1;
        while (i >= 0 && (line[i] == ' ' || line[i] == '\t')) {
            i--;
        }
        return i >= 0 && line[i] == '{';
    }
}
