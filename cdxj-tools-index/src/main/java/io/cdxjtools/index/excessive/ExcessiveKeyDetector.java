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

import io.cdxjtools.index.OrderViolationPolicy;
import io.cdxjtools.index.UnsortedInputException;
import io.cdxjtools.index.record.CdxjRecord;
import io.cdxjtools.index.record.CdxjRecordReader;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.function.Consumer;

/// Finds the surts whose runs in a sorted stream are longer than a threshold.
///
/// One linear pass, holding only the run being accumulated. When the surt changes the
/// finished run is emitted if its count is strictly greater than the threshold. For
/// a given input and threshold the result is always the same.
public class ExcessiveKeyDetector {
    private static final Logger logger = LogManager.getLogger(ExcessiveKeyDetector.class);

    /// Run length above which a surt is considered excessive, unless configured
    public static final long DEFAULT_THRESHOLD = 1000;

    private final long threshold;
    private final OrderViolationPolicy orderPolicy;

    public ExcessiveKeyDetector(long threshold, OrderViolationPolicy orderPolicy) {
        if (threshold < 0) {
            throw new IllegalArgumentException("threshold cannot be negative: " + threshold);
        }
        this.threshold = threshold;
        this.orderPolicy = orderPolicy;
    }

    public ExcessiveKeyDetector(long threshold) {
        this(threshold, OrderViolationPolicy.ABORT);
    }

    public long threshold() {
        return threshold;
    }

    /// Detect excessive runs and collect them.
    /// @param reader the sorted stream
    /// @return the excessive entries in stream order
    /// @throws IOException if the stream fails
    public List<ExcessiveKey> detect(CdxjRecordReader reader) throws IOException {
        List<ExcessiveKey> found = new ArrayList<>();
        detect(reader, found::add);
        return found;
    }

    /// Detect excessive runs and hand each one to a sink as soon as its run ends.
    /// @param reader the sorted stream
    /// @param sink receives each excessive entry
    /// @return counts of what was read
    /// @throws IOException if the stream fails
    public DetectionStats detect(CdxjRecordReader reader, Consumer<ExcessiveKey> sink) throws IOException {
        long records = 0;
        long runs = 0;
        long excessive = 0;
        byte[] runSurt = null;
        long runCount = 0;

        CdxjRecord record;
        while ((record = reader.next()) != null) {
            records++;
            int cmp = runSurt == null ? 1 : record.compareSurtTo(runSurt);
            if (cmp == 0) {
                runCount++;
                continue;
            }
            if (cmp < 0) {
                UnsortedInputException violation = new UnsortedInputException(
                    "Surt '" + record.surt() + "' sorts before the preceding surt",
                    reader.sourceName(), reader.lineNumber(), reader.lineOffset());
                if (orderPolicy == OrderViolationPolicy.ABORT) {
                    throw violation;
                }
                logger.warn("Ordering violation, run counts may be split: {}", violation.getMessage());
            }
            if (runSurt != null && runCount > threshold) {
                sink.accept(new ExcessiveKey(runSurt, runCount));
                excessive++;
            }
            runSurt = record.surtBytes();
            runCount = 1;
            runs++;
        }
        if (runSurt != null && runCount > threshold) {
            sink.accept(new ExcessiveKey(runSurt, runCount));
            excessive++;
        }

        DetectionStats stats = new DetectionStats(records, runs, excessive);
        logger.info("Scanned {} records in {} runs of {}, {} runs longer than {}",
            records, runs, reader.sourceName(), excessive, threshold);
        return stats;
    }
}
