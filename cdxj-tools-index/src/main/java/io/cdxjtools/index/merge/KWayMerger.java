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

import io.cdxjtools.index.MalformedRecordException;
import io.cdxjtools.index.OrderViolationPolicy;
import io.cdxjtools.index.ShardReadException;
import io.cdxjtools.index.UnsortedInputException;
import io.cdxjtools.index.record.CdxjOrdering;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.BufferedOutputStream;
import java.io.IOException;
import java.io.OutputStream;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.PriorityQueue;

/// Streaming k-way merge of sorted CDXJ inputs.
///
/// The merge opens one {@link MergeCursor} per input and keeps the open cursors in a
/// priority queue ordered by `(current record key, input index)`. It repeatedly polls
/// the smallest cursor, writes its record, advances it, and offers it back until all
/// cursors are exhausted:
///
/// ```text
///   shard-0: a 1, a 3 ─┐
///   shard-1: a 2 ──────┼─► [min-heap of cursors] ─► a 1, a 2, a 3
///   shard-2: b 1 ──────┘
/// ```
///
/// Time is O(M log N) for M records over N inputs; memory is one buffered record per
/// open input, whatever the total volume. Nothing is deduplicated and no temporary
/// files are written.
///
/// Each input is checked for monotonic order as it is read, since the merge would
/// otherwise emit an unsorted master index without noticing. Read failures and
/// malformed records fail the merge unless {@link ShardFailurePolicy#SKIP} is chosen.
public class KWayMerger implements ShardMerger {
    private static final Logger logger = LogManager.getLogger(KWayMerger.class);

    private static final Comparator<MergeCursor> CURSOR_ORDER = (a, b) -> {
        int byKey = CdxjOrdering.compareKeys(a.current(), b.current());
        return byKey != 0 ? byKey : Integer.compare(a.index(), b.index());
    };

    private final MergeSettings settings;

    public KWayMerger(MergeSettings settings) {
        this.settings = settings;
    }

    public KWayMerger() {
        this(MergeSettings.defaults());
    }

    @Override
    public MergeStats merge(List<MergeInput> inputs, OutputStream out) throws IOException {
        if (inputs.isEmpty()) {
            throw new IllegalArgumentException("At least one input is required");
        }
        long liveInputs = inputs.stream().filter(MergeInput::isLive).count();
        if (liveInputs > 1) {
            throw new IllegalArgumentException("At most one live input may be merged, found " + liveInputs);
        }

        List<String> names = new ArrayList<>(inputs.size());
        inputs.forEach(i -> names.add(i.name()));
        MergeStats stats = new MergeStats(names);

        List<MergeCursor> cursors = new ArrayList<>(inputs.size());
        PriorityQueue<MergeCursor> queue = new PriorityQueue<>(Math.max(1, inputs.size()), CURSOR_ORDER);
        OutputStream buffered = new BufferedOutputStream(out, settings.bufferSize());
        try {
            for (int i = 0; i < inputs.size(); i++) {
                MergeCursor cursor = openCursor(i, inputs.get(i), stats);
                if (cursor != null) {
                    cursors.add(cursor);
                    advance(cursor, queue, stats);
                }
            }
            logger.debug("Merging {} inputs, {} open", inputs.size(), queue.size());

            while (!queue.isEmpty()) {
                MergeCursor cursor = queue.poll();
                cursor.current().writeTo(buffered);
                stats.recordWritten(cursor.index());
                advance(cursor, queue, stats);
            }
            buffered.flush();
        } finally {
            for (MergeCursor cursor : cursors) {
                try {
                    cursor.close();
                } catch (IOException e) {
                    logger.warn("Error closing input {}", cursor.input().name(), e);
                }
            }
        }
        logger.info("Merge complete: {}", stats);
        return stats;
    }

    private MergeCursor openCursor(int index, MergeInput input, MergeStats stats) {
        try {
            return MergeCursor.open(index, input, settings.bufferSize());
        } catch (IOException e) {
            ShardReadException failure = new ShardReadException(input.name(), 0, 0, e);
            if (settings.shardFailurePolicy() == ShardFailurePolicy.ABORT) {
                throw failure;
            }
            logger.warn("Skipping input which could not be opened: {}", failure.getMessage());
            stats.markSkipped(input.name());
            return null;
        }
    }

    private void advance(MergeCursor cursor, PriorityQueue<MergeCursor> queue, MergeStats stats)
        throws IOException {
        try {
            cursor.advance();
        } catch (IOException e) {
            fail(cursor, new ShardReadException(cursor.input().name(),
                cursor.lineNumber() + 1, cursor.bytesConsumed(), e), stats);
            return;
        } catch (MalformedRecordException e) {
            fail(cursor, e, stats);
            return;
        }
        if (cursor.isExhausted()) {
            logger.debug("Input {} exhausted after {} records", cursor.input().name(),
                stats.recordsFrom(cursor.index()));
            return;
        }
        if (cursor.previous() != null
            && CdxjOrdering.compareKeys(cursor.current(), cursor.previous()) < 0) {
            UnsortedInputException violation = new UnsortedInputException(
                "Record '" + cursor.current() + "' sorts before the preceding record '"
                    + cursor.previous() + "'",
                cursor.input().name(), cursor.lineNumber(), cursor.lineOffset());
            if (settings.orderViolationPolicy() == OrderViolationPolicy.ABORT) {
                throw violation;
            }
            logger.warn("Ordering violation, merged output will not be sorted: {}", violation.getMessage());
        }
        queue.offer(cursor);
    }

    private void fail(MergeCursor cursor, RuntimeException failure, MergeStats stats) throws IOException {
        if (settings.shardFailurePolicy() == ShardFailurePolicy.ABORT) {
            throw failure;
        }
        logger.warn("Dropping input after {} records: {}", stats.recordsFrom(cursor.index()), failure.getMessage());
        stats.markSkipped(cursor.input().name());
        cursor.close();
    }
}
