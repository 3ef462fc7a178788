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
import io.cdxjtools.index.StaleEntryException;
import io.cdxjtools.index.UnsortedInputException;
import io.cdxjtools.index.record.CdxjLineReader;
import io.cdxjtools.index.record.CdxjOrdering;
import io.cdxjtools.index.record.CdxjRecord;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.BufferedOutputStream;
import java.io.IOException;
import java.io.OutputStream;
import java.util.List;

/// Removes every record of the flagged surts from a sorted master stream in one
/// forward pass.
///
/// The master stream and the entry list are walked together, both in ascending surt
/// order. Retained lines are copied exactly as read, terminator included, so the
/// payload is never rebuilt. Only flagged runs are dropped:
///
/// ```text
///   master:   a 1 {..}        entries:  b 1001
///             b 1 {..}  ┐
///             ...       ├ skipped
///             b 1001 {..}┘
///             c 1 {..}
///   output:   a 1 {..}
///             c 1 {..}
/// ```
///
/// The scan for an entry stops at the first surt that does not sort before it, so an
/// entry whose surt is absent costs nothing and does not consume the rest of the
/// stream. Total work is one traversal of the master stream, however many entries
/// there are.
///
/// Entries carry the run length seen when they were computed. With
/// {@link SkipMode#VERIFY} the run end is found from the keys and the count is only
/// checked; with {@link SkipMode#TRUST_COUNT} exactly that many lines are skipped.
/// Either way, a mismatch is reported through the {@link StaleEntryPolicy}.
public class ExcessiveKeyFilter {
    private static final Logger logger = LogManager.getLogger(ExcessiveKeyFilter.class);

    private final FilterSettings settings;

    public ExcessiveKeyFilter(FilterSettings settings) {
        this.settings = settings;
    }

    public ExcessiveKeyFilter() {
        this(FilterSettings.defaults());
    }

    public FilterSettings settings() {
        return settings;
    }

    /// @param master the sorted master stream
    /// @param entries the flagged surts, ascending
    /// @param out where retained lines are written; flushed, not closed
    /// @return counts of what was read, kept and dropped
    /// @throws IOException if either stream fails
    public FilterStats filter(CdxjLineReader master, List<ExcessiveKey> entries, OutputStream out)
        throws IOException {
        Scan scan = new Scan(master, new BufferedOutputStream(out, settings.bufferSize()));
        scan.advance();

        ExcessiveKey previousEntry = null;
        for (ExcessiveKey entry : entries) {
            if (previousEntry != null && entry.compareTo(previousEntry) <= 0) {
                throw new UnsortedInputException(
                    "Excessive-key entry '" + entry.surt() + "' does not sort after '"
                        + previousEntry.surt() + "'",
                    "excessive-key entries", UnsortedInputException.UNKNOWN, UnsortedInputException.UNKNOWN);
            }
            previousEntry = entry;

            byte[] surt = entry.rawSurt();
            while (scan.current != null && scan.current.compareSurtTo(surt) < 0) {
                scan.copyCurrent();
            }
            if (scan.current == null || !scan.current.hasSurt(surt)) {
                scan.stale(entry, 0, "found none");
                continue;
            }
            if (settings.skipMode() == SkipMode.VERIFY) {
                skipVerified(scan, entry);
            } else {
                skipCounted(scan, entry);
            }
        }
        while (scan.current != null) {
            scan.copyCurrent();
        }
        scan.out.flush();

        FilterStats stats = new FilterStats(scan.read, scan.retained, scan.removed, scan.staleEntries);
        logger.info("Filtered {}: read {}, retained {}, removed {} over {} entries ({} stale)",
            master.sourceName(), stats.recordsRead(), stats.recordsRetained(), stats.recordsRemoved(),
            entries.size(), stats.staleEntries());
        return stats;
    }

    private void skipVerified(Scan scan, ExcessiveKey entry) throws IOException {
        byte[] surt = entry.rawSurt();
        long runLine = scan.reader.lineNumber();
        long runOffset = scan.reader.lineOffset();
        long skipped = 0;
        while (scan.current != null && scan.current.hasSurt(surt)) {
            scan.dropCurrent();
            skipped++;
        }
        if (skipped != entry.count()) {
            scan.staleAt(entry, skipped, "found " + skipped, runLine, runOffset);
        }
    }

    private void skipCounted(Scan scan, ExcessiveKey entry) throws IOException {
        byte[] surt = entry.rawSurt();
        long runLine = scan.reader.lineNumber();
        long runOffset = scan.reader.lineOffset();
        long skipped = 0;
        long foreign = 0;
        while (skipped < entry.count() && scan.current != null) {
            if (!scan.current.hasSurt(surt)) {
                foreign++;
            }
            scan.dropCurrent();
            skipped++;
        }
        if (skipped < entry.count()) {
            scan.staleAt(entry, skipped, "stream ended after " + skipped, runLine, runOffset);
        } else if (foreign > 0) {
            scan.staleAt(entry, skipped - foreign,
                "skipped " + foreign + " records of other surts", runLine, runOffset);
        } else if (scan.current != null && scan.current.hasSurt(surt)) {
            scan.staleAt(entry, skipped, "run continues past the recorded count", runLine, runOffset);
        }
    }

    /// Scan state of the single forward pass: the current line, its parsed record, and
    /// the counters. The reader supplies the current byte offset and line number.
    private final class Scan {
        private final CdxjLineReader reader;
        private final OutputStream out;
        private byte[] line;
        private CdxjRecord current;
        private CdxjRecord previous;
        private long read;
        private long retained;
        private long removed;
        private long staleEntries;

        private Scan(CdxjLineReader reader, OutputStream out) {
            this.reader = reader;
            this.out = out;
        }

        private void advance() throws IOException {
            previous = current;
            line = reader.readLine();
            if (line == null) {
                current = null;
                return;
            }
            read++;
            current = CdxjRecord.parse(line, reader.sourceName(), reader.lineNumber(), reader.lineOffset());
            if (previous != null && CdxjOrdering.BY_SURT.compare(current, previous) < 0) {
                UnsortedInputException violation = new UnsortedInputException(
                    "Surt '" + current.surt() + "' sorts before the preceding surt '" + previous.surt() + "'",
                    reader.sourceName(), reader.lineNumber(), reader.lineOffset());
                if (settings.orderViolationPolicy() == OrderViolationPolicy.ABORT) {
                    throw violation;
                }
                logger.warn("Ordering violation, flagged runs may be missed: {}", violation.getMessage());
            }
        }

        private void copyCurrent() throws IOException {
            out.write(line);
            if (reader.lastLineTerminated()) {
                out.write('\n');
            }
            retained++;
            advance();
        }

        private void dropCurrent() throws IOException {
            removed++;
            advance();
        }

        private void stale(ExcessiveKey entry, long observed, String detail) {
            long lineNumber = current != null ? reader.lineNumber() : StaleEntryException.UNKNOWN;
            long offset = current != null ? reader.lineOffset() : reader.bytesConsumed();
            staleAt(entry, observed, detail, lineNumber, offset);
        }

        private void staleAt(ExcessiveKey entry, long observed, String detail, long lineNumber, long offset) {
            staleEntries++;
            StaleEntryException mismatch = new StaleEntryException(entry.surt(), entry.count(), observed, detail,
                reader.sourceName(), lineNumber, offset);
            if (settings.staleEntryPolicy() == StaleEntryPolicy.ABORT) {
                throw mismatch;
            }
            logger.warn("{}", mismatch.getMessage());
        }
    }
}
