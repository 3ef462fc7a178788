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

package io.cdxjtools.command.common;

import io.cdxjtools.index.OrderViolationPolicy;
import io.cdxjtools.index.excessive.FilterSettings;
import io.cdxjtools.index.excessive.SkipMode;
import io.cdxjtools.index.excessive.StaleEntryPolicy;
import io.cdxjtools.index.record.CdxjLineReader;
import picocli.CommandLine;

/**
 * Shared excessive-key filter options.
 */
public class FilterPolicyOption {

    /** Converter for {@link SkipMode} values */
    public static class SkipModeConverter extends EnumOptionConverter<SkipMode> {
        public SkipModeConverter() {
            super(SkipMode.class);
        }
    }

    /** Converter for {@link StaleEntryPolicy} values */
    public static class StalePolicyConverter extends EnumOptionConverter<StaleEntryPolicy> {
        public StalePolicyConverter() {
            super(StaleEntryPolicy.class);
        }
    }

    @CommandLine.Option(
        names = {"--skip-mode"},
        description = "How a flagged run is skipped: verify (find the run end by key, default) "
            + "or trust-count (skip the recorded number of lines)",
        converter = SkipModeConverter.class
    )
    private SkipMode skipMode = SkipMode.VERIFY;

    @CommandLine.Option(
        names = {"--stale-entries"},
        description = "On an entry whose count does not match its run: abort (default) or warn and continue",
        converter = StalePolicyConverter.class
    )
    private StaleEntryPolicy staleEntryPolicy = StaleEntryPolicy.ABORT;

    public SkipMode getSkipMode() {
        return skipMode;
    }

    public StaleEntryPolicy getStaleEntryPolicy() {
        return staleEntryPolicy;
    }

    /**
     * @param orderPolicy the ordering policy selected for the command
     * @return filter settings built from these options
     */
    public FilterSettings toSettings(OrderViolationPolicy orderPolicy) {
        return new FilterSettings(skipMode, staleEntryPolicy, orderPolicy, CdxjLineReader.DEFAULT_BUFFER_SIZE);
    }
}
