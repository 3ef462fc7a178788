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

package io.cdxjtools.command.excessive.subcommands;

import io.cdxjtools.command.common.CacheOption;
import io.cdxjtools.command.common.InputFileOption;
import io.cdxjtools.command.common.OrderPolicyOption;
import io.cdxjtools.command.common.OutputFileOption;
import io.cdxjtools.command.common.OutputTarget;
import io.cdxjtools.command.common.ThresholdOption;
import io.cdxjtools.command.common.VerbosityOption;
import io.cdxjtools.index.CdxjIndexException;
import io.cdxjtools.index.excessive.DetectionStats;
import io.cdxjtools.index.excessive.ExcessiveKey;
import io.cdxjtools.index.excessive.ExcessiveKeyCache;
import io.cdxjtools.index.excessive.ExcessiveKeyDetector;
import io.cdxjtools.index.excessive.ExcessiveKeyFile;
import io.cdxjtools.index.excessive.FreshnessToken;
import io.cdxjtools.index.record.CdxjLineReader;
import io.cdxjtools.index.record.CdxjRecordReader;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import picocli.CommandLine;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.Callable;

/// List the surts of a sorted index whose runs exceed the threshold
///
/// Output has one `<surt> <count>` line per excessive key, in index order, which is
/// the format `excessive filter` reads. With `--cache-dir`, a result computed earlier
/// for an unchanged index and the same threshold is reused.
@CommandLine.Command(name = "find",
    description = "List surts with more records than the threshold, with their counts")
public class CMD_excessive_find implements Callable<Integer> {
    private static final Logger logger = LogManager.getLogger(CMD_excessive_find.class);

    private static final int EXIT_SUCCESS = 0;
    private static final int EXIT_FILE_EXISTS = 1;
    private static final int EXIT_ERROR = 2;

    @CommandLine.Mixin
    private InputFileOption inputFileOption = new InputFileOption();

    @CommandLine.Mixin
    private OutputFileOption outputFileOption = new OutputFileOption();

    @CommandLine.Mixin
    private ThresholdOption thresholdOption = new ThresholdOption();

    @CommandLine.Mixin
    private OrderPolicyOption orderPolicyOption = new OrderPolicyOption();

    @CommandLine.Mixin
    private CacheOption cacheOption = new CacheOption();

    @CommandLine.Option(names = {"--collection"},
        description = "Cache entry name (default: the input file name)")
    private String collection;

    @CommandLine.Mixin
    private VerbosityOption verbosityOption = new VerbosityOption();

    @Override
    public Integer call() {
        try {
            verbosityOption.validate();
            verbosityOption.applyLogLevel();
            inputFileOption.validate();
            thresholdOption.validate();
            if (cacheOption.isEnabled() && inputFileOption.getInputFile().isStdin()) {
                throw new IllegalStateException("--cache-dir needs an input file, not standard input");
            }
        } catch (IllegalStateException e) {
            logger.error(e.getMessage());
            return EXIT_ERROR;
        }

        if (outputFileOption.outputExistsWithoutForce()) {
            logger.error("Output file already exists: {}. Use --force to overwrite.", outputFileOption.getOutputPath());
            return EXIT_FILE_EXISTS;
        }

        long threshold = thresholdOption.getThreshold();
        InputFileOption.InputFile input = inputFileOption.getInputFile();
        try {
            ExcessiveKeyCache cache = cacheOption.toCache();
            String cacheKey = null;
            FreshnessToken token = null;
            List<ExcessiveKey> entries = null;
            if (cache != null) {
                cacheKey = collection != null ? collection : String.valueOf(input.path().getFileName());
                ExcessiveKeyCache.fileName(cacheKey);
                token = cache.tokenFor(input.path(), threshold);
                Optional<List<ExcessiveKey>> cached = cache.lookup(cacheKey, token);
                if (cached.isPresent()) {
                    entries = cached.get();
                    logger.info("Reusing {} cached excessive keys for {}", entries.size(), input);
                }
            }

            if (entries == null) {
                entries = new ArrayList<>();
                ExcessiveKeyDetector detector = new ExcessiveKeyDetector(threshold, orderPolicyOption.getPolicy());
                DetectionStats stats;
                try (CdxjRecordReader reader = new CdxjRecordReader(
                    new CdxjLineReader(input.sourceName(), input.open(System.in)))) {
                    stats = detector.detect(reader, entries::add);
                }
                logger.info("Found {} excessive keys among {} surts ({} records) in {}",
                    stats.excessiveRuns(), stats.runs(), stats.records(), input);
                if (cache != null) {
                    cache.store(cacheKey, token, entries);
                }
            }

            try (OutputTarget target = OutputTarget.open(outputFileOption.getOutputFile(), System.out)) {
                ExcessiveKeyFile.write(entries, target.stream());
                target.commit();
            }
            return EXIT_SUCCESS;
        } catch (CdxjIndexException e) {
            logger.error("Detection failed: {}", e.getMessage());
            return EXIT_ERROR;
        } catch (IOException e) {
            logger.error("Detection failed: {}", e.getMessage(), e);
            return EXIT_ERROR;
        } catch (IllegalArgumentException | IllegalStateException e) {
            logger.error(e.getMessage());
            return EXIT_ERROR;
        }
    }
}
