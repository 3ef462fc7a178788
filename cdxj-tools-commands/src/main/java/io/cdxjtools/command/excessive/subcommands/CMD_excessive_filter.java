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

import io.cdxjtools.command.common.FilterPolicyOption;
import io.cdxjtools.command.common.InputFileOption;
import io.cdxjtools.command.common.OrderPolicyOption;
import io.cdxjtools.command.common.OutputFileOption;
import io.cdxjtools.command.common.OutputTarget;
import io.cdxjtools.command.common.VerbosityOption;
import io.cdxjtools.index.CdxjIndexException;
import io.cdxjtools.index.excessive.ExcessiveKey;
import io.cdxjtools.index.excessive.ExcessiveKeyFile;
import io.cdxjtools.index.excessive.ExcessiveKeyFilter;
import io.cdxjtools.index.excessive.FilterStats;
import io.cdxjtools.index.record.CdxjLineReader;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import picocli.CommandLine;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.concurrent.Callable;

/// Copy a sorted index, leaving out every run listed in an excessive keys file
///
/// Retained lines are copied byte for byte. The master is read once from start to
/// end, so it may be standard input.
@CommandLine.Command(name = "filter",
    description = "Copy a sorted index without the runs of its excessive keys")
public class CMD_excessive_filter implements Callable<Integer> {
    private static final Logger logger = LogManager.getLogger(CMD_excessive_filter.class);

    private static final int EXIT_SUCCESS = 0;
    private static final int EXIT_FILE_EXISTS = 1;
    private static final int EXIT_ERROR = 2;

    @CommandLine.Parameters(index = "0", paramLabel = "<entries>",
        description = "Excessive keys file, '<surt> <count>' per line in index order")
    private Path entriesPath;

    @CommandLine.Parameters(index = "1", paramLabel = "<master>",
        description = "The sorted master index, or '-' for standard input",
        converter = InputFileOption.InputFileConverter.class)
    private InputFileOption.InputFile master;

    @CommandLine.Mixin
    private OutputFileOption outputFileOption = new OutputFileOption();

    @CommandLine.Mixin
    private FilterPolicyOption filterPolicyOption = new FilterPolicyOption();

    @CommandLine.Mixin
    private OrderPolicyOption orderPolicyOption = new OrderPolicyOption();

    @CommandLine.Mixin
    private VerbosityOption verbosityOption = new VerbosityOption();

    @Override
    public Integer call() {
        try {
            verbosityOption.validate();
            verbosityOption.applyLogLevel();
            if (!Files.exists(entriesPath)) {
                throw new IllegalStateException("Excessive keys file does not exist: " + entriesPath);
            }
            master.validate();
        } catch (IllegalStateException e) {
            logger.error(e.getMessage());
            return EXIT_ERROR;
        }

        if (outputFileOption.outputExistsWithoutForce()) {
            logger.error("Output file already exists: {}. Use --force to overwrite.", outputFileOption.getOutputPath());
            return EXIT_FILE_EXISTS;
        }

        try {
            List<ExcessiveKey> entries = ExcessiveKeyFile.read(entriesPath);
            logger.debug("Loaded {} excessive keys from {}", entries.size(), entriesPath);
            ExcessiveKeyFilter filter = new ExcessiveKeyFilter(filterPolicyOption.toSettings(orderPolicyOption.getPolicy()));

            FilterStats stats;
            try (CdxjLineReader reader = new CdxjLineReader(master.sourceName(), master.open(System.in));
                 OutputTarget target = OutputTarget.open(outputFileOption.getOutputFile(), System.out)) {
                stats = filter.filter(reader, entries, target.stream());
                target.commit();
            }

            logger.info("Kept {} of {} records, removed {}", stats.recordsRetained(), stats.recordsRead(), stats.recordsRemoved());
            if (stats.staleEntries() > 0) {
                logger.warn("{} excessive key entries did not match the master; regenerate {}",
                    stats.staleEntries(), entriesPath);
            }
            return EXIT_SUCCESS;
        } catch (CdxjIndexException e) {
            logger.error("Filter failed: {}", e.getMessage());
            return EXIT_ERROR;
        } catch (IOException e) {
            logger.error("Filter failed: {}", e.getMessage(), e);
            return EXIT_ERROR;
        } catch (IllegalArgumentException | IllegalStateException e) {
            logger.error(e.getMessage());
            return EXIT_ERROR;
        }
    }
}
