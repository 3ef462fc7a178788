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

package io.cdxjtools.command.merge;

import io.cdxjtools.command.common.MergePolicyOption;
import io.cdxjtools.command.common.OrderPolicyOption;
import io.cdxjtools.command.common.OutputFileOption;
import io.cdxjtools.command.common.OutputTarget;
import io.cdxjtools.command.common.ParallelExecutionOption;
import io.cdxjtools.command.common.VerbosityOption;
import io.cdxjtools.index.CdxjIndexException;
import io.cdxjtools.index.merge.GroupedMerger;
import io.cdxjtools.index.merge.KWayMerger;
import io.cdxjtools.index.merge.MergeInput;
import io.cdxjtools.index.merge.MergeSettings;
import io.cdxjtools.index.merge.MergeStats;
import io.cdxjtools.index.merge.ShardMerger;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import picocli.CommandLine;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;

/// Merge sorted CDXJ shards into one sorted index
///
/// Every input must already be sorted by surt and timestamp. Records with equal keys
/// keep the order of the inputs on the command line. One input may be `-` to read
/// standard input alongside the files.
@CommandLine.Command(name = "merge",
    description = "Merge sorted CDXJ shards into one sorted index")
public class CMD_merge implements Callable<Integer> {
    private static final Logger logger = LogManager.getLogger(CMD_merge.class);

    private static final int EXIT_SUCCESS = 0;
    private static final int EXIT_FILE_EXISTS = 1;
    private static final int EXIT_ERROR = 2;

    @CommandLine.Parameters(arity = "1..*", paramLabel = "<input>",
        description = "Sorted CDXJ shards, or '-' for standard input")
    private List<String> inputs = new ArrayList<>();

    @CommandLine.Mixin
    private OutputFileOption outputFileOption = new OutputFileOption();

    @CommandLine.Mixin
    private MergePolicyOption mergePolicyOption = new MergePolicyOption();

    @CommandLine.Mixin
    private OrderPolicyOption orderPolicyOption = new OrderPolicyOption();

    @CommandLine.Mixin
    private ParallelExecutionOption parallelExecutionOption = new ParallelExecutionOption();

    @CommandLine.Mixin
    private VerbosityOption verbosityOption = new VerbosityOption();

    @Override
    public Integer call() {
        try {
            verbosityOption.validate();
            verbosityOption.applyLogLevel();
        } catch (IllegalStateException e) {
            logger.error(e.getMessage());
            return EXIT_ERROR;
        }

        if (outputFileOption.outputExistsWithoutForce()) {
            logger.error("Output file already exists: {}. Use --force to overwrite.", outputFileOption.getOutputPath());
            return EXIT_FILE_EXISTS;
        }

        try {
            List<MergeInput> mergeInputs = new ArrayList<>();
            for (String input : inputs) {
                mergeInputs.add(MergeInput.parse(input, System.in));
            }
            MergeSettings settings = mergePolicyOption.toSettings(orderPolicyOption.getPolicy());
            int threads = parallelExecutionOption.getOptimalThreadCount();
            if (parallelExecutionOption.exceedsAvailableCores()) {
                logger.warn("Specified thread count ({}) >= available cores ({}). This may cause contention.",
                    parallelExecutionOption.getExplicitThreads(), Runtime.getRuntime().availableProcessors());
            }
            ShardMerger merger = threads > 1
                ? new GroupedMerger(settings, threads, parallelExecutionOption.resolveTempDir(outputFileOption.getOutputPath()))
                : new KWayMerger(settings);

            MergeStats stats;
            try (OutputTarget target = OutputTarget.open(outputFileOption.getOutputFile(), System.out)) {
                stats = merger.merge(mergeInputs, target.stream());
                target.commit();
            }

            logger.info("Merged {} records from {} shards into {}",
                stats.totalRecords(), mergeInputs.size(), outputFileOption.getOutputFile());
            for (int i = 0; i < stats.inputNames().size(); i++) {
                logger.debug("  {}: {} records", stats.inputNames().get(i), stats.recordsFrom(i));
            }
            if (!stats.skippedInputs().isEmpty()) {
                logger.warn("Skipped {} shards: {}", stats.skippedInputs().size(), stats.skippedInputs());
            }
            return EXIT_SUCCESS;
        } catch (CdxjIndexException e) {
            logger.error("Merge failed: {}", e.getMessage());
            return EXIT_ERROR;
        } catch (IOException e) {
            logger.error("Merge failed: {}", e.getMessage(), e);
            return EXIT_ERROR;
        } catch (IllegalArgumentException | IllegalStateException e) {
            logger.error(e.getMessage());
            return EXIT_ERROR;
        }
    }
}
