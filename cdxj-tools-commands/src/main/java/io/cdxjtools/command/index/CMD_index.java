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

package io.cdxjtools.command.index;

import io.cdxjtools.command.common.CacheOption;
import io.cdxjtools.command.common.FilterPolicyOption;
import io.cdxjtools.command.common.MergePolicyOption;
import io.cdxjtools.command.common.OrderPolicyOption;
import io.cdxjtools.command.common.OutputFileOption;
import io.cdxjtools.command.common.ParallelExecutionOption;
import io.cdxjtools.command.common.ThresholdOption;
import io.cdxjtools.command.common.VerbosityOption;
import io.cdxjtools.index.CdxjIndexException;
import io.cdxjtools.index.merge.MergeInput;
import io.cdxjtools.index.pipeline.IndexPipeline;
import io.cdxjtools.index.pipeline.PipelineReport;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import picocli.CommandLine;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;

/// Build the master index of a collection, and optionally a filtered copy
///
/// Runs merge, tagging, excessive-key detection and filtering in one go:
///
/// ```
/// cdxj-tools index -o master.cdxj -F filtered.cdxj -c AWP1 --cache-dir cache shards/*.cdxj
/// ```
///
/// Each output appears under its final name only once it is complete.
@CommandLine.Command(name = "index",
    description = "Merge shards into a master index, then optionally tag it and write a filtered copy")
public class CMD_index implements Callable<Integer> {
    private static final Logger logger = LogManager.getLogger(CMD_index.class);

    private static final int EXIT_SUCCESS = 0;
    private static final int EXIT_FILE_EXISTS = 1;
    private static final int EXIT_ERROR = 2;

    @CommandLine.Parameters(arity = "1..*", paramLabel = "<shard>",
        description = "Sorted CDXJ shards, or '-' for standard input")
    private List<String> shards = new ArrayList<>();

    @CommandLine.Mixin
    private OutputFileOption outputFileOption = new OutputFileOption();

    @CommandLine.Option(names = {"-F", "--filtered"},
        description = "Also write a copy of the master without excessive keys here")
    private Path filteredPath;

    @CommandLine.Option(names = {"-c", "--collection"},
        description = "Collection name added to every payload, also used as the cache entry name")
    private String collection;

    @CommandLine.Mixin
    private ThresholdOption thresholdOption = new ThresholdOption();

    @CommandLine.Mixin
    private CacheOption cacheOption = new CacheOption();

    @CommandLine.Mixin
    private MergePolicyOption mergePolicyOption = new MergePolicyOption();

    @CommandLine.Mixin
    private FilterPolicyOption filterPolicyOption = new FilterPolicyOption();

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
            thresholdOption.validate();
            if (outputFileOption.getOutputPath() == null) {
                throw new IllegalStateException("index needs a master file: use -o <master>");
            }
        } catch (IllegalStateException e) {
            logger.error(e.getMessage());
            return EXIT_ERROR;
        }

        Path master = outputFileOption.getOutputPath();
        if (outputFileOption.outputExistsWithoutForce()) {
            logger.error("Output file already exists: {}. Use --force to overwrite.", master);
            return EXIT_FILE_EXISTS;
        }
        if (filteredPath != null && Files.exists(filteredPath) && !outputFileOption.isForce()) {
            logger.error("Output file already exists: {}. Use --force to overwrite.", filteredPath);
            return EXIT_FILE_EXISTS;
        }

        try {
            List<MergeInput> inputs = new ArrayList<>();
            for (String shard : shards) {
                inputs.add(MergeInput.parse(shard, System.in));
            }
            IndexPipeline pipeline = IndexPipeline.builder()
                .shards(inputs)
                .masterPath(master)
                .filteredPath(filteredPath)
                .collection(collection)
                .threshold(thresholdOption.getThreshold())
                .cache(cacheOption.toCache())
                .mergeSettings(mergePolicyOption.toSettings(orderPolicyOption.getPolicy()))
                .filterSettings(filterPolicyOption.toSettings(orderPolicyOption.getPolicy()))
                .threads(parallelExecutionOption.getOptimalThreadCount())
                .tempDir(parallelExecutionOption.resolveTempDir(master))
                .build();

            PipelineReport report = pipeline.run();

            logger.info("Master {}: {} records from {} shards", master, report.merge().totalRecords(), inputs.size());
            if (!report.merge().skippedInputs().isEmpty()) {
                logger.warn("Skipped {} shards: {}", report.merge().skippedInputs().size(), report.merge().skippedInputs());
            }
            if (report.filter() != null) {
                logger.info("Filtered {}: kept {} records, removed {} in {} excessive keys{}",
                    filteredPath, report.filter().recordsRetained(), report.filter().recordsRemoved(),
                    report.excessiveKeys(), report.cacheHit() ? " (cached)" : "");
            }
            return EXIT_SUCCESS;
        } catch (CdxjIndexException e) {
            logger.error("Indexing failed: {}", e.getMessage());
            return EXIT_ERROR;
        } catch (IOException e) {
            logger.error("Indexing failed: {}", e.getMessage(), e);
            return EXIT_ERROR;
        } catch (IllegalArgumentException | IllegalStateException e) {
            logger.error(e.getMessage());
            return EXIT_ERROR;
        }
    }
}
