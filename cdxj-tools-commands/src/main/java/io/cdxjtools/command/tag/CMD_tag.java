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

package io.cdxjtools.command.tag;

import io.cdxjtools.command.common.InputFileOption;
import io.cdxjtools.command.common.OutputFileOption;
import io.cdxjtools.command.common.OutputTarget;
import io.cdxjtools.command.common.VerbosityOption;
import io.cdxjtools.index.CdxjIndexException;
import io.cdxjtools.index.pipeline.CollectionTagger;
import io.cdxjtools.index.pipeline.TagStats;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import picocli.CommandLine;

import java.io.IOException;
import java.io.InputStream;
import java.util.concurrent.Callable;

/// Add a collection name to the JSON payload of every record
@CommandLine.Command(name = "tag",
    description = "Add a \"collection\" member to the JSON payload of every record")
public class CMD_tag implements Callable<Integer> {
    private static final Logger logger = LogManager.getLogger(CMD_tag.class);

    private static final int EXIT_SUCCESS = 0;
    private static final int EXIT_FILE_EXISTS = 1;
    private static final int EXIT_ERROR = 2;

    @CommandLine.Option(names = {"-c", "--collection"}, required = true,
        description = "The collection name to add")
    private String collection;

    @CommandLine.Mixin
    private InputFileOption inputFileOption = new InputFileOption();

    @CommandLine.Mixin
    private OutputFileOption outputFileOption = new OutputFileOption();

    @CommandLine.Mixin
    private VerbosityOption verbosityOption = new VerbosityOption();

    @Override
    public Integer call() {
        try {
            verbosityOption.validate();
            verbosityOption.applyLogLevel();
            inputFileOption.validate();
        } catch (IllegalStateException e) {
            logger.error(e.getMessage());
            return EXIT_ERROR;
        }

        if (outputFileOption.outputExistsWithoutForce()) {
            logger.error("Output file already exists: {}. Use --force to overwrite.", outputFileOption.getOutputPath());
            return EXIT_FILE_EXISTS;
        }

        InputFileOption.InputFile input = inputFileOption.getInputFile();
        try {
            CollectionTagger tagger = new CollectionTagger(collection);
            TagStats stats;
            try (InputStream in = input.open(System.in);
                 OutputTarget target = OutputTarget.open(outputFileOption.getOutputFile(), System.out)) {
                stats = tagger.run(input.sourceName(), in, target.stream());
                target.commit();
            }
            logger.info("Tagged {} of {} records with collection '{}'", stats.tagged(), stats.records(), collection);
            if (stats.tagged() < stats.records()) {
                logger.warn("{} records had no JSON object payload and were left unchanged",
                    stats.records() - stats.tagged());
            }
            return EXIT_SUCCESS;
        } catch (CdxjIndexException e) {
            logger.error("Tagging failed: {}", e.getMessage());
            return EXIT_ERROR;
        } catch (IOException e) {
            logger.error("Tagging failed: {}", e.getMessage(), e);
            return EXIT_ERROR;
        } catch (IllegalArgumentException | IllegalStateException e) {
            logger.error(e.getMessage());
            return EXIT_ERROR;
        }
    }
}
