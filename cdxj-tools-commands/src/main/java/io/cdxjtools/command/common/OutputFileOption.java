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

import picocli.CommandLine;

import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Shared output option with force overwrite flag.
 * When the option is absent, or given as {@code -}, standard output is written.
 */
public class OutputFileOption {

    /**
     * Immutable output specification with force-overwrite flag.
     *
     * @param path  the output file path, or null for standard output
     * @param force whether to overwrite an existing file
     */
    public record OutputFile(Path path, boolean force) {

        /**
         * Checks if this output is standard output.
         */
        public boolean isStdout() {
            return path == null;
        }

        /**
         * Checks if the output file exists and force is not set.
         */
        public boolean existsWithoutForce() {
            return !isStdout() && Files.exists(path) && !force;
        }

        @Override
        public String toString() {
            if (isStdout()) {
                return "<stdout>";
            }
            return force ? path + " (force)" : path.toString();
        }
    }

    @CommandLine.Option(
        names = {"-o", "--output"},
        description = "The output file path, or '-' for standard output (default: standard output)"
    )
    private String output;

    @CommandLine.Option(
        names = {"-f", "--force"},
        description = "Force overwrite if output file already exists"
    )
    private boolean force = false;

    /**
     * Gets the OutputFile record constructed from the options.
     */
    public OutputFile getOutputFile() {
        return new OutputFile(getOutputPath(), force);
    }

    /**
     * Gets the output file path, or null for standard output.
     */
    public Path getOutputPath() {
        if (output == null || "-".equals(output)) {
            return null;
        }
        return Path.of(output).normalize();
    }

    /**
     * Checks if an output was named explicitly, standard output included.
     */
    public boolean isSpecified() {
        return output != null;
    }

    /**
     * Checks if force overwrite is enabled.
     */
    public boolean isForce() {
        return force;
    }

    /**
     * Checks if the output file already exists and force is not enabled.
     */
    public boolean outputExistsWithoutForce() {
        return getOutputFile().existsWithoutForce();
    }

    /**
     * Validates the output file, checking for existence without force flag.
     */
    public void validate() {
        if (outputExistsWithoutForce()) {
            throw new IllegalStateException(
                "Output file already exists: " + output + ". Use --force to overwrite."
            );
        }
    }

    @Override
    public String toString() {
        return getOutputFile().toString();
    }
}
