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

import java.io.FilterInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Shared input option for commands that read one CDXJ stream.
 * When the option is absent, or given as {@code -}, standard input is read.
 */
public class InputFileOption {

    /**
     * Immutable input specification.
     *
     * @param path the input file path, or null for standard input
     */
    public record InputFile(Path path) {

        /**
         * The standard input stream.
         */
        public static final InputFile STDIN = new InputFile(null);

        /**
         * Checks if this input is standard input.
         */
        public boolean isStdin() {
            return path == null;
        }

        /**
         * Checks if the input file exists. Standard input always exists.
         */
        public boolean exists() {
            return isStdin() || Files.exists(path);
        }

        /**
         * Validates that the input file exists.
         */
        public void validate() {
            if (!exists()) {
                throw new IllegalStateException("Input file does not exist: " + path);
            }
        }

        /**
         * Name of the input for diagnostics.
         */
        public String sourceName() {
            return isStdin() ? "<stdin>" : path.toString();
        }

        /**
         * Opens the input. Standard input is wrapped so that closing it is a no-op.
         *
         * @param stdin the stream to use for standard input
         * @return the open stream
         * @throws IOException if the file cannot be opened
         */
        public InputStream open(InputStream stdin) throws IOException {
            if (isStdin()) {
                return new FilterInputStream(stdin) {
                    @Override
                    public void close() {
                        // standard input stays open
                    }
                };
            }
            return Files.newInputStream(path);
        }

        @Override
        public String toString() {
            return sourceName();
        }
    }

    /**
     * Picocli type converter for {@link InputFile} specifications.
     */
    public static class InputFileConverter implements CommandLine.ITypeConverter<InputFile> {

        @Override
        public InputFile convert(String value) {
            if (value == null || value.trim().isEmpty()) {
                throw new IllegalArgumentException("Input file path cannot be empty");
            }
            if ("-".equals(value)) {
                return InputFile.STDIN;
            }
            return new InputFile(Path.of(value));
        }
    }

    @CommandLine.Option(
        names = {"-i", "--input"},
        description = "The input CDXJ file, or '-' for standard input (default: standard input)",
        converter = InputFileConverter.class
    )
    private InputFile inputFile;

    /**
     * Gets the input, standard input when none was given.
     */
    public InputFile getInputFile() {
        return inputFile != null ? inputFile : InputFile.STDIN;
    }

    /**
     * Gets the input file path, or null for standard input.
     */
    public Path getInputPath() {
        return getInputFile().path();
    }

    /**
     * Validates the input file exists.
     */
    public void validate() {
        getInputFile().validate();
    }

    @Override
    public String toString() {
        return getInputFile().toString();
    }
}
