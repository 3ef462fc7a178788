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

import org.apache.logging.log4j.Level;
import org.apache.logging.log4j.core.config.Configurator;
import picocli.CommandLine;

/**
 * Shared verbosity control options.
 * Provides standard {@code -v/--verbose} and {@code -q/--quiet} flags, which adjust the
 * level of the diagnostics written to standard error.
 */
public class VerbosityOption {

    @CommandLine.Option(
        names = {"-v", "--verbose"},
        description = "Enable verbose (debug) diagnostics"
    )
    private boolean verbose = false;

    @CommandLine.Option(
        names = {"-q", "--quiet"},
        description = "Suppress all diagnostics except errors"
    )
    private boolean quiet = false;

    /**
     * Checks if verbose mode is enabled.
     *
     * @return true if verbose is enabled
     */
    public boolean isVerbose() {
        return verbose;
    }

    /**
     * Checks if quiet mode is enabled.
     *
     * @return true if quiet is enabled
     */
    public boolean isQuiet() {
        return quiet;
    }

    /**
     * Validates that verbose and quiet are not both enabled.
     *
     * @throws IllegalStateException if both verbose and quiet are enabled
     */
    public void validate() {
        if (verbose && quiet) {
            throw new IllegalStateException(
                "Cannot specify both --verbose and --quiet options"
            );
        }
    }

    /**
     * Applies the selected verbosity to the root logger. Without either flag the
     * configured level is left alone.
     */
    public void applyLogLevel() {
        validate();
        if (quiet) {
            Configurator.setRootLevel(Level.ERROR);
        } else if (verbose) {
            Configurator.setRootLevel(Level.DEBUG);
        }
    }
}
