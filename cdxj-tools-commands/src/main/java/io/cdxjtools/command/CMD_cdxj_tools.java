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

package io.cdxjtools.command;

import io.cdxjtools.command.common.SettingsDefaultProvider;
import io.cdxjtools.command.excessive.CMD_excessive;
import io.cdxjtools.command.index.CMD_index;
import io.cdxjtools.command.merge.CMD_merge;
import io.cdxjtools.command.tag.CMD_tag;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import picocli.CommandLine;

/// Tools for building and cleaning CDXJ web archive indexes
///
/// This is the top level command which serves as the entry point for all sub-commands
@CommandLine.Command(name = "cdxj-tools",
    mixinStandardHelpOptions = true,
    versionProvider = CMD_cdxj_tools.VersionProvider.class,
    description = "Merge sorted CDXJ index shards, find and remove excessive keys",
    subcommands = {
        CommandLine.HelpCommand.class,
        CMD_merge.class,
        CMD_excessive.class,
        CMD_tag.class,
        CMD_index.class,
    })
public class CMD_cdxj_tools {
    private static final Logger logger = LogManager.getLogger(CMD_cdxj_tools.class);

    /// Reports the version from the jar manifest, when there is one
    public static class VersionProvider implements CommandLine.IVersionProvider {
        @Override
        public String[] getVersion() {
            String version = CMD_cdxj_tools.class.getPackage().getImplementationVersion();
            return new String[]{"cdxj-tools " + (version != null ? version : "(development build)")};
        }
    }

    /// Build the command line with settings file defaults applied
    /// @param defaults
    ///     supplies option defaults
    /// @return the configured command line
    public static CommandLine commandLine(CommandLine.IDefaultValueProvider defaults) {
        return new CommandLine(new CMD_cdxj_tools())
            .setCaseInsensitiveEnumValuesAllowed(true)
            .setDefaultValueProvider(defaults);
    }

    /// run a cdxj-tools command
    /// @param args
    ///     command line args
    public static void main(String[] args) {
        SettingsDefaultProvider defaults;
        try {
            defaults = SettingsDefaultProvider.load();
        } catch (RuntimeException e) {
            logger.error("Unable to load settings: {}", e.getMessage());
            System.exit(2);
            return;
        }
        int exitCode = commandLine(defaults).execute(args);
        System.exit(exitCode);
    }
}
