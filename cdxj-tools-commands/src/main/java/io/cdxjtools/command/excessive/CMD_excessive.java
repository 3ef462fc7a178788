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

package io.cdxjtools.command.excessive;

import io.cdxjtools.command.excessive.subcommands.CMD_excessive_filter;
import io.cdxjtools.command.excessive.subcommands.CMD_excessive_find;
import picocli.CommandLine.Command;
import picocli.CommandLine.HelpCommand;

/// Commands for surts whose runs are too long to be useful in an index.
@Command(name = "excessive",
    header = "find and remove excessive keys",
    description = """
        A key is excessive when more consecutive records of a sorted index share its surt
        than the threshold allows. These runs are usually crawler traps or calendar pages,
        and lookups against them are slow. 'find' lists them with their counts, 'filter'
        copies an index without them.""",
    subcommands = {
        CMD_excessive_find.class,
        CMD_excessive_filter.class,
        HelpCommand.class
    })
public class CMD_excessive {
}
