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
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import picocli.CommandLine;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("cdxj-tools")
public class CMD_cdxj_toolsTest {

    @TempDir
    Path tempDir;

    private final ByteArrayOutputStream outContent = new ByteArrayOutputStream();
    private PrintStream originalOut;

    @BeforeEach
    void captureStdout() {
        originalOut = System.out;
        System.setOut(new PrintStream(outContent, true, StandardCharsets.UTF_8));
    }

    @AfterEach
    void restoreStdout() {
        System.setOut(originalOut);
    }

    @Test
    @DisplayName("should register every subcommand")
    void shouldRegisterSubcommands() {
        CommandLine commandLine = CMD_cdxj_tools.commandLine(new SettingsDefaultProvider(Map.of()));

        assertThat(commandLine.getSubcommands()).containsKeys("merge", "excessive", "tag", "index", "help");
        assertThat(commandLine.getSubcommands().get("excessive").getSubcommands()).containsKeys("find", "filter");
    }

    @Test
    @DisplayName("should apply settings as option defaults for nested commands")
    void shouldApplySettings() throws IOException {
        Path master = tempDir.resolve("master.cdxj");
        Files.writeString(master, "a 1 {}\na 2 {}\nb 1 {}\n", StandardCharsets.UTF_8);
        SettingsDefaultProvider settings = new SettingsDefaultProvider(
            SettingsDefaultProvider.parse("threshold: 1\n"));

        int exitCode = CMD_cdxj_tools.commandLine(settings).execute("excessive", "find", "-i", master.toString());

        assertThat(exitCode).isZero();
        assertThat(outContent.toString(StandardCharsets.UTF_8)).isEqualTo("a 2\n");
    }
}
