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

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.snakeyaml.engine.v2.api.Load;
import org.snakeyaml.engine.v2.api.LoadSettings;
import picocli.CommandLine;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/// Supplies option defaults from a YAML settings file.
///
/// Keys are long option names without the leading dashes. A top level mapping named
/// after a command holds settings that only apply to that command, and is consulted
/// before the top level keys:
///
/// ```yaml
/// threshold: 500
/// shard-failure: skip
/// index:
///   cache-dir: /var/cache/cdxj
/// ```
///
/// Values given on the command line always win.
public class SettingsDefaultProvider implements CommandLine.IDefaultValueProvider {
    private static final Logger logger = LogManager.getLogger(SettingsDefaultProvider.class);

    /// Environment variable naming the settings file
    public static final String SETTINGS_ENV = "CDXJ_TOOLS_SETTINGS";

    /// Settings file used when the environment variable is not set
    public static final Path DEFAULT_SETTINGS = Path.of(System.getProperty("user.home"), ".config", "cdxj-tools", "settings.yaml");

    private final Map<String, Object> settings;

    public SettingsDefaultProvider(Map<String, Object> settings) {
        this.settings = settings;
    }

    /// Loads settings from the file named by {@value #SETTINGS_ENV}, or from
    /// {@link #DEFAULT_SETTINGS}. A missing default file yields empty settings.
    /// @return the provider
    public static SettingsDefaultProvider load() {
        String configured = System.getenv(SETTINGS_ENV);
        if (configured != null && !configured.isBlank()) {
            return load(Path.of(configured), false);
        }
        return load(DEFAULT_SETTINGS, true);
    }

    /// @param file the YAML settings file
    /// @param optional whether a missing file is acceptable
    /// @return the provider
    public static SettingsDefaultProvider load(Path file, boolean optional) {
        if (!Files.exists(file)) {
            if (optional) {
                logger.debug("No settings file at {}", file);
                return new SettingsDefaultProvider(Collections.emptyMap());
            }
            throw new IllegalStateException("Settings file does not exist: " + file);
        }
        try {
            return new SettingsDefaultProvider(parse(Files.readString(file)));
        } catch (IOException e) {
            throw new IllegalStateException("Unable to read settings file " + file + ": " + e.getMessage(), e);
        }
    }

    /// @param yaml the settings document
    /// @return the top level settings mapping
    public static Map<String, Object> parse(String yaml) {
        LoadSettings loadSettings = LoadSettings.builder().build();
        Load load = new Load(loadSettings);
        Object loaded = load.loadFromString(yaml);
        if (loaded == null) {
            return Collections.emptyMap();
        }
        if (!(loaded instanceof Map<?, ?> map)) {
            throw new IllegalStateException("Settings must be a mapping of option names to values");
        }
        Map<String, Object> result = new LinkedHashMap<>();
        map.forEach((k, v) -> result.put(String.valueOf(k), v));
        return result;
    }

    @Override
    public String defaultValue(CommandLine.Model.ArgSpec argSpec) {
        if (!argSpec.isOption()) {
            return null;
        }
        String key = stripDashes(((CommandLine.Model.OptionSpec) argSpec).longestName());
        CommandLine.Model.CommandSpec command = argSpec.command();
        if (command != null && settings.get(command.name()) instanceof Map<?, ?> section) {
            Object value = section.get(key);
            if (value != null) {
                return scalar(key, value);
            }
        }
        Object value = settings.get(key);
        if (value == null || value instanceof Map) {
            return null;
        }
        return scalar(key, value);
    }

    private static String scalar(String key, Object value) {
        if (value instanceof Iterable<?> || value instanceof Map<?, ?>) {
            throw new IllegalStateException("Setting '" + key + "' must be a single value, not " + value);
        }
        return String.valueOf(value);
    }

    private static String stripDashes(String name) {
        int i = 0;
        while (i < name.length() && name.charAt(i) == '-') {
            i++;
        }
        return name.substring(i);
    }
}
