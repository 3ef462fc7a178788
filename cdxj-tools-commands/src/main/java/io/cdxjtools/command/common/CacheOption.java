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

import io.cdxjtools.index.excessive.DigestMode;
import io.cdxjtools.index.excessive.ExcessiveKeyCache;
import picocli.CommandLine;

import java.nio.file.Path;

/**
 * Shared options for the excessive-key cache. The cache is only used when a
 * directory is given.
 */
public class CacheOption {

    /** Converter for {@link DigestMode} values */
    public static class DigestConverter extends EnumOptionConverter<DigestMode> {
        public DigestConverter() {
            super(DigestMode.class);
        }
    }

    @CommandLine.Option(
        names = {"--cache-dir"},
        description = "Directory holding cached excessive keys with their freshness tokens"
    )
    private Path cacheDir;

    @CommandLine.Option(
        names = {"--digest"},
        description = "How much of the master is hashed for the freshness token: sampled (default) or full",
        converter = DigestConverter.class
    )
    private DigestMode digestMode = DigestMode.SAMPLED;

    public boolean isEnabled() {
        return cacheDir != null;
    }

    /**
     * @return the cache, or null when no cache directory was given
     */
    public ExcessiveKeyCache toCache() {
        return cacheDir != null ? new ExcessiveKeyCache(cacheDir, digestMode) : null;
    }
}
