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

package io.cdxjtools.index.excessive;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonParseException;
import io.cdxjtools.index.CdxjIndexException;
import io.cdxjtools.index.fileio.AtomicFileOutput;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.IOException;
import java.io.OutputStreamWriter;
import java.io.Reader;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/// Reusable store of detector results, one entry list per collection.
///
/// For a collection `name` the entries live in `<dir>/name.urls`, in the form the
/// filter reads, and the {@link FreshnessToken} of the master snapshot they came from
/// lives next to them in `<dir>/name.urls.json`. Collection names are percent-encoded
/// into file names, so `RAQ 2018` is stored as `RAQ%202018.urls`; ASCII letters, digits,
/// `-`, `_` and any `.` after the first character are kept as they are. A lookup only returns the entries when
/// the stored token matches the token of the master file as it is now, so a changed
/// master or a different threshold is a miss rather than a silent reuse. A missing,
/// unreadable or stale token is a miss, never an error.
public class ExcessiveKeyCache {
    private static final Logger logger = LogManager.getLogger(ExcessiveKeyCache.class);

    private static final char[] HEX = "0123456789ABCDEF".toCharArray();
    private static final Gson GSON = new GsonBuilder().setPrettyPrinting().create();

    private final Path directory;
    private final DigestMode digestMode;

    public ExcessiveKeyCache(Path directory, DigestMode digestMode) {
        this.directory = Objects.requireNonNull(directory, "directory cannot be null");
        this.digestMode = Objects.requireNonNull(digestMode, "digestMode cannot be null");
    }

    public ExcessiveKeyCache(Path directory) {
        this(directory, DigestMode.SAMPLED);
    }

    public Path directory() {
        return directory;
    }

    /// @param master the master file
    /// @param threshold the detection threshold
    /// @return the token of the master as it is now
    /// @throws IOException if the master cannot be read
    public FreshnessToken tokenFor(Path master, long threshold) throws IOException {
        return FreshnessToken.compute(master, threshold, digestMode);
    }

    public Path entriesPath(String collection) {
        return directory.resolve(fileName(collection) + ".urls");
    }

    public Path tokenPath(String collection) {
        return directory.resolve(fileName(collection) + ".urls.json");
    }

    /// @param collection the collection identity
    /// @param current the token of the master file as it is now
    /// @return the cached entries, if they were computed from the same snapshot and threshold
    /// @throws IOException if a fresh entries file cannot be read
    public Optional<List<ExcessiveKey>> lookup(String collection, FreshnessToken current) throws IOException {
        Path entries = entriesPath(collection);
        Path tokenFile = tokenPath(collection);
        if (!Files.exists(entries) || !Files.exists(tokenFile)) {
            logger.debug("No cached excessive keys for {}", collection);
            return Optional.empty();
        }
        FreshnessToken stored;
        try (Reader reader = Files.newBufferedReader(tokenFile, StandardCharsets.UTF_8)) {
            stored = GSON.fromJson(reader, FreshnessToken.class);
        } catch (JsonParseException e) {
            logger.warn("Ignoring unreadable freshness token {}: {}", tokenFile, e.getMessage());
            return Optional.empty();
        }
        if (!current.matches(stored)) {
            logger.info("Cached excessive keys for {} are stale (cached: {}, current: {})",
                collection, stored, current);
            return Optional.empty();
        }
        try {
            List<ExcessiveKey> cached = ExcessiveKeyFile.read(entries);
            logger.info("Reusing {} cached excessive keys for {}", cached.size(), collection);
            return Optional.of(cached);
        } catch (CdxjIndexException e) {
            logger.warn("Ignoring corrupt cached entries {}: {}", entries, e.getMessage());
            return Optional.empty();
        }
    }

    /// Store entries with the token of the snapshot they were computed from.
    ///
    /// The old token is removed first, so an interrupted store leaves a miss behind,
    /// never new entries paired with an old token.
    /// @param collection the collection identity
    /// @param token the token computed before detection ran
    /// @param entries the detected entries
    /// @throws IOException if the files cannot be written
    public void store(String collection, FreshnessToken token, List<ExcessiveKey> entries) throws IOException {
        Files.createDirectories(directory);
        Files.deleteIfExists(tokenPath(collection));
        try (AtomicFileOutput out = AtomicFileOutput.create(entriesPath(collection))) {
            ExcessiveKeyFile.write(entries, out.stream());
            out.commit();
        }
        try (AtomicFileOutput out = AtomicFileOutput.create(tokenPath(collection))) {
            Writer writer = new OutputStreamWriter(out.stream(), StandardCharsets.UTF_8);
            GSON.toJson(token, writer);
            writer.flush();
            out.commit();
        }
        logger.info("Cached {} excessive keys for {}", entries.size(), collection);
    }

    /// @param collection the collection identity
    /// @return the file name stem used for the collection's cache files
    /// @throws IllegalArgumentException if the name is null or empty
    public static String fileName(String collection) {
        if (collection == null || collection.isEmpty()) {
            throw new IllegalArgumentException("Collection name for the cache cannot be empty");
        }
        byte[] bytes = collection.getBytes(StandardCharsets.UTF_8);
        StringBuilder sb = new StringBuilder(bytes.length);
        for (int i = 0; i < bytes.length; i++) {
            int b = bytes[i] & 0xff;
            if (isPlain(b) || (b == '.' && i > 0)) {
                sb.append((char) b);
            } else {
                sb.append('%').append(HEX[b >> 4]).append(HEX[b & 0xf]);
            }
        }
        return sb.toString();
    }

    private static boolean isPlain(int b) {
        return (b >= 'a' && b <= 'z') || (b >= 'A' && b <= 'Z') || (b >= '0' && b <= '9') || b == '-' || b == '_';
    }
}
