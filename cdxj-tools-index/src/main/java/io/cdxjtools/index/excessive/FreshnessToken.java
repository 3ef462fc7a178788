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

import com.google.gson.annotations.SerializedName;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.nio.ByteBuffer;
import java.nio.channels.FileChannel;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.security.DigestInputStream;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;
import java.util.Objects;

/// Identifies the master file snapshot, and the threshold, that a list of excessive-key
/// entries was computed from.
///
/// Cached entries are reused only while a freshly computed token equals the stored one.
/// The token covers the file size, its last-modified time, a SHA-256 digest (sampled or
/// full, see {@link DigestMode}) and the detection threshold.
///
/// ```json
/// {
///   "version": 1,
///   "size": 123456789,
///   "last_modified_millis": 1700000000000,
///   "digest_mode": "SAMPLED",
///   "digest": "sha256:9f86d081...",
///   "threshold": 1000
/// }
/// ```
public final class FreshnessToken {

    public static final int CURRENT_VERSION = 1;

    static final int SAMPLE_BYTES = 1 << 20;
    private static final String DIGEST_PREFIX = "sha256:";

    @SerializedName("version")
    private final int version;

    @SerializedName("size")
    private final long size;

    @SerializedName("last_modified_millis")
    private final long lastModifiedMillis;

    @SerializedName("digest_mode")
    private final DigestMode digestMode;

    @SerializedName("digest")
    private final String digest;

    @SerializedName("threshold")
    private final long threshold;

    FreshnessToken(int version, long size, long lastModifiedMillis, DigestMode digestMode, String digest,
                   long threshold) {
        this.version = version;
        this.size = size;
        this.lastModifiedMillis = lastModifiedMillis;
        this.digestMode = digestMode;
        this.digest = digest;
        this.threshold = threshold;
    }

    /// Compute the token of a master file as it is now.
    /// @param master the master file
    /// @param threshold the detection threshold the entries are, or will be, computed with
    /// @param mode how much of the file to hash
    /// @return the token
    /// @throws IOException if the file cannot be read
    public static FreshnessToken compute(Path master, long threshold, DigestMode mode) throws IOException {
        long size = Files.size(master);
        long lastModified = Files.getLastModifiedTime(master).toMillis();
        MessageDigest sha = sha256();
        if (mode == DigestMode.FULL) {
            try (InputStream in = new DigestInputStream(Files.newInputStream(master), sha)) {
                in.transferTo(OutputStream.nullOutputStream());
            }
        } else {
            sha.update(ByteBuffer.allocate(Long.BYTES).putLong(0, size));
            try (FileChannel channel = FileChannel.open(master, StandardOpenOption.READ)) {
                hashRange(channel, sha, 0, Math.min(size, SAMPLE_BYTES));
                long tailStart = Math.max(0, size - SAMPLE_BYTES);
                hashRange(channel, sha, tailStart, size - tailStart);
            }
        }
        String digest = DIGEST_PREFIX + HexFormat.of().formatHex(sha.digest());
        return new FreshnessToken(CURRENT_VERSION, size, lastModified, mode, digest, threshold);
    }

    private static void hashRange(FileChannel channel, MessageDigest sha, long start, long length)
        throws IOException {
        ByteBuffer buffer = ByteBuffer.allocate((int) Math.min(length, 1 << 16));
        long position = start;
        long end = start + length;
        while (position < end) {
            buffer.clear();
            buffer.limit((int) Math.min(buffer.capacity(), end - position));
            int read = channel.read(buffer, position);
            if (read < 0) {
                throw new IOException("File shrank while it was being hashed");
            }
            buffer.flip();
            sha.update(buffer);
            position += read;
        }
    }

    private static MessageDigest sha256() {
        try {
            return MessageDigest.getInstance("SHA-256");
        } catch (NoSuchAlgorithmException e) {
            throw new RuntimeException("SHA-256 not available", e);
        }
    }

    public int version() {
        return version;
    }

    public long size() {
        return size;
    }

    public long lastModifiedMillis() {
        return lastModifiedMillis;
    }

    public DigestMode digestMode() {
        return digestMode;
    }

    public String digest() {
        return digest;
    }

    public long threshold() {
        return threshold;
    }

    /// Decide whether entries computed under {@code stored} are valid for this snapshot.
    ///
    /// A full digest identifies the content on its own, so the modification time is
    /// ignored and a master rebuilt with identical bytes still matches. A sampled digest
    /// does not see the middle of the file, so the modification time must match too.
    /// @param stored the token stored with cached entries
    /// @return true if the cached entries may be reused
    public boolean matches(FreshnessToken stored) {
        if (stored == null
            || version != stored.version
            || size != stored.size
            || threshold != stored.threshold
            || digestMode != stored.digestMode
            || !Objects.equals(digest, stored.digest)) {
            return false;
        }
        return digestMode == DigestMode.FULL || lastModifiedMillis == stored.lastModifiedMillis;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof FreshnessToken)) {
            return false;
        }
        FreshnessToken that = (FreshnessToken) o;
        return version == that.version
            && size == that.size
            && lastModifiedMillis == that.lastModifiedMillis
            && threshold == that.threshold
            && digestMode == that.digestMode
            && Objects.equals(digest, that.digest);
    }

    @Override
    public int hashCode() {
        return Objects.hash(version, size, lastModifiedMillis, digestMode, digest, threshold);
    }

    @Override
    public String toString() {
        return String.format("size=%d modified=%d %s %s threshold=%d",
            size, lastModifiedMillis, digestMode, digest, threshold);
    }
}
