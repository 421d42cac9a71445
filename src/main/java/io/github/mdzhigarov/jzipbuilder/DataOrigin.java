/*
 * Copyright 2024 mdzhigarov
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package io.github.mdzhigarov.jzipbuilder;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.nio.ByteBuffer;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Objects;

/**
 * Where the bytes of a queued entry come from. Fixed when the entry is registered.
 */
abstract class DataOrigin {

    static final long UNKNOWN_SIZE = -1;

    /**
     * Opens the source. Called once, by the worker compressing the entry, which closes the stream.
     */
    abstract InputStream open() throws IOException;

    /**
     * @return The expected number of bytes, or {@link #UNKNOWN_SIZE}
     */
    abstract long sizeHint() throws IOException;

    /**
     * Resolves the attributes of the entry when none were configured.
     */
    int defaultAttributes() throws IOException {
        return Platform.current().defaultFileAttributes();
    }

    /**
     * Resolves the extra fields of the entry when none were configured.
     */
    ExtraFields defaultExtraFields() throws IOException {
        return ExtraFields.empty();
    }

    static DataOrigin filesystem(Path path) {
        return new FilesystemOrigin(path);
    }

    static DataOrigin buffer(ByteBuffer buffer) {
        return new BufferOrigin(buffer);
    }

    static DataOrigin stream(InputStream stream) {
        return new StreamOrigin(stream);
    }

    /**
     * A file read when the entry is compressed. Attributes and extra fields come from its metadata.
     */
    static final class FilesystemOrigin extends DataOrigin {
        private final Path path;

        private FilesystemOrigin(Path path) {
            this.path = Objects.requireNonNull(path, "path");
        }

        Path getPath() {
            return path;
        }

        @Override
        InputStream open() throws IOException {
            return Files.newInputStream(path);
        }

        @Override
        long sizeHint() throws IOException {
            return Files.size(path);
        }

        @Override
        int defaultAttributes() throws IOException {
            return FilesystemMetadata.attributes(path);
        }

        @Override
        ExtraFields defaultExtraFields() throws IOException {
            return FilesystemMetadata.extraFields(path);
        }

        @Override
        public String toString() {
            return "file " + path;
        }
    }

    /**
     * Bytes held in memory. Covers both caller-owned arrays and borrowed buffer slices.
     */
    static final class BufferOrigin extends DataOrigin {
        private final ByteBuffer buffer;

        private BufferOrigin(ByteBuffer buffer) {
            // own position and limit, the caller's buffer state is left untouched
            this.buffer = Objects.requireNonNull(buffer, "buffer").duplicate();
        }

        @Override
        InputStream open() {
            if (buffer.hasArray()) {
                return new ByteArrayInputStream(buffer.array(), buffer.arrayOffset() + buffer.position(),
                        buffer.remaining());
            }
            byte[] copy = new byte[buffer.remaining()];
            buffer.duplicate().get(copy);
            return new ByteArrayInputStream(copy);
        }

        @Override
        long sizeHint() {
            return buffer.remaining();
        }

        @Override
        public String toString() {
            return buffer.remaining() + " bytes in memory";
        }
    }

    /**
     * An arbitrary stream, read to its end. The size is only known afterwards.
     */
    static final class StreamOrigin extends DataOrigin {
        private final InputStream stream;

        private StreamOrigin(InputStream stream) {
            this.stream = Objects.requireNonNull(stream, "stream");
        }

        @Override
        InputStream open() {
            return stream;
        }

        @Override
        long sizeHint() {
            return UNKNOWN_SIZE;
        }

        @Override
        public String toString() {
            return "stream";
        }
    }
}
