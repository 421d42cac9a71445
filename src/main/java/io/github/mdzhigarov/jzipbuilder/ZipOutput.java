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

import java.io.IOException;
import java.io.OutputStream;
import java.nio.ByteBuffer;
import java.nio.channels.Channels;
import java.nio.channels.SeekableByteChannel;
import java.nio.channels.WritableByteChannel;

/**
 * A byte sink that tracks the offset of the next byte written.
 * Offsets are needed for the central directory and the end of central directory record.
 */
final class ZipOutput {

    private final WritableByteChannel channel;
    private long position;

    private ZipOutput(WritableByteChannel channel, long startPosition) {
        this.channel = channel;
        this.position = startPosition;
    }

    /**
     * Offsets start at the channel's current position.
     */
    static ZipOutput of(SeekableByteChannel channel) throws IOException {
        return new ZipOutput(channel, channel.position());
    }

    /**
     * Offsets start at 0. The stream is neither flushed nor closed by this class.
     */
    static ZipOutput of(OutputStream stream) {
        return new ZipOutput(Channels.newChannel(stream), 0);
    }

    long position() {
        return position;
    }

    void write(ByteBuffer buffer) throws IOException {
        while (buffer.hasRemaining()) {
            position += channel.write(buffer);
        }
    }
}
