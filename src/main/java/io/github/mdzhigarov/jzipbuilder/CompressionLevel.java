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

import java.util.zip.Deflater;

/**
 * A DEFLATE compression level between 0 (no compression) and 9 (best compression).
 * Instances are immutable and only meaningful for {@link CompressionType#DEFLATE} entries.
 */
public final class CompressionLevel implements Comparable<CompressionLevel> {

    public static final int MIN_LEVEL = 0;
    public static final int MAX_LEVEL = 9;

    private static final CompressionLevel[] LEVELS = new CompressionLevel[MAX_LEVEL + 1];

    static {
        for (int i = MIN_LEVEL; i <= MAX_LEVEL; i++) {
            LEVELS[i] = new CompressionLevel(i);
        }
    }

    private final int level;

    private CompressionLevel(int level) {
        this.level = level;
    }

    /**
     * Returns the compression level for the given value.
     *
     * @param level The level, from 0 to 9 inclusive
     * @return The compression level
     * @throws InvalidCompressionLevelException if the value is outside of 0..9
     */
    public static CompressionLevel of(int level) {
        if (level < MIN_LEVEL || level > MAX_LEVEL) {
            throw new InvalidCompressionLevelException(level);
        }
        return LEVELS[level];
    }

    /**
     * @return Level 0, the data is deflated without being compressed
     */
    public static CompressionLevel none() {
        return LEVELS[0];
    }

    /**
     * @return Level 1, fastest compression
     */
    public static CompressionLevel fast() {
        return LEVELS[1];
    }

    /**
     * @return Level 6, moderate compression at a moderate speed
     */
    public static CompressionLevel balanced() {
        return LEVELS[6];
    }

    /**
     * @return Level 9, best compression ratio at the cost of speed
     */
    public static CompressionLevel best() {
        return LEVELS[9];
    }

    /**
     * @return The raw level value
     */
    public int getValue() {
        return level;
    }

    Deflater newDeflater() {
        // raw DEFLATE stream, ZIP entries carry no zlib wrapper
        return new Deflater(level, true);
    }

    @Override
    public int compareTo(CompressionLevel other) {
        return Integer.compare(level, other.level);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof CompressionLevel)) {
            return false;
        }
        return level == ((CompressionLevel) o).level;
    }

    @Override
    public int hashCode() {
        return Integer.hashCode(level);
    }

    @Override
    public String toString() {
        return "CompressionLevel{" + level + "}";
    }
}
