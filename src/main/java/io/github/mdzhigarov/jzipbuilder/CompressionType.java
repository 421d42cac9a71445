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

/**
 * Compression methods that can be written into an archive.
 */
public enum CompressionType {
    /** Data is copied verbatim. Always used for directories. */
    STORED(0),
    /** Data is compressed with raw DEFLATE. */
    DEFLATE(8);

    private final int method;

    CompressionType(int method) {
        this.method = method;
    }

    /**
     * @return The method number written into the local and central headers (0 = stored, 8 = deflated)
     */
    public int getMethod() {
        return method;
    }
}
