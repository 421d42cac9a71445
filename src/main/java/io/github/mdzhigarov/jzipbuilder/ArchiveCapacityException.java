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
 * Thrown when a value does not fit into its 16 or 32 bit header field.
 * ZIP64 is not supported, so such archives cannot be written.
 */
public class ArchiveCapacityException extends ZipArchiveException {

    private static final long serialVersionUID = 1L;

    static final long MAX_U16 = 0xFFFFL;
    static final long MAX_U32 = 0xFFFFFFFFL;

    public ArchiveCapacityException(String message) {
        super(message);
    }

    static int checkU16(long value, String what) throws ArchiveCapacityException {
        if (value < 0 || value > MAX_U16) {
            throw new ArchiveCapacityException(what + " " + value + " exceeds the 16-bit limit of " + MAX_U16);
        }
        return (int) value;
    }

    static long checkU32(long value, String what) throws ArchiveCapacityException {
        if (value < 0 || value > MAX_U32) {
            throw new ArchiveCapacityException(what + " " + value + " exceeds the 32-bit limit of " + MAX_U32);
        }
        return value;
    }
}
