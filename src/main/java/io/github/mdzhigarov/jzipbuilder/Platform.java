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

import java.util.Locale;

/**
 * Host dependent header values: the "version made by" field and default entry attributes.
 */
enum Platform {
    UNIX(3, 0100644, 040755),
    WINDOWS(11, 128, 16),
    MACOS(19, 0100644, 040755);

    /** ZIP specification version 6.2, low byte of "version made by". */
    private static final int ZIP_FORMAT_VERSION = 62;

    private static final Platform CURRENT = detect(System.getProperty("os.name", ""));

    private final int hostId;
    private final int defaultFileAttributes;
    private final int defaultDirectoryAttributes;

    Platform(int hostId, int defaultFileAttributes, int defaultDirectoryAttributes) {
        this.hostId = hostId;
        this.defaultFileAttributes = defaultFileAttributes;
        this.defaultDirectoryAttributes = defaultDirectoryAttributes;
    }

    static Platform current() {
        return CURRENT;
    }

    static Platform detect(String osName) {
        String name = osName.toLowerCase(Locale.ROOT);
        if (name.startsWith("windows")) {
            return WINDOWS;
        }
        if (name.startsWith("mac") || name.contains("darwin")) {
            return MACOS;
        }
        // Unix is the fallback for everything else
        return UNIX;
    }

    int versionMadeBy() {
        return (hostId << 8) | ZIP_FORMAT_VERSION;
    }

    int defaultFileAttributes() {
        return defaultFileAttributes;
    }

    int defaultDirectoryAttributes() {
        return defaultDirectoryAttributes;
    }
}
