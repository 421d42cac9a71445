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
 * Thrown by a compression pass when one of its entries could not be read or compressed.
 */
public class EntryCompressionException extends ZipArchiveException {

    private static final long serialVersionUID = 1L;

    private final String archivePath;

    public EntryCompressionException(String archivePath, Throwable cause) {
        super("Failed to compress entry '" + archivePath + "': " + cause.getMessage(), cause);
        this.archivePath = archivePath;
    }

    /**
     * @return The name of the entry inside the archive
     */
    public String getArchivePath() {
        return archivePath;
    }
}
