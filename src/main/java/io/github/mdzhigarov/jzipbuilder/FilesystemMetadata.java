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
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.attribute.BasicFileAttributes;
import java.nio.file.attribute.DosFileAttributes;
import java.nio.file.attribute.FileTime;
import java.util.Map;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Reads entry attributes and extra fields from filesystem metadata.
 */
final class FilesystemMetadata {

    private static final Logger logger = LoggerFactory.getLogger(FilesystemMetadata.class);

    private static final String UNIX_ATTRIBUTES = "unix:mode,uid,gid,lastModifiedTime,lastAccessTime,ctime";

    private static final int DOS_READ_ONLY = 0x01;
    private static final int DOS_HIDDEN = 0x02;
    private static final int DOS_SYSTEM = 0x04;
    private static final int DOS_DIRECTORY = 0x10;
    private static final int DOS_ARCHIVE = 0x20;
    private static final int DOS_NORMAL = 0x80;

    private FilesystemMetadata() {
    }

    private static boolean supportsView(Path path, String view) {
        Set<String> views = path.getFileSystem().supportedFileAttributeViews();
        return views.contains(view);
    }

    /**
     * Returns the 16-bit platform attributes of a file: the Unix mode where available,
     * the DOS attribute bits on Windows, otherwise the platform default.
     */
    static int attributes(Path path) throws IOException {
        if (supportsView(path, "unix")) {
            Object mode = Files.getAttribute(path, "unix:mode");
            return ((Integer) mode) & 0xFFFF;
        }
        if (supportsView(path, "dos")) {
            DosFileAttributes dos = Files.readAttributes(path, DosFileAttributes.class);
            int bits = 0;
            if (dos.isReadOnly()) {
                bits |= DOS_READ_ONLY;
            }
            if (dos.isHidden()) {
                bits |= DOS_HIDDEN;
            }
            if (dos.isSystem()) {
                bits |= DOS_SYSTEM;
            }
            if (dos.isDirectory()) {
                bits |= DOS_DIRECTORY;
            }
            if (dos.isArchive()) {
                bits |= DOS_ARCHIVE;
            }
            return bits == 0 ? DOS_NORMAL : bits;
        }
        Platform platform = Platform.current();
        return Files.isDirectory(path) ? platform.defaultDirectoryAttributes() : platform.defaultFileAttributes();
    }

    /**
     * Builds extra fields from the file's timestamps and ownership.
     */
    static ExtraFields extraFields(Path path) throws IOException {
        if (supportsView(path, "unix")) {
            Map<String, Object> attrs = Files.readAttributes(path, UNIX_ATTRIBUTES);
            ExtraField timestamp = ExtraField.extendedTimestamp(
                    epochSeconds((FileTime) attrs.get("lastModifiedTime")),
                    epochSeconds((FileTime) attrs.get("lastAccessTime")),
                    epochSeconds((FileTime) attrs.get("ctime")));
            ExtraField ownership = ExtraField.unixOwnership((Integer) attrs.get("uid"), (Integer) attrs.get("gid"));
            return ExtraFields.of(timestamp, ownership);
        }
        if (Platform.current() == Platform.WINDOWS) {
            BasicFileAttributes basic = Files.readAttributes(path, BasicFileAttributes.class);
            return ExtraFields.of(ExtraField.ntfs(
                    ExtraField.Ntfs.toNtfsTicks(basic.lastModifiedTime()),
                    ExtraField.Ntfs.toNtfsTicks(basic.lastAccessTime()),
                    ExtraField.Ntfs.toNtfsTicks(basic.creationTime())));
        }
        logger.debug("No timestamp metadata available for {}", path);
        return ExtraFields.empty();
    }

    private static Integer epochSeconds(FileTime time) {
        if (time == null) {
            return null;
        }
        // 32-bit field, same truncation as Info-ZIP
        return (int) time.to(java.util.concurrent.TimeUnit.SECONDS);
    }
}
