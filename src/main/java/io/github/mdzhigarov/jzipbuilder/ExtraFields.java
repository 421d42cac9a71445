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
import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.Collections;
import java.util.List;

/**
 * An immutable collection of {@link ExtraField}s belonging to one entry.
 * Insertion order is kept so that the written archive is deterministic.
 */
public final class ExtraFields {

    private static final ExtraFields EMPTY = new ExtraFields(Collections.emptyList());

    private final List<ExtraField> values;

    private ExtraFields(List<ExtraField> values) {
        this.values = values;
    }

    /**
     * @return A collection without fields
     */
    public static ExtraFields empty() {
        return EMPTY;
    }

    public static ExtraFields of(ExtraField... fields) {
        return of(Arrays.asList(fields));
    }

    public static ExtraFields of(Collection<? extends ExtraField> fields) {
        if (fields.isEmpty()) {
            return EMPTY;
        }
        List<ExtraField> copy = new ArrayList<>(fields.size());
        for (ExtraField field : fields) {
            if (field == null) {
                throw new NullPointerException("extra field must not be null");
            }
            copy.add(field);
        }
        return new ExtraFields(Collections.unmodifiableList(copy));
    }

    /**
     * Builds the fields describing a file or directory from its filesystem metadata:
     * extended timestamp and ownership on Unix-like systems, NTFS times on Windows.
     *
     * @param path The file or directory
     * @return The fields, empty when the platform exposes no suitable metadata
     * @throws IOException if the metadata cannot be read
     */
    public static ExtraFields fromFilesystem(Path path) throws IOException {
        return FilesystemMetadata.extraFields(path);
    }

    /**
     * @return The fields in insertion order
     */
    public List<ExtraField> getValues() {
        return values;
    }

    public boolean isEmpty() {
        return values.isEmpty();
    }

    /**
     * Returns the size of the whole extra field block, as written into the header's
     * extra field length. Each field contributes its 4-byte header plus its data.
     *
     * @param central {@code true} for the central directory, {@code false} for the local header
     */
    public long totalLength(boolean central) {
        long length = 0;
        for (ExtraField field : values) {
            length += field.encodedLength(central);
        }
        return length;
    }

    /**
     * Encodes the block for the given placement.
     */
    byte[] toBytes(boolean central) throws ArchiveCapacityException {
        int length = ArchiveCapacityException.checkU16(totalLength(central), "Extra field length");
        ByteBuffer buffer = ByteBuffer.allocate(length).order(ByteOrder.LITTLE_ENDIAN);
        for (ExtraField field : values) {
            field.writeTo(buffer, central);
        }
        return buffer.array();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof ExtraFields)) {
            return false;
        }
        return values.equals(((ExtraFields) o).values);
    }

    @Override
    public int hashCode() {
        return values.hashCode();
    }

    @Override
    public String toString() {
        return "ExtraFields" + values;
    }
}
