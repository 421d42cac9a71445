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

import java.util.Objects;

/**
 * Per-entry settings: compression level and type, external attributes, extra fields and comment.
 * <p>
 * Attributes and extra fields are optional. When they are not set, memory and stream entries use
 * the platform defaults, and filesystem entries take them from the file's metadata.
 */
public final class EntryOptions {

    private static final EntryOptions DEFAULTS = builder().build();

    private final CompressionLevel compressionLevel;
    private final CompressionType compressionType;
    private final Integer externalAttributes;
    private final ExtraFields extraFields;
    private final String comment;

    private EntryOptions(Builder builder) {
        this.compressionLevel = builder.compressionLevel;
        this.compressionType = builder.compressionType;
        this.externalAttributes = builder.externalAttributes;
        this.extraFields = builder.extraFields;
        this.comment = builder.comment;
    }

    /**
     * @return Deflate at the best compression level, no comment, default attributes
     */
    public static EntryOptions defaults() {
        return DEFAULTS;
    }

    public static Builder builder() {
        return new Builder();
    }

    public CompressionLevel getCompressionLevel() {
        return compressionLevel;
    }

    public CompressionType getCompressionType() {
        return compressionType;
    }

    /**
     * @return The 16-bit platform attributes, or {@code null} when not set
     */
    public Integer getExternalAttributes() {
        return externalAttributes;
    }

    /**
     * @return The extra fields, or {@code null} when not set
     */
    public ExtraFields getExtraFields() {
        return extraFields;
    }

    /**
     * @return The entry comment, or {@code null} for none
     */
    public String getComment() {
        return comment;
    }

    @Override
    public String toString() {
        return String.format("EntryOptions{level=%d, type=%s, attributes=%s, extraFields=%s, comment=%s}",
                compressionLevel.getValue(), compressionType, externalAttributes, extraFields, comment);
    }

    /**
     * A builder for {@link EntryOptions}.
     */
    public static final class Builder {
        private CompressionLevel compressionLevel = CompressionLevel.best();
        private CompressionType compressionType = CompressionType.DEFLATE;
        private Integer externalAttributes;
        private ExtraFields extraFields;
        private String comment;

        private Builder() {
        }

        public Builder compressionLevel(CompressionLevel level) {
            this.compressionLevel = Objects.requireNonNull(level, "level");
            return this;
        }

        /**
         * Shortcut for {@code compressionLevel(CompressionLevel.of(level))}.
         *
         * @throws InvalidCompressionLevelException if the level is outside of 0..9
         */
        public Builder compressionLevel(int level) {
            return compressionLevel(CompressionLevel.of(level));
        }

        public Builder compressionType(CompressionType type) {
            this.compressionType = Objects.requireNonNull(type, "type");
            return this;
        }

        /**
         * Sets the platform attributes, e.g. a Unix mode such as {@code 0100644}.
         * Only the low 16 bits are kept; they end up in the high half of the central header field.
         */
        public Builder externalAttributes(int attributes) {
            if ((attributes & ~0xFFFF) != 0) {
                throw new IllegalArgumentException("External attributes must fit in 16 bits: " + attributes);
            }
            this.externalAttributes = attributes;
            return this;
        }

        public Builder extraFields(ExtraFields extraFields) {
            this.extraFields = Objects.requireNonNull(extraFields, "extraFields");
            return this;
        }

        public Builder comment(String comment) {
            this.comment = comment;
            return this;
        }

        public EntryOptions build() {
            return new EntryOptions(this);
        }
    }
}
