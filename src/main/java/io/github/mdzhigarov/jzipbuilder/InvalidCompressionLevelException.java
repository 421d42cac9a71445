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
 * Thrown when a compression level outside of 0..9 is requested.
 */
public class InvalidCompressionLevelException extends IllegalArgumentException {

    private static final long serialVersionUID = 1L;

    private final int value;

    public InvalidCompressionLevelException(int value) {
        super("Invalid compression level number: " + value);
        this.value = value;
    }

    /**
     * @return The rejected value
     */
    public int getValue() {
        return value;
    }
}
