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
 * What a compression pass does when one of its entries fails.
 */
public enum FailurePolicy {
    /**
     * The pass stops taking new entries and throws. None of the pass's entries are added.
     */
    ABORT,
    /**
     * The failed entry is logged and left out. All other entries of the pass are added.
     */
    SKIP_FAILED
}
