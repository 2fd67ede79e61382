/*
 *  Copyright (c) 2020-2025 Sergiy Yevtushenko.
 *
 *  Licensed under the Apache License, Version 2.0 (the "License");
 *  you may not use this file except in compliance with the License.
 *  You may obtain a copy of the License at
 *
 *      http://www.apache.org/licenses/LICENSE-2.0
 *
 *  Unless required by applicable law or agreed to in writing, software
 *  distributed under the License is distributed on an "AS IS" BASIS,
 *  WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 *  See the License for the specific language governing permissions and
 *  limitations under the License.
 *
 */

package org.safepay.lang;

import java.util.List;

/**
 * Basic interface for failure causes.
 * <p>
 * A cause is a plain value describing why an operation failed. Several causes produced by independent
 * checks are combined into a {@link Causes.CompositeCause}, so a single failed {@link Result} may carry
 * any number of them.
 */
public interface Cause {
    /**
     * Human-readable description of the failure.
     */
    String message();

    /**
     * All elementary causes represented by this instance, in the order they were produced.
     * The returned list is never empty; a plain cause returns a list containing only itself.
     */
    default List<Cause> causes() {
        return List.of(this);
    }

    /**
     * Wrap this cause into a failed {@link Result}.
     */
    default <T> Result<T> result() {
        return Result.failure(this);
    }
}
