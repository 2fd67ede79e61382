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

import org.safepay.lang.Functions.Fn1;
import org.safepay.lang.utils.Causes;

import java.math.BigDecimal;
import java.util.function.Predicate;
import java.util.regex.Pattern;

/**
 * Single-condition checks returning {@link Result}.
 * <p>
 * Each call checks exactly one condition, so chains built from {@code ensure} and
 * {@link Result#filter(Fn1, Predicate)} stop at the first violated condition.
 */
public interface Verify {
    /**
     * Check the value against the predicate.
     *
     * @param value         value to check
     * @param predicate     condition which must hold
     * @param causeProvider builds the failure cause from the rejected value
     */
    static <T> Result<T> ensure(T value, Predicate<? super T> predicate, Fn1<? extends Cause, ? super T> causeProvider) {
        return predicate.test(value)
               ? Result.success(value)
               : Result.failure(causeProvider.apply(value));
    }

    static <T> Result<T> ensure(T value, Predicate<? super T> predicate, Cause cause) {
        return ensure(value, predicate, rejected -> cause);
    }

    static <T> Result<T> ensure(T value, Predicate<? super T> predicate) {
        return ensure(value, predicate, Causes.forOneValue("Value '{}' does not satisfy the required condition"));
    }

    /**
     * Predicates commonly used with {@code ensure}. All of them accept {@code null} and treat it as not matching.
     */
    interface Is {
        static <T> boolean notNull(T value) {
            return value != null;
        }

        static boolean notBlank(String value) {
            return value != null && !value.isBlank();
        }

        static boolean notEmpty(String value) {
            return value != null && !value.isEmpty();
        }

        static boolean contains(String value, String fragment) {
            return value != null && value.contains(fragment);
        }

        static boolean matches(String value, Pattern pattern) {
            return value != null && pattern.matcher(value).matches();
        }

        static boolean digits(String value) {
            return value != null && value.chars().allMatch(Character::isDigit);
        }

        static boolean positive(BigDecimal value) {
            return value != null && value.signum() > 0;
        }

        static boolean nonNegative(BigDecimal value) {
            return value != null && value.signum() >= 0;
        }

        static boolean between(int value, int min, int max) {
            return value >= min && value <= max;
        }
    }
}
