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

import org.safepay.lang.Functions.Fn0;
import org.safepay.lang.Functions.Fn1;

import java.util.Objects;
import java.util.Optional;
import java.util.function.Consumer;
import java.util.function.Predicate;

/**
 * Container for an optional value: either {@link Some} holding a non-null value or {@link None}.
 */
public sealed interface Option<T> permits Option.Some, Option.None {

    /**
     * Handle both possible states of the instance. This is the only way to branch on the state,
     * so all other methods are expressed through it.
     *
     * @param emptyMapper   called when the instance is empty
     * @param presentMapper called with the value when the instance is present
     */
    <R> R fold(Fn0<? extends R> emptyMapper, Fn1<? extends R, ? super T> presentMapper);

    default <U> Option<U> map(Fn1<U, ? super T> mapper) {
        return this.<Option<U>>fold(Option::none, value -> some(mapper.apply(value)));
    }

    default <U> Option<U> flatMap(Fn1<Option<U>, ? super T> mapper) {
        return this.<Option<U>>fold(Option::none, value -> mapper.apply(value));
    }

    default Option<T> filter(Predicate<? super T> predicate) {
        return this.<Option<T>>fold(Option::none, value -> predicate.test(value) ? this : none());
    }

    default boolean isPresent() {
        return fold(() -> false, value -> true);
    }

    default boolean isEmpty() {
        return !isPresent();
    }

    default Option<T> onPresent(Consumer<? super T> consumer) {
        fold(() -> null, value -> {
            consumer.accept(value);
            return null;
        });
        return this;
    }

    default Option<T> onEmpty(Runnable action) {
        fold(() -> {
            action.run();
            return null;
        }, value -> null);
        return this;
    }

    /**
     * Return the value or the provided replacement if the instance is empty.
     */
    default T or(T replacement) {
        return fold(() -> replacement, value -> value);
    }

    default T or(Fn0<T> supplier) {
        return fold(supplier, value -> value);
    }

    /**
     * Convert to {@link Result}, using the given cause when the instance is empty.
     */
    default Result<T> toResult(Cause cause) {
        return this.<Result<T>>fold(cause::result, Result::success);
    }

    default Optional<T> toOptional() {
        return this.<Optional<T>>fold(Optional::empty, Optional::of);
    }

    /**
     * Return the value or throw {@link IllegalStateException} if the instance is empty.
     * Intended for tests and for code which already checked presence.
     */
    default T unwrap() {
        return fold(() -> {
            throw new IllegalStateException("Unwrap of empty Option");
        }, value -> value);
    }

    static <T> Option<T> option(T value) {
        return value == null
               ? none()
               : some(value);
    }

    static <T> Option<T> from(Optional<T> optional) {
        return option(optional.orElse(null));
    }

    static <T> Option<T> some(T value) {
        return new Some<>(Objects.requireNonNull(value, "Option.some() requires a non-null value"));
    }

    @SuppressWarnings("unchecked")
    static <T> Option<T> none() {
        return (Option<T>) NONE;
    }

    record Some<T>(T value) implements Option<T> {
        @Override
        public <R> R fold(Fn0<? extends R> emptyMapper, Fn1<? extends R, ? super T> presentMapper) {
            return presentMapper.apply(value);
        }

        @Override
        public String toString() {
            return "Some(" + value + ")";
        }
    }

    record None<T>() implements Option<T> {
        @Override
        public <R> R fold(Fn0<? extends R> emptyMapper, Fn1<? extends R, ? super T> presentMapper) {
            return emptyMapper.apply();
        }

        @Override
        public String toString() {
            return "None()";
        }
    }

    @SuppressWarnings("rawtypes")
    None NONE = new None<>();
}
