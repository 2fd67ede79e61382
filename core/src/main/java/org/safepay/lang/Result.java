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
import org.safepay.lang.Functions.Fn2;
import org.safepay.lang.Functions.Fn3;
import org.safepay.lang.Functions.Fn4;
import org.safepay.lang.Functions.Fn5;
import org.safepay.lang.Functions.Fn6;
import org.safepay.lang.Functions.ThrowingFn0;
import org.safepay.lang.utils.Causes;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.function.Consumer;
import java.util.function.Predicate;

/**
 * Representation of the result of an operation which may fail: either {@link Success} with a value or
 * {@link Failure} with a {@link Cause}.
 * <p>
 * Chained transformations ({@link #map(Fn1)}, {@link #flatMap(Fn1)}, {@link #filter(Fn1, Predicate)}) stop at the
 * first failure. Independent results are combined with the {@code all(...)} family, which always inspects every
 * result and reports all failures together, in argument order:
 * <pre>{@code
 * Result.all(cardNumber(raw.number()),
 *            expiryDate(raw.month(), raw.year()),
 *            cvv(raw.cvv()))
 *       .map(CreditCard::new);
 * }</pre>
 *
 * @param <T> Type of the success value
 */
public sealed interface Result<T> permits Result.Success, Result.Failure {

    /**
     * Handle both possible states of the instance.
     *
     * @param failureMapper called with the cause if the instance is a failure
     * @param successMapper called with the value if the instance is a success
     */
    <R> R fold(Fn1<? extends R, ? super Cause> failureMapper, Fn1<? extends R, ? super T> successMapper);

    default <U> Result<U> map(Fn1<U, ? super T> mapper) {
        return this.<Result<U>>fold(Result::failure, value -> success(mapper.apply(value)));
    }

    default <U> Result<U> flatMap(Fn1<Result<U>, ? super T> mapper) {
        return this.<Result<U>>fold(Result::failure, value -> mapper.apply(value));
    }

    /**
     * Transform the cause of a failure. Success is passed through unchanged.
     */
    default Result<T> mapError(Fn1<Cause, ? super Cause> mapper) {
        return this.<Result<T>>fold(cause -> failure(mapper.apply(cause)), value -> this);
    }

    /**
     * Keep the success only if the value satisfies the predicate, otherwise turn it into a failure
     * built from the value.
     */
    default Result<T> filter(Fn1<Cause, ? super T> causeMapper, Predicate<? super T> predicate) {
        return this.<Result<T>>fold(cause -> this,
                                    value -> predicate.test(value)
                                             ? this
                                             : failure(causeMapper.apply(value)));
    }

    default Result<T> onSuccess(Consumer<? super T> consumer) {
        fold(cause -> null, value -> {
            consumer.accept(value);
            return null;
        });
        return this;
    }

    default Result<T> onSuccessRun(Runnable action) {
        return onSuccess(value -> action.run());
    }

    default Result<T> onFailure(Consumer<? super Cause> consumer) {
        fold(cause -> {
            consumer.accept(cause);
            return null;
        }, value -> null);
        return this;
    }

    default Result<T> onFailureRun(Runnable action) {
        return onFailure(cause -> action.run());
    }

    default boolean isSuccess() {
        return fold(cause -> false, value -> true);
    }

    default boolean isFailure() {
        return !isSuccess();
    }

    /**
     * Elementary causes of the failure in the order they were produced, or an empty list for success.
     */
    default List<Cause> causes() {
        return this.<List<Cause>>fold(Cause::causes, value -> List.of());
    }

    default Option<T> option() {
        return this.<Option<T>>fold(cause -> Option.none(), Option::option);
    }

    default T or(T replacement) {
        return fold(cause -> replacement, value -> value);
    }

    /**
     * Return the success value or throw {@link IllegalStateException} carrying the failure message.
     * Intended for tests and for code which already checked the state.
     */
    default T unwrap() {
        return fold(cause -> {
            throw new IllegalStateException("Unwrap of failure: " + cause.message());
        }, value -> value);
    }

    static <T> Result<T> success(T value) {
        return new Success<>(value);
    }

    static <T> Result<T> failure(Cause cause) {
        return new Failure<>(Objects.requireNonNull(cause, "Failure requires a cause"));
    }

    /**
     * Run code which may throw and convert the thrown exception into a failure.
     */
    static <T> Result<T> lift(Fn1<? extends Cause, ? super Throwable> exceptionMapper, ThrowingFn0<T> supplier) {
        try {
            return success(supplier.apply());
        } catch (Throwable e) {
            return failure(exceptionMapper.apply(e));
        }
    }

    /**
     * Collect a list of results into a result of list. Every element is inspected; if any of them is a failure,
     * the returned failure contains causes of all failed elements in list order.
     */
    static <T> Result<List<T>> allOf(List<Result<T>> results) {
        return combine(List.copyOf(results),
                       () -> {
                           var values = new ArrayList<T>(results.size());
                           results.forEach(result -> values.add(result.unwrap()));
                           return success(List.copyOf(values));
                       });
    }

    static <T1> Mapper1<T1> all(Result<T1> value1) {
        return new Mapper1<>(value1);
    }

    static <T1, T2> Mapper2<T1, T2> all(Result<T1> value1, Result<T2> value2) {
        return new Mapper2<>(value1, value2);
    }

    static <T1, T2, T3> Mapper3<T1, T2, T3> all(Result<T1> value1, Result<T2> value2, Result<T3> value3) {
        return new Mapper3<>(value1, value2, value3);
    }

    static <T1, T2, T3, T4> Mapper4<T1, T2, T3, T4> all(Result<T1> value1,
                                                        Result<T2> value2,
                                                        Result<T3> value3,
                                                        Result<T4> value4) {
        return new Mapper4<>(value1, value2, value3, value4);
    }

    static <T1, T2, T3, T4, T5> Mapper5<T1, T2, T3, T4, T5> all(Result<T1> value1,
                                                                Result<T2> value2,
                                                                Result<T3> value3,
                                                                Result<T4> value4,
                                                                Result<T5> value5) {
        return new Mapper5<>(value1, value2, value3, value4, value5);
    }

    static <T1, T2, T3, T4, T5, T6> Mapper6<T1, T2, T3, T4, T5, T6> all(Result<T1> value1,
                                                                        Result<T2> value2,
                                                                        Result<T3> value3,
                                                                        Result<T4> value4,
                                                                        Result<T5> value5,
                                                                        Result<T6> value6) {
        return new Mapper6<>(value1, value2, value3, value4, value5, value6);
    }

    /**
     * Inspect all results; call the supplier only when all of them are successful.
     */
    private static <R> Result<R> combine(List<? extends Result<?>> results, Fn0<Result<R>> onSuccess) {
        var causes = new ArrayList<Cause>();
        results.forEach(result -> causes.addAll(result.causes()));

        return causes.isEmpty()
               ? onSuccess.apply()
               : failure(Causes.composite(causes));
    }

    record Success<T>(T value) implements Result<T> {
        @Override
        public <R> R fold(Fn1<? extends R, ? super Cause> failureMapper, Fn1<? extends R, ? super T> successMapper) {
            return successMapper.apply(value);
        }

        @Override
        public String toString() {
            return "Success(" + value + ")";
        }
    }

    record Failure<T>(Cause cause) implements Result<T> {
        @Override
        public <R> R fold(Fn1<? extends R, ? super Cause> failureMapper, Fn1<? extends R, ? super T> successMapper) {
            return failureMapper.apply(cause);
        }

        @Override
        public String toString() {
            return "Failure(" + cause + ")";
        }
    }

    record Mapper1<T1>(Result<T1> value1) {
        public <R> Result<R> flatMap(Fn1<Result<R>, T1> mapper) {
            return combine(List.of(value1), () -> mapper.apply(value1.unwrap()));
        }

        public <R> Result<R> map(Fn1<R, T1> mapper) {
            return flatMap(v1 -> success(mapper.apply(v1)));
        }
    }

    record Mapper2<T1, T2>(Result<T1> value1, Result<T2> value2) {
        public <R> Result<R> flatMap(Fn2<Result<R>, T1, T2> mapper) {
            return combine(List.of(value1, value2),
                           () -> mapper.apply(value1.unwrap(), value2.unwrap()));
        }

        public <R> Result<R> map(Fn2<R, T1, T2> mapper) {
            return flatMap((v1, v2) -> success(mapper.apply(v1, v2)));
        }
    }

    record Mapper3<T1, T2, T3>(Result<T1> value1, Result<T2> value2, Result<T3> value3) {
        public <R> Result<R> flatMap(Fn3<Result<R>, T1, T2, T3> mapper) {
            return combine(List.of(value1, value2, value3),
                           () -> mapper.apply(value1.unwrap(), value2.unwrap(), value3.unwrap()));
        }

        public <R> Result<R> map(Fn3<R, T1, T2, T3> mapper) {
            return flatMap((v1, v2, v3) -> success(mapper.apply(v1, v2, v3)));
        }
    }

    record Mapper4<T1, T2, T3, T4>(Result<T1> value1, Result<T2> value2, Result<T3> value3, Result<T4> value4) {
        public <R> Result<R> flatMap(Fn4<Result<R>, T1, T2, T3, T4> mapper) {
            return combine(List.of(value1, value2, value3, value4),
                           () -> mapper.apply(value1.unwrap(), value2.unwrap(), value3.unwrap(), value4.unwrap()));
        }

        public <R> Result<R> map(Fn4<R, T1, T2, T3, T4> mapper) {
            return flatMap((v1, v2, v3, v4) -> success(mapper.apply(v1, v2, v3, v4)));
        }
    }

    record Mapper5<T1, T2, T3, T4, T5>(Result<T1> value1,
                                       Result<T2> value2,
                                       Result<T3> value3,
                                       Result<T4> value4,
                                       Result<T5> value5) {
        public <R> Result<R> flatMap(Fn5<Result<R>, T1, T2, T3, T4, T5> mapper) {
            return combine(List.of(value1, value2, value3, value4, value5),
                           () -> mapper.apply(value1.unwrap(),
                                              value2.unwrap(),
                                              value3.unwrap(),
                                              value4.unwrap(),
                                              value5.unwrap()));
        }

        public <R> Result<R> map(Fn5<R, T1, T2, T3, T4, T5> mapper) {
            return flatMap((v1, v2, v3, v4, v5) -> success(mapper.apply(v1, v2, v3, v4, v5)));
        }
    }

    record Mapper6<T1, T2, T3, T4, T5, T6>(Result<T1> value1,
                                           Result<T2> value2,
                                           Result<T3> value3,
                                           Result<T4> value4,
                                           Result<T5> value5,
                                           Result<T6> value6) {
        public <R> Result<R> flatMap(Fn6<Result<R>, T1, T2, T3, T4, T5, T6> mapper) {
            return combine(List.of(value1, value2, value3, value4, value5, value6),
                           () -> mapper.apply(value1.unwrap(),
                                              value2.unwrap(),
                                              value3.unwrap(),
                                              value4.unwrap(),
                                              value5.unwrap(),
                                              value6.unwrap()));
        }

        public <R> Result<R> map(Fn6<R, T1, T2, T3, T4, T5, T6> mapper) {
            return flatMap((v1, v2, v3, v4, v5, v6) -> success(mapper.apply(v1, v2, v3, v4, v5, v6)));
        }
    }
}
