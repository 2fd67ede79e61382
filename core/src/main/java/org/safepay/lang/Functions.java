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

/**
 * Functional interfaces used across the library.
 * <p>
 * The result type always comes first in the type parameter list, so {@code Fn1<Cause, String>} reads as
 * "a function from String to Cause".
 */
public interface Functions {
    @FunctionalInterface
    interface Fn0<R> {
        R apply();
    }

    @FunctionalInterface
    interface ThrowingFn0<R> {
        R apply() throws Throwable;
    }

    @FunctionalInterface
    interface Fn1<R, T1> {
        R apply(T1 param1);

        default <N> Fn1<N, T1> then(Fn1<N, R> function) {
            return param1 -> function.apply(apply(param1));
        }
    }

    @FunctionalInterface
    interface Fn2<R, T1, T2> {
        R apply(T1 param1, T2 param2);
    }

    @FunctionalInterface
    interface Fn3<R, T1, T2, T3> {
        R apply(T1 param1, T2 param2, T3 param3);
    }

    @FunctionalInterface
    interface Fn4<R, T1, T2, T3, T4> {
        R apply(T1 param1, T2 param2, T3 param3, T4 param4);
    }

    @FunctionalInterface
    interface Fn5<R, T1, T2, T3, T4, T5> {
        R apply(T1 param1, T2 param2, T3 param3, T4 param4, T5 param5);
    }

    @FunctionalInterface
    interface Fn6<R, T1, T2, T3, T4, T5, T6> {
        R apply(T1 param1, T2 param2, T3 param3, T4 param4, T5 param5, T6 param6);
    }
}
