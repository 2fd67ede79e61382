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

package org.safepay.lang.utils;

import org.safepay.lang.Cause;
import org.safepay.lang.Functions.Fn1;

import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Frequently used variants of {@link Cause} and helpers to build and combine them.
 */
public final class Causes {
    private Causes() {}

    /**
     * Simple cause with the given message.
     */
    public static Cause cause(String message) {
        return new SimpleCause(message);
    }

    /**
     * Create a mapper which builds a cause from a single value. The template may contain either
     * {@code %s} or {@code {}} as the placeholder for the value.
     */
    public static <T> Fn1<Cause, T> forOneValue(String template) {
        var format = template.replace("{}", "%s");
        return value -> cause(String.format(format, value));
    }

    /**
     * Combine causes into one, preserving order and flattening nested composites.
     * A single elementary cause is returned as is.
     *
     * @throws IllegalArgumentException if no causes are given
     */
    public static Cause composite(List<? extends Cause> causes) {
        var flattened = new ArrayList<Cause>();
        causes.forEach(cause -> flattened.addAll(cause.causes()));

        if (flattened.isEmpty()) {
            throw new IllegalArgumentException("At least one cause is required");
        }

        return flattened.size() == 1
               ? flattened.get(0)
               : new CompositeCause(List.copyOf(flattened));
    }

    /**
     * Combine two causes, see {@link #composite(List)}.
     */
    public static Cause merge(Cause first, Cause second) {
        return composite(List.of(first, second));
    }

    public record SimpleCause(String message) implements Cause {
        @Override
        public String toString() {
            return message;
        }
    }

    /**
     * Ordered, non-empty collection of elementary causes.
     */
    public record CompositeCause(List<Cause> causes) implements Cause {
        public CompositeCause {
            if (causes.isEmpty()) {
                throw new IllegalArgumentException("Composite cause can't be empty");
            }
            causes = List.copyOf(causes);
        }

        @Override
        public String message() {
            return causes.stream()
                         .map(Cause::message)
                         .collect(Collectors.joining(", "));
        }

        @Override
        public String toString() {
            return "Composite" + causes;
        }
    }
}
