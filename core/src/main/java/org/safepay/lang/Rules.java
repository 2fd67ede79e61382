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

import java.util.ArrayList;
import java.util.List;
import java.util.function.Predicate;

/**
 * Ordered, immutable set of rules applied to a single value.
 * <p>
 * The same set can be evaluated in two ways:
 * <ul>
 *     <li>{@link #all(Object)} evaluates every applicable rule and reports all violations in declaration order;</li>
 *     <li>{@link #first(Object)} stops at the first violation.</li>
 * </ul>
 * A rule added with {@link #ensureWhen(Predicate, Predicate, Fn1)} is applied only when its guard holds for the
 * value. Guards depend on the value only, never on the outcome of other rules, so a rule which must not run over
 * malformed input (for example, a checksum over non-digit text) repeats the relevant shape conditions in its guard.
 *
 * @param <T> Type of the checked value
 */
public final class Rules<T> {
    private final List<Rule<T>> rules;

    private Rules(List<Rule<T>> rules) {
        this.rules = rules;
    }

    public static <T> Rules<T> rules() {
        return new Rules<>(List.of());
    }

    /**
     * Return a new set with an additional unconditional rule.
     */
    public Rules<T> ensure(Predicate<? super T> predicate, Fn1<? extends Cause, ? super T> causeProvider) {
        return ensureWhen(value -> true, predicate, causeProvider);
    }

    /**
     * Return a new set with an additional rule applied only when {@code guard} holds.
     */
    public Rules<T> ensureWhen(Predicate<? super T> guard,
                               Predicate<? super T> predicate,
                               Fn1<? extends Cause, ? super T> causeProvider) {
        var extended = new ArrayList<>(rules);
        extended.add(new Rule<>(guard, predicate, causeProvider));
        return new Rules<>(List.copyOf(extended));
    }

    /**
     * Evaluate every rule and accumulate all violations.
     */
    public Result<T> all(T value) {
        var causes = new ArrayList<Cause>();
        rules.forEach(rule -> rule.check(value)
                                  .onPresent(causes::add));

        return causes.isEmpty()
               ? Result.success(value)
               : Causes.composite(causes).result();
    }

    /**
     * Evaluate rules in order and stop at the first violation.
     */
    public Result<T> first(T value) {
        for (var rule : rules) {
            var violation = rule.check(value);

            if (violation.isPresent()) {
                return violation.unwrap().result();
            }
        }
        return Result.success(value);
    }

    public int size() {
        return rules.size();
    }

    private record Rule<T>(Predicate<? super T> guard,
                           Predicate<? super T> predicate,
                           Fn1<? extends Cause, ? super T> causeProvider) {
        Option<Cause> check(T value) {
            if (!guard.test(value) || predicate.test(value)) {
                return Option.none();
            }
            return Option.some(causeProvider.apply(value));
        }
    }
}
