package org.safepay.domain.value;

import org.safepay.lang.Result;
import org.safepay.lang.Rules;

/// How the rules of a single field are evaluated.
public enum Evaluation {
    /// Evaluate every applicable rule and report all violations in rule order.
    ACCUMULATING,
    /// Stop at the first violated rule.
    FAIL_FAST;

    <T> Result<T> apply(Rules<T> rules, T value) {
        return switch (this) {
            case ACCUMULATING -> rules.all(value);
            case FAIL_FAST -> rules.first(value);
        };
    }
}
