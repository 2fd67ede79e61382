package org.safepay.domain.value;

import org.safepay.lang.Result;
import org.safepay.lang.Rules;

import static org.safepay.domain.error.ValidationError.Rule.ABA;
import static org.safepay.domain.error.ValidationError.Rule.LENGTH;
import static org.safepay.domain.error.ValidationError.Rule.NON_DIGIT;
import static org.safepay.domain.error.ValidationError.checksumError;
import static org.safepay.domain.error.ValidationError.shapeError;

/// Nine-digit ABA bank routing number with a valid check digit.
public final class RoutingNumber extends ValueObject<String> {
    private static final int LENGTH_DIGITS = 9;

    private RoutingNumber(String value) {
        super(value);
    }

    public static Result<RoutingNumber> routingNumber(String field, String raw) {
        return routingNumber(field, raw, Evaluation.ACCUMULATING);
    }

    public static Result<RoutingNumber> routingNumber(String field, String raw, Evaluation evaluation) {
        return evaluation.apply(rules(field), Digits.normalize(raw))
                         .map(RoutingNumber::new);
    }

    private static Rules<String> rules(String field) {
        return Rules.<String>rules()
                    .ensure(Digits::allDigits,
                            text -> shapeError(field, NON_DIGIT, field + " must contain only digits (spaces allowed)"))
                    .ensure(text -> text.length() == LENGTH_DIGITS,
                            text -> shapeError(field, LENGTH, field + " must be exactly " + LENGTH_DIGITS + " digits long"))
                    .ensureWhen(text -> Digits.allDigits(text) && text.length() == LENGTH_DIGITS,
                                Digits::abaValid,
                                text -> checksumError(field, ABA, field + " failed ABA routing checksum"));
    }
}
