package org.safepay.domain.value;

import org.safepay.lang.Result;
import org.safepay.lang.Rules;

import static org.safepay.domain.error.ValidationError.Rule.EMPTY;
import static org.safepay.domain.error.ValidationError.Rule.MAX_LENGTH;
import static org.safepay.domain.error.ValidationError.Rule.MIN_LENGTH;
import static org.safepay.domain.error.ValidationError.Rule.NON_DIGIT;
import static org.safepay.domain.error.ValidationError.shapeError;

/// Non-empty string of decimal digits, such as a CVV or a bank account number.
///
/// Input is trimmed and interior spaces are removed before validation, so `"123 456"` yields `"123456"`.
/// By default all violated rules are reported together: a value may be both non-numeric and too long.
/// [Evaluation#FAIL_FAST] reports only the first of them.
public final class DigitString extends ValueObject<String> {
    private DigitString(String value) {
        super(value);
    }

    public static Result<DigitString> digitString(String field, String raw) {
        return digitString(field, raw, LengthBounds.unbounded());
    }

    public static Result<DigitString> digitString(String field, String raw, LengthBounds bounds) {
        return digitString(field, raw, bounds, Evaluation.ACCUMULATING);
    }

    public static Result<DigitString> digitString(String field,
                                                  String raw,
                                                  LengthBounds bounds,
                                                  Evaluation evaluation) {
        return evaluation.apply(rules(field, bounds), Digits.normalize(raw))
                         .map(DigitString::new);
    }

    /// Rules for the normalized text, in evaluation order.
    private static Rules<String> rules(String field, LengthBounds bounds) {
        return Rules.<String>rules()
                    .ensure(Digits::allDigits,
                            text -> shapeError(field, NON_DIGIT, field + " must contain only digits (spaces allowed)"))
                    .ensure(text -> !text.isEmpty(),
                            text -> shapeError(field, EMPTY, field + " must not be empty"))
                    .ensure(text -> bounds.fitsMax(text.length()),
                            text -> shapeError(field, MAX_LENGTH, field + " must be at most " + bounds.max().unwrap() + " digits"))
                    .ensure(text -> bounds.fitsMin(text.length()),
                            text -> shapeError(field, MIN_LENGTH, field + " must be at least " + bounds.min().unwrap() + " digits"));
    }
}
