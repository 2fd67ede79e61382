package org.safepay.domain.value;

import org.safepay.lang.Result;
import org.safepay.lang.Rules;

import static org.safepay.domain.error.ValidationError.Rule.EMPTY;
import static org.safepay.domain.error.ValidationError.Rule.MAX_LENGTH;
import static org.safepay.domain.error.ValidationError.Rule.MOD10;
import static org.safepay.domain.error.ValidationError.Rule.NON_DIGIT;
import static org.safepay.domain.error.ValidationError.checksumError;
import static org.safepay.domain.error.ValidationError.shapeError;

/// Digit string which passes the MOD10 (Luhn) checksum, such as a payment card number.
///
/// The checksum is evaluated only for well-formed input: non-empty, digits only and within the length limit.
/// Malformed input reports its shape errors without a checksum error.
public final class ChecksumString extends ValueObject<String> {
    private ChecksumString(String value) {
        super(value);
    }

    public static Result<ChecksumString> checksumString(String field, String raw) {
        return checksumString(field, raw, LengthBounds.unbounded(), Evaluation.ACCUMULATING);
    }

    public static Result<ChecksumString> checksumString(String field, String raw, int maxLength) {
        return checksumString(field, raw, LengthBounds.atMost(maxLength), Evaluation.ACCUMULATING);
    }

    public static Result<ChecksumString> checksumString(String field,
                                                        String raw,
                                                        int maxLength,
                                                        Evaluation evaluation) {
        return checksumString(field, raw, LengthBounds.atMost(maxLength), evaluation);
    }

    private static Result<ChecksumString> checksumString(String field,
                                                         String raw,
                                                         LengthBounds bounds,
                                                         Evaluation evaluation) {
        return evaluation.apply(rules(field, bounds), Digits.normalize(raw))
                         .map(ChecksumString::new);
    }

    /// Last four digits, or the whole value if it is shorter.
    public String lastFour() {
        var digits = value();
        return digits.substring(Math.max(0, digits.length() - 4));
    }

    private static Rules<String> rules(String field, LengthBounds bounds) {
        return Rules.<String>rules()
                    .ensure(Digits::allDigits,
                            text -> shapeError(field, NON_DIGIT, field + " must contain only digits (spaces allowed)"))
                    .ensure(text -> !text.isEmpty(),
                            text -> shapeError(field, EMPTY, field + " must not be empty"))
                    .ensure(text -> bounds.fitsMax(text.length()),
                            text -> shapeError(field, MAX_LENGTH, field + " exceeds maximum length of " + bounds.max().unwrap()))
                    .ensureWhen(text -> wellFormed(text, bounds),
                                Digits::luhnValid,
                                text -> checksumError(field, MOD10, field + " failed MOD10 (Luhn) checksum"));
    }

    private static boolean wellFormed(String text, LengthBounds bounds) {
        return !text.isEmpty() && Digits.allDigits(text) && bounds.fitsMax(text.length());
    }
}
