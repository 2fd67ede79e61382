package org.safepay.domain.value;

import org.safepay.lang.Result;
import org.safepay.lang.Verify;

import static org.safepay.domain.error.ValidationError.Rule.MIN_LENGTH;
import static org.safepay.domain.error.ValidationError.shapeError;

/// Text which, after trimming, has at least the configured number of characters (never fewer than one).
/// Holds the trimmed text.
public final class NonEmptyString extends ValueObject<String> {
    private static final int DEFAULT_MIN_LENGTH = 1;

    private NonEmptyString(String value) {
        super(value);
    }

    public static Result<NonEmptyString> nonEmptyString(String field, String raw) {
        return nonEmptyString(field, raw, DEFAULT_MIN_LENGTH);
    }

    public static Result<NonEmptyString> nonEmptyString(String field, String raw, int minLength) {
        var trimmed = raw == null ? "" : raw.trim();
        var minimum = Math.max(DEFAULT_MIN_LENGTH, minLength);

        return Verify.ensure(trimmed,
                             text -> text.length() >= minimum,
                             text -> shapeError(field, MIN_LENGTH, field + " must be at least " + minimum + " characters long"))
                     .map(NonEmptyString::new);
    }
}
