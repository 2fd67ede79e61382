package org.safepay.domain.value;

import org.safepay.lang.Result;
import org.safepay.lang.Verify;

import static org.safepay.domain.error.ValidationError.Rule.NOT_POSITIVE;
import static org.safepay.domain.error.ValidationError.rangeError;

/// Number strictly greater than zero. Accepts any [Number] implementation; null and NaN are rejected.
///
/// @param <T> Type of the wrapped number
public final class PositiveNumber<T extends Number> extends ValueObject<T> {
    private PositiveNumber(T value) {
        super(value);
    }

    public static <T extends Number> Result<PositiveNumber<T>> positiveNumber(String field, T raw) {
        return Verify.ensure(raw,
                             number -> Numbers.signum(number).fold(() -> false, sign -> sign > 0),
                             number -> rangeError(field, NOT_POSITIVE, field + " must be a positive number (> 0)"))
                     .map(PositiveNumber::new);
    }
}
