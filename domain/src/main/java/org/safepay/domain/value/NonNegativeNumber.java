package org.safepay.domain.value;

import org.safepay.lang.Result;
import org.safepay.lang.Verify;

import static org.safepay.domain.error.ValidationError.Rule.NEGATIVE;
import static org.safepay.domain.error.ValidationError.rangeError;

/// Number greater than or equal to zero, for example a balance. Null and NaN are rejected.
///
/// @param <T> Type of the wrapped number
public final class NonNegativeNumber<T extends Number> extends ValueObject<T> {
    private NonNegativeNumber(T value) {
        super(value);
    }

    public static <T extends Number> Result<NonNegativeNumber<T>> nonNegativeNumber(String field, T raw) {
        return Verify.ensure(raw,
                             number -> Numbers.signum(number).fold(() -> false, sign -> sign >= 0),
                             number -> rangeError(field, NEGATIVE, field + " must be a non-negative number (>= 0)"))
                     .map(NonNegativeNumber::new);
    }
}
