package org.safepay.domain.value;

import org.safepay.lang.Result;
import org.safepay.lang.Verify;

import java.math.BigDecimal;

import static org.safepay.domain.error.ValidationError.Rule.NOT_POSITIVE;
import static org.safepay.domain.error.ValidationError.rangeError;

/// Currency amount strictly greater than zero. The scale of the input is preserved.
public final class PositiveAmount extends ValueObject<BigDecimal> {
    private PositiveAmount(BigDecimal value) {
        super(value);
    }

    public static Result<PositiveAmount> positiveAmount(String field, BigDecimal raw) {
        return Verify.ensure(raw,
                             Verify.Is::positive,
                             amount -> rangeError(field, NOT_POSITIVE, field + " must be a positive amount (> 0)"))
                     .map(PositiveAmount::new);
    }

    @Override
    public String toString() {
        return value().toPlainString();
    }
}
