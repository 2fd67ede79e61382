package org.safepay.domain.value;

import org.safepay.lang.Result;
import org.safepay.lang.Verify;

import java.time.LocalDate;

import static org.safepay.domain.error.ValidationError.Rule.EMPTY;
import static org.safepay.domain.error.ValidationError.Rule.NOT_AFTER;
import static org.safepay.domain.error.ValidationError.shapeError;
import static org.safepay.domain.error.ValidationError.temporalError;

/// Date strictly after the reference date (today by default).
public final class FutureDate extends ValueObject<LocalDate> {
    private FutureDate(LocalDate value) {
        super(value);
    }

    public static Result<FutureDate> futureDate(String field, LocalDate date) {
        return futureDate(field, date, LocalDate.now());
    }

    public static Result<FutureDate> futureDate(String field, LocalDate date, LocalDate reference) {
        return Verify.ensure(date,
                             Verify.Is::notNull,
                             value -> shapeError(field, EMPTY, field + " must not be empty"))
                     .filter(value -> temporalError(field, NOT_AFTER, field + " must be after " + reference),
                             value -> value.isAfter(reference))
                     .map(FutureDate::new);
    }
}
