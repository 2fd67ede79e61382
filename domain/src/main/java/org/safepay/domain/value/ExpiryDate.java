package org.safepay.domain.value;

import org.safepay.lang.Result;
import org.safepay.lang.Verify;

import java.time.Year;
import java.time.YearMonth;

import static org.safepay.domain.error.ValidationError.Rule.EMPTY;
import static org.safepay.domain.error.ValidationError.Rule.MONTH;
import static org.safepay.domain.error.ValidationError.Rule.PAST;
import static org.safepay.domain.error.ValidationError.Rule.YEAR;
import static org.safepay.domain.error.ValidationError.rangeError;
import static org.safepay.domain.error.ValidationError.shapeError;
import static org.safepay.domain.error.ValidationError.temporalError;

/// Card expiry month which is not before the reference month.
///
/// When both the month is out of range and the date is in the past, both errors are reported: the past-date
/// check substitutes January for an invalid month.
public final class ExpiryDate extends ValueObject<YearMonth> {
    private static final int SUBSTITUTE_MONTH = 1;

    private ExpiryDate(YearMonth value) {
        super(value);
    }

    public static Result<ExpiryDate> expiryDate(String field, int month, int year) {
        return expiryDate(field, month, year, YearMonth.now());
    }

    public static Result<ExpiryDate> expiryDate(String field, int month, int year, YearMonth now) {
        var validMonth = Verify.ensure(month,
                                       value -> Verify.Is.between(value, 1, 12),
                                       value -> rangeError(field, MONTH, field + " month must be between 1 and 12 (was " + value + ")"));
        var notPast = Verify.ensure(year,
                                    value -> Verify.Is.between(value, Year.MIN_VALUE, Year.MAX_VALUE),
                                    value -> rangeError(field, YEAR, field + " year is out of range (was " + value + ")"))
                            .map(value -> YearMonth.of(value, validMonth.isSuccess() ? month : SUBSTITUTE_MONTH))
                            .flatMap(yearMonth -> notBefore(field, yearMonth, now));

        return Result.all(validMonth, notPast)
                     .map((validMonthValue, yearMonth) -> new ExpiryDate(yearMonth));
    }

    public static Result<ExpiryDate> expiryDate(String field, YearMonth yearMonth, YearMonth now) {
        return Verify.ensure(yearMonth,
                             Verify.Is::notNull,
                             value -> shapeError(field, EMPTY, field + " must not be empty"))
                     .flatMap(value -> notBefore(field, value, now))
                     .map(ExpiryDate::new);
    }

    public int month() {
        return value().getMonthValue();
    }

    public int year() {
        return value().getYear();
    }

    private static Result<YearMonth> notBefore(String field, YearMonth yearMonth, YearMonth now) {
        return Verify.ensure(yearMonth,
                             value -> !value.isBefore(now),
                             value -> temporalError(field, PAST, field + " must not be in the past (now is " + now + ")"));
    }
}
