package org.safepay.domain.value;

import org.safepay.lang.Option;

import java.math.BigDecimal;
import java.math.BigInteger;

import static org.safepay.lang.Option.none;
import static org.safepay.lang.Option.option;
import static org.safepay.lang.Option.some;

/// Sign detection for arbitrary [Number] implementations.
final class Numbers {
    private Numbers() {}

    /// Sign of the number (-1, 0 or 1), or empty for null and NaN.
    static Option<Integer> signum(Number number) {
        return option(number).flatMap(Numbers::signumOf);
    }

    private static Option<Integer> signumOf(Number number) {
        if (number instanceof BigDecimal decimal) {
            return some(decimal.signum());
        }
        if (number instanceof BigInteger integer) {
            return some(integer.signum());
        }
        if (number instanceof Double || number instanceof Float) {
            return floatingSignum(number.doubleValue());
        }
        if (number instanceof Long || number instanceof Integer || number instanceof Short || number instanceof Byte) {
            return some(Long.signum(number.longValue()));
        }
        return floatingSignum(number.doubleValue());
    }

    private static Option<Integer> floatingSignum(double value) {
        return Double.isNaN(value)
               ? none()
               : some((int) Math.signum(value));
    }
}
