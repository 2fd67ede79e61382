package org.safepay.domain.value;

import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.safepay.domain.error.ValidationError;
import org.safepay.domain.error.ValidationError.RangeError;
import org.safepay.lang.Cause;

import java.math.BigDecimal;
import java.math.BigInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.safepay.domain.error.ValidationError.Rule.NEGATIVE;
import static org.safepay.domain.error.ValidationError.Rule.NOT_POSITIVE;
import static org.safepay.domain.value.NonNegativeNumber.nonNegativeNumber;
import static org.safepay.domain.value.PositiveAmount.positiveAmount;
import static org.safepay.domain.value.PositiveNumber.positiveNumber;

class NumericValuesTest {
    @Nested
    class Positive {
        @Test
        void positiveNumber_acceptsValuesAboveZero() {
            positiveNumber("quantity", 5).onFailureRun(Assertions::fail)
                                         .onSuccess(number -> assertThat(number.value()).isEqualTo(5));
            positiveNumber("rate", 0.01).onFailureRun(Assertions::fail);
            positiveNumber("count", BigInteger.ONE).onFailureRun(Assertions::fail);
        }

        @Test
        void positiveNumber_rejectsZeroNegativeNanAndNull() {
            assertThat(positiveNumber("quantity", 0).causes()).singleElement()
                                                              .isInstanceOf(RangeError.class);
            assertThat(positiveNumber("quantity", -1L).isFailure()).isTrue();
            assertThat(positiveNumber("rate", Double.NaN).isFailure()).isTrue();
            assertThat(positiveNumber("quantity", (Integer) null).isFailure()).isTrue();
            assertThat(((ValidationError) positiveNumber("quantity", 0).causes().get(0)).rule()).isEqualTo(NOT_POSITIVE);
        }
    }

    @Nested
    class NonNegative {
        @Test
        void nonNegativeNumber_acceptsZero() {
            nonNegativeNumber("discount", 0).onFailureRun(Assertions::fail);
            nonNegativeNumber("discount", BigDecimal.ZERO).onFailureRun(Assertions::fail);
        }

        @Test
        void nonNegativeNumber_rejectsNegativeValues() {
            var result = nonNegativeNumber("discount", -0.5);

            assertThat(((ValidationError) result.causes().get(0)).rule()).isEqualTo(NEGATIVE);
            assertThat(result.causes()).extracting(Cause::message)
                                       .containsExactly("discount must be a non-negative number (>= 0)");
        }
    }

    @Nested
    class Amount {
        @Test
        void positiveAmount_keepsScale() {
            positiveAmount("amount", new BigDecimal("99.990"))
                .onFailureRun(Assertions::fail)
                .onSuccess(amount -> assertThat(amount.toString()).isEqualTo("99.990"));
        }

        @Test
        void positiveAmount_rejectsZeroAndNull() {
            assertThat(positiveAmount("amount", BigDecimal.ZERO).causes()).extracting(Cause::message)
                                                                          .containsExactly("amount must be a positive amount (> 0)");
            assertThat(positiveAmount("amount", null).isFailure()).isTrue();
        }
    }
}
