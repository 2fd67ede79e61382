package org.safepay.domain.value;

import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;
import org.safepay.domain.error.ValidationError;
import org.safepay.lang.Cause;
import org.safepay.lang.Result;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.safepay.domain.error.ValidationError.Rule.EMPTY;
import static org.safepay.domain.error.ValidationError.Rule.MAX_LENGTH;
import static org.safepay.domain.error.ValidationError.Rule.MIN_LENGTH;
import static org.safepay.domain.error.ValidationError.Rule.NON_DIGIT;
import static org.safepay.domain.value.DigitString.digitString;

class DigitStringTest {
    private static final LengthBounds CVV = LengthBounds.between(3, 4);

    @Test
    void digitString_acceptsDigitsWithinBounds() {
        digitString("CVV", "123", CVV)
            .onFailureRun(Assertions::fail)
            .onSuccess(cvv -> assertThat(cvv.value()).isEqualTo("123"));
    }

    @Test
    void digitString_normalizesSpaces() {
        assertThat(digitString("account number", " 123 456 ").unwrap())
            .isEqualTo(digitString("account number", "123456").unwrap());
    }

    @Test
    void digitString_reportsSingleErrorForOneBadCharacter() {
        var result = digitString("CVV", "12a", CVV);

        assertThat(rules(result)).containsExactly(NON_DIGIT);
        assertThat(result.causes()).extracting(Cause::message)
                                   .containsExactly("CVV must contain only digits (spaces allowed)");
    }

    @Test
    void digitString_accumulatesIndependentViolations() {
        assertThat(rules(digitString("CVV", "12a45", CVV))).containsExactly(NON_DIGIT, MAX_LENGTH);
        assertThat(rules(digitString("CVV", "1a", CVV))).containsExactly(NON_DIGIT, MIN_LENGTH);
    }

    @Test
    void digitString_failFastReportsOnlyFirstViolation() {
        assertThat(rules(digitString("CVV", "12a45", CVV, Evaluation.FAIL_FAST))).containsExactly(NON_DIGIT);
        assertThat(rules(digitString("CVV", "12a45", CVV, Evaluation.ACCUMULATING))).containsExactly(NON_DIGIT,
                                                                                                      MAX_LENGTH);
        assertThat(rules(digitString("CVV", "12", CVV, Evaluation.FAIL_FAST))).containsExactly(MIN_LENGTH);
        digitString("CVV", "123", CVV, Evaluation.FAIL_FAST).onFailureRun(Assertions::fail);
    }

    @Test
    void digitString_rejectsEmptyAndNullInput() {
        assertThat(rules(digitString("account number", "   "))).containsExactly(EMPTY);
        assertThat(rules(digitString("account number", null))).containsExactly(EMPTY);
        assertThat(rules(digitString("CVV", "", CVV))).containsExactly(EMPTY, MIN_LENGTH);
    }

    @Test
    void digitString_rejectsNonAsciiDigits() {
        assertThat(rules(digitString("account number", "١٢٣"))).containsExactly(NON_DIGIT);
    }

    @Test
    void digitString_lengthMessagesNameTheLimits() {
        assertThat(digitString("CVV", "12", CVV).causes()).extracting(Cause::message)
                                                          .containsExactly("CVV must be at least 3 digits");
        assertThat(digitString("CVV", "12345", CVV).causes()).extracting(Cause::message)
                                                             .containsExactly("CVV must be at most 4 digits");
    }

    private static List<ValidationError.Rule> rules(Result<?> result) {
        return result.causes()
                     .stream()
                     .map(cause -> ((ValidationError) cause).rule())
                     .toList();
    }
}
