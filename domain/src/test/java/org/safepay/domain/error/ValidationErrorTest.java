package org.safepay.domain.error;

import org.junit.jupiter.api.Test;
import org.safepay.lang.Cause;
import org.safepay.lang.utils.Causes;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.safepay.domain.error.ValidationError.Rule.ABA;
import static org.safepay.domain.error.ValidationError.Rule.MISSING_DIGIT;
import static org.safepay.domain.error.ValidationError.Rule.MONTH;
import static org.safepay.domain.error.ValidationError.Rule.NON_DIGIT;
import static org.safepay.domain.error.ValidationError.Rule.PAST;

class ValidationErrorTest {
    @Test
    void fold_dispatchesOnErrorKind() {
        assertThat(kind(ValidationError.shapeError("CVV", NON_DIGIT, "bad"))).isEqualTo("shape");
        assertThat(kind(ValidationError.rangeError("expiry", MONTH, "bad"))).isEqualTo("range");
        assertThat(kind(ValidationError.checksumError("routing", ABA, "bad"))).isEqualTo("checksum");
        assertThat(kind(ValidationError.temporalError("expiry", PAST, "bad"))).isEqualTo("temporal");
        assertThat(kind(ValidationError.compositionError("password", MISSING_DIGIT, "bad"))).isEqualTo("composition");
    }

    @Test
    void validationErrors_flattensCompositeAndSkipsOtherCauses() {
        var shape = ValidationError.shapeError("CVV", NON_DIGIT, "CVV must contain only digits");
        var range = ValidationError.rangeError("expiry", MONTH, "expiry month must be between 1 and 12");
        var other = Causes.cause("unrelated");

        var composite = Causes.composite(List.of(shape, other, range));

        assertThat(ValidationError.validationErrors(composite)).containsExactly(shape, range);
        assertThat(composite.causes()).extracting(Cause::message)
                                      .containsExactly("CVV must contain only digits",
                                                       "unrelated",
                                                       "expiry month must be between 1 and 12");
    }

    private static String kind(ValidationError error) {
        return error.fold(shape -> "shape",
                          range -> "range",
                          checksum -> "checksum",
                          temporal -> "temporal",
                          composition -> "composition");
    }
}
