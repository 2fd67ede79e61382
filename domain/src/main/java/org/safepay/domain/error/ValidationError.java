package org.safepay.domain.error;

import org.safepay.lang.Cause;
import org.safepay.lang.Functions.Fn1;

import java.util.List;

/// Failure of a single validation rule for a named field.
///
/// Errors are grouped by the kind of rule which failed. Every error carries the field label it was produced for,
/// the [Rule] tag and a human-readable message.
public sealed interface ValidationError extends Cause {
    String field();

    Rule rule();

    /// Handle every kind of validation error.
    <R> R fold(Fn1<R, ShapeError> onShape,
               Fn1<R, RangeError> onRange,
               Fn1<R, ChecksumError> onChecksum,
               Fn1<R, TemporalError> onTemporal,
               Fn1<R, CompositionError> onComposition);

    enum Rule {
        EMPTY,
        NON_DIGIT,
        MIN_LENGTH,
        MAX_LENGTH,
        LENGTH,
        EMAIL,
        NOT_POSITIVE,
        NEGATIVE,
        MONTH,
        YEAR,
        MOD10,
        ABA,
        PAST,
        NOT_AFTER,
        MISSING_UPPERCASE,
        MISSING_LOWERCASE,
        MISSING_DIGIT,
        MISSING_SYMBOL
    }

    /// Wrong primitive shape: empty text, non-digit characters, wrong length.
    record ShapeError(String field, Rule rule, String message) implements ValidationError {
        @Override
        public <R> R fold(Fn1<R, ShapeError> onShape,
                          Fn1<R, RangeError> onRange,
                          Fn1<R, ChecksumError> onChecksum,
                          Fn1<R, TemporalError> onTemporal,
                          Fn1<R, CompositionError> onComposition) {
            return onShape.apply(this);
        }
    }

    /// Numeric value outside the required range.
    record RangeError(String field, Rule rule, String message) implements ValidationError {
        @Override
        public <R> R fold(Fn1<R, ShapeError> onShape,
                          Fn1<R, RangeError> onRange,
                          Fn1<R, ChecksumError> onChecksum,
                          Fn1<R, TemporalError> onTemporal,
                          Fn1<R, CompositionError> onComposition) {
            return onRange.apply(this);
        }
    }

    /// Well-formed value which fails its checksum.
    record ChecksumError(String field, Rule rule, String message) implements ValidationError {
        @Override
        public <R> R fold(Fn1<R, ShapeError> onShape,
                          Fn1<R, RangeError> onRange,
                          Fn1<R, ChecksumError> onChecksum,
                          Fn1<R, TemporalError> onTemporal,
                          Fn1<R, CompositionError> onComposition) {
            return onChecksum.apply(this);
        }
    }

    /// Date or time which does not satisfy a temporal constraint.
    record TemporalError(String field, Rule rule, String message) implements ValidationError {
        @Override
        public <R> R fold(Fn1<R, ShapeError> onShape,
                          Fn1<R, RangeError> onRange,
                          Fn1<R, ChecksumError> onChecksum,
                          Fn1<R, TemporalError> onTemporal,
                          Fn1<R, CompositionError> onComposition) {
            return onTemporal.apply(this);
        }
    }

    /// Value which lacks a required constituent, such as a character class of a password.
    record CompositionError(String field, Rule rule, String message) implements ValidationError {
        @Override
        public <R> R fold(Fn1<R, ShapeError> onShape,
                          Fn1<R, RangeError> onRange,
                          Fn1<R, ChecksumError> onChecksum,
                          Fn1<R, TemporalError> onTemporal,
                          Fn1<R, CompositionError> onComposition) {
            return onComposition.apply(this);
        }
    }

    static ShapeError shapeError(String field, Rule rule, String message) {
        return new ShapeError(field, rule, message);
    }

    static RangeError rangeError(String field, Rule rule, String message) {
        return new RangeError(field, rule, message);
    }

    static ChecksumError checksumError(String field, Rule rule, String message) {
        return new ChecksumError(field, rule, message);
    }

    static TemporalError temporalError(String field, Rule rule, String message) {
        return new TemporalError(field, rule, message);
    }

    static CompositionError compositionError(String field, Rule rule, String message) {
        return new CompositionError(field, rule, message);
    }

    /// Validation errors contained in the given cause, in their original order. Causes of other types are skipped.
    static List<ValidationError> validationErrors(Cause cause) {
        return cause.causes()
                    .stream()
                    .filter(ValidationError.class::isInstance)
                    .map(ValidationError.class::cast)
                    .toList();
    }
}
