package org.safepay.domain.processing;

import org.safepay.domain.error.ValidationError;
import org.safepay.lang.Cause;

import java.util.List;
import java.util.stream.Collectors;

/// Projection of a failure to plain values, one entry per elementary cause in reporting order.
///
/// @param errors Individual errors
public record ErrorReport(List<FieldError> errors) {
    public static final String GENERAL_FIELD = "";
    public static final String GENERAL_RULE = "GENERAL";

    public ErrorReport {
        errors = List.copyOf(errors);
    }

    /// Single error entry. Causes which are not validation errors use [#GENERAL_FIELD] and [#GENERAL_RULE].
    public record FieldError(String field, String rule, String message) {}

    public static ErrorReport errorReport(Cause cause) {
        return new ErrorReport(cause.causes()
                                    .stream()
                                    .map(ErrorReport::fieldError)
                                    .toList());
    }

    public List<String> messages() {
        return errors.stream()
                     .map(FieldError::message)
                     .toList();
    }

    /// All messages as one bracketed text block, one message per line.
    public String message() {
        return errors.stream()
                     .map(FieldError::message)
                     .collect(Collectors.joining(",\n", "[\n", "]\n"));
    }

    private static FieldError fieldError(Cause cause) {
        if (cause instanceof ValidationError error) {
            return new FieldError(error.field(), error.rule().name(), error.message());
        }
        return new FieldError(GENERAL_FIELD, GENERAL_RULE, cause.message());
    }
}
