package org.safepay.domain.value;

import org.safepay.lang.Result;
import org.safepay.lang.Verify;

import static org.safepay.domain.error.ValidationError.Rule.EMAIL;
import static org.safepay.domain.error.ValidationError.shapeError;

/// Trimmed, non-blank text containing `@`. Only the basic shape is checked.
public final class EmailAddress extends ValueObject<String> {
    private EmailAddress(String value) {
        super(value);
    }

    public static Result<EmailAddress> emailAddress(String field, String raw) {
        var trimmed = raw == null ? "" : raw.trim();

        return Verify.ensure(trimmed,
                             text -> !text.isEmpty() && text.contains("@"),
                             text -> shapeError(field, EMAIL, field + " must be a valid email address"))
                     .map(EmailAddress::new);
    }
}
