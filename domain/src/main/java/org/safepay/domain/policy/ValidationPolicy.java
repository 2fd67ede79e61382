package org.safepay.domain.policy;

import org.safepay.domain.value.LengthBounds;
import org.safepay.domain.value.PasswordPolicy;

/// Tunable limits applied by the composite constructors.
///
/// @param nameMinLength       Minimal length of an account holder name
/// @param cardNumberMaxLength Maximal number of digits in a card number
/// @param cvvBounds           Allowed number of CVV digits
/// @param accountNumberBounds Allowed number of bank account digits
/// @param passwordPolicy      Requirements for account holder passwords
public record ValidationPolicy(int nameMinLength,
                               int cardNumberMaxLength,
                               LengthBounds cvvBounds,
                               LengthBounds accountNumberBounds,
                               PasswordPolicy passwordPolicy) {
    public static final int DEFAULT_NAME_MIN_LENGTH = 1;
    public static final int DEFAULT_CARD_NUMBER_MAX_LENGTH = 19;
    public static final int DEFAULT_CVV_MIN_LENGTH = 3;
    public static final int DEFAULT_CVV_MAX_LENGTH = 4;

    public static final ValidationPolicy DEFAULT = validationPolicy(DEFAULT_NAME_MIN_LENGTH,
                                                                    DEFAULT_CARD_NUMBER_MAX_LENGTH,
                                                                    LengthBounds.between(DEFAULT_CVV_MIN_LENGTH,
                                                                                         DEFAULT_CVV_MAX_LENGTH),
                                                                    LengthBounds.unbounded(),
                                                                    PasswordPolicy.DEFAULT);

    public static ValidationPolicy validationPolicy(int nameMinLength,
                                                    int cardNumberMaxLength,
                                                    LengthBounds cvvBounds,
                                                    LengthBounds accountNumberBounds,
                                                    PasswordPolicy passwordPolicy) {
        return new ValidationPolicy(nameMinLength, cardNumberMaxLength, cvvBounds, accountNumberBounds, passwordPolicy);
    }
}
