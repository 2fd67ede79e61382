package org.safepay.domain.value;

/// Requirements a [StrongPassword] must satisfy.
///
/// @param minLength        Minimal number of characters
/// @param requireUppercase At least one uppercase letter is required
/// @param requireLowercase At least one lowercase letter is required
/// @param requireDigit     At least one digit is required
/// @param requireSymbol    At least one character which is neither a letter nor a digit is required
public record PasswordPolicy(int minLength,
                             boolean requireUppercase,
                             boolean requireLowercase,
                             boolean requireDigit,
                             boolean requireSymbol) {
    public static final int DEFAULT_MIN_LENGTH = 12;
    public static final PasswordPolicy DEFAULT = new PasswordPolicy(DEFAULT_MIN_LENGTH, true, true, true, true);

    public static PasswordPolicy passwordPolicy(int minLength,
                                                boolean requireUppercase,
                                                boolean requireLowercase,
                                                boolean requireDigit,
                                                boolean requireSymbol) {
        return new PasswordPolicy(minLength, requireUppercase, requireLowercase, requireDigit, requireSymbol);
    }
}
