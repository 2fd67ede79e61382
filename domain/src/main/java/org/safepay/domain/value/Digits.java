package org.safepay.domain.value;

import org.safepay.lang.Option;

/// Normalization and checksum algorithms shared by digit-bearing value types.
final class Digits {
    private static final int[] ABA_WEIGHTS = {3, 7, 1, 3, 7, 1, 3, 7};

    private Digits() {}

    /// Trim the input and strip interior spaces. Null is normalized to an empty string.
    static String normalize(String raw) {
        return Option.option(raw)
                     .map(String::trim)
                     .map(text -> text.replace(" ", ""))
                     .or("");
    }

    static boolean allDigits(String text) {
        return text.chars().allMatch(Digits::isAsciiDigit);
    }

    /// Luhn (MOD10) checksum. Expects a string of ASCII digits.
    static boolean luhnValid(String digits) {
        var sum = 0;
        var reversed = new StringBuilder(digits).reverse();

        for (int i = 0; i < reversed.length(); i++) {
            var digit = reversed.charAt(i) - '0';

            if (i % 2 == 1) {
                digit *= 2;
                if (digit > 9) {
                    digit -= 9;
                }
            }
            sum += digit;
        }
        return sum % 10 == 0;
    }

    /// ABA routing number checksum. Expects exactly 9 ASCII digits.
    static boolean abaValid(String digits) {
        var sum = 0;

        for (int i = 0; i < ABA_WEIGHTS.length; i++) {
            sum += (digits.charAt(i) - '0') * ABA_WEIGHTS[i];
        }

        var expectedCheckDigit = (10 - sum % 10) % 10;
        return digits.charAt(8) - '0' == expectedCheckDigit;
    }

    private static boolean isAsciiDigit(int ch) {
        return ch >= '0' && ch <= '9';
    }
}
