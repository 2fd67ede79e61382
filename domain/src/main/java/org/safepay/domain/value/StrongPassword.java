package org.safepay.domain.value;

import org.safepay.lang.Result;
import org.safepay.lang.Rules;

import java.util.function.IntPredicate;

import static org.safepay.domain.error.ValidationError.Rule.EMPTY;
import static org.safepay.domain.error.ValidationError.Rule.MIN_LENGTH;
import static org.safepay.domain.error.ValidationError.Rule.MISSING_DIGIT;
import static org.safepay.domain.error.ValidationError.Rule.MISSING_LOWERCASE;
import static org.safepay.domain.error.ValidationError.Rule.MISSING_SYMBOL;
import static org.safepay.domain.error.ValidationError.Rule.MISSING_UPPERCASE;
import static org.safepay.domain.error.ValidationError.compositionError;
import static org.safepay.domain.error.ValidationError.shapeError;

/// Password satisfying a [PasswordPolicy]. The text is kept as entered, without trimming.
///
/// Every violated requirement is reported, so a short password without digits yields two errors.
/// [#toString()] never reveals the password.
public final class StrongPassword extends ValueObject<String> {
    private StrongPassword(String value) {
        super(value);
    }

    public static Result<StrongPassword> strongPassword(String field, String raw) {
        return strongPassword(field, raw, PasswordPolicy.DEFAULT);
    }

    public static Result<StrongPassword> strongPassword(String field, String raw, PasswordPolicy policy) {
        return strongPassword(field, raw, policy, Evaluation.ACCUMULATING);
    }

    public static Result<StrongPassword> strongPassword(String field,
                                                        String raw,
                                                        PasswordPolicy policy,
                                                        Evaluation evaluation) {
        return evaluation.apply(rules(field, policy), raw == null ? "" : raw)
                         .map(StrongPassword::new);
    }

    @Override
    public String toString() {
        return "StrongPassword[****]";
    }

    private static Rules<String> rules(String field, PasswordPolicy policy) {
        return Rules.<String>rules()
                    .ensure(text -> !text.isEmpty(),
                            text -> shapeError(field, EMPTY, field + " must not be empty"))
                    .ensureWhen(text -> !text.isEmpty(),
                                text -> text.length() >= policy.minLength(),
                                text -> shapeError(field, MIN_LENGTH,
                                                   field + " must be at least " + policy.minLength() + " characters long"))
                    .ensureWhen(text -> policy.requireUppercase(),
                                text -> containsAny(text, Character::isUpperCase),
                                text -> compositionError(field, MISSING_UPPERCASE,
                                                         field + " must contain at least one uppercase letter"))
                    .ensureWhen(text -> policy.requireLowercase(),
                                text -> containsAny(text, Character::isLowerCase),
                                text -> compositionError(field, MISSING_LOWERCASE,
                                                         field + " must contain at least one lowercase letter"))
                    .ensureWhen(text -> policy.requireDigit(),
                                text -> containsAny(text, Character::isDigit),
                                text -> compositionError(field, MISSING_DIGIT,
                                                         field + " must contain at least one digit"))
                    .ensureWhen(text -> policy.requireSymbol(),
                                text -> containsAny(text, ch -> !Character.isLetterOrDigit(ch)),
                                text -> compositionError(field, MISSING_SYMBOL,
                                                         field + " must contain at least one symbol"));
    }

    private static boolean containsAny(String text, IntPredicate characterClass) {
        return text.chars().anyMatch(characterClass);
    }
}
