package org.safepay.domain.holder;

import org.safepay.domain.policy.ValidationPolicy;
import org.safepay.domain.value.EmailAddress;
import org.safepay.domain.value.NonEmptyString;
import org.safepay.domain.value.StrongPassword;
import org.safepay.lang.Result;

import static org.safepay.domain.value.EmailAddress.emailAddress;
import static org.safepay.domain.value.NonEmptyString.nonEmptyString;
import static org.safepay.domain.value.StrongPassword.strongPassword;

/// Owner of a payment account.
public record AccountHolder(NonEmptyString name, EmailAddress email, StrongPassword password) {
    public static final String NAME_FIELD = "name";
    public static final String EMAIL_FIELD = "email";
    public static final String PASSWORD_FIELD = "password";

    public static Result<AccountHolder> accountHolder(String name, String email, String password) {
        return accountHolder(name, email, password, ValidationPolicy.DEFAULT);
    }

    public static Result<AccountHolder> accountHolder(String name,
                                                      String email,
                                                      String password,
                                                      ValidationPolicy policy) {
        return Result.all(nonEmptyString(NAME_FIELD, name, policy.nameMinLength()),
                          emailAddress(EMAIL_FIELD, email),
                          strongPassword(PASSWORD_FIELD, password, policy.passwordPolicy()))
                     .map(AccountHolder::new);
    }
}
