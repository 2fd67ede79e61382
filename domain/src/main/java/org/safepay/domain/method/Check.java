package org.safepay.domain.method;

import org.safepay.domain.policy.ValidationPolicy;
import org.safepay.domain.value.DigitString;
import org.safepay.domain.value.RoutingNumber;
import org.safepay.lang.Functions.Fn0;
import org.safepay.lang.Functions.Fn1;
import org.safepay.lang.Result;

import static org.safepay.domain.value.DigitString.digitString;

/// Bank check identified by routing and account numbers.
public record Check(RoutingNumber routingNumber, DigitString accountNumber) implements PaymentMethod {
    public static final String ROUTING_FIELD = "routing number";
    public static final String ACCOUNT_FIELD = "account number";

    public static Result<Check> check(String routingNumber, String accountNumber) {
        return check(routingNumber, accountNumber, ValidationPolicy.DEFAULT);
    }

    public static Result<Check> check(String routingNumber, String accountNumber, ValidationPolicy policy) {
        return Result.all(RoutingNumber.routingNumber(ROUTING_FIELD, routingNumber),
                          digitString(ACCOUNT_FIELD, accountNumber, policy.accountNumberBounds()))
                     .map(Check::new);
    }

    @Override
    public <R> R fold(Fn0<R> onCash, Fn1<R, CreditCard> onCreditCard, Fn1<R, Check> onCheck) {
        return onCheck.apply(this);
    }
}
