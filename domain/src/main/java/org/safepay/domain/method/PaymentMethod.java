package org.safepay.domain.method;

import org.safepay.lang.Functions.Fn0;
import org.safepay.lang.Functions.Fn1;

/// Instrument a payment is made with. The set of instruments is closed.
public sealed interface PaymentMethod permits Cash, CreditCard, Check {
    /// Handle every kind of payment method.
    <R> R fold(Fn0<R> onCash, Fn1<R, CreditCard> onCreditCard, Fn1<R, Check> onCheck);

    default MethodType type() {
        return fold(() -> MethodType.CASH, card -> MethodType.CREDIT_CARD, check -> MethodType.CHECK);
    }

    static PaymentMethod cash() {
        return Cash.INSTANCE;
    }

    enum MethodType {
        CASH,
        CREDIT_CARD,
        CHECK
    }
}
