package org.safepay.domain.method;

import org.safepay.lang.Functions.Fn0;
import org.safepay.lang.Functions.Fn1;

/// Cash payment. Carries no data.
public enum Cash implements PaymentMethod {
    INSTANCE;

    @Override
    public <R> R fold(Fn0<R> onCash, Fn1<R, CreditCard> onCreditCard, Fn1<R, Check> onCheck) {
        return onCash.apply();
    }

    @Override
    public String toString() {
        return "Cash";
    }
}
