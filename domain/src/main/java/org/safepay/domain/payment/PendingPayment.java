package org.safepay.domain.payment;

import org.safepay.domain.method.PaymentMethod;
import org.safepay.domain.value.PositiveAmount;
import org.safepay.lang.Functions.Fn1;

import java.util.Objects;

/// Payment awaiting settlement.
public record PendingPayment(PositiveAmount amount, PaymentMethod method) implements Payment {
    public PendingPayment {
        Objects.requireNonNull(amount);
        Objects.requireNonNull(method);
    }

    public static PendingPayment pendingPayment(PositiveAmount amount, PaymentMethod method) {
        return new PendingPayment(amount, method);
    }

    @Override
    public <R> R fold(Fn1<R, PendingPayment> onPending,
                      Fn1<R, PaidPayment> onPaid,
                      Fn1<R, VoidPayment> onVoid,
                      Fn1<R, RefundedPayment> onRefunded) {
        return onPending.apply(this);
    }
}
