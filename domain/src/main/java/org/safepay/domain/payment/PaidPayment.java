package org.safepay.domain.payment;

import org.safepay.domain.method.PaymentMethod;
import org.safepay.domain.value.PositiveAmount;
import org.safepay.lang.Functions.Fn1;

import java.time.Instant;
import java.util.Objects;

/// Settled payment.
public record PaidPayment(PositiveAmount amount, PaymentMethod method, Instant paidAt) implements Payment {
    public PaidPayment {
        Objects.requireNonNull(amount);
        Objects.requireNonNull(method);
        Objects.requireNonNull(paidAt);
    }

    @Override
    public <R> R fold(Fn1<R, PendingPayment> onPending,
                      Fn1<R, PaidPayment> onPaid,
                      Fn1<R, VoidPayment> onVoid,
                      Fn1<R, RefundedPayment> onRefunded) {
        return onPaid.apply(this);
    }
}
