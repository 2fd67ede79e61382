package org.safepay.domain.payment;

import org.safepay.domain.method.PaymentMethod;
import org.safepay.domain.value.PositiveAmount;
import org.safepay.lang.Functions.Fn1;

import java.time.Instant;
import java.util.Objects;

/// Settled payment returned to the payer.
public record RefundedPayment(PositiveAmount amount, PaymentMethod method, Instant refundedAt) implements Payment {
    public RefundedPayment {
        Objects.requireNonNull(amount);
        Objects.requireNonNull(method);
        Objects.requireNonNull(refundedAt);
    }

    @Override
    public <R> R fold(Fn1<R, PendingPayment> onPending,
                      Fn1<R, PaidPayment> onPaid,
                      Fn1<R, VoidPayment> onVoid,
                      Fn1<R, RefundedPayment> onRefunded) {
        return onRefunded.apply(this);
    }
}
