package org.safepay.domain.payment;

import org.safepay.domain.method.PaymentMethod;
import org.safepay.domain.value.PositiveAmount;
import org.safepay.lang.Functions.Fn1;

import java.time.Instant;
import java.util.Objects;

/// Payment cancelled before settlement.
public record VoidPayment(PositiveAmount amount, PaymentMethod method, Instant voidedAt) implements Payment {
    public VoidPayment {
        Objects.requireNonNull(amount);
        Objects.requireNonNull(method);
        Objects.requireNonNull(voidedAt);
    }

    @Override
    public <R> R fold(Fn1<R, PendingPayment> onPending,
                      Fn1<R, PaidPayment> onPaid,
                      Fn1<R, VoidPayment> onVoid,
                      Fn1<R, RefundedPayment> onRefunded) {
        return onVoid.apply(this);
    }
}
