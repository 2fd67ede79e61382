package org.safepay.domain.payment;

import org.safepay.domain.method.PaymentMethod;
import org.safepay.domain.value.PositiveAmount;
import org.safepay.lang.Functions.Fn1;

/// Payment in exactly one lifecycle state. Each state carries only the data legal for it.
///
/// State changes are performed by [PaymentTransitions], which accept only the state a change is legal from.
public sealed interface Payment permits PendingPayment, PaidPayment, VoidPayment, RefundedPayment {
    PositiveAmount amount();

    PaymentMethod method();

    /// Handle every payment state.
    <R> R fold(Fn1<R, PendingPayment> onPending,
               Fn1<R, PaidPayment> onPaid,
               Fn1<R, VoidPayment> onVoid,
               Fn1<R, RefundedPayment> onRefunded);

    default PaymentStatus status() {
        return fold(pending -> PaymentStatus.PENDING,
                    paid -> PaymentStatus.PAID,
                    voided -> PaymentStatus.VOID,
                    refunded -> PaymentStatus.REFUNDED);
    }
}
