package org.safepay.domain.payment;

import java.time.Clock;
import java.time.Instant;

/// Lifecycle transitions between payment states.
///
/// Each transition accepts only the state it is legal from, so an illegal change such as refunding a voided
/// payment does not compile. Transitions keep amount and method and add the timestamp of the change.
public final class PaymentTransitions {
    private PaymentTransitions() {}

    public static PaidPayment transitionToPaid(PendingPayment payment) {
        return transitionToPaid(payment, Clock.systemUTC());
    }

    public static PaidPayment transitionToPaid(PendingPayment payment, Clock clock) {
        return transitionToPaid(payment, clock.instant());
    }

    public static PaidPayment transitionToPaid(PendingPayment payment, Instant paidAt) {
        return new PaidPayment(payment.amount(), payment.method(), paidAt);
    }

    public static VoidPayment transitionToVoid(PendingPayment payment) {
        return transitionToVoid(payment, Clock.systemUTC());
    }

    public static VoidPayment transitionToVoid(PendingPayment payment, Clock clock) {
        return transitionToVoid(payment, clock.instant());
    }

    public static VoidPayment transitionToVoid(PendingPayment payment, Instant voidedAt) {
        return new VoidPayment(payment.amount(), payment.method(), voidedAt);
    }

    public static RefundedPayment transitionToRefunded(PaidPayment payment) {
        return transitionToRefunded(payment, Clock.systemUTC());
    }

    public static RefundedPayment transitionToRefunded(PaidPayment payment, Clock clock) {
        return transitionToRefunded(payment, clock.instant());
    }

    public static RefundedPayment transitionToRefunded(PaidPayment payment, Instant refundedAt) {
        return new RefundedPayment(payment.amount(), payment.method(), refundedAt);
    }
}
