package org.safepay.domain.payment;

/// Lifecycle state of a payment.
public enum PaymentStatus {
    PENDING,
    PAID,
    VOID,
    REFUNDED
}
