package org.safepay.domain.processing;

import org.safepay.domain.method.PaymentMethod.MethodType;
import org.safepay.domain.payment.Payment;
import org.safepay.domain.payment.PaymentStatus;
import org.safepay.lang.Option;

import java.math.BigDecimal;
import java.time.Instant;

/// Projection of a payment to plain values, suitable for serialization by a transport layer.
///
/// @param amount       Payment amount
/// @param status       Lifecycle state
/// @param methodType   Kind of payment method
/// @param cardLastFour Last four card digits, present for card payments only
/// @param timestamp    Time of the last state change, absent for pending payments
public record PaymentView(BigDecimal amount,
                          PaymentStatus status,
                          MethodType methodType,
                          Option<String> cardLastFour,
                          Option<Instant> timestamp) {
    public static PaymentView paymentView(Payment payment) {
        var lastFour = payment.method()
                              .<Option<String>>fold(Option::none,
                                                    card -> Option.some(card.lastFour()),
                                                    check -> Option.none());
        var timestamp = payment.<Option<Instant>>fold(pending -> Option.none(),
                                                      paid -> Option.some(paid.paidAt()),
                                                      voided -> Option.some(voided.voidedAt()),
                                                      refunded -> Option.some(refunded.refundedAt()));

        return new PaymentView(payment.amount().value(),
                               payment.status(),
                               payment.method().type(),
                               lastFour,
                               timestamp);
    }
}
