package org.safepay.domain.processing;

import org.safepay.domain.method.Check;
import org.safepay.domain.method.CreditCard;
import org.safepay.domain.method.PaymentMethod;
import org.safepay.domain.payment.PaidPayment;
import org.safepay.domain.payment.PaymentTransitions;
import org.safepay.domain.payment.PendingPayment;
import org.safepay.domain.payment.RefundedPayment;
import org.safepay.domain.payment.VoidPayment;
import org.safepay.domain.policy.ValidationPolicy;
import org.safepay.domain.value.PositiveAmount;
import org.safepay.lang.Cause;
import org.safepay.lang.Result;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.YearMonth;
import java.util.stream.Collectors;

import static org.safepay.domain.error.ValidationError.validationErrors;

/// Entry point for callers holding raw payment input.
///
/// Requests are validated as a whole: errors of the amount and of the payment method are reported together.
/// Lifecycle operations take timestamps from the processor clock.
public interface PaymentProcessor {
    String AMOUNT_FIELD = "amount";

    record CardPaymentRequest(String cardNumber, int expiryMonth, int expiryYear, String cvv, BigDecimal amount) {
        public static CardPaymentRequest cardPaymentRequest(String cardNumber,
                                                            int expiryMonth,
                                                            int expiryYear,
                                                            String cvv,
                                                            BigDecimal amount) {
            return new CardPaymentRequest(cardNumber, expiryMonth, expiryYear, cvv, amount);
        }

        @Override
        public String toString() {
            return "CardPaymentRequest[expiry=" + expiryMonth + "/" + expiryYear + ", amount=" + amount + "]";
        }
    }

    record CheckPaymentRequest(String routingNumber, String accountNumber, BigDecimal amount) {
        public static CheckPaymentRequest checkPaymentRequest(String routingNumber,
                                                              String accountNumber,
                                                              BigDecimal amount) {
            return new CheckPaymentRequest(routingNumber, accountNumber, amount);
        }
    }

    Result<PendingPayment> cardPayment(CardPaymentRequest request);

    Result<PendingPayment> checkPayment(CheckPaymentRequest request);

    Result<PendingPayment> cashPayment(BigDecimal amount);

    PaidPayment settle(PendingPayment payment);

    VoidPayment cancel(PendingPayment payment);

    RefundedPayment refund(PaidPayment payment);

    /// Validate the request, settle the resulting payment and project it for the caller.
    Result<PaymentView> processCardPayment(CardPaymentRequest request);

    static PaymentProcessor paymentProcessor() {
        return paymentProcessor(ValidationPolicy.DEFAULT, Clock.systemUTC());
    }

    static PaymentProcessor paymentProcessor(ValidationPolicy policy, Clock clock) {
        return new paymentProcessor(policy, clock);
    }

    record paymentProcessor(ValidationPolicy policy, Clock clock) implements PaymentProcessor {
        private static final Logger log = LoggerFactory.getLogger(paymentProcessor.class);

        @Override
        public Result<PendingPayment> cardPayment(CardPaymentRequest request) {
            var card = CreditCard.creditCard(request.cardNumber(),
                                             request.expiryMonth(),
                                             request.expiryYear(),
                                             request.cvv(),
                                             policy,
                                             YearMonth.now(clock));
            return pending(request.amount(), card);
        }

        @Override
        public Result<PendingPayment> checkPayment(CheckPaymentRequest request) {
            return pending(request.amount(),
                           Check.check(request.routingNumber(), request.accountNumber(), policy));
        }

        @Override
        public Result<PendingPayment> cashPayment(BigDecimal amount) {
            return pending(amount, Result.success(PaymentMethod.cash()));
        }

        @Override
        public PaidPayment settle(PendingPayment payment) {
            var paid = PaymentTransitions.transitionToPaid(payment, clock);
            log.info("Payment of {} by {} settled at {}", paid.amount(), paid.method().type(), paid.paidAt());
            return paid;
        }

        @Override
        public VoidPayment cancel(PendingPayment payment) {
            var voided = PaymentTransitions.transitionToVoid(payment, clock);
            log.info("Payment of {} by {} voided at {}", voided.amount(), voided.method().type(), voided.voidedAt());
            return voided;
        }

        @Override
        public RefundedPayment refund(PaidPayment payment) {
            var refunded = PaymentTransitions.transitionToRefunded(payment, clock);
            log.info("Payment of {} by {} refunded at {}",
                     refunded.amount(),
                     refunded.method().type(),
                     refunded.refundedAt());
            return refunded;
        }

        @Override
        public Result<PaymentView> processCardPayment(CardPaymentRequest request) {
            return cardPayment(request).map(this::settle)
                                       .map(PaymentView::paymentView);
        }

        private Result<PendingPayment> pending(BigDecimal amount, Result<? extends PaymentMethod> method) {
            return Result.all(PositiveAmount.positiveAmount(AMOUNT_FIELD, amount), method)
                         .map(PendingPayment::pendingPayment)
                         .onFailure(paymentProcessor::logRejection);
        }

        private static void logRejection(Cause cause) {
            var errors = cause.causes();
            log.debug("Payment request rejected with {} error(s) in fields [{}]",
                      errors.size(),
                      validationErrors(cause).stream()
                                             .map(error -> error.field())
                                             .distinct()
                                             .collect(Collectors.joining(", ")));
        }
    }
}
