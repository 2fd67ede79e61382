package org.safepay.domain.method;

import org.safepay.domain.policy.ValidationPolicy;
import org.safepay.domain.value.ChecksumString;
import org.safepay.domain.value.DigitString;
import org.safepay.domain.value.ExpiryDate;
import org.safepay.lang.Functions.Fn0;
import org.safepay.lang.Functions.Fn1;
import org.safepay.lang.Result;

import java.time.YearMonth;

import static org.safepay.domain.value.ChecksumString.checksumString;
import static org.safepay.domain.value.DigitString.digitString;
import static org.safepay.domain.value.ExpiryDate.expiryDate;

/// Payment card built from validated parts.
///
/// The factories validate every part and report all failures together; a card is never built from a partially
/// valid input.
public record CreditCard(ChecksumString number, ExpiryDate expiry, DigitString cvv) implements PaymentMethod {
    public static final String NUMBER_FIELD = "card number";
    public static final String EXPIRY_FIELD = "expiry date";
    public static final String CVV_FIELD = "CVV";

    public static Result<CreditCard> creditCard(String number, int month, int year, String cvv) {
        return creditCard(number, month, year, cvv, YearMonth.now());
    }

    public static Result<CreditCard> creditCard(String number, int month, int year, String cvv, YearMonth now) {
        return creditCard(number, month, year, cvv, ValidationPolicy.DEFAULT, now);
    }

    public static Result<CreditCard> creditCard(String number,
                                                int month,
                                                int year,
                                                String cvv,
                                                ValidationPolicy policy,
                                                YearMonth now) {
        return Result.all(checksumString(NUMBER_FIELD, number, policy.cardNumberMaxLength()),
                          expiryDate(EXPIRY_FIELD, month, year, now),
                          digitString(CVV_FIELD, cvv, policy.cvvBounds()))
                     .map(CreditCard::new);
    }

    @Override
    public <R> R fold(Fn0<R> onCash, Fn1<R, CreditCard> onCreditCard, Fn1<R, Check> onCheck) {
        return onCreditCard.apply(this);
    }

    public String lastFour() {
        return number.lastFour();
    }

    /// Card network guessed from the leading digit of the number.
    public Brand brand() {
        return Brand.fromLeadingDigit(number.value().charAt(0));
    }

    @Override
    public String toString() {
        return "CreditCard[****" + lastFour() + ", " + expiry.value() + "]";
    }

    public enum Brand {
        AMEX,
        VISA,
        MASTERCARD,
        DISCOVER,
        UNKNOWN;

        static Brand fromLeadingDigit(char digit) {
            return switch (digit) {
                case '3' -> AMEX;
                case '4' -> VISA;
                case '2', '5' -> MASTERCARD;
                case '6' -> DISCOVER;
                default -> UNKNOWN;
            };
        }
    }
}
