package org.safepay.domain.method;

import org.junit.jupiter.api.Test;

import java.time.YearMonth;

import static org.assertj.core.api.Assertions.assertThat;

class PaymentMethodTest {
    private static final YearMonth NOW = YearMonth.of(2024, 8);

    @Test
    void fold_dispatchesOnVariant() {
        PaymentMethod cash = PaymentMethod.cash();
        PaymentMethod card = CreditCard.creditCard("4532015112830366", 12, 2026, "123", NOW).unwrap();
        PaymentMethod check = Check.check("021000021", "12345678").unwrap();

        assertThat(describe(cash)).isEqualTo("cash");
        assertThat(describe(card)).isEqualTo("card ending 0366");
        assertThat(describe(check)).isEqualTo("check from 021000021");
    }

    @Test
    void type_matchesVariant() {
        assertThat(PaymentMethod.cash().type()).isEqualTo(PaymentMethod.MethodType.CASH);
        assertThat(PaymentMethod.cash()).isSameAs(Cash.INSTANCE);
    }

    private static String describe(PaymentMethod method) {
        return method.fold(() -> "cash",
                           card -> "card ending " + card.lastFour(),
                           check -> "check from " + check.routingNumber().value());
    }
}
