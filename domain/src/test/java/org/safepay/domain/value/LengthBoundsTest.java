package org.safepay.domain.value;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class LengthBoundsTest {
    @Test
    void unbounded_acceptsAnyLength() {
        assertThat(LengthBounds.unbounded().fitsMin(0)).isTrue();
        assertThat(LengthBounds.unbounded().fitsMax(Integer.MAX_VALUE)).isTrue();
    }

    @Test
    void between_checksBothEndsInclusively() {
        var bounds = LengthBounds.between(3, 4);

        assertThat(bounds.fitsMin(2)).isFalse();
        assertThat(bounds.fitsMin(3)).isTrue();
        assertThat(bounds.fitsMax(4)).isTrue();
        assertThat(bounds.fitsMax(5)).isFalse();
        assertThat(bounds.toString()).isEqualTo("LengthBounds[3..4]");
    }

    @Test
    void atLeastAndAtMost_leaveOtherEndOpen() {
        assertThat(LengthBounds.atLeast(2).fitsMax(100)).isTrue();
        assertThat(LengthBounds.atMost(2).fitsMin(0)).isTrue();
        assertThat(LengthBounds.atMost(2).toString()).isEqualTo("LengthBounds[-..2]");
    }
}
