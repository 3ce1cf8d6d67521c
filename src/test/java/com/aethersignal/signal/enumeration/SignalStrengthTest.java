/* (C)2026 */
package com.aethersignal.signal.enumeration;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import org.junit.jupiter.api.Test;

class SignalStrengthTest {

    @Test
    void countOfAgreeingMethodsMapsToStrength() {
        assertThat(SignalStrength.fromFlaggedCount(0)).isEqualTo(SignalStrength.NONE);
        assertThat(SignalStrength.fromFlaggedCount(1)).isEqualTo(SignalStrength.WEAK);
        assertThat(SignalStrength.fromFlaggedCount(2)).isEqualTo(SignalStrength.MODERATE);
        assertThat(SignalStrength.fromFlaggedCount(3)).isEqualTo(SignalStrength.STRONG);
        assertThat(SignalStrength.fromFlaggedCount(4)).isEqualTo(SignalStrength.VERY_STRONG);
        assertThat(SignalStrength.fromFlaggedCount(9)).isEqualTo(SignalStrength.VERY_STRONG);
    }

    @Test
    void negativeCountIsRejected() {
        assertThatThrownBy(() -> SignalStrength.fromFlaggedCount(-1)).isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void orderingFollowsSeverity() {
        assertThat(SignalStrength.STRONG.isAtLeast(SignalStrength.MODERATE)).isTrue();
        assertThat(SignalStrength.STRONG.isAtLeast(SignalStrength.STRONG)).isTrue();
        assertThat(SignalStrength.WEAK.isAtLeast(SignalStrength.MODERATE)).isFalse();
    }
}
