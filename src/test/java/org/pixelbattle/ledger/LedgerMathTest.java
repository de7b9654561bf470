package org.pixelbattle.ledger;

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@Tag("unit")
class LedgerMathTest {

    @Test
    void mulDivFloor_truncatesTowardZero() {
        assertThat(LedgerMath.mulDivFloor(110, 84, 100)).isEqualTo(92);
        assertThat(LedgerMath.mulDivFloor(110, 15, 100)).isEqualTo(16);
        assertThat(LedgerMath.mulDivFloor(99, 1, 100)).isZero();
        assertThat(LedgerMath.mulDivFloor(0, 7, 3)).isZero();
    }

    @Test
    void mulDivFloor_handlesProductsBeyondLongRange() {
        // value * numerator overflows, the result does not
        final long value = Long.MAX_VALUE / 2;
        assertThat(LedgerMath.mulDivFloor(value, 3, 4)).isEqualTo(3458764513820540927L);
        assertThat(LedgerMath.mulDivFloor(Long.MAX_VALUE, 99, 100)).isEqualTo(9131138316486228048L);
        assertThat(LedgerMath.mulDivFloor(Long.MAX_VALUE - 1, Long.MAX_VALUE - 2, Long.MAX_VALUE)).isEqualTo(Long.MAX_VALUE - 3);
    }

    @Test
    void mulDivFloor_throwsWhenResultDoesNotFit() {
        assertThatThrownBy(() -> LedgerMath.mulDivFloor(Long.MAX_VALUE, 110, 100))
            .isInstanceOf(ArithmeticException.class);
    }

    @Test
    void mulDivFloor_rejectsInvalidOperands() {
        assertThatThrownBy(() -> LedgerMath.mulDivFloor(-1, 1, 1)).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> LedgerMath.mulDivFloor(1, -1, 1)).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> LedgerMath.mulDivFloor(1, 1, 0)).isInstanceOf(IllegalArgumentException.class);
    }
}
