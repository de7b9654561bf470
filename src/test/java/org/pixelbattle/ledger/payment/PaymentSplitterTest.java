package org.pixelbattle.ledger.payment;

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@Tag("unit")
class PaymentSplitterTest {

    private final PaymentSplitter splitter = new PaymentSplitter(RevenueSplit.defaults());

    @Test
    void split_withPreviousOwner_paysOwnerAndCarriesRemainderIntoPool() {
        final PaymentSplit split = splitter.split(110, true);

        assertThat(split.previousOwnerShare()).isEqualTo(92);
        assertThat(split.operatorShare()).isEqualTo(1);
        assertThat(split.carry()).isEqualTo(1);
        assertThat(split.poolShare()).isEqualTo(17);
        assertThat(split.total()).isEqualTo(110);
    }

    @Test
    void split_withoutPreviousOwner_redirectsOwnerShareToPool() {
        final PaymentSplit split = splitter.split(100, false);

        assertThat(split.previousOwnerShare()).isZero();
        assertThat(split.poolShare()).isEqualTo(99);
        assertThat(split.operatorShare()).isEqualTo(1);
        assertThat(split.carry()).isZero();
    }

    @Test
    void split_alwaysAccountsForTheFullAmount() {
        final long[] amounts = {0, 1, 7, 99, 101, 12_345, 100_000_000_000_000L, Long.MAX_VALUE};
        for (final long amount : amounts) {
            assertThat(splitter.split(amount, true).total()).as("amount %d with owner", amount).isEqualTo(amount);
            assertThat(splitter.split(amount, false).total()).as("amount %d without owner", amount).isEqualTo(amount);
        }
    }

    @Test
    void split_rejectsNegativeAmount() {
        assertThatThrownBy(() -> splitter.split(-1, false)).isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void revenueSplit_mustSumToHundred() {
        assertThatThrownBy(() -> new RevenueSplit(84, 23, 1)).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new RevenueSplit(101, 0, -1)).isInstanceOf(IllegalArgumentException.class);
        assertThat(new RevenueSplit(50, 50, 0).toString()).isEqualTo("50/50/0");
    }
}
