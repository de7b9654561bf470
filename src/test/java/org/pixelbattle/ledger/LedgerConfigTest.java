package org.pixelbattle.ledger;

import com.typesafe.config.ConfigException;
import com.typesafe.config.ConfigFactory;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.pixelbattle.ledger.model.ActorId;
import org.pixelbattle.ledger.model.GridProperties;
import org.pixelbattle.ledger.payment.RevenueSplit;

import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@Tag("unit")
class LedgerConfigTest {

    @Test
    void fromConfig_emptyBlockYieldsDefaults() {
        final LedgerConfig config = LedgerConfig.fromConfig(ConfigFactory.empty());

        assertThat(config).isEqualTo(LedgerConfig.defaults());
        assertThat(config.grid().getWidth()).isEqualTo(32);
        assertThat(config.initialPrice()).isEqualTo(100_000_000_000_000L);
        assertThat(config.split()).isEqualTo(new RevenueSplit(84, 15, 1));
        assertThat(config.inactivityWindow()).isEqualTo(Duration.ofHours(24));
        assertThat(config.autoStart()).isTrue();
    }

    @Test
    void fromConfig_readsAllKeys() {
        final LedgerConfig config = LedgerConfig.fromConfig(ConfigFactory.parseString("""
            grid { width = 8, height = 4 }
            pricing { initial-price = 1000, multiplier-numerator = 3, multiplier-denominator = 2 }
            split { owner-percent = 70, pool-percent = 25, operator-percent = 5 }
            cycle { inactivity-window = 90m }
            operator-account = "house"
            auto-start = false
            """));

        assertThat(config.grid().getCellCount()).isEqualTo(32);
        assertThat(config.initialPrice()).isEqualTo(1000);
        assertThat(config.pricingEngine().nextPrice(1000)).isEqualTo(1500);
        assertThat(config.split()).isEqualTo(new RevenueSplit(70, 25, 5));
        assertThat(config.inactivityWindow()).isEqualTo(Duration.ofMinutes(90));
        assertThat(config.operator()).isEqualTo(ActorId.of("house"));
        assertThat(config.autoStart()).isFalse();
    }

    @Test
    void fromConfig_rejectsSplitNotSummingToHundred() {
        assertThatThrownBy(() -> LedgerConfig.fromConfig(ConfigFactory.parseString("split.pool-percent = 23")))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("84/23/1");
    }

    @Test
    void fromConfig_rejectsWrongTypes() {
        assertThatThrownBy(() -> LedgerConfig.fromConfig(ConfigFactory.parseString("grid.width = wide")))
            .isInstanceOf(ConfigException.WrongType.class);
    }

    @Test
    void constructor_rejectsInitialPriceThatCannotEscalate() {
        assertThatThrownBy(() -> new LedgerConfig(new GridProperties(2, 2), 5, 110, 100, RevenueSplit.defaults(),
            Duration.ofHours(1), ActorId.of("op"), true))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("does not increase");
    }

    @Test
    void constructor_rejectsNonPositiveWindow() {
        assertThatThrownBy(() -> new LedgerConfig(new GridProperties(2, 2), 100, 110, 100, RevenueSplit.defaults(),
            Duration.ZERO, ActorId.of("op"), true))
            .isInstanceOf(IllegalArgumentException.class);
    }
}
