package org.pixelbattle.ledger;

import com.typesafe.config.Config;
import org.pixelbattle.ledger.model.ActorId;
import org.pixelbattle.ledger.model.GridProperties;
import org.pixelbattle.ledger.payment.RevenueSplit;
import org.pixelbattle.ledger.pricing.PricingEngine;

import java.time.Duration;
import java.util.Objects;

/**
 * Immutable settings of a ledger. Every rule is checked here, once, so a misconfigured ledger never
 * gets constructed.
 *
 * <h3>Configuration Structure:</h3>
 * <pre>
 * grid { width = 32, height = 32 }
 * pricing {
 *   initial-price = 100000000000000
 *   multiplier-numerator = 110
 *   multiplier-denominator = 100
 * }
 * split { owner-percent = 84, pool-percent = 15, operator-percent = 1 }
 * cycle { inactivity-window = 24h }
 * operator-account = "operator"
 * auto-start = true
 * </pre>
 *
 * @param grid                  grid dimensions
 * @param initialPrice          price of an unowned cell
 * @param multiplierNumerator   price escalation numerator
 * @param multiplierDenominator price escalation denominator
 * @param split                 revenue split percentages
 * @param inactivityWindow      time without purchases after which a cycle may end
 * @param operator              account receiving the operator fee
 * @param autoStart             whether the first cycle opens on construction
 */
public record LedgerConfig(
    GridProperties grid,
    long initialPrice,
    long multiplierNumerator,
    long multiplierDenominator,
    RevenueSplit split,
    Duration inactivityWindow,
    ActorId operator,
    boolean autoStart
) {

    public static final long DEFAULT_INITIAL_PRICE = 100_000_000_000_000L;
    public static final Duration DEFAULT_INACTIVITY_WINDOW = Duration.ofHours(24);

    public LedgerConfig {
        Objects.requireNonNull(grid, "grid");
        Objects.requireNonNull(split, "split");
        Objects.requireNonNull(inactivityWindow, "inactivityWindow");
        Objects.requireNonNull(operator, "operator");
        if (initialPrice < 1) {
            throw new IllegalArgumentException("Initial price must be at least 1, got " + initialPrice);
        }
        if (inactivityWindow.isZero() || inactivityWindow.isNegative()) {
            throw new IllegalArgumentException("Inactivity window must be positive, got " + inactivityWindow);
        }
        final PricingEngine engine = new PricingEngine(multiplierNumerator, multiplierDenominator);
        if (!engine.escalates(initialPrice)) {
            throw new IllegalArgumentException("Initial price " + initialPrice + " does not increase under multiplier "
                + multiplierNumerator + "/" + multiplierDenominator + "; prices would stall.");
        }
    }

    /**
     * Defaults: 32x32 grid, initial price 10^14, 110/100 escalation, 84/15/1 split, 24h window.
     */
    public static LedgerConfig defaults() {
        return new LedgerConfig(new GridProperties(32, 32), DEFAULT_INITIAL_PRICE,
            PricingEngine.DEFAULT_NUMERATOR, PricingEngine.DEFAULT_DENOMINATOR,
            RevenueSplit.defaults(), DEFAULT_INACTIVITY_WINDOW, ActorId.of("operator"), true);
    }

    /**
     * Reads the settings from a HOCON block. Missing keys fall back to {@link #defaults()}.
     *
     * @param options the ledger configuration block
     * @return the validated settings
     * @throws IllegalArgumentException if a value breaks a ledger rule
     * @throws com.typesafe.config.ConfigException if a value has the wrong type
     */
    public static LedgerConfig fromConfig(final Config options) {
        final LedgerConfig d = defaults();
        final GridProperties grid = new GridProperties(
            getInt(options, "grid.width", d.grid().getWidth()),
            getInt(options, "grid.height", d.grid().getHeight()));
        final RevenueSplit split = new RevenueSplit(
            getInt(options, "split.owner-percent", d.split().ownerPercent()),
            getInt(options, "split.pool-percent", d.split().poolPercent()),
            getInt(options, "split.operator-percent", d.split().operatorPercent()));
        return new LedgerConfig(
            grid,
            getLong(options, "pricing.initial-price", d.initialPrice()),
            getLong(options, "pricing.multiplier-numerator", d.multiplierNumerator()),
            getLong(options, "pricing.multiplier-denominator", d.multiplierDenominator()),
            split,
            options.hasPath("cycle.inactivity-window") ? options.getDuration("cycle.inactivity-window") : d.inactivityWindow(),
            options.hasPath("operator-account") ? ActorId.of(options.getString("operator-account")) : d.operator(),
            options.hasPath("auto-start") ? options.getBoolean("auto-start") : d.autoStart());
    }

    public PricingEngine pricingEngine() {
        return new PricingEngine(multiplierNumerator, multiplierDenominator);
    }

    private static int getInt(final Config options, final String path, final int fallback) {
        return options.hasPath(path) ? options.getInt(path) : fallback;
    }

    private static long getLong(final Config options, final String path, final long fallback) {
        return options.hasPath(path) ? options.getLong(path) : fallback;
    }
}
