package org.pixelbattle.node.processes.cycle;

import com.typesafe.config.Config;
import org.pixelbattle.ledger.PixelBattleLedger;
import org.pixelbattle.node.processes.AbstractProcess;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Map;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

/**
 * Periodically asks the ledger to end its cycle. The ledger decides whether the inactivity window
 * has passed, so polling too often is harmless.
 *
 * <pre>
 * cycle-watchdog {
 *   className = "org.pixelbattle.node.processes.cycle.CycleWatchdogProcess"
 *   require { ledger = "ledger" }
 *   options { poll-interval = 10s }
 * }
 * </pre>
 */
public class CycleWatchdogProcess extends AbstractProcess {
    private static final Logger LOG = LoggerFactory.getLogger(CycleWatchdogProcess.class);
    private static final Duration DEFAULT_POLL_INTERVAL = Duration.ofSeconds(10);

    private final PixelBattleLedger ledger;
    private final Duration pollInterval;
    private ScheduledExecutorService scheduler;

    public CycleWatchdogProcess(final String processName, final Map<String, Object> dependencies, final Config options) {
        super(processName, dependencies, options);
        this.ledger = getDependency("ledger", PixelBattleLedger.class);
        this.pollInterval = options.hasPath("poll-interval")
            ? options.getDuration("poll-interval")
            : DEFAULT_POLL_INTERVAL;
        if (pollInterval.isZero() || pollInterval.isNegative()) {
            throw new IllegalArgumentException("poll-interval must be positive, got " + pollInterval);
        }
    }

    @Override
    public void start() {
        scheduler = Executors.newSingleThreadScheduledExecutor(r -> {
            final Thread thread = new Thread(r, processName);
            thread.setDaemon(true);
            return thread;
        });
        final long periodMillis = pollInterval.toMillis();
        scheduler.scheduleWithFixedDelay(this::poll, periodMillis, periodMillis, TimeUnit.MILLISECONDS);
        LOG.debug("Cycle watchdog '{}' polling every {}.", processName, pollInterval);
    }

    /**
     * Runs one check. Exceptions are logged so the schedule keeps running.
     *
     * @return whether a cycle was ended
     */
    boolean poll() {
        try {
            return ledger.tryEndCycle();
        } catch (final RuntimeException e) {
            LOG.error("Cycle watchdog '{}' failed to check the game cycle.", processName, e);
            return false;
        }
    }

    @Override
    public void stop() {
        if (scheduler == null) {
            return;
        }
        scheduler.shutdown();
        try {
            if (!scheduler.awaitTermination(3, TimeUnit.SECONDS)) {
                scheduler.shutdownNow();
            }
        } catch (final InterruptedException e) {
            Thread.currentThread().interrupt();
            scheduler.shutdownNow();
        }
    }
}
