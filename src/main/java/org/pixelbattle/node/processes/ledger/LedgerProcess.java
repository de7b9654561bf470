package org.pixelbattle.node.processes.ledger;

import com.typesafe.config.Config;
import org.pixelbattle.ledger.LedgerConfig;
import org.pixelbattle.ledger.PixelBattleLedger;
import org.pixelbattle.ledger.cycle.CycleSettlement;
import org.pixelbattle.ledger.persistence.ISnapshotStore;
import org.pixelbattle.ledger.persistence.JsonSnapshotStore;
import org.pixelbattle.ledger.persistence.LedgerSnapshot;
import org.pixelbattle.ledger.spi.ILedgerListener;
import org.pixelbattle.ledger.transfer.InMemoryTransferGateway;
import org.pixelbattle.node.processes.AbstractProcess;
import org.pixelbattle.node.spi.IServiceProvider;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

/**
 * Hosts the {@link PixelBattleLedger} and exposes it to other processes.
 * <p>
 * The ledger is built from the process options (see {@link LedgerConfig}). If {@code snapshot.file}
 * is set, the ledger is restored from that file on creation and written back after every cycle
 * settlement, every {@code snapshot.interval} and on stop.
 */
public class LedgerProcess extends AbstractProcess implements IServiceProvider {
    private static final Logger LOG = LoggerFactory.getLogger(LedgerProcess.class);
    private static final Duration DEFAULT_SNAPSHOT_INTERVAL = Duration.ofMinutes(1);

    private final InMemoryTransferGateway gateway;
    private final ISnapshotStore snapshotStore;
    private final Duration snapshotInterval;
    private final PixelBattleLedger ledger;
    private ScheduledExecutorService snapshotScheduler;

    public LedgerProcess(final String processName, final Map<String, Object> dependencies, final Config options) {
        this(processName, dependencies, options, Clock.systemUTC());
    }

    LedgerProcess(final String processName, final Map<String, Object> dependencies, final Config options,
                  final Clock clock) {
        this(processName, dependencies, options, clock, options.hasPath("snapshot.file")
            ? new JsonSnapshotStore(Path.of(options.getString("snapshot.file")))
            : null);
    }

    LedgerProcess(final String processName, final Map<String, Object> dependencies, final Config options,
                  final Clock clock, final ISnapshotStore snapshotStore) {
        super(processName, dependencies, options);
        final LedgerConfig ledgerConfig = LedgerConfig.fromConfig(options);
        this.gateway = new InMemoryTransferGateway();
        this.snapshotStore = snapshotStore;
        this.snapshotInterval = options.hasPath("snapshot.interval")
            ? options.getDuration("snapshot.interval")
            : DEFAULT_SNAPSHOT_INTERVAL;
        this.ledger = createLedger(ledgerConfig, clock);
        LOG.info("Ledger ready: grid {}, initial price {}, split {}, inactivity window {}.",
            ledgerConfig.grid(), ledgerConfig.initialPrice(), ledgerConfig.split(), ledgerConfig.inactivityWindow());
    }

    private PixelBattleLedger createLedger(final LedgerConfig ledgerConfig, final Clock clock) {
        if (snapshotStore == null) {
            return new PixelBattleLedger(ledgerConfig, gateway, clock);
        }
        final Optional<LedgerSnapshot> snapshot;
        try {
            snapshot = snapshotStore.load();
        } catch (final IOException e) {
            throw new IllegalStateException("Could not read ledger snapshot for process '" + processName + "'", e);
        }
        return snapshot
            .map(s -> PixelBattleLedger.restore(ledgerConfig, gateway, clock, s))
            .orElseGet(() -> new PixelBattleLedger(ledgerConfig, gateway, clock));
    }

    @Override
    public void start() {
        if (snapshotStore == null) {
            return;
        }
        ledger.addListener(new ILedgerListener() {
            @Override
            public void onCycleSettled(final CycleSettlement settlement) {
                persist();
            }
        });
        snapshotScheduler = Executors.newSingleThreadScheduledExecutor(r -> {
            final Thread thread = new Thread(r, processName + "-snapshot");
            thread.setDaemon(true);
            return thread;
        });
        final long periodMillis = snapshotInterval.toMillis();
        snapshotScheduler.scheduleAtFixedRate(this::persist, periodMillis, periodMillis, TimeUnit.MILLISECONDS);
    }

    @Override
    public void stop() {
        if (snapshotScheduler != null) {
            snapshotScheduler.shutdown();
            try {
                if (!snapshotScheduler.awaitTermination(3, TimeUnit.SECONDS)) {
                    snapshotScheduler.shutdownNow();
                }
            } catch (final InterruptedException e) {
                Thread.currentThread().interrupt();
                snapshotScheduler.shutdownNow();
            }
        }
        if (snapshotStore != null) {
            persist();
        }
    }

    /**
     * Writes the current ledger state to the snapshot store. Failures are logged; the ledger keeps running.
     */
    void persist() {
        try {
            snapshotStore.save(ledger.snapshot());
        } catch (final IOException | RuntimeException e) {
            LOG.error("Failed to persist ledger snapshot of process '{}'.", processName, e);
        }
    }

    @Override
    public Object getExposedService() {
        return ledger;
    }

    public PixelBattleLedger getLedger() {
        return ledger;
    }

    public InMemoryTransferGateway getGateway() {
        return gateway;
    }
}
