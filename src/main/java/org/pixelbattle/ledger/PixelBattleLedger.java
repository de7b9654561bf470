package org.pixelbattle.ledger;

import it.unimi.dsi.fastutil.ints.IntOpenHashSet;
import it.unimi.dsi.fastutil.ints.IntSet;
import org.pixelbattle.ledger.cycle.CycleSettlement;
import org.pixelbattle.ledger.cycle.CycleStatus;
import org.pixelbattle.ledger.cycle.GameCycleController;
import org.pixelbattle.ledger.model.ActorId;
import org.pixelbattle.ledger.model.CanvasSnapshot;
import org.pixelbattle.ledger.model.Cell;
import org.pixelbattle.ledger.model.CellView;
import org.pixelbattle.ledger.model.Coordinate;
import org.pixelbattle.ledger.model.GameCycle;
import org.pixelbattle.ledger.model.GridProperties;
import org.pixelbattle.ledger.model.GridStore;
import org.pixelbattle.ledger.model.OwnershipLedger;
import org.pixelbattle.ledger.payment.PaymentSplitter;
import org.pixelbattle.ledger.persistence.LedgerSnapshot;
import org.pixelbattle.ledger.prize.PrizeDistributor;
import org.pixelbattle.ledger.prize.WinnerResolver;
import org.pixelbattle.ledger.purchase.BatchPurchaseResult;
import org.pixelbattle.ledger.purchase.PurchaseOrder;
import org.pixelbattle.ledger.purchase.PurchaseProcessor;
import org.pixelbattle.ledger.purchase.PurchaseReceipt;
import org.pixelbattle.ledger.purchase.PurchaseRejectedException;
import org.pixelbattle.ledger.spi.ILedgerListener;
import org.pixelbattle.ledger.spi.ITransferGateway;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Consumer;
import java.util.function.Supplier;

/**
 * The pixel ownership ledger. Owns the grid, the ownership counts and the game cycle as private
 * state and exposes the only operations that may read or change them.
 * <p>
 * All operations run under one global lock, so purchases and cycle ends execute in a total order.
 * Payment transfers are made while the lock is held; a transfer gateway that calls back into the
 * ledger on the same thread is rejected with an {@link IllegalStateException} instead of
 * re-entering. Listeners are notified after the lock was released and may call back freely.
 */
public class PixelBattleLedger {
    private static final Logger LOG = LoggerFactory.getLogger(PixelBattleLedger.class);

    private final LedgerConfig config;
    private final Clock clock;

    private final GridStore grid;
    private final OwnershipLedger ownership;
    private final GameCycle cycle;
    private final GameCycleController cycleController;
    private final PurchaseProcessor purchaseProcessor;
    private final WinnerResolver winnerResolver;

    private final ReentrantLock lock = new ReentrantLock(true);
    private final List<ILedgerListener> listeners = new CopyOnWriteArrayList<>();

    /**
     * Creates an empty ledger. The first cycle opens immediately if {@link LedgerConfig#autoStart()} is set.
     *
     * @param config  validated settings
     * @param gateway transfer capability for disbursements and prizes
     * @param clock   time source
     */
    public PixelBattleLedger(final LedgerConfig config, final ITransferGateway gateway, final Clock clock) {
        this(config, gateway, clock, new GameCycle(config.inactivityWindow()));
        if (config.autoStart()) {
            cycleController.start(clock.instant());
        }
    }

    private PixelBattleLedger(final LedgerConfig config, final ITransferGateway gateway, final Clock clock,
                              final GameCycle cycle) {
        this.config = Objects.requireNonNull(config, "config");
        this.clock = Objects.requireNonNull(clock, "clock");
        Objects.requireNonNull(gateway, "gateway");
        this.grid = new GridStore(config.grid(), config.initialPrice());
        this.ownership = new OwnershipLedger();
        this.cycle = cycle;
        this.winnerResolver = new WinnerResolver();
        this.cycleController = new GameCycleController(cycle, ownership, winnerResolver, new PrizeDistributor(gateway));
        this.purchaseProcessor = new PurchaseProcessor(grid, ownership, cycleController, config.pricingEngine(),
            new PaymentSplitter(config.split()), gateway, config.operator());
    }

    /**
     * Rebuilds a ledger from a snapshot. Ownership counts are recomputed from the cells written in
     * the snapshot's current cycle. {@link LedgerConfig#autoStart()} applies only if the snapshot
     * holds no active cycle.
     *
     * @throws IllegalArgumentException if the snapshot does not fit the configuration or is inconsistent
     */
    public static PixelBattleLedger restore(final LedgerConfig config, final ITransferGateway gateway,
                                            final Clock clock, final LedgerSnapshot snapshot) {
        final GridProperties grid = config.grid();
        if (snapshot.width() != grid.getWidth() || snapshot.height() != grid.getHeight()) {
            throw new IllegalArgumentException("Snapshot grid " + snapshot.width() + "x" + snapshot.height()
                + " does not match configured grid " + grid);
        }
        final LedgerSnapshot.CycleRecord c = snapshot.cycle();
        final GameCycle cycle = new GameCycle(config.inactivityWindow(), c.active(), c.cycleId(),
            toInstant(c.startedAt()), toInstant(c.lastActivityAt()), c.prizePool());
        final PixelBattleLedger ledger = new PixelBattleLedger(config, gateway, clock, cycle);

        final IntSet seen = new IntOpenHashSet(snapshot.cells().size());
        for (final LedgerSnapshot.CellRecord record : snapshot.cells()) {
            if (!grid.inBounds(record.x(), record.y())) {
                throw new IllegalArgumentException("Cell (" + record.x() + ", " + record.y() + ") lies outside the "
                    + grid + " grid.");
            }
            if (!seen.add(grid.toFlatIndex(record.x(), record.y()))) {
                throw new IllegalArgumentException("Cell (" + record.x() + ", " + record.y()
                    + ") appears more than once in the snapshot.");
            }
            if (record.lastUpdateCycle() > c.cycleId()) {
                throw new IllegalArgumentException("Cell (" + record.x() + ", " + record.y() + ") was written in cycle "
                    + record.lastUpdateCycle() + ", after the snapshot's cycle " + c.cycleId());
            }
            if (record.price() < config.initialPrice()) {
                throw new IllegalArgumentException("Cell (" + record.x() + ", " + record.y() + ") is priced below the initial price.");
            }
            ledger.grid.set(record.x(), record.y(),
                new Cell(record.owner(), record.price(), record.tag(), record.lastUpdateCycle()));
            if (record.owner() != null && record.lastUpdateCycle() == c.cycleId()) {
                ledger.ownership.credit(record.owner(), grid.toFlatIndex(record.x(), record.y()));
            }
        }
        if (config.autoStart() && !cycle.isActive()) {
            ledger.cycleController.start(clock.instant());
        }
        LOG.info("Ledger restored: cycle {} ({}), {} cells, {} owned, prize pool {}.", cycle.getCycleId(),
            cycle.isActive() ? "active" : "inactive", snapshot.cells().size(), ledger.ownership.getTotalOwned(),
            cycle.getPrizePool());
        return ledger;
    }

    public LedgerConfig getConfig() {
        return config;
    }

    public void addListener(final ILedgerListener listener) {
        listeners.add(Objects.requireNonNull(listener, "listener"));
    }

    public void removeListener(final ILedgerListener listener) {
        listeners.remove(listener);
    }

    /**
     * Opens the first cycle if none is active.
     *
     * @return {@code true} if a cycle was opened
     */
    public boolean start() {
        return locked(() -> cycleController.start(clock.instant()));
    }

    /**
     * Buys the cell at ({@code x}, {@code y}) for {@code actor}.
     *
     * @throws PurchaseRejectedException if the purchase was rejected; the ledger is unchanged
     */
    public PurchaseReceipt purchase(final int x, final int y, final String tag, final long amountTendered,
                                    final ActorId actor) throws PurchaseRejectedException {
        return purchase(actor, new PurchaseOrder(x, y, tag, amountTendered));
    }

    /**
     * Buys one cell for {@code actor}.
     *
     * @throws PurchaseRejectedException if the purchase was rejected; the ledger is unchanged
     */
    public PurchaseReceipt purchase(final ActorId actor, final PurchaseOrder order) throws PurchaseRejectedException {
        final PurchaseReceipt receipt;
        enter();
        try {
            receipt = purchaseProcessor.process(actor, order, clock.instant());
        } finally {
            lock.unlock();
        }
        notifyListeners(l -> l.onPixelPurchased(receipt));
        return receipt;
    }

    /**
     * Processes several orders in sequence without letting other operations interleave. Each order
     * commits or fails on its own.
     *
     * @param actor  the buyer of all orders
     * @param orders the orders, processed in list order
     * @return receipts and failures
     */
    public BatchPurchaseResult purchaseBatch(final ActorId actor, final List<PurchaseOrder> orders) {
        Objects.requireNonNull(actor, "actor");
        if (orders == null || orders.isEmpty()) {
            throw new IllegalArgumentException("A batch needs at least one order.");
        }
        final List<PurchaseReceipt> receipts = new ArrayList<>();
        final List<BatchPurchaseResult.Failure> failures = new ArrayList<>();
        enter();
        try {
            for (final PurchaseOrder order : orders) {
                try {
                    receipts.add(purchaseProcessor.process(actor, order, clock.instant()));
                } catch (final PurchaseRejectedException e) {
                    failures.add(new BatchPurchaseResult.Failure(order, e.getError(), e.getMessage()));
                }
            }
        } finally {
            lock.unlock();
        }
        for (final PurchaseReceipt receipt : receipts) {
            notifyListeners(l -> l.onPixelPurchased(receipt));
        }
        return new BatchPurchaseResult(receipts, failures);
    }

    /**
     * @return the lazily resolved cell
     * @throws org.pixelbattle.ledger.model.CellOutOfBoundsException if the coordinate is outside the grid
     */
    public CellView getCell(final int x, final int y) {
        return locked(() -> CellView.of(x, y, resolved(grid.get(x, y))));
    }

    /**
     * @return coordinates of the cells {@code actor} owns in the current cycle, in row-major order
     */
    public List<Coordinate> getOwnedCells(final ActorId actor) {
        return locked(() -> {
            final IntSet indices = ownership.ownedIndices(actor);
            final int[] sorted = indices.toIntArray();
            Arrays.sort(sorted);
            final List<Coordinate> result = new ArrayList<>(sorted.length);
            for (final int index : sorted) {
                result.add(grid.getProperties().toCoordinate(index));
            }
            return List.copyOf(result);
        });
    }

    public int getPixelCount(final ActorId actor) {
        return locked(() -> ownership.count(actor));
    }

    /**
     * @return actor to owned-cell count for the current cycle
     */
    public Map<ActorId, Integer> getOwnershipCounts() {
        return locked(ownership::snapshotCounts);
    }

    /**
     * @return the actors that would win if the cycle ended now
     */
    public Set<ActorId> getLeaders() {
        return locked(() -> winnerResolver.resolve(ownership));
    }

    public CycleStatus getCycleState() {
        return getCycleState(clock.instant());
    }

    public CycleStatus getCycleState(final Instant now) {
        return locked(() -> cycleController.status(now));
    }

    /**
     * @return the whole grid, lazily resolved
     */
    public CanvasSnapshot getCanvas() {
        return locked(() -> {
            final GridProperties props = grid.getProperties();
            final List<CellView> cells = new ArrayList<>(props.getCellCount());
            for (int index = 0; index < props.getCellCount(); index++) {
                final Coordinate c = props.toCoordinate(index);
                cells.add(CellView.of(c.x(), c.y(), resolved(grid.getAt(index))));
            }
            return new CanvasSnapshot(props.getWidth(), props.getHeight(), cycleController.getCycleId(), cells);
        });
    }

    public boolean tryEndCycle() {
        return tryEndCycle(clock.instant());
    }

    /**
     * Ends the cycle if its inactivity window has passed. Safe to call from anyone, any number of
     * times: only the first call after the deadline transitions, all others return {@code false}.
     */
    public boolean tryEndCycle(final Instant now) {
        return settleCycle(now).isPresent();
    }

    /**
     * Like {@link #tryEndCycle(Instant)} but returns the settlement report.
     */
    public Optional<CycleSettlement> settleCycle(final Instant now) {
        Objects.requireNonNull(now, "now");
        final Optional<CycleSettlement> settlement = locked(() -> cycleController.endAndRestart(now));
        settlement.ifPresent(s -> notifyListeners(l -> l.onCycleSettled(s)));
        return settlement;
    }

    /**
     * @return a consistent snapshot of the ledger for persistence
     */
    public LedgerSnapshot snapshot() {
        return locked(() -> {
            final int[] touched = grid.getTouchedIndices().toIntArray();
            Arrays.sort(touched);
            final List<LedgerSnapshot.CellRecord> cells = new ArrayList<>(touched.length);
            for (final int index : touched) {
                final Coordinate c = grid.getProperties().toCoordinate(index);
                final Cell cell = grid.getAt(index);
                cells.add(new LedgerSnapshot.CellRecord(c.x(), c.y(), cell.owner(), cell.price(), cell.tag(),
                    cell.lastUpdateCycle()));
            }
            final LedgerSnapshot.CycleRecord cycleRecord = new LedgerSnapshot.CycleRecord(cycle.isActive(),
                cycle.getCycleId(), toEpochMilli(cycle.getStartedAt()), toEpochMilli(cycle.getLastActivityAt()),
                cycle.getPrizePool());
            return new LedgerSnapshot(LedgerSnapshot.CURRENT_FORMAT_VERSION, grid.getWidth(), grid.getHeight(),
                cycleRecord, cells);
        });
    }

    private Cell resolved(final Cell cell) {
        return cell.resolve(cycle.getCycleId(), grid.getInitialPrice());
    }

    private void enter() {
        if (lock.isHeldByCurrentThread()) {
            throw new IllegalStateException("Re-entrant ledger call from inside a ledger operation.");
        }
        lock.lock();
    }

    private <T> T locked(final Supplier<T> action) {
        enter();
        try {
            return action.get();
        } finally {
            lock.unlock();
        }
    }

    private void notifyListeners(final Consumer<ILedgerListener> event) {
        for (final ILedgerListener listener : listeners) {
            try {
                event.accept(listener);
            } catch (final RuntimeException e) {
                LOG.warn("Ledger listener {} failed.", listener.getClass().getName(), e);
            }
        }
    }

    private static Instant toInstant(final Long epochMilli) {
        return epochMilli == null ? null : Instant.ofEpochMilli(epochMilli);
    }

    private static Long toEpochMilli(final Instant instant) {
        return instant == null ? null : instant.toEpochMilli();
    }
}
