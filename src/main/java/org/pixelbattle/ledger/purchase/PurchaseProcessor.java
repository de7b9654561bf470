package org.pixelbattle.ledger.purchase;

import org.pixelbattle.ledger.cycle.GameCycleController;
import org.pixelbattle.ledger.model.ActorId;
import org.pixelbattle.ledger.model.Cell;
import org.pixelbattle.ledger.model.Coordinate;
import org.pixelbattle.ledger.model.GameCycle;
import org.pixelbattle.ledger.model.GridStore;
import org.pixelbattle.ledger.model.OwnershipLedger;
import org.pixelbattle.ledger.payment.PaymentSplit;
import org.pixelbattle.ledger.payment.PaymentSplitter;
import org.pixelbattle.ledger.pricing.PricingEngine;
import org.pixelbattle.ledger.spi.ITransferGateway;
import org.pixelbattle.ledger.spi.TransferException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.Objects;

/**
 * Executes a single purchase: validate, price, split, mutate, disburse.
 * <p>
 * Validation happens against the lazily resolved cell before anything is written. Once mutation has
 * started the purchase either commits fully or is unwound from a pre-image: if a disbursement fails,
 * the cell, both ownership counts, the activity clock and the prize pool are restored and transfers
 * already made for this purchase are reversed.
 * <p>
 * <strong>Thread Safety:</strong> not thread-safe. The owning ledger serializes all access.
 */
public class PurchaseProcessor {
    private static final Logger LOG = LoggerFactory.getLogger(PurchaseProcessor.class);

    private final GridStore grid;
    private final OwnershipLedger ledger;
    private final GameCycleController cycleController;
    private final PricingEngine pricingEngine;
    private final PaymentSplitter paymentSplitter;
    private final ITransferGateway gateway;
    private final ActorId operator;

    public PurchaseProcessor(final GridStore grid,
                             final OwnershipLedger ledger,
                             final GameCycleController cycleController,
                             final PricingEngine pricingEngine,
                             final PaymentSplitter paymentSplitter,
                             final ITransferGateway gateway,
                             final ActorId operator) {
        this.grid = Objects.requireNonNull(grid, "grid");
        this.ledger = Objects.requireNonNull(ledger, "ledger");
        this.cycleController = Objects.requireNonNull(cycleController, "cycleController");
        this.pricingEngine = Objects.requireNonNull(pricingEngine, "pricingEngine");
        this.paymentSplitter = Objects.requireNonNull(paymentSplitter, "paymentSplitter");
        this.gateway = Objects.requireNonNull(gateway, "gateway");
        this.operator = Objects.requireNonNull(operator, "operator");
    }

    /**
     * Processes one purchase.
     *
     * @param buyer the purchasing actor
     * @param order what to buy and how much is tendered
     * @param now   the commit time
     * @return the receipt of the committed purchase
     * @throws PurchaseRejectedException if the purchase was rejected or rolled back
     */
    public PurchaseReceipt process(final ActorId buyer, final PurchaseOrder order, final Instant now)
            throws PurchaseRejectedException {
        Objects.requireNonNull(buyer, "buyer");
        Objects.requireNonNull(order, "order");

        // Validating
        if (!cycleController.isActive()) {
            throw reject(PurchaseError.GAME_NOT_ACTIVE, "No game cycle is active.");
        }
        final int x = order.x();
        final int y = order.y();
        if (!grid.inBounds(x, y)) {
            throw reject(PurchaseError.OUT_OF_BOUNDS, "Cell (" + x + ", " + y + ") is outside the "
                + grid.getProperties() + " grid.");
        }
        if (order.tag() == null || order.tag().isEmpty()) {
            throw reject(PurchaseError.INVALID_TAG, "A purchase must carry a non-empty tag.");
        }
        final long cycleId = cycleController.getCycleId();
        final Cell stored = grid.get(x, y);
        final Cell current = stored.resolve(cycleId, grid.getInitialPrice());
        if (order.amountTendered() < current.price()) {
            throw reject(PurchaseError.INSUFFICIENT_PAYMENT, "Cell (" + x + ", " + y + ") costs "
                + current.price() + " but " + order.amountTendered() + " was tendered.");
        }
        if (buyer.equals(current.owner())) {
            throw reject(PurchaseError.ALREADY_OWNER, buyer + " already owns cell (" + x + ", " + y + ").");
        }

        // Pricing and splitting
        final ActorId previousOwner = current.owner();
        final long newPrice = pricingEngine.nextPrice(current.price());
        final PaymentSplit split = paymentSplitter.split(order.amountTendered(), previousOwner != null);

        // Mutating. The pool goes first: it is the only write that can overflow.
        final int index = grid.getProperties().toFlatIndex(x, y);
        final GameCycle cyclePreImage = cycleController.capture();
        cycleController.addToPool(split.poolShare());
        try {
            grid.set(x, y, current.purchasedBy(buyer, newPrice, order.tag(), cycleId));
            if (previousOwner != null) {
                ledger.debit(previousOwner, index);
            }
            ledger.credit(buyer, index);
            cycleController.recordActivity(now);

            // Disbursing
            disburse(previousOwner, split);
        } catch (final TransferException e) {
            rollback(buyer, previousOwner, index, stored, cyclePreImage);
            LOG.warn("Purchase of ({}, {}) by {} rolled back: transfer of {} to {} failed: {}",
                x, y, buyer, e.getAmount(), e.getRecipient(), e.getMessage());
            throw new PurchaseRejectedException(PurchaseError.TRANSFER_FAILED,
                "Transfer of " + e.getAmount() + " to " + e.getRecipient() + " failed: " + e.getMessage(), e);
        } catch (final RuntimeException e) {
            rollback(buyer, previousOwner, index, stored, cyclePreImage);
            throw e;
        }

        LOG.debug("Cell ({}, {}) bought by {} for {} (listed {}), new price {}, split {}.",
            x, y, buyer, order.amountTendered(), current.price(), newPrice, split);
        return new PurchaseReceipt(buyer, x, y, order.tag(), current.price(), order.amountTendered(),
            newPrice, previousOwner, split, cycleId, now);
    }

    private void rollback(final ActorId buyer, final ActorId previousOwner, final int index,
                          final Cell stored, final GameCycle cyclePreImage) {
        if (ledger.ownedIndices(buyer).contains(index)) {
            ledger.debit(buyer, index);
        }
        if (previousOwner != null && !ledger.ownedIndices(previousOwner).contains(index)) {
            ledger.credit(previousOwner, index);
        }
        final Coordinate coordinate = grid.getProperties().toCoordinate(index);
        grid.set(coordinate.x(), coordinate.y(), stored);
        cycleController.restore(cyclePreImage);
    }

    private void disburse(final ActorId previousOwner, final PaymentSplit split) throws TransferException {
        final boolean paysOwner = previousOwner != null && split.previousOwnerShare() > 0;
        if (paysOwner) {
            gateway.transfer(previousOwner, split.previousOwnerShare());
        }
        if (split.operatorShare() > 0) {
            try {
                gateway.transfer(operator, split.operatorShare());
            } catch (final TransferException | RuntimeException e) {
                if (paysOwner) {
                    compensate(previousOwner, split.previousOwnerShare(), e);
                }
                throw e;
            }
        }
    }

    private void compensate(final ActorId recipient, final long amount, final Exception failure) {
        try {
            gateway.reverse(recipient, amount);
        } catch (final TransferException reversalFailure) {
            LOG.error("Could not reverse transfer of {} to {} after a failed purchase.", amount, recipient, reversalFailure);
            failure.addSuppressed(reversalFailure);
        }
    }

    private PurchaseRejectedException reject(final PurchaseError error, final String message) {
        LOG.debug("Purchase rejected ({}): {}", error, message);
        return new PurchaseRejectedException(error, message);
    }
}
