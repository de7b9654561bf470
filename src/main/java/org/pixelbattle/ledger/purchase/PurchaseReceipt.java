package org.pixelbattle.ledger.purchase;

import org.pixelbattle.ledger.model.ActorId;
import org.pixelbattle.ledger.payment.PaymentSplit;

import java.time.Instant;
import java.util.Optional;

/**
 * Record of a committed purchase.
 *
 * @param buyer          the new owner
 * @param x              column
 * @param y              row
 * @param tag            tag written to the cell
 * @param listedPrice    the price the cell was listed at before the purchase
 * @param amountTendered the amount actually paid and split
 * @param newPrice       the cell's price after the purchase
 * @param previousOwner  owner before the purchase, {@code null} if the cell was unowned
 * @param split          how the tendered amount was distributed
 * @param cycleId        cycle the purchase belongs to
 * @param purchasedAt    commit time
 */
public record PurchaseReceipt(
    ActorId buyer,
    int x,
    int y,
    String tag,
    long listedPrice,
    long amountTendered,
    long newPrice,
    ActorId previousOwner,
    PaymentSplit split,
    long cycleId,
    Instant purchasedAt
) {

    public Optional<ActorId> previousOwnerOptional() {
        return Optional.ofNullable(previousOwner);
    }
}
