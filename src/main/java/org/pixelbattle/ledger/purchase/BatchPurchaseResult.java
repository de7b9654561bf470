package org.pixelbattle.ledger.purchase;

import java.util.List;

/**
 * Outcome of a batch purchase. Orders commit or fail independently.
 *
 * @param receipts receipts of the committed orders, in submission order
 * @param failures rejected orders with their reasons, in submission order
 */
public record BatchPurchaseResult(List<PurchaseReceipt> receipts, List<Failure> failures) {

    public BatchPurchaseResult {
        receipts = List.copyOf(receipts);
        failures = List.copyOf(failures);
    }

    public boolean isFullySuccessful() {
        return failures.isEmpty();
    }

    /**
     * A rejected order.
     *
     * @param order  the order as submitted
     * @param error  the rejection code
     * @param reason human readable detail
     */
    public record Failure(PurchaseOrder order, PurchaseError error, String reason) {
    }
}
