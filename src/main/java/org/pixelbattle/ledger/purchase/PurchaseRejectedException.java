package org.pixelbattle.ledger.purchase;

/**
 * Thrown when a purchase does not commit. The ledger state is exactly as before the attempt.
 */
public class PurchaseRejectedException extends Exception {

    private final PurchaseError error;

    public PurchaseRejectedException(final PurchaseError error, final String message) {
        super(message);
        this.error = error;
    }

    public PurchaseRejectedException(final PurchaseError error, final String message, final Throwable cause) {
        super(message, cause);
        this.error = error;
    }

    public PurchaseError getError() {
        return error;
    }
}
