package org.pixelbattle.ledger.purchase;

/**
 * Reasons a purchase is rejected.
 */
public enum PurchaseError {
    GAME_NOT_ACTIVE(true),
    OUT_OF_BOUNDS(true),
    INVALID_TAG(true),
    INSUFFICIENT_PAYMENT(true),
    ALREADY_OWNER(true),
    /** A disbursement failed; the purchase was rolled back. */
    TRANSFER_FAILED(false);

    private final boolean validation;

    PurchaseError(final boolean validation) {
        this.validation = validation;
    }

    /**
     * @return {@code true} if the purchase was rejected before any state was touched, so the caller
     * can retry with corrected input
     */
    public boolean isValidation() {
        return validation;
    }
}
