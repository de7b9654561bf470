package org.pixelbattle.ledger.payment;

/**
 * Result of splitting one payment. The components always add up to the split amount.
 *
 * @param previousOwnerShare amount for the previous owner, {@code 0} if the cell was unowned
 * @param poolShare          amount for the prize pool, rounding carry included
 * @param operatorShare      amount for the operator
 * @param carry              rounding remainder that was folded into {@code poolShare}
 */
public record PaymentSplit(long previousOwnerShare, long poolShare, long operatorShare, long carry) {

    public long total() {
        return previousOwnerShare + poolShare + operatorShare;
    }
}
