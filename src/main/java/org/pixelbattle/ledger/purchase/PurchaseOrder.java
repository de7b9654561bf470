package org.pixelbattle.ledger.purchase;

/**
 * A request to buy one cell.
 *
 * @param x              column
 * @param y              row
 * @param tag            payload to attach to the cell, must not be empty
 * @param amountTendered amount the buyer pays; everything above the listed price is split too
 */
public record PurchaseOrder(int x, int y, String tag, long amountTendered) {
}
