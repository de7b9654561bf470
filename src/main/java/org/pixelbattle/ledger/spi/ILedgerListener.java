package org.pixelbattle.ledger.spi;

import org.pixelbattle.ledger.cycle.CycleSettlement;
import org.pixelbattle.ledger.purchase.PurchaseReceipt;

/**
 * Receives notifications about committed ledger changes. Callbacks run on the thread that performed
 * the change, after the ledger released its lock. Exceptions thrown by a listener are logged and
 * do not affect the committed change.
 */
public interface ILedgerListener {

    /**
     * Called after a purchase committed.
     */
    default void onPixelPurchased(final PurchaseReceipt receipt) {
    }

    /**
     * Called after a cycle ended, its prize was distributed and the next cycle opened.
     */
    default void onCycleSettled(final CycleSettlement settlement) {
    }
}
