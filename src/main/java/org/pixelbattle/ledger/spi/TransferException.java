package org.pixelbattle.ledger.spi;

import org.pixelbattle.ledger.model.ActorId;

/**
 * Signals that a payment transfer could not be completed.
 */
public class TransferException extends Exception {

    private final ActorId recipient;
    private final long amount;

    public TransferException(final ActorId recipient, final long amount, final String message) {
        super(message);
        this.recipient = recipient;
        this.amount = amount;
    }

    public TransferException(final ActorId recipient, final long amount, final String message, final Throwable cause) {
        super(message, cause);
        this.recipient = recipient;
        this.amount = amount;
    }

    public ActorId getRecipient() {
        return recipient;
    }

    public long getAmount() {
        return amount;
    }
}
