package org.pixelbattle.ledger.spi;

import org.pixelbattle.ledger.model.ActorId;

/**
 * Moves currency out of the ledger to an actor. Implementations are supplied by the host
 * (a wallet, a payment provider, an in-memory account book).
 * <p>
 * Implementations must not call back into the ledger. The ledger invokes the gateway while it holds
 * its write lock and rejects re-entrant calls from the same thread.
 */
public interface ITransferGateway {

    /**
     * Pays {@code amount} to {@code recipient}.
     *
     * @param recipient the receiving actor
     * @param amount    a positive amount in the smallest currency unit
     * @throws TransferException if the payment did not go through; nothing was paid in that case
     */
    void transfer(ActorId recipient, long amount) throws TransferException;

    /**
     * Takes back a transfer that completed earlier within the same, now failing, purchase.
     * Used to keep a purchase all-or-nothing when a later disbursement fails.
     *
     * @param recipient the actor that received the original transfer
     * @param amount    the amount of the original transfer
     * @throws TransferException if the claw-back failed
     */
    void reverse(ActorId recipient, long amount) throws TransferException;
}
