package org.pixelbattle.ledger.prize;

import org.pixelbattle.ledger.model.ActorId;

/**
 * One prize transfer attempted at the end of a cycle.
 *
 * @param recipient     the actor
 * @param cellCount     cells the actor held when the cycle ended
 * @param amount        the computed share
 * @param paid          whether the transfer went through
 * @param failureReason why the transfer failed, {@code null} when paid
 */
public record Payout(ActorId recipient, int cellCount, long amount, boolean paid, String failureReason) {

    static Payout paid(final ActorId recipient, final int cellCount, final long amount) {
        return new Payout(recipient, cellCount, amount, true, null);
    }

    static Payout failed(final ActorId recipient, final int cellCount, final long amount, final String reason) {
        return new Payout(recipient, cellCount, amount, false, reason);
    }
}
