package org.pixelbattle.ledger.transfer;

import org.pixelbattle.ledger.model.ActorId;
import org.pixelbattle.ledger.spi.ITransferGateway;
import org.pixelbattle.ledger.spi.TransferException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collections;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Account book that credits transfers to per-actor balances held in memory. Recipients can be
 * blocked, in which case transfers to them fail; this mirrors a wallet that refuses payments.
 * <p>
 * <strong>Thread Safety:</strong> thread-safe.
 */
public class InMemoryTransferGateway implements ITransferGateway {
    private static final Logger LOG = LoggerFactory.getLogger(InMemoryTransferGateway.class);

    private final Map<ActorId, Long> balances = new ConcurrentHashMap<>();
    private final Set<ActorId> blocked = ConcurrentHashMap.newKeySet();

    @Override
    public void transfer(final ActorId recipient, final long amount) throws TransferException {
        if (amount <= 0) {
            throw new TransferException(recipient, amount, "Transfer amount must be positive.");
        }
        if (blocked.contains(recipient)) {
            throw new TransferException(recipient, amount, "Recipient " + recipient + " does not accept transfers.");
        }
        balances.merge(recipient, amount, Math::addExact);
        LOG.debug("Transferred {} to {}.", amount, recipient);
    }

    @Override
    public void reverse(final ActorId recipient, final long amount) throws TransferException {
        final Long[] before = new Long[1];
        balances.compute(recipient, (id, balance) -> {
            before[0] = balance;
            if (balance == null || balance < amount) {
                return balance;
            }
            final long remaining = balance - amount;
            return remaining == 0 ? null : remaining;
        });
        if (before[0] == null || before[0] < amount) {
            throw new TransferException(recipient, amount, "Balance of " + recipient + " is too low to reverse " + amount + ".");
        }
        LOG.debug("Reversed transfer of {} to {}.", amount, recipient);
    }

    public long balanceOf(final ActorId actor) {
        return balances.getOrDefault(actor, 0L);
    }

    /**
     * @return all non-zero balances ordered by actor id
     */
    public Map<ActorId, Long> balances() {
        return Collections.unmodifiableMap(new TreeMap<>(balances));
    }

    public void block(final ActorId recipient) {
        blocked.add(recipient);
    }

    public void unblock(final ActorId recipient) {
        blocked.remove(recipient);
    }
}
