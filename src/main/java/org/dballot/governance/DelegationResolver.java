package org.dballot.governance;

import org.dballot.identity.Identity;
import org.dballot.ledger.VoterLedger;

import java.util.Objects;

/**
 * Follows delegate pointers to the identity that ends up holding a delegated vote.
 * <p>
 * Pointers are plain identity values looked up afresh on every hop; nothing is cached
 * between delegations.
 */
public class DelegationResolver {

    private final VoterLedger ledger;

    public DelegationResolver(VoterLedger ledger) {
        this.ledger = Objects.requireNonNull(ledger, "ledger must not be null");
    }

    /**
     * Walks from {@code target} until reaching an identity that has not delegated further.
     * The caller has already rejected {@code target == start}.
     *
     * @param start  the identity that wants to delegate
     * @param target its chosen immediate delegate
     * @return the terminal delegate
     * @throws BallotException {@link BallotError#DELEGATION_CYCLE} as soon as the walk reaches {@code start}
     */
    public Identity resolve(Identity start, Identity target) {
        Identity current = target;
        Identity next = ledger.get(current).getDelegateTarget();
        while (next != null) {
            current = next;
            if (current.equals(start))
                throw new BallotException(BallotError.DELEGATION_CYCLE,
                        "Delegation from " + start + " to " + target + " would form a loop");
            next = ledger.get(current).getDelegateTarget();
        }
        return current;
    }
}
