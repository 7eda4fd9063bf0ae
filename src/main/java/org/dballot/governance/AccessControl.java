package org.dballot.governance;

import org.dballot.identity.Identity;
import org.dballot.ledger.VoterLedger;

import java.util.Objects;

/**
 * Gates administrative operations to the single administrator and voting
 * operations to identities holding weight.
 */
public class AccessControl {

    private final Identity administrator;
    private final VoterLedger ledger;

    public AccessControl(Identity administrator, VoterLedger ledger) {
        this.administrator = Objects.requireNonNull(administrator, "administrator must not be null");
        this.ledger = Objects.requireNonNull(ledger, "ledger must not be null");
    }

    public Identity administrator() {
        return administrator;
    }

    public boolean isAdministrator(Identity actor) {
        return administrator.equals(actor);
    }

    public void requireAdministrator(Identity actor) {
        if (!isAdministrator(actor))
            throw new BallotException(BallotError.NOT_AUTHORIZED, "Only the administrator may do this");
    }

    public void requireVotingRights(Identity actor) {
        if (ledger.get(actor).getWeight() == 0)
            throw new BallotException(BallotError.NO_VOTING_RIGHTS, actor + " has no right to vote");
    }
}
