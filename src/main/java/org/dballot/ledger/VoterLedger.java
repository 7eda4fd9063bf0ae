package org.dballot.ledger;

import org.dballot.governance.BallotError;
import org.dballot.governance.BallotException;
import org.dballot.identity.Identity;
import org.dballot.store.BallotStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;
import java.util.Set;

/**
 * Identity to {@link VotingRecord} mapping on top of a {@link BallotStore}.
 * <p>
 * Records handed out are detached copies; changes only take effect through {@link #set}.
 */
public class VoterLedger {

    private static final Logger log = LoggerFactory.getLogger(VoterLedger.class);

    private final BallotStore store;

    public VoterLedger(BallotStore store) {
        this.store = Objects.requireNonNull(store, "store must not be null");
    }

    /**
     * @return the record of {@code identity}, or an empty (weight 0) record if it was never stored
     */
    public VotingRecord get(Identity identity) {
        Objects.requireNonNull(identity, "identity must not be null");
        VotingRecord record = store.getRecord(identity);
        return record == null ? new VotingRecord() : record.copy();
    }

    public void set(Identity identity, VotingRecord record) {
        Objects.requireNonNull(identity, "identity must not be null");
        Objects.requireNonNull(record, "record must not be null");
        store.putRecord(identity, record.copy());
    }

    public VoterStatus status(Identity identity) {
        return get(identity).status();
    }

    /**
     * Gives {@code target} a weight of one. The administrator check is the caller's job.
     *
     * @throws BallotException {@link BallotError#ALREADY_HAS_RIGHTS} if the target already holds weight
     */
    public void grantRights(Identity target) {
        VotingRecord record = get(target);
        if (record.getWeight() != 0)
            throw new BallotException(BallotError.ALREADY_HAS_RIGHTS, target + " already has voting rights");
        record.setWeight(1);
        set(target, record);
        store.putGrantedWeight(store.getGrantedWeight() + 1);
        log.info("[VoterLedger] Granted voting rights to " + target);
    }

    public Set<Identity> identities() {
        return store.getIdentities();
    }

    /**
     * Total weight ever granted. Delegation only moves weight, so this never changes outside
     * {@link #grantRights(Identity)} and the administrator's initial grant.
     */
    public long totalGranted() {
        return store.getGrantedWeight();
    }

    /**
     * Weight held by identities that have neither voted nor delegated.
     */
    public long restingWeight() {
        long resting = 0;
        for (Identity identity : identities()) {
            VotingRecord record = store.getRecord(identity);
            if (record != null && !record.hasVoted())
                resting += record.getWeight();
        }
        return resting;
    }
}
