package org.dballot.store;

import org.dballot.identity.Identity;
import org.dballot.ledger.VotingRecord;
import org.dballot.proposal.ProposalLabel;

import java.util.List;
import java.util.Set;

/**
 * BallotStore - pluggable persistence for one voting round.
 */
public interface BallotStore extends AutoCloseable {

    /**
     * Administrator fixed at construction, or null for an empty store.
     */
    Identity getAdministrator();

    void putAdministrator(Identity administrator);

    /**
     * Proposal labels in index order; empty for an empty store.
     */
    List<ProposalLabel> getProposalLabels();

    /**
     * Stores the proposals with zero vote counts.
     */
    void putProposals(List<ProposalLabel> labels);

    long getVoteCount(int index);

    void putVoteCount(int index, long count);

    /**
     * Record of an identity, or null if none was ever stored.
     */
    VotingRecord getRecord(Identity identity);

    void putRecord(Identity identity, VotingRecord record);

    Set<Identity> getIdentities();

    /**
     * Total weight ever granted in this round; zero for an empty store.
     */
    long getGrantedWeight();

    void putGrantedWeight(long weight);

    /**
     * Runs {@code body} so that either all of its writes land or none do.
     */
    void atomically(Runnable body);

    @Override
    default void close() {
    }
}
