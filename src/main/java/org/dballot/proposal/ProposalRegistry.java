package org.dballot.proposal;

import org.dballot.governance.BallotError;
import org.dballot.governance.BallotException;
import org.dballot.store.BallotStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Ordered, fixed set of proposals with their running vote counts.
 * <p>
 * The labels never change after construction; only the vote counts do, and only
 * through {@link #recordVote(int, long)}.
 */
public class ProposalRegistry {

    private static final Logger log = LoggerFactory.getLogger(ProposalRegistry.class);

    private final BallotStore store;
    private final List<ProposalLabel> labels;

    private ProposalRegistry(BallotStore store, List<ProposalLabel> labels) {
        this.store = store;
        this.labels = Collections.unmodifiableList(labels);
    }

    /**
     * Encodes the names and writes them to an empty store with zero vote counts.
     */
    public static ProposalRegistry construct(BallotStore store, List<String> names, LabelPolicy policy) {
        Objects.requireNonNull(store, "store must not be null");
        List<ProposalLabel> labels = encode(names, policy);
        store.putProposals(labels);
        log.info("[ProposalRegistry] Registered " + labels.size() + " proposals");
        return new ProposalRegistry(store, labels);
    }

    /**
     * Rebuilds the registry over a store that already holds proposals.
     */
    public static ProposalRegistry load(BallotStore store) {
        Objects.requireNonNull(store, "store must not be null");
        List<ProposalLabel> labels = store.getProposalLabels();
        if (labels.isEmpty())
            throw new IllegalStateException("Store holds no proposals");
        return new ProposalRegistry(store, new ArrayList<>(labels));
    }

    public static List<ProposalLabel> encode(List<String> names, LabelPolicy policy) {
        if (names == null || names.isEmpty())
            throw new BallotException(BallotError.INVALID_INPUT, "At least one proposal is required");
        LabelPolicy effective = policy == null ? LabelPolicy.TRUNCATE : policy;
        List<ProposalLabel> labels = new ArrayList<>(names.size());
        for (String name : names)
            labels.add(ProposalLabel.encode(name, effective));
        return labels;
    }

    public int size() {
        return labels.size();
    }

    public boolean contains(int index) {
        return index >= 0 && index < labels.size();
    }

    public List<ProposalLabel> labels() {
        return labels;
    }

    public Proposal get(int index) {
        if (!contains(index))
            throw new BallotException(BallotError.INVALID_PROPOSAL,
                    "Proposal index " + index + " out of range [0, " + labels.size() + ")");
        return new Proposal(index, labels.get(index), store.getVoteCount(index));
    }

    public List<Proposal> proposals() {
        List<Proposal> out = new ArrayList<>(labels.size());
        for (int i = 0; i < labels.size(); i++)
            out.add(new Proposal(i, labels.get(i), store.getVoteCount(i)));
        return out;
    }

    /**
     * Adds weight to a proposal. The index must already have been validated.
     */
    public void recordVote(int index, long weight) {
        long updated = store.getVoteCount(index) + weight;
        store.putVoteCount(index, updated);
        log.debug("[ProposalRegistry] Proposal " + index + " now at " + updated);
    }

    /**
     * Index of the proposal with the strictly greatest count. Ties go to the lowest index
     * and an all-zero tally yields 0.
     */
    public int winner() {
        int winning = 0;
        long max = 0;
        for (int i = 0; i < labels.size(); i++) {
            long count = store.getVoteCount(i);
            if (count > max) {
                max = count;
                winning = i;
            }
        }
        return winning;
    }
}
