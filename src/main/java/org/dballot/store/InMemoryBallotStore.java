package org.dballot.store;

import org.dballot.identity.Identity;
import org.dballot.ledger.VotingRecord;
import org.dballot.proposal.ProposalLabel;

import java.util.*;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Simple in-memory implementation of BallotStore.
 * <p>
 * {@link #atomically(Runnable)} snapshots the counts, records and granted weight and restores them if the body throws.
 */
public class InMemoryBallotStore implements BallotStore {
    private final Map<Identity, VotingRecord> records = new ConcurrentHashMap<>();
    private final List<ProposalLabel> labels = new CopyOnWriteArrayList<>();
    private final Map<Integer, Long> voteCounts = new ConcurrentHashMap<>();
    private volatile Identity administrator;
    private volatile long grantedWeight;

    @Override
    public Identity getAdministrator() {
        return administrator;
    }

    @Override
    public void putAdministrator(Identity administrator) {
        this.administrator = administrator;
    }

    @Override
    public List<ProposalLabel> getProposalLabels() {
        return new ArrayList<>(labels);
    }

    @Override
    public void putProposals(List<ProposalLabel> proposalLabels) {
        labels.clear();
        voteCounts.clear();
        labels.addAll(proposalLabels);
        for (int i = 0; i < proposalLabels.size(); i++)
            voteCounts.put(i, 0L);
    }

    @Override
    public long getVoteCount(int index) {
        return voteCounts.getOrDefault(index, 0L);
    }

    @Override
    public void putVoteCount(int index, long count) {
        voteCounts.put(index, count);
    }

    @Override
    public VotingRecord getRecord(Identity identity) {
        VotingRecord record = records.get(identity);
        return record == null ? null : record.copy();
    }

    @Override
    public void putRecord(Identity identity, VotingRecord record) {
        records.put(identity, record.copy());
    }

    @Override
    public Set<Identity> getIdentities() {
        return new HashSet<>(records.keySet());
    }

    @Override
    public long getGrantedWeight() {
        return grantedWeight;
    }

    @Override
    public void putGrantedWeight(long weight) {
        this.grantedWeight = weight;
    }

    @Override
    public synchronized void atomically(Runnable body) {
        Map<Identity, VotingRecord> recordSnapshot = new HashMap<>();
        records.forEach((identity, record) -> recordSnapshot.put(identity, record.copy()));
        Map<Integer, Long> countSnapshot = new HashMap<>(voteCounts);
        long grantedSnapshot = grantedWeight;
        try {
            body.run();
        } catch (RuntimeException e) {
            records.clear();
            records.putAll(recordSnapshot);
            voteCounts.clear();
            voteCounts.putAll(countSnapshot);
            grantedWeight = grantedSnapshot;
            throw e;
        }
    }
}
