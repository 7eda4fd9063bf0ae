package org.dballot.proposal;

import java.util.Objects;

/**
 * Snapshot of one proposal: its position, label and the weight counted for it so far.
 */
public class Proposal {
    private final int index;
    private final ProposalLabel label;
    private final long voteCount;

    public Proposal(int index, ProposalLabel label, long voteCount) {
        this.index = index;
        this.label = label;
        this.voteCount = voteCount;
    }

    public int getIndex() {
        return index;
    }

    public ProposalLabel getLabel() {
        return label;
    }

    public String getName() {
        return label.name();
    }

    public long getVoteCount() {
        return voteCount;
    }

    @Override
    public String toString() {
        return "Proposal{" +
                "index=" + index +
                ", name='" + getName() + '\'' +
                ", voteCount=" + voteCount +
                '}';
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        Proposal that = (Proposal) o;
        return index == that.index && voteCount == that.voteCount && Objects.equals(label, that.label);
    }

    @Override
    public int hashCode() {
        return Objects.hash(index, label, voteCount);
    }
}
