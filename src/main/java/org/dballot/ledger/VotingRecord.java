package org.dballot.ledger;

import org.dballot.identity.Identity;

import java.util.Objects;

/**
 * Voting rights of one identity.
 * <p>
 * {@code weight == 0} means no right to vote. {@code delegateTarget} and {@code chosenProposal}
 * are mutually exclusive and only meaningful once {@code voted} is set.
 */
public class VotingRecord {
    private long weight;
    private boolean voted;
    private Identity delegateTarget;
    private Integer chosenProposal;

    public VotingRecord() {
    }

    public VotingRecord(long weight, boolean voted, Identity delegateTarget, Integer chosenProposal) {
        this.weight = weight;
        this.voted = voted;
        this.delegateTarget = delegateTarget;
        this.chosenProposal = chosenProposal;
    }

    public VotingRecord copy() {
        return new VotingRecord(weight, voted, delegateTarget, chosenProposal);
    }

    public long getWeight() {
        return weight;
    }

    public void setWeight(long weight) {
        this.weight = weight;
    }

    public boolean hasVoted() {
        return voted;
    }

    public void setVoted(boolean voted) {
        this.voted = voted;
    }

    public Identity getDelegateTarget() {
        return delegateTarget;
    }

    public void setDelegateTarget(Identity delegateTarget) {
        this.delegateTarget = delegateTarget;
    }

    public Integer getChosenProposal() {
        return chosenProposal;
    }

    public void setChosenProposal(Integer chosenProposal) {
        this.chosenProposal = chosenProposal;
    }

    public VoterStatus status() {
        if (voted)
            return delegateTarget != null ? VoterStatus.DELEGATED : VoterStatus.VOTED;
        return weight > 0 ? VoterStatus.HAS_RIGHTS : VoterStatus.NO_RIGHTS;
    }

    @Override
    public String toString() {
        return "VotingRecord{" +
                "weight=" + weight +
                ", voted=" + voted +
                ", delegateTarget=" + delegateTarget +
                ", chosenProposal=" + chosenProposal +
                '}';
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        VotingRecord that = (VotingRecord) o;
        return weight == that.weight &&
                voted == that.voted &&
                Objects.equals(delegateTarget, that.delegateTarget) &&
                Objects.equals(chosenProposal, that.chosenProposal);
    }

    @Override
    public int hashCode() {
        return Objects.hash(weight, voted, delegateTarget, chosenProposal);
    }
}
