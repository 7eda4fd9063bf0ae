package org.dballot.governance;

import org.dballot.proposal.Proposal;

import java.util.List;

/**
 * Point-in-time summary of a round.
 */
public class BallotTally {
    private final List<Proposal> proposals;
    private final int winningProposal;
    private final String winnerName;
    private final long totalGranted;
    private final long restingWeight;

    public BallotTally(List<Proposal> proposals, int winningProposal, String winnerName,
                       long totalGranted, long restingWeight) {
        this.proposals = List.copyOf(proposals);
        this.winningProposal = winningProposal;
        this.winnerName = winnerName;
        this.totalGranted = totalGranted;
        this.restingWeight = restingWeight;
    }

    public List<Proposal> getProposals() {
        return proposals;
    }

    public int getWinningProposal() {
        return winningProposal;
    }

    public String getWinnerName() {
        return winnerName;
    }

    public long getTotalGranted() {
        return totalGranted;
    }

    public long getRestingWeight() {
        return restingWeight;
    }

    public long getCountedWeight() {
        return proposals.stream().mapToLong(Proposal::getVoteCount).sum();
    }

    @Override
    public String toString() {
        return "BallotTally{" +
                "proposals=" + proposals +
                ", winningProposal=" + winningProposal +
                ", winnerName='" + winnerName + '\'' +
                ", totalGranted=" + totalGranted +
                ", restingWeight=" + restingWeight +
                '}';
    }
}
