package org.dballot.governance;

import org.dballot.identity.Identity;
import org.dballot.ledger.VoterStatus;
import org.dballot.ledger.VotingRecord;
import org.dballot.proposal.LabelPolicy;
import org.dballot.store.InMemoryBallotStore;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class BallotTest {

    private static final Identity ADMIN = Identity.of("chair");
    private static final Identity A = Identity.of("A");
    private static final Identity B = Identity.of("B");
    private static final Identity C = Identity.of("C");
    private static final Identity OUTSIDER = Identity.of("outsider");

    private InMemoryBallotStore store;
    private Ballot ballot;

    @BeforeEach
    public void setup() {
        store = new InMemoryBallotStore();
        ballot = Ballot.create(ADMIN, List.of("P0", "P1", "P2"), LabelPolicy.TRUNCATE, store);
        ballot.grantRights(ADMIN, A);
        ballot.grantRights(ADMIN, B);
        ballot.grantRights(ADMIN, C);
    }

    private static BallotError errorOf(Runnable op) {
        return assertThrows(BallotException.class, op::run).getError();
    }

    @Test
    public void testAdministratorStartsWithWeightOne() {
        assertEquals(1, ballot.getWeight(ADMIN, ADMIN));
        assertTrue(ballot.isAdministrator(ADMIN));
    }

    @Test
    public void testGrantRightsIsAdministratorOnly() {
        assertEquals(BallotError.NOT_AUTHORIZED, errorOf(() -> ballot.grantRights(A, OUTSIDER)));
        assertEquals(0, ballot.getWeight(ADMIN, OUTSIDER));
    }

    @Test
    @DisplayName("Granting rights twice succeeds once and leaves weight at one")
    public void testRightsIdempotence() {
        assertEquals(BallotError.ALREADY_HAS_RIGHTS, errorOf(() -> ballot.grantRights(ADMIN, A)));
        assertEquals(1, ballot.getWeight(ADMIN, A));
    }

    @Test
    public void testRecordQueriesAreAdministratorOnly() {
        assertEquals(BallotError.NOT_AUTHORIZED, errorOf(() -> ballot.getWeight(A, B)));
        assertEquals(BallotError.NOT_AUTHORIZED, errorOf(() -> ballot.getVoterInfo(A, A)));
    }

    @Test
    public void testDirectVote() {
        ballot.vote(A, 1);

        assertTrue(ballot.hasVoted(A));
        assertEquals(1, ballot.getProposalVote(1));
        VotingRecord record = ballot.getVoterInfo(ADMIN, A);
        assertEquals(VoterStatus.VOTED, record.status());
        assertEquals(1, record.getChosenProposal());
    }

    @Test
    public void testVoteWithoutRights() {
        assertEquals(BallotError.NO_VOTING_RIGHTS, errorOf(() -> ballot.vote(OUTSIDER, 0)));
        assertEquals(BallotError.NO_VOTING_RIGHTS, errorOf(() -> ballot.delegate(OUTSIDER, A)));
    }

    @Test
    @DisplayName("An invalid proposal index leaves the voter free to vote again")
    public void testInvalidProposalHasNoEffect() {
        assertEquals(BallotError.INVALID_PROPOSAL, errorOf(() -> ballot.vote(A, 3)));
        assertEquals(BallotError.INVALID_PROPOSAL, errorOf(() -> ballot.vote(A, -1)));
        assertFalse(ballot.hasVoted(A));

        ballot.vote(A, 2);
        assertEquals(1, ballot.getProposalVote(2));
    }

    @Test
    @DisplayName("At most one of vote or delegate succeeds per identity")
    public void testNoDoubleCounting() {
        ballot.vote(A, 0);
        assertEquals(BallotError.ALREADY_VOTED, errorOf(() -> ballot.vote(A, 0)));
        assertEquals(BallotError.ALREADY_VOTED, errorOf(() -> ballot.delegate(A, B)));

        ballot.delegate(B, C);
        assertEquals(BallotError.ALREADY_VOTED, errorOf(() -> ballot.vote(B, 1)));
        assertEquals(BallotError.ALREADY_VOTED, errorOf(() -> ballot.delegate(B, A)));
        assertEquals(1, ballot.getProposalVote(0));
    }

    @Test
    public void testSelfDelegationRejected() {
        assertEquals(BallotError.SELF_DELEGATION, errorOf(() -> ballot.delegate(A, A)));
        assertFalse(ballot.hasVoted(A));
    }

    @Test
    @DisplayName("Closing A->B->C->A fails on the closing edge and changes nothing")
    public void testCycleRejection() {
        ballot.delegate(A, B);
        ballot.delegate(B, C);

        VotingRecord a = ballot.getVoterInfo(ADMIN, A);
        VotingRecord b = ballot.getVoterInfo(ADMIN, B);
        VotingRecord c = ballot.getVoterInfo(ADMIN, C);

        assertEquals(BallotError.DELEGATION_CYCLE, errorOf(() -> ballot.delegate(C, A)));

        assertEquals(a, ballot.getVoterInfo(ADMIN, A));
        assertEquals(b, ballot.getVoterInfo(ADMIN, B));
        assertEquals(c, ballot.getVoterInfo(ADMIN, C));
        assertEquals(3, c.getWeight());
        assertFalse(ballot.hasVoted(C));
    }

    @Test
    @DisplayName("Delegating to a voter who votes later counts both weights")
    public void testDelegationToFutureVoter() {
        ballot.delegate(A, B);
        assertEquals(2, ballot.getWeight(ADMIN, B));
        assertEquals(0, ballot.getProposalVote(2));

        ballot.vote(B, 2);
        assertEquals(2, ballot.getProposalVote(2));
    }

    @Test
    @DisplayName("Delegating to a voter who already voted counts immediately")
    public void testDelegationToPastVoter() {
        ballot.vote(B, 0);
        ballot.delegate(A, B);

        assertEquals(2, ballot.getProposalVote(0));
        assertEquals(1, ballot.getWeight(ADMIN, B));
        assertEquals(B, ballot.getVoterInfo(ADMIN, A).getDelegateTarget());
    }

    @Test
    @DisplayName("The immediate target is recorded while weight lands on the terminal delegate")
    public void testChainRecordsImmediateTarget() {
        ballot.delegate(B, C);
        ballot.delegate(A, B);

        assertEquals(B, ballot.getVoterInfo(ADMIN, A).getDelegateTarget());
        assertEquals(3, ballot.getWeight(ADMIN, C));
        assertEquals(1, ballot.getWeight(ADMIN, B));

        ballot.vote(C, 1);
        assertEquals(3, ballot.getProposalVote(1));
        assertEquals(1, ballot.winningProposal());
        assertEquals("P1", ballot.winnerName());
    }

    @Test
    @DisplayName("Delegating to an identity without rights hands it the delegator's weight")
    public void testDelegateToUngrantedIdentity() {
        ballot.delegate(A, OUTSIDER);

        assertTrue(ballot.hasVoted(A));
        assertEquals(1, ballot.getWeight(ADMIN, OUTSIDER));
        assertEquals(4, ballot.tally().getTotalGranted());

        ballot.vote(OUTSIDER, 2);
        assertEquals(1, ballot.getProposalVote(2));
        assertEquals(BallotError.ALREADY_VOTED, errorOf(() -> ballot.vote(OUTSIDER, 1)));
        assertEquals(BallotError.ALREADY_HAS_RIGHTS, errorOf(() -> ballot.grantRights(ADMIN, OUTSIDER)));
        assertEquals(4, ballot.tally().getTotalGranted());
    }

    @Test
    public void testProposalQueries() {
        assertEquals(3, ballot.proposalCount());
        assertEquals("P1", ballot.getProposalName(1));
        assertEquals(BallotError.INVALID_PROPOSAL, errorOf(() -> ballot.getProposalName(3)));
        assertEquals(BallotError.INVALID_PROPOSAL, errorOf(() -> ballot.getProposalVote(7)));
    }

    @Test
    public void testWinnerTieBreak() {
        assertEquals(0, ballot.winningProposal());
        assertEquals("P0", ballot.winnerName());

        ballot.vote(A, 2);
        ballot.vote(B, 1);
        assertEquals(1, ballot.winningProposal());
    }

    @Test
    public void testTallySummary() {
        ballot.delegate(A, B);
        ballot.vote(C, 2);

        BallotTally tally = ballot.tally();
        assertEquals(4, tally.getTotalGranted());
        assertEquals(1, tally.getCountedWeight());
        assertEquals(3, tally.getRestingWeight());
        assertEquals(2, tally.getWinningProposal());
        assertEquals("P2", tally.getWinnerName());
    }

    @Test
    public void testResumeSameRound() {
        ballot.vote(A, 1);

        Ballot resumed = Ballot.create(ADMIN, List.of("P0", "P1", "P2"), LabelPolicy.TRUNCATE, store);
        assertEquals(1, resumed.getProposalVote(1));
        assertTrue(resumed.hasVoted(A));
        assertEquals(ADMIN, Ballot.resume(store).administrator());
    }

    @Test
    public void testResumeDifferentRoundRejected() {
        assertEquals(BallotError.INVALID_INPUT,
                errorOf(() -> Ballot.create(ADMIN, List.of("X", "Y"), LabelPolicy.TRUNCATE, store)));
        assertEquals(BallotError.INVALID_INPUT,
                errorOf(() -> Ballot.create(A, List.of("P0", "P1", "P2"), LabelPolicy.TRUNCATE, store)));
    }

    @Test
    public void testResumeEmptyStoreRejected() {
        assertEquals(BallotError.INVALID_INPUT, errorOf(() -> Ballot.resume(new InMemoryBallotStore())));
    }
}
