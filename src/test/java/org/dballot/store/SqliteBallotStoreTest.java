package org.dballot.store;

import org.dballot.governance.Ballot;
import org.dballot.governance.BallotError;
import org.dballot.governance.BallotException;
import org.dballot.identity.Identity;
import org.dballot.ledger.VotingRecord;
import org.dballot.proposal.LabelPolicy;
import org.dballot.proposal.ProposalLabel;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class SqliteBallotStoreTest {

    private static final Identity ADMIN = Identity.of("chair");
    private static final Identity A = Identity.of("A");
    private static final Identity B = Identity.of("B");

    @TempDir
    Path tempDir;

    private String dbFile;

    @BeforeEach
    public void setup() {
        dbFile = tempDir.resolve("ballot-test.db").toString();
    }

    @Test
    public void testRecordRoundTrip() {
        SqliteBallotStore store = new SqliteBallotStore(dbFile);
        store.putRecord(A, new VotingRecord(3, true, B, null));
        store.putRecord(B, new VotingRecord(1, true, null, 2));

        assertEquals(new VotingRecord(3, true, B, null), store.getRecord(A));
        assertEquals(new VotingRecord(1, true, null, 2), store.getRecord(B));
        assertNull(store.getRecord(ADMIN));
        assertEquals(2, store.getIdentities().size());
    }

    @Test
    public void testProposalsAndCounts() {
        SqliteBallotStore store = new SqliteBallotStore(dbFile);
        List<ProposalLabel> labels = List.of(
                ProposalLabel.encode("first", LabelPolicy.TRUNCATE),
                ProposalLabel.encode("second", LabelPolicy.TRUNCATE));
        store.putProposals(labels);
        store.putVoteCount(1, 7);

        assertEquals(labels, store.getProposalLabels());
        assertEquals(0, store.getVoteCount(0));
        assertEquals(7, store.getVoteCount(1));
    }

    @Test
    public void testAtomicallyRollsBack() {
        SqliteBallotStore store = new SqliteBallotStore(dbFile);
        store.putRecord(A, new VotingRecord(1, false, null, null));

        assertThrows(IllegalStateException.class, () -> store.atomically(() -> {
            store.putRecord(A, new VotingRecord(1, true, null, 0));
            assertTrue(store.getRecord(A).hasVoted());
            throw new IllegalStateException("boom");
        }));

        assertFalse(store.getRecord(A).hasVoted());
    }

    @Test
    public void testGrantedWeightPersists() {
        SqliteBallotStore store = new SqliteBallotStore(dbFile);
        assertEquals(0, store.getGrantedWeight());
        store.putGrantedWeight(4);

        assertEquals(4, new SqliteBallotStore(dbFile).getGrantedWeight());
    }

    @Test
    public void testBallotSurvivesReopen() {
        Ballot ballot = Ballot.create(ADMIN, List.of("P0", "P1"), LabelPolicy.TRUNCATE, new SqliteBallotStore(dbFile));
        ballot.grantRights(ADMIN, A);
        ballot.grantRights(ADMIN, B);
        ballot.delegate(A, B);
        ballot.vote(B, 1);

        Ballot reopened = Ballot.resume(new SqliteBallotStore(dbFile));
        assertEquals(ADMIN, reopened.administrator());
        assertEquals(2, reopened.getProposalVote(1));
        assertEquals(1, reopened.winningProposal());
        assertTrue(reopened.hasVoted(A));
        assertEquals(3, reopened.tally().getTotalGranted());

        BallotException e = assertThrows(BallotException.class, () -> reopened.vote(A, 0));
        assertEquals(BallotError.ALREADY_VOTED, e.getError());
        assertEquals(0, reopened.getProposalVote(0));
    }
}
