package org.dballot.proposal;

import org.dballot.governance.BallotError;
import org.dballot.governance.BallotException;
import org.dballot.store.InMemoryBallotStore;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class ProposalRegistryTest {

    private InMemoryBallotStore store;

    @BeforeEach
    public void setup() {
        store = new InMemoryBallotStore();
    }

    @Test
    public void testConstructPreservesOrder() {
        ProposalRegistry registry = ProposalRegistry.construct(store, List.of("alpha", "beta", "gamma"), LabelPolicy.TRUNCATE);

        assertEquals(3, registry.size());
        assertEquals("alpha", registry.get(0).getName());
        assertEquals("beta", registry.get(1).getName());
        assertEquals("gamma", registry.get(2).getName());
        assertEquals(0, registry.get(2).getVoteCount());
    }

    @Test
    public void testEmptyProposalListRejected() {
        BallotException e = assertThrows(BallotException.class,
                () -> ProposalRegistry.construct(store, List.of(), LabelPolicy.TRUNCATE));
        assertEquals(BallotError.INVALID_INPUT, e.getError());
    }

    @Test
    public void testGetOutOfRange() {
        ProposalRegistry registry = ProposalRegistry.construct(store, List.of("a", "b"), LabelPolicy.TRUNCATE);

        assertEquals(BallotError.INVALID_PROPOSAL, assertThrows(BallotException.class, () -> registry.get(2)).getError());
        assertEquals(BallotError.INVALID_PROPOSAL, assertThrows(BallotException.class, () -> registry.get(-1)).getError());
    }

    @Test
    public void testAllZeroTallyWinsAtIndexZero() {
        ProposalRegistry registry = ProposalRegistry.construct(store, List.of("P0", "P1", "P2"), LabelPolicy.TRUNCATE);
        assertEquals(0, registry.winner());
    }

    @Test
    public void testTieGoesToLowestIndex() {
        ProposalRegistry registry = ProposalRegistry.construct(store, List.of("P0", "P1", "P2"), LabelPolicy.TRUNCATE);
        registry.recordVote(0, 3);
        registry.recordVote(1, 5);
        registry.recordVote(2, 5);

        assertEquals(1, registry.winner());
    }

    @Test
    public void testRecordVoteAccumulates() {
        ProposalRegistry registry = ProposalRegistry.construct(store, List.of("P0", "P1", "P2"), LabelPolicy.TRUNCATE);
        registry.recordVote(2, 1);
        registry.recordVote(2, 1);

        assertEquals(2, registry.get(2).getVoteCount());
        assertEquals(2, registry.winner());
    }

    @Test
    public void testLoadRebuildsFromStore() {
        ProposalRegistry original = ProposalRegistry.construct(store, List.of("x", "y"), LabelPolicy.TRUNCATE);
        original.recordVote(1, 4);

        ProposalRegistry loaded = ProposalRegistry.load(store);
        assertEquals(original.labels(), loaded.labels());
        assertEquals(4, loaded.get(1).getVoteCount());
    }
}
