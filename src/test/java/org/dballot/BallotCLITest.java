package org.dballot;

import org.dballot.governance.Ballot;
import org.dballot.identity.Identity;
import org.dballot.proposal.LabelPolicy;
import org.dballot.store.InMemoryBallotStore;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Scanner;

import static org.junit.jupiter.api.Assertions.*;

public class BallotCLITest {

    private static final Identity ADMIN = Identity.of("chair");

    private static Ballot newBallot() {
        return Ballot.create(ADMIN, List.of("Parks", "Roads"), LabelPolicy.TRUNCATE, new InMemoryBallotStore());
    }

    @Test
    public void testScriptedSession() {
        Ballot ballot = newBallot();
        String script = String.join("\n",
                "2", "alice",       // grant alice
                "2", "bob",         // grant bob
                "7", "alice",       // act as alice
                "3", "bob",         // alice delegates to bob
                "7", "bob",
                "4", "1",           // bob votes Roads
                "0") + "\n";

        BallotCLI cli = new BallotCLI(ballot, new Scanner(script));
        cli.start();

        assertEquals(Identity.of("bob"), cli.getActor());
        assertEquals(2, ballot.getProposalVote(1));
        assertEquals("Roads", ballot.winnerName());
    }

    @Test
    public void testRejectionsDoNotEndSession() {
        Ballot ballot = newBallot();
        String script = String.join("\n",
                "7", "mallory",
                "2", "mallory",     // not the administrator
                "4", "x",           // not a number
                "9",                // unknown option
                "7", "chair",
                "4", "0") + "\n";   // input ends without an explicit exit

        new BallotCLI(ballot, new Scanner(script)).start();

        assertEquals(1, ballot.getProposalVote(0));
        assertEquals(0, ballot.getWeight(ADMIN, Identity.of("mallory")));
    }
}
