package org.dballot;

import org.dballot.governance.Ballot;
import org.dballot.governance.BallotException;
import org.dballot.governance.BallotTally;
import org.dballot.identity.Identity;
import org.dballot.ledger.VotingRecord;
import org.dballot.proposal.Proposal;
import org.dballot.util.ConsolePrinter;

import java.util.Scanner;

/**
 * Menu-driven console over an in-process ballot. Operations run as the current acting identity,
 * which starts as the administrator and can be switched at any time.
 */
public class BallotCLI {

    private final Ballot ballot;
    private final Scanner scanner;
    private Identity actor;

    public BallotCLI(Ballot ballot, Scanner scanner) {
        this.ballot = ballot;
        this.scanner = scanner;
        this.actor = ballot.administrator();
    }

    public Identity getActor() {
        return actor;
    }

    public void start() {
        while (true) {
            printMenu();
            if (!scanner.hasNextLine()) {
                ConsolePrinter.printInfo("Input closed. Exiting CLI...");
                return;
            }
            String choice = scanner.nextLine().trim();

            try {
                switch (choice) {
                    case "1" -> showProposals();
                    case "2" -> grantRights();
                    case "3" -> delegate();
                    case "4" -> vote();
                    case "5" -> showWinner();
                    case "6" -> showVoterInfo();
                    case "7" -> switchActor();
                    case "8" -> showTally();
                    case "0" -> {
                        ConsolePrinter.printInfo("Exiting CLI...");
                        return;
                    }
                    default -> ConsolePrinter.printWarning("Invalid option. Try again.");
                }
            } catch (BallotException e) {
                ConsolePrinter.printFail("✗ " + e.getError() + ": " + e.getMessage());
            } catch (IllegalArgumentException e) {
                ConsolePrinter.printFail("✗ " + e.getMessage());
            }
        }
    }

    private void printMenu() {
        System.out.println("\n===== dBallot CLI (acting as " + actor + ") =====");
        System.out.println("1. Show Proposals");
        System.out.println("2. Grant Voting Rights");
        System.out.println("3. Delegate Vote");
        System.out.println("4. Vote");
        System.out.println("5. Show Winner");
        System.out.println("6. Show Voter Info");
        System.out.println("7. Switch Acting Identity");
        System.out.println("8. Show Tally");
        System.out.println("0. Exit");
        System.out.print("Choose an option: ");
    }

    private String prompt(String label) {
        System.out.print(label + ": ");
        if (!scanner.hasNextLine())
            throw new IllegalArgumentException("No input");
        return scanner.nextLine().trim();
    }

    private void showProposals() {
        System.out.println("\nProposals:");
        for (Proposal p : ballot.proposals())
            ConsolePrinter.printRow(p.getIndex() + ". " + p.getName(), p.getVoteCount());
    }

    private void grantRights() {
        Identity target = Identity.of(prompt("Identity to grant"));
        ballot.grantRights(actor, target);
        ConsolePrinter.printSuccess("✓ Voting rights granted to " + target);
    }

    private void delegate() {
        Identity target = Identity.of(prompt("Delegate to"));
        ballot.delegate(actor, target);
        ConsolePrinter.printSuccess("✓ " + actor + " delegated to " + target);
    }

    private void vote() {
        String raw = prompt("Proposal index");
        int index;
        try {
            index = Integer.parseInt(raw);
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Not a number: " + raw);
        }
        ballot.vote(actor, index);
        ConsolePrinter.printSuccess("✓ Vote recorded for " + ballot.getProposalName(index));
    }

    private void showWinner() {
        ConsolePrinter.printInfo("Winner: " + ballot.winningProposal() + ". " + ballot.winnerName());
    }

    private void showVoterInfo() {
        Identity target = Identity.of(prompt("Identity"));
        VotingRecord record = ballot.getVoterInfo(actor, target);
        ConsolePrinter.printRow("Status", record.status());
        ConsolePrinter.printRow("Weight", record.getWeight());
        if (record.getDelegateTarget() != null)
            ConsolePrinter.printRow("Delegate", record.getDelegateTarget());
        if (record.getChosenProposal() != null)
            ConsolePrinter.printRow("Vote", record.getChosenProposal());
    }

    private void switchActor() {
        actor = Identity.of(prompt("Act as"));
        ConsolePrinter.printInfo("Now acting as " + actor);
    }

    private void showTally() {
        BallotTally tally = ballot.tally();
        showProposals();
        ConsolePrinter.printRow("Winner", tally.getWinningProposal() + ". " + tally.getWinnerName());
        ConsolePrinter.printRow("Granted weight", tally.getTotalGranted());
        ConsolePrinter.printRow("Counted weight", tally.getCountedWeight());
        ConsolePrinter.printRow("Resting weight", tally.getRestingWeight());
    }
}
