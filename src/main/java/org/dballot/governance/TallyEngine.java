package org.dballot.governance;

import org.dballot.identity.Identity;
import org.dballot.ledger.VoterLedger;
import org.dballot.ledger.VotingRecord;
import org.dballot.proposal.ProposalRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Applies votes and delegations to the registry and the ledger.
 * <p>
 * Every precondition is checked before the first write, so a rejected call changes nothing.
 */
public class TallyEngine {

    private static final Logger log = LoggerFactory.getLogger(TallyEngine.class);

    private final ProposalRegistry registry;
    private final VoterLedger ledger;
    private final AccessControl accessControl;
    private final DelegationResolver resolver;

    public TallyEngine(ProposalRegistry registry, VoterLedger ledger,
                       AccessControl accessControl, DelegationResolver resolver) {
        this.registry = registry;
        this.ledger = ledger;
        this.accessControl = accessControl;
        this.resolver = resolver;
    }

    /**
     * Casts the actor's full accumulated weight for one proposal.
     */
    public void vote(Identity actor, int proposalIndex) {
        accessControl.requireVotingRights(actor);
        VotingRecord record = ledger.get(actor);
        if (record.hasVoted())
            throw new BallotException(BallotError.ALREADY_VOTED, actor + " already voted");
        if (!registry.contains(proposalIndex))
            throw new BallotException(BallotError.INVALID_PROPOSAL,
                    "Proposal index " + proposalIndex + " out of range [0, " + registry.size() + ")");

        record.setVoted(true);
        record.setChosenProposal(proposalIndex);
        ledger.set(actor, record);
        registry.recordVote(proposalIndex, record.getWeight());
        log.info("[TallyEngine] " + actor + " voted for proposal " + proposalIndex + " with weight " + record.getWeight());
    }

    /**
     * Hands the actor's weight to {@code target}. If the terminal delegate already voted the weight
     * is counted for its proposal at once, otherwise it is added to the delegate's own weight.
     */
    public void delegate(Identity actor, Identity target) {
        accessControl.requireVotingRights(actor);
        VotingRecord sender = ledger.get(actor);
        if (sender.hasVoted())
            throw new BallotException(BallotError.ALREADY_VOTED, actor + " already voted");
        if (actor.equals(target))
            throw new BallotException(BallotError.SELF_DELEGATION, "Self-delegation is not allowed");

        Identity terminal = resolver.resolve(actor, target);
        VotingRecord delegate = ledger.get(terminal);

        sender.setVoted(true);
        sender.setDelegateTarget(target);
        ledger.set(actor, sender);

        if (delegate.hasVoted()) {
            registry.recordVote(delegate.getChosenProposal(), sender.getWeight());
            log.info("[TallyEngine] " + actor + " delegated to " + target + "; weight " + sender.getWeight()
                    + " counted for proposal " + delegate.getChosenProposal() + " chosen by " + terminal);
        } else {
            delegate.setWeight(delegate.getWeight() + sender.getWeight());
            ledger.set(terminal, delegate);
            log.info("[TallyEngine] " + actor + " delegated to " + target + "; " + terminal
                    + " now holds weight " + delegate.getWeight());
        }
    }

    public int winningProposal() {
        return registry.winner();
    }

    public String winnerName() {
        return registry.get(registry.winner()).getName();
    }
}
