package org.dballot.governance;

import org.dballot.identity.Identity;
import org.dballot.ledger.VoterLedger;
import org.dballot.ledger.VotingRecord;
import org.dballot.proposal.LabelPolicy;
import org.dballot.proposal.Proposal;
import org.dballot.proposal.ProposalLabel;
import org.dballot.proposal.ProposalRegistry;
import org.dballot.store.BallotStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicReference;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import java.util.function.Supplier;

/**
 * One voting round and the single serialization point for every operation on it.
 * <p>
 * Mutations run under the write lock and inside {@link BallotStore#atomically(Runnable)};
 * queries share the read lock. Callers pass their identity explicitly on every call.
 */
public class Ballot {

    private static final Logger log = LoggerFactory.getLogger(Ballot.class);

    private final BallotStore store;
    private final ProposalRegistry registry;
    private final VoterLedger ledger;
    private final AccessControl accessControl;
    private final TallyEngine engine;

    // fair lock
    private final ReentrantReadWriteLock lock = new ReentrantReadWriteLock(true);

    private Ballot(BallotStore store, ProposalRegistry registry, Identity administrator) {
        this.store = store;
        this.registry = registry;
        this.ledger = new VoterLedger(store);
        this.accessControl = new AccessControl(administrator, ledger);
        this.engine = new TallyEngine(registry, ledger, accessControl, new DelegationResolver(ledger));
    }

    /**
     * Opens a round on {@code store}.
     * <p>
     * An empty store is initialized with the proposals and the administrator, who receives weight 1.
     * A store that already holds a round is resumed if it was created with the same proposal labels
     * and administrator.
     *
     * @throws BallotException {@link BallotError#INVALID_INPUT} for bad names or a store holding a different round
     */
    public static Ballot create(Identity administrator, List<String> proposalNames,
                                LabelPolicy policy, BallotStore store) {
        Objects.requireNonNull(administrator, "administrator must not be null");
        Objects.requireNonNull(store, "store must not be null");

        List<ProposalLabel> requested = ProposalRegistry.encode(proposalNames, policy);
        Identity existingAdmin = store.getAdministrator();

        if (existingAdmin == null) {
            AtomicReference<ProposalRegistry> created = new AtomicReference<>();
            store.atomically(() -> {
                created.set(ProposalRegistry.construct(store, proposalNames, policy));
                store.putAdministrator(administrator);
                VotingRecord adminRecord = new VotingRecord();
                adminRecord.setWeight(1);
                store.putRecord(administrator, adminRecord);
                store.putGrantedWeight(1);
            });
            log.info("[Ballot] New round with " + requested.size() + " proposals, administrator " + administrator);
            return new Ballot(store, created.get(), administrator);
        }

        ProposalRegistry registry = ProposalRegistry.load(store);
        if (!existingAdmin.equals(administrator) || !registry.labels().equals(requested))
            throw new BallotException(BallotError.INVALID_INPUT,
                    "Store already holds a different round (administrator " + existingAdmin + ")");
        log.info("[Ballot] Resumed round with " + registry.size() + " proposals");
        return new Ballot(store, registry, administrator);
    }

    /**
     * Opens a round on {@code store} using its stored proposals and administrator.
     */
    public static Ballot resume(BallotStore store) {
        Identity administrator = store.getAdministrator();
        if (administrator == null)
            throw new BallotException(BallotError.INVALID_INPUT, "Store holds no round to resume");
        return new Ballot(store, ProposalRegistry.load(store), administrator);
    }

    // ---- Mutations ----

    public void grantRights(Identity caller, Identity target) {
        Objects.requireNonNull(target, "target must not be null");
        write(() -> {
            accessControl.requireAdministrator(caller);
            ledger.grantRights(target);
        });
    }

    public void delegate(Identity caller, Identity target) {
        Objects.requireNonNull(caller, "caller must not be null");
        Objects.requireNonNull(target, "target must not be null");
        write(() -> engine.delegate(caller, target));
    }

    public void vote(Identity caller, int proposalIndex) {
        Objects.requireNonNull(caller, "caller must not be null");
        write(() -> engine.vote(caller, proposalIndex));
    }

    // ---- Queries ----

    public int winningProposal() {
        return read(engine::winningProposal);
    }

    public String winnerName() {
        return read(engine::winnerName);
    }

    public String getProposalName(int index) {
        return read(() -> registry.get(index).getName());
    }

    public long getProposalVote(int index) {
        return read(() -> registry.get(index).getVoteCount());
    }

    public int proposalCount() {
        return registry.size();
    }

    public List<Proposal> proposals() {
        return read(registry::proposals);
    }

    public boolean hasVoted(Identity caller) {
        Objects.requireNonNull(caller, "caller must not be null");
        return read(() -> ledger.get(caller).hasVoted());
    }

    public long getWeight(Identity caller, Identity target) {
        return read(() -> {
            accessControl.requireAdministrator(caller);
            return ledger.get(target).getWeight();
        });
    }

    public VotingRecord getVoterInfo(Identity caller, Identity target) {
        return read(() -> {
            accessControl.requireAdministrator(caller);
            return ledger.get(target);
        });
    }

    public BallotTally tally() {
        return read(() -> {
            int winner = registry.winner();
            return new BallotTally(registry.proposals(), winner, registry.get(winner).getName(),
                    ledger.totalGranted(), ledger.restingWeight());
        });
    }

    public Identity administrator() {
        return accessControl.administrator();
    }

    public boolean isAdministrator(Identity identity) {
        return accessControl.isAdministrator(identity);
    }

    // ---- Helpers ----

    private void write(Runnable operation) {
        lock.writeLock().lock();
        try {
            store.atomically(operation);
        } catch (BallotException e) {
            log.warn("[Ballot] Rejected: " + e.getError() + " - " + e.getMessage());
            throw e;
        } finally {
            lock.writeLock().unlock();
        }
    }

    private <T> T read(Supplier<T> query) {
        lock.readLock().lock();
        try {
            return query.get();
        } finally {
            lock.readLock().unlock();
        }
    }
}
