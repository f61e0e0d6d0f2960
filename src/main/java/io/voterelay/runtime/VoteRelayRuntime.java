package io.voterelay.runtime;

import io.voterelay.config.DelegationSettings;
import io.voterelay.config.VoteRelayConfig;
import io.voterelay.lifecycle.LifecycleManager;
import io.voterelay.model.DelegationEdge;
import io.voterelay.model.HistoryEntry;
import io.voterelay.model.Resolution;
import io.voterelay.model.SignerId;
import io.voterelay.observability.AuditLogger;
import io.voterelay.resolver.ChainResolver;
import io.voterelay.storage.Database;
import io.voterelay.storage.SqliteDelegationStore;
import io.voterelay.voting.ProposalBallot;
import io.voterelay.voting.VotingAdapter;

import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Wires the SQLite store, lifecycle manager, voting adapter and audit trail
 * for one namespace. Call {@link #init()} before any other operation.
 */
public final class VoteRelayRuntime {
    private final VoteRelayConfig config;
    private final DelegationSettings settings;
    private final Database database;
    private final AuditLogger auditLogger;
    private final LifecycleManager lifecycle;
    private final VotingAdapter votingAdapter;

    public VoteRelayRuntime(VoteRelayConfig config) {
        this(config, DelegationSettings.load(config.settingsFile()));
    }

    public VoteRelayRuntime(VoteRelayConfig config, DelegationSettings settings) {
        this.config = config;
        this.settings = settings;
        this.database = new Database(config);
        SqliteDelegationStore store = new SqliteDelegationStore(database, settings.historyCapacity());
        ChainResolver resolver = new ChainResolver(store);
        this.lifecycle = new LifecycleManager(store, resolver, settings.maxDepth());
        this.votingAdapter = new VotingAdapter(store, resolver, lifecycle);
        this.auditLogger = new AuditLogger(config.auditFile(), config.namespace(), settings.auditSigningSecret());
        this.lifecycle.addListener(auditLogger);
    }

    public void init() {
        database.init();
    }

    public VoteRelayConfig config() {
        return config;
    }

    public DelegationSettings settings() {
        return settings;
    }

    public LifecycleManager lifecycle() {
        return lifecycle;
    }

    public VotingAdapter votingAdapter() {
        return votingAdapter;
    }

    public DelegationEdge delegate(String delegator, String delegate, Long expiry, long now) {
        return delegate(delegator, delegate, expiry, now, settings.signers());
    }

    public DelegationEdge delegate(String delegator, String delegate, Long expiry, long now, Set<SignerId> eligibleSigners) {
        return lifecycle.create(new SignerId(delegator), new SignerId(delegate), expiry, now, eligibleSigners);
    }

    public HistoryEntry revoke(String delegator, String caller, long now) {
        return lifecycle.revoke(new SignerId(delegator), new SignerId(caller), now);
    }

    public SignerId resolveEffectiveVoter(String signer, long now) {
        return votingAdapter.resolveEffectiveVoter(new SignerId(signer), now);
    }

    public Resolution resolve(String signer, long now) {
        return votingAdapter.resolve(new SignerId(signer), now);
    }

    public Optional<DelegationEdge> getActiveDelegation(String delegator, long now) {
        return lifecycle.getActive(new SignerId(delegator), now);
    }

    public List<HistoryEntry> getHistory(String delegator, long now) {
        return lifecycle.getHistory(new SignerId(delegator), now);
    }

    public SignerId approve(ProposalBallot ballot, String signer, long now) {
        return votingAdapter.recordApproval(ballot, new SignerId(signer), now);
    }

    public SignerId abstain(ProposalBallot ballot, String signer, long now) {
        return votingAdapter.recordAbstention(ballot, new SignerId(signer), now);
    }

    public List<String> auditTail(int lines) {
        return auditLogger.tail(lines);
    }

    public AuditLogger.IntegrityOutcome verifyAudit() {
        return auditLogger.verify();
    }
}
