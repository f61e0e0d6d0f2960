package io.voterelay.voting;

import io.voterelay.lifecycle.DelegationError;
import io.voterelay.lifecycle.DelegationException;
import io.voterelay.lifecycle.LifecycleManager;
import io.voterelay.model.DelegationEdge;
import io.voterelay.model.Resolution;
import io.voterelay.model.SignerId;
import io.voterelay.resolver.ChainResolver;
import io.voterelay.storage.DelegationStore;

import java.util.HashSet;
import java.util.Optional;
import java.util.Set;

/**
 * Entry point for the proposal approval path. Votes must be recorded under the
 * effective voter returned here, never under the calling signer, so that two
 * chains converging on one voter count once.
 */
public final class VotingAdapter {
    private final DelegationStore store;
    private final ChainResolver resolver;
    private final LifecycleManager lifecycle;

    public VotingAdapter(DelegationStore store, ChainResolver resolver, LifecycleManager lifecycle) {
        this.store = store;
        this.resolver = resolver;
        this.lifecycle = lifecycle;
    }

    public SignerId resolveEffectiveVoter(SignerId signer, long now) {
        return resolve(signer, now).effectiveVoter();
    }

    /**
     * Prunes expired edges along the chain starting at {@code signer}, then resolves it.
     */
    public Resolution resolve(SignerId signer, long now) {
        int maxDepth = lifecycle.maxDepth();
        SignerId current = signer;
        Set<SignerId> visited = new HashSet<>();
        visited.add(signer);
        for (int hop = 0; hop <= maxDepth; hop++) {
            lifecycle.expireIfDue(current, now);
            Optional<DelegationEdge> edge = store.getActive(current);
            if (edge.isEmpty() || !visited.add(edge.get().delegate())) {
                break;
            }
            current = edge.get().delegate();
        }
        return resolver.resolve(signer, now, maxDepth);
    }

    public SignerId recordApproval(ProposalBallot ballot, SignerId signer, long now) {
        SignerId voter = claimVote(ballot, signer, now);
        ballot.addApproval(voter);
        return voter;
    }

    public SignerId recordAbstention(ProposalBallot ballot, SignerId signer, long now) {
        SignerId voter = claimVote(ballot, signer, now);
        ballot.addAbstention(voter);
        return voter;
    }

    private SignerId claimVote(ProposalBallot ballot, SignerId signer, long now) {
        SignerId voter = resolveEffectiveVoter(signer, now);
        if (ballot.hasVoted(voter)) {
            throw new DelegationException(DelegationError.ALREADY_VOTED,
                    voter + " already voted on proposal " + ballot.proposalId()
                            + (voter.equals(signer) ? "" : " (resolved from " + signer + ")"));
        }
        return voter;
    }
}
