package io.voterelay.voting;

import io.voterelay.model.SignerId;

import java.util.LinkedHashSet;
import java.util.Set;

/**
 * Approval and abstention sets of one proposal, keyed by effective voter.
 * Owned by the proposal component; votes are added through {@link VotingAdapter}.
 */
public final class ProposalBallot {
    private final String proposalId;
    private final Set<SignerId> approvals = new LinkedHashSet<>();
    private final Set<SignerId> abstentions = new LinkedHashSet<>();

    public ProposalBallot(String proposalId) {
        if (proposalId == null || proposalId.isBlank()) {
            throw new IllegalArgumentException("proposalId must not be blank");
        }
        this.proposalId = proposalId.trim();
    }

    public String proposalId() {
        return proposalId;
    }

    public Set<SignerId> approvals() {
        return Set.copyOf(approvals);
    }

    public Set<SignerId> abstentions() {
        return Set.copyOf(abstentions);
    }

    public boolean hasVoted(SignerId voter) {
        return approvals.contains(voter) || abstentions.contains(voter);
    }

    void addApproval(SignerId voter) {
        approvals.add(voter);
    }

    void addAbstention(SignerId voter) {
        abstentions.add(voter);
    }
}
