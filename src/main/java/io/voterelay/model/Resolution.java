package io.voterelay.model;

import java.util.List;

/**
 * Outcome of following active delegations from a starting signer.
 *
 * @param effectiveVoter terminal signer of the chain
 * @param hops           number of edges traversed
 * @param path           signers visited in order, starting signer first and effective voter last
 */
public record Resolution(SignerId effectiveVoter, int hops, List<SignerId> path) {
    public Resolution {
        path = List.copyOf(path);
    }

    public boolean passesThrough(SignerId signer) {
        return path.contains(signer);
    }
}
