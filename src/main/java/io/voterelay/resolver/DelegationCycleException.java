package io.voterelay.resolver;

import io.voterelay.model.SignerId;

import java.util.List;

/**
 * Raised when resolution walks back onto a signer it already visited.
 * Cycles are rejected when delegations are created, so meeting one here
 * means stored state is corrupt.
 */
public final class DelegationCycleException extends IllegalStateException {
    private final List<SignerId> path;

    public DelegationCycleException(List<SignerId> path, SignerId repeated) {
        super("Delegation cycle detected at " + repeated + " via " + path);
        this.path = List.copyOf(path);
    }

    public List<SignerId> path() {
        return path;
    }
}
