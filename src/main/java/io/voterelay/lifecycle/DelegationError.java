package io.voterelay.lifecycle;

public enum DelegationError {
    NOT_ELIGIBLE,
    SELF_DELEGATION,
    ALREADY_DELEGATING,
    WOULD_CREATE_CYCLE,
    CHAIN_TOO_LONG,
    NO_ACTIVE_DELEGATION,
    UNAUTHORIZED,
    INVALID_EXPIRY,
    ALREADY_VOTED
}
