package io.voterelay.model;

public enum EndReason {
    REVOKED,
    EXPIRED
}
