package io.voterelay.model;

import java.util.Objects;

/**
 * An edge in the delegation graph. {@code expiry} is {@code null} for a
 * permanent delegation; otherwise the edge stops counting once the host
 * clock reaches it.
 */
public record DelegationEdge(
        long delegationId,
        SignerId delegator,
        SignerId delegate,
        Long expiry,
        long createdAt,
        boolean active
) {
    public DelegationEdge {
        Objects.requireNonNull(delegator, "delegator");
        Objects.requireNonNull(delegate, "delegate");
        if (delegator.equals(delegate)) {
            throw new IllegalArgumentException("Delegator and delegate must differ: " + delegator);
        }
    }

    public static DelegationEdge create(long delegationId, SignerId delegator, SignerId delegate, Long expiry, long now) {
        return new DelegationEdge(delegationId, delegator, delegate, expiry, now, true);
    }

    public boolean isPermanent() {
        return expiry == null;
    }

    public boolean isStaleAt(long now) {
        return expiry != null && now >= expiry;
    }

    public HistoryEntry end(long endedAt, EndReason reason) {
        return new HistoryEntry(delegationId, delegator, delegate, createdAt, endedAt, reason);
    }
}
