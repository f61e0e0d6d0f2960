package io.voterelay.observability;

import io.voterelay.model.DelegationEdge;
import io.voterelay.model.SignerId;

/**
 * Notification published once per successful state transition.
 *
 * @param at host clock value of the transition; for expiries this is the edge's expiry
 */
public record DelegationEvent(
        Type type,
        long delegationId,
        SignerId delegator,
        SignerId delegate,
        Long expiry,
        long at
) {
    public enum Type {
        CREATED("delegation.created"),
        REVOKED("delegation.revoked"),
        EXPIRED("delegation.expired");

        private final String action;

        Type(String action) {
            this.action = action;
        }

        public String action() {
            return action;
        }
    }

    public static DelegationEvent created(DelegationEdge edge) {
        return new DelegationEvent(Type.CREATED, edge.delegationId(), edge.delegator(), edge.delegate(), edge.expiry(), edge.createdAt());
    }

    public static DelegationEvent revoked(DelegationEdge edge, long now) {
        return new DelegationEvent(Type.REVOKED, edge.delegationId(), edge.delegator(), edge.delegate(), edge.expiry(), now);
    }

    public static DelegationEvent expired(DelegationEdge edge) {
        return new DelegationEvent(Type.EXPIRED, edge.delegationId(), edge.delegator(), edge.delegate(), edge.expiry(), edge.expiry());
    }
}
