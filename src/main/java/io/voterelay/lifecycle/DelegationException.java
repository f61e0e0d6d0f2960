package io.voterelay.lifecycle;

/**
 * A request rejected by validation. Nothing was persisted; the caller must
 * correct the request and resubmit.
 */
public final class DelegationException extends RuntimeException {
    private final DelegationError error;

    public DelegationException(DelegationError error, String message) {
        super(message);
        this.error = error;
    }

    public DelegationError error() {
        return error;
    }
}
