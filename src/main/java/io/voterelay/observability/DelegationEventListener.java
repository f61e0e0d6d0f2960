package io.voterelay.observability;

@FunctionalInterface
public interface DelegationEventListener {
    void onEvent(DelegationEvent event);
}
