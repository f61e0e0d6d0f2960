package io.voterelay.storage;

import io.voterelay.model.DelegationEdge;
import io.voterelay.model.HistoryEntry;
import io.voterelay.model.SignerId;
import io.voterelay.model.UpstreamCounts;

import java.util.List;
import java.util.Optional;
import java.util.function.Supplier;

/**
 * Key-value persistence for delegation edges. Implementations hold no
 * business rules and know nothing about time: callers keep the
 * one-active-edge-per-delegator invariant.
 */
public interface DelegationStore {

    Optional<DelegationEdge> getActive(SignerId delegator);

    /**
     * Overwrites the active slot of {@code delegator}.
     */
    void putActive(SignerId delegator, DelegationEdge edge);

    void clearActive(SignerId delegator);

    /**
     * Appends to the delegator's bounded log. Past capacity the oldest entry is evicted.
     */
    void appendHistory(SignerId delegator, HistoryEntry entry);

    /**
     * Returns the delegator's history, most recent first. The list is a snapshot.
     */
    List<HistoryEntry> getHistory(SignerId delegator);

    /**
     * Allocates the next delegation id. Ids of committed delegations are strictly increasing.
     */
    long nextDelegationId();

    int historyCapacity();

    /**
     * Returns the stored upstream counts of {@code signer}, empty when none were written.
     */
    UpstreamCounts getUpstream(SignerId signer);

    void putUpstream(SignerId signer, UpstreamCounts counts);

    /**
     * Runs {@code work} as one unit. Durable stores commit its writes together
     * or not at all; the default runs it directly.
     */
    default <T> T atomically(Supplier<T> work) {
        return work.get();
    }
}
