package io.voterelay.storage;

import io.voterelay.model.DelegationEdge;
import io.voterelay.model.HistoryEntry;
import io.voterelay.model.SignerId;
import io.voterelay.model.UpstreamCounts;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Heap-backed store. Suitable for tests and embedding; each call is
 * serialized on the instance. {@link #atomically} runs the work directly,
 * so callers finish validating before their first write.
 */
public final class InMemoryDelegationStore implements DelegationStore {
    private final int historyCapacity;
    private final Map<SignerId, DelegationEdge> active = new HashMap<>();
    private final Map<SignerId, Deque<HistoryEntry>> history = new HashMap<>();
    private final Map<SignerId, UpstreamCounts> upstream = new HashMap<>();
    private long lastDelegationId;

    public InMemoryDelegationStore(int historyCapacity) {
        if (historyCapacity < 1) {
            throw new IllegalArgumentException("historyCapacity must be positive, got " + historyCapacity);
        }
        this.historyCapacity = historyCapacity;
    }

    @Override
    public synchronized Optional<DelegationEdge> getActive(SignerId delegator) {
        return Optional.ofNullable(active.get(delegator));
    }

    @Override
    public synchronized void putActive(SignerId delegator, DelegationEdge edge) {
        active.put(delegator, edge);
    }

    @Override
    public synchronized void clearActive(SignerId delegator) {
        active.remove(delegator);
    }

    @Override
    public synchronized void appendHistory(SignerId delegator, HistoryEntry entry) {
        Deque<HistoryEntry> log = history.computeIfAbsent(delegator, k -> new ArrayDeque<>());
        log.addFirst(entry);
        while (log.size() > historyCapacity) {
            log.removeLast();
        }
    }

    @Override
    public synchronized List<HistoryEntry> getHistory(SignerId delegator) {
        Deque<HistoryEntry> log = history.get(delegator);
        return log == null ? List.of() : List.copyOf(log);
    }

    @Override
    public synchronized long nextDelegationId() {
        return ++lastDelegationId;
    }

    @Override
    public int historyCapacity() {
        return historyCapacity;
    }

    @Override
    public synchronized UpstreamCounts getUpstream(SignerId signer) {
        return upstream.getOrDefault(signer, UpstreamCounts.empty());
    }

    @Override
    public synchronized void putUpstream(SignerId signer, UpstreamCounts counts) {
        if (counts == null || counts.isEmpty()) {
            upstream.remove(signer);
        } else {
            upstream.put(signer, counts);
        }
    }
}
