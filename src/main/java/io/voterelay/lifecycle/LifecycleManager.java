package io.voterelay.lifecycle;

import io.voterelay.model.DelegationEdge;
import io.voterelay.model.EndReason;
import io.voterelay.model.HistoryEntry;
import io.voterelay.model.Resolution;
import io.voterelay.model.SignerId;
import io.voterelay.model.UpstreamCounts;
import io.voterelay.observability.DelegationEvent;
import io.voterelay.observability.DelegationEventListener;
import io.voterelay.resolver.ChainResolver;
import io.voterelay.resolver.DelegationCycleException;
import io.voterelay.storage.DelegationStore;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Applies create, revoke and expiry transitions to a delegator's slot.
 *
 * <p>Every mutation runs inside {@link DelegationStore#atomically}; validation
 * completes before the first write, and events are published only once the
 * unit of work has committed. Expiry is discovered lazily by read paths.
 *
 * <p>Each signer's {@link UpstreamCounts} are kept in step with the stored
 * edges, so a new edge is checked against the longest chain running through
 * it in both directions.
 */
public final class LifecycleManager {
    private final DelegationStore store;
    private final ChainResolver resolver;
    private final int maxDepth;
    private final List<DelegationEventListener> listeners = new CopyOnWriteArrayList<>();

    public LifecycleManager(DelegationStore store, ChainResolver resolver, int maxDepth) {
        if (maxDepth < 1) {
            throw new IllegalArgumentException("maxDepth must be positive, got " + maxDepth);
        }
        this.store = Objects.requireNonNull(store, "store");
        this.resolver = Objects.requireNonNull(resolver, "resolver");
        this.maxDepth = maxDepth;
    }

    public void addListener(DelegationEventListener listener) {
        listeners.add(Objects.requireNonNull(listener, "listener"));
    }

    public int maxDepth() {
        return maxDepth;
    }

    public DelegationEdge create(
            SignerId delegator,
            SignerId delegate,
            Long expiry,
            long now,
            Set<SignerId> eligibleSigners
    ) {
        Objects.requireNonNull(delegator, "delegator");
        Objects.requireNonNull(delegate, "delegate");
        Set<SignerId> eligible = eligibleSigners == null ? Set.of() : eligibleSigners;
        if (!eligible.contains(delegator)) {
            throw new DelegationException(DelegationError.NOT_ELIGIBLE, "Delegator is not a signer: " + delegator);
        }
        if (!eligible.contains(delegate)) {
            throw new DelegationException(DelegationError.NOT_ELIGIBLE, "Delegate is not a signer: " + delegate);
        }
        if (delegator.equals(delegate)) {
            throw new DelegationException(DelegationError.SELF_DELEGATION, "Cannot delegate to self: " + delegator);
        }
        if (expiry != null && expiry <= now) {
            throw new DelegationException(DelegationError.INVALID_EXPIRY,
                    "Expiry " + expiry + " is not after current time " + now);
        }

        List<DelegationEvent> pending = new ArrayList<>();
        DelegationEdge created = store.atomically(() -> {
            Optional<DelegationEdge> existing = store.getActive(delegator);
            if (existing.isPresent() && !existing.get().isStaleAt(now)) {
                throw new DelegationException(DelegationError.ALREADY_DELEGATING,
                        delegator + " already delegates to " + existing.get().delegate());
            }
            Resolution downstream = resolver.resolve(delegate, now, maxDepth);
            if (downstream.passesThrough(delegator)) {
                throw new DelegationException(DelegationError.WOULD_CREATE_CYCLE,
                        "Delegating " + delegator + " to " + delegate + " closes the chain " + downstream.path());
            }
            Optional<DelegationEdge> staleBelow = store.getActive(downstream.effectiveVoter())
                    .filter(next -> next.isStaleAt(now));
            int upstreamDepth = upstreamWithout(delegator, staleBelow).depth();
            if (upstreamDepth + 1 + downstream.hops() > maxDepth) {
                throw new DelegationException(DelegationError.CHAIN_TOO_LONG,
                        "Delegating " + delegator + " to " + delegate + " spans " + upstreamDepth + " hops above and "
                                + downstream.hops() + " below the new edge, limit is " + maxDepth);
            }

            // Checks passed. Expiries found on the way are recorded before the new edge.
            if (existing.isPresent()) {
                endExpired(existing.get(), pending);
            }
            staleBelow.ifPresent(stale -> endExpired(stale, pending));
            DelegationEdge edge = DelegationEdge.create(store.nextDelegationId(), delegator, delegate, expiry, now);
            store.putActive(delegator, edge);
            propagateUpstream(edge, false);
            pending.add(DelegationEvent.created(edge));
            return edge;
        });
        publish(pending);
        return created;
    }

    public HistoryEntry revoke(SignerId delegator, SignerId caller, long now) {
        Objects.requireNonNull(delegator, "delegator");
        if (!delegator.equals(caller)) {
            throw new DelegationException(DelegationError.UNAUTHORIZED,
                    "Only " + delegator + " may revoke its delegation, caller was " + caller);
        }
        List<DelegationEvent> pending = new ArrayList<>();
        HistoryEntry entry = store.atomically(() -> {
            DelegationEdge edge = store.getActive(delegator)
                    .filter(active -> !active.isStaleAt(now))
                    .orElseThrow(() -> new DelegationException(
                            DelegationError.NO_ACTIVE_DELEGATION, delegator + " has no active delegation"));
            HistoryEntry ended = edge.end(now, EndReason.REVOKED);
            store.clearActive(delegator);
            store.appendHistory(delegator, ended);
            propagateUpstream(edge, true);
            pending.add(DelegationEvent.revoked(edge, now));
            return ended;
        });
        publish(pending);
        return entry;
    }

    /**
     * Ends the delegator's edge if its expiry has been reached. Repeated calls
     * with the same or a later clock value change nothing further.
     *
     * @return whether an edge was ended by this call
     */
    public boolean expireIfDue(SignerId delegator, long now) {
        List<DelegationEvent> pending = new ArrayList<>();
        boolean expired = store.atomically(() -> expireIfDue(delegator, now, pending));
        publish(pending);
        return expired;
    }

    public Optional<DelegationEdge> getActive(SignerId delegator, long now) {
        expireIfDue(delegator, now);
        return store.getActive(delegator);
    }

    public List<HistoryEntry> getHistory(SignerId delegator, long now) {
        expireIfDue(delegator, now);
        return store.getHistory(delegator);
    }

    private boolean expireIfDue(SignerId delegator, long now, List<DelegationEvent> pending) {
        Optional<DelegationEdge> edge = store.getActive(delegator);
        if (edge.isEmpty() || !edge.get().isStaleAt(now)) {
            return false;
        }
        endExpired(edge.get(), pending);
        return true;
    }

    private void endExpired(DelegationEdge stale, List<DelegationEvent> pending) {
        store.clearActive(stale.delegator());
        store.appendHistory(stale.delegator(), stale.end(stale.expiry(), EndReason.EXPIRED));
        propagateUpstream(stale, true);
        pending.add(DelegationEvent.expired(stale));
    }

    /**
     * Adds, or with {@code removing} subtracts, the delegator and everything
     * upstream of it to the counts of each signer on the stored chain below
     * the edge. Stored chains never exceed the depth limit, so this touches
     * at most {@code maxDepth} signers.
     */
    private void propagateUpstream(DelegationEdge edge, boolean removing) {
        UpstreamCounts carried = store.getUpstream(edge.delegator()).throughEdge();
        List<SignerId> chain = storedChain(edge.delegate());
        for (int distance = 0; distance < chain.size(); distance++) {
            SignerId signer = chain.get(distance);
            UpstreamCounts current = store.getUpstream(signer);
            store.putUpstream(signer, removing ? current.minus(carried, distance) : current.plus(carried, distance));
        }
    }

    /**
     * Upstream counts of {@code signer} once {@code pruned}, if present, is gone.
     */
    private UpstreamCounts upstreamWithout(SignerId signer, Optional<DelegationEdge> pruned) {
        UpstreamCounts counts = store.getUpstream(signer);
        if (pruned.isEmpty()) {
            return counts;
        }
        int distance = storedChain(pruned.get().delegate()).indexOf(signer);
        if (distance < 0) {
            return counts;
        }
        return counts.minus(store.getUpstream(pruned.get().delegator()).throughEdge(), distance);
    }

    /**
     * Signers reached from {@code start} over stored edges, expired ones included.
     */
    private List<SignerId> storedChain(SignerId start) {
        List<SignerId> chain = new ArrayList<>();
        Set<SignerId> visited = new HashSet<>();
        SignerId current = start;
        while (current != null) {
            if (!visited.add(current)) {
                throw new DelegationCycleException(chain, current);
            }
            chain.add(current);
            current = store.getActive(current).map(DelegationEdge::delegate).orElse(null);
        }
        return chain;
    }

    private void publish(List<DelegationEvent> events) {
        for (DelegationEvent event : events) {
            for (DelegationEventListener listener : listeners) {
                listener.onEvent(event);
            }
        }
    }
}
