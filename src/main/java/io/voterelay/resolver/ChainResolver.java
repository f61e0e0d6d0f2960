package io.voterelay.resolver;

import io.voterelay.model.DelegationEdge;
import io.voterelay.model.Resolution;
import io.voterelay.model.SignerId;
import io.voterelay.storage.DelegationStore;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Follows active delegation edges from a starting signer to its effective voter.
 *
 * <p>The walk is iterative and read-only. An edge whose expiry has been reached
 * ends the walk exactly like a missing edge, so callers get the right answer
 * whether or not expired edges have been pruned yet. The walk stops after
 * {@code maxHops} edges; the signer reached at that depth is returned.
 */
public final class ChainResolver {
    private final DelegationStore store;

    public ChainResolver(DelegationStore store) {
        this.store = store;
    }

    public Resolution resolve(SignerId start, long now, int maxHops) {
        if (maxHops < 0) {
            throw new IllegalArgumentException("maxHops must not be negative, got " + maxHops);
        }
        SignerId current = start;
        Set<SignerId> visited = new HashSet<>();
        visited.add(start);
        List<SignerId> path = new ArrayList<>();
        path.add(start);
        int hops = 0;
        while (true) {
            Optional<DelegationEdge> edge = store.getActive(current);
            if (edge.isEmpty() || edge.get().isStaleAt(now)) {
                break;
            }
            SignerId next = edge.get().delegate();
            if (visited.contains(next)) {
                throw new DelegationCycleException(path, next);
            }
            if (hops + 1 > maxHops) {
                break;
            }
            current = next;
            visited.add(next);
            path.add(next);
            hops++;
        }
        return new Resolution(current, hops, path);
    }
}
