package io.voterelay.resolver;

import io.voterelay.model.DelegationEdge;
import io.voterelay.model.Resolution;
import io.voterelay.model.SignerId;
import io.voterelay.storage.InMemoryDelegationStore;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;

final class ChainResolverTest {
    private static final SignerId A = new SignerId("A");
    private static final SignerId B = new SignerId("B");
    private static final SignerId C = new SignerId("C");
    private static final SignerId D = new SignerId("D");
    private static final SignerId E = new SignerId("E");

    private InMemoryDelegationStore store;
    private ChainResolver resolver;
    private long ids;

    @BeforeEach
    void setUp() {
        store = new InMemoryDelegationStore(8);
        resolver = new ChainResolver(store);
    }

    private void edge(SignerId from, SignerId to, Long expiry) {
        store.putActive(from, DelegationEdge.create(++ids, from, to, expiry, 0L));
    }

    @Test
    void undelegatedSignerResolvesToItself() {
        Resolution out = resolver.resolve(A, 10L, 3);
        Assertions.assertEquals(A, out.effectiveVoter());
        Assertions.assertEquals(0, out.hops());
        Assertions.assertEquals(List.of(A), out.path());
    }

    @Test
    void followsChainToTerminalSigner() {
        edge(A, B, null);
        edge(B, C, null);
        Resolution out = resolver.resolve(A, 10L, 3);
        Assertions.assertEquals(C, out.effectiveVoter());
        Assertions.assertEquals(2, out.hops());
        Assertions.assertEquals(List.of(A, B, C), out.path());
    }

    @Test
    void staleEdgeStopsTheWalkWithoutMutatingStore() {
        edge(A, B, null);
        edge(B, C, 50L);
        Assertions.assertEquals(C, resolver.resolve(A, 49L, 3).effectiveVoter());
        Resolution atExpiry = resolver.resolve(A, 50L, 3);
        Assertions.assertEquals(B, atExpiry.effectiveVoter());
        Assertions.assertEquals(1, atExpiry.hops());
        Assertions.assertTrue(store.getActive(B).isPresent());
    }

    @Test
    void stopsAtDepthCeiling() {
        edge(A, B, null);
        edge(B, C, null);
        edge(C, D, null);
        edge(D, E, null);
        Resolution out = resolver.resolve(A, 0L, 3);
        Assertions.assertEquals(D, out.effectiveVoter());
        Assertions.assertEquals(3, out.hops());

        Resolution zero = resolver.resolve(A, 0L, 0);
        Assertions.assertEquals(A, zero.effectiveVoter());
        Assertions.assertEquals(0, zero.hops());
    }

    @Test
    void corruptCycleIsReportedInsteadOfLooping() {
        edge(A, B, null);
        edge(B, C, null);
        edge(C, A, null);
        DelegationCycleException ex = Assertions.assertThrows(DelegationCycleException.class,
                () -> resolver.resolve(A, 0L, 3));
        Assertions.assertEquals(List.of(A, B, C), ex.path());
    }

    @Test
    void rejectsNegativeHopBudget() {
        Assertions.assertThrows(IllegalArgumentException.class, () -> resolver.resolve(A, 0L, -1));
    }
}
