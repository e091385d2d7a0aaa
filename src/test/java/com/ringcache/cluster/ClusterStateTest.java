package com.ringcache.cluster;

import com.ringcache.metric.MetricsRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class ClusterStateTest
{
    private MetricsRegistry metrics;
    private ClusterState state;

    @BeforeEach
    void setup()
    {
        metrics = new MetricsRegistry();
        state = new ClusterState("node-1", "10.1.1.1", 7946, 3031, metrics);
    }

    @Nested
    class Identity
    {
        // Bu test yerel düğümün kimliğini, adreslerini ve canlı durumunu doğrular.
        @Test
        void local_node_info_is_returned()
        {
            NodeInfo self = state.localNode();
            assertEquals("node-1", self.id());
            assertEquals("10.1.1.1:7946", self.address());
            assertEquals("10.1.1.1:3031", self.apiAddress());
            assertEquals(NodeState.ALIVE, self.state());
            assertTrue(state.isLocal("node-1"));
            assertFalse(state.isLocal("node-2"));
        }
    }

    @Nested
    class Refutation
    {
        // Bu test çürütmenin gözlenen enkarnasyonun bir fazlasına çıktığını gösterir.
        @Test
        void refute_moves_past_observed_incarnation()
        {
            assertEquals(0L, state.incarnation());
            assertEquals(8L, state.refute(7));
            assertEquals(8L, state.localNode().incarnation());
            assertEquals(1L, metrics.counter("cluster_refutations").get());
        }

        // Bu test daha küçük bir gözlemin enkarnasyonu geri götürmediğini doğrular.
        @Test
        void lower_observation_never_decreases_incarnation()
        {
            state.refute(10);
            assertEquals(12L, state.refute(3));
        }
    }
}
