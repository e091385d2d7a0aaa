package com.ringcache.cluster;

import com.ringcache.metric.MetricsRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

import static org.junit.jupiter.api.Assertions.*;

class RequestCoordinatorTest
{
    private MetricsRegistry metrics;
    private ClusterState local;
    private MembershipTable membership;
    private RingManager ring;
    private Map<String, FakeNode> nodes;
    private RequestCoordinator coordinator;

    @BeforeEach
    void setup()
    {
        metrics = new MetricsRegistry();
        local = new ClusterState("self", "127.0.0.1", 7000, 3000, metrics);
        membership = new MembershipTable(local, System::currentTimeMillis, 60_000L, 60_000L, 0L, metrics);
        membership.merge(List.of(
                new NodeInfo("peer-a", "127.0.0.2", 7000, 3000, 0, NodeState.ALIVE),
                new NodeInfo("peer-b", "127.0.0.3", 7000, 3000, 0, NodeState.ALIVE)));
        ring = new RingManager(membership, HashFn.md5(), 16);

        nodes = new HashMap<>();
        for (String id : List.of("self", "peer-a", "peer-b")) {
            nodes.put(id, new FakeNode(id));
        }
        coordinator = new RequestCoordinator(local, ring, nodes.get("self"),
                target -> nodes.get(target.id()), metrics);
    }

    private String keyOwnedBy(String owner)
    {
        for (int i = 0; i < 10_000; i++) {
            String key = "key-" + i;
            if (coordinator.route(key).id().equals(owner)) {
                return key;
            }
        }
        throw new AssertionError("no key found for " + owner);
    }

    private static byte[] utf8(String s)
    {
        return s.getBytes(StandardCharsets.UTF_8);
    }

    @Nested
    class Routing
    {
        // Bu test yerel düğüme ait anahtarın yerelde işlendiğini doğrular.
        @Test
        void local_key_is_served_locally()
        {
            String key = keyOwnedBy("self");
            assertTrue(coordinator.ownsLocally(key));
            coordinator.set(key, utf8("v"));
            assertTrue(nodes.get("self").data.containsKey(key));
            assertEquals(0L, metrics.counter("requests_forwarded").get());
        }

        // Bu test başka düğüme ait anahtarın sahibine iletildiğini ve yanıtın aktarıldığını gösterir.
        @Test
        void remote_key_is_forwarded_to_owner()
        {
            String key = keyOwnedBy("peer-a");
            coordinator.set(key, utf8("remote"));
            assertFalse(nodes.get("self").data.containsKey(key));
            assertArrayEquals(utf8("remote"), nodes.get("peer-a").data.get(key));
            assertArrayEquals(utf8("remote"), coordinator.get(key).orElseThrow());
            assertTrue(coordinator.delete(key));
            assertEquals(3L, metrics.counter("requests_forwarded").get());
        }

        // Bu test ölü ilan edilen düğümün anahtarlarının yeni sahibine gittiğini doğrular.
        @Test
        void keys_of_dead_node_move_to_new_owner()
        {
            String key = keyOwnedBy("peer-b");
            membership.merge(List.of(new NodeInfo("peer-b", "127.0.0.3", 7000, 3000, 0, NodeState.DEAD)));
            assertNotEquals("peer-b", coordinator.route(key).id());
        }
    }

    @Nested
    class Failures
    {
        // Bu test uzak hatanın yerelde cevaplanmadan çağırana iletildiğini gösterir.
        @Test
        void remote_failure_reaches_caller()
        {
            String key = keyOwnedBy("peer-a");
            nodes.get("peer-a").failure = new RemoteTimeoutException("peer-a", "timed out", null);

            assertThrows(RemoteTimeoutException.class, () -> coordinator.get(key));
            assertEquals(1L, metrics.counter("forward_failures").get());
            assertTrue(nodes.get("self").data.isEmpty());
        }

        // Bu test sahibin sahipliği reddetmesinin MisroutedException olarak yüzeye çıktığını doğrular.
        @Test
        void ownership_rejection_is_surfaced()
        {
            String key = keyOwnedBy("peer-b");
            nodes.get("peer-b").failure = new MisroutedException(key, "peer-a", "127.0.0.2:3000");

            MisroutedException e = assertThrows(MisroutedException.class, () -> coordinator.set(key, utf8("v")));
            assertEquals("peer-a", e.reportedOwnerId());
            assertFalse(nodes.get("peer-a").data.containsKey(key));
        }
    }

    private static final class FakeNode implements CacheNode
    {
        private final String id;
        private final Map<String, byte[]> data = new ConcurrentHashMap<>();
        private RuntimeException failure;

        private FakeNode(String id)
        {
            this.id = id;
        }

        private void maybeFail()
        {
            if (failure != null) {
                throw failure;
            }
        }

        @Override
        public Optional<byte[]> get(String key)
        {
            maybeFail();
            return Optional.ofNullable(data.get(key));
        }

        @Override
        public void set(String key, byte[] value)
        {
            maybeFail();
            data.put(key, value);
        }

        @Override
        public boolean delete(String key)
        {
            maybeFail();
            return data.remove(key) != null;
        }

        @Override
        public String id()
        {
            return id;
        }
    }
}
