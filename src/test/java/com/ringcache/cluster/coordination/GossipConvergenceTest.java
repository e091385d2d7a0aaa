package com.ringcache.cluster.coordination;

import com.ringcache.cluster.CacheNode;
import com.ringcache.cluster.ClusterState;
import com.ringcache.cluster.HashFn;
import com.ringcache.cluster.MembershipTable;
import com.ringcache.cluster.NodeInfo;
import com.ringcache.cluster.NodeState;
import com.ringcache.cluster.RequestCoordinator;
import com.ringcache.cluster.RingManager;
import com.ringcache.core.CacheEngine;
import com.ringcache.index.CacheIndex;
import com.ringcache.metric.MetricsRegistry;
import com.ringcache.storage.FileStorageUnit;
import io.vertx.core.Vertx;
import io.vertx.core.WorkerExecutor;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.net.ServerSocket;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicLong;

import static org.junit.jupiter.api.Assertions.*;

class GossipConvergenceTest
{
    private static final long NODE_TIMEOUT = 10_000L;
    private static final long SUSPECT_TIMEOUT = 10_000L;

    @TempDir
    Path dir;

    private final AtomicLong clock = new AtomicLong(1_000_000L);
    private Vertx vertx;
    private WorkerExecutor worker;
    private final List<TestNode> nodes = new ArrayList<>();

    @BeforeEach
    void setUp() throws IOException
    {
        vertx = Vertx.vertx();
        worker = vertx.createSharedWorkerExecutor("gossip-test", 8);
        TestNode a = new TestNode("node-a", availablePort(), List.of());
        nodes.add(a);
        String seed = "127.0.0.1:" + a.port;
        nodes.add(new TestNode("node-b", availablePort(), List.of(seed)));
        nodes.add(new TestNode("node-c", availablePort(), List.of(seed)));
    }

    @AfterEach
    void tearDown()
    {
        for (TestNode node : nodes) {
            node.close();
        }
        worker.close();
        vertx.close().toCompletionStage().toCompletableFuture().join();
    }

    private TestNode node(String id)
    {
        return nodes.stream().filter(n -> n.id.equals(id)).findFirst().orElseThrow();
    }

    private void converge()
    {
        for (int round = 0; round < 4; round++) {
            for (TestNode node : nodes) {
                if (node.running) {
                    node.gossip.runRound();
                }
            }
        }
    }

    private static int availablePort() throws IOException
    {
        try (ServerSocket socket = new ServerSocket(0)) {
            socket.setReuseAddress(true);
            return socket.getLocalPort();
        }
    }

    private static byte[] utf8(String s)
    {
        return s.getBytes(StandardCharsets.UTF_8);
    }

    @Nested
    class Convergence
    {
        // Bu test tohumlar üzerinden katılan üç düğümün aynı üyelik görünümüne ulaştığını doğrular.
        @Test
        void three_nodes_reach_same_view()
        {
            converge();
            for (TestNode node : nodes) {
                List<String> ids = node.membership.routableNodes().stream().map(NodeInfo::id).toList();
                assertEquals(List.of("node-a", "node-b", "node-c"), ids, "view of " + node.id);
                assertEquals(3, node.ring.current().nodes().size());
            }
        }

        // Bu test her düğümün aynı anahtar için aynı sahibi seçtiğini gösterir.
        @Test
        void all_nodes_pick_same_owner()
        {
            converge();
            for (int i = 0; i < 100; i++) {
                String key = "key-" + i;
                String owner = nodes.get(0).coordinator.route(key).id();
                for (TestNode node : nodes) {
                    assertEquals(owner, node.coordinator.route(key).id());
                }
            }
        }

        // Bu test bir düğüme yazılan değerin her düğümden okunabildiğini doğrular.
        @Test
        void value_is_readable_from_any_node()
        {
            converge();
            node("node-a").coordinator.set("testkey", utf8("test123"));

            for (TestNode node : nodes) {
                Optional<byte[]> value = node.coordinator.get("testkey");
                assertTrue(value.isPresent(), "missing on " + node.id);
                assertEquals("test123", new String(value.get(), StandardCharsets.UTF_8));
            }

            String owner = node("node-a").coordinator.route("testkey").id();
            assertTrue(node(owner).engine.get("testkey").isPresent());
            for (TestNode node : nodes) {
                if (!node.id.equals(owner)) {
                    assertTrue(node.engine.get("testkey").isEmpty(), "copy stored on " + node.id);
                }
            }
        }
    }

    @Nested
    class FailureDetection
    {
        // Bu test duran bir düğümün önce şüpheli sonra ölü ilan edilip halkadan çıktığını doğrular.
        @Test
        void stopped_node_leaves_ring()
        {
            converge();
            TestNode victim = node("node-c");
            victim.close();

            clock.addAndGet(NODE_TIMEOUT + 1);
            converge();
            assertEquals(NodeState.SUSPECT, node("node-a").membership.get("node-c").orElseThrow().state());
            assertEquals(3, node("node-a").ring.current().nodes().size());

            clock.addAndGet(SUSPECT_TIMEOUT + 1);
            converge();
            for (String id : List.of("node-a", "node-b")) {
                TestNode survivor = node(id);
                assertEquals(NodeState.DEAD, survivor.membership.get("node-c").orElseThrow().state());
                assertEquals(2, survivor.ring.current().nodes().size());
            }
            for (int i = 0; i < 50; i++) {
                assertNotEquals("node-c", node("node-a").coordinator.route("key-" + i).id());
            }
        }

        // Bu test yanıt veren düğümlerin zaman aşımı sonrasında da ölü ilan edilmediğini gösterir.
        @Test
        void live_nodes_are_never_declared_dead()
        {
            converge();
            clock.addAndGet(NODE_TIMEOUT + 1);
            converge();
            clock.addAndGet(SUSPECT_TIMEOUT + 1);
            converge();
            for (TestNode node : nodes) {
                assertTrue(node.membership.snapshot().stream().noneMatch(n -> n.state() == NodeState.DEAD),
                        "view of " + node.id + ": " + node.membership.snapshot());
                assertEquals(3, node.ring.current().nodes().size());
            }
        }
    }

    private final class TestNode
    {
        final String id;
        final int port;
        final CacheEngine engine;
        final ClusterState state;
        final MembershipTable membership;
        final RingManager ring;
        final GossipServer server;
        final PeerClients peers;
        final GossipService gossip;
        final RequestCoordinator coordinator;
        boolean running = true;

        TestNode(String id, int port, List<String> seeds)
        {
            this.id = id;
            this.port = port;
            MetricsRegistry metrics = new MetricsRegistry();
            Path storage = dir.resolve(id);
            FileStorageUnit records = FileStorageUnit.open(storage, false);
            engine = CacheEngine.builder(CacheIndex.open(storage, false), records)
                    .metrics(metrics)
                    .build();
            state = new ClusterState(id, "127.0.0.1", port, 3000 + port % 1000, metrics);
            membership = new MembershipTable(state, clock::get, NODE_TIMEOUT, SUSPECT_TIMEOUT, 0L, metrics);
            ring = new RingManager(membership, HashFn.md5(), 10);
            CacheNode local = new EngineNode(id, engine);
            server = new GossipServer("127.0.0.1", port, state, membership, ring, local, vertx, worker);
            server.start();
            peers = new PeerClients(vertx, 1_000L);
            membership.addListener(peers);
            gossip = new GossipService(state, membership, peers, seeds, 3, 0L, 1_000L, vertx);
            coordinator = new RequestCoordinator(state, ring, local, peers, metrics);
        }

        void close()
        {
            if (!running) {
                return;
            }
            running = false;
            gossip.close();
            peers.close();
            server.close();
            engine.close();
        }
    }

    private record EngineNode(String id, CacheEngine engine) implements CacheNode
    {
        @Override
        public Optional<byte[]> get(String key)
        {
            return engine.get(key);
        }

        @Override
        public void set(String key, byte[] value)
        {
            engine.set(key, value);
        }

        @Override
        public boolean delete(String key)
        {
            return engine.delete(key);
        }
    }
}
