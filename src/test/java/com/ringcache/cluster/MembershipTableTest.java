package com.ringcache.cluster;

import com.ringcache.metric.MetricsRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.AtomicLong;

import static org.junit.jupiter.api.Assertions.*;

class MembershipTableTest
{
    private static final long NODE_TIMEOUT = 10_000L;
    private static final long SUSPECT_TIMEOUT = 5_000L;

    private final AtomicLong clock = new AtomicLong(1_000_000L);
    private MetricsRegistry metrics;
    private ClusterState local;
    private MembershipTable table;
    private final List<String> events = new ArrayList<>();

    @BeforeEach
    void setup()
    {
        metrics = new MetricsRegistry();
        local = new ClusterState("self", "127.0.0.1", 7000, 3000, metrics);
        table = newTable(0L);
    }

    private MembershipTable newTable(long deadRetention)
    {
        MembershipTable t = new MembershipTable(local, clock::get, NODE_TIMEOUT, SUSPECT_TIMEOUT, deadRetention, metrics);
        t.addListener((previous, current) -> events.add(
                (previous == null ? "-" : previous.state().name()) + ">" + (current == null ? "-" : current.state().name())));
        return t;
    }

    private static NodeInfo node(String id, long incarnation, NodeState state)
    {
        return new NodeInfo(id, "10.0.0." + id.length(), 7000, 3000, incarnation, state);
    }

    private NodeState stateOf(String id)
    {
        return table.get(id).orElseThrow().state();
    }

    @Nested
    class Merge
    {
        // Bu test yeni üyelerin eklendiğini ve yerel düğümün görünümde bulunduğunu doğrular.
        @Test
        void new_member_is_added()
        {
            assertTrue(table.merge(List.of(node("a", 0, NodeState.ALIVE))));
            assertEquals(List.of("a", "self"), table.snapshot().stream().map(NodeInfo::id).toList());
            assertEquals(List.of("->ALIVE"), events);
        }

        // Bu test yüksek enkarnasyonun her zaman kazandığını gösterir.
        @Test
        void higher_incarnation_wins()
        {
            table.merge(List.of(node("a", 1, NodeState.DEAD)));
            assertTrue(table.merge(List.of(node("a", 2, NodeState.ALIVE))));
            assertEquals(NodeState.ALIVE, stateOf("a"));
            assertEquals(2L, table.get("a").orElseThrow().incarnation());
        }

        // Bu test eşit enkarnasyonda daha ciddi durumun kazandığını doğrular.
        @Test
        void more_severe_state_wins_at_equal_incarnation()
        {
            table.merge(List.of(node("a", 3, NodeState.ALIVE)));
            assertTrue(table.merge(List.of(node("a", 3, NodeState.SUSPECT))));
            assertEquals(NodeState.SUSPECT, stateOf("a"));

            assertFalse(table.merge(List.of(node("a", 3, NodeState.ALIVE))));
            assertEquals(NodeState.SUSPECT, stateOf("a"));
        }

        // Bu test düşük enkarnasyonlu eski bilgilerin yok sayıldığını gösterir.
        @Test
        void stale_update_is_ignored()
        {
            table.merge(List.of(node("a", 5, NodeState.ALIVE)));
            assertFalse(table.merge(List.of(node("a", 4, NodeState.DEAD))));
            assertEquals(NodeState.ALIVE, stateOf("a"));
        }

        // Bu test yerel düğüm hakkındaki şüphenin enkarnasyon artışıyla çürütüldüğünü doğrular.
        @Test
        void suspicion_about_local_node_is_refuted()
        {
            table.merge(List.of(new NodeInfo("self", "127.0.0.1", 7000, 3000, 4, NodeState.SUSPECT)));
            assertEquals(5L, local.incarnation());
            assertEquals(NodeState.ALIVE, table.get("self").orElseThrow().state());
            assertEquals(1L, metrics.counter("cluster_refutations").get());

            // daha eski bir şüphe yeniden çürütme gerektirmez
            table.merge(List.of(new NodeInfo("self", "127.0.0.1", 7000, 3000, 2, NodeState.DEAD)));
            assertEquals(5L, local.incarnation());
        }

        // Bu test yeniden başlayan düğümün önceki çalıştırmadan kalan canlı kaydını aştığını doğrular.
        @Test
        void alive_report_from_previous_run_is_outranked()
        {
            table.merge(List.of(new NodeInfo("self", "10.9.9.9", 7100, 3100, 3, NodeState.ALIVE)));
            assertEquals(4L, local.incarnation());
            NodeInfo advertised = table.get("self").orElseThrow();
            assertEquals("127.0.0.1:7000", advertised.address());
            assertEquals(4L, advertised.incarnation());
        }

        // Bu test aynı enkarnasyonda farklı adres bildiren raporun çürütüldüğünü, güncel raporun ise dokunulmadığını gösterir.
        @Test
        void stale_address_at_same_incarnation_is_refuted()
        {
            table.merge(List.of(new NodeInfo("self", "127.0.0.1", 7000, 3000, 0, NodeState.ALIVE)));
            assertEquals(0L, local.incarnation());

            table.merge(List.of(new NodeInfo("self", "10.9.9.9", 7100, 3100, 0, NodeState.ALIVE)));
            assertEquals(1L, local.incarnation());
            assertEquals(1L, metrics.counter("cluster_refutations").get());
        }
    }

    @Nested
    class FailureDetection
    {
        // Bu test sessiz kalan üyenin önce şüpheli sonra ölü olduğunu gösterir.
        @Test
        void silent_member_becomes_suspect_then_dead()
        {
            table.merge(List.of(node("a", 0, NodeState.ALIVE)));

            clock.addAndGet(NODE_TIMEOUT + 1);
            assertEquals(List.of(NodeState.SUSPECT),
                    table.detectFailures().stream().map(NodeInfo::state).toList());

            clock.addAndGet(SUSPECT_TIMEOUT + 1);
            table.detectFailures();
            assertEquals(NodeState.DEAD, stateOf("a"));
            assertTrue(table.routableNodes().stream().noneMatch(n -> n.id().equals("a")));
            assertTrue(table.probeCandidates().isEmpty());
        }

        // Bu test doğrudan temasın şüpheli üyeyi yeniden canlı yaptığını doğrular.
        @Test
        void direct_contact_clears_suspicion()
        {
            table.merge(List.of(node("a", 0, NodeState.ALIVE)));
            clock.addAndGet(NODE_TIMEOUT + 1);
            table.detectFailures();
            assertEquals(NodeState.SUSPECT, stateOf("a"));

            table.recordHeard("a");
            assertEquals(NodeState.ALIVE, stateOf("a"));

            clock.addAndGet(SUSPECT_TIMEOUT + 1);
            assertTrue(table.detectFailures().isEmpty());
        }

        // Bu test ölü üyenin doğrudan temasla değil ancak yüksek enkarnasyonla döndüğünü gösterir.
        @Test
        void dead_member_returns_only_with_higher_incarnation()
        {
            table.merge(List.of(node("a", 0, NodeState.ALIVE)));
            clock.addAndGet(NODE_TIMEOUT + 1);
            table.detectFailures();
            clock.addAndGet(SUSPECT_TIMEOUT + 1);
            table.detectFailures();

            table.recordHeard("a");
            assertEquals(NodeState.DEAD, stateOf("a"));
            table.merge(List.of(node("a", 0, NodeState.ALIVE)));
            assertEquals(NodeState.DEAD, stateOf("a"));

            table.merge(List.of(node("a", 1, NodeState.ALIVE)));
            assertEquals(NodeState.ALIVE, stateOf("a"));
            assertEquals(1, table.probeCandidates().size());
        }

        // Bu test saklama süresi tanımlıysa ölü üyenin tablodan temizlendiğini doğrular.
        @Test
        void dead_member_is_purged_after_retention()
        {
            table = newTable(1_000L);
            table.merge(List.of(node("a", 0, NodeState.DEAD)));

            clock.addAndGet(1_001L);
            table.detectFailures();
            assertTrue(table.get("a").isEmpty());
            assertEquals("DEAD>-", events.get(events.size() - 1));
        }

        // Bu test saklama süresi yoksa ölü üyenin tabloda kaldığını gösterir.
        @Test
        void dead_member_stays_without_retention()
        {
            table.merge(List.of(node("a", 0, NodeState.DEAD)));
            clock.addAndGet(10 * NODE_TIMEOUT);
            table.detectFailures();
            assertTrue(table.get("a").isPresent());
        }
    }

    @Nested
    class Queries
    {
        // Bu test adres ile üye aramanın yerel düğümü de kapsadığını doğrular.
        @Test
        void address_lookup_includes_local_node()
        {
            table.merge(List.of(new NodeInfo("b", "10.0.0.9", 7100, 3100, 0, NodeState.ALIVE)));
            assertEquals("b", table.findByAddress("10.0.0.9", 7100).orElseThrow().id());
            assertEquals("self", table.findByAddress("127.0.0.1", 7000).orElseThrow().id());
            assertTrue(table.findByAddress("10.0.0.9", 7101).isEmpty());
        }

        // Bu test yoklama başarısızlıklarının sayıldığını gösterir.
        @Test
        void probe_failures_are_counted()
        {
            table.recordProbeFailure("a");
            table.recordProbeFailure("a");
            assertEquals(2L, metrics.counter("probe_failures").get());
        }
    }
}
