package com.ringcache.cluster;

import org.jboss.logging.Logger;

import java.nio.charset.StandardCharsets;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Yönlendiricilerin okuduğu güncel halkayı tutar. Üyelik her değiştiğinde ölü
 * olmayan üyelerden yeni bir halka kurulur ve referans atomik olarak
 * değiştirilir; okuyucular her zaman tutarlı bir halka görür.
 */
public final class RingManager implements MembershipListener
{
    private static final Logger LOG = Logger.getLogger(RingManager.class);

    private final MembershipTable membership;
    private final HashFn hash;
    private final int virtualNodes;
    private final AtomicReference<ConsistentHashRing<NodeInfo>> current = new AtomicReference<>();

    public RingManager(MembershipTable membership, HashFn hash, int virtualNodes)
    {
        this.membership = Objects.requireNonNull(membership, "membership");
        this.hash = Objects.requireNonNull(hash, "hash");
        this.virtualNodes = Math.max(1, virtualNodes);
        rebuild();
        membership.addListener(this);
    }

    @Override
    public void onTransition(NodeInfo previous, NodeInfo current)
    {
        rebuild();
    }

    public synchronized ConsistentHashRing<NodeInfo> rebuild()
    {
        Map<String, NodeInfo> nodes = new LinkedHashMap<>();
        for (NodeInfo info : membership.routableNodes()) {
            nodes.put(info.id(), info);
        }
        ConsistentHashRing<NodeInfo> ring = ConsistentHashRing.build(hash, virtualNodes, nodes);
        ConsistentHashRing<NodeInfo> previous = current.getAndSet(ring);
        if (previous == null || !previous.nodes().keySet().equals(ring.nodes().keySet())) {
            LOG.infof("Hash ring rebuilt with %d nodes: %s", nodes.size(), nodes.keySet());
        }
        return ring;
    }

    public ConsistentHashRing<NodeInfo> current()
    {
        return current.get();
    }

    /**
     * Anahtarın birincil sahibini döndürür. Yerel düğüm her zaman halkada
     * olduğundan sonuç boş olamaz.
     */
    public NodeInfo route(String key)
    {
        return current.get().primaryOwner(key.getBytes(StandardCharsets.UTF_8))
                .orElseThrow(() -> new IllegalStateException("Hash ring is empty"));
    }
}
