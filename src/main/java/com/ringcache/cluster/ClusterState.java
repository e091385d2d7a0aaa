package com.ringcache.cluster;

import com.ringcache.metric.Counter;
import com.ringcache.metric.MetricsRegistry;

import java.util.Objects;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Yerel düğümün kimliğini, adreslerini ve kendi enkarnasyon sayacını tutar.
 * Başka bir üye bu düğümü şüpheli ya da ölü ilan ettiğinde enkarnasyon,
 * görülen değerin bir fazlasına çıkarılarak iddia çürütülür.
 */
public final class ClusterState
{
    private final String localNodeId;
    private final String host;
    private final int port;
    private final int apiPort;
    private final AtomicLong incarnation = new AtomicLong(0L);
    private final Counter refutations;

    public ClusterState(String localNodeId, String host, int port, int apiPort, MetricsRegistry metrics)
    {
        this.localNodeId = Objects.requireNonNull(localNodeId, "localNodeId");
        this.host = Objects.requireNonNull(host, "host");
        this.port = port;
        this.apiPort = apiPort;
        this.refutations = metrics != null ? metrics.counter("cluster_refutations") : null;
    }

    public String localNodeId()
    {
        return localNodeId;
    }

    public long incarnation()
    {
        return incarnation.get();
    }

    /** Yerel düğümün kendisi hakkındaki güncel ve her zaman canlı görünümü. */
    public NodeInfo localNode()
    {
        return new NodeInfo(localNodeId, host, port, apiPort, incarnation.get(), NodeState.ALIVE);
    }

    /**
     * Gözlenen enkarnasyondan kesin olarak büyük yeni bir enkarnasyona geçer.
     *
     * @return yeni enkarnasyon
     */
    public long refute(long observedIncarnation)
    {
        long value = incarnation.updateAndGet(current -> Math.max(current, observedIncarnation) + 1);
        if (refutations != null) {
            refutations.inc();
        }
        return value;
    }

    public boolean isLocal(String nodeId)
    {
        return localNodeId.equals(nodeId);
    }
}
