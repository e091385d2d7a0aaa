package com.ringcache.cluster.coordination;

import com.ringcache.cluster.ClusterState;
import com.ringcache.cluster.MembershipTable;
import com.ringcache.cluster.NodeInfo;
import com.ringcache.cluster.NodeState;
import com.ringcache.config.AppProperties;
import io.quarkus.runtime.Startup;
import io.vertx.core.Vertx;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import jakarta.inject.Inject;
import jakarta.inject.Singleton;
import org.jboss.logging.Logger;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * SWIM tarzı üyelik döngüsü. Her turda önce zaman aşımları uygulanır, sonra
 * rastgele seçilen birkaç üye ve henüz tanınmayan tohum adresleri yoklanır.
 * Yoklama üyelik görünümünü taşır, yanıt ise karşı tarafın görünümünü getirir;
 * iki görünüm de çatışma kuralıyla birleştirilir.
 *
 * <p>Tur tetikleyicisi Vert.x zamanlayıcısıdır. Yoklamalar engelleyici olduğu
 * için ayrı bir havuzda yürür ve aynı anda en fazla bir tur çalışır. Tohumu
 * olmayan düğüm kümenin başlangıç noktasıdır.
 */
@Startup
@Singleton
public class GossipService implements AutoCloseable
{
    private static final Logger LOG = Logger.getLogger(GossipService.class);

    private final ClusterState clusterState;
    private final MembershipTable membership;
    private final PeerClients peers;
    private final List<String> seeds;
    private final int fanout;
    private final long intervalMillis;
    private final long requestTimeoutMillis;
    private final Vertx vertx;
    private final ExecutorService probeExecutor;
    private final AtomicBoolean roundInProgress = new AtomicBoolean(false);
    private long gossipTimerId = -1L;
    private volatile boolean running;

    @Inject
    public GossipService(AppProperties properties,
                         ClusterState clusterState,
                         MembershipTable membership,
                         PeerClients peers,
                         Vertx vertx)
    {
        this(clusterState, membership, peers,
                properties.cluster().seeds().orElse(List.of()),
                properties.cluster().probeFanout(),
                TimeUnit.SECONDS.toMillis(properties.cluster().gossipIntervalSeconds()),
                properties.cluster().requestTimeoutMillis(),
                vertx);
    }

    public GossipService(ClusterState clusterState,
                         MembershipTable membership,
                         PeerClients peers,
                         List<String> seeds,
                         int fanout,
                         long intervalMillis,
                         long requestTimeoutMillis,
                         Vertx vertx)
    {
        this.clusterState = clusterState;
        this.membership = membership;
        this.peers = peers;
        this.seeds = List.copyOf(seeds);
        this.fanout = Math.max(1, fanout);
        this.intervalMillis = intervalMillis;
        this.requestTimeoutMillis = Math.max(50L, requestTimeoutMillis);
        this.vertx = vertx;
        this.probeExecutor = Executors.newCachedThreadPool(daemonThreads("gossip-probe-"));
    }

    private static ThreadFactory daemonThreads(String prefix)
    {
        AtomicInteger counter = new AtomicInteger();
        return runnable -> {
            Thread thread = new Thread(runnable, prefix + counter.getAndIncrement());
            thread.setDaemon(true);
            return thread;
        };
    }

    @PostConstruct
    void init()
    {
        start();
    }

    public synchronized void start()
    {
        if (running) {
            return;
        }
        running = true;
        if (intervalMillis > 0) {
            gossipTimerId = vertx.setPeriodic(intervalMillis, id -> scheduleRound());
        }
        if (seeds.isEmpty()) {
            LOG.infof("Node %s starting as cluster origin", clusterState.localNodeId());
        } else {
            LOG.infof("Node %s joining cluster via seeds %s", clusterState.localNodeId(), seeds);
        }
    }

    public boolean isRunning()
    {
        return running;
    }

    private void scheduleRound()
    {
        if (!running || !roundInProgress.compareAndSet(false, true)) {
            return;
        }
        try {
            probeExecutor.execute(() -> {
                try {
                    runRound();
                } catch (RuntimeException e) {
                    LOG.warn("Gossip round failed", e);
                } finally {
                    roundInProgress.set(false);
                }
            });
        } catch (RejectedExecutionException e) {
            roundInProgress.set(false);
            LOG.debug("Gossip round rejected, executor is shutting down");
        }
    }

    /**
     * Tek bir gossip turu yürütür ve bitene kadar bekler. Event-loop
     * thread'inden çağrılmamalıdır.
     */
    public void runRound()
    {
        membership.detectFailures();

        List<Probe> probes = new ArrayList<>();
        List<NodeInfo> candidates = new ArrayList<>(membership.probeCandidates());
        Collections.shuffle(candidates);
        for (NodeInfo target : candidates.subList(0, Math.min(fanout, candidates.size()))) {
            probes.add(new Probe(target.id(), null, submit(peers.connect(target))));
        }
        for (String seed : seeds) {
            SeedAddress address = SeedAddress.parse(seed);
            if (address == null) {
                continue;
            }
            Optional<NodeInfo> known = membership.findByAddress(address.host(), address.port());
            if (known.isPresent() && known.get().state() != NodeState.DEAD) {
                continue;
            }
            probes.add(new Probe(null, address, submit(peers.connectSeed(address.host(), address.port()))));
        }

        long deadline = System.nanoTime() + TimeUnit.MILLISECONDS.toNanos(requestTimeoutMillis * 2);
        for (Probe probe : probes) {
            try {
                long remaining = Math.max(1L, deadline - System.nanoTime());
                List<NodeInfo> view = probe.future().get(remaining, TimeUnit.NANOSECONDS);
                onProbeSuccess(probe, view);
            } catch (ExecutionException e) {
                onProbeFailure(probe, e.getCause() != null ? e.getCause() : e);
            } catch (TimeoutException e) {
                probe.future().cancel(true);
                onProbeFailure(probe, e);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                return;
            }
        }
    }

    private CompletableFuture<List<NodeInfo>> submit(RemoteNode target)
    {
        try {
            return CompletableFuture.supplyAsync(
                    () -> target.ping(clusterState.localNodeId(), membership.snapshot()), probeExecutor);
        } catch (RejectedExecutionException e) {
            return CompletableFuture.failedFuture(e);
        }
    }

    private void onProbeSuccess(Probe probe, List<NodeInfo> view)
    {
        if (probe.nodeId() != null) {
            membership.recordHeard(probe.nodeId());
            membership.merge(view);
            return;
        }
        membership.merge(view);
        membership.findByAddress(probe.seed().host(), probe.seed().port())
                .filter(node -> !clusterState.isLocal(node.id()))
                .ifPresent(node -> membership.recordHeard(node.id()));
    }

    private void onProbeFailure(Probe probe, Throwable cause)
    {
        if (probe.nodeId() != null) {
            membership.recordProbeFailure(probe.nodeId());
            LOG.debugf(cause, "Probe to cluster member %s failed", probe.nodeId());
        } else {
            LOG.debugf("Seed %s:%d unreachable: %s", probe.seed().host(), probe.seed().port(), cause.getMessage());
        }
    }

    @PreDestroy
    @Override
    public synchronized void close()
    {
        running = false;
        if (gossipTimerId >= 0L) {
            vertx.cancelTimer(gossipTimerId);
            gossipTimerId = -1L;
        }
        probeExecutor.shutdownNow();
    }

    private record Probe(String nodeId, SeedAddress seed, CompletableFuture<List<NodeInfo>> future) {}

    record SeedAddress(String host, int port)
    {
        static SeedAddress parse(String value)
        {
            if (value == null) {
                return null;
            }
            String trimmed = value.trim();
            int colon = trimmed.lastIndexOf(':');
            if (colon <= 0 || colon == trimmed.length() - 1) {
                LOG.warnf("Ignoring malformed seed address '%s'", value);
                return null;
            }
            try {
                return new SeedAddress(trimmed.substring(0, colon), Integer.parseInt(trimmed.substring(colon + 1)));
            } catch (NumberFormatException e) {
                LOG.warnf("Ignoring seed address '%s' with invalid port", value);
                return null;
            }
        }
    }
}
