package com.ringcache.config;

import com.ringcache.cluster.CacheNode;
import com.ringcache.cluster.ClusterState;
import com.ringcache.cluster.HashFn;
import com.ringcache.cluster.MembershipTable;
import com.ringcache.cluster.RequestCoordinator;
import com.ringcache.cluster.RingManager;
import com.ringcache.cluster.coordination.PeerClients;
import com.ringcache.core.CacheEngine;
import com.ringcache.index.CacheIndex;
import com.ringcache.metric.MetricsRegistry;
import com.ringcache.storage.FileStorageUnit;
import com.ringcache.storage.StorageUnit;
import io.quarkus.arc.DefaultBean;
import io.vertx.core.Vertx;
import io.vertx.core.VertxOptions;
import io.vertx.core.WorkerExecutor;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.inject.Disposes;
import jakarta.enterprise.inject.Produces;
import jakarta.inject.Inject;
import jakarta.inject.Singleton;
import org.jboss.logging.Logger;

import java.nio.file.Path;
import java.util.Optional;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Uygulamanın tekil bean'lerini üretir: Vert.x ve worker havuzu, depolama
 * birimi ile indeks, önbellek motoru, küme durumu, üyelik tablosu, halka ve
 * istek yönlendirici. Değerler {@link AppProperties} üzerinden okunur;
 * kapanışta kaynaklar ters sırayla bırakılır.
 */
@ApplicationScoped
public class AppConfig
{
    private static final Logger LOG = Logger.getLogger(AppConfig.class);

    private final AppProperties properties;
    private final AtomicBoolean ownsVertx = new AtomicBoolean(false);

    @Inject
    public AppConfig(AppProperties properties)
    {
        this.properties = properties;
    }

    @Produces
    @Singleton
    @DefaultBean
    public Vertx vertx()
    {
        ownsVertx.set(true);
        var network = properties.network();

        VertxOptions options = new VertxOptions();
        int eventLoopThreads = network.eventLoopThreads();
        if (eventLoopThreads <= 0) {
            eventLoopThreads = VertxOptions.DEFAULT_EVENT_LOOP_POOL_SIZE;
        }
        options.setEventLoopPoolSize(eventLoopThreads);
        options.setWorkerPoolSize(Math.max(1, network.workerThreads()));
        return Vertx.vertx(options);
    }

    void disposeVertx(@Disposes Vertx vertx)
    {
        if (ownsVertx.get()) {
            vertx.close().toCompletionStage().toCompletableFuture().join();
        }
    }

    @Produces
    @Singleton
    public WorkerExecutor workerExecutor(Vertx vertx)
    {
        return vertx.createSharedWorkerExecutor("ring-cache-worker", Math.max(1, properties.network().workerThreads()));
    }

    void disposeWorkerExecutor(@Disposes WorkerExecutor workerExecutor)
    {
        workerExecutor.close();
    }

    @Produces
    @Singleton
    public MetricsRegistry metricsRegistry()
    {
        return new MetricsRegistry();
    }

    @Produces
    @Singleton
    public StorageUnit storageUnit()
    {
        var storage = properties.storage();
        return FileStorageUnit.open(Path.of(storage.directory()), storage.fsync());
    }

    @Produces
    @Singleton
    public CacheIndex cacheIndex()
    {
        var storage = properties.storage();
        CacheIndex index = CacheIndex.open(Path.of(storage.directory()), storage.fsync());
        if (index.skippedOnLoad() > 0) {
            LOG.warnf("Skipped %d malformed index entries while loading %s", index.skippedOnLoad(), storage.directory());
        }
        return index;
    }

    @Produces
    @Singleton
    public CacheEngine cacheEngine(CacheIndex index, StorageUnit storage, MetricsRegistry metrics)
    {
        CacheEngine engine = CacheEngine.builder(index, storage)
                .metrics(metrics)
                .build();
        LOG.infof("Cache engine opened with %d entries in %s", engine.size(), properties.storage().directory());
        return engine;
    }

    void disposeCacheEngine(@Disposes CacheEngine engine)
    {
        engine.close();
    }

    @Produces
    @Singleton
    public ClusterState clusterState(MetricsRegistry metrics)
    {
        var node = properties.node();
        String nodeId = resolveNodeId(node.id(), node.host(), node.port());
        return new ClusterState(nodeId, node.host(), node.port(), node.apiPort(), metrics);
    }

    static String resolveNodeId(Optional<String> configured, String host, int port)
    {
        return configured
                .map(String::trim)
                .filter(id -> !id.isEmpty())
                .orElseGet(() -> host + ":" + port);
    }

    @Produces
    @Singleton
    public MembershipTable membershipTable(ClusterState clusterState, MetricsRegistry metrics)
    {
        var cluster = properties.cluster();
        long retention = cluster.deadRetentionSeconds().map(TimeUnit.SECONDS::toMillis).orElse(0L);
        return new MembershipTable(clusterState,
                System::currentTimeMillis,
                TimeUnit.SECONDS.toMillis(cluster.nodeTimeoutSeconds()),
                TimeUnit.SECONDS.toMillis(cluster.suspectTimeoutSeconds()),
                retention,
                metrics);
    }

    @Produces
    @Singleton
    public RingManager ringManager(MembershipTable membership)
    {
        return new RingManager(membership, HashFn.md5(), properties.cluster().virtualNodes());
    }

    @Produces
    @Singleton
    public CacheNode localNode(CacheEngine engine, ClusterState clusterState)
    {
        final String nodeId = clusterState.localNodeId();
        return new CacheNode()
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

            @Override
            public String id()
            {
                return nodeId;
            }
        };
    }

    @Produces
    @Singleton
    public PeerClients peerClients(Vertx vertx, MembershipTable membership)
    {
        PeerClients peers = new PeerClients(vertx, properties.cluster().requestTimeoutMillis());
        membership.addListener(peers);
        return peers;
    }

    void disposePeerClients(@Disposes PeerClients peers)
    {
        peers.close();
    }

    @Produces
    @Singleton
    public RequestCoordinator requestCoordinator(ClusterState clusterState,
                                                 RingManager ring,
                                                 CacheNode localNode,
                                                 PeerClients peers,
                                                 MetricsRegistry metrics)
    {
        return new RequestCoordinator(clusterState, ring, localNode, peers, metrics);
    }
}
