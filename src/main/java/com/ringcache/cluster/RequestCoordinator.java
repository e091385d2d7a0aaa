package com.ringcache.cluster;

import com.ringcache.metric.Counter;
import com.ringcache.metric.MetricsRegistry;
import org.jboss.logging.Logger;

import java.util.Objects;
import java.util.Optional;

/**
 * İstemci isteklerini anahtarın sahibine yönlendirir. Sahip yerel düğümse
 * işlem doğrudan önbellek motorunda yürütülür, değilse küme portu üzerinden
 * sahibine iletilir ve yanıtı aynen döndürülür. Sahibi olunmayan bir anahtar
 * hiçbir durumda yerelde cevaplanmaz; uzak hata çağırana iletilir.
 */
public final class RequestCoordinator
{
    private static final Logger LOG = Logger.getLogger(RequestCoordinator.class);

    private final ClusterState clusterState;
    private final RingManager ring;
    private final CacheNode localNode;
    private final NodeConnector connector;
    private final Counter forwarded;
    private final Counter forwardFailures;

    public RequestCoordinator(ClusterState clusterState,
                              RingManager ring,
                              CacheNode localNode,
                              NodeConnector connector,
                              MetricsRegistry metrics)
    {
        this.clusterState = Objects.requireNonNull(clusterState, "clusterState");
        this.ring = Objects.requireNonNull(ring, "ring");
        this.localNode = Objects.requireNonNull(localNode, "localNode");
        this.connector = Objects.requireNonNull(connector, "connector");
        MetricsRegistry registry = metrics != null ? metrics : new MetricsRegistry();
        this.forwarded = registry.counter("requests_forwarded");
        this.forwardFailures = registry.counter("forward_failures");
    }

    /** Halkanın o anki görünümüne göre anahtarın sahibi; G/Ç yapmaz. */
    public NodeInfo route(String key)
    {
        return ring.route(key);
    }

    public boolean ownsLocally(String key)
    {
        return clusterState.isLocal(route(key).id());
    }

    public Optional<byte[]> get(String key)
    {
        return targetFor(key).get(key);
    }

    public void set(String key, byte[] value)
    {
        targetFor(key).set(key, value);
    }

    public boolean delete(String key)
    {
        return targetFor(key).delete(key);
    }

    private CacheNode targetFor(String key)
    {
        NodeInfo owner = route(key);
        if (clusterState.isLocal(owner.id())) {
            return localNode;
        }
        forwarded.inc();
        LOG.debugf("Forwarding key %s to owner %s at %s", key, owner.id(), owner.address());
        return new CountingNode(connector.connect(owner));
    }

    /** Yönlendirme hatalarını sayan ince sarmalayıcı. */
    private final class CountingNode implements CacheNode
    {
        private final CacheNode delegate;

        private CountingNode(CacheNode delegate)
        {
            this.delegate = delegate;
        }

        @Override
        public Optional<byte[]> get(String key)
        {
            try {
                return delegate.get(key);
            } catch (RuntimeException e) {
                forwardFailures.inc();
                throw e;
            }
        }

        @Override
        public void set(String key, byte[] value)
        {
            try {
                delegate.set(key, value);
            } catch (RuntimeException e) {
                forwardFailures.inc();
                throw e;
            }
        }

        @Override
        public boolean delete(String key)
        {
            try {
                return delegate.delete(key);
            } catch (RuntimeException e) {
                forwardFailures.inc();
                throw e;
            }
        }

        @Override
        public String id()
        {
            return delegate.id();
        }
    }
}
