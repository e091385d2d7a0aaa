package com.ringcache.cluster.coordination;

import com.ringcache.cluster.NodeConnector;
import com.ringcache.cluster.NodeInfo;
import com.ringcache.cluster.NodeState;
import com.ringcache.cluster.MembershipListener;
import io.vertx.core.Vertx;
import org.jboss.logging.Logger;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Uzak üyeler için {@link RemoteNode} istemcilerini tutar. Üye adresi
 * değişirse istemci yenilenir, üye ölü ilan edilir ya da tablodan silinirse
 * istemci kapatılır. Tohum adreslerine ise henüz kimliği bilinmeyen geçici
 * istemcilerle bağlanılır.
 */
public final class PeerClients implements NodeConnector, MembershipListener, AutoCloseable
{
    private static final Logger LOG = Logger.getLogger(PeerClients.class);

    private final Vertx vertx;
    private final long requestTimeoutMillis;
    private final Map<String, RemoteNode> clients = new ConcurrentHashMap<>();
    private final Map<String, RemoteNode> seedClients = new ConcurrentHashMap<>();
    private volatile boolean closed;

    public PeerClients(Vertx vertx, long requestTimeoutMillis)
    {
        this.vertx = Objects.requireNonNull(vertx, "vertx");
        this.requestTimeoutMillis = requestTimeoutMillis;
    }

    @Override
    public RemoteNode connect(NodeInfo node)
    {
        if (closed) {
            throw new IllegalStateException("Peer clients are closed");
        }
        RemoteNode[] replaced = new RemoteNode[1];
        RemoteNode client = clients.compute(node.id(), (id, existing) -> {
            if (existing != null && sameEndpoint(existing.target(), node)) {
                return existing;
            }
            replaced[0] = existing;
            return new RemoteNode(node, vertx, requestTimeoutMillis);
        });
        if (replaced[0] != null) {
            LOG.infof("Address of cluster member %s changed to %s", node.id(), node.address());
            closeQuietly(replaced[0]);
        }
        return client;
    }

    /**
     * Kimliği henüz bilinmeyen bir tohum adresi için istemci döndürür.
     */
    public RemoteNode connectSeed(String host, int port)
    {
        if (closed) {
            throw new IllegalStateException("Peer clients are closed");
        }
        String address = host + ":" + port;
        return seedClients.computeIfAbsent(address,
                a -> new RemoteNode(new NodeInfo("seed@" + a, host, port, 0, 0L, NodeState.ALIVE),
                        vertx, requestTimeoutMillis));
    }

    @Override
    public void onTransition(NodeInfo previous, NodeInfo current)
    {
        if (current == null) {
            if (previous != null) {
                closeClient(previous.id());
            }
            return;
        }
        if (current.state() == NodeState.DEAD) {
            closeClient(current.id());
        }
    }

    private void closeClient(String nodeId)
    {
        RemoteNode client = clients.remove(nodeId);
        if (client != null) {
            LOG.debugf("Closing client for cluster member %s", nodeId);
            closeQuietly(client);
        }
    }

    private static boolean sameEndpoint(NodeInfo a, NodeInfo b)
    {
        return a.host().equals(b.host()) && a.port() == b.port();
    }

    private static void closeQuietly(RemoteNode client)
    {
        try {
            client.close();
        } catch (RuntimeException e) {
            LOG.debugf(e, "Failed to close client for node %s", client.id());
        }
    }

    @Override
    public void close()
    {
        closed = true;
        List<RemoteNode> all = new ArrayList<>(clients.values());
        all.addAll(seedClients.values());
        clients.clear();
        seedClients.clear();
        all.forEach(PeerClients::closeQuietly);
    }
}
