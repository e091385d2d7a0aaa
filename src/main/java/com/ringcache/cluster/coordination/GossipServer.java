package com.ringcache.cluster.coordination;

import com.ringcache.cluster.CacheNode;
import com.ringcache.cluster.ClusterState;
import com.ringcache.cluster.MembershipTable;
import com.ringcache.cluster.NodeInfo;
import com.ringcache.cluster.RingManager;
import com.ringcache.config.AppProperties;
import com.ringcache.constants.NodeProtocol;
import io.quarkus.runtime.Startup;
import io.vertx.core.Vertx;
import io.vertx.core.WorkerExecutor;
import io.vertx.core.buffer.Buffer;
import io.vertx.core.net.NetServer;
import io.vertx.core.net.NetServerOptions;
import io.vertx.core.net.NetSocket;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import jakarta.inject.Inject;
import jakarta.inject.Singleton;
import org.jboss.logging.Logger;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Function;

/**
 * Küme portunu dinleyen Vert.x tabanlı TCP sunucusudur. İki tür trafik taşır:
 * üyelik tablosunu içeren gossip yoklamaları ve sahibi olunmayan anahtarlar
 * için diğer düğümlerden yönlendirilen GET/SET/DELETE istekleri.
 *
 * <p>Yönlendirilen her istekte sahiplik yerel halkaya göre yeniden denetlenir;
 * bu düğüm sahip değilse istek yürütülmez ve kendi gördüğü sahip MISROUTED
 * yanıtıyla bildirilir. Soket işleri event-loop'ta, önbellek ve tablo
 * işlemleri worker havuzunda yürür; bir bağlantıdaki komutlar sırayla işlenir.
 */
@Singleton
@Startup
public class GossipServer implements AutoCloseable
{
    private static final Logger LOG = Logger.getLogger(GossipServer.class);

    private final String bindHost;
    private final int port;
    private final ClusterState clusterState;
    private final MembershipTable membership;
    private final RingManager ring;
    private final CacheNode localNode;
    private final Vertx vertx;
    private final WorkerExecutor workerExecutor;

    private volatile boolean running;
    private NetServer netServer;
    private final Set<PeerConnection> connections = ConcurrentHashMap.newKeySet();

    @Inject
    public GossipServer(AppProperties properties,
                        ClusterState clusterState,
                        MembershipTable membership,
                        RingManager ring,
                        CacheNode localNode,
                        Vertx vertx,
                        WorkerExecutor workerExecutor)
    {
        this(properties.node().bindHost(), properties.node().port(),
                clusterState, membership, ring, localNode, vertx, workerExecutor);
    }

    public GossipServer(String bindHost,
                        int port,
                        ClusterState clusterState,
                        MembershipTable membership,
                        RingManager ring,
                        CacheNode localNode,
                        Vertx vertx,
                        WorkerExecutor workerExecutor)
    {
        this.bindHost = bindHost;
        this.port = port;
        this.clusterState = clusterState;
        this.membership = membership;
        this.ring = ring;
        this.localNode = localNode;
        this.vertx = vertx;
        this.workerExecutor = workerExecutor;
    }

    /**
     * @throws IllegalStateException küme portu bağlanamazsa
     */
    @PostConstruct
    public void start()
    {
        NetServerOptions options = new NetServerOptions()
                .setHost(bindHost)
                .setPort(port)
                .setTcpNoDelay(true)
                .setReuseAddress(true);

        netServer = vertx.createNetServer(options);
        netServer.connectHandler(this::onPeerConnected);
        try {
            netServer.listen().toCompletionStage().toCompletableFuture().join();
        } catch (RuntimeException e) {
            throw new IllegalStateException("Failed to bind cluster port " + bindHost + ":" + port, e);
        }

        running = true;
        LOG.infof("Cluster port listening on %s:%d as node %s", bindHost, netServer.actualPort(), clusterState.localNodeId());
    }

    public int actualPort()
    {
        return netServer != null ? netServer.actualPort() : -1;
    }

    private void onPeerConnected(NetSocket socket)
    {
        if (!running) {
            socket.close();
            return;
        }

        PeerConnection connection = new PeerConnection(socket);
        connections.add(connection);
        socket.closeHandler(v -> {
            connection.onClosed();
            connections.remove(connection);
        });
        socket.exceptionHandler(e -> {
            LOG.debugf(e, "Cluster peer %s disconnected with error", socket.remoteAddress());
            socket.close();
        });
        socket.handler(connection::handleData);
    }

    @PreDestroy
    @Override
    public void close()
    {
        running = false;
        for (PeerConnection connection : connections) {
            connection.close();
        }
        connections.clear();
        if (netServer != null) {
            try {
                netServer.close().toCompletionStage().toCompletableFuture().join();
            } catch (RuntimeException e) {
                LOG.debugf(e, "Cluster port did not close cleanly");
            }
            netServer = null;
        }
    }

    Buffer handlePing(String senderId, Buffer payload) throws IOException
    {
        List<NodeInfo> remote = MembershipCodec.decode(payload);
        membership.merge(remote);
        membership.recordHeard(senderId);
        Buffer snapshot = MembershipCodec.encode(membership.snapshot());
        return Buffer.buffer(1 + 4 + snapshot.length())
                .appendByte(NodeProtocol.RESP_ACK)
                .appendInt(snapshot.length())
                .appendBuffer(snapshot);
    }

    Buffer handleGet(String key)
    {
        Optional<NodeInfo> foreignOwner = foreignOwner(key);
        if (foreignOwner.isPresent()) {
            return misrouted(foreignOwner.get());
        }
        Optional<byte[]> value = localNode.get(key);
        if (value.isEmpty()) {
            return Buffer.buffer(1).appendByte(NodeProtocol.RESP_MISS);
        }
        byte[] bytes = value.get();
        return Buffer.buffer(1 + 4 + bytes.length)
                .appendByte(NodeProtocol.RESP_HIT)
                .appendInt(bytes.length)
                .appendBytes(bytes);
    }

    Buffer handleSet(String key, byte[] value)
    {
        Optional<NodeInfo> foreignOwner = foreignOwner(key);
        if (foreignOwner.isPresent()) {
            return misrouted(foreignOwner.get());
        }
        localNode.set(key, value);
        return Buffer.buffer(1).appendByte(NodeProtocol.RESP_TRUE);
    }

    Buffer handleDelete(String key)
    {
        Optional<NodeInfo> foreignOwner = foreignOwner(key);
        if (foreignOwner.isPresent()) {
            return misrouted(foreignOwner.get());
        }
        boolean removed = localNode.delete(key);
        return Buffer.buffer(1).appendByte(removed ? NodeProtocol.RESP_TRUE : NodeProtocol.RESP_FALSE);
    }

    private Optional<NodeInfo> foreignOwner(String key)
    {
        NodeInfo owner = ring.route(key);
        return clusterState.isLocal(owner.id()) ? Optional.empty() : Optional.of(owner);
    }

    private static Buffer misrouted(NodeInfo owner)
    {
        byte[] id = owner.id().getBytes(StandardCharsets.UTF_8);
        byte[] api = owner.apiAddress().getBytes(StandardCharsets.UTF_8);
        return Buffer.buffer(1 + 4 + id.length + 4 + api.length)
                .appendByte(NodeProtocol.RESP_MISROUTED)
                .appendInt(id.length)
                .appendBytes(id)
                .appendInt(api.length)
                .appendBytes(api);
    }

    private static Buffer error(Throwable cause)
    {
        String message = cause.getMessage() != null ? cause.getMessage() : cause.getClass().getSimpleName();
        byte[] bytes = message.getBytes(StandardCharsets.UTF_8);
        return Buffer.buffer(1 + 4 + bytes.length)
                .appendByte(NodeProtocol.RESP_ERROR)
                .appendInt(bytes.length)
                .appendBytes(bytes);
    }

    private final class PeerConnection
    {
        private final NetSocket socket;
        private final ByteBufferReader reader = new ByteBufferReader();

        private boolean closed;
        private boolean processing;
        private CommandDecoder decoder;

        private PeerConnection(NetSocket socket)
        {
            this.socket = socket;
        }

        private void handleData(Buffer buffer)
        {
            if (closed) {
                return;
            }
            reader.append(buffer);
            processBuffer();
        }

        private void processBuffer()
        {
            while (!closed && !processing) {
                if (decoder == null) {
                    if (!reader.has(1)) {
                        return;
                    }
                    byte command = reader.readByte();
                    decoder = decoderFor(command);
                    if (decoder == null) {
                        LOG.warnf("Unknown cluster command %d from %s", command & 0xff, socket.remoteAddress());
                        close();
                        return;
                    }
                }

                try {
                    CommandAction action = decoder.tryDecode(reader);
                    if (action == null) {
                        return;
                    }
                    decoder = null;
                    reader.compact();
                    execute(action);
                } catch (IOException e) {
                    LOG.debugf(e, "Failed to decode cluster command from %s", socket.remoteAddress());
                    close();
                    return;
                }
            }
        }

        private void execute(CommandAction action)
        {
            processing = true;
            workerExecutor.<Buffer>executeBlocking(() -> {
                try {
                    return action.execute();
                } catch (RuntimeException e) {
                    LOG.warnf(e, "Cluster command from %s failed", socket.remoteAddress());
                    return error(e);
                }
            }, false).onComplete(ar -> {
                processing = false;
                if (closed) {
                    return;
                }
                if (ar.failed()) {
                    LOG.debugf(ar.cause(), "Dropping cluster peer %s after a malformed command", socket.remoteAddress());
                    close();
                    return;
                }
                socket.write(ar.result());
                processBuffer();
            });
        }

        private CommandDecoder decoderFor(byte command)
        {
            return switch (command) {
                case NodeProtocol.CMD_PING -> new PingDecoder();
                case NodeProtocol.CMD_GET -> new KeyDecoder(GossipServer.this::handleGet);
                case NodeProtocol.CMD_DELETE -> new KeyDecoder(GossipServer.this::handleDelete);
                case NodeProtocol.CMD_SET -> new SetDecoder();
                default -> null;
            };
        }

        private void close()
        {
            if (closed) {
                return;
            }
            closed = true;
            decoder = null;
            reader.reset();
            socket.close();
        }

        private void onClosed()
        {
            closed = true;
            decoder = null;
            processing = false;
            reader.reset();
        }
    }

    private interface CommandDecoder
    {
        CommandAction tryDecode(ByteBufferReader reader) throws IOException;
    }

    @FunctionalInterface
    private interface CommandAction
    {
        Buffer execute() throws IOException;
    }

    /** {@code SENDER_LEN(4) SENDER PAYLOAD_LEN(4) PAYLOAD} */
    private final class PingDecoder implements CommandDecoder
    {
        private enum Stage { SENDER_LENGTH, SENDER, PAYLOAD_LENGTH, PAYLOAD }

        private Stage stage = Stage.SENDER_LENGTH;
        private int length;
        private String senderId;

        @Override
        public CommandAction tryDecode(ByteBufferReader reader) throws IOException
        {
            while (true) {
                switch (stage) {
                    case SENDER_LENGTH -> {
                        if (!reader.has(4)) {
                            return null;
                        }
                        length = reader.readLength();
                        stage = Stage.SENDER;
                    }
                    case SENDER -> {
                        if (!reader.has(length)) {
                            return null;
                        }
                        senderId = reader.readString(length);
                        stage = Stage.PAYLOAD_LENGTH;
                    }
                    case PAYLOAD_LENGTH -> {
                        if (!reader.has(4)) {
                            return null;
                        }
                        length = reader.readLength();
                        stage = Stage.PAYLOAD;
                    }
                    case PAYLOAD -> {
                        if (!reader.has(length)) {
                            return null;
                        }
                        Buffer payload = Buffer.buffer(reader.readBytes(length));
                        String sender = senderId;
                        return () -> handlePing(sender, payload);
                    }
                }
            }
        }
    }

    /** {@code KEY_LEN(4) KEY}; GET ve DELETE için ortaktır. */
    private static final class KeyDecoder implements CommandDecoder
    {
        private final Function<String, Buffer> handler;
        private int keyLength = -1;

        private KeyDecoder(Function<String, Buffer> handler)
        {
            this.handler = handler;
        }

        @Override
        public CommandAction tryDecode(ByteBufferReader reader) throws IOException
        {
            if (keyLength < 0) {
                if (!reader.has(4)) {
                    return null;
                }
                keyLength = reader.readLength();
            }
            if (!reader.has(keyLength)) {
                return null;
            }
            String key = reader.readString(keyLength);
            return () -> handler.apply(key);
        }
    }

    /** {@code KEY_LEN(4) VALUE_LEN(4) KEY VALUE} */
    private final class SetDecoder implements CommandDecoder
    {
        private enum Stage { HEADER, KEY, VALUE }

        private Stage stage = Stage.HEADER;
        private int keyLength;
        private int valueLength;
        private String key;

        @Override
        public CommandAction tryDecode(ByteBufferReader reader) throws IOException
        {
            while (true) {
                switch (stage) {
                    case HEADER -> {
                        if (!reader.has(8)) {
                            return null;
                        }
                        keyLength = reader.readLength();
                        valueLength = reader.readLength();
                        stage = Stage.KEY;
                    }
                    case KEY -> {
                        if (!reader.has(keyLength)) {
                            return null;
                        }
                        key = reader.readString(keyLength);
                        stage = Stage.VALUE;
                    }
                    case VALUE -> {
                        if (!reader.has(valueLength)) {
                            return null;
                        }
                        byte[] value = reader.readBytes(valueLength);
                        String decodedKey = key;
                        return () -> handleSet(decodedKey, value);
                    }
                }
            }
        }
    }
}
