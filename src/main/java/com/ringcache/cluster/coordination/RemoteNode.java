package com.ringcache.cluster.coordination;

import com.ringcache.cluster.CacheNode;
import com.ringcache.cluster.MisroutedException;
import com.ringcache.cluster.NodeInfo;
import com.ringcache.cluster.RemoteRequestException;
import com.ringcache.cluster.RemoteTimeoutException;
import com.ringcache.constants.NodeProtocol;
import io.netty.channel.ConnectTimeoutException;
import io.vertx.core.Context;
import io.vertx.core.Promise;
import io.vertx.core.Vertx;
import io.vertx.core.buffer.Buffer;
import io.vertx.core.net.NetClient;
import io.vertx.core.net.NetClientOptions;
import io.vertx.core.net.NetSocket;
import org.jboss.logging.Logger;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.Collection;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Başka bir düğümün küme portuna bağlanan vekildir. Gossip yoklamalarını
 * gönderir ve sahibi olunmayan anahtarlar için GET/SET/DELETE isteklerini
 * iletir. Bağlantılar Vert.x {@link NetClient} üzerinden havuzlanır.
 *
 * <p>Çağrılar engelleyicidir ve bağlantı kurma dahil her istek tek bir
 * {@code requestTimeoutMillis} süresiyle sınırlıdır. Soket olayları
 * event-loop'ta işlendiği için bu sınıf event-loop thread'inden çağrılamaz.
 */
public final class RemoteNode implements CacheNode, AutoCloseable
{
    private static final Logger LOG = Logger.getLogger(RemoteNode.class);

    private final NodeInfo target;
    private final long requestTimeoutNanos;
    private final NetClient netClient;
    private final int maxPoolSize;
    private final BlockingQueue<PooledConnection> pool;
    private final Set<PooledConnection> allConnections = ConcurrentHashMap.newKeySet();
    private final AtomicInteger openConnections = new AtomicInteger();
    private final AtomicBoolean closed = new AtomicBoolean();

    public RemoteNode(NodeInfo target, Vertx vertx, long requestTimeoutMillis)
    {
        this.target = Objects.requireNonNull(target, "target");
        long timeoutMillis = Math.max(50L, requestTimeoutMillis);
        this.requestTimeoutNanos = TimeUnit.MILLISECONDS.toNanos(timeoutMillis);
        this.maxPoolSize = Math.max(2, Runtime.getRuntime().availableProcessors());
        this.pool = new LinkedBlockingQueue<>(maxPoolSize);

        NetClientOptions options = new NetClientOptions()
                .setConnectTimeout((int) Math.min(Integer.MAX_VALUE, timeoutMillis))
                .setTcpNoDelay(true)
                .setReuseAddress(true);
        this.netClient = Objects.requireNonNull(vertx, "vertx").createNetClient(options);
    }

    @Override
    public String id()
    {
        return target.id();
    }

    public NodeInfo target()
    {
        return target;
    }

    /**
     * Üyelik görünümünü gönderir ve karşı tarafın görünümünü döndürür.
     */
    public List<NodeInfo> ping(String senderId, Collection<NodeInfo> membership)
    {
        byte[] sender = senderId.getBytes(StandardCharsets.UTF_8);
        Buffer payload = MembershipCodec.encode(membership);
        Buffer request = Buffer.buffer(1 + 4 + sender.length + 4 + payload.length())
                .appendByte(NodeProtocol.CMD_PING)
                .appendInt(sender.length)
                .appendBytes(sender)
                .appendInt(payload.length())
                .appendBuffer(payload);
        return execute(request, new PingResponseParser());
    }

    @Override
    public Optional<byte[]> get(String key)
    {
        byte[] keyBytes = key.getBytes(StandardCharsets.UTF_8);
        Buffer request = Buffer.buffer(1 + 4 + keyBytes.length)
                .appendByte(NodeProtocol.CMD_GET)
                .appendInt(keyBytes.length)
                .appendBytes(keyBytes);
        return execute(request, new GetResponseParser(key));
    }

    @Override
    public void set(String key, byte[] value)
    {
        byte[] keyBytes = key.getBytes(StandardCharsets.UTF_8);
        Buffer request = Buffer.buffer(1 + 4 + 4 + keyBytes.length + value.length)
                .appendByte(NodeProtocol.CMD_SET)
                .appendInt(keyBytes.length)
                .appendInt(value.length)
                .appendBytes(keyBytes)
                .appendBytes(value);
        if (!execute(request, new BooleanResponseParser(key))) {
            throw new RemoteRequestException(target.id(), "Node " + target.id() + " refused to store key " + key);
        }
    }

    @Override
    public boolean delete(String key)
    {
        byte[] keyBytes = key.getBytes(StandardCharsets.UTF_8);
        Buffer request = Buffer.buffer(1 + 4 + keyBytes.length)
                .appendByte(NodeProtocol.CMD_DELETE)
                .appendInt(keyBytes.length)
                .appendBytes(keyBytes);
        return execute(request, new BooleanResponseParser(key));
    }

    private <T> T execute(Buffer request, ResponseParser<T> parser)
    {
        if (Context.isOnEventLoopThread()) {
            throw new IllegalStateException("Blocking call to node " + target.id() + " from an event-loop thread");
        }
        if (closed.get()) {
            throw new RemoteRequestException(target.id(), "Connection pool for node " + target.id() + " is closed");
        }

        long deadline = System.nanoTime() + requestTimeoutNanos;
        PooledConnection connection;
        try {
            connection = acquireConnection(deadline);
        } catch (TimeoutException e) {
            throw new RemoteTimeoutException(target.id(), describe("Connecting timed out"), e);
        } catch (IOException e) {
            throw communicationError("Failed to connect", e);
        }

        boolean reusable = false;
        try {
            CompletableFuture<T> future = send(connection, request, parser);
            long remaining = Math.max(1L, deadline - System.nanoTime());
            T result = future.get(remaining, TimeUnit.NANOSECONDS);
            reusable = true;
            return result;
        } catch (TimeoutException e) {
            throw new RemoteTimeoutException(target.id(), describe("Request timed out"), e);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            if (parser.rejected() && cause instanceof RuntimeException rejection) {
                // yanıt çerçevesi tam okundu, bağlantı yeniden kullanılabilir
                reusable = true;
                if (rejection instanceof RemoteRequestException remote && remote.nodeId() == null) {
                    throw new RemoteRequestException(target.id(), remote.getMessage());
                }
                throw rejection;
            }
            throw communicationError("Request failed", cause);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw communicationError("Interrupted while waiting for response", e);
        } finally {
            if (reusable) {
                release(connection);
            } else {
                discard(connection);
            }
        }
    }

    private String describe(String message)
    {
        return message + " for node " + target.id() + " at " + target.address();
    }

    private RemoteRequestException communicationError(String message, Throwable cause)
    {
        return new RemoteRequestException(target.id(), describe(message), cause);
    }

    private PooledConnection acquireConnection(long deadlineNanos) throws IOException, TimeoutException
    {
        while (true) {
            if (closed.get()) {
                throw new IOException("Connection pool is closed");
            }
            PooledConnection pooled = pool.poll();
            if (pooled != null) {
                if (!pooled.closed) {
                    return pooled;
                }
                continue;
            }

            int current = openConnections.get();
            if (current < maxPoolSize) {
                if (openConnections.compareAndSet(current, current + 1)) {
                    try {
                        return createConnection(deadlineNanos);
                    } catch (IOException | TimeoutException | RuntimeException e) {
                        openConnections.decrementAndGet();
                        throw e;
                    }
                }
                continue;
            }

            long remaining = deadlineNanos - System.nanoTime();
            if (remaining <= 0L) {
                throw new TimeoutException("Timed out waiting for a pooled connection");
            }
            try {
                pooled = pool.poll(remaining, TimeUnit.NANOSECONDS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new IOException("Interrupted while waiting for a pooled connection", e);
            }
            if (pooled != null && !pooled.closed) {
                return pooled;
            }
        }
    }

    private PooledConnection createConnection(long deadlineNanos) throws IOException, TimeoutException
    {
        CompletableFuture<NetSocket> future = new CompletableFuture<>();
        netClient.connect(target.port(), target.host()).onComplete(ar -> {
            if (ar.failed()) {
                future.completeExceptionally(ar.cause());
            } else if (!future.complete(ar.result())) {
                // çağıran vazgeçti
                ar.result().close();
            }
        });

        NetSocket socket;
        try {
            socket = future.get(Math.max(1L, deadlineNanos - System.nanoTime()), TimeUnit.NANOSECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            future.cancel(false);
            throw new IOException("Interrupted while connecting", e);
        } catch (TimeoutException e) {
            future.cancel(false);
            throw e;
        } catch (ExecutionException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            if (cause instanceof ConnectTimeoutException) {
                TimeoutException timeout = new TimeoutException("Connect timed out");
                timeout.initCause(cause);
                throw timeout;
            }
            if (cause instanceof IOException io) {
                throw io;
            }
            throw new IOException("Failed to open connection", cause);
        }

        PooledConnection connection = new PooledConnection(socket);
        allConnections.add(connection);
        socket.closeHandler(v -> {
            connection.closed = true;
            pool.remove(connection);
            allConnections.remove(connection);
            Promise<?> pending = connection.clearInFlight();
            if (pending != null) {
                pending.tryFail(new IOException("Connection closed"));
            }
            openConnections.decrementAndGet();
        });
        return connection;
    }

    private void release(PooledConnection connection)
    {
        connection.clearInFlight();
        if (closed.get() || connection.closed || !pool.offer(connection)) {
            discard(connection);
        }
    }

    private void discard(PooledConnection connection)
    {
        connection.clearInFlight();
        pool.remove(connection);
        allConnections.remove(connection);
        if (!connection.closed) {
            connection.closed = true;
            connection.socket.close();
        }
    }

    private <T> CompletableFuture<T> send(PooledConnection connection, Buffer request, ResponseParser<T> parser)
    {
        Promise<T> promise = Promise.promise();
        if (!connection.register(promise)) {
            promise.fail(new IllegalStateException("Connection already in use"));
            return promise.future().toCompletionStage().toCompletableFuture();
        }

        NetSocket socket = connection.socket;
        socket.handler(buffer -> {
            try {
                parser.handle(buffer);
                if (parser.rejected()) {
                    promise.tryFail(parser.rejection());
                } else if (parser.completed()) {
                    promise.tryComplete(parser.result());
                }
            } catch (IOException | RuntimeException e) {
                promise.tryFail(e);
            }
        });
        socket.exceptionHandler(promise::tryFail);
        socket.write(request).onComplete(ar -> {
            if (ar.failed()) {
                promise.tryFail(ar.cause());
            }
        });
        promise.future().onComplete(ar -> {
            connection.clear(promise);
            socket.handler(null);
            socket.exceptionHandler(null);
        });
        return promise.future().toCompletionStage().toCompletableFuture();
    }

    @Override
    public void close()
    {
        if (!closed.compareAndSet(false, true)) {
            return;
        }
        PooledConnection pooled;
        while ((pooled = pool.poll()) != null) {
            discard(pooled);
        }
        for (PooledConnection connection : allConnections.toArray(new PooledConnection[0])) {
            discard(connection);
        }
        netClient.close().onComplete(ar -> {
            if (ar.failed()) {
                LOG.debugf(ar.cause(), "Failed to close client for node %s at %s", target.id(), target.address());
            }
        });
    }

    /**
     * Bir yanıt çerçevesini parça parça çözer. MISROUTED ve ERROR durumları tüm
     * komutlar için ortaktır; bunlar ret olarak işaretlenir ve çerçeve tamamen
     * tüketildiği için bağlantı havuza dönebilir.
     */
    private abstract static class ResponseParser<T>
    {
        protected final ByteBufferReader reader = new ByteBufferReader();
        private final String key;
        private boolean statusRead;
        private byte status;
        protected boolean complete;
        protected T result;
        private RuntimeException rejection;

        protected ResponseParser(String key)
        {
            this.key = key;
        }

        final void handle(Buffer chunk) throws IOException
        {
            reader.append(chunk);
            if (complete || rejection != null) {
                return;
            }
            if (!statusRead) {
                if (!reader.has(1)) {
                    return;
                }
                status = reader.readByte();
                statusRead = true;
            }
            if (status == NodeProtocol.RESP_MISROUTED) {
                byte[][] fields = reader.tryReadFields(2);
                if (fields != null) {
                    rejection = new MisroutedException(key,
                            new String(fields[0], StandardCharsets.UTF_8),
                            new String(fields[1], StandardCharsets.UTF_8));
                }
            } else if (status == NodeProtocol.RESP_ERROR) {
                byte[][] fields = reader.tryReadFields(1);
                if (fields != null) {
                    rejection = new RemoteRequestException(null,
                            "Remote node failed: " + new String(fields[0], StandardCharsets.UTF_8));
                }
            } else {
                parseBody(status);
            }
        }

        protected abstract void parseBody(byte status) throws IOException;

        final boolean completed()
        {
            return complete;
        }

        final boolean rejected()
        {
            return rejection != null;
        }

        final RuntimeException rejection()
        {
            return rejection;
        }

        final T result()
        {
            return result;
        }
    }

    private static final class PingResponseParser extends ResponseParser<List<NodeInfo>>
    {
        private PingResponseParser()
        {
            super(null);
        }

        @Override
        protected void parseBody(byte status) throws IOException
        {
            if (status != NodeProtocol.RESP_ACK) {
                throw new IOException("unexpected response to ping: " + (char) status);
            }
            byte[][] fields = reader.tryReadFields(1);
            if (fields != null) {
                result = MembershipCodec.decode(Buffer.buffer(fields[0]));
                complete = true;
            }
        }
    }

    private static final class GetResponseParser extends ResponseParser<Optional<byte[]>>
    {
        private GetResponseParser(String key)
        {
            super(key);
        }

        @Override
        protected void parseBody(byte status) throws IOException
        {
            if (status == NodeProtocol.RESP_MISS) {
                result = Optional.empty();
                complete = true;
                return;
            }
            if (status != NodeProtocol.RESP_HIT) {
                throw new IOException("unexpected response to get: " + (char) status);
            }
            byte[][] fields = reader.tryReadFields(1);
            if (fields != null) {
                result = Optional.of(fields[0]);
                complete = true;
            }
        }
    }

    private static final class BooleanResponseParser extends ResponseParser<Boolean>
    {
        private BooleanResponseParser(String key)
        {
            super(key);
        }

        @Override
        protected void parseBody(byte status) throws IOException
        {
            if (status == NodeProtocol.RESP_TRUE) {
                result = Boolean.TRUE;
            } else if (status == NodeProtocol.RESP_FALSE) {
                result = Boolean.FALSE;
            } else {
                throw new IOException("unexpected boolean response: " + (char) status);
            }
            complete = true;
        }
    }

    private static final class PooledConnection
    {
        final NetSocket socket;
        private final AtomicReference<Promise<?>> inFlight = new AtomicReference<>();
        volatile boolean closed;

        private PooledConnection(NetSocket socket)
        {
            this.socket = socket;
        }

        boolean register(Promise<?> promise)
        {
            return inFlight.compareAndSet(null, promise);
        }

        void clear(Promise<?> promise)
        {
            inFlight.compareAndSet(promise, null);
        }

        Promise<?> clearInFlight()
        {
            return inFlight.getAndSet(null);
        }
    }
}
