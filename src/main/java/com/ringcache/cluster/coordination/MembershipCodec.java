package com.ringcache.cluster.coordination;

import com.ringcache.cluster.NodeInfo;
import com.ringcache.cluster.NodeState;
import io.vertx.core.buffer.Buffer;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;

/**
 * Üyelik tablosunun küme portundaki ikili gösterimi:
 * {@code COUNT(4)} ve her üye için
 * {@code ID_LEN(4) ID HOST_LEN(4) HOST PORT(4) API_PORT(4) INCARNATION(8) STATE(1)}.
 * Biçim yalnızca aynı sürümdeki düğümler arasında geçerlidir.
 */
final class MembershipCodec
{
    private static final int MAX_MEMBERS = 65_536;

    private MembershipCodec()
    {
    }

    static Buffer encode(Collection<NodeInfo> nodes)
    {
        Buffer out = Buffer.buffer();
        out.appendInt(nodes.size());
        for (NodeInfo node : nodes) {
            byte[] id = node.id().getBytes(StandardCharsets.UTF_8);
            byte[] host = node.host().getBytes(StandardCharsets.UTF_8);
            out.appendInt(id.length).appendBytes(id)
                    .appendInt(host.length).appendBytes(host)
                    .appendInt(node.port())
                    .appendInt(node.apiPort())
                    .appendLong(node.incarnation())
                    .appendByte(node.state().code());
        }
        return out;
    }

    /**
     * Tamamı alınmış bir yükü çözer; eksik ya da tutarsız içerik {@link IOException} üretir.
     */
    static List<NodeInfo> decode(Buffer payload) throws IOException
    {
        ByteBufferReader reader = new ByteBufferReader();
        reader.append(payload);
        if (!reader.has(4)) {
            throw new IOException("membership payload too short");
        }
        int count = reader.readInt();
        if (count < 0 || count > MAX_MEMBERS) {
            throw new IOException("invalid member count " + count);
        }
        List<NodeInfo> nodes = new ArrayList<>(count);
        try {
            for (int i = 0; i < count; i++) {
                String id = readString(reader);
                String host = readString(reader);
                require(reader, 4 + 4 + 8 + 1);
                int port = reader.readInt();
                int apiPort = reader.readInt();
                long incarnation = reader.readLong();
                NodeState state = NodeState.fromCode(reader.readByte());
                nodes.add(new NodeInfo(id, host, port, apiPort, incarnation, state));
            }
        } catch (IllegalArgumentException e) {
            throw new IOException("invalid member entry: " + e.getMessage(), e);
        }
        return nodes;
    }

    private static String readString(ByteBufferReader reader) throws IOException
    {
        require(reader, 4);
        int length = reader.readLength();
        require(reader, length);
        return reader.readString(length);
    }

    private static void require(ByteBufferReader reader, int bytes) throws IOException
    {
        if (!reader.has(bytes)) {
            throw new IOException("membership payload truncated");
        }
    }
}
