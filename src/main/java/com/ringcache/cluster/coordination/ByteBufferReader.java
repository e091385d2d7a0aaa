package com.ringcache.cluster.coordination;

import io.vertx.core.buffer.Buffer;

import java.io.IOException;
import java.nio.charset.StandardCharsets;

/**
 * Parça parça gelen soket verisini biriktirip çerçeve çözücülerine okuma
 * imkânı sunan basit tampondur. Uzunluk alanları {@link #MAX_FIELD_BYTES}
 * ile sınırlandırılır.
 */
final class ByteBufferReader
{
    static final int MAX_FIELD_BYTES = 64 * 1024 * 1024;

    private Buffer buffer = Buffer.buffer();
    private int readIndex;

    void append(Buffer chunk)
    {
        buffer.appendBuffer(chunk);
    }

    boolean has(int bytes)
    {
        return buffer.length() - readIndex >= bytes;
    }

    int available()
    {
        return buffer.length() - readIndex;
    }

    int peekInt(int offset)
    {
        return buffer.getInt(readIndex + offset);
    }

    /**
     * {@code count} adet uzunluk önekli alan tamamen geldiyse hepsini okur,
     * aksi halde hiçbir şey tüketmeden {@code null} döner.
     */
    byte[][] tryReadFields(int count) throws IOException
    {
        int offset = 0;
        for (int i = 0; i < count; i++) {
            if (available() < offset + 4) {
                return null;
            }
            int length = peekInt(offset);
            if (length < 0 || length > MAX_FIELD_BYTES) {
                throw new IOException("invalid length field " + length);
            }
            offset += 4 + length;
        }
        if (available() < offset) {
            return null;
        }
        byte[][] fields = new byte[count][];
        for (int i = 0; i < count; i++) {
            fields[i] = readBytes(readInt());
        }
        return fields;
    }

    byte readByte()
    {
        byte value = buffer.getByte(readIndex);
        readIndex += 1;
        return value;
    }

    int readInt()
    {
        int value = buffer.getInt(readIndex);
        readIndex += 4;
        return value;
    }

    /** Negatif ya da sınırı aşan uzunlukları protokol hatası sayar. */
    int readLength() throws IOException
    {
        int length = readInt();
        if (length < 0 || length > MAX_FIELD_BYTES) {
            throw new IOException("invalid length field " + length);
        }
        return length;
    }

    long readLong()
    {
        long value = buffer.getLong(readIndex);
        readIndex += 8;
        return value;
    }

    byte[] readBytes(int length)
    {
        byte[] data = buffer.getBytes(readIndex, readIndex + length);
        readIndex += length;
        return data;
    }

    String readString(int length)
    {
        return new String(readBytes(length), StandardCharsets.UTF_8);
    }

    void compact()
    {
        if (readIndex == 0) {
            return;
        }
        if (readIndex >= buffer.length()) {
            buffer = Buffer.buffer();
        } else {
            buffer = buffer.getBuffer(readIndex, buffer.length());
        }
        readIndex = 0;
    }

    void reset()
    {
        buffer = Buffer.buffer();
        readIndex = 0;
    }
}
