package com.ringcache.index;

import com.ringcache.storage.StorageIOException;
import org.jboss.logging.Logger;

import java.io.BufferedReader;
import java.io.Closeable;
import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.channels.FileChannel;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.Base64;
import java.util.Map;

/** Satır tabanlı indeks günlüğü: "S <b64key> <konum> <created> <updated> <size>" veya "D <b64key>". */
final class IndexJournal implements Closeable
{
    private static final Logger LOG = Logger.getLogger(IndexJournal.class);

    static final char OP_SET = 'S';
    static final char OP_DELETE = 'D';

    private final Path file;
    private final boolean fsyncEvery;
    private FileChannel channel;

    IndexJournal(Path file, boolean fsyncEvery)
    {
        this(file, openChannel(file), fsyncEvery);
    }

    IndexJournal(Path file, FileChannel channel, boolean fsyncEvery)
    {
        this.file = file;
        this.fsyncEvery = fsyncEvery;
        this.channel = channel;
        try {
            dropTrailingFragment();
        } catch (IOException e) {
            throw new IllegalStateException("Cannot open index journal " + file, e);
        }
    }

    private static FileChannel openChannel(Path file)
    {
        try {
            return FileChannel.open(file, StandardOpenOption.CREATE, StandardOpenOption.READ,
                    StandardOpenOption.WRITE, StandardOpenOption.APPEND);
        } catch (IOException e) {
            throw new IllegalStateException("Cannot open index journal " + file, e);
        }
    }

    /**
     * Çökmeden kalan, satır sonu olmayan son parçayı keser. Parça oynatmada
     * zaten atlanmıştır; kesilmezse sonraki ilk ekleme onunla birleşir.
     */
    private void dropTrailingFragment() throws IOException
    {
        long size = channel.size();
        long end = size;
        ByteBuffer buffer = ByteBuffer.allocate(4096);
        while (end > 0) {
            int length = (int) Math.min(buffer.capacity(), end);
            long from = end - length;
            buffer.clear();
            buffer.limit(length);
            while (buffer.hasRemaining()) {
                if (channel.read(buffer, from + buffer.position()) < 0) {
                    break;
                }
            }
            for (int i = buffer.position() - 1; i >= 0; i--) {
                if (buffer.get(i) == '\n') {
                    truncateTo(from + i + 1, size);
                    return;
                }
            }
            end = from;
        }
        truncateTo(0L, size);
    }

    private void truncateTo(long keep, long size) throws IOException
    {
        if (keep < size) {
            channel.truncate(keep);
            LOG.warnf("Dropped %d bytes of incomplete trailing line from index journal %s", size - keep, file);
        }
    }

    synchronized void appendSet(IndexRecord record)
    {
        EntryMetadata m = record.metadata();
        writeLine(OP_SET + " " + encodeKey(record.key()) + " " + record.location() + " "
                + m.createdAt() + " " + m.updatedAt() + " " + m.sizeBytes());
    }

    synchronized void appendDelete(String key)
    {
        writeLine(OP_DELETE + " " + encodeKey(key));
    }

    /**
     * Günlüğü boşaltır. Yalnızca içerik bir kontrol noktasına yazıldıktan sonra çağrılmalıdır.
     */
    synchronized void truncate()
    {
        ensureOpen();
        try {
            channel.truncate(0L);
            channel.force(true);
        } catch (IOException e) {
            throw new StorageIOException("Failed to truncate index journal " + file, e);
        }
    }

    private void writeLine(String line)
    {
        ensureOpen();
        long start = -1L;
        try {
            start = channel.size();
            ByteBuffer buffer = ByteBuffer.wrap((line + "\n").getBytes(StandardCharsets.UTF_8));
            while (buffer.hasRemaining()) {
                channel.write(buffer);
            }
            if (fsyncEvery) {
                channel.force(false);
            }
        } catch (IOException e) {
            // yarım satır bir sonraki eklemeyle birleşmemeli
            if (start >= 0L) {
                try {
                    channel.truncate(start);
                } catch (IOException rollback) {
                    e.addSuppressed(rollback);
                }
            }
            throw new StorageIOException("Failed to append to index journal " + file, e);
        }
    }

    private void ensureOpen()
    {
        if (channel == null) {
            throw new StorageIOException("Index journal " + file + " is closed");
        }
    }

    /**
     * Günlükteki işlemleri sırasıyla verilen haritaya uygular. Bozuk satırlar
     * atlanır ve sayıları döndürülür; yarım kalmış son satır da bu kapsamdadır.
     */
    static int replay(Path file, Map<String, IndexRecord> target)
    {
        if (!Files.exists(file)) {
            return 0;
        }
        int skipped = 0;
        try (BufferedReader reader = Files.newBufferedReader(file, StandardCharsets.UTF_8)) {
            String line;
            while ((line = reader.readLine()) != null) {
                if (line.isBlank()) {
                    continue;
                }
                try {
                    applyLine(line, target);
                } catch (IllegalArgumentException e) {
                    skipped++;
                    LOG.debugf("Skipping malformed index journal line: %s", e.getMessage());
                }
            }
        } catch (IOException e) {
            throw new IllegalStateException("Cannot read index journal " + file, e);
        }
        return skipped;
    }

    private static void applyLine(String line, Map<String, IndexRecord> target)
    {
        String[] parts = line.split(" ");
        if (parts[0].length() != 1) {
            throw new IllegalArgumentException("unknown op " + parts[0]);
        }
        char op = parts[0].charAt(0);
        if (op == OP_SET && parts.length == 6) {
            String key = decodeKey(parts[1]);
            EntryMetadata metadata = new EntryMetadata(
                    Long.parseLong(parts[3]), Long.parseLong(parts[4]), Long.parseLong(parts[5]));
            target.put(key, new IndexRecord(key, parts[2], metadata));
        } else if (op == OP_DELETE && parts.length == 2) {
            target.remove(decodeKey(parts[1]));
        } else {
            throw new IllegalArgumentException("unexpected line shape '" + line + "'");
        }
    }

    static String encodeKey(String key)
    {
        return Base64.getEncoder().encodeToString(key.getBytes(StandardCharsets.UTF_8));
    }

    static String decodeKey(String encoded)
    {
        return new String(Base64.getDecoder().decode(encoded), StandardCharsets.UTF_8);
    }

    @Override
    public synchronized void close()
    {
        if (channel == null) {
            return;
        }
        try {
            channel.close();
        } catch (IOException e) {
            LOG.warnf(e, "Failed to close index journal %s", file);
        } finally {
            channel = null;
        }
    }
}
