package com.ringcache.index;

import com.ringcache.storage.StorageIOException;
import org.jboss.logging.Logger;

import java.io.BufferedReader;
import java.io.BufferedWriter;
import java.io.IOException;
import java.nio.channels.FileChannel;
import java.nio.charset.StandardCharsets;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.nio.file.StandardOpenOption;
import java.util.Collection;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * İndeksin tamamını tek bir düz dosyaya yazan kontrol noktasıdır. Her satır
 * sekme ile ayrılmış {@code b64key konum created updated size} alanlarından
 * oluşur. Dosya geçici bir ada yazılıp atomik olarak yerine taşınır.
 */
record IndexCheckpoint(Path file, boolean fsync)
{
    private static final Logger LOG = Logger.getLogger(IndexCheckpoint.class);

    /**
     * Tab karakteri Base64 çıktılarında ve kayıt konumlarında bulunmadığı için ayırıcı olarak güvenlidir.
     */
    private static final String FIELD_SEPARATOR = "\t";
    private static final Pattern FIELD_SPLITTER = Pattern.compile(Pattern.quote(FIELD_SEPARATOR));

    void write(Collection<IndexRecord> records)
    {
        Path temp = file.resolveSibling(file.getFileName() + ".tmp");
        try {
            try (BufferedWriter writer = Files.newBufferedWriter(temp, StandardCharsets.UTF_8)) {
                for (IndexRecord record : records) {
                    EntryMetadata m = record.metadata();
                    writer.write(String.join(FIELD_SEPARATOR,
                            IndexJournal.encodeKey(record.key()),
                            record.location(),
                            Long.toString(m.createdAt()),
                            Long.toString(m.updatedAt()),
                            Long.toString(m.sizeBytes())));
                    writer.newLine();
                }
            }
            if (fsync) {
                try (FileChannel channel = FileChannel.open(temp, StandardOpenOption.WRITE)) {
                    channel.force(true);
                }
            }
            try {
                Files.move(temp, file, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
            } catch (AtomicMoveNotSupportedException e) {
                Files.move(temp, file, StandardCopyOption.REPLACE_EXISTING);
            }
        } catch (IOException e) {
            throw new StorageIOException("Failed to write index checkpoint " + file, e);
        }
    }

    /**
     * Kontrol noktasını okuyup haritaya yükler; bozuk satır sayısını döndürür.
     */
    int load(Map<String, IndexRecord> target)
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
                String[] parts = FIELD_SPLITTER.split(line, -1);
                if (parts.length != 5) {
                    skipped++;
                    continue;
                }
                try {
                    String key = IndexJournal.decodeKey(parts[0]);
                    EntryMetadata metadata = new EntryMetadata(
                            Long.parseLong(parts[2]), Long.parseLong(parts[3]), Long.parseLong(parts[4]));
                    target.put(key, new IndexRecord(key, parts[1], metadata));
                } catch (IllegalArgumentException e) {
                    skipped++;
                }
            }
        } catch (IOException e) {
            throw new IllegalStateException("Cannot read index checkpoint " + file, e);
        }
        if (skipped > 0) {
            LOG.warnf("Skipped %d malformed lines in index checkpoint %s", skipped, file);
        }
        return skipped;
    }
}
