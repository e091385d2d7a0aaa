package com.ringcache.index;

import org.jboss.logging.Logger;

import java.io.Closeable;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Anahtardan disk konumuna ve meta veriye giden bellek içi indekstir.
 *
 * <p>Okumalar kilitsiz olarak {@link ConcurrentHashMap} üzerinden yapılır.
 * Her değişiklik tek bir kritik bölgede önce günlüğe eklenir, ardından
 * haritaya uygulanır; disk G/Ç'si ise çağıran tarafta bu bölgenin dışında
 * kalır. Başlangıçta son kontrol noktası yüklenir ve günlük üzerine oynatılır.
 */
public final class CacheIndex implements Closeable
{
    private static final Logger LOG = Logger.getLogger(CacheIndex.class);

    public static final String JOURNAL_FILE = "cache_index.log";
    public static final String CHECKPOINT_FILE = "cache_index.snapshot";

    private final Map<String, IndexRecord> entries;
    private final ReentrantLock mutationLock = new ReentrantLock();
    private final IndexJournal journal;
    private final IndexCheckpoint checkpoint;
    private final int skippedOnLoad;

    private CacheIndex(Map<String, IndexRecord> entries, IndexJournal journal, IndexCheckpoint checkpoint, int skippedOnLoad)
    {
        this.entries = entries;
        this.journal = journal;
        this.checkpoint = checkpoint;
        this.skippedOnLoad = skippedOnLoad;
    }

    public static CacheIndex open(Path directory, boolean fsync)
    {
        Objects.requireNonNull(directory, "directory");
        try {
            Files.createDirectories(directory);
        } catch (IOException e) {
            throw new IllegalStateException("Cannot create index directory " + directory, e);
        }
        Map<String, IndexRecord> entries = new ConcurrentHashMap<>();
        IndexCheckpoint checkpoint = new IndexCheckpoint(directory.resolve(CHECKPOINT_FILE), fsync);
        Path journalFile = directory.resolve(JOURNAL_FILE);

        int skipped = checkpoint.load(entries);
        skipped += IndexJournal.replay(journalFile, entries);
        if (skipped > 0) {
            LOG.warnf("Index loaded with %d malformed lines skipped", skipped);
        }
        LOG.infof("Index loaded from %s with %d entries", directory, entries.size());
        return new CacheIndex(entries, new IndexJournal(journalFile, fsync), checkpoint, skipped);
    }

    public Optional<IndexRecord> get(String key)
    {
        return Optional.ofNullable(entries.get(key));
    }

    public int size()
    {
        return entries.size();
    }

    public int skippedOnLoad()
    {
        return skippedOnLoad;
    }

    /**
     * Anahtar için yeni konumu yerleştirir. Önceki kayıt varsa oluşturulma zamanı
     * korunur ve güncellenme zamanı geri gitmez.
     *
     * @return yerini alan önceki kayıt
     */
    public Optional<IndexRecord> install(String key, String location, long sizeBytes, long nowMillis)
    {
        mutationLock.lock();
        try {
            IndexRecord previous = entries.get(key);
            long createdAt = previous != null ? previous.metadata().createdAt() : nowMillis;
            long updatedAt = previous != null ? Math.max(nowMillis, previous.metadata().updatedAt()) : nowMillis;
            IndexRecord record = new IndexRecord(key, location, new EntryMetadata(createdAt, Math.max(createdAt, updatedAt), sizeBytes));
            journal.appendSet(record);
            entries.put(key, record);
            return Optional.ofNullable(previous);
        } finally {
            mutationLock.unlock();
        }
    }

    public Optional<IndexRecord> remove(String key)
    {
        mutationLock.lock();
        try {
            if (!entries.containsKey(key)) {
                return Optional.empty();
            }
            journal.appendDelete(key);
            return Optional.ofNullable(entries.remove(key));
        } finally {
            mutationLock.unlock();
        }
    }

    /**
     * Kaydı yalnızca indeks hâlâ tam olarak aynı girdiyi tutuyorsa siler.
     */
    public boolean removeIfMatches(IndexRecord expected)
    {
        mutationLock.lock();
        try {
            if (!expected.equals(entries.get(expected.key()))) {
                return false;
            }
            journal.appendDelete(expected.key());
            entries.remove(expected.key());
            return true;
        } finally {
            mutationLock.unlock();
        }
    }

    public List<IndexRecord> snapshot()
    {
        return new ArrayList<>(entries.values());
    }

    /**
     * İndeksin tamamını kontrol noktasına yazar ve günlüğü boşaltır.
     */
    public void checkpoint()
    {
        mutationLock.lock();
        try {
            checkpoint.write(entries.values());
            journal.truncate();
            LOG.debugf("Index checkpoint written with %d entries", entries.size());
        } finally {
            mutationLock.unlock();
        }
    }

    @Override
    public void close()
    {
        journal.close();
    }
}
