package com.ringcache.core;

import com.ringcache.index.CacheIndex;
import com.ringcache.index.EntryMetadata;
import com.ringcache.index.IndexRecord;
import com.ringcache.metric.Counter;
import com.ringcache.metric.MetricsRegistry;
import com.ringcache.metric.Timer;
import com.ringcache.storage.CorruptRecordException;
import com.ringcache.storage.StorageIOException;
import com.ringcache.storage.StorageUnit;
import org.jboss.logging.Logger;

import java.io.IOException;
import java.nio.file.NoSuchFileException;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Queue;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.function.LongSupplier;

/**
 * İndeks ile depolama birimini birleştirerek yerel GET/SET/DELETE işlemlerini
 * sunan önbellek motorudur.
 *
 * <p>Yazma sırası her zaman "yeni kaydı yaz, indeksi değiştir, eskisini geri
 * kazan" şeklindedir. Bu nedenle indeks hiçbir zaman tamamlanmamış bir kaydı
 * göstermez ve okuyucular geçersizleşmiş bir kayda yönlendirilmez. Eski
 * kayıtların silinmesi ertelenir ve {@link #reclaimPending()} ile yapılır.
 *
 * <p>İndeks bir kaydı gösterdiği halde disk okuması başarısız olursa bu bir
 * tutarlılık hatasıdır: çağırana kayıt yokmuş gibi dönülür ve sorunlu girdi
 * indeksten kaldırılır.
 */
public final class CacheEngine implements AutoCloseable
{
    private static final Logger LOG = Logger.getLogger(CacheEngine.class);

    private static final int MAX_READ_ATTEMPTS = 8;

    private final CacheIndex index;
    private final StorageUnit storage;
    private final LongSupplier clock;

    private final Queue<String> reclaimQueue = new ConcurrentLinkedQueue<>();
    private final Set<String> pendingReclaim = ConcurrentHashMap.newKeySet();

    private final Counter hits;
    private final Counter misses;
    private final Counter writes;
    private final Counter deletes;
    private final Counter consistencyFaults;
    private final Counter reclaimed;
    private final Timer writeTimer;
    private boolean closed;

    private CacheEngine(CacheIndex index, StorageUnit storage, MetricsRegistry metrics, LongSupplier clock)
    {
        this.index = Objects.requireNonNull(index, "index");
        this.storage = Objects.requireNonNull(storage, "storage");
        this.clock = Objects.requireNonNull(clock, "clock");
        storage.reserve(index.snapshot().stream().map(IndexRecord::location).toList());
        MetricsRegistry registry = metrics != null ? metrics : new MetricsRegistry();
        this.hits = registry.counter("cache_hits");
        this.misses = registry.counter("cache_misses");
        this.writes = registry.counter("cache_writes");
        this.deletes = registry.counter("cache_deletes");
        this.consistencyFaults = registry.counter("consistency_faults");
        this.reclaimed = registry.counter("records_reclaimed");
        this.writeTimer = registry.timer("cache_write");
    }

    public static Builder builder(CacheIndex index, StorageUnit storage) { return new Builder(index, storage); }

    /**
     * Motoru yapılandırmak için kullanılan akıcı builder.
     */
    public static final class Builder
    {
        private final CacheIndex index;
        private final StorageUnit storage;
        private MetricsRegistry metrics;
        private LongSupplier clock = System::currentTimeMillis;

        private Builder(CacheIndex index, StorageUnit storage) { this.index = index; this.storage = storage; }
        public Builder metrics(MetricsRegistry m) { this.metrics = m; return this; }
        public Builder clock(LongSupplier c) { this.clock = Objects.requireNonNull(c); return this; }
        public CacheEngine build() { return new CacheEngine(index, storage, metrics, clock); }
    }

    /**
     * Değeri önce diske yazar, ardından indeksi yeni konuma çevirir. Önceki
     * kayıt geri kazanım kuyruğuna alınır.
     *
     * @throws StorageIOException kayıt veya indeks günlüğü yazılamazsa; bu durumda
     *                            önceki değer görünür kalmaya devam eder
     */
    public void set(String key, byte[] value)
    {
        requireKey(key);
        Objects.requireNonNull(value, "value");

        String location = writeTimer.time(() -> storage.write(key, value));
        Optional<IndexRecord> previous;
        try {
            previous = index.install(key, location, value.length, clock.getAsLong());
        } catch (RuntimeException e) {
            discardUnindexed(location, e);
            throw e;
        }
        writes.inc();
        previous.filter(record -> !record.location().equals(location))
                .ifPresent(record -> scheduleReclaim(record.location()));
    }

    public Optional<byte[]> get(String key)
    {
        requireKey(key);
        for (int attempt = 0; attempt < MAX_READ_ATTEMPTS; attempt++) {
            Optional<IndexRecord> found = index.get(key);
            if (found.isEmpty()) {
                misses.inc();
                return Optional.empty();
            }
            IndexRecord record = found.get();
            try {
                byte[] value = storage.read(record.location(), key);
                hits.inc();
                return Optional.of(value);
            } catch (NoSuchFileException | CorruptRecordException e) {
                Optional<IndexRecord> current = index.get(key);
                if (current.isEmpty()) {
                    misses.inc();
                    return Optional.empty();
                }
                if (!current.get().equals(record)) {
                    // eşzamanlı bir yazma kaydı taşıdı
                    continue;
                }
                handleConsistencyFault(record, e);
                misses.inc();
                return Optional.empty();
            } catch (IOException e) {
                throw new StorageIOException("Failed to read record " + record.location(), e);
            }
        }
        throw new StorageIOException("Key " + key + " kept moving during " + MAX_READ_ATTEMPTS + " read attempts");
    }

    /**
     * Anahtarı indeksten hemen kaldırır; disk kaydının silinmesi ertelenir.
     *
     * @return anahtar mevcutsa {@code true}
     */
    public boolean delete(String key)
    {
        requireKey(key);
        Optional<IndexRecord> removed = index.remove(key);
        removed.ifPresent(record -> {
            deletes.inc();
            scheduleReclaim(record.location());
        });
        return removed.isPresent();
    }

    public Optional<EntryMetadata> metadata(String key)
    {
        requireKey(key);
        return index.get(key).map(IndexRecord::metadata);
    }

    public int size()
    {
        return index.size();
    }

    public int pendingReclaimCount()
    {
        return pendingReclaim.size();
    }

    /**
     * Kuyruktaki eski kayıtları siler. Silme başarısız olursa kayıt kuyrukta
     * kalır ve bir sonraki çağrıda yeniden denenir.
     *
     * @return silinen kayıt sayısı
     */
    public int reclaimPending()
    {
        int budget = reclaimQueue.size();
        int done = 0;
        for (int i = 0; i < budget; i++) {
            String location = reclaimQueue.poll();
            if (location == null) {
                break;
            }
            try {
                storage.delete(location);
                pendingReclaim.remove(location);
                done++;
            } catch (StorageIOException e) {
                LOG.warnf(e, "Reclaim of %s failed; will retry", location);
                reclaimQueue.add(location);
                break;
            }
        }
        if (done > 0) {
            reclaimed.add(done);
            LOG.debugf("Reclaimed %d superseded records", done);
        }
        return done;
    }

    /**
     * İndeksteki her girdinin okunabilir bir kayda dayandığını ve diskteki her
     * kaydın bir indeks girdisine ait olduğunu denetler. Geri kazanım için
     * bekleyen kayıtlar sahipsiz sayılmaz.
     */
    public ConsistencyReport verify()
    {
        // disk önce listelenir; sonrasında yazılan kayıtlar listede olmaz
        List<String> onDisk = storage.list();
        List<IndexRecord> indexed = index.snapshot();

        List<String> missingKeys = new ArrayList<>();
        Set<String> referenced = new HashSet<>();
        for (IndexRecord record : indexed) {
            referenced.add(record.location());
            if (!isReadable(record) && index.get(record.key()).filter(record::equals).isPresent()) {
                missingKeys.add(record.key());
            }
        }

        List<String> candidates = new ArrayList<>();
        for (String location : onDisk) {
            if (!referenced.contains(location) && !pendingReclaim.contains(location)) {
                candidates.add(location);
            }
        }
        List<String> orphanLocations = new ArrayList<>();
        if (!candidates.isEmpty()) {
            // listeleme ile indeks kopyası arasında yerleşen yazmaları ele
            Set<String> current = new HashSet<>();
            index.snapshot().forEach(record -> current.add(record.location()));
            for (String location : candidates) {
                if (!current.contains(location) && !pendingReclaim.contains(location)) {
                    orphanLocations.add(location);
                }
            }
        }

        ConsistencyReport report = new ConsistencyReport(
                indexed.size(), missingKeys.size(), orphanLocations.size(), missingKeys, orphanLocations);
        if (report.consistent()) {
            LOG.debugf("Verification found %d consistent entries", report.indexedEntries());
        } else {
            LOG.warnf("Verification found %d entries without backing records and %d orphan records",
                    report.missingBacking(), report.orphans());
        }
        return report;
    }

    public void checkpoint()
    {
        index.checkpoint();
    }

    /**
     * Bekleyen geri kazanımları ve son kontrol noktasını tamamlayıp indeks günlüğünü kapatır.
     */
    @Override
    public synchronized void close()
    {
        if (closed) {
            return;
        }
        closed = true;
        try {
            reclaimPending();
            index.checkpoint();
        } catch (StorageIOException e) {
            LOG.warnf(e, "Final checkpoint failed; the journal will be replayed on next start");
        } finally {
            index.close();
        }
    }

    private boolean isReadable(IndexRecord record)
    {
        try {
            storage.read(record.location(), record.key());
            return true;
        } catch (IOException e) {
            return false;
        }
    }

    private void handleConsistencyFault(IndexRecord record, IOException cause)
    {
        consistencyFaults.inc();
        LOG.warnf("Consistency fault for key %s at %s: %s", record.key(), record.location(), cause.getMessage());
        if (index.removeIfMatches(record)) {
            scheduleReclaim(record.location());
        }
    }

    private void discardUnindexed(String location, RuntimeException cause)
    {
        try {
            storage.delete(location);
        } catch (StorageIOException e) {
            cause.addSuppressed(e);
        }
    }

    private void scheduleReclaim(String location)
    {
        if (pendingReclaim.add(location)) {
            reclaimQueue.add(location);
        }
    }

    private static void requireKey(String key)
    {
        if (key == null || key.isEmpty()) {
            throw new IllegalArgumentException("key must not be empty");
        }
    }
}
