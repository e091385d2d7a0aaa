package com.ringcache.core;

import com.ringcache.config.AppProperties;
import io.quarkus.runtime.Startup;
import io.vertx.core.Vertx;
import io.vertx.core.WorkerExecutor;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import jakarta.inject.Inject;
import jakarta.inject.Singleton;
import org.jboss.logging.Logger;

import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * {@link CacheEngine} için arka plan bakımını yürütür: başlangıçta bir
 * doğrulama geçişi çalıştırır, eski kayıtları kısa aralıklarla geri kazanır ve
 * indeks kontrol noktasını periyodik olarak yazar. Görevler Vert.x
 * zamanlayıcısından tetiklenir, fakat disk işleri worker havuzunda yürür.
 */
@Startup
@Singleton
public class StorageMaintenanceScheduler implements AutoCloseable
{
    private static final Logger LOG = Logger.getLogger(StorageMaintenanceScheduler.class);

    private final CacheEngine engine;
    private final long reclaimIntervalMillis;
    private final long checkpointIntervalSeconds;
    private final boolean verifyOnStartup;
    private final Vertx vertx;
    private final WorkerExecutor workerExecutor;
    private final AtomicBoolean started = new AtomicBoolean(false);
    private long reclaimTimerId = -1L;
    private long checkpointTimerId = -1L;

    @Inject
    public StorageMaintenanceScheduler(CacheEngine engine,
                                       AppProperties properties,
                                       Vertx vertx,
                                       WorkerExecutor workerExecutor)
    {
        this(engine,
                properties.storage().reclaimIntervalMillis(),
                properties.storage().checkpointIntervalSeconds(),
                properties.storage().verifyOnStartup(),
                vertx,
                workerExecutor);
    }

    public StorageMaintenanceScheduler(CacheEngine engine,
                                       long reclaimIntervalMillis,
                                       long checkpointIntervalSeconds,
                                       boolean verifyOnStartup,
                                       Vertx vertx,
                                       WorkerExecutor workerExecutor)
    {
        this.engine = engine;
        this.reclaimIntervalMillis = reclaimIntervalMillis;
        this.checkpointIntervalSeconds = checkpointIntervalSeconds;
        this.verifyOnStartup = verifyOnStartup;
        this.vertx = vertx;
        this.workerExecutor = workerExecutor;
    }

    @PostConstruct
    void init()
    {
        start();
    }

    public synchronized void start()
    {
        if (!started.compareAndSet(false, true)) {
            return;
        }
        if (verifyOnStartup) {
            workerExecutor.executeBlocking(() -> {
                safeVerify();
                return null;
            }, false);
        }
        if (reclaimIntervalMillis > 0) {
            reclaimTimerId = vertx.setPeriodic(reclaimIntervalMillis, id ->
                    workerExecutor.executeBlocking(() -> {
                        safeReclaim();
                        return null;
                    }, false));
        }
        if (checkpointIntervalSeconds > 0) {
            long delay = TimeUnit.SECONDS.toMillis(checkpointIntervalSeconds);
            checkpointTimerId = vertx.setPeriodic(delay, id ->
                    workerExecutor.executeBlocking(() -> {
                        safeCheckpoint();
                        return null;
                    }, false));
        }
    }

    public boolean isRunning()
    {
        return started.get();
    }

    private void safeVerify()
    {
        try {
            ConsistencyReport report = engine.verify();
            LOG.infof("Startup verification: %d indexed, %d missing backing, %d orphans",
                    report.indexedEntries(), report.missingBacking(), report.orphans());
        } catch (RuntimeException e) {
            LOG.error("Startup verification failed", e);
        }
    }

    private void safeReclaim()
    {
        try {
            engine.reclaimPending();
        } catch (RuntimeException e) {
            LOG.error("Failed to reclaim superseded records", e);
        }
    }

    private void safeCheckpoint()
    {
        try {
            engine.checkpoint();
        } catch (RuntimeException e) {
            LOG.error("Failed to write index checkpoint", e);
        }
    }

    @PreDestroy
    void shutdown()
    {
        close();
    }

    @Override
    public synchronized void close()
    {
        if (!started.getAndSet(false)) {
            return;
        }
        if (reclaimTimerId >= 0L) {
            vertx.cancelTimer(reclaimTimerId);
            reclaimTimerId = -1L;
        }
        if (checkpointTimerId >= 0L) {
            vertx.cancelTimer(checkpointTimerId);
            checkpointTimerId = -1L;
        }
    }
}
