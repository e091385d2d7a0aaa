package com.ringcache.metric;

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
 * Kayıt defterindeki metrikleri belirli aralıklarla log'a yazar. Aralık sıfır
 * veya negatifse raporlama hiç başlatılmaz.
 */
@Startup
@Singleton
public class MetricsReporter implements AutoCloseable
{
    private static final Logger LOG = Logger.getLogger(MetricsReporter.class);

    private final MetricsRegistry registry;
    private final long intervalSeconds;
    private final Vertx vertx;
    private final WorkerExecutor workerExecutor;
    private final AtomicBoolean running = new AtomicBoolean(false);
    private long timerId = -1L;

    @Inject
    public MetricsReporter(MetricsRegistry registry, AppProperties properties, Vertx vertx, WorkerExecutor workerExecutor)
    {
        this(registry, properties.metrics().reportIntervalSeconds(), vertx, workerExecutor);
    }

    public MetricsReporter(MetricsRegistry registry, long intervalSeconds, Vertx vertx, WorkerExecutor workerExecutor)
    {
        this.registry = registry;
        this.intervalSeconds = intervalSeconds;
        this.vertx = vertx;
        this.workerExecutor = workerExecutor;
    }

    @PostConstruct
    void init()
    {
        start(intervalSeconds);
    }

    public synchronized void start(long intervalSeconds)
    {
        if (intervalSeconds <= 0 || !running.compareAndSet(false, true)) {
            return;
        }
        long periodMillis = TimeUnit.SECONDS.toMillis(intervalSeconds);
        timerId = vertx.setPeriodic(periodMillis, id ->
                workerExecutor.executeBlocking(() -> {
                    report();
                    return null;
                }, false));
    }

    public boolean isRunning()
    {
        return running.get();
    }

    void report()
    {
        StringBuilder summary = new StringBuilder("metrics:");
        registry.counterValues().forEach((name, value) ->
                summary.append(' ').append(name).append('=').append(value));
        registry.timerSamples().values().forEach(sample -> summary.append(String.format(
                " %s[count=%d avg=%.1fus p50=%.1fus p95=%.1fus]",
                sample.name(),
                sample.count(),
                sample.avgNs() / 1_000.0,
                sample.p50Ns() / 1_000.0,
                sample.p95Ns() / 1_000.0)));
        LOG.info(summary);
    }

    @PreDestroy
    void shutdown()
    {
        close();
    }

    @Override
    public synchronized void close()
    {
        running.set(false);
        if (timerId >= 0L) {
            vertx.cancelTimer(timerId);
            timerId = -1L;
        }
    }
}
