package com.ringcache.metric;

import java.util.Map;
import java.util.TreeMap;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Sayaç ve zamanlayıcıları isimleriyle tutan ortak kayıt defteridir. Metrikler
 * ilk talep edildiklerinde oluşturulur.
 */
public final class MetricsRegistry
{
    private final Map<String, Counter> counters = new ConcurrentHashMap<>();
    private final Map<String, Timer> timers = new ConcurrentHashMap<>();

    public Counter counter(String name)
    {
        return counters.computeIfAbsent(name, Counter::new);
    }

    public Timer timer(String name)
    {
        return timers.computeIfAbsent(name, Timer::new);
    }

    /** İsme göre sıralı sayaç değerleri. */
    public Map<String, Long> counterValues()
    {
        Map<String, Long> values = new TreeMap<>();
        counters.forEach((name, counter) -> values.put(name, counter.get()));
        return values;
    }

    public Map<String, Timer.Sample> timerSamples()
    {
        Map<String, Timer.Sample> samples = new TreeMap<>();
        timers.forEach((name, timer) -> samples.put(name, timer.snapshot()));
        return samples;
    }
}
