package com.ringcache.metric;

import java.util.Arrays;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.LongAccumulator;
import java.util.concurrent.atomic.LongAdder;
import java.util.function.Supplier;

/**
 * Disk yazmaları ve yönlendirilen istekler gibi işlemlerin sürelerini toplar.
 * Son ölçümleri halka şeklinde bir örneklem dizisinde tutarak p50/p95
 * değerlerini kestirir.
 */
public final class Timer
{
    private final String name;
    private final LongAdder count = new LongAdder();
    private final LongAdder totalNs = new LongAdder();
    private final LongAccumulator minNs = new LongAccumulator(Math::min, Long.MAX_VALUE);
    private final LongAccumulator maxNs = new LongAccumulator(Math::max, Long.MIN_VALUE);
    private final long[] reservoir;
    private final AtomicInteger cursor = new AtomicInteger();

    public Timer(String name)
    {
        this(name, 1024);
    }

    public Timer(String name, int reservoirSize)
    {
        this.name = name;
        this.reservoir = new long[Math.max(128, reservoirSize)];
    }

    public <T> T time(Supplier<T> action)
    {
        long start = System.nanoTime();
        try {
            return action.get();
        } finally {
            record(System.nanoTime() - start);
        }
    }

    public void record(long durationNs)
    {
        count.increment();
        totalNs.add(durationNs);
        minNs.accumulate(durationNs);
        maxNs.accumulate(durationNs);
        reservoir[Math.floorMod(cursor.getAndIncrement(), reservoir.length)] = durationNs;
    }

    public Sample snapshot()
    {
        long c = count.sum();
        long t = totalNs.sum();
        double avg = c == 0 ? 0.0 : (double) t / c;
        long min = c == 0 ? 0 : minNs.get();
        long max = c == 0 ? 0 : maxNs.get();

        int filled = (int) Math.min(c, reservoir.length);
        long[] copy = Arrays.copyOf(reservoir, filled);
        Arrays.sort(copy);
        long p50 = filled == 0 ? 0 : copy[(int) (0.50 * (filled - 1))];
        long p95 = filled == 0 ? 0 : copy[(int) (0.95 * (filled - 1))];
        return new Sample(name, c, avg, min, max, p50, p95);
    }

    public record Sample(String name, long count, double avgNs, long minNs, long maxNs, long p50Ns, long p95Ns) {}
}
