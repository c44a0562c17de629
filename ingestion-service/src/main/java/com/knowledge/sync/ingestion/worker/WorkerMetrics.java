package com.knowledge.sync.ingestion.worker;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Counters and a rolling latency window for the ingestion worker. Safe for concurrent listeners.
 */
public class WorkerMetrics {

    static final int LATENCY_WINDOW = 100;

    private final AtomicLong processed = new AtomicLong();
    private final AtomicLong errors = new AtomicLong();
    private final AtomicLong maxLatencyMs = new AtomicLong();
    private final Deque<Long> latencies = new ArrayDeque<>(LATENCY_WINDOW);

    /**
     * @return the processed count including this message
     */
    public long recordSuccess(long latencyMs) {
        synchronized (latencies) {
            if (latencies.size() == LATENCY_WINDOW) {
                latencies.removeFirst();
            }
            latencies.addLast(latencyMs);
        }
        maxLatencyMs.accumulateAndGet(latencyMs, Math::max);
        return processed.incrementAndGet();
    }

    public long recordError() {
        return errors.incrementAndGet();
    }

    public Snapshot snapshot() {
        double average;
        synchronized (latencies) {
            average = latencies.stream().mapToLong(Long::longValue).average().orElse(0);
        }
        return new Snapshot(processed.get(), errors.get(), average, maxLatencyMs.get());
    }

    public record Snapshot(long processed, long errors, double averageLatencyMs, long maxLatencyMs) {
    }
}
