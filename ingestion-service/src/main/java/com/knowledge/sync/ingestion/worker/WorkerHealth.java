package com.knowledge.sync.ingestion.worker;

import com.knowledge.sync.shared.util.constants.AppConstants;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Liveness of the host process: when it last handled a message and how many it handled or failed.
 */
@Slf4j
@Component
public class WorkerHealth {

    private final Clock clock;
    private final Instant startedAt;
    private final AtomicReference<Instant> lastActivity;
    private final AtomicLong processed = new AtomicLong();
    private final AtomicLong errors = new AtomicLong();

    public WorkerHealth() {
        this(Clock.systemUTC());
    }

    WorkerHealth(Clock clock) {
        this.clock = clock;
        this.startedAt = clock.instant();
        this.lastActivity = new AtomicReference<>(startedAt);
    }

    /** Marks the worker alive without counting a processed message. */
    public void touch() {
        lastActivity.set(clock.instant());
    }

    public void recordActivity() {
        touch();
        processed.incrementAndGet();
    }

    public void recordError() {
        errors.incrementAndGet();
    }

    public long processedCount() {
        return processed.get();
    }

    public long errorCount() {
        return errors.get();
    }

    public Duration idleTime() {
        return Duration.between(lastActivity.get(), clock.instant());
    }

    @Scheduled(fixedRateString = AppConstants.PROP_HEALTH_CHECK_RATE_MS)
    public void reportHealth() {
        Duration uptime = Duration.between(startedAt, clock.instant());
        log.info("Health check: uptime={}s, processed={}, errors={}, idle={}s",
                uptime.toSeconds(), processed.get(), errors.get(), idleTime().toSeconds());
    }
}
