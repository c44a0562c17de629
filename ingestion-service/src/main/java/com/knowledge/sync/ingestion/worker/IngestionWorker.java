package com.knowledge.sync.ingestion.worker;

import com.knowledge.sync.ingestion.config.IngestionProperties;
import com.knowledge.sync.ingestion.exception.MessageValidationException;
import com.knowledge.sync.ingestion.exception.SyncInterruptedException;
import com.knowledge.sync.ingestion.exception.SyncTimeoutException;
import com.knowledge.sync.ingestion.service.SyncCoordinator;
import com.knowledge.sync.shared.constant.APIMessages;
import com.knowledge.sync.shared.event.SyncRequestEvent;
import com.knowledge.sync.shared.util.constants.AppConstants;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.core.task.AsyncTaskExecutor;
import org.springframework.lang.Nullable;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Future;
import java.util.concurrent.Semaphore;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.regex.Pattern;

/**
 * Turns sync-request messages into {@link SyncCoordinator#run} calls.
 * <p>
 * Malformed messages are logged and dropped. Every other failure is counted and rethrown so the
 * transport redelivers the message. At most {@code max-concurrent-syncs} runs are in flight at once.
 */
@Slf4j
@Component
public class IngestionWorker {

    static final String FIELD_USER_ID = "user_id";
    static final String FIELD_SYNC_ID = "sync_id";
    static final String FIELD_RETRY_COUNT = "retry_count";
    static final String FIELD_PRIORITY = "priority";
    static final String FIELD_MESSAGE_ID = "message_id";

    private static final int SUMMARY_INTERVAL = 100;
    private static final String URN_PREFIX = "urn:uuid:";
    private static final Pattern HEX_UUID = Pattern.compile("[0-9a-fA-F]{32}");

    private final SyncCoordinator syncCoordinator;
    private final IngestionProperties properties;
    private final AsyncTaskExecutor syncExecutor;
    private final WorkerHealth workerHealth;
    private final boolean detailedLogging;

    private final Semaphore permits;
    private final WorkerMetrics metrics = new WorkerMetrics();

    public IngestionWorker(SyncCoordinator syncCoordinator,
                           IngestionProperties properties,
                           @Qualifier("syncExecutor") AsyncTaskExecutor syncExecutor,
                           @Nullable WorkerHealth workerHealth,
                           @Value(AppConstants.PROP_WORKER_DETAILED_LOGGING) boolean detailedLogging) {
        this.syncCoordinator = syncCoordinator;
        this.properties = properties;
        this.syncExecutor = syncExecutor;
        this.workerHealth = workerHealth;
        this.detailedLogging = detailedLogging;
        this.permits = new Semaphore(properties.getMaxConcurrentSyncs(), true);
    }

    public void consume(Object payload) {
        if (workerHealth != null) {
            workerHealth.touch();
        }
        SyncRequest request;
        try {
            request = validate(payload);
        } catch (MessageValidationException e) {
            log.error("Dropping invalid sync request: {}", e.getMessage());
            if (workerHealth != null) {
                workerHealth.recordError();
            }
            return;
        }

        MDC.put(AppConstants.MDC_SYNC_ID, request.syncId().toString());
        MDC.put(AppConstants.MDC_USER_ID, request.userId());
        long started = System.nanoTime();
        try {
            String prefix = request.isHighPriority() ? "[PRIORITY] " : "";
            if (request.retryCount() >= properties.getMaxRetries()) {
                log.warn("{}Sync {} delivered {} times (limit {}), processing anyway",
                        prefix, request.syncId(), request.retryCount(), properties.getMaxRetries());
            }
            if (detailedLogging) {
                log.debug("{}Received sync request {} (retry {}, message {})",
                        prefix, request.syncId(), request.retryCount(), request.messageId());
            }

            runBounded(request);

            long latencyMs = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - started);
            long processed = metrics.recordSuccess(latencyMs);
            if (workerHealth != null) {
                workerHealth.recordActivity();
            }
            log.info("{}Finished sync {} in {} ms", prefix, request.syncId(), latencyMs);
            if (processed % SUMMARY_INTERVAL == 0) {
                WorkerMetrics.Snapshot snapshot = metrics.snapshot();
                log.info("Worker metrics: processed={}, errors={}, avgLatency={} ms, maxLatency={} ms",
                        snapshot.processed(), snapshot.errors(),
                        Math.round(snapshot.averageLatencyMs()), snapshot.maxLatencyMs());
            }
        } catch (RuntimeException e) {
            metrics.recordError();
            if (workerHealth != null) {
                workerHealth.recordError();
            }
            log.error("Sync {} failed: {}", request.syncId(), e.getMessage(), e);
            throw e;
        } finally {
            MDC.remove(AppConstants.MDC_SYNC_ID);
            MDC.remove(AppConstants.MDC_USER_ID);
        }
    }

    public WorkerMetrics.Snapshot metrics() {
        return metrics.snapshot();
    }

    int availablePermits() {
        return permits.availablePermits();
    }

    private void runBounded(SyncRequest request) {
        try {
            permits.acquire();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new SyncInterruptedException("Interrupted while waiting for a sync slot", e);
        }

        boolean handedOff = false;
        try {
            if (properties.hasSyncTimeout()) {
                // whoever claims first (the task starting, or the caller after cancelling it) owns the permit
                AtomicBoolean claimed = new AtomicBoolean();
                Future<?> future = syncExecutor.submit(withContext(() -> {
                    if (!claimed.compareAndSet(false, true)) {
                        return;
                    }
                    try {
                        syncCoordinator.run(request.userId(), request.syncId());
                    } finally {
                        permits.release();
                    }
                }));
                handedOff = true;
                await(future, claimed, request.syncId(), properties.getSyncTimeout());
            } else {
                syncCoordinator.run(request.userId(), request.syncId());
            }
        } finally {
            if (!handedOff) {
                permits.release();
            }
        }
    }

    private void await(Future<?> future, AtomicBoolean claimed, UUID syncId, Duration timeout) {
        try {
            future.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            cancel(future, claimed);
            throw new SyncTimeoutException(syncId, timeout);
        } catch (InterruptedException e) {
            cancel(future, claimed);
            Thread.currentThread().interrupt();
            throw new SyncInterruptedException(syncId);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof RuntimeException runtime) {
                throw runtime;
            }
            if (cause instanceof Error error) {
                throw error;
            }
            throw new IllegalStateException(cause);
        }
    }

    private void cancel(Future<?> future, AtomicBoolean claimed) {
        future.cancel(true);
        if (claimed.compareAndSet(false, true)) {
            permits.release();
        }
    }

    private static Runnable withContext(Runnable task) {
        Map<String, String> context = MDC.getCopyOfContextMap();
        return () -> {
            if (context != null) {
                MDC.setContextMap(context);
            }
            try {
                task.run();
            } finally {
                MDC.clear();
            }
        };
    }

    static SyncRequest validate(Object payload) {
        if (!(payload instanceof Map<?, ?> message)) {
            String type = payload == null ? "null" : payload.getClass().getSimpleName();
            throw new MessageValidationException(APIMessages.ERROR_NOT_A_MAP + type);
        }

        Object userId = message.get(FIELD_USER_ID);
        if (userId == null) {
            throw new MessageValidationException(String.format(APIMessages.ERROR_MISSING_FIELD, FIELD_USER_ID));
        }
        if (!(userId instanceof String userIdValue)) {
            throw new MessageValidationException(APIMessages.ERROR_USER_ID_TYPE);
        }

        Object syncId = message.get(FIELD_SYNC_ID);
        if (syncId == null) {
            throw new MessageValidationException(String.format(APIMessages.ERROR_MISSING_FIELD, FIELD_SYNC_ID));
        }
        UUID parsedSyncId = parseSyncId(syncId.toString());

        int retryCount = message.get(FIELD_RETRY_COUNT) instanceof Number number ? number.intValue() : 0;
        String priority = message.get(FIELD_PRIORITY) instanceof String value
                ? value : SyncRequestEvent.PRIORITY_NORMAL;
        Object messageId = message.get(FIELD_MESSAGE_ID);

        return new SyncRequest(userIdValue, parsedSyncId, retryCount, priority,
                messageId == null ? null : messageId.toString());
    }

    /**
     * Accepts the canonical, hyphenless, braced and {@code urn:uuid:} spellings of a UUID.
     */
    private static UUID parseSyncId(String raw) {
        String hex = raw.strip();
        if (hex.regionMatches(true, 0, URN_PREFIX, 0, URN_PREFIX.length())) {
            hex = hex.substring(URN_PREFIX.length());
        }
        if (hex.startsWith("{") && hex.endsWith("}")) {
            hex = hex.substring(1, hex.length() - 1);
        }
        hex = hex.replace("-", "");
        if (!HEX_UUID.matcher(hex).matches()) {
            throw new MessageValidationException(APIMessages.ERROR_SYNC_ID_FORMAT + raw);
        }
        return new UUID(Long.parseUnsignedLong(hex.substring(0, 16), 16),
                Long.parseUnsignedLong(hex.substring(16), 16));
    }

    record SyncRequest(String userId, UUID syncId, int retryCount, String priority, String messageId) {

        boolean isHighPriority() {
            return SyncRequestEvent.PRIORITY_HIGH.equalsIgnoreCase(priority);
        }
    }
}
