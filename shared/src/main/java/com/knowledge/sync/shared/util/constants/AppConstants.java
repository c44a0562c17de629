package com.knowledge.sync.shared.util.constants;

public final class AppConstants {
    private AppConstants() {
    }

    // ── SpEL Bindings for @Document Annotations ──
    public static final String SPEL_COLLECTION_OUTBOX = "#{@environment.getProperty('app.mongodb.collections.outbox', 'outbox_events')}";
    public static final String SPEL_COLLECTION_SYNC_RUNS = "#{@environment.getProperty('app.mongodb.collections.sync-runs', 'sync_runs')}";
    public static final String SPEL_COLLECTION_INTEGRATIONS = "#{@environment.getProperty('app.mongodb.collections.integrations', 'user_integrations')}";
    public static final String SPEL_COLLECTION_DOCUMENTS = "#{@environment.getProperty('app.mongodb.collections.documents', 'user_documents')}";

    // ── Kafka ──
    public static final String PROP_KAFKA_TOPIC_SYNC_REQUESTS = "${app.kafka.topics.sync-requests:integration-sync-requests}";
    public static final String PROP_KAFKA_TOPIC_SYNC_STATUS = "${app.kafka.topics.sync-status:integration-sync-status}";
    public static final String PROP_KAFKA_GROUP_ID = "${app.kafka.group-id:knowledge-ingestion}";
    public static final String PROP_KAFKA_LISTENER_CONCURRENCY = "${app.kafka.listener-concurrency:4}";
    public static final String PROP_KAFKA_REDELIVERY_INTERVAL_MS = "${app.kafka.redelivery.interval-ms:30000}";
    public static final String PROP_KAFKA_REDELIVERY_ATTEMPTS = "${app.kafka.redelivery.max-attempts:5}";

    // ── Outbox ──
    public static final String PROP_COLLECTION_OUTBOX = "${app.mongodb.collections.outbox:outbox_events}";
    public static final String EVENT_TYPE_SYNC_REQUESTED = "SYNC_REQUESTED";
    public static final String EVENT_TYPE_SYNC_STATUS_CHANGED = "SYNC_STATUS_CHANGED";
    public static final String PROP_OUTBOX_SWEEP_RATE_MS = "${app.outbox.sweep-interval-ms:30000}";

    // ── Worker ──
    public static final String PROP_HEALTH_CHECK_RATE_MS = "${app.worker.health-check-interval-ms:60000}";
    public static final String PROP_WORKER_DETAILED_LOGGING = "${app.worker.detailed-logging:true}";

    // ── Integrations ──
    public static final String PROP_DRIVE_API_URL = "${app.integrations.google-drive.api-url:https://www.googleapis.com/drive/v3}";
    public static final String PROP_DRIVE_PAGE_SIZE = "${app.integrations.google-drive.page-size:100}";
    public static final String PROP_ANALYTICS_URL = "${app.integrations.analytics.url:http://localhost:8090/api/analytics}";

    // ── MDC keys ──
    public static final String MDC_SYNC_ID = "syncId";
    public static final String MDC_USER_ID = "userId";
}
