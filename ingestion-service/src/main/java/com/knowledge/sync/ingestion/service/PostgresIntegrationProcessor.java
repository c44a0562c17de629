package com.knowledge.sync.ingestion.service;

import com.knowledge.sync.ingestion.client.AnalyticsClient;
import com.knowledge.sync.ingestion.client.DatabaseRegistration;
import com.knowledge.sync.ingestion.model.Integration;
import com.knowledge.sync.ingestion.model.IntegrationType;
import com.knowledge.sync.ingestion.model.SyncContext;
import com.knowledge.sync.ingestion.model.SyncSummary;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * A PostgreSQL integration has no documents; syncing it registers the database with the analytics service.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class PostgresIntegrationProcessor implements IntegrationProcessor {

    static final int DEFAULT_PORT = 5432;

    private final AnalyticsClient analyticsClient;

    @Override
    public IntegrationType type() {
        return IntegrationType.POSTGRESQL;
    }

    @Override
    public SyncSummary process(SyncContext context) {
        DatabaseRegistration registration = toRegistration(context);
        analyticsClient.registerDatabase(registration);
        log.info("Registered database {} for sync {}", registration.databaseName(), context.syncId());
        return SyncSummary.single();
    }

    static DatabaseRegistration toRegistration(SyncContext context) {
        Integration integration = context.integration();
        String port = integration.credentialValue("port");
        return new DatabaseRegistration(
                integration.credentialValue("database_name"),
                integration.credentialValue("host"),
                port == null || port.isBlank() ? DEFAULT_PORT : Integer.parseInt(port.trim()),
                integration.credentialValue("username"),
                orEmpty(integration.credentialValue("password")),
                orEmpty(integration.credentialValue("description")),
                context.userId(),
                context.integrationId());
    }

    private static String orEmpty(String value) {
        return value == null ? "" : value;
    }
}
