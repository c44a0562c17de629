package com.knowledge.sync.ingestion.client;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Connection details the analytics service needs to register a user's PostgreSQL database.
 */
public record DatabaseRegistration(
        @JsonProperty("database_name") String databaseName,
        @JsonProperty("host") String host,
        @JsonProperty("port") int port,
        @JsonProperty("user") String user,
        @JsonProperty("password") String password,
        @JsonProperty("description") String description,
        @JsonProperty("user_id") String userId,
        @JsonProperty("integration_id") String integrationId) {

    @Override
    public String toString() {
        return "DatabaseRegistration[database=" + databaseName + ", host=" + host + ":" + port
                + ", user=" + user + ", integration=" + integrationId + "]";
    }
}
