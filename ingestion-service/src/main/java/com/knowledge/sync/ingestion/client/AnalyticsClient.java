package com.knowledge.sync.ingestion.client;

import com.knowledge.sync.shared.util.constants.AppConstants;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestClient;

@Slf4j
@Component
public class AnalyticsClient {

    private final RestClient restClient;

    public AnalyticsClient(RestClient.Builder builder, @Value(AppConstants.PROP_ANALYTICS_URL) String analyticsUrl) {
        this.restClient = builder.baseUrl(analyticsUrl).build();
    }

    public void registerDatabase(DatabaseRegistration registration) {
        log.info("Registering database with analytics: {}", registration);
        restClient.post()
                .uri("/databases")
                .contentType(MediaType.APPLICATION_JSON)
                .body(registration)
                .retrieve()
                .toBodilessEntity();
    }
}
