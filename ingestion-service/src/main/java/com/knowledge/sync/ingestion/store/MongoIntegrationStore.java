package com.knowledge.sync.ingestion.store;

import com.knowledge.sync.ingestion.model.Integration;
import com.knowledge.sync.ingestion.repository.IntegrationRepository;
import com.mongodb.client.result.UpdateResult;
import lombok.RequiredArgsConstructor;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.data.mongodb.core.query.Criteria;
import org.springframework.data.mongodb.core.query.Query;
import org.springframework.data.mongodb.core.query.Update;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.Optional;

@Component
@RequiredArgsConstructor
public class MongoIntegrationStore implements IntegrationStore {

    private final IntegrationRepository integrationRepository;
    private final MongoTemplate mongoTemplate;

    @Override
    public Optional<Integration> findIntegration(String userId, String integrationId) {
        return integrationRepository.findByIdAndUserId(integrationId, userId);
    }

    @Override
    public Optional<String> getCheckpoint(String userId, String integrationId) {
        return findIntegration(userId, integrationId)
                .map(Integration::getSettings)
                .map(settings -> settings.get(Integration.SETTING_CHECKPOINT))
                .map(Object::toString);
    }

    @Override
    public boolean updateCheckpoint(String userId, String integrationId, String checkpoint) {
        Query query = Query.query(Criteria.where("_id").is(integrationId).and("userId").is(userId));
        Update update = new Update()
                .set("settings." + Integration.SETTING_CHECKPOINT, checkpoint)
                .set("updatedAt", Instant.now());

        UpdateResult result = mongoTemplate.updateFirst(query, update, Integration.class);
        return result.getMatchedCount() > 0;
    }

}
