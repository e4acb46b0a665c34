package io.github.drompincen.autopilot.persistence.repository;

import io.github.drompincen.autopilot.persistence.document.ScheduledActionDocument;
import org.springframework.data.mongodb.repository.MongoRepository;

import java.util.List;

public interface ScheduledActionRepository extends MongoRepository<ScheduledActionDocument, String> {
    List<ScheduledActionDocument> findByEnabled(boolean enabled);
    List<ScheduledActionDocument> findByOwnerId(String ownerId);
}
