package io.github.drompincen.autopilot.persistence.repository;

import io.github.drompincen.autopilot.persistence.document.NotificationDocument;
import org.springframework.data.mongodb.repository.MongoRepository;

public interface NotificationRepository extends MongoRepository<NotificationDocument, String> {
}
