package io.github.drompincen.autopilot.persistence.repository;

import io.github.drompincen.autopilot.persistence.document.MemoryDocument;
import org.springframework.data.mongodb.repository.MongoRepository;

public interface MemoryRepository extends MongoRepository<MemoryDocument, String> {
}
