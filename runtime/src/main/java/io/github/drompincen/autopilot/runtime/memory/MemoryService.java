package io.github.drompincen.autopilot.runtime.memory;

import io.github.drompincen.autopilot.persistence.document.MemoryDocument;
import io.github.drompincen.autopilot.persistence.repository.MemoryRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.List;
import java.util.UUID;

/**
 * Long-term memory entries per owner.
 */
@Service
public class MemoryService {

    private static final Logger log = LoggerFactory.getLogger(MemoryService.class);

    private final MemoryRepository memoryRepository;
    private final Clock clock;

    public MemoryService(MemoryRepository memoryRepository, Clock clock) {
        this.memoryRepository = memoryRepository;
        this.clock = clock;
    }

    public MemoryDocument remember(String ownerId, String content, String source, List<String> tags) {
        if (ownerId == null || ownerId.isBlank()) {
            throw new IllegalArgumentException("Memory owner is required");
        }
        MemoryDocument doc = new MemoryDocument();
        doc.setMemoryId(UUID.randomUUID().toString());
        doc.setOwnerId(ownerId);
        doc.setContent(content);
        doc.setSource(source);
        doc.setTags(tags);
        doc.setCreatedAt(clock.instant());
        MemoryDocument saved = memoryRepository.save(doc);
        log.info("Saved memory {} for owner {} (source={})", saved.getMemoryId(), ownerId, source);
        return saved;
    }
}
