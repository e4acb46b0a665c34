package io.github.drompincen.autopilot.runtime.scheduler;

import com.mongodb.client.result.UpdateResult;
import io.github.drompincen.autopilot.persistence.document.ScheduledActionDocument;
import io.github.drompincen.autopilot.persistence.repository.ScheduledActionRepository;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.data.mongodb.core.query.Criteria;
import org.springframework.data.mongodb.core.query.Query;
import org.springframework.data.mongodb.core.query.Update;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

@Component
public class MongoScheduledActionStore implements ScheduledActionStore {

    private final ScheduledActionRepository repository;
    private final MongoTemplate mongoTemplate;
    private final Clock clock;

    public MongoScheduledActionStore(ScheduledActionRepository repository,
                                     MongoTemplate mongoTemplate,
                                     Clock clock) {
        this.repository = repository;
        this.mongoTemplate = mongoTemplate;
        this.clock = clock;
    }

    @Override
    public List<ScheduledActionDocument> listEnabled() {
        return repository.findByEnabled(true);
    }

    @Override
    public Optional<ScheduledActionDocument> get(String actionId) {
        return repository.findById(actionId);
    }

    // Field-level updates so a concurrent edit of name/config is never overwritten
    @Override
    public boolean recordRun(String actionId, Instant lastRunAt, Instant nextRunAt, Boolean enabled) {
        Update update = new Update()
                .set("lastRunAt", lastRunAt)
                .set("nextRunAt", nextRunAt)
                .set("updatedAt", clock.instant());
        if (enabled != null) {
            update.set("enabled", enabled);
        }
        return apply(actionId, update);
    }

    @Override
    public boolean updateSettings(ScheduledActionDocument edited) {
        Update update = new Update()
                .set("name", edited.getName())
                .set("description", edited.getDescription())
                .set("actionConfig", edited.getActionConfig())
                .set("scheduleType", edited.getScheduleType())
                .set("scheduleConfig", edited.getScheduleConfig())
                .set("enabled", edited.isEnabled())
                .set("updatedAt", edited.getUpdatedAt());
        return apply(edited.getId(), update);
    }

    @Override
    public boolean updateNextRun(String actionId, Instant nextRunAt) {
        return apply(actionId, new Update().set("nextRunAt", nextRunAt));
    }

    private boolean apply(String actionId, Update update) {
        UpdateResult result = mongoTemplate.updateFirst(
                Query.query(Criteria.where("_id").is(actionId)), update, ScheduledActionDocument.class);
        return result.getMatchedCount() > 0;
    }
}
