package io.github.drompincen.autopilot.runtime.action;

import io.github.drompincen.autopilot.persistence.document.ScheduledActionDocument;
import io.github.drompincen.autopilot.persistence.repository.ScheduledActionRepository;
import io.github.drompincen.autopilot.protocol.api.JobStatusDto;
import io.github.drompincen.autopilot.protocol.api.ScheduleType;
import io.github.drompincen.autopilot.protocol.api.ScheduledActionRequest;
import io.github.drompincen.autopilot.protocol.api.ScheduledActionUpdateRequest;
import io.github.drompincen.autopilot.runtime.executor.ExecutionResult;
import io.github.drompincen.autopilot.runtime.executor.ExecutorRegistry;
import io.github.drompincen.autopilot.runtime.scheduler.ActionJobRegistry;
import io.github.drompincen.autopilot.runtime.scheduler.ActionNotFoundException;
import io.github.drompincen.autopilot.runtime.scheduler.InvalidScheduleConfigException;
import io.github.drompincen.autopilot.runtime.scheduler.ScheduleCalculator;
import io.github.drompincen.autopilot.runtime.scheduler.ScheduledActionStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

/**
 * Lifecycle of scheduled actions. Every mutation is persisted first and then handed to
 * the {@link ActionJobRegistry}, so the armed timers follow the stored records. Edits go
 * through {@link ScheduledActionStore#updateSettings} and never rewrite run bookkeeping.
 */
@Service
public class ScheduledActionService {

    private static final Logger log = LoggerFactory.getLogger(ScheduledActionService.class);

    private final ScheduledActionRepository repository;
    private final ScheduledActionStore store;
    private final ActionJobRegistry jobRegistry;
    private final ScheduleCalculator calculator;
    private final ExecutorRegistry executorRegistry;
    private final Clock clock;

    public ScheduledActionService(ScheduledActionRepository repository,
                                  ScheduledActionStore store,
                                  ActionJobRegistry jobRegistry,
                                  ScheduleCalculator calculator,
                                  ExecutorRegistry executorRegistry,
                                  Clock clock) {
        this.repository = repository;
        this.store = store;
        this.jobRegistry = jobRegistry;
        this.calculator = calculator;
        this.executorRegistry = executorRegistry;
        this.clock = clock;
    }

    /**
     * @throws IllegalArgumentException        if the name is missing
     * @throws InvalidScheduleConfigException  if the schedule does not parse, or a one-time
     *                                         schedule lies in the past
     * @throws io.github.drompincen.autopilot.runtime.executor.UnknownActionTypeException
     *                                         if no executor handles the action type
     */
    public ScheduledActionDocument create(String ownerId, ScheduledActionRequest req) {
        if (req.name() == null || req.name().isBlank()) {
            throw new IllegalArgumentException("name is required");
        }
        executorRegistry.require(req.actionType());
        ScheduleType type = ScheduleCalculator.requireType(req.scheduleType());
        checkSchedule(type, req.scheduleConfig());

        Instant now = clock.instant();
        ScheduledActionDocument doc = new ScheduledActionDocument();
        doc.setId(UUID.randomUUID().toString());
        doc.setOwnerId(ownerId);
        doc.setName(req.name());
        doc.setDescription(req.description());
        doc.setActionType(req.actionType());
        doc.setActionConfig(copy(req.actionConfig()));
        doc.setScheduleType(type.wireName());
        doc.setScheduleConfig(copy(req.scheduleConfig()));
        doc.setEnabled(req.enabled() != null ? req.enabled() : true);
        doc.setCreatedAt(now);
        doc.setUpdatedAt(now);
        repository.save(doc);
        log.info("Created scheduled action '{}' (id={}, type={}, user={})",
                doc.getName(), doc.getId(), doc.getActionType(), ownerId);

        jobRegistry.reconcileOne(doc.getId());
        // Reload to pick up the nextRunAt written while arming
        return repository.findById(doc.getId()).orElse(doc);
    }

    /**
     * Partial update; only non-null request fields change. The schedule is revalidated
     * when it changes, and re-enabling a one-time action whose instant has passed is
     * rejected like creating one.
     */
    public ScheduledActionDocument update(String actionId, ScheduledActionUpdateRequest req) {
        ScheduledActionDocument doc = require(actionId);
        boolean wasEnabled = doc.isEnabled();

        if (req.name() != null) {
            if (req.name().isBlank()) throw new IllegalArgumentException("name must not be blank");
            doc.setName(req.name());
        }
        if (req.description() != null) doc.setDescription(req.description());
        if (req.actionConfig() != null) doc.setActionConfig(copy(req.actionConfig()));

        boolean scheduleChanged = req.scheduleType() != null || req.scheduleConfig() != null;
        if (scheduleChanged) {
            ScheduleType type = ScheduleCalculator.requireType(
                    req.scheduleType() != null ? req.scheduleType() : doc.getScheduleType());
            Map<String, Object> config = req.scheduleConfig() != null ? req.scheduleConfig() : doc.getScheduleConfig();
            checkSchedule(type, config);
            doc.setScheduleType(type.wireName());
            doc.setScheduleConfig(copy(config));
        }
        if (req.enabled() != null) doc.setEnabled(req.enabled());
        if (!scheduleChanged && doc.isEnabled() && !wasEnabled) {
            requireUpcoming(ScheduleCalculator.requireType(doc.getScheduleType()), doc.getScheduleConfig());
        }
        doc.setUpdatedAt(clock.instant());
        saveSettings(doc);
        log.info("Updated scheduled action {} (scheduleChanged={})", actionId, scheduleChanged);

        jobRegistry.reconcileOne(actionId);
        return repository.findById(actionId).orElse(doc);
    }

    public ScheduledActionDocument toggle(String actionId, boolean enabled) {
        ScheduledActionDocument doc = require(actionId);
        if (enabled && !doc.isEnabled()) {
            requireUpcoming(ScheduleCalculator.requireType(doc.getScheduleType()), doc.getScheduleConfig());
        }
        doc.setEnabled(enabled);
        doc.setUpdatedAt(clock.instant());
        saveSettings(doc);
        log.info("Scheduled action {} {}", actionId, enabled ? "enabled" : "disabled");

        jobRegistry.reconcileOne(actionId);
        return repository.findById(actionId).orElse(doc);
    }

    public void delete(String actionId) {
        if (!repository.existsById(actionId)) {
            throw new ActionNotFoundException(actionId);
        }
        // Delete before disarm so a concurrent sweep cannot re-arm it
        repository.deleteById(actionId);
        jobRegistry.disarm(actionId);
        log.info("Deleted scheduled action {}", actionId);
    }

    public ExecutionResult test(String actionId) {
        return jobRegistry.runNow(actionId);
    }

    public List<ScheduledActionDocument> list(String ownerId) {
        return repository.findByOwnerId(ownerId);
    }

    public List<ScheduledActionDocument> listAll() {
        return repository.findAll();
    }

    public Optional<ScheduledActionDocument> get(String actionId) {
        return repository.findById(actionId);
    }

    public Optional<JobStatusDto> jobStatus(String actionId) {
        return jobRegistry.jobStatus(actionId);
    }

    private ScheduledActionDocument require(String actionId) {
        return repository.findById(actionId).orElseThrow(() -> new ActionNotFoundException(actionId));
    }

    private void saveSettings(ScheduledActionDocument doc) {
        if (!store.updateSettings(doc)) {
            throw new ActionNotFoundException(doc.getId());
        }
    }

    private void checkSchedule(ScheduleType type, Map<String, Object> config) {
        calculator.validate(type, config);
        requireUpcoming(type, config);
    }

    private void requireUpcoming(ScheduleType type, Map<String, Object> config) {
        if (type == ScheduleType.ONCE
                && calculator.computeNextFire(type, config, clock.instant()).isEmpty()) {
            throw new InvalidScheduleConfigException("Scheduled datetime is in the past: " + config.get("datetime"));
        }
    }

    private static Map<String, Object> copy(Map<String, Object> source) {
        return source != null ? new LinkedHashMap<>(source) : new LinkedHashMap<>();
    }
}
