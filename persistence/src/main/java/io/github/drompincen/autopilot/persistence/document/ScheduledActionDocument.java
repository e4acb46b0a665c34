package io.github.drompincen.autopilot.persistence.document;

import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.index.Indexed;
import org.springframework.data.mongodb.core.mapping.Document;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

@Document(collection = "scheduled_actions")
public class ScheduledActionDocument {

    @Id
    private String id;
    @Indexed
    private String ownerId;
    private String name;
    private String description;
    private String actionType;
    // Stored as given by the client; owned by the executor for actionType
    private Map<String, Object> actionConfig = new LinkedHashMap<>();
    private String scheduleType;
    private Map<String, Object> scheduleConfig = new LinkedHashMap<>();
    @Indexed
    private boolean enabled = true;
    private Instant lastRunAt;
    private Instant nextRunAt;
    private Instant createdAt;
    private Instant updatedAt;

    public ScheduledActionDocument() {}

    public String getId() { return id; }
    public void setId(String id) { this.id = id; }

    public String getOwnerId() { return ownerId; }
    public void setOwnerId(String ownerId) { this.ownerId = ownerId; }

    public String getName() { return name; }
    public void setName(String name) { this.name = name; }

    public String getDescription() { return description; }
    public void setDescription(String description) { this.description = description; }

    public String getActionType() { return actionType; }
    public void setActionType(String actionType) { this.actionType = actionType; }

    public Map<String, Object> getActionConfig() { return actionConfig; }
    public void setActionConfig(Map<String, Object> actionConfig) { this.actionConfig = actionConfig; }

    public String getScheduleType() { return scheduleType; }
    public void setScheduleType(String scheduleType) { this.scheduleType = scheduleType; }

    public Map<String, Object> getScheduleConfig() { return scheduleConfig; }
    public void setScheduleConfig(Map<String, Object> scheduleConfig) { this.scheduleConfig = scheduleConfig; }

    public boolean isEnabled() { return enabled; }
    public void setEnabled(boolean enabled) { this.enabled = enabled; }

    public Instant getLastRunAt() { return lastRunAt; }
    public void setLastRunAt(Instant lastRunAt) { this.lastRunAt = lastRunAt; }

    public Instant getNextRunAt() { return nextRunAt; }
    public void setNextRunAt(Instant nextRunAt) { this.nextRunAt = nextRunAt; }

    public Instant getCreatedAt() { return createdAt; }
    public void setCreatedAt(Instant createdAt) { this.createdAt = createdAt; }

    public Instant getUpdatedAt() { return updatedAt; }
    public void setUpdatedAt(Instant updatedAt) { this.updatedAt = updatedAt; }
}
