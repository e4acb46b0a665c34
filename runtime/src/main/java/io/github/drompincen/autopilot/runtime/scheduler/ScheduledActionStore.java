package io.github.drompincen.autopilot.runtime.scheduler;

import io.github.drompincen.autopilot.persistence.document.ScheduledActionDocument;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * The scheduler's view of persisted actions. The persisted table is the source of
 * truth. The scheduler writes run bookkeeping through it, and the action service writes
 * user edits, each touching only its own fields.
 */
public interface ScheduledActionStore {

    List<ScheduledActionDocument> listEnabled();

    Optional<ScheduledActionDocument> get(String actionId);

    /**
     * Records a run attempt. {@code nextRunAt} is written as given (null clears it);
     * a null {@code enabled} leaves the flag unchanged.
     *
     * @return false if the action no longer exists
     */
    boolean recordRun(String actionId, Instant lastRunAt, Instant nextRunAt, Boolean enabled);

    /**
     * Writes the user-editable fields of {@code edited}: name, description, action config,
     * schedule and enabled flag. Run bookkeeping is left as stored.
     *
     * @return false if the action no longer exists
     */
    boolean updateSettings(ScheduledActionDocument edited);

    /**
     * Writes only the next fire instant; null clears it.
     *
     * @return false if the action no longer exists
     */
    boolean updateNextRun(String actionId, Instant nextRunAt);
}
