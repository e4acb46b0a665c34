package io.github.drompincen.autopilot.runtime.notification;

import io.github.drompincen.autopilot.persistence.document.NotificationDocument;
import io.github.drompincen.autopilot.persistence.repository.NotificationRepository;
import io.github.drompincen.autopilot.protocol.api.NotificationSeverity;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.UUID;

/**
 * Delivers notifications into the owner's inbox.
 */
@Service
public class NotificationService {

    private static final Logger log = LoggerFactory.getLogger(NotificationService.class);
    static final int MAX_TITLE_LENGTH = 200;

    private final NotificationRepository notificationRepository;
    private final Clock clock;

    public NotificationService(NotificationRepository notificationRepository, Clock clock) {
        this.notificationRepository = notificationRepository;
        this.clock = clock;
    }

    /**
     * @throws NotificationRejectedException if there is no recipient, nothing to say,
     *                                       or the title is too long
     */
    public NotificationDocument deliver(String ownerId, String title, String message,
                                        NotificationSeverity severity, String actionId) {
        if (ownerId == null || ownerId.isBlank()) {
            throw new NotificationRejectedException("Notification has no recipient");
        }
        if (isBlank(title) && isBlank(message)) {
            throw new NotificationRejectedException("Notification has neither title nor message");
        }
        if (title != null && title.length() > MAX_TITLE_LENGTH) {
            throw new NotificationRejectedException("Notification title exceeds " + MAX_TITLE_LENGTH + " characters");
        }

        NotificationDocument doc = new NotificationDocument();
        doc.setNotificationId(UUID.randomUUID().toString());
        doc.setOwnerId(ownerId);
        doc.setTitle(title);
        doc.setMessage(message);
        doc.setSeverity(severity != null ? severity : NotificationSeverity.INFO);
        doc.setActionId(actionId);
        doc.setRead(false);
        doc.setCreatedAt(clock.instant());

        NotificationDocument saved = notificationRepository.save(doc);
        log.info("Notification for {}: [{}] {} - {}", ownerId, doc.getSeverity().wireName(), title, message);
        return saved;
    }

    private static boolean isBlank(String s) {
        return s == null || s.isBlank();
    }
}
