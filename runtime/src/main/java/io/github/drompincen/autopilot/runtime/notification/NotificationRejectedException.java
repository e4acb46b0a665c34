package io.github.drompincen.autopilot.runtime.notification;

public class NotificationRejectedException extends RuntimeException {

    public NotificationRejectedException(String message) {
        super(message);
    }
}
