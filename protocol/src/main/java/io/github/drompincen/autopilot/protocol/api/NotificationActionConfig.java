package io.github.drompincen.autopilot.protocol.api;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

@JsonIgnoreProperties(ignoreUnknown = true)
public record NotificationActionConfig(
        String title,
        String message,
        NotificationSeverity type
) {
    public static final String DEFAULT_TITLE = "Scheduled Action";
    public static final String DEFAULT_MESSAGE = "Your scheduled action has completed";

    public String titleOrDefault() {
        return title != null && !title.isBlank() ? title : DEFAULT_TITLE;
    }

    public String messageOrDefault() {
        return message != null && !message.isBlank() ? message : DEFAULT_MESSAGE;
    }

    public NotificationSeverity severityOrDefault() {
        return type != null ? type : NotificationSeverity.INFO;
    }
}
