package io.github.drompincen.autopilot.protocol.api;

/**
 * Built-in action type tags. The set is open: any tag with a registered executor is valid.
 */
public final class ActionTypes {

    public static final String WEB_SEARCH = "web_search";
    public static final String CHAT_COMPLETION = "chat_completion";
    public static final String NOTIFICATION = "notification";

    private ActionTypes() {}
}
