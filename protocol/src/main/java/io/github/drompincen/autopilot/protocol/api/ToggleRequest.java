package io.github.drompincen.autopilot.protocol.api;

public record ToggleRequest(boolean enabled) {}
