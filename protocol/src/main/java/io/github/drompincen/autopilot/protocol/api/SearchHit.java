package io.github.drompincen.autopilot.protocol.api;

public record SearchHit(
        String title,
        String link,
        String snippet
) {}
