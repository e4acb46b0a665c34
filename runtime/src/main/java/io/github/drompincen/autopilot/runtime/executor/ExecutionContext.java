package io.github.drompincen.autopilot.runtime.executor;

import java.time.Instant;

public record ExecutionContext(
        String ownerId,
        String actionId,
        String actionName,
        Instant firedAt,
        boolean testRun
) {}
