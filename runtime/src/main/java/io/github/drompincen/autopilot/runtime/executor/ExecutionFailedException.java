package io.github.drompincen.autopilot.runtime.executor;

public class ExecutionFailedException extends RuntimeException {

    public ExecutionFailedException(String reason) {
        super(reason);
    }

    public ExecutionFailedException(String reason, Throwable cause) {
        super(reason, cause);
    }
}
