package io.github.drompincen.autopilot.runtime.executor;

import java.util.Map;

/**
 * Performs the side effect of one action type. Implementations read their own config
 * shape, ignore unknown fields, and never touch scheduling bookkeeping.
 */
public interface ActionExecutor {

    /** The action type tag this executor handles, e.g. {@code web_search}. */
    String actionType();

    /**
     * @throws ExecutionFailedException when the side effect could not be performed
     */
    ExecutionResult execute(Map<String, Object> config, ExecutionContext context);
}
