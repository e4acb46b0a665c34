package io.github.drompincen.autopilot.runtime.executor;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.*;
import java.util.concurrent.ConcurrentHashMap;

@Component
public class ExecutorRegistry {

    private static final Logger log = LoggerFactory.getLogger(ExecutorRegistry.class);
    private final Map<String, ActionExecutor> executors = new ConcurrentHashMap<>();

    public ExecutorRegistry(List<ActionExecutor> discovered) {
        discovered.forEach(this::register);
        log.info("Registered {} action executors: {}", executors.size(), new TreeSet<>(executors.keySet()));
    }

    public void register(ActionExecutor executor) {
        register(executor.actionType(), executor);
    }

    public void register(String actionType, ActionExecutor executor) {
        ActionExecutor previous = executors.put(actionType, executor);
        if (previous != null && previous != executor) {
            log.warn("Executor for '{}' replaced: {} -> {}", actionType,
                    previous.getClass().getSimpleName(), executor.getClass().getSimpleName());
        }
        log.debug("Registered executor: {}", actionType);
    }

    public Optional<ActionExecutor> lookup(String actionType) {
        if (actionType == null) return Optional.empty();
        return Optional.ofNullable(executors.get(actionType));
    }

    public ActionExecutor require(String actionType) {
        return lookup(actionType).orElseThrow(() -> new UnknownActionTypeException(actionType));
    }

    public Set<String> registeredTypes() {
        return Collections.unmodifiableSet(new TreeSet<>(executors.keySet()));
    }
}
