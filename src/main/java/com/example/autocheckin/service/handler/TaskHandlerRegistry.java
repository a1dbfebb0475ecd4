package com.example.autocheckin.service.handler;

import com.example.autocheckin.domain.enums.TaskMethod;
import jakarta.annotation.PostConstruct;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Registry for task method handlers.
 * <p>
 * Automatically discovers and registers all TaskMethodHandler beans.
 * Provides lookup by task method.
 */
@Slf4j
@Component
public class TaskHandlerRegistry {

    private final Map<TaskMethod, TaskMethodHandler> handlers = new EnumMap<>(TaskMethod.class);
    private final List<TaskMethodHandler> handlerBeans;

    public TaskHandlerRegistry(List<TaskMethodHandler> handlerBeans) {
        this.handlerBeans = handlerBeans;
    }

    @PostConstruct
    public void initialize() {
        for (var handler : handlerBeans) {
            var method = handler.getMethod();
            if (handlers.containsKey(method)) {
                log.warn("Duplicate handler for task method {}: {} will override {}",
                        method, handler.getClass().getSimpleName(),
                        handlers.get(method).getClass().getSimpleName());
            }
            handlers.put(method, handler);
            log.debug("Registered handler for task method {}: {}", method, handler.getClass().getSimpleName());
        }

        for (var method : TaskMethod.values()) {
            if (!handlers.containsKey(method)) {
                log.warn("No handler registered for task method: {}", method);
            }
        }
    }

    public Optional<TaskMethodHandler> getHandler(TaskMethod method) {
        return Optional.ofNullable(handlers.get(method));
    }

    /**
     * @throws IllegalStateException if no handler is registered
     */
    public TaskMethodHandler getHandlerOrThrow(TaskMethod method) {
        return getHandler(method).orElseThrow(() -> new IllegalStateException("No handler registered for task method: " + method));
    }

    public Set<TaskMethod> getRegisteredMethods() {
        return handlers.keySet();
    }
}
