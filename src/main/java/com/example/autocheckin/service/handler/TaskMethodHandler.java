package com.example.autocheckin.service.handler;

import com.example.autocheckin.client.Messenger;
import com.example.autocheckin.domain.enums.TaskMethod;
import com.example.autocheckin.domain.model.ReplyPolicy;
import com.example.autocheckin.domain.model.Task;
import org.slf4j.Logger;

/**
 * Interface for task method handlers.
 * <p>
 * Each task method has one handler that knows which messenger operation to invoke.
 * <p>
 * Handlers should:
 * - Be stateless
 * - Make exactly one attempt
 * - Let messenger failures propagate
 */
public interface TaskMethodHandler {

    /**
     * Get the method this handler supports
     */
    TaskMethod getMethod();

    /**
     * Perform the task's remote action
     *
     * @param task        The task snapshot
     * @param messenger   The account's messenger session
     * @param replyPolicy Resolved reply policy for this task
     * @param taskLog     Logger for progress events of this execution
     * @return Classified outcome of the action
     */
    TaskOutcome execute(Task task, Messenger messenger, ReplyPolicy replyPolicy, Logger taskLog);

    /**
     * Validate task before execution (optional override)
     *
     * @throws IllegalArgumentException if validation fails
     */
    default void validate(Task task) {
        if (task.getTarget() == null || task.getTarget().isBlank()) {
            throw new IllegalArgumentException("Task target is required");
        }
    }
}
