package com.example.autocheckin.service.handler;

import com.example.autocheckin.client.Messenger;
import com.example.autocheckin.domain.model.ReplyPolicy;
import com.example.autocheckin.domain.model.Task;
import com.example.autocheckin.exception.TaskExecutionException;
import com.example.autocheckin.exception.UnknownMethodException;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.springframework.stereotype.Component;

/**
 * Stateless dispatch of one task execution to the handler of its method.
 * <p>
 * A single attempt per invocation, no retries.
 *
 * @see TaskHandlerRegistry
 */
@Component
@RequiredArgsConstructor
public class TaskRunner {

    private final TaskHandlerRegistry handlerRegistry;

    /**
     * @throws UnknownMethodException  if the task's method is neither message nor button
     * @throws TaskExecutionException  if validation or the remote action fails
     */
    public TaskOutcome run(Task task, Messenger messenger, ReplyPolicy replyPolicy, Logger taskLog) {
        var handler = handlerRegistry.getHandlerOrThrow(task.requireMethod());

        try {
            handler.validate(task);
            return handler.execute(task, messenger, replyPolicy, taskLog);
        } catch (TaskExecutionException e) {
            throw e;
        } catch (RuntimeException e) {
            throw new TaskExecutionException(task.getDisplayName(), e);
        }
    }
}
