package com.example.autocheckin.service.handler;

import com.example.autocheckin.client.Messenger;
import com.example.autocheckin.domain.enums.TaskMethod;
import com.example.autocheckin.domain.model.ReplyPolicy;
import com.example.autocheckin.domain.model.Task;
import org.slf4j.Logger;
import org.springframework.stereotype.Component;

/**
 * Handler for button tasks: clicks the inline button whose text equals the payload.
 */
@Component
public class ButtonTaskHandler implements TaskMethodHandler {

    @Override
    public TaskMethod getMethod() {
        return TaskMethod.BUTTON;
    }

    @Override
    public void validate(Task task) {
        TaskMethodHandler.super.validate(task);

        if (task.getPayload() == null || task.getPayload().isBlank()) {
            throw new IllegalArgumentException("Button text (payload) is required");
        }
    }

    @Override
    public TaskOutcome execute(Task task, Messenger messenger, ReplyPolicy replyPolicy, Logger taskLog) {
        taskLog.debug("Clicking button '{}' at {}", task.getPayload(), task.getTarget());
        var outcome = messenger.clickButton(task.getTarget(), task.getPayload(), replyPolicy, taskLog);
        return TaskOutcome.from(outcome);
    }
}
