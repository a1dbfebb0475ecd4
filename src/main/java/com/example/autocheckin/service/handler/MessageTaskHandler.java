package com.example.autocheckin.service.handler;

import com.example.autocheckin.client.Messenger;
import com.example.autocheckin.domain.enums.TaskMethod;
import com.example.autocheckin.domain.model.ReplyPolicy;
import com.example.autocheckin.domain.model.Task;
import org.slf4j.Logger;
import org.springframework.stereotype.Component;

/**
 * Handler for message tasks: sends the payload as text to the target.
 */
@Component
public class MessageTaskHandler implements TaskMethodHandler {

    @Override
    public TaskMethod getMethod() {
        return TaskMethod.MESSAGE;
    }

    @Override
    public TaskOutcome execute(Task task, Messenger messenger, ReplyPolicy replyPolicy, Logger taskLog) {
        taskLog.debug("Sending message to {}", task.getTarget());
        var outcome = messenger.sendText(task.getTarget(), task.getPayload(), replyPolicy, taskLog);
        return TaskOutcome.from(outcome);
    }
}
