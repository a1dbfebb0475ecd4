package com.example.autocheckin.service.handler;

import com.example.autocheckin.client.MessengerOutcome;
import com.example.autocheckin.domain.enums.ResponseType;
import lombok.Builder;
import lombok.Data;

/**
 * Result of one successful task execution.
 * <p>
 * Failures are not represented here; they propagate as exceptions.
 */
@Data
@Builder
public class TaskOutcome {

    /**
     * Classification of the remote answer
     */
    private ResponseType responseType;

    /**
     * Reply text extracted from the remote side, if any
     */
    private String replyText;

    /**
     * URL returned by a button callback, if any
     */
    private String url;

    /**
     * Raw response shape reported by the messenger
     */
    private String responseShape;

    /**
     * Classify a messenger outcome: reply text wins over URL, otherwise no reply
     */
    public static TaskOutcome from(MessengerOutcome outcome) {
        if (outcome == null) {
            return noReply();
        }
        var type = outcome.hasReply() ? ResponseType.REPLY
                : outcome.hasUrl() ? ResponseType.URL
                : ResponseType.NO_REPLY;
        return TaskOutcome.builder()
                .responseType(type)
                .replyText(outcome.getReplyText())
                .url(outcome.getUrl())
                .responseShape(outcome.getResponseShape())
                .build();
    }

    public static TaskOutcome noReply() {
        return TaskOutcome.builder().responseType(ResponseType.NO_REPLY).build();
    }
}
