package com.example.autocheckin.client;

import lombok.Builder;
import lombok.Value;

/**
 * What a single remote action produced.
 */
@Value
@Builder
public class MessengerOutcome {

    /**
     * Raw shape of the remote answer, for debugging
     */
    String responseShape;

    String replyText;

    String url;

    public boolean hasReply() {
        return replyText != null && !replyText.isBlank();
    }

    public boolean hasUrl() {
        return url != null && !url.isBlank();
    }
}
