package com.example.autocheckin.client;

import com.example.autocheckin.domain.model.ReplyPolicy;
import org.slf4j.Logger;

/**
 * Remote actions against an authenticated messenger session.
 * <p>
 * Implementations must be safe for concurrent use by all workers of one account.
 * Each call is a single attempt; failures surface as exceptions.
 */
public interface Messenger {

    /**
     * Send text to the target and look for a reply according to the policy.
     */
    MessengerOutcome sendText(String target, String text, ReplyPolicy replyPolicy);

    /**
     * Click the button labelled {@code buttonLabel} in the target's latest messages.
     */
    MessengerOutcome clickButton(String target, String buttonLabel, ReplyPolicy replyPolicy);

    /**
     * Variant that reports progress to a task-specific logger as well.
     */
    default MessengerOutcome sendText(String target, String text, ReplyPolicy replyPolicy, Logger taskLog) {
        return sendText(target, text, replyPolicy);
    }

    /**
     * Variant that reports progress to a task-specific logger as well.
     */
    default MessengerOutcome clickButton(String target, String buttonLabel, ReplyPolicy replyPolicy, Logger taskLog) {
        return clickButton(target, buttonLabel, replyPolicy);
    }
}
