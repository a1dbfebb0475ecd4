package com.example.autocheckin.client;

import com.example.autocheckin.client.ClientModels.AuthRequest;
import com.example.autocheckin.client.ClientModels.ButtonClickRequest;
import com.example.autocheckin.client.ClientModels.HistoryMessage;
import com.example.autocheckin.client.ClientModels.SendMessageRequest;
import com.example.autocheckin.domain.model.ReplyPolicy;
import com.example.autocheckin.exception.AuthException;
import com.example.autocheckin.exception.MessengerException;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.Logger;

import java.time.Duration;

/**
 * One account's session on the messenger gateway.
 * <p>
 * Stateless apart from the session name, so concurrent use by several
 * workers is safe as long as the gateway serialises per-session protocol
 * access, which it does.
 */
@Slf4j
public class GatewayMessengerSession implements MessengerSession {

    @Getter
    private final String sessionName;
    private final MessengerGatewayClient client;
    private final Sleeper sleeper;

    GatewayMessengerSession(String sessionName, MessengerGatewayClient client, Sleeper sleeper) {
        this.sessionName = sessionName;
        this.client = client;
        this.sleeper = sleeper;
    }

    @Override
    public void authenticate(String phone, String password) {
        try {
            var response = client.authenticate(sessionName, AuthRequest.builder()
                    .phone(phone)
                    .password(password)
                    .build());
            if (response == null) {
                throw new AuthException(sessionName, "empty response from gateway");
            }
            if (!response.isAuthorized()) {
                if (response.getLoginUrl() != null && !response.getLoginUrl().isBlank()) {
                    log.info("Please scan this link with the messenger app on your phone: {}", response.getLoginUrl());
                }
                throw new AuthException(sessionName, response.getMessage() != null ? response.getMessage() : "not authorized");
            }
            log.info("Logged in as {}", response.getUser() != null ? response.getUser() : sessionName);
        } catch (MessengerException e) {
            throw new AuthException(sessionName, e);
        }
    }

    @Override
    public MessengerOutcome sendText(String target, String text, ReplyPolicy replyPolicy) {
        return sendText(target, text, replyPolicy, log);
    }

    @Override
    public MessengerOutcome sendText(String target, String text, ReplyPolicy replyPolicy, Logger taskLog) {
        var sent = client.sendMessage(sessionName, SendMessageRequest.builder()
                .target(target)
                .text(text)
                .build());
        var shape = sent != null ? sent.getResponseShape() : null;
        taskLog.debug("Message sent to {} (response: {})", target, shape);

        taskLog.info("Waiting for reply... ({}s)", replyPolicy.getWaitSeconds());
        sleeper.sleep(replyPolicy.getWaitDuration());

        var history = client.history(sessionName, target, replyPolicy.getHistoryLimit());
        var sentId = sent != null && sent.getMessageId() != null ? sent.getMessageId() : 0L;
        String reply = null;
        if (history != null && history.getMessages() != null) {
            // history is newest first
            reply = history.getMessages().stream()
                    .filter(m -> !m.isOutgoing() && m.getId() > sentId)
                    .map(HistoryMessage::getText)
                    .filter(t -> t != null && !t.isBlank())
                    .findFirst()
                    .orElse(null);
        }

        return MessengerOutcome.builder()
                .responseShape(shape)
                .replyText(reply)
                .build();
    }

    @Override
    public MessengerOutcome clickButton(String target, String buttonLabel, ReplyPolicy replyPolicy) {
        return clickButton(target, buttonLabel, replyPolicy, log);
    }

    @Override
    public MessengerOutcome clickButton(String target, String buttonLabel, ReplyPolicy replyPolicy, Logger taskLog) {
        var answer = client.clickButton(sessionName, ButtonClickRequest.builder()
                .target(target)
                .buttonText(buttonLabel)
                .historyLimit(replyPolicy.getHistoryLimit())
                .build());
        if (answer == null) {
            throw new MessengerException("click-button", "empty response from gateway");
        }
        taskLog.debug("Button '{}' clicked on message {} (alert: {}, response: {})",
                buttonLabel, answer.getMessageId(), answer.isAlert(), answer.getResponseShape());

        return MessengerOutcome.builder()
                .responseShape(answer.getResponseShape())
                .replyText(answer.getMessage())
                .url(answer.getUrl())
                .build();
    }

    @Override
    public void close() {
        try {
            client.disconnect(sessionName);
        } catch (Exception e) {
            log.warn("Failed to disconnect session {}: {}", sessionName, e.getMessage());
        }
    }

    /**
     * Blocking wait between sending and reading the reply
     */
    @FunctionalInterface
    interface Sleeper {
        void sleep(Duration duration);

        static Sleeper threadSleep() {
            return duration -> {
                try {
                    Thread.sleep(duration.toMillis());
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    throw new MessengerException("wait-reply", "interrupted while waiting for reply", e);
                }
            };
        }
    }
}
