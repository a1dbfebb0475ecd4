package com.example.autocheckin.client;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * Request/Response DTOs for the messenger gateway
 */
public class ClientModels {
    private ClientModels() {
    }

    // === Session Models ===

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class ConnectRequest {
        private int appId;
        private String appHash;
        private String proxy;
    }

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class AuthRequest {
        private String phone;
        private String password;
    }

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class AuthResponse {
        private boolean authorized;
        private String user;
        /**
         * QR login link when the session needs to be confirmed on another device
         */
        private String loginUrl;
        private String message;
    }

    // === Message Models ===

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class SendMessageRequest {
        private String target;
        private String text;
    }

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class SendMessageResponse {
        private Long messageId;
        /**
         * Shape of the raw update the remote side answered with
         */
        private String responseShape;
    }

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class HistoryMessage {
        private long id;
        private boolean outgoing;
        private String text;
        private String date;
    }

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class HistoryResponse {
        private List<HistoryMessage> messages = new ArrayList<>();
    }

    // === Button Models ===

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class ButtonClickRequest {
        private String target;
        private String buttonText;
        private int historyLimit;
    }

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class ButtonClickResponse {
        private Long messageId;
        private String message;
        private String url;
        private boolean alert;
        private String responseShape;
    }
}
