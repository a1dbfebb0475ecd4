package com.example.autocheckin.client;

import com.example.autocheckin.client.ClientModels.AuthRequest;
import com.example.autocheckin.client.ClientModels.AuthResponse;
import com.example.autocheckin.client.ClientModels.ButtonClickRequest;
import com.example.autocheckin.client.ClientModels.ButtonClickResponse;
import com.example.autocheckin.client.ClientModels.ConnectRequest;
import com.example.autocheckin.client.ClientModels.HistoryResponse;
import com.example.autocheckin.client.ClientModels.SendMessageRequest;
import com.example.autocheckin.client.ClientModels.SendMessageResponse;
import com.example.autocheckin.config.MessengerGatewayProperties;
import com.example.autocheckin.exception.MessengerException;
import io.github.resilience4j.circuitbreaker.annotation.CircuitBreaker;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.http.HttpStatusCode;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;

import java.time.Duration;

/**
 * Client for the messenger gateway API.
 * <p>
 * The gateway holds the network-level protocol sessions; this client only
 * addresses them by session name. A circuit breaker fails calls fast while the
 * gateway is down. There are no retries: every call is a single attempt.
 */
@Slf4j
@Component
public class MessengerGatewayClient {

    private static final String GATEWAY = "Messenger Gateway";

    private final WebClient webClient;
    private final Duration timeout;

    public MessengerGatewayClient(@Qualifier("messengerGatewayWebClient") WebClient webClient,
                                  MessengerGatewayProperties properties) {
        this.webClient = webClient;
        this.timeout = Duration.ofSeconds(properties.getTimeoutSeconds());
    }

    @CircuitBreaker(name = "messengerGateway")
    public void connect(String session, ConnectRequest request) {
        log.debug("Connecting gateway session {}", session);
        call("connect", webClient.post()
                .uri("/api/v1/sessions/{session}/connect", session)
                .bodyValue(request)
                .retrieve()
                .onStatus(HttpStatusCode::isError, response -> response.bodyToMono(String.class)
                        .defaultIfEmpty("")
                        .flatMap(body -> Mono.error(new MessengerException("connect", response.statusCode().value(), body))))
                .toBodilessEntity());
    }

    @CircuitBreaker(name = "messengerGateway")
    public AuthResponse authenticate(String session, AuthRequest request) {
        log.debug("Authenticating gateway session {}", session);
        return call("auth", webClient.post()
                .uri("/api/v1/sessions/{session}/auth", session)
                .bodyValue(request)
                .retrieve()
                .onStatus(HttpStatusCode::isError, response -> response.bodyToMono(String.class)
                        .defaultIfEmpty("")
                        .flatMap(body -> Mono.error(new MessengerException("auth", response.statusCode().value(), body))))
                .bodyToMono(AuthResponse.class));
    }

    @CircuitBreaker(name = "messengerGateway")
    public SendMessageResponse sendMessage(String session, SendMessageRequest request) {
        return call("send-message", webClient.post()
                .uri("/api/v1/sessions/{session}/messages", session)
                .bodyValue(request)
                .retrieve()
                .onStatus(HttpStatusCode::isError, response -> response.bodyToMono(String.class)
                        .defaultIfEmpty("")
                        .flatMap(body -> Mono.error(new MessengerException("send-message", response.statusCode().value(), body))))
                .bodyToMono(SendMessageResponse.class));
    }

    @CircuitBreaker(name = "messengerGateway")
    public HistoryResponse history(String session, String target, int limit) {
        return call("history", webClient.get()
                .uri(uri -> uri.path("/api/v1/sessions/{session}/history")
                        .queryParam("target", target)
                        .queryParam("limit", limit)
                        .build(session))
                .retrieve()
                .onStatus(HttpStatusCode::isError, response -> response.bodyToMono(String.class)
                        .defaultIfEmpty("")
                        .flatMap(body -> Mono.error(new MessengerException("history", response.statusCode().value(), body))))
                .bodyToMono(HistoryResponse.class));
    }

    @CircuitBreaker(name = "messengerGateway")
    public ButtonClickResponse clickButton(String session, ButtonClickRequest request) {
        return call("click-button", webClient.post()
                .uri("/api/v1/sessions/{session}/buttons/click", session)
                .bodyValue(request)
                .retrieve()
                .onStatus(HttpStatusCode::isError, response -> response.bodyToMono(String.class)
                        .defaultIfEmpty("")
                        .flatMap(body -> Mono.error(new MessengerException("click-button", response.statusCode().value(), body))))
                .bodyToMono(ButtonClickResponse.class));
    }

    public void disconnect(String session) {
        call("disconnect", webClient.delete()
                .uri("/api/v1/sessions/{session}", session)
                .retrieve()
                .toBodilessEntity());
    }

    private <T> T call(String operation, Mono<T> request) {
        try {
            return request.timeout(timeout).block();
        } catch (MessengerException e) {
            throw e;
        } catch (Exception e) {
            log.error("[{}] {} failed: {}", GATEWAY, operation, e.getMessage());
            throw new MessengerException(operation, e);
        }
    }
}
