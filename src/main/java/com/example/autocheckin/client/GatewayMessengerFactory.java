package com.example.autocheckin.client;

import com.example.autocheckin.client.ClientModels.ConnectRequest;
import com.example.autocheckin.domain.model.AppCredentials;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Opens gateway-backed messenger sessions.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class GatewayMessengerFactory implements MessengerFactory {

    private final MessengerGatewayClient client;

    @Override
    public MessengerSession open(String sessionName, AppCredentials credentials, String proxy) {
        client.connect(sessionName, ConnectRequest.builder()
                .appId(credentials.getAppId())
                .appHash(credentials.getAppHash())
                .proxy(proxy)
                .build());
        log.debug("Session {} connected{}", sessionName, proxy != null && !proxy.isBlank() ? " via proxy" : "");
        return new GatewayMessengerSession(sessionName, client, GatewayMessengerSession.Sleeper.threadSleep());
    }
}
