package com.example.autocheckin.config;

import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;
import org.springframework.validation.annotation.Validated;

/**
 * Messenger gateway connection properties
 */
@Data
@Validated
@Configuration
@ConfigurationProperties(prefix = "messenger-gateway")
public class MessengerGatewayProperties {
    @NotBlank
    private String baseUrl = "http://localhost:8081";
    @Min(1)
    private int timeoutSeconds = 30;
}
