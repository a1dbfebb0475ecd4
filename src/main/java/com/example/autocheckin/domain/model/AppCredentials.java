package com.example.autocheckin.domain.model;

import lombok.Value;

/**
 * Application id/hash pair a messenger session authenticates the client with.
 */
@Value
public class AppCredentials {

    int appId;
    String appHash;

    @Override
    public String toString() {
        return "AppCredentials(appId=" + appId + ", appHash=***)";
    }
}
