package com.example.autocheckin.client;

import com.example.autocheckin.domain.model.AppCredentials;

/**
 * Opens messenger sessions; one per account.
 */
public interface MessengerFactory {

    MessengerSession open(String sessionName, AppCredentials credentials, String proxy);
}
