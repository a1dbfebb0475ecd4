package com.example.autocheckin.client;

/**
 * A long-lived messenger session owned by one account.
 */
public interface MessengerSession extends Messenger, AutoCloseable {

    /**
     * Log the session in. Called once per session before any action.
     *
     * @throws com.example.autocheckin.exception.AuthException if the account cannot be authenticated
     */
    void authenticate(String phone, String password);

    /**
     * Tear the session down; never throws.
     */
    @Override
    void close();
}
