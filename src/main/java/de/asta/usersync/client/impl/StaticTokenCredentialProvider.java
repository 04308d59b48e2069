package de.asta.usersync.client.impl;

import de.asta.usersync.client.CredentialProvider;
import de.asta.usersync.exception.AuthException;

/**
 * Hands out a pre-issued access token from configuration.
 */
public class StaticTokenCredentialProvider implements CredentialProvider {

    private final String backend;
    private final String token;

    public StaticTokenCredentialProvider(String backend, String token) {
        this.backend = backend;
        this.token = token;
    }

    @Override
    public BearerCredential acquire() {
        if (token == null || token.isBlank()) {
            throw new AuthException("No access token configured for " + backend);
        }
        return new BearerCredential(token);
    }
}
