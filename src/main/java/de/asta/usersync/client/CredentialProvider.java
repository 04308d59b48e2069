package de.asta.usersync.client;

/**
 * Obtains the bearer credential used to talk to a backend.
 */
public interface CredentialProvider {

    /**
     * @throws de.asta.usersync.exception.AuthException if no credential can be obtained
     */
    BearerCredential acquire();

    /**
     * @param expiresInSeconds lifetime reported by the issuer, {@code 0} if the token does not expire
     */
    record BearerCredential(String token, long expiresInSeconds) {

        public BearerCredential(String token) {
            this(token, 0L);
        }

        @Override
        public String toString() {
            return "BearerCredential[****]";
        }
    }
}
