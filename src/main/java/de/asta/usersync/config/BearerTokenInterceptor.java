package de.asta.usersync.config;

import de.asta.usersync.client.CredentialProvider;
import de.asta.usersync.client.CredentialProvider.BearerCredential;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpRequest;
import org.springframework.http.client.ClientHttpRequestExecution;
import org.springframework.http.client.ClientHttpRequestInterceptor;
import org.springframework.http.client.ClientHttpResponse;
import org.springframework.lang.NonNull;

import java.io.IOException;
import java.util.function.LongSupplier;

/**
 * Adds {@code Authorization: Bearer ...} to every request. The credential is acquired on the
 * first request and reused until its reported lifetime, minus a small margin, has passed.
 */
@Slf4j
public class BearerTokenInterceptor implements ClientHttpRequestInterceptor {

    static final long REFRESH_MARGIN_SECONDS = 5L;

    private final CredentialProvider credentialProvider;
    private final LongSupplier currentTimeMillis;

    private String cachedToken;
    private long tokenFetchTime;
    private long expiresInSeconds;

    public BearerTokenInterceptor(CredentialProvider credentialProvider) {
        this(credentialProvider, System::currentTimeMillis);
    }

    BearerTokenInterceptor(CredentialProvider credentialProvider, LongSupplier currentTimeMillis) {
        this.credentialProvider = credentialProvider;
        this.currentTimeMillis = currentTimeMillis;
    }

    private synchronized String token() {
        long now = currentTimeMillis.getAsLong();
        boolean expired = cachedToken == null
                || (expiresInSeconds > 0 && now - tokenFetchTime >= (expiresInSeconds - REFRESH_MARGIN_SECONDS) * 1000);
        if (expired) {
            BearerCredential credential = credentialProvider.acquire();
            cachedToken = credential.token();
            tokenFetchTime = now;
            expiresInSeconds = credential.expiresInSeconds();
            log.debug("Acquired bearer credential (expires in {}s)", expiresInSeconds);
        }
        return cachedToken;
    }

    @Override
    @NonNull
    public ClientHttpResponse intercept(@NonNull HttpRequest request,
                                        @NonNull byte[] body,
                                        @NonNull ClientHttpRequestExecution execution) throws IOException {
        request.getHeaders().setBearerAuth(token());
        log.debug("{} {}", request.getMethod(), request.getURI());
        return execution.execute(request, body);
    }
}
