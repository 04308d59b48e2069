package de.asta.usersync.client.impl;

import de.asta.usersync.client.CredentialProvider;
import de.asta.usersync.config.UserSyncProperties;
import de.asta.usersync.exception.AuthException;
import de.asta.usersync.model.dto.TokenResponse;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.util.LinkedMultiValueMap;
import org.springframework.util.MultiValueMap;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;

import java.util.List;

/**
 * Fetches an admin access token from Keycloak with the OAuth2 resource owner password grant.
 */
@Slf4j
public class KeycloakPasswordGrantCredentialProvider implements CredentialProvider {

    private final RestTemplate restTemplate;
    private final UserSyncProperties.Keycloak keycloak;

    public KeycloakPasswordGrantCredentialProvider(RestTemplate restTemplate, UserSyncProperties.Keycloak keycloak) {
        this.restTemplate = restTemplate;
        this.keycloak = keycloak;
    }

    String tokenUrl() {
        return keycloak.getUrl() + "/realms/" + keycloak.getAuthRealm() + "/protocol/openid-connect/token";
    }

    @Override
    public BearerCredential acquire() {
        String url = tokenUrl();
        log.info("Fetching Keycloak access token from {}", url);

        HttpHeaders headers = new HttpHeaders();
        headers.setContentType(MediaType.APPLICATION_FORM_URLENCODED);
        headers.setAccept(List.of(MediaType.APPLICATION_JSON));

        MultiValueMap<String, String> form = new LinkedMultiValueMap<>();
        form.add("grant_type", "password");
        form.add("client_id", keycloak.getClientId());
        form.add("username", keycloak.getUsername());
        form.add("password", keycloak.getPassword());

        ResponseEntity<TokenResponse> response;
        try {
            response = restTemplate.postForEntity(url, new HttpEntity<>(form, headers), TokenResponse.class);
        } catch (RestClientException e) {
            throw new AuthException("Keycloak token request to " + url + " failed", e);
        }

        TokenResponse body = response.getBody();
        if (body == null || body.accessToken() == null) {
            log.error("Keycloak token response without access token. Status: {}", response.getStatusCode());
            throw new AuthException("Keycloak token response did not contain an access token");
        }
        log.info("Fetched Keycloak access token successfully (expires in {}s)", body.expiresIn());
        return new BearerCredential(body.accessToken(), body.expiresIn() != null ? body.expiresIn() : 0L);
    }
}
