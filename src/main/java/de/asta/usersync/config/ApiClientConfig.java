package de.asta.usersync.config;

import de.asta.usersync.client.CredentialProvider;
import de.asta.usersync.client.impl.KeycloakPasswordGrantCredentialProvider;
import de.asta.usersync.client.impl.StaticTokenCredentialProvider;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.boot.web.client.RestTemplateBuilder;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.web.client.RestTemplate;

/**
 * One {@link RestTemplate} per remote system, each carrying its own base URL and authentication.
 */
@Configuration
@EnableConfigurationProperties(UserSyncProperties.class)
public class ApiClientConfig {

    private static final Logger logger = LoggerFactory.getLogger(ApiClientConfig.class);

    @Bean
    @ConditionalOnProperty(name = "usersync.keycloak.enabled", havingValue = "true")
    public CredentialProvider keycloakCredentialProvider(RestTemplateBuilder builder, UserSyncProperties properties) {
        return new KeycloakPasswordGrantCredentialProvider(builder.build(), properties.getKeycloak());
    }

    @Bean
    @Qualifier("keycloakRestTemplate")
    @ConditionalOnProperty(name = "usersync.keycloak.enabled", havingValue = "true")
    public RestTemplate keycloakRestTemplate(RestTemplateBuilder builder,
                                             UserSyncProperties properties,
                                             @Qualifier("keycloakCredentialProvider") CredentialProvider credentialProvider) {
        String rootUri = properties.getKeycloak().getUrl() + "/admin/realms/" + properties.getKeycloak().getRealm();
        logger.info("Initializing keycloakRestTemplate for {}", rootUri);
        return builder
                .rootUri(rootUri)
                .defaultHeader(HttpHeaders.ACCEPT, MediaType.APPLICATION_JSON_VALUE)
                .additionalInterceptors(new BearerTokenInterceptor(credentialProvider))
                .build();
    }

    @Bean
    @Qualifier("gitlabRestTemplate")
    @ConditionalOnProperty(name = "usersync.gitlab.enabled", havingValue = "true")
    public RestTemplate gitlabRestTemplate(RestTemplateBuilder builder, UserSyncProperties properties) {
        String rootUri = properties.getGitlab().getUrl() + "/api/v4";
        logger.info("Initializing gitlabRestTemplate for {}", rootUri);
        return builder
                .rootUri(rootUri)
                .defaultHeader(HttpHeaders.ACCEPT, MediaType.APPLICATION_JSON_VALUE)
                .additionalInterceptors(new BearerTokenInterceptor(
                        new StaticTokenCredentialProvider("gitlab", properties.getGitlab().getToken())))
                .build();
    }

    @Bean
    @Qualifier("nextcloudRestTemplate")
    @ConditionalOnProperty(name = "usersync.users-provider.type", havingValue = "nextcloud-table")
    public RestTemplate nextcloudRestTemplate(RestTemplateBuilder builder, UserSyncProperties properties) {
        UserSyncProperties.Nextcloud nextcloud = properties.getUsersProvider().getNextcloud();
        logger.info("Initializing nextcloudRestTemplate for {}", nextcloud.getUrl());
        return builder
                .rootUri(nextcloud.getUrl())
                .basicAuthentication(nextcloud.getUsername(), nextcloud.getPassword())
                .defaultHeader(HttpHeaders.ACCEPT, MediaType.APPLICATION_JSON_VALUE)
                .defaultHeader("OCS-APIRequest", "true")
                .build();
    }
}
