package de.asta.usersync.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Everything an operator configures under {@code usersync.*}.
 */
@Data
@ConfigurationProperties(prefix = "usersync")
public class UserSyncProperties {

    private UsersProvider usersProvider = new UsersProvider();
    private ColumnMapping columnMapping = new ColumnMapping();
    private Keycloak keycloak = new Keycloak();
    private GitLab gitlab = new GitLab();

    @Data
    public static class UsersProvider {
        /** {@code file} or {@code nextcloud-table}. */
        private String type;
        /** Spring resource location of the JSON users file, e.g. {@code file:/etc/usersync/users.json}. */
        private String file;
        private Nextcloud nextcloud = new Nextcloud();
    }

    @Data
    public static class Nextcloud {
        private String url;
        private String username;
        private String password;
        private long tableId;
    }

    /**
     * Column titles of the user table and the mail domain. The titles are the contract with
     * whoever maintains the table.
     */
    @Data
    public static class ColumnMapping {
        private String identifier = "Funktionskennung";
        private String firstName = "Vorname";
        private String lastName = "Nachname";
        private String roles = "Funktion";
        private String department = "Fachschaft";
        private String emailDomain = "hhu.de";
    }

    @Data
    public static class Keycloak {
        private boolean enabled;
        private String url;
        private String realm;
        /** Realm the admin account authenticates against. */
        private String authRealm = "master";
        private String clientId = "admin-cli";
        private String username;
        private String password;
        private int pageSize = 100;
        private boolean disableInsteadOfDelete;
    }

    @Data
    public static class GitLab {
        private boolean enabled;
        private String url;
        private String token;
        private long groupId;
        private String ownerRole;
        private String maintainerRole;
    }
}
