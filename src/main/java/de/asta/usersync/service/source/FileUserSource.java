package de.asta.usersync.service.source;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import de.asta.usersync.config.UserSyncProperties;
import de.asta.usersync.exception.SourceException;
import de.asta.usersync.model.domain.CanonicalUser;
import de.asta.usersync.model.domain.DesiredState;
import de.asta.usersync.model.dto.UserConfigEntry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.core.io.Resource;
import org.springframework.core.io.ResourceLoader;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.io.InputStream;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Reads canonical users from a JSON document of the form
 * {@code {"jdoe": {"first_name": "Jane", "roles": ["..."], ...}}}.
 */
@Slf4j
@Service
@ConditionalOnProperty(name = "usersync.users-provider.type", havingValue = "file")
public class FileUserSource implements UserSource {

    private static final TypeReference<LinkedHashMap<String, UserConfigEntry>> USERS_FILE = new TypeReference<>() {};

    private final ResourceLoader resourceLoader;
    private final ObjectMapper objectMapper;
    private final String location;

    public FileUserSource(ResourceLoader resourceLoader, ObjectMapper objectMapper, UserSyncProperties properties) {
        this.resourceLoader = resourceLoader;
        this.objectMapper = objectMapper;
        this.location = properties.getUsersProvider().getFile();
    }

    @Override
    public DesiredState load() {
        if (location == null || location.isBlank()) {
            throw new SourceException("usersync.users-provider.file is not set");
        }
        log.info("Loading users from {}", location);
        Resource resource = resourceLoader.getResource(location);

        Map<String, UserConfigEntry> entries;
        try (InputStream in = resource.getInputStream()) {
            entries = objectMapper.readValue(in, USERS_FILE);
        } catch (IOException e) {
            throw new SourceException("Failed to read users file " + location, e);
        }
        if (entries == null) {
            throw new SourceException("Users file " + location + " is empty");
        }

        Map<String, CanonicalUser> users = new LinkedHashMap<>();
        entries.forEach((identifier, entry) -> users.put(identifier, toUser(identifier, entry)));
        log.info("Loaded {} users from {}", users.size(), location);
        return DesiredState.of(users);
    }

    private CanonicalUser toUser(String identifier, UserConfigEntry entry) {
        if (entry == null || entry.getRoles() == null) {
            throw new SourceException("User '" + identifier + "' in " + location + " has no roles");
        }
        if (entry.getRoles().contains(null)) {
            throw new SourceException("User '" + identifier + "' in " + location + " has a null role");
        }
        try {
            return new CanonicalUser(identifier, entry.getFirstName(), entry.getLastName(), entry.getEmail(),
                    entry.getMatrixId(), entry.getRoles(), entry.isEnabled());
        } catch (IllegalArgumentException e) {
            throw new SourceException("Invalid user '" + identifier + "' in " + location, e);
        }
    }
}
