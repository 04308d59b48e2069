package de.asta.usersync.service.source;

import de.asta.usersync.model.domain.DesiredState;

/**
 * Where the canonical user data of a run comes from.
 */
public interface UserSource {

    /**
     * @throws de.asta.usersync.exception.SourceException if the data cannot be loaded
     */
    DesiredState load();
}
