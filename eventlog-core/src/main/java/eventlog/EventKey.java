package eventlog;

import java.util.Objects;

/**
 * Unique key of a stored event within an entity type.
 *
 * @param persistenceId the entity instance identity
 * @param seqNr         1-based sequence number within {@code persistenceId}
 */
public record EventKey(String persistenceId, long seqNr) {
    public EventKey {
        Objects.requireNonNull(persistenceId, "persistenceId");
    }
}
