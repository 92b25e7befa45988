package eventlog;

import java.util.Objects;

/**
 * Persistence id conventions shared with the journal writer.
 *
 * <p>A persistence id is {@code "<entityType>|<entityId>"}, or a bare id whose entity type is
 * the id itself when no separator is present. The slice of an id is
 * {@code |String.hashCode(id) mod numberOfSlices|}; writers and readers must agree on both rules.
 */
public final class PersistenceIds {

    /**
     * Separator between entity type and entity id.
     */
    public static final String SEPARATOR = "|";

    private PersistenceIds() {
    }

    /**
     * Builds {@code "<entityType>|<entityId>"}.
     *
     * @throws InvalidConfigurationException if either part is empty or the entity type contains the separator
     */
    public static String of(String entityType, String entityId) {
        Objects.requireNonNull(entityType, "entityType");
        Objects.requireNonNull(entityId, "entityId");
        if (entityType.isEmpty() || entityId.isEmpty()) {
            throw new InvalidConfigurationException("entityType and entityId must not be empty");
        }
        if (entityType.contains(SEPARATOR)) {
            throw new InvalidConfigurationException(
                    "entityType must not contain '" + SEPARATOR + "': " + entityType);
        }
        return entityType + SEPARATOR + entityId;
    }

    /**
     * Extracts the entity type of a persistence id.
     *
     * @param persistenceId the id to parse
     * @return the part before the first separator, or the whole id when there is none
     * @throws InvalidConfigurationException if the id is malformed
     */
    public static String entityTypeOf(String persistenceId) {
        validate(persistenceId);
        int i = persistenceId.indexOf(SEPARATOR);
        return i == -1 ? persistenceId : persistenceId.substring(0, i);
    }

    /**
     * Computes the slice of a persistence id.
     *
     * @param persistenceId  the id
     * @param numberOfSlices total slice count, must be positive
     * @return slice in {@code [0, numberOfSlices)}
     */
    public static int sliceOf(String persistenceId, int numberOfSlices) {
        Objects.requireNonNull(persistenceId, "persistenceId");
        if (numberOfSlices <= 0) {
            throw new InvalidConfigurationException("numberOfSlices must be > 0, got: " + numberOfSlices);
        }
        return Math.abs(persistenceId.hashCode() % numberOfSlices);
    }

    /**
     * Rejects ids that do not follow the writer convention: null or empty ids, and ids whose
     * entity type or entity id around the separator is empty.
     *
     * @throws InvalidConfigurationException if the id is malformed
     */
    public static void validate(String persistenceId) {
        if (persistenceId == null || persistenceId.isEmpty()) {
            throw new InvalidConfigurationException("persistenceId must not be null or empty");
        }
        int i = persistenceId.indexOf(SEPARATOR);
        if (i == 0) {
            throw new InvalidConfigurationException("persistenceId has an empty entity type: " + persistenceId);
        }
        if (i == persistenceId.length() - 1) {
            throw new InvalidConfigurationException("persistenceId has an empty entity id: " + persistenceId);
        }
    }
}
