/**
 * Core value types of the event log query engine.
 *
 * <p>Every event is addressed by {@code (persistenceId, seqNr)} and carries the database commit
 * timestamp used for ordering. Persistence ids follow the {@code "<entityType>|<entityId>"}
 * convention of the writer; {@link eventlog.PersistenceIds} derives entity type and slice from them.
 */
package eventlog;
