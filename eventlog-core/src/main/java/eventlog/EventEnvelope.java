package eventlog;

import java.time.Instant;
import java.util.Arrays;
import java.util.Objects;

/**
 * Immutable view of one stored journal event, as returned by the slice cursor,
 * the per-identity replay and the poller.
 *
 * <p>Payload and metadata are opaque serialized bytes; deserialization is the
 * caller's concern. Soft-deleted rows are never materialized as envelopes.
 * Use the {@linkplain Builder builder} to create instances.
 *
 * @see EventMetadata
 * @see EventKey
 */
public final class EventEnvelope {
    private final String entityType;
    private final int slice;
    private final String persistenceId;
    private final long seqNr;
    private final Instant dbTimestamp;
    private final Instant readTimestamp;
    private final byte[] payload;
    private final int serializerId;
    private final String serializerManifest;
    private final String writerId;
    private final String adapterManifest;
    private final EventMetadata metadata;

    private EventEnvelope(Builder builder) {
        this.persistenceId = Objects.requireNonNull(builder.persistenceId, "persistenceId");
        this.entityType = builder.entityType == null
                ? PersistenceIds.entityTypeOf(builder.persistenceId) : builder.entityType;
        if (builder.slice < 0) {
            throw new IllegalArgumentException("slice must be >= 0, got: " + builder.slice);
        }
        if (builder.seqNr < 1) {
            throw new IllegalArgumentException("seqNr must be >= 1, got: " + builder.seqNr);
        }
        this.slice = builder.slice;
        this.seqNr = builder.seqNr;
        this.dbTimestamp = Objects.requireNonNull(builder.dbTimestamp, "dbTimestamp");
        this.readTimestamp = builder.readTimestamp == null ? builder.dbTimestamp : builder.readTimestamp;
        Objects.requireNonNull(builder.payload, "payload");
        this.payload = Arrays.copyOf(builder.payload, builder.payload.length);
        this.serializerId = builder.serializerId;
        this.serializerManifest = builder.serializerManifest == null ? "" : builder.serializerManifest;
        this.writerId = builder.writerId == null ? "" : builder.writerId;
        this.adapterManifest = builder.adapterManifest == null ? "" : builder.adapterManifest;
        this.metadata = builder.metadata == null ? EventMetadata.none() : builder.metadata;
    }

    /**
     * Creates a builder for an event of the given identity and sequence number.
     *
     * @param persistenceId the entity instance identity
     * @param seqNr         1-based sequence number
     * @return a new builder
     */
    public static Builder builder(String persistenceId, long seqNr) {
        return new Builder(persistenceId, seqNr);
    }

    public String entityType() {
        return entityType;
    }

    public int slice() {
        return slice;
    }

    public String persistenceId() {
        return persistenceId;
    }

    public long seqNr() {
        return seqNr;
    }

    /**
     * Commit timestamp assigned by the database server. Orders events within a slice range.
     */
    public Instant dbTimestamp() {
        return dbTimestamp;
    }

    /**
     * Database time at which the row was read. Diagnostic only, never used for ordering.
     */
    public Instant readTimestamp() {
        return readTimestamp;
    }

    /**
     * Returns a copy of the serialized event payload.
     */
    public byte[] payload() {
        return Arrays.copyOf(payload, payload.length);
    }

    public int serializerId() {
        return serializerId;
    }

    public String serializerManifest() {
        return serializerManifest;
    }

    public String writerId() {
        return writerId;
    }

    public String adapterManifest() {
        return adapterManifest;
    }

    public EventMetadata metadata() {
        return metadata;
    }

    /**
     * Returns the {@code (persistenceId, seqNr)} key of this event.
     */
    public EventKey key() {
        return new EventKey(persistenceId, seqNr);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof EventEnvelope other)) return false;
        return slice == other.slice
                && seqNr == other.seqNr
                && serializerId == other.serializerId
                && entityType.equals(other.entityType)
                && persistenceId.equals(other.persistenceId)
                && dbTimestamp.equals(other.dbTimestamp)
                && Arrays.equals(payload, other.payload)
                && serializerManifest.equals(other.serializerManifest)
                && writerId.equals(other.writerId)
                && adapterManifest.equals(other.adapterManifest)
                && metadata.equals(other.metadata);
    }

    @Override
    public int hashCode() {
        return Objects.hash(persistenceId, seqNr, dbTimestamp);
    }

    @Override
    public String toString() {
        return "EventEnvelope{" +
                "persistenceId='" + persistenceId + '\'' +
                ", seqNr=" + seqNr +
                ", slice=" + slice +
                ", dbTimestamp=" + dbTimestamp +
                ", serializerId=" + serializerId +
                ", manifest='" + serializerManifest + '\'' +
                '}';
    }

    /**
     * Builder for {@link EventEnvelope}.
     */
    public static final class Builder {
        private final String persistenceId;
        private final long seqNr;
        private String entityType;
        private int slice;
        private Instant dbTimestamp;
        private Instant readTimestamp;
        private byte[] payload = new byte[0];
        private int serializerId;
        private String serializerManifest;
        private String writerId;
        private String adapterManifest;
        private EventMetadata metadata;

        private Builder(String persistenceId, long seqNr) {
            this.persistenceId = persistenceId;
            this.seqNr = seqNr;
        }

        /**
         * Sets the entity type. Optional; derived from the persistence id when not set.
         */
        public Builder entityType(String entityType) {
            this.entityType = entityType;
            return this;
        }

        public Builder slice(int slice) {
            this.slice = slice;
            return this;
        }

        /**
         * <b>Required.</b>
         */
        public Builder dbTimestamp(Instant dbTimestamp) {
            this.dbTimestamp = dbTimestamp;
            return this;
        }

        /**
         * Optional. Defaults to the {@code dbTimestamp}.
         */
        public Builder readTimestamp(Instant readTimestamp) {
            this.readTimestamp = readTimestamp;
            return this;
        }

        public Builder payload(byte[] payload) {
            this.payload = payload;
            return this;
        }

        public Builder serializerId(int serializerId) {
            this.serializerId = serializerId;
            return this;
        }

        public Builder serializerManifest(String serializerManifest) {
            this.serializerManifest = serializerManifest;
            return this;
        }

        public Builder writerId(String writerId) {
            this.writerId = writerId;
            return this;
        }

        public Builder adapterManifest(String adapterManifest) {
            this.adapterManifest = adapterManifest;
            return this;
        }

        /**
         * Optional. Defaults to {@link EventMetadata#none()}.
         */
        public Builder metadata(EventMetadata metadata) {
            this.metadata = metadata;
            return this;
        }

        /**
         * Builds the envelope.
         *
         * @return a new {@link EventEnvelope}
         * @throws NullPointerException     if {@code persistenceId}, {@code dbTimestamp} or {@code payload} is null
         * @throws IllegalArgumentException if {@code seqNr < 1} or {@code slice < 0}
         */
        public EventEnvelope build() {
            return new EventEnvelope(this);
        }
    }
}
