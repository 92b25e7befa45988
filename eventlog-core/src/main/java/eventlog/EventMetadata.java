package eventlog;

import java.util.Arrays;
import java.util.Objects;

/**
 * Optional serialized metadata stored alongside an event.
 *
 * <ul>
 *   <li>{@link None}: the row carries no metadata ({@code meta_payload} is NULL).</li>
 *   <li>{@link Present}: serializer id, manifest and payload of the metadata.</li>
 * </ul>
 *
 * @see EventEnvelope#metadata()
 */
public sealed interface EventMetadata permits EventMetadata.None, EventMetadata.Present {

    /**
     * Singleton for rows without metadata.
     */
    None NONE = new None();

    /**
     * Returns the singleton {@link None} value.
     *
     * @return the no-metadata value
     */
    static None none() {
        return NONE;
    }

    /**
     * Creates a {@link Present} metadata value.
     *
     * @param serializerId serializer identifier
     * @param manifest     serializer manifest (may be empty, never null)
     * @param payload      serialized metadata
     * @return the metadata value
     */
    static Present of(int serializerId, String manifest, byte[] payload) {
        return new Present(serializerId, manifest, payload);
    }

    /**
     * No metadata stored for the event.
     */
    record None() implements EventMetadata {
    }

    /**
     * Serialized metadata.
     *
     * @param serializerId serializer identifier
     * @param manifest     serializer manifest
     * @param payload      serialized bytes (defensively copied)
     */
    record Present(int serializerId, String manifest, byte[] payload) implements EventMetadata {
        public Present {
            Objects.requireNonNull(manifest, "manifest");
            Objects.requireNonNull(payload, "payload");
            payload = payload.clone();
        }

        @Override
        public byte[] payload() {
            return payload.clone();
        }

        @Override
        public boolean equals(Object o) {
            if (this == o) return true;
            if (!(o instanceof Present other)) return false;
            return serializerId == other.serializerId
                    && manifest.equals(other.manifest)
                    && Arrays.equals(payload, other.payload);
        }

        @Override
        public int hashCode() {
            return 31 * Objects.hash(serializerId, manifest) + Arrays.hashCode(payload);
        }

        @Override
        public String toString() {
            return "Present[serializerId=" + serializerId + ", manifest=" + manifest
                    + ", payload=" + payload.length + " bytes]";
        }
    }
}
