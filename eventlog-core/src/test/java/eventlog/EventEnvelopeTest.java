package eventlog;

import org.junit.jupiter.api.Test;

import java.time.Instant;

import static org.junit.jupiter.api.Assertions.*;

class EventEnvelopeTest {
    private static final Instant TS = Instant.parse("2026-01-01T00:00:00Z");

    @Test
    void defaultsAreFilledIn() {
        EventEnvelope event = EventEnvelope.builder("Cart|42", 3).slice(7).dbTimestamp(TS).build();

        assertEquals("Cart", event.entityType());
        assertEquals(TS, event.readTimestamp());
        assertEquals(0, event.payload().length);
        assertEquals("", event.serializerManifest());
        assertEquals("", event.writerId());
        assertEquals(EventMetadata.none(), event.metadata());
        assertEquals(new EventKey("Cart|42", 3), event.key());
    }

    @Test
    void payloadIsCopied() {
        byte[] payload = {1, 2, 3};
        EventEnvelope event = EventEnvelope.builder("Cart|42", 1).dbTimestamp(TS).payload(payload).build();

        payload[0] = 9;
        event.payload()[1] = 9;

        assertArrayEquals(new byte[]{1, 2, 3}, event.payload());
    }

    @Test
    void metadataComparesByContent() {
        EventMetadata a = EventMetadata.of(5, "m", new byte[]{1});
        EventMetadata b = EventMetadata.of(5, "m", new byte[]{1});

        assertEquals(a, b);
        assertEquals(a.hashCode(), b.hashCode());
        assertNotEquals(a, EventMetadata.none());
    }

    @Test
    void rejectsInvalidFields() {
        assertThrows(IllegalArgumentException.class,
                () -> EventEnvelope.builder("Cart|42", 0).dbTimestamp(TS).build());
        assertThrows(IllegalArgumentException.class,
                () -> EventEnvelope.builder("Cart|42", 1).slice(-1).dbTimestamp(TS).build());
        assertThrows(NullPointerException.class,
                () -> EventEnvelope.builder("Cart|42", 1).build());
    }

    @Test
    void decodeResultThrowsOnFailure() {
        DecodeResult<String> failed = DecodeResult.failed("seq_nr", "unexpected NULL");

        RowDecodeException ex = assertThrows(RowDecodeException.class, failed::orThrow);
        assertEquals("seq_nr", ex.column());
        assertEquals(4, DecodeResult.ok("abcd").map(String::length).orThrow());
    }
}
