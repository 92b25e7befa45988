package eventlog;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import static org.junit.jupiter.api.Assertions.*;

class PersistenceIdsTest {

    @Test
    void entityTypeIsPrefixBeforeSeparator() {
        assertEquals("Cart", PersistenceIds.entityTypeOf("Cart|42"));
        assertEquals("Cart", PersistenceIds.entityTypeOf("Cart|a|b"));
    }

    @Test
    void bareIdIsItsOwnEntityType() {
        assertEquals("legacy-42", PersistenceIds.entityTypeOf("legacy-42"));
    }

    @ParameterizedTest
    @ValueSource(strings = {"", "|42", "Cart|"})
    void malformedIdsAreRejected(String pid) {
        assertThrows(InvalidConfigurationException.class, () -> PersistenceIds.entityTypeOf(pid));
    }

    @Test
    void nullIdIsRejected() {
        assertThrows(InvalidConfigurationException.class, () -> PersistenceIds.validate(null));
    }

    @Test
    void sliceFollowsWriterHashConvention() {
        String pid = "Cart|42";

        assertEquals(Math.abs(pid.hashCode() % 1024), PersistenceIds.sliceOf(pid, 1024));
    }

    @Test
    void sliceIsNonNegativeForNegativeHashCodes() {
        // "polygenelubricants".hashCode() == Integer.MIN_VALUE
        assertEquals(Integer.MIN_VALUE, "polygenelubricants".hashCode());

        int slice = PersistenceIds.sliceOf("polygenelubricants", 1000);

        assertTrue(slice >= 0 && slice < 1000, "slice " + slice);
    }

    @Test
    void sliceIsStableAndInRange() {
        for (int i = 0; i < 500; i++) {
            String pid = PersistenceIds.of("Order", "id-" + i);
            int slice = PersistenceIds.sliceOf(pid, 128);
            assertTrue(slice >= 0 && slice < 128);
            assertEquals(slice, PersistenceIds.sliceOf(pid, 128));
        }
    }

    @Test
    void ofJoinsWithSeparator() {
        assertEquals("Cart|42", PersistenceIds.of("Cart", "42"));
        assertThrows(InvalidConfigurationException.class, () -> PersistenceIds.of("Ca|rt", "42"));
        assertThrows(InvalidConfigurationException.class, () -> PersistenceIds.of("", "42"));
    }

    @Test
    void zeroSlicesIsRejected() {
        assertThrows(InvalidConfigurationException.class, () -> PersistenceIds.sliceOf("Cart|1", 0));
    }
}
