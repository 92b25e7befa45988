package eventlog.util;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class DaemonThreadFactoryTest {

    @Test
    void threadsAreDaemonsWithSequentialNames() {
        DaemonThreadFactory factory = new DaemonThreadFactory("eventlog-poller-");

        Thread first = factory.newThread(() -> { });
        Thread second = factory.newThread(() -> { });

        assertTrue(first.isDaemon());
        assertEquals("eventlog-poller-1", first.getName());
        assertEquals("eventlog-poller-2", second.getName());
        assertNotNull(first.getUncaughtExceptionHandler());
    }

    @Test
    void nullPrefixIsRejected() {
        assertThrows(NullPointerException.class, () -> new DaemonThreadFactory(null));
    }
}
