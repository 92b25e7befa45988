package eventlog;

import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;

class EventLogSettingsTest {

    @Test
    void defaults() {
        EventLogSettings settings = EventLogSettings.defaults();

        assertEquals(1024, settings.numberOfSlices());
        assertEquals(1000, settings.pageSize());
        assertEquals(Duration.ofMillis(500), settings.lagTolerance());
        assertEquals(Duration.ofSeconds(3), settings.pollInterval());
    }

    @Test
    void zeroLagIsAllowed() {
        EventLogSettings settings = EventLogSettings.builder().lagTolerance(Duration.ZERO).build();

        assertEquals(Duration.ZERO, settings.lagTolerance());
    }

    @Test
    void invalidValuesAreRejected() {
        assertThrows(InvalidConfigurationException.class,
                () -> EventLogSettings.builder().numberOfSlices(0).build());
        assertThrows(InvalidConfigurationException.class,
                () -> EventLogSettings.builder().pageSize(-1).build());
        assertThrows(InvalidConfigurationException.class,
                () -> EventLogSettings.builder().lagTolerance(Duration.ofMillis(-1)).build());
        assertThrows(InvalidConfigurationException.class,
                () -> EventLogSettings.builder().pollInterval(Duration.ZERO).build());
    }

    @Test
    void invalidConfigurationIsAnIllegalArgument() {
        assertThrows(IllegalArgumentException.class,
                () -> EventLogSettings.builder().pageSize(0).build());
    }
}
