package eventlog.jdbc.store;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class JdbcEventQueryStoresTest {

    @Test
    void registersBothStores() {
        assertEquals(2, JdbcEventQueryStores.all().size());
        assertInstanceOf(PostgresEventQueryStore.class, JdbcEventQueryStores.get("postgresql"));
        assertInstanceOf(H2EventQueryStore.class, JdbcEventQueryStores.get("H2"));
    }

    @Test
    void unknownNameListsAvailableStores() {
        IllegalArgumentException ex = assertThrows(IllegalArgumentException.class,
                () -> JdbcEventQueryStores.get("mysql"));
        assertTrue(ex.getMessage().startsWith("Unknown event query store: mysql"));
    }

    @Test
    void detectsFromJdbcUrl() {
        assertEquals("postgresql", JdbcEventQueryStores.detect("jdbc:postgresql://db:5432/app").name());
        assertEquals("h2", JdbcEventQueryStores.detect("jdbc:h2:mem:test").name());
        assertEquals("h2", JdbcEventQueryStores.detect("JDBC:H2:mem:test").name());
    }

    @Test
    void rejectsUnknownOrEmptyUrl() {
        IllegalArgumentException ex = assertThrows(IllegalArgumentException.class,
                () -> JdbcEventQueryStores.detect("jdbc:sqlite:test.db"));
        assertTrue(ex.getMessage().startsWith("No event query store found for JDBC URL: jdbc:sqlite:test.db"));
        assertThrows(IllegalArgumentException.class, () -> JdbcEventQueryStores.detect(""));
    }

    @Test
    void withTableNameKeepsDialect() {
        AbstractJdbcEventQueryStore store = JdbcEventQueryStores.get("postgresql").withTableName("app.events");
        assertInstanceOf(PostgresEventQueryStore.class, store);
        assertEquals("app.events", store.tableName());
        assertEquals("event_journal", JdbcEventQueryStores.get("postgresql").tableName());
    }
}
