package eventlog.demo;

import eventlog.EventEnvelope;
import eventlog.EventLogSettings;
import eventlog.PersistenceIds;
import eventlog.SliceRange;
import eventlog.jdbc.DataSourceConnectionProvider;
import eventlog.jdbc.offset.JdbcOffsetStore;
import eventlog.jdbc.store.JdbcEventQueryStores;
import eventlog.poller.SliceRangePoller;
import eventlog.query.EventLogQueries;

import org.h2.jdbcx.JdbcDataSource;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.time.Duration;
import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

/**
 * Checked-out cart projection fed by four exactly-once slice-range pollers over an H2 journal.
 *
 * Run with: mvn -pl samples/eventlog-demo exec:java
 */
public final class EventLogDemo {
    private static final int SLICES = 1024;
    private static final int CARTS = 12;
    private static final int ITEMS_PER_CART = 3;

    public static void main(String[] args) throws Exception {
        // 1. H2 journal with the bundled schema
        JdbcDataSource dataSource = new JdbcDataSource();
        dataSource.setURL("jdbc:h2:mem:eventlog_demo;DB_CLOSE_DELAY=-1");
        createSchema(dataSource);

        // 2. Query facade, store detected from the JDBC URL
        DataSourceConnectionProvider connectionProvider = new DataSourceConnectionProvider(dataSource);
        EventLogQueries queries = EventLogQueries.builder()
                .connectionProvider(connectionProvider)
                .store(JdbcEventQueryStores.detect(dataSource))
                .settings(EventLogSettings.builder()
                        .numberOfSlices(SLICES)
                        .pageSize(10)
                        .lagTolerance(Duration.ofMillis(200))
                        .pollInterval(Duration.ofMillis(250))
                        .build())
                .build();
        JdbcOffsetStore offsets = new JdbcOffsetStore(connectionProvider);

        // 3. One exactly-once poller per slice range: projection rows and offset commit together
        CountDownLatch latch = new CountDownLatch(CARTS * ITEMS_PER_CART + CARTS / 2);
        List<SliceRangePoller> pollers = new ArrayList<>();
        for (SliceRange range : queries.sliceRanges("Cart", 4)) {
            SliceRangePoller poller = SliceRangePoller.builder()
                    .cursor(queries.cursor(range))
                    .connectionProvider(connectionProvider)
                    .offsetStore(offsets)
                    .settings(queries.settings())
                    .transactionalHandler((events, next) -> {
                        try (Connection conn = dataSource.getConnection()) {
                            conn.setAutoCommit(false);
                            for (EventEnvelope event : events) {
                                project(conn, event);
                            }
                            offsets.save(conn, range, next);
                            conn.commit();
                        }
                        System.out.println("[" + range + "] committed " + events.size() + " events");
                        events.forEach(e -> latch.countDown());
                    })
                    .build();
            pollers.add(poller);
            poller.start();
        }

        System.out.println("=== Event Log Demo ===\n");

        // 4. Append events, one transaction per event; every other cart checks out
        for (int item = 1; item <= ITEMS_PER_CART; item++) {
            for (int cart = 1; cart <= CARTS; cart++) {
                append(dataSource, PersistenceIds.of("Cart", "cart-" + cart), item, "ItemAdded",
                        "{\"item\": \"sku-" + (cart * 10 + item) + "\"}");
            }
        }
        for (int cart = 2; cart <= CARTS; cart += 2) {
            append(dataSource, PersistenceIds.of("Cart", "cart-" + cart), ITEMS_PER_CART + 1, "CheckedOut", "{}");
        }
        System.out.println("Appended " + latch.getCount() + " events\n");

        boolean completed = latch.await(10, TimeUnit.SECONDS);
        System.out.println(completed
                ? "\nAll events projected"
                : "\nTimeout, " + latch.getCount() + " events not projected");

        // 5. Projection state, then direct journal queries
        System.out.println("\n=== Checked-out carts ===");
        showCheckedOutCarts(dataSource);

        String firstCart = PersistenceIds.of("Cart", "cart-1");
        System.out.println("\n=== Replay " + firstCart + " ===");
        for (EventEnvelope event : queries.replay(firstCart, 1, Long.MAX_VALUE)) {
            System.out.println(event.seqNr() + " @ " + event.dbTimestamp());
        }
        Optional<Instant> written = queries.timestampOfEvent(firstCart, 2);
        System.out.println("Second event written at " + written.map(Object::toString).orElse("<missing>"));

        System.out.println("\n=== Persistence ids ===");
        long count = queries.persistenceIdEnumerator().forEach(5, System.out::println);
        System.out.println(count + " ids");

        System.out.println("\n=== Offsets ===");
        for (SliceRangePoller poller : pollers) {
            System.out.println(poller.sliceRange() + " -> "
                    + offsets.load(poller.sliceRange()).map(rp -> rp.lastSeenTimestamp().toString()).orElse("<none>"));
        }

        // 6. Cleanup
        pollers.forEach(SliceRangePoller::close);
        System.out.println("\nDemo complete.");
    }

    private static void project(Connection conn, EventEnvelope event) throws SQLException {
        if (event.serializerManifest().equals("ItemAdded")) {
            try (PreparedStatement ps = conn.prepareStatement(
                    "MERGE INTO checked_out_cart (persistence_id, items, checked_out_at) KEY (persistence_id) "
                            + "VALUES (?, COALESCE((SELECT items FROM checked_out_cart WHERE persistence_id = ?), 0) + 1, "
                            + "(SELECT checked_out_at FROM checked_out_cart WHERE persistence_id = ?))")) {
                ps.setString(1, event.persistenceId());
                ps.setString(2, event.persistenceId());
                ps.setString(3, event.persistenceId());
                ps.executeUpdate();
            }
        } else if (event.serializerManifest().equals("CheckedOut")) {
            try (PreparedStatement ps = conn.prepareStatement(
                    "UPDATE checked_out_cart SET checked_out_at = ? WHERE persistence_id = ?")) {
                ps.setObject(1, OffsetDateTime.ofInstant(event.dbTimestamp(), ZoneOffset.UTC));
                ps.setString(2, event.persistenceId());
                ps.executeUpdate();
            }
        }
    }

    private static void showCheckedOutCarts(JdbcDataSource dataSource) throws SQLException {
        try (Connection conn = dataSource.getConnection();
             Statement st = conn.createStatement();
             ResultSet rs = st.executeQuery("SELECT persistence_id, items, checked_out_at FROM checked_out_cart "
                     + "WHERE checked_out_at IS NOT NULL ORDER BY persistence_id")) {
            System.out.printf("%-14s | %-5s | %s%n", "CART", "ITEMS", "CHECKED OUT");
            System.out.println("-".repeat(60));
            while (rs.next()) {
                System.out.printf("%-14s | %-5d | %s%n",
                        rs.getString(1), rs.getInt(2), rs.getObject(3, OffsetDateTime.class));
            }
        }
    }

    private static void append(JdbcDataSource dataSource, String persistenceId, long seqNr, String manifest,
            String json) throws SQLException {
        try (Connection conn = dataSource.getConnection();
             PreparedStatement ps = conn.prepareStatement(
                     "INSERT INTO event_journal (slice, entity_type, persistence_id, seq_nr, db_timestamp, "
                             + "event_ser_id, event_ser_manifest, event_payload, writer) "
                             + "VALUES (?, ?, ?, ?, CURRENT_TIMESTAMP, 1, ?, ?, 'demo')")) {
            ps.setInt(1, PersistenceIds.sliceOf(persistenceId, SLICES));
            ps.setString(2, PersistenceIds.entityTypeOf(persistenceId));
            ps.setString(3, persistenceId);
            ps.setLong(4, seqNr);
            ps.setString(5, manifest);
            ps.setBytes(6, json.getBytes(StandardCharsets.UTF_8));
            ps.executeUpdate();
        }
    }

    private static void createSchema(JdbcDataSource dataSource) throws SQLException, IOException {
        String schema;
        try (InputStream is = EventLogDemo.class.getResourceAsStream("/schema/h2.sql")) {
            if (is == null) throw new IOException("schema/h2.sql not on classpath");
            schema = new String(is.readAllBytes(), StandardCharsets.UTF_8);
        }
        try (Connection conn = dataSource.getConnection(); Statement st = conn.createStatement()) {
            for (String stmt : schema.split(";")) {
                if (!stmt.isBlank()) {
                    st.execute(stmt.trim());
                }
            }
            st.execute("CREATE TABLE checked_out_cart (persistence_id VARCHAR(255) PRIMARY KEY, "
                    + "items INT NOT NULL, checked_out_at TIMESTAMP(6) WITH TIME ZONE)");
        }
    }
}
