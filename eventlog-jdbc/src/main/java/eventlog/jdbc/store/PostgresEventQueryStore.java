package eventlog.jdbc.store;

import java.util.List;

/**
 * PostgreSQL query store.
 *
 * <p>The lag reference is {@code transaction_timestamp()}, the read timestamp
 * {@code statement_timestamp()}. Persistence ids are compared with {@code COLLATE "C"} so
 * enumeration order is by code point regardless of the database locale.
 */
public final class PostgresEventQueryStore extends AbstractJdbcEventQueryStore {

    public PostgresEventQueryStore() {
        super();
    }

    public PostgresEventQueryStore(String tableName) {
        super(tableName);
    }

    @Override
    public AbstractJdbcEventQueryStore withTableName(String tableName) {
        return new PostgresEventQueryStore(tableName);
    }

    @Override
    public String name() {
        return "postgresql";
    }

    @Override
    public List<String> jdbcUrlPrefixes() {
        return List.of("jdbc:postgresql:");
    }

    @Override
    protected String currentTimestampFunction() {
        return "transaction_timestamp()";
    }

    @Override
    protected String readTimestampFunction() {
        return "statement_timestamp()";
    }

    @Override
    protected String idCollation() {
        return " COLLATE \"C\"";
    }
}
