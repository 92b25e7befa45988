package eventlog.jdbc.store;

import java.util.List;

/**
 * H2 query store. Primarily for testing.
 *
 * <p>H2 has a single clock function. {@code CURRENT_TIMESTAMP} stays fixed for the whole
 * transaction, so the read timestamp equals the lag reference of the same statement.
 */
public final class H2EventQueryStore extends AbstractJdbcEventQueryStore {

    public H2EventQueryStore() {
        super();
    }

    public H2EventQueryStore(String tableName) {
        super(tableName);
    }

    @Override
    public AbstractJdbcEventQueryStore withTableName(String tableName) {
        return new H2EventQueryStore(tableName);
    }

    @Override
    public String name() {
        return "h2";
    }

    @Override
    public List<String> jdbcUrlPrefixes() {
        return List.of("jdbc:h2:");
    }

    @Override
    protected String currentTimestampFunction() {
        return "CURRENT_TIMESTAMP";
    }

    @Override
    protected String readTimestampFunction() {
        return "CURRENT_TIMESTAMP";
    }
}
