package eventlog.jdbc;

import eventlog.InvalidConfigurationException;

import java.util.Objects;

/**
 * Table name validation for the journal and offset tables. Names are concatenated into SQL,
 * so only plain identifiers with an optional schema prefix are accepted.
 */
public final class TableNames {
    public static final String DEFAULT_JOURNAL_TABLE = "event_journal";
    public static final String DEFAULT_OFFSET_TABLE = "eventlog_offset";
    private static final String TABLE_NAME_PATTERN =
            "([a-zA-Z_][a-zA-Z0-9_]*\\.)?[a-zA-Z_][a-zA-Z0-9_]*";

    private TableNames() {
    }

    public static String validate(String tableName) {
        Objects.requireNonNull(tableName, "tableName");
        if (!tableName.matches(TABLE_NAME_PATTERN)) {
            throw new InvalidConfigurationException("Invalid table name: " + tableName);
        }
        return tableName;
    }
}
