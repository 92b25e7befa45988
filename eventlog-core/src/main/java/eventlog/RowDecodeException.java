package eventlog;

/**
 * Unchecked exception raised when a journal row does not match the expected schema:
 * a required column is missing, NULL, or of the wrong type.
 *
 * <p>Not retried: it indicates a schema mismatch between writer and reader.
 */
public final class RowDecodeException extends RuntimeException {
    private final String column;

    public RowDecodeException(String column, String message) {
        super(message);
        this.column = column;
    }

    public RowDecodeException(String column, String message, Throwable cause) {
        super(message, cause);
        this.column = column;
    }

    /**
     * The offending column name.
     */
    public String column() {
        return column;
    }
}
