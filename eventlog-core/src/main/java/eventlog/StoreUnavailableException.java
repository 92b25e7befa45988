package eventlog;

/**
 * Unchecked exception raised when the journal cannot be reached: connection acquisition,
 * statement execution or the database time probe failed.
 *
 * <p>Reads are idempotent, so callers may retry. {@link eventlog.poller.SliceRangePoller}
 * retries these transparently with backoff; single-shot queries surface them to the caller.
 */
public final class StoreUnavailableException extends RuntimeException {
    public StoreUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
