package eventlog;

import java.util.Objects;
import java.util.function.Function;

/**
 * Outcome of decoding one row.
 *
 * <ul>
 *   <li>{@link Ok}: the decoded value.</li>
 *   <li>{@link Failed}: the column that failed and why.</li>
 * </ul>
 *
 * @param <T> the decoded type
 */
public sealed interface DecodeResult<T> permits DecodeResult.Ok, DecodeResult.Failed {

    static <T> Ok<T> ok(T value) {
        return new Ok<>(value);
    }

    static <T> Failed<T> failed(String column, String reason) {
        return new Failed<>(column, reason);
    }

    /**
     * Returns the decoded value or throws {@link RowDecodeException}.
     */
    default T orThrow() {
        if (this instanceof Ok<T> ok) {
            return ok.value();
        }
        Failed<T> failed = (Failed<T>) this;
        throw new RowDecodeException(failed.column(), "Failed to decode column [" + failed.column() + "]: " + failed.reason());
    }

    default <R> DecodeResult<R> map(Function<? super T, ? extends R> fn) {
        if (this instanceof Ok<T> ok) {
            return new Ok<>(fn.apply(ok.value()));
        }
        Failed<T> failed = (Failed<T>) this;
        return new Failed<>(failed.column(), failed.reason());
    }

    record Ok<T>(T value) implements DecodeResult<T> {
        public Ok {
            Objects.requireNonNull(value, "value");
        }
    }

    record Failed<T>(String column, String reason) implements DecodeResult<T> {
        public Failed {
            Objects.requireNonNull(column, "column");
            Objects.requireNonNull(reason, "reason");
        }
    }
}
