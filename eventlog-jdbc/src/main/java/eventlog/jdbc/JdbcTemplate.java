package eventlog.jdbc;

import eventlog.DecodeResult;
import eventlog.StoreUnavailableException;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.ResultSetMetaData;
import java.sql.SQLException;
import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;

/**
 * Lightweight JDBC helper shared by the query and offset stores.
 *
 * <p>Parameters are bound positionally by their Java type; {@link Instant}s are sent as
 * {@link OffsetDateTime} in UTC so {@code timestamp with time zone} columns compare exactly.
 * Every {@link SQLException} surfaces as {@link StoreUnavailableException}.
 */
public final class JdbcTemplate {

    @FunctionalInterface
    public interface RowMapper<T> {
        T map(ResultSet rs) throws SQLException;
    }

    /**
     * Decodes rows of one result set. Obtained once per result set from a {@link RowDecoder.Binder}.
     */
    @FunctionalInterface
    public interface RowDecoder<T> {
        DecodeResult<T> decode(ResultSet rs) throws SQLException;

        /**
         * Checks the result set shape and returns the decoder for its rows.
         */
        @FunctionalInterface
        interface Binder<T> {
            DecodeResult<RowDecoder<T>> bind(ResultSetMetaData metaData) throws SQLException;
        }
    }

    /** Execute INSERT/UPDATE/DELETE, return rows affected. */
    public static int update(Connection conn, String sql, Object... params) {
        try (PreparedStatement ps = conn.prepareStatement(sql)) {
            bindParams(ps, params);
            return ps.executeUpdate();
        } catch (SQLException e) {
            throw new StoreUnavailableException("Failed to execute update", e);
        }
    }

    /** Execute SELECT, map rows. */
    public static <T> List<T> query(Connection conn, String sql, RowMapper<T> mapper, Object... params) {
        try (PreparedStatement ps = conn.prepareStatement(sql)) {
            bindParams(ps, params);
            try (ResultSet rs = ps.executeQuery()) {
                List<T> results = new ArrayList<>();
                while (rs.next()) {
                    results.add(mapper.map(rs));
                }
                return results;
            }
        } catch (SQLException e) {
            throw new StoreUnavailableException("Failed to execute query", e);
        }
    }

    /**
     * Execute SELECT and decode rows. The result set shape is validated once before the first row.
     *
     * @throws eventlog.RowDecodeException if the shape or any row does not decode
     */
    public static <T> List<T> queryDecoded(Connection conn, String sql, RowDecoder.Binder<T> binder,
            Object... params) {
        try (PreparedStatement ps = conn.prepareStatement(sql)) {
            bindParams(ps, params);
            try (ResultSet rs = ps.executeQuery()) {
                RowDecoder<T> decoder = binder.bind(rs.getMetaData()).orThrow();
                List<T> results = new ArrayList<>();
                while (rs.next()) {
                    results.add(decoder.decode(rs).orThrow());
                }
                return results;
            }
        } catch (SQLException e) {
            throw new StoreUnavailableException("Failed to execute query", e);
        }
    }

    static void bindParams(PreparedStatement ps, Object... params) throws SQLException {
        for (int i = 0; i < params.length; i++) {
            Object param = params[i];
            int index = i + 1;
            if (param instanceof String s) {
                ps.setString(index, s);
            } else if (param instanceof Integer n) {
                ps.setInt(index, n);
            } else if (param instanceof Long n) {
                ps.setLong(index, n);
            } else if (param instanceof Boolean b) {
                ps.setBoolean(index, b);
            } else if (param instanceof byte[] bytes) {
                ps.setBytes(index, bytes);
            } else if (param instanceof Instant instant) {
                ps.setObject(index, OffsetDateTime.ofInstant(instant, ZoneOffset.UTC));
            } else if (param == null) {
                throw new IllegalArgumentException("Null parameter at index " + index
                        + "; use a query variant without the condition instead");
            } else {
                throw new IllegalArgumentException("Unsupported parameter type at index " + index + ": "
                        + param.getClass().getName());
            }
        }
    }

    private JdbcTemplate() {
    }
}
