package org.croniq.store.jdbc;

import org.croniq.store.StoreException;
import org.croniq.utils.JsonUtil;
import org.postgresql.util.PGobject;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.sql.Types;
import java.time.Instant;
import java.util.Map;

/**
 * Small JDBC helpers shared by the Postgres stores.
 */
final class JdbcSupport {

    private static final Logger logger = LoggerFactory.getLogger(JdbcSupport.class);

    private JdbcSupport() {}

    static void setInstant(PreparedStatement ps, int index, Instant value) throws SQLException {
        if (value == null) {
            ps.setNull(index, Types.TIMESTAMP_WITH_TIMEZONE);
        } else {
            ps.setTimestamp(index, Timestamp.from(value));
        }
    }

    static Instant getInstant(ResultSet rs, String column) throws SQLException {
        Timestamp ts = rs.getTimestamp(column);
        return ts != null ? ts.toInstant() : null;
    }

    static PGobject jsonb(Map<String, Object> value) throws SQLException {
        PGobject json = new PGobject();
        json.setType("jsonb");
        json.setValue(JsonUtil.toJson(value != null ? value : Map.of()));
        return json;
    }

    static void rollbackQuietly(Connection conn, SQLException cause) {
        try {
            conn.rollback();
        } catch (SQLException e) {
            cause.addSuppressed(e);
            logger.warn("Rollback failed: {}", e.getMessage());
        }
    }

    static StoreException failure(String operation, SQLException e) {
        logger.error("Database error during {}: {}", operation, e.getMessage());
        return new StoreException("Database error during " + operation, e);
    }
}
