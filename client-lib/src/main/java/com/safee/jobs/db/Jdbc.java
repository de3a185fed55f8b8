package com.safee.jobs.db;

import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.sql.Types;
import java.time.Instant;
import java.util.List;
import java.util.UUID;

/**
 * Null-aware column helpers shared by the JDBC stores.
 */
public final class Jdbc {
    private Jdbc() {
    }

    public static void setInstant(PreparedStatement ps, int index, Instant value) throws SQLException {
        if (value == null) {
            ps.setNull(index, Types.TIMESTAMP);
        } else {
            ps.setTimestamp(index, Timestamp.from(value));
        }
    }

    public static Instant getInstant(ResultSet rs, String column) throws SQLException {
        Timestamp ts = rs.getTimestamp(column);
        return ts == null ? null : ts.toInstant();
    }

    public static void setUuid(PreparedStatement ps, int index, UUID value) throws SQLException {
        if (value == null) {
            ps.setNull(index, Types.OTHER);
        } else {
            ps.setObject(index, value);
        }
    }

    public static UUID getUuid(ResultSet rs, String column) throws SQLException {
        return rs.getObject(column, UUID.class);
    }

    public static void setText(PreparedStatement ps, int index, String value) throws SQLException {
        if (value == null) {
            ps.setNull(index, Types.VARCHAR);
        } else {
            ps.setString(index, value);
        }
    }

    /** Placeholder for a SQL NULL of a known type in a dynamically built parameter list. */
    public static Object nullOf(int sqlType) {
        return new TypedNull(sqlType);
    }

    public static Object instantOrNull(Instant value) {
        return value == null ? nullOf(Types.TIMESTAMP) : value;
    }

    public static Object textOrNull(String value) {
        return value == null ? nullOf(Types.VARCHAR) : value;
    }

    public static void bind(PreparedStatement ps, List<?> params) throws SQLException {
        for (int i = 0; i < params.size(); i++) {
            Object p = params.get(i);
            int index = i + 1;
            if (p instanceof TypedNull) {
                ps.setNull(index, ((TypedNull) p).sqlType);
            } else if (p instanceof Instant) {
                setInstant(ps, index, (Instant) p);
            } else if (p instanceof Integer) {
                ps.setInt(index, (Integer) p);
            } else if (p instanceof Boolean) {
                ps.setBoolean(index, (Boolean) p);
            } else {
                ps.setObject(index, p);
            }
        }
    }

    public static void rollbackQuietly(java.sql.Connection c, SQLException original) {
        try {
            c.rollback();
        } catch (SQLException rollbackFailure) {
            original.addSuppressed(rollbackFailure);
        }
    }

    private static final class TypedNull {
        final int sqlType;

        TypedNull(int sqlType) {
            this.sqlType = sqlType;
        }
    }
}
