package com.errorengine.util;

import java.io.Reader;
import java.sql.Blob;
import java.sql.Clob;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.SQLXML;
import java.util.Base64;

/**
 * Converts JDBC driver values into plain scalars (String, Number, Boolean or null) so rows can be
 * stored as JSON snapshots and compared without driver-specific objects leaking through.
 */
public final class JdbcScalars {
    private static final int MAX_LOB_CHARS = 100_000;
    private static final int MAX_BLOB_BYTES = 100_000;
    private static final int MAX_STRING_CHARS = 100_000;
    private static final String UNSUPPORTED_PLACEHOLDER = "[unsupported]";

    private JdbcScalars() {
    }

    /**
     * Reads a JDBC column value and returns a scalar equivalent.
     *
     * @param rs result set
     * @param columnIndex 1-based column index
     * @return scalar value
     * @throws SQLException when the driver fails to read the column
     */
    public static Object readScalar(ResultSet rs, int columnIndex) throws SQLException {
        Object v = rs.getObject(columnIndex);
        try {
            return toScalar(v);
        } catch (SQLException e) {
            throw e;
        } catch (Exception e) {
            return UNSUPPORTED_PLACEHOLDER;
        }
    }

    static Object toScalar(Object v) throws SQLException {
        if (v == null) {
            return null;
        }
        if (v instanceof Number || v instanceof Boolean) {
            return v;
        }
        if (v instanceof String s) {
            return truncate(s);
        }
        // PGobject (json/jsonb/custom types) carries its text in getValue()
        if ("org.postgresql.util.PGobject".equals(v.getClass().getName())) {
            try {
                Object value = v.getClass().getMethod("getValue").invoke(v);
                return value != null ? truncate(value.toString()) : "";
            } catch (ReflectiveOperationException e) {
                return truncate(String.valueOf(v));
            }
        }
        if (v instanceof Clob clob) {
            return readClob(clob);
        }
        if (v instanceof Blob blob) {
            long length = blob.length();
            int toRead = (int) Math.min(length, MAX_BLOB_BYTES);
            return toRead <= 0 ? "" : Base64.getEncoder().encodeToString(blob.getBytes(1, toRead));
        }
        if (v instanceof SQLXML xml) {
            return truncate(xml.getString());
        }
        if (v instanceof byte[] bytes) {
            return Base64.getEncoder().encodeToString(bytes);
        }
        if (v instanceof java.sql.Array arr) {
            Object arrayValue = arr.getArray();
            if (arrayValue instanceof Object[] objects) {
                return truncate(java.util.Arrays.toString(objects));
            }
            return truncate(String.valueOf(arrayValue));
        }
        // dates, times, timestamps, UUIDs and anything else: their text form
        return truncate(String.valueOf(v));
    }

    private static String truncate(String s) {
        if (s.length() <= MAX_STRING_CHARS) {
            return s;
        }
        return s.substring(0, MAX_STRING_CHARS);
    }

    private static String readClob(Clob clob) throws SQLException {
        long length = clob.length();
        int toRead = (int) Math.min(length, MAX_LOB_CHARS);
        if (toRead <= 0) {
            return "";
        }
        try {
            return clob.getSubString(1, toRead);
        } catch (SQLException e) {
            try (Reader reader = clob.getCharacterStream()) {
                if (reader == null) {
                    return "";
                }
                char[] buf = new char[Math.min(MAX_LOB_CHARS, 8192)];
                StringBuilder sb = new StringBuilder();
                int n;
                while (sb.length() < MAX_LOB_CHARS
                        && (n = reader.read(buf, 0, Math.min(buf.length, MAX_LOB_CHARS - sb.length()))) > 0) {
                    sb.append(buf, 0, n);
                }
                return sb.toString();
            } catch (java.io.IOException io) {
                throw new SQLException("Failed to read CLOB column", io);
            }
        }
    }
}
