package com.errorengine.source;

import com.zaxxer.hikari.SQLExceptionOverride;

import java.sql.SQLException;
import java.sql.SQLFeatureNotSupportedException;
import java.sql.SQLSyntaxErrorException;
import java.sql.SQLTimeoutException;

/**
 * Keeps pooled source connections alive when a monitored query fails for reasons that do not
 * affect the connection: unsupported features, syntax errors in user queries, and statement
 * timeouts.
 */
public class HikariSqlExceptionOverride implements SQLExceptionOverride {

    @java.lang.Override
    public SQLExceptionOverride.Override adjudicate(SQLException sqlException) {
        if (sqlException == null) {
            return Override.CONTINUE_EVICT;
        }
        if (sqlException instanceof SQLFeatureNotSupportedException
                || sqlException instanceof SQLSyntaxErrorException
                || sqlException instanceof SQLTimeoutException) {
            return Override.DO_NOT_EVICT;
        }
        String sqlState = sqlException.getSQLState();
        if (sqlState != null && (sqlState.startsWith("0A") || sqlState.startsWith("42") || "57014".equals(sqlState))) {
            return Override.DO_NOT_EVICT;
        }
        return Override.CONTINUE_EVICT;
    }
}
