package com.errorengine.util;

import org.springframework.stereotype.Component;

import java.util.Map;

/**
 * Resolves a data source DSN + dbType into a JDBC connection configuration.
 *
 * <p>A DSN that already starts with {@code jdbc:} is passed through untouched; credentials are then
 * expected inside the URL or its properties.
 */
@Component
public class JdbcConnectionInfoResolver {

    /**
     * Resolve a DSN into JDBC connection info.
     *
     * @param dsn dsn
     * @param dbType dbType, may be blank when the DSN scheme names it
     * @return jdbc connection info
     * @throws IllegalArgumentException for unparseable DSNs and unsupported database types
     */
    public JdbcConnectionInfo resolve(String dsn, String dbType) {
        if (dsn != null && dsn.trim().startsWith("jdbc:")) {
            String url = dsn.trim();
            String resolvedType = DbTypeNormalizer.normalize(
                    dbType != null && !dbType.isBlank() ? dbType : url.substring(5, Math.max(5, url.indexOf(':', 5))));
            return JdbcConnectionInfo.builder()
                    .url(url)
                    .dbType(resolvedType)
                    .dataSourceProperties(Map.of())
                    .build();
        }

        DsnParser.ParsedDsn parsed = DsnParser.parseComponents(dsn);
        String normalized = DbTypeNormalizer.normalize(dbType != null && !dbType.isBlank() ? dbType : parsed.getScheme());
        String database = parsed.getPath() != null ? parsed.getPath() : "";

        String url;
        String driverClass;
        switch (normalized) {
            case "postgres" -> {
                url = String.format("jdbc:postgresql://%s:%d/%s", parsed.getHost(), port(parsed, 5432), database);
                driverClass = "org.postgresql.Driver";
            }
            case "mysql" -> {
                url = String.format("jdbc:mysql://%s:%d/%s", parsed.getHost(), port(parsed, 3306), database);
                driverClass = null;
            }
            case "oracle" -> {
                url = buildOracleJdbcUrl(parsed);
                driverClass = null;
            }
            case "sqlserver" -> {
                url = String.format("jdbc:sqlserver://%s:%d;databaseName=%s", parsed.getHost(), port(parsed, 1433), database);
                driverClass = null;
            }
            case "db2i" -> {
                url = String.format("jdbc:as400://%s%s", parsed.getHost(), database.isEmpty() ? "" : "/" + database);
                driverClass = null;
            }
            case "h2" -> {
                url = "jdbc:h2:" + (parsed.getHost() == null || parsed.getHost().isEmpty() ? "" : parsed.getHost() + ":") + database;
                driverClass = "org.h2.Driver";
            }
            case "sqlite" -> {
                url = "jdbc:sqlite:" + (parsed.getHost() != null ? parsed.getHost() : "") + (database.isEmpty() ? "" : "/" + database);
                driverClass = null;
            }
            default -> throw new IllegalArgumentException("Unsupported database type: " + normalized);
        }

        return JdbcConnectionInfo.builder()
                .url(url)
                .username(parsed.getUsername())
                .password(parsed.getPassword())
                .dbType(normalized)
                .driverClassName(driverClass)
                .dataSourceProperties(parsed.getQueryParams())
                .build();
    }

    private static int port(DsnParser.ParsedDsn parsed, int defaultPort) {
        return parsed.getPort() > 0 ? parsed.getPort() : defaultPort;
    }

    private static String buildOracleJdbcUrl(DsnParser.ParsedDsn parsed) {
        String sid = parsed.getQueryParams().get("sid");
        if (sid != null && !sid.isEmpty()) {
            return String.format("jdbc:oracle:thin:@%s:%d:%s", parsed.getHost(), port(parsed, 1521), sid);
        }
        if (parsed.getPort() == -1 && (parsed.getPath() == null || parsed.getPath().isEmpty())) {
            // TNS alias
            return String.format("jdbc:oracle:thin:@%s", parsed.getHost());
        }
        return String.format("jdbc:oracle:thin:@//%s:%d/%s", parsed.getHost(), port(parsed, 1521), parsed.getPath());
    }
}
