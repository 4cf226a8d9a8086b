package com.errorengine.util;

import java.util.Locale;
import java.util.Map;

/**
 * Normalizes incoming dbType (and aliases) into canonical dbType strings.
 */
public final class DbTypeNormalizer {

    private static final Map<String, String> ALIASES = Map.ofEntries(
            Map.entry("postgresql", "postgres"),
            Map.entry("pg", "postgres"),
            Map.entry("mariadb", "mysql"),
            Map.entry("sqlserver", "sqlserver"),
            Map.entry("mssql", "sqlserver"),
            Map.entry("as400", "db2i"),
            Map.entry("ibmi", "db2i"),
            Map.entry("iseries", "db2i"),
            Map.entry("sqlite3", "sqlite")
    );

    private DbTypeNormalizer() {
    }

    /**
     * Normalize dbType.
     *
     * @param dbType incoming dbType
     * @return normalized dbType (lowercased + alias mapping)
     */
    public static String normalize(String dbType) {
        if (dbType == null) {
            return "";
        }
        String v = dbType.trim().toLowerCase(Locale.ROOT);
        if (v.isBlank()) {
            return "";
        }
        return ALIASES.getOrDefault(v, v);
    }
}
