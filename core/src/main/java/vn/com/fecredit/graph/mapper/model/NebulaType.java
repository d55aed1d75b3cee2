package vn.com.fecredit.graph.mapper.model;

import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Canonical property types of the target graph schema.
 */
public enum NebulaType {
    BOOL,
    INT64,
    DOUBLE,
    STRING,
    FIXED_STRING,
    TIMESTAMP,
    DATE,
    TIME,
    DATETIME;

    private static final Map<String, NebulaType> ALIASES = Map.ofEntries(
            Map.entry("INT", INT64),
            Map.entry("INTEGER", INT64),
            Map.entry("INT8", INT64),
            Map.entry("INT16", INT64),
            Map.entry("INT32", INT64),
            Map.entry("FLOAT", DOUBLE),
            Map.entry("BOOLEAN", BOOL),
            Map.entry("VARCHAR", STRING));

    /**
     * Resolves a declared type name, case-insensitively, through the alias table.
     *
     * @return the canonical type, or empty when the name is unknown
     */
    public static Optional<NebulaType> lookup(String name) {
        if (name == null || name.isBlank()) return Optional.empty();
        String up = name.trim().toUpperCase(Locale.ROOT);
        NebulaType alias = ALIASES.get(up);
        if (alias != null) return Optional.of(alias);
        for (NebulaType t : values()) {
            if (t.name().equals(up)) return Optional.of(t);
        }
        return Optional.empty();
    }
}
