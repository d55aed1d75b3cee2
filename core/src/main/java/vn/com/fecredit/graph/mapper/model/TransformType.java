package vn.com.fecredit.graph.mapper.model;

import java.util.Locale;

public enum TransformType {
    NONE,
    /** Array elements matched against rules become boolean properties. */
    ARRAY_TO_BOOL,
    ARRAY_JOIN,
    CUSTOM;

    /**
     * Unknown or blank names map to CUSTOM when rules or a function are present,
     * which is how mapping files usually spell their own transforms.
     */
    public static TransformType fromName(String name) {
        if (name == null || name.isBlank()) return NONE;
        switch (name.trim().toUpperCase(Locale.ROOT)) {
            case "NONE": return NONE;
            case "ARRAY_TO_BOOL": return ARRAY_TO_BOOL;
            case "ARRAY_JOIN": case "JOIN": return ARRAY_JOIN;
            default: return CUSTOM;
        }
    }
}
