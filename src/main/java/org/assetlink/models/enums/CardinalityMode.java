package org.assetlink.models.enums;

import java.util.Locale;

public enum CardinalityMode {
    ALL,
    UNIQUE,
    MULTIPLE;

    public boolean matches(int sourceCount) {
        return switch (this) {
            case ALL -> true;
            case UNIQUE -> sourceCount == 1;
            case MULTIPLE -> sourceCount > 1;
        };
    }

    /**
     * Accepts the enum names as well as {@code exactly-one-source} and {@code more-than-one-source}.
     * Blank input means {@link #ALL}.
     */
    public static CardinalityMode fromParameter(String value) {
        if (value == null || value.isBlank()) {
            return ALL;
        }
        String normalized = value.trim().toLowerCase(Locale.ROOT);
        return switch (normalized) {
            case "all" -> ALL;
            case "unique", "exactly-one-source", "single" -> UNIQUE;
            case "multiple", "more-than-one-source", "synced" -> MULTIPLE;
            default -> throw new IllegalArgumentException("Unknown cardinality mode: " + value);
        };
    }
}
