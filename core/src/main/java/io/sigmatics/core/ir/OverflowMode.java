package io.sigmatics.core.ir;

import java.util.Locale;

/** How a ring op reports results that wrapped around the modulus. */
public enum OverflowMode {
    /** Return the bare reduced value. */
    DROP,
    /** Return the reduced value together with an overflow flag. */
    TRACK;

    /**
     * Parses {@code "drop"} or {@code "track"} (case-insensitive).
     *
     * @throws IllegalArgumentException for any other value
     */
    public static OverflowMode parse(String value) {
        if (value == null) {
            throw new IllegalArgumentException("overflow mode must not be null");
        }
        return switch (value.toLowerCase(Locale.ROOT)) {
            case "drop" -> DROP;
            case "track" -> TRACK;
            default -> throw new IllegalArgumentException(
                    "Invalid overflow mode: '" + value + "'. Must be one of: drop, track");
        };
    }

    public String id() {
        return name().toLowerCase(Locale.ROOT);
    }
}
