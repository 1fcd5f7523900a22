package io.sigmatics.core.model;

import java.util.Locale;

/** Caller preference for backend selection; {@link #AUTO} defers to the complexity class. */
public enum BackendPreference {
    CLASS,
    SGA,
    AUTO;

    /**
     * Parses {@code "class"}, {@code "sga"} or {@code "auto"} (case-insensitive).
     *
     * @throws IllegalArgumentException for any other value
     */
    public static BackendPreference parse(String value) {
        if (value != null) {
            for (BackendPreference p : values()) {
                if (p.id().equals(value.toLowerCase(Locale.ROOT))) {
                    return p;
                }
            }
        }
        throw new IllegalArgumentException(
                "Invalid backend preference: '" + value + "'. Must be one of: class, sga, auto");
    }

    public String id() {
        return name().toLowerCase(Locale.ROOT);
    }
}
