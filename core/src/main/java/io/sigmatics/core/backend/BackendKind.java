package io.sigmatics.core.backend;

import java.util.Locale;

/** The two executable targets. */
public enum BackendKind {
    /** Bare class-index arithmetic. */
    CLASS,
    /** Full algebraic elements. */
    SGA;

    public String id() {
        return name().toLowerCase(Locale.ROOT);
    }
}
