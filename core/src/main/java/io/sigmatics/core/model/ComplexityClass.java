package io.sigmatics.core.model;

import io.sigmatics.core.error.InvalidComplexityHintException;

/** Fusion and backend-eligibility tier assigned to a normalized tree. */
public enum ComplexityClass {
    /** Single compiled atom with no runtime inputs; folded to a constant. */
    C0,
    /** Class-pure and shallow; runs on the class backend. */
    C1,
    /** Needs grade projection but stays shallow; runs on the SGA backend. */
    C2,
    /** Deeply sequenced; runs on the SGA backend. */
    C3;

    /**
     * Parses an externally supplied hint.
     *
     * @throws InvalidComplexityHintException if the hint is not exactly one of {@code C0..C3}
     */
    public static ComplexityClass parseHint(String hint, String modelName) {
        if (hint != null) {
            for (ComplexityClass c : values()) {
                if (c.name().equals(hint)) {
                    return c;
                }
            }
        }
        throw new InvalidComplexityHintException(hint, modelName);
    }
}
