package io.sigmatics.core.error;

/** Thrown when an algebraic element is raised to a negative power. */
public final class NegativePowerException extends EvaluationException {

    private static final long serialVersionUID = 1L;

    public static final String CODE = "NegativePower";

    public NegativePowerException(int exponent) {
        super("Negative powers are not supported: " + exponent, null, null);
    }

    @Override
    public String code() {
        return CODE;
    }
}
