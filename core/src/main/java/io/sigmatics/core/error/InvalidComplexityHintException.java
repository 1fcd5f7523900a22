package io.sigmatics.core.error;

/** Thrown when a descriptor's complexity hint is not one of {@code C0..C3}. */
public final class InvalidComplexityHintException extends LoweringException {

    private static final long serialVersionUID = 1L;

    public static final String CODE = "InvalidComplexityHint";

    private final String hint;

    public InvalidComplexityHintException(String hint, String modelName) {
        super("Invalid complexity hint: '" + hint + "'. Must be one of C0, C1, C2, C3.", modelName);
        this.hint = hint;
    }

    public String hint() {
        return hint;
    }

    @Override
    public String code() {
        return CODE;
    }
}
