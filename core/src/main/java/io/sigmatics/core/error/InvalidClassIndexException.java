package io.sigmatics.core.error;

/** Thrown when a class index lies outside {@code 0..95}. */
public final class InvalidClassIndexException extends ConstructionException {

    private static final long serialVersionUID = 1L;

    public static final String CODE = "InvalidClassIndex";

    private final int index;

    public InvalidClassIndexException(int index) {
        super("Invalid class index: " + index + ". Must be 0..95.", null);
        this.index = index;
    }

    public int index() {
        return index;
    }

    @Override
    public String code() {
        return CODE;
    }
}
