package io.sigmatics.core.error;

/** Thrown when an element must be projected to a class index but is not rank-1. */
public final class NonRank1Exception extends EvaluationException {

    private static final long serialVersionUID = 1L;

    public static final String CODE = "NonRank1";

    public NonRank1Exception(String element) {
        super("Element is not rank-1 and has no class index: " + element, null, null);
    }

    @Override
    public String code() {
        return CODE;
    }
}
