package io.sigmatics.core.error;

/** Thrown when a tree containing a grade projection is lowered to the class backend. */
public final class GradeProjectionRequiresSgaException extends LoweringException {

    private static final long serialVersionUID = 1L;

    public static final String CODE = "GradeProjectionRequiresSga";

    public GradeProjectionRequiresSgaException(String modelName) {
        super("Grade projection requires SGA backend", modelName);
    }

    @Override
    public String code() {
        return CODE;
    }
}
