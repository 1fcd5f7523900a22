package io.sigmatics.core.error;

/** Thrown when class projection runs with neither a current state nor an {@code x} input. */
public final class ProjectClassRequiresInputException extends EvaluationException {

    private static final long serialVersionUID = 1L;

    public static final String CODE = "ProjectClassRequiresInput";

    public ProjectClassRequiresInputException(String modelName, Integer opIndex) {
        super("projectClass requires an element state or runtime parameter 'x'", modelName, opIndex);
    }

    @Override
    public String code() {
        return CODE;
    }
}
