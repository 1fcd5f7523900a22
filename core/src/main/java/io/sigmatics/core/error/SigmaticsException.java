package io.sigmatics.core.error;

/**
 * Root of every error the compiler core raises. Each concrete error sits under exactly one phase
 * parent ({@link ConstructionException}, {@link LoweringException} or {@link EvaluationException})
 * and names itself through {@link #code()}, so callers can branch on either.
 */
public abstract class SigmaticsException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    public enum Phase {
        CONSTRUCTION,
        LOWERING,
        EXECUTION
    }

    private final Phase phase;
    private final String modelName;

    protected SigmaticsException(Phase phase, String modelName, String message) {
        this(phase, modelName, message, null);
    }

    protected SigmaticsException(Phase phase, String modelName, String message, Throwable cause) {
        super(message, cause);
        this.phase = phase;
        this.modelName = modelName;
    }

    public Phase phase() {
        return phase;
    }

    /** Model being compiled or run when the error was raised; {@code null} outside a model. */
    public String modelName() {
        return modelName;
    }

    /** Stable error name, e.g. {@code InvalidClassIndex}. */
    public abstract String code();
}
