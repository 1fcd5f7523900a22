package io.sigmatics.core.error;

/**
 * Abstract parent for errors raised while executing a compiled plan. Carries the index of the plan
 * op that failed, when known.
 */
public abstract class EvaluationException extends SigmaticsException {

    private static final long serialVersionUID = 1L;

    private final Integer opIndex;

    protected EvaluationException(String message, String modelName, Integer opIndex) {
        super(Phase.EXECUTION, modelName, message);
        this.opIndex = opIndex;
    }

    /** Index of the failing op within the plan, or {@code null} if not raised by a plan op. */
    public Integer opIndex() {
        return opIndex;
    }
}
