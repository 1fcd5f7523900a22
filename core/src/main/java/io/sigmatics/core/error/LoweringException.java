package io.sigmatics.core.error;

/**
 * Abstract parent for errors raised while classifying or lowering a normalized tree to a backend
 * plan. No partial plan is ever produced.
 */
public abstract class LoweringException extends SigmaticsException {

    private static final long serialVersionUID = 1L;

    protected LoweringException(String message, String modelName) {
        super(Phase.LOWERING, modelName, message);
    }
}
