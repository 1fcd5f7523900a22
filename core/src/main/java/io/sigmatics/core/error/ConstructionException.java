package io.sigmatics.core.error;

/**
 * Abstract parent for errors raised while building IR nodes, algebraic values or model
 * descriptors. These are caller mistakes: the offending value never reaches the compiler.
 */
public abstract class ConstructionException extends SigmaticsException {

    private static final long serialVersionUID = 1L;

    protected ConstructionException(String message, String modelName) {
        super(Phase.CONSTRUCTION, modelName, message);
    }

    protected ConstructionException(String message, Throwable cause, String modelName) {
        super(Phase.CONSTRUCTION, modelName, message, cause);
    }
}
