package io.sigmatics.core.error;

/** Thrown when a descriptor names a model for which no IR recipe is registered. */
public final class UnknownModelException extends ConstructionException {

    private static final long serialVersionUID = 1L;

    public static final String CODE = "UnknownModel";

    public UnknownModelException(String modelName) {
        super(CODE + ": " + modelName, modelName);
    }

    @Override
    public String code() {
        return CODE;
    }
}
