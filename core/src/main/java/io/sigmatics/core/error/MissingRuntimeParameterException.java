package io.sigmatics.core.error;

/** Thrown when a plan needs a runtime input that the caller did not supply. */
public final class MissingRuntimeParameterException extends EvaluationException {

    private static final long serialVersionUID = 1L;

    public static final String CODE = "MissingRuntimeParameter";

    private final String parameter;

    public MissingRuntimeParameterException(String parameter, String modelName, Integer opIndex) {
        super("Missing runtime parameter: '" + parameter + "'", modelName, opIndex);
        this.parameter = parameter;
    }

    public String parameter() {
        return parameter;
    }

    @Override
    public String code() {
        return CODE;
    }
}
