package io.sigmatics.core.error;

import java.util.List;

/**
 * Thrown when a model descriptor fails structural or schema validation. Carries every validation
 * message collected, not just the first one.
 */
public final class InvalidDescriptorException extends ConstructionException {

    private static final long serialVersionUID = 1L;

    public static final String CODE = "InvalidDescriptor";

    private final String source;
    private final List<String> errors;

    public InvalidDescriptorException(String message, String modelName, String source, List<String> errors) {
        super(message, modelName);
        this.source = source;
        this.errors = errors == null ? List.of() : List.copyOf(errors);
    }

    public InvalidDescriptorException(String message, Throwable cause, String modelName, String source) {
        super(message, cause, modelName);
        this.source = source;
        this.errors = List.of(message);
    }

    /** The file path or resource that was being read, or {@code null} for in-memory descriptors. */
    public String source() {
        return source;
    }

    /** Validation messages, in the order they were found. */
    public List<String> errors() {
        return errors;
    }

    @Override
    public String code() {
        return CODE;
    }
}
