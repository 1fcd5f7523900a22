package io.sigmatics.core.model;

/** What the compiler does with a descriptor that fails validation. */
public enum DescriptorValidationMode {
    /** Reject the descriptor with an {@link io.sigmatics.core.error.InvalidDescriptorException}. */
    STRICT,
    /** Log the problems at WARN and compile anyway. */
    LENIENT
}
