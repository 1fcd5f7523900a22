package io.sigmatics.core.engine;

import io.sigmatics.core.model.BackendPreference;
import io.sigmatics.core.model.DescriptorValidationMode;
import java.util.Objects;

/**
 * Compiler configuration.
 *
 * @param defaultPreference backend preference for descriptors that state none
 * @param validationMode how descriptor validation failures are handled
 * @param constantFolding whether C0 models are evaluated at compile time
 */
public record CompilerOptions(
        BackendPreference defaultPreference, DescriptorValidationMode validationMode, boolean constantFolding) {

    /** Auto backend selection, strict validation, folding on. */
    public static final CompilerOptions DEFAULT =
            new CompilerOptions(BackendPreference.AUTO, DescriptorValidationMode.STRICT, true);

    public CompilerOptions {
        Objects.requireNonNull(defaultPreference, "defaultPreference must not be null");
        Objects.requireNonNull(validationMode, "validationMode must not be null");
    }

    public CompilerOptions withDefaultPreference(BackendPreference preference) {
        return new CompilerOptions(preference, validationMode, constantFolding);
    }

    public CompilerOptions withValidationMode(DescriptorValidationMode mode) {
        return new CompilerOptions(defaultPreference, mode, constantFolding);
    }

    public CompilerOptions withConstantFolding(boolean enabled) {
        return new CompilerOptions(defaultPreference, validationMode, enabled);
    }
}
