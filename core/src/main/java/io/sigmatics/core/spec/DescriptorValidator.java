package io.sigmatics.core.spec;

import io.sigmatics.core.model.ComplexityClass;
import io.sigmatics.core.model.ModelDescriptor;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.regex.Pattern;

/**
 * Structural checks on a {@link ModelDescriptor}. Never fails fast: every problem is collected into
 * the returned {@link ValidationResult}.
 */
public final class DescriptorValidator {

    private static final Pattern SEMVER = Pattern.compile("^\\d+\\.\\d+\\.\\d+$");
    private static final Pattern NAME = Pattern.compile("^[A-Za-z][A-Za-z0-9_]*$");
    private static final Pattern NAMESPACE = Pattern.compile("^[a-z][a-z0-9_]*(\\.[a-z][a-z0-9_]*)*$");

    private DescriptorValidator() {}

    public static ValidationResult validate(ModelDescriptor descriptor) {
        Objects.requireNonNull(descriptor, "descriptor must not be null");
        List<String> errors = new ArrayList<>();

        if (isBlank(descriptor.name())) {
            errors.add("name is required");
        } else if (!NAME.matcher(descriptor.name()).matches()) {
            errors.add("name must start with a letter and contain only letters, digits and '_': '"
                    + descriptor.name() + "'");
        }

        if (isBlank(descriptor.version())) {
            errors.add("version is required");
        } else if (!SEMVER.matcher(descriptor.version()).matches()) {
            errors.add("version must follow MAJOR.MINOR.PATCH: '" + descriptor.version() + "'");
        }

        if (isBlank(descriptor.namespace())) {
            errors.add("namespace is required");
        } else if (!NAMESPACE.matcher(descriptor.namespace()).matches()) {
            errors.add("namespace must be dot-separated lowercase segments: '" + descriptor.namespace() + "'");
        }

        String hint = descriptor.complexityHint();
        if (hint != null && !isComplexityClass(hint)) {
            errors.add("complexityHint must be one of C0, C1, C2, C3: '" + hint + "'");
        }

        for (String param : descriptor.runtime()) {
            if (isBlank(param)) {
                errors.add("runtime parameter names must not be blank");
            }
        }
        if (descriptor.runtime().stream().distinct().count() != descriptor.runtime().size()) {
            errors.add("runtime parameter names must be unique: " + descriptor.runtime());
        }

        return ValidationResult.of(errors);
    }

    private static boolean isComplexityClass(String hint) {
        for (ComplexityClass c : ComplexityClass.values()) {
            if (c.name().equals(hint)) {
                return true;
            }
        }
        return false;
    }

    private static boolean isBlank(String s) {
        return s == null || s.isBlank();
    }
}
