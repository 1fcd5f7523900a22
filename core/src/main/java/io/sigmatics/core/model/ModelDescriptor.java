package io.sigmatics.core.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Declarative description of a model to compile. Field values are not validated here so that
 * {@link io.sigmatics.core.spec.DescriptorValidator} can report every problem at once.
 *
 * @param name recipe name, e.g. {@code add96}
 * @param version semantic version {@code MAJOR.MINOR.PATCH}
 * @param namespace grouping, e.g. {@code stdlib.ring}
 * @param compiled compile-time parameters
 * @param runtime names of the runtime parameters the model expects
 * @param complexityHint optional complexity override, raw as supplied ({@code null} when absent)
 * @param preference optional backend preference ({@code null} defers to the compiler default)
 */
public record ModelDescriptor(
        String name,
        String version,
        String namespace,
        Map<String, Object> compiled,
        List<String> runtime,
        String complexityHint,
        BackendPreference preference) {

    public ModelDescriptor {
        compiled = compiled == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(compiled));
        runtime = runtime == null ? List.of() : List.copyOf(runtime);
    }

    public static Builder builder(String name) {
        return new Builder(name);
    }

    /** {@code namespace/name@version}, used in logs. */
    public String qualifiedName() {
        return namespace + "/" + name + "@" + version;
    }

    /** Integer compile-time parameter, or {@code defaultValue} when absent. */
    public int compiledInt(String key, int defaultValue) {
        Object value = compiled.get(key);
        if (value == null) {
            return defaultValue;
        }
        if (value instanceof Number n) {
            return n.intValue();
        }
        throw new IllegalArgumentException("compiled parameter '" + key + "' must be a number, got " + value);
    }

    /** String compile-time parameter, or {@code defaultValue} when absent. */
    public String compiledString(String key, String defaultValue) {
        Object value = compiled.get(key);
        return value == null ? defaultValue : value.toString();
    }

    public static final class Builder {
        private final String name;
        private String version = "1.0.0";
        private String namespace = "default";
        private final Map<String, Object> compiled = new LinkedHashMap<>();
        private List<String> runtime = List.of();
        private String complexityHint;
        private BackendPreference preference;

        private Builder(String name) {
            this.name = Objects.requireNonNull(name, "name must not be null");
        }

        public Builder version(String version) {
            this.version = version;
            return this;
        }

        public Builder namespace(String namespace) {
            this.namespace = namespace;
            return this;
        }

        public Builder compiled(String key, Object value) {
            this.compiled.put(key, value);
            return this;
        }

        public Builder runtime(String... names) {
            this.runtime = List.of(names);
            return this;
        }

        public Builder complexityHint(String hint) {
            this.complexityHint = hint;
            return this;
        }

        public Builder prefer(BackendPreference preference) {
            this.preference = preference;
            return this;
        }

        public ModelDescriptor build() {
            return new ModelDescriptor(name, version, namespace, compiled, runtime, complexityHint, preference);
        }
    }
}
