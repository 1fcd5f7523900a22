package io.sigmatics.core.model;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.sigmatics.core.error.InvalidComplexityHintException;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

class ModelDescriptorTest {

    @Test
    void builderDefaults() {
        ModelDescriptor descriptor = ModelDescriptor.builder("M").build();

        assertThat(descriptor.version()).isEqualTo("1.0.0");
        assertThat(descriptor.namespace()).isEqualTo("default");
        assertThat(descriptor.compiled()).isEmpty();
        assertThat(descriptor.runtime()).isEmpty();
        assertThat(descriptor.complexityHint()).isNull();
        assertThat(descriptor.preference()).isNull();
        assertThat(descriptor.qualifiedName()).isEqualTo("default/M@1.0.0");
    }

    @Test
    void collectionsAreCopied() {
        Map<String, Object> compiled = new HashMap<>(Map.of("k", 1));
        List<String> runtime = new ArrayList<>(List.of("x"));
        ModelDescriptor descriptor = new ModelDescriptor("R", "1.0.0", "stdlib.transforms", compiled, runtime, null, null);

        compiled.put("k", 2);
        runtime.add("y");

        assertThat(descriptor.compiledInt("k", 0)).isEqualTo(1);
        assertThat(descriptor.runtime()).containsExactly("x");
        assertThatThrownBy(() -> descriptor.compiled().put("z", 3)).isInstanceOf(UnsupportedOperationException.class);
    }

    @Test
    void typedCompiledAccess() {
        ModelDescriptor descriptor = ModelDescriptor.builder("R")
                .compiled("k", 3L)
                .compiled("mode", "track")
                .compiled("label", List.of("a"))
                .build();

        assertThat(descriptor.compiledInt("k", 1)).isEqualTo(3);
        assertThat(descriptor.compiledInt("missing", 1)).isEqualTo(1);
        assertThat(descriptor.compiledString("mode", "drop")).isEqualTo("track");
        assertThat(descriptor.compiledString("missing", "drop")).isEqualTo("drop");
        assertThatThrownBy(() -> descriptor.compiledInt("mode", 0))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("'mode'");
    }

    @Test
    void equalDescriptorsAreEqual() {
        assertThat(ModelDescriptor.builder("add96").compiled("overflowMode", "track").runtime("a", "b").build())
                .isEqualTo(ModelDescriptor.builder("add96").compiled("overflowMode", "track").runtime("a", "b").build());
    }

    @ParameterizedTest
    @ValueSource(strings = {"C0", "C1", "C2", "C3"})
    void validHints(String hint) {
        assertThat(ComplexityClass.parseHint(hint, "m")).isEqualTo(ComplexityClass.valueOf(hint));
    }

    @ParameterizedTest
    @ValueSource(strings = {"c1", "C4", "", "fast"})
    void invalidHints(String hint) {
        assertThatThrownBy(() -> ComplexityClass.parseHint(hint, "m"))
                .isInstanceOf(InvalidComplexityHintException.class);
    }

    @Test
    void preferenceParsing() {
        assertThat(BackendPreference.parse("SGA")).isEqualTo(BackendPreference.SGA);
        assertThat(BackendPreference.AUTO.id()).isEqualTo("auto");
        assertThatThrownBy(() -> BackendPreference.parse("gpu"))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("class, sga, auto");
    }
}
