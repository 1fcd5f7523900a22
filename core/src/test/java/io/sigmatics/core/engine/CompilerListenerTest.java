package io.sigmatics.core.engine;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.sigmatics.core.backend.BackendKind;
import io.sigmatics.core.error.UnknownModelException;
import io.sigmatics.core.ir.OverflowMode;
import io.sigmatics.core.model.ComplexityClass;
import io.sigmatics.core.model.ModelDescriptor;
import io.sigmatics.core.spi.CompilerListener;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

/**
 * Tests for the {@link CompilerListener} SPI: compiled, cache-hit and rejected events, and isolation
 * from listeners that throw.
 */
@DisplayName("CompilerListenerTest")
class CompilerListenerTest {

    private static ModelCompiler compilerWith(CompilerListener listener) {
        return new ModelCompiler(
                BackendRegistry.withDefaults(),
                ModelRecipes.standard(),
                new SchemaRegistry(),
                new ModelCache(),
                CompilerOptions.DEFAULT,
                listener);
    }

    @Test
    @DisplayName("First compile → compiled event, second → cache hit")
    void compileThenCacheHit() {
        CapturingListener listener = new CapturingListener();
        ModelCompiler compiler = compilerWith(listener);

        CompiledModel model = compiler.compile(StandardModels.add96(OverflowMode.TRACK));
        compiler.compile(StandardModels.add96(OverflowMode.TRACK));

        assertThat(listener.compiled).hasSize(1);
        CompilerListener.ModelCompiledEvent event = listener.compiled.get(0);
        assertThat(event.modelName()).isEqualTo("add96");
        assertThat(event.cacheKey()).isEqualTo(model.cacheKey());
        assertThat(event.complexity()).isEqualTo(ComplexityClass.C1);
        assertThat(event.backend()).isEqualTo(BackendKind.CLASS);
        assertThat(event.opCount()).isEqualTo(1);
        assertThat(event.folded()).isFalse();
        assertThat(event.durationMicros()).isNotNegative();

        assertThat(listener.cacheHits)
                .containsExactly(new CompilerListener.CacheHitEvent("add96", model.cacheKey()));
        assertThat(listener.rejected).isEmpty();
    }

    @Test
    @DisplayName("Folded model → folded flag set")
    void foldedModel() {
        CapturingListener listener = new CapturingListener();

        compilerWith(listener).compile(StandardModels.lift(3));

        assertThat(listener.compiled).singleElement().satisfies(e -> {
            assertThat(e.folded()).isTrue();
            assertThat(e.complexity()).isEqualTo(ComplexityClass.C0);
        });
    }

    @Test
    @DisplayName("Failed compile → rejected event with error code")
    void rejection() {
        CapturingListener listener = new CapturingListener();
        ModelCompiler compiler = compilerWith(listener);

        assertThatThrownBy(() -> compiler.compile(ModelDescriptor.builder("nope").build()))
                .isInstanceOf(UnknownModelException.class);

        assertThat(listener.rejected)
                .containsExactly(new CompilerListener.ModelRejectedEvent("nope", "UnknownModel", "UnknownModel: nope"));
        assertThat(listener.compiled).isEmpty();
    }

    @Test
    @DisplayName("Throwing listener → compilation unaffected")
    void throwingListenerIsIsolated() {
        ModelCompiler compiler = compilerWith(new CompilerListener() {
            @Override
            public void onModelCompiled(ModelCompiledEvent event) {
                throw new IllegalStateException("listener bug");
            }

            @Override
            public void onCacheHit(CacheHitEvent event) {
                throw new IllegalStateException("listener bug");
            }

            @Override
            public void onModelRejected(ModelRejectedEvent event) {
                throw new IllegalStateException("listener bug");
            }
        });

        CompiledModel model = compiler.compile(StandardModels.sub96(OverflowMode.DROP));
        assertThat(compiler.compile(StandardModels.sub96(OverflowMode.DROP))).isSameAs(model);
        assertThat(model.run(Map.of("a", 1, "b", 2)).classIndex()).hasValue(95);
        assertThatThrownBy(() -> compiler.compile(ModelDescriptor.builder("nope").build()))
                .isInstanceOf(UnknownModelException.class);
    }

    private static final class CapturingListener implements CompilerListener {
        final List<ModelCompiledEvent> compiled = new CopyOnWriteArrayList<>();
        final List<CacheHitEvent> cacheHits = new CopyOnWriteArrayList<>();
        final List<ModelRejectedEvent> rejected = new CopyOnWriteArrayList<>();

        @Override
        public void onModelCompiled(ModelCompiledEvent event) {
            compiled.add(event);
        }

        @Override
        public void onCacheHit(CacheHitEvent event) {
            cacheHits.add(event);
        }

        @Override
        public void onModelRejected(ModelRejectedEvent event) {
            rejected.add(event);
        }
    }
}
