package io.sigmatics.core.engine;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.sigmatics.core.backend.BackendKind;
import io.sigmatics.core.backend.BackendPlan;
import io.sigmatics.core.backend.ClassBackend;
import io.sigmatics.core.backend.ExecutionResult;
import io.sigmatics.core.backend.SgaBackend;
import io.sigmatics.core.ir.IrNode;
import io.sigmatics.core.spi.LoweringBackend;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

class BackendRegistryTest {

    @Test
    void defaultsHoldBothBackends() {
        BackendRegistry registry = BackendRegistry.withDefaults();

        assertThat(registry.size()).isEqualTo(2);
        assertThat(registry.requireBackend(BackendKind.CLASS)).isInstanceOf(ClassBackend.class);
        assertThat(registry.requireBackend(BackendKind.SGA)).isInstanceOf(SgaBackend.class);
    }

    @Test
    void emptyRegistryReportsMissingBackend() {
        BackendRegistry registry = new BackendRegistry();

        assertThat(registry.getBackend(BackendKind.SGA)).isEmpty();
        assertThat(registry.hasBackend(BackendKind.SGA)).isFalse();
        assertThatThrownBy(() -> registry.requireBackend(BackendKind.SGA))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessage("No backend registered for id: 'sga'");
    }

    @Test
    void laterRegistrationReplacesEarlier() {
        BackendRegistry registry = BackendRegistry.withDefaults();
        LoweringBackend replacement = new ConstantBackend();

        registry.register(replacement);

        assertThat(registry.size()).isEqualTo(2);
        assertThat(registry.requireBackend(BackendKind.CLASS)).isSameAs(replacement);
    }

    @Test
    void rejectsNull() {
        assertThatThrownBy(() -> new BackendRegistry().register(null)).isInstanceOf(NullPointerException.class);
    }

    /** Class backend stand-in that lowers everything to an empty plan. */
    private static final class ConstantBackend implements LoweringBackend {
        @Override
        public BackendKind id() {
            return BackendKind.CLASS;
        }

        @Override
        public BackendPlan lower(IrNode node, String modelName) {
            return new BackendPlan.ClassPlan(List.of());
        }

        @Override
        public ExecutionResult execute(BackendPlan plan, Map<String, ?> params, String modelName) {
            return ExecutionResult.value(0);
        }
    }
}
