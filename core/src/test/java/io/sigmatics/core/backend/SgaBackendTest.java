package io.sigmatics.core.backend;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.sigmatics.core.algebra.AlgebraicElement;
import io.sigmatics.core.algebra.Blade;
import io.sigmatics.core.algebra.Multivector;
import io.sigmatics.core.bridge.Bridge;
import io.sigmatics.core.error.MissingRuntimeParameterException;
import io.sigmatics.core.error.NonRank1Exception;
import io.sigmatics.core.error.ProjectClassRequiresInputException;
import io.sigmatics.core.ir.Ir;
import io.sigmatics.core.ir.IrNode;
import io.sigmatics.core.ir.OverflowMode;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

/** Tests for {@link SgaBackend}. */
class SgaBackendTest {

    private final SgaBackend backend = new SgaBackend();

    private static final AlgebraicElement COMPOSITE = AlgebraicElement.of(
            2, 1, Multivector.of(Map.of(Blade.SCALAR, 3, Blade.of(4), 1, Blade.of(1, 2), -2, Blade.of(3, 5), 1)));

    private ExecutionResult run(IrNode node, Map<String, ?> params) {
        return backend.execute(backend.lower(node), params);
    }

    private static AlgebraicElement element(ExecutionResult result) {
        assertThat(result).isInstanceOf(ExecutionResult.ElementValue.class);
        return ((ExecutionResult.ElementValue) result).element();
    }

    @Test
    void literalsLowerToLifts() {
        BackendPlan plan = backend.lower(Ir.classLiteral(5));
        assertThat(plan.backend()).isEqualTo(BackendKind.SGA);
        assertThat(plan.ops()).containsExactly(new PlanOp.Lift(5));
        assertThat(backend.execute(plan, Map.of())).isEqualTo(ExecutionResult.element(Bridge.lift(5)));
    }

    @Test
    void transformedLiteralMatchesClassArithmetic() {
        ExecutionResult result = run(Ir.rotate(Ir.classLiteral(3), 1), Map.of());
        assertThat(element(result)).isEqualTo(Bridge.lift(27));
        assertThat(result.classIndex()).hasValue(27);
    }

    @Nested
    @DisplayName("grade projection")
    class GradeProjection {

        @Test
        void keepsGroupCoordinates() {
            AlgebraicElement projected = element(run(Ir.projectGrade(2), Map.of("x", COMPOSITE)));
            assertThat(projected.z4()).isEqualTo(2);
            assertThat(projected.z3()).isEqualTo(1);
            assertThat(projected.clifford())
                    .isEqualTo(Multivector.of(Map.of(Blade.of(1, 2), -2, Blade.of(3, 5), 1)));
        }

        @Test
        void projectsLiftedState() {
            ExecutionResult result = run(Ir.seq(Ir.lift(29), Ir.projectGrade(1)), Map.of());
            assertThat(element(result)).isEqualTo(Bridge.lift(29));
            assertThat(element(run(Ir.seq(Ir.lift(29), Ir.projectGrade(0)), Map.of())).isZero()).isTrue();
        }

        @Test
        void liftsNumericInput() {
            assertThat(element(run(Ir.projectGrade(0), Map.of("x", 24)))).isEqualTo(Bridge.lift(24));
        }

        @Test
        void requiresInputWithoutState() {
            assertThatThrownBy(() -> run(Ir.projectGrade(1), Map.of()))
                    .isInstanceOf(MissingRuntimeParameterException.class)
                    .hasMessageContaining("'x'");
        }
    }

    @Nested
    @DisplayName("class projection")
    class ClassProjection {

        @Test
        void rank1ElementProjects() {
            assertThat(run(Ir.projectClass(), Map.of("x", Bridge.lift(7)))).isEqualTo(ExecutionResult.value(7));
        }

        @Test
        void numberPassesThrough() {
            assertThat(run(Ir.projectClass(), Map.of("x", 42))).isEqualTo(ExecutionResult.value(42));
        }

        @Test
        void compositeIsAbsent() {
            ExecutionResult result = run(Ir.projectClass(), Map.of("x", COMPOSITE));
            assertThat(result.kind()).isEqualTo(ExecutionResult.Kind.ABSENT);
            assertThat(result.classIndex()).isEmpty();
        }

        @Test
        void projectsState() {
            IrNode node = Ir.seq(Ir.twist(Ir.lift(7), 1), Ir.projectClass());
            assertThat(run(node, Map.of())).isEqualTo(ExecutionResult.value(0));
        }

        @Test
        void failsWithoutAnyInput() {
            assertThatThrownBy(() -> run(Ir.projectClass(), Map.of()))
                    .isInstanceOf(ProjectClassRequiresInputException.class);
        }
    }

    @Nested
    @DisplayName("ring ops")
    class RingOps {

        private final ClassBackend classBackend = new ClassBackend();

        @ParameterizedTest
        @CsvSource({"80, 30", "10, 15", "10, 10", "0, 0", "95, 95", "48, 2"})
        void agreeWithClassBackend(int a, int b) {
            for (IrNode node : List.of(
                    Ir.add96(OverflowMode.TRACK),
                    Ir.sub96(OverflowMode.TRACK),
                    Ir.mul96(OverflowMode.TRACK),
                    Ir.mul96(OverflowMode.DROP),
                    Ir.gcd96(),
                    Ir.lcm96())) {
                Map<String, Integer> params = Map.of("a", a, "b", b);
                assertThat(run(node, params)).isEqualTo(classBackend.execute(classBackend.lower(node), params));
            }
        }

        @Test
        void rank1OperandsAreBridged() {
            ExecutionResult result = run(Ir.add96(OverflowMode.TRACK), Map.of("a", Bridge.lift(80), "b", 30));
            assertThat(result).isEqualTo(ExecutionResult.ring(14, true));
        }

        @Test
        void liftedStateFeedsFirstOperand() {
            IrNode node = Ir.seq(Ir.classLiteral(10), Ir.sub96(OverflowMode.TRACK));
            assertThat(run(node, Map.of("b", 15))).isEqualTo(ExecutionResult.ring(91, true));
        }

        @Test
        void compositeOperandFails() {
            assertThatThrownBy(() -> run(Ir.add96(OverflowMode.DROP), Map.of("a", COMPOSITE, "b", 1)))
                    .isInstanceOf(NonRank1Exception.class);
        }

        @Test
        void foldsMatchClassBackend() {
            assertThat(run(Ir.product96(), Map.of("values", List.of(10, 10)))).isEqualTo(ExecutionResult.value(4));
        }
    }

    @Nested
    @DisplayName("element ops")
    class ElementOps {

        @Test
        void multiplyByOperand() {
            BackendPlan plan = new BackendPlan.SgaPlan(List.of(new PlanOp.Lift(5), new PlanOp.Multiply(Bridge.lift(5))));
            ExecutionResult result = backend.execute(plan, Map.of());
            assertThat(element(result)).isEqualTo(AlgebraicElement.of(0, 0, Multivector.scalar(-1)));
            assertThat(result.classIndex()).isEmpty();
        }

        @Test
        void scaleAndAdd() {
            BackendPlan plan = new BackendPlan.SgaPlan(
                    List.of(new PlanOp.Lift(1), new PlanOp.Add(Bridge.lift(2)), new PlanOp.Scale(3)));
            assertThat(element(backend.execute(plan, Map.of())).clifford())
                    .isEqualTo(Multivector.basis(1).add(Multivector.basis(2)).scale(3));
        }

        @Test
        void elementOpsReadInputWithoutState() {
            BackendPlan plan = new BackendPlan.SgaPlan(List.of(new PlanOp.Scale(2)));
            assertThat(element(backend.execute(plan, Map.of("x", 3))).clifford())
                    .isEqualTo(Multivector.term(Blade.generator(3), 2));
        }
    }

    @Test
    void emptyPlanFallsBackToZero() {
        ExecutionResult result = backend.execute(new BackendPlan.SgaPlan(List.of()), Map.of());
        assertThat(result).isInstanceOf(ExecutionResult.Fallback.class);
        assertThat(((ExecutionResult.Fallback) result).value()).isZero();
    }
}
