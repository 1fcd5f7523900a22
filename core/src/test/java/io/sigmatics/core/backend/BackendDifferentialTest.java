package io.sigmatics.core.backend;

import static org.assertj.core.api.Assertions.assertThat;

import io.sigmatics.core.algebra.ClassIndex;
import io.sigmatics.core.compiler.RewriteEngine;
import io.sigmatics.core.ir.Ir;
import io.sigmatics.core.ir.IrNode;
import java.util.List;
import java.util.Map;
import java.util.stream.IntStream;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.MethodSource;

/** Runs the same transform chains through both backends and compares the class indices. */
class BackendDifferentialTest {

    private static final ClassBackend CLASS = new ClassBackend();
    private static final SgaBackend SGA = new SgaBackend();

    private static final IrNode X = Ir.param("x");

    private static final List<IrNode> CHAINS = List.of(
            Ir.rotate(X, 1),
            Ir.triality(X, 2),
            Ir.twist(X, 5),
            Ir.mirror(X),
            Ir.rotate(Ir.twist(Ir.triality(Ir.rotate(X, 1), 2), 3), 2),
            Ir.mirror(Ir.twist(Ir.triality(Ir.rotate(X, 3), 2), 5)),
            Ir.twist(Ir.mirror(Ir.rotate(X, 2)), 7),
            Ir.seq(Ir.rotate(X, 1), Ir.projectClass()));

    static IntStream allClasses() {
        return IntStream.range(0, ClassIndex.CLASS_COUNT);
    }

    @ParameterizedTest
    @MethodSource("allClasses")
    void backendsAgreeOnEveryClass(int c) {
        for (IrNode chain : CHAINS) {
            IrNode normalized = RewriteEngine.normalize(chain);
            Map<String, Integer> params = Map.of("x", c);
            ExecutionResult viaClass = CLASS.execute(CLASS.lower(normalized), params);
            ExecutionResult viaSga = SGA.execute(SGA.lower(normalized), params);
            assertThat(viaSga.classIndex())
                    .as("class %d through %s", c, chain)
                    .isEqualTo(viaClass.classIndex());
        }
    }
}
