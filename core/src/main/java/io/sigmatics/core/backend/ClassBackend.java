package io.sigmatics.core.backend;

import io.sigmatics.core.algebra.ClassIndex;
import io.sigmatics.core.compiler.ComplexityAnalyzer;
import io.sigmatics.core.error.GradeProjectionRequiresSgaException;
import io.sigmatics.core.ir.AtomOp;
import io.sigmatics.core.ir.IrNode;
import io.sigmatics.core.ir.TransformOp;
import io.sigmatics.core.spi.LoweringBackend;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Fast backend over bare class indices.
 *
 * <p>Execution keeps a single numeric state. Ring ops take operand {@code a} from the state once one
 * is established, otherwise from the runtime input {@code a}; operand {@code b} always comes from the
 * input {@code b}. Transforms act on the state, or on the input {@code x} before any state exists. A
 * plan that never establishes a state yields {@link ExecutionResult#fallback()}.
 */
public final class ClassBackend implements LoweringBackend {

    private static final Logger LOG = LoggerFactory.getLogger(ClassBackend.class);

    @Override
    public BackendKind id() {
        return BackendKind.CLASS;
    }

    /**
     * @throws GradeProjectionRequiresSgaException if a grade projection appears anywhere in the tree
     */
    @Override
    public BackendPlan lower(IrNode node, String modelName) {
        Objects.requireNonNull(node, "node must not be null");
        if (ComplexityAnalyzer.requiresSgaBackend(node)) {
            throw new GradeProjectionRequiresSgaException(modelName);
        }
        BackendPlan plan = new BackendPlan.ClassPlan(Lowering.linearize(node, op -> lowerAtom(op, modelName)));
        LOG.debug("Lowered to class backend: model={}, ops={}", modelName, plan.ops());
        return plan;
    }

    private static PlanOp lowerAtom(AtomOp op, String modelName) {
        return switch (op.kind()) {
            case CLASS_LITERAL -> new PlanOp.Literal(((AtomOp.ClassLiteral) op).value());
            case PARAM -> new PlanOp.Param(((AtomOp.Param) op).name());
            case LIFT -> new PlanOp.Lift(((AtomOp.Lift) op).classIndex());
            case PROJECT_CLASS -> new PlanOp.ProjectClass();
            case RING -> {
                AtomOp.Ring ring = (AtomOp.Ring) op;
                yield new PlanOp.Ring(ring.op(), ring.overflowMode());
            }
            case PROJECT_GRADE -> throw new GradeProjectionRequiresSgaException(modelName);
        };
    }

    @Override
    public ExecutionResult execute(BackendPlan plan, Map<String, ?> params, String modelName) {
        Objects.requireNonNull(plan, "plan must not be null");
        if (plan.backend() != BackendKind.CLASS) {
            throw new IllegalArgumentException("class backend cannot run a " + plan.backend().id() + " plan");
        }
        RuntimeInputs inputs = new RuntimeInputs(params, modelName);
        Integer state = null;
        boolean tracked = false;
        boolean overflow = false;

        List<PlanOp> ops = plan.ops();
        for (int i = 0; i < ops.size(); i++) {
            PlanOp op = ops.get(i);
            switch (op.code()) {
                case LITERAL -> {
                    state = ((PlanOp.Literal) op).classIndex();
                    tracked = false;
                }
                case PARAM -> {
                    state = inputs.requireInt(((PlanOp.Param) op).name(), i);
                    tracked = false;
                }
                case LIFT -> {
                    state = ((PlanOp.Lift) op).classIndex();
                    tracked = false;
                }
                case RING -> {
                    PlanOp.Ring ring = (PlanOp.Ring) op;
                    RingArithmetic.Outcome outcome;
                    if (ring.op().isFold()) {
                        outcome = RingArithmetic.fold(ring.op(), inputs.requireValues("values", i));
                    } else {
                        int a = state != null ? state : inputs.requireInt("a", i);
                        int b = inputs.requireInt("b", i);
                        outcome = RingArithmetic.binary(ring.op(), a, b);
                    }
                    state = outcome.value();
                    tracked = ring.tracked();
                    overflow = outcome.overflow();
                }
                case TRANSFORM -> {
                    int x = state != null ? state : inputs.requireInt("x", i);
                    state = apply(((PlanOp.Transform) op).transform(), x);
                    tracked = false;
                }
                case PROJECT_CLASS -> {
                    if (state == null && inputs.has("x")) {
                        state = inputs.requireInt("x", i);
                    }
                }
                case PROJECT_GRADE, MULTIPLY, ADD, SCALE -> throw new IllegalStateException(
                        "class plan contains SGA-only op " + op);
            }
        }

        if (state == null) {
            return ExecutionResult.fallback();
        }
        return tracked ? ExecutionResult.ring(state, overflow) : ExecutionResult.value(state);
    }

    /** Applies a transform to a class index by rotating the matching coordinate. */
    static int apply(TransformOp transform, int classIndex) {
        int k = transform.power();
        return switch (transform.kind()) {
            case R -> ClassIndex.rotate(classIndex, k);
            case D -> ClassIndex.triality(classIndex, k);
            case T -> ClassIndex.twist(classIndex, k);
            case M -> ClassIndex.mirror(classIndex);
        };
    }
}
