package io.sigmatics.core.backend;

import io.sigmatics.core.algebra.AlgebraicElement;
import io.sigmatics.core.algebra.ElementTransforms;
import io.sigmatics.core.bridge.Bridge;
import io.sigmatics.core.error.MissingRuntimeParameterException;
import io.sigmatics.core.error.ProjectClassRequiresInputException;
import io.sigmatics.core.ir.AtomOp;
import io.sigmatics.core.ir.IrNode;
import io.sigmatics.core.ir.TransformOp;
import io.sigmatics.core.spi.LoweringBackend;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.OptionalInt;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * General backend over algebraic elements. Accepts every IR construct, including grade projection.
 *
 * <p>The state is an {@link AlgebraicElement}, or a bare number while only ring ops have run. Numbers
 * are lifted when an element op needs them; elements are bridged back to class indices (and must be
 * rank-1) when a ring op needs them. Ring results therefore match the class backend exactly.
 */
public final class SgaBackend implements LoweringBackend {

    private static final Logger LOG = LoggerFactory.getLogger(SgaBackend.class);

    @Override
    public BackendKind id() {
        return BackendKind.SGA;
    }

    @Override
    public BackendPlan lower(IrNode node, String modelName) {
        Objects.requireNonNull(node, "node must not be null");
        BackendPlan plan = new BackendPlan.SgaPlan(Lowering.linearize(node, SgaBackend::lowerAtom));
        LOG.debug("Lowered to SGA backend: model={}, ops={}", modelName, plan.ops());
        return plan;
    }

    private static PlanOp lowerAtom(AtomOp op) {
        return switch (op.kind()) {
            case CLASS_LITERAL -> new PlanOp.Lift(((AtomOp.ClassLiteral) op).value());
            case PARAM -> new PlanOp.Param(((AtomOp.Param) op).name());
            case LIFT -> new PlanOp.Lift(((AtomOp.Lift) op).classIndex());
            case PROJECT_GRADE -> new PlanOp.ProjectGrade(((AtomOp.ProjectGrade) op).grade());
            case PROJECT_CLASS -> new PlanOp.ProjectClass();
            case RING -> {
                AtomOp.Ring ring = (AtomOp.Ring) op;
                yield new PlanOp.Ring(ring.op(), ring.overflowMode());
            }
        };
    }

    @Override
    public ExecutionResult execute(BackendPlan plan, Map<String, ?> params, String modelName) {
        Objects.requireNonNull(plan, "plan must not be null");
        RuntimeInputs inputs = new RuntimeInputs(params, modelName);
        Object state = null;
        boolean tracked = false;
        boolean overflow = false;

        List<PlanOp> ops = plan.ops();
        for (int i = 0; i < ops.size(); i++) {
            PlanOp op = ops.get(i);
            switch (op.code()) {
                case LITERAL -> state = ((PlanOp.Literal) op).classIndex();
                case PARAM -> state = inputs.require(((PlanOp.Param) op).name(), i);
                case LIFT -> state = Bridge.lift(((PlanOp.Lift) op).classIndex());
                case RING -> {
                    PlanOp.Ring ring = (PlanOp.Ring) op;
                    RingArithmetic.Outcome outcome;
                    if (ring.op().isFold()) {
                        outcome = RingArithmetic.fold(ring.op(), inputs.requireValues("values", i));
                    } else {
                        Object a = state != null ? state : inputs.require("a", i);
                        Object b = inputs.require("b", i);
                        outcome = RingArithmetic.binary(ring.op(), toClassIndex(a), toClassIndex(b));
                    }
                    state = outcome.value();
                    tracked = ring.tracked();
                    overflow = outcome.overflow();
                    continue;
                }
                case TRANSFORM -> state = apply(
                        ((PlanOp.Transform) op).transform(), currentElement(state, inputs, i));
                case PROJECT_GRADE -> state = currentElement(state, inputs, i)
                        .gradeProject(((PlanOp.ProjectGrade) op).grade());
                case PROJECT_CLASS -> {
                    Object source = state;
                    if (source == null) {
                        if (!inputs.has("x")) {
                            throw new ProjectClassRequiresInputException(modelName, i);
                        }
                        source = inputs.require("x", i);
                    }
                    if (source instanceof AlgebraicElement element) {
                        OptionalInt index = Bridge.project(element);
                        if (index.isEmpty()) {
                            return ExecutionResult.absent();
                        }
                        state = index.getAsInt();
                    } else {
                        state = source;
                    }
                }
                case MULTIPLY -> state = currentElement(state, inputs, i)
                        .multiply(((PlanOp.Multiply) op).operand());
                case ADD -> state = currentElement(state, inputs, i).add(((PlanOp.Add) op).operand());
                case SCALE -> state = currentElement(state, inputs, i).scale(((PlanOp.Scale) op).factor());
            }
            tracked = false;
        }

        if (state == null) {
            return ExecutionResult.fallback();
        }
        if (state instanceof AlgebraicElement element) {
            return ExecutionResult.element(element);
        }
        int value = (Integer) state;
        return tracked ? ExecutionResult.ring(value, overflow) : ExecutionResult.value(value);
    }

    /** The state as an element: numbers are lifted, and before any state the input {@code x} is used. */
    private static AlgebraicElement currentElement(Object state, RuntimeInputs inputs, int opIndex) {
        Object value = state;
        if (value == null) {
            if (!inputs.has("x")) {
                throw new MissingRuntimeParameterException("x", inputs.modelName(), opIndex);
            }
            value = inputs.require("x", opIndex);
        }
        return value instanceof AlgebraicElement element ? element : Bridge.lift((Integer) value);
    }

    private static int toClassIndex(Object operand) {
        return operand instanceof AlgebraicElement element ? Bridge.projectStrict(element) : (Integer) operand;
    }

    /** Applies a transform to an element through the matching SGA endomorphism. */
    static AlgebraicElement apply(TransformOp transform, AlgebraicElement element) {
        int k = transform.power();
        return switch (transform.kind()) {
            case R -> ElementTransforms.rotate(element, k);
            case D -> ElementTransforms.triality(element, k);
            case T -> ElementTransforms.twist(element, k);
            case M -> ElementTransforms.mirror(element);
        };
    }
}
