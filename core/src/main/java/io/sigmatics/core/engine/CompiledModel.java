package io.sigmatics.core.engine;

import io.sigmatics.core.backend.BackendKind;
import io.sigmatics.core.backend.BackendPlan;
import io.sigmatics.core.backend.ExecutionResult;
import io.sigmatics.core.error.MissingRuntimeParameterException;
import io.sigmatics.core.ir.IrNode;
import io.sigmatics.core.model.ComplexityClass;
import io.sigmatics.core.model.ModelDescriptor;
import io.sigmatics.core.spi.LoweringBackend;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Immutable result of compiling a {@link ModelDescriptor}: the normalized tree, its complexity class,
 * the backend plan and the entry point {@link #run(Map)}.
 *
 * <p>Thread-safe; one instance may be run concurrently with different inputs.
 */
public final class CompiledModel {

    private final ModelDescriptor descriptor;
    private final String cacheKey;
    private final IrNode ir;
    private final ComplexityClass complexity;
    private final BackendPlan plan;
    private final LoweringBackend backend;
    private final ExecutionResult constant;

    CompiledModel(
            ModelDescriptor descriptor,
            String cacheKey,
            IrNode ir,
            ComplexityClass complexity,
            BackendPlan plan,
            LoweringBackend backend,
            ExecutionResult constant) {
        this.descriptor = Objects.requireNonNull(descriptor, "descriptor must not be null");
        this.cacheKey = Objects.requireNonNull(cacheKey, "cacheKey must not be null");
        this.ir = Objects.requireNonNull(ir, "ir must not be null");
        this.complexity = Objects.requireNonNull(complexity, "complexity must not be null");
        this.plan = Objects.requireNonNull(plan, "plan must not be null");
        this.backend = Objects.requireNonNull(backend, "backend must not be null");
        this.constant = constant;
    }

    /**
     * Runs the model.
     *
     * @param params runtime inputs; every name declared in the descriptor's {@code runtime} list must be
     *     present
     * @throws MissingRuntimeParameterException if a declared runtime parameter is absent
     * @throws io.sigmatics.core.error.EvaluationException for other execution failures
     */
    public ExecutionResult run(Map<String, ?> params) {
        Map<String, ?> inputs = params == null ? Map.of() : params;
        for (String name : descriptor.runtime()) {
            if (inputs.get(name) == null) {
                throw new MissingRuntimeParameterException(name, descriptor.name(), null);
            }
        }
        if (constant != null) {
            return constant;
        }
        return backend.execute(plan, inputs, descriptor.name());
    }

    public ModelDescriptor descriptor() {
        return descriptor;
    }

    public String name() {
        return descriptor.name();
    }

    public String cacheKey() {
        return cacheKey;
    }

    /** The normalized tree the plan was lowered from. */
    public IrNode ir() {
        return ir;
    }

    /** Effective complexity class, after any descriptor hint. */
    public ComplexityClass complexity() {
        return complexity;
    }

    public BackendKind backend() {
        return plan.backend();
    }

    public BackendPlan plan() {
        return plan;
    }

    /** The value computed at compile time for folded models. */
    public Optional<ExecutionResult> constant() {
        return Optional.ofNullable(constant);
    }

    public boolean isFolded() {
        return constant != null;
    }

    @Override
    public String toString() {
        return "CompiledModel[" + cacheKey + ", " + complexity + ", " + plan.backend().id() + ", "
                + plan.ops().size() + " ops" + (constant != null ? ", folded" : "") + "]";
    }
}
