package io.sigmatics.core.spi;

import io.sigmatics.core.backend.BackendKind;
import io.sigmatics.core.backend.BackendPlan;
import io.sigmatics.core.backend.ExecutionResult;
import io.sigmatics.core.ir.IrNode;
import java.util.Map;

/**
 * Service Provider Interface for a compilation target. A backend lowers an IR tree to a linear
 * {@link BackendPlan} and executes its own plans.
 *
 * <p>Implementations must be stateless and thread-safe: one instance serves every compiled model.
 */
public interface LoweringBackend {

    /** The backend this implementation provides. */
    BackendKind id();

    /**
     * Lowers a tree to an op list.
     *
     * @param node the tree, normally already normalized
     * @param modelName the model being compiled, for error context; may be {@code null}
     * @throws io.sigmatics.core.error.LoweringException if the tree uses an op this backend cannot run
     */
    BackendPlan lower(IrNode node, String modelName);

    default BackendPlan lower(IrNode node) {
        return lower(node, null);
    }

    /**
     * Runs a plan against runtime inputs.
     *
     * @throws io.sigmatics.core.error.EvaluationException if a required input is missing or invalid
     */
    ExecutionResult execute(BackendPlan plan, Map<String, ?> params, String modelName);

    default ExecutionResult execute(BackendPlan plan, Map<String, ?> params) {
        return execute(plan, params, null);
    }
}
