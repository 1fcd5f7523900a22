package io.sigmatics.core.backend;

import java.util.List;

/** A linear op list for one backend. Ops run in list order. */
public sealed interface BackendPlan {

    BackendKind backend();

    List<PlanOp> ops();

    default boolean isEmpty() {
        return ops().isEmpty();
    }

    /** Plan for the class backend; never contains SGA-only ops. */
    record ClassPlan(List<PlanOp> ops) implements BackendPlan {
        public ClassPlan {
            ops = List.copyOf(ops);
            for (PlanOp op : ops) {
                if (op.code().sgaOnly()) {
                    throw new IllegalArgumentException("op not supported by the class backend: " + op);
                }
            }
        }

        @Override
        public BackendKind backend() {
            return BackendKind.CLASS;
        }
    }

    record SgaPlan(List<PlanOp> ops) implements BackendPlan {
        public SgaPlan {
            ops = List.copyOf(ops);
        }

        @Override
        public BackendKind backend() {
            return BackendKind.SGA;
        }
    }
}
