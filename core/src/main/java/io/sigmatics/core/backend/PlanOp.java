package io.sigmatics.core.backend;

import io.sigmatics.core.algebra.AlgebraicElement;
import io.sigmatics.core.ir.OverflowMode;
import io.sigmatics.core.ir.RingOp;
import io.sigmatics.core.ir.TransformOp;
import java.util.Objects;

/**
 * One step of a linear backend plan. Executors switch on {@link #code()}.
 */
public sealed interface PlanOp {

    enum Code {
        LITERAL,
        PARAM,
        LIFT,
        RING,
        TRANSFORM,
        PROJECT_CLASS,
        PROJECT_GRADE,
        MULTIPLY,
        ADD,
        SCALE;

        /** Ops that only make sense on algebraic elements. */
        public boolean sgaOnly() {
            return this == PROJECT_GRADE || this == MULTIPLY || this == ADD || this == SCALE;
        }
    }

    Code code();

    /** Loads a constant class index as a bare number. */
    record Literal(int classIndex) implements PlanOp {
        @Override
        public Code code() {
            return Code.LITERAL;
        }

        @Override
        public String toString() {
            return "literal(" + classIndex + ")";
        }
    }

    /** Loads a runtime input. */
    record Param(String name) implements PlanOp {
        public Param {
            Objects.requireNonNull(name, "name must not be null");
        }

        @Override
        public Code code() {
            return Code.PARAM;
        }

        @Override
        public String toString() {
            return "param(" + name + ")";
        }
    }

    /** Loads the lift of a class index: a rank-1 element on the SGA backend, the bare index on the class backend. */
    record Lift(int classIndex) implements PlanOp {
        @Override
        public Code code() {
            return Code.LIFT;
        }

        @Override
        public String toString() {
            return "lift(" + classIndex + ")";
        }
    }

    record Ring(RingOp op, OverflowMode overflowMode) implements PlanOp {
        public Ring {
            Objects.requireNonNull(op, "op must not be null");
            Objects.requireNonNull(overflowMode, "overflowMode must not be null");
        }

        @Override
        public Code code() {
            return Code.RING;
        }

        /** {@code true} when this op reports its overflow flag. */
        public boolean tracked() {
            return op.tracksOverflow() && overflowMode == OverflowMode.TRACK;
        }

        @Override
        public String toString() {
            return op.tracksOverflow() ? op.id() + "[" + overflowMode.id() + "]" : op.id();
        }
    }

    record Transform(TransformOp transform) implements PlanOp {
        public Transform {
            Objects.requireNonNull(transform, "transform must not be null");
        }

        @Override
        public Code code() {
            return Code.TRANSFORM;
        }

        @Override
        public String toString() {
            return transform.toString();
        }
    }

    record ProjectClass() implements PlanOp {
        @Override
        public Code code() {
            return Code.PROJECT_CLASS;
        }

        @Override
        public String toString() {
            return "projectClass";
        }
    }

    record ProjectGrade(int grade) implements PlanOp {
        @Override
        public Code code() {
            return Code.PROJECT_GRADE;
        }

        @Override
        public String toString() {
            return "projectGrade(" + grade + ")";
        }
    }

    /** Right-multiplies the current element by a fixed operand. */
    record Multiply(AlgebraicElement operand) implements PlanOp {
        public Multiply {
            Objects.requireNonNull(operand, "operand must not be null");
        }

        @Override
        public Code code() {
            return Code.MULTIPLY;
        }
    }

    /** Adds a fixed operand sharing the current element's group coordinates. */
    record Add(AlgebraicElement operand) implements PlanOp {
        public Add {
            Objects.requireNonNull(operand, "operand must not be null");
        }

        @Override
        public Code code() {
            return Code.ADD;
        }
    }

    record Scale(int factor) implements PlanOp {
        @Override
        public Code code() {
            return Code.SCALE;
        }
    }
}
