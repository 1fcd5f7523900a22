package io.sigmatics.core.ir;

import io.sigmatics.core.algebra.ClassIndex;
import io.sigmatics.core.error.InvalidGradeException;
import java.util.Objects;

/**
 * Leaf operations of the IR. Closed: consumers switch on {@link #kind()}, so a new atom is a
 * compile-time change at every switch.
 *
 * <p>Class indices and grades are range-checked on construction.
 */
public sealed interface AtomOp {

    enum Kind {
        CLASS_LITERAL,
        PARAM,
        LIFT,
        PROJECT_GRADE,
        PROJECT_CLASS,
        RING
    }

    Kind kind();

    /** A constant class index, {@code 0..95}. */
    record ClassLiteral(int value) implements AtomOp {
        public ClassLiteral {
            ClassIndex.require(value);
        }

        @Override
        public Kind kind() {
            return Kind.CLASS_LITERAL;
        }
    }

    /** A named runtime input. */
    record Param(String name) implements AtomOp {
        public Param {
            Objects.requireNonNull(name, "name must not be null");
        }

        @Override
        public Kind kind() {
            return Kind.PARAM;
        }
    }

    /** Lifts a constant class index into the algebra. */
    record Lift(int classIndex) implements AtomOp {
        public Lift {
            ClassIndex.require(classIndex);
        }

        @Override
        public Kind kind() {
            return Kind.LIFT;
        }
    }

    /** Keeps the grade-{@code g} part of an element's Clifford component. */
    record ProjectGrade(int grade) implements AtomOp {
        public ProjectGrade {
            if (grade < 0 || grade > 7) {
                throw new InvalidGradeException(grade);
            }
        }

        @Override
        public Kind kind() {
            return Kind.PROJECT_GRADE;
        }
    }

    /** Converts the current value (or runtime {@code x}) to a class index. */
    record ProjectClass() implements AtomOp {
        @Override
        public Kind kind() {
            return Kind.PROJECT_CLASS;
        }
    }

    /** A ring op; {@code overflowMode} is only meaningful when {@link RingOp#tracksOverflow()}. */
    record Ring(RingOp op, OverflowMode overflowMode) implements AtomOp {
        public Ring {
            Objects.requireNonNull(op, "op must not be null");
            Objects.requireNonNull(overflowMode, "overflowMode must not be null");
        }

        @Override
        public Kind kind() {
            return Kind.RING;
        }
    }
}
