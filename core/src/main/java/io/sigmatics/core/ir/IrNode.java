package io.sigmatics.core.ir;

import java.util.Objects;

/**
 * Immutable expression tree. Nodes are records, so equality is structural and trees may share
 * subtrees freely. Build nodes through {@link Ir}, which normalizes exponents.
 */
public sealed interface IrNode {

    <R> R accept(IrVisitor<R> visitor);

    /** A leaf operation. */
    record Atom(AtomOp op) implements IrNode {
        public Atom {
            Objects.requireNonNull(op, "op must not be null");
        }

        @Override
        public <R> R accept(IrVisitor<R> visitor) {
            return visitor.visitAtom(this);
        }
    }

    /** Sequential composition: {@code left} then {@code right}. */
    record Seq(IrNode left, IrNode right) implements IrNode {
        public Seq {
            Objects.requireNonNull(left, "left must not be null");
            Objects.requireNonNull(right, "right must not be null");
        }

        @Override
        public <R> R accept(IrVisitor<R> visitor) {
            return visitor.visitSeq(this);
        }
    }

    /** Parallel (tensor) composition. */
    record Par(IrNode left, IrNode right) implements IrNode {
        public Par {
            Objects.requireNonNull(left, "left must not be null");
            Objects.requireNonNull(right, "right must not be null");
        }

        @Override
        public <R> R accept(IrVisitor<R> visitor) {
            return visitor.visitPar(this);
        }
    }

    /** A transform applied to a subtree. */
    record Transform(TransformOp op, IrNode child) implements IrNode {
        public Transform {
            Objects.requireNonNull(op, "op must not be null");
            Objects.requireNonNull(child, "child must not be null");
        }

        @Override
        public <R> R accept(IrVisitor<R> visitor) {
            return visitor.visitTransform(this);
        }
    }
}
