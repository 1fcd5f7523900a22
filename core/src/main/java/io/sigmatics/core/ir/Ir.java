package io.sigmatics.core.ir;

import io.sigmatics.core.error.InvalidGradeException;

/**
 * Smart constructors for {@link IrNode} trees.
 *
 * <p>Transform exponents are reduced modulo the transform's order on construction, and an exponent
 * that reduces to zero returns the child unchanged, so no identity transform node is ever built.
 * Literal indices and grades are validated eagerly.
 */
public final class Ir {

    private Ir() {}

    // --- Atoms ---

    /**
     * @throws io.sigmatics.core.error.InvalidClassIndexException if {@code value} is outside {@code 0..95}
     */
    public static IrNode classLiteral(int value) {
        return atom(new AtomOp.ClassLiteral(value));
    }

    public static IrNode param(String name) {
        return atom(new AtomOp.Param(name));
    }

    /**
     * @throws io.sigmatics.core.error.InvalidClassIndexException if {@code classIndex} is outside {@code 0..95}
     */
    public static IrNode lift(int classIndex) {
        return atom(new AtomOp.Lift(classIndex));
    }

    /**
     * @throws InvalidGradeException if {@code grade} is outside {@code 0..7}
     */
    public static IrNode projectGrade(int grade) {
        return atom(new AtomOp.ProjectGrade(grade));
    }

    public static IrNode projectClass() {
        return atom(new AtomOp.ProjectClass());
    }

    public static IrNode ring(RingOp op, OverflowMode overflowMode) {
        return atom(new AtomOp.Ring(op, overflowMode));
    }

    public static IrNode add96(OverflowMode overflowMode) {
        return ring(RingOp.ADD96, overflowMode);
    }

    public static IrNode sub96(OverflowMode overflowMode) {
        return ring(RingOp.SUB96, overflowMode);
    }

    public static IrNode mul96(OverflowMode overflowMode) {
        return ring(RingOp.MUL96, overflowMode);
    }

    public static IrNode gcd96() {
        return ring(RingOp.GCD96, OverflowMode.DROP);
    }

    public static IrNode lcm96() {
        return ring(RingOp.LCM96, OverflowMode.DROP);
    }

    public static IrNode sum96() {
        return ring(RingOp.SUM96, OverflowMode.DROP);
    }

    public static IrNode product96() {
        return ring(RingOp.PRODUCT96, OverflowMode.DROP);
    }

    private static IrNode atom(AtomOp op) {
        return new IrNode.Atom(op);
    }

    // --- Composition ---

    public static IrNode seq(IrNode left, IrNode right) {
        return new IrNode.Seq(left, right);
    }

    public static IrNode par(IrNode left, IrNode right) {
        return new IrNode.Par(left, right);
    }

    // --- Transforms ---

    /** {@code R^k}, exponent reduced modulo 4. */
    public static IrNode rotate(IrNode child, int k) {
        return transform(TransformKind.R, child, k);
    }

    /** {@code D^k}, exponent reduced modulo 3. */
    public static IrNode triality(IrNode child, int k) {
        return transform(TransformKind.D, child, k);
    }

    /** {@code T^k}, exponent reduced modulo 8. */
    public static IrNode twist(IrNode child, int k) {
        return transform(TransformKind.T, child, k);
    }

    public static IrNode mirror(IrNode child) {
        return transform(TransformKind.M, child, 1);
    }

    /**
     * Applies a transform of the given kind. For {@link TransformKind#M} the exponent is read modulo 2,
     * so an even count collapses to the child.
     */
    public static IrNode transform(TransformKind kind, IrNode child, int k) {
        int power = kind.reduce(k);
        if (power == 0) {
            return child;
        }
        return new IrNode.Transform(new TransformOp(kind, power), child);
    }
}
