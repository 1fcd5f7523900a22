package io.sigmatics.core.ir;

/** The four transform families and the order of the cyclic group each generates. */
public enum TransformKind {
    /** Quarter-turn rotation on the Z4 coordinate. */
    R(4),
    /** Triality rotation on the Z3 coordinate. */
    D(3),
    /** Context rotation on the Z8 coordinate. */
    T(8),
    /** Mirror, an involution. */
    M(2);

    private final int order;

    TransformKind(int order) {
        this.order = order;
    }

    public int order() {
        return order;
    }

    /** Reduces an exponent into {@code 0..order-1} (Euclidean remainder). */
    public int reduce(int k) {
        return Math.floorMod(k, order);
    }

    /** {@code true} for the rotations that carry an exponent; {@code false} for {@link #M}. */
    public boolean isRotation() {
        return this != M;
    }
}
