package io.sigmatics.core.ir;

/** Arithmetic in Z/96Z. */
public enum RingOp {
    ADD96("add96", true),
    SUB96("sub96", true),
    MUL96("mul96", true),
    GCD96("gcd96", false),
    LCM96("lcm96", false),
    /** Folds the runtime list {@code values} with addition. */
    SUM96("sum96", false),
    /** Folds the runtime list {@code values} with multiplication. */
    PRODUCT96("product96", false);

    private final String id;
    private final boolean binaryArithmetic;

    RingOp(String id, boolean binaryArithmetic) {
        this.id = id;
        this.binaryArithmetic = binaryArithmetic;
    }

    public String id() {
        return id;
    }

    /** {@code true} for add, sub and mul, the ops that honour an {@link OverflowMode}. */
    public boolean tracksOverflow() {
        return binaryArithmetic;
    }

    /** {@code true} for the ops that read the runtime list {@code values} instead of {@code a}/{@code b}. */
    public boolean isFold() {
        return this == SUM96 || this == PRODUCT96;
    }
}
