package io.sigmatics.core.algebra;

import io.sigmatics.core.error.NegativePowerException;
import java.util.Objects;

/**
 * An element of the SGA: a quadrant coordinate in Z4, a modality coordinate in Z3 and a Cl(0,7)
 * multivector. Immutable; equality compares all three components.
 *
 * <p>Multiplication adds the cyclic coordinates and takes the geometric product of the Clifford
 * parts. Addition is only defined between elements sharing both cyclic coordinates.
 */
public final class AlgebraicElement {

    private static final AlgebraicElement ZERO = new AlgebraicElement(0, 0, Multivector.zero());
    private static final AlgebraicElement IDENTITY = new AlgebraicElement(0, 0, Multivector.one());

    private final int z4;
    private final int z3;
    private final Multivector clifford;

    private AlgebraicElement(int z4, int z3, Multivector clifford) {
        this.z4 = z4;
        this.z3 = z3;
        this.clifford = clifford;
    }

    public static AlgebraicElement of(int z4, int z3, Multivector clifford) {
        Objects.requireNonNull(clifford, "clifford must not be null");
        return new AlgebraicElement(Math.floorMod(z4, 4), Math.floorMod(z3, 3), clifford);
    }

    public static AlgebraicElement zero() {
        return ZERO;
    }

    public static AlgebraicElement identity() {
        return IDENTITY;
    }

    /**
     * The rank-1 element {@code r^h2 (x) tau^d (x) e_l}, with {@code e_0} read as the scalar 1.
     */
    public static AlgebraicElement rank1(int h2, int d, int l) {
        if (l < 0 || l > 7) {
            throw new IllegalArgumentException("context slot must be in 0..7, got " + l);
        }
        Multivector part = l == 0 ? Multivector.one() : Multivector.basis(l);
        return of(h2, d, part);
    }

    public int z4() {
        return z4;
    }

    public int z3() {
        return z3;
    }

    public Multivector clifford() {
        return clifford;
    }

    public AlgebraicElement multiply(AlgebraicElement other) {
        return of(z4 + other.z4, z3 + other.z3, clifford.multiply(other.clifford));
    }

    /**
     * Sums the Clifford parts of two elements.
     *
     * @throws IllegalArgumentException if the elements differ in {@code z4} or {@code z3}
     */
    public AlgebraicElement add(AlgebraicElement other) {
        if (z4 != other.z4 || z3 != other.z3) {
            throw new IllegalArgumentException("cannot add elements with different group coordinates: "
                    + this + " and " + other);
        }
        return new AlgebraicElement(z4, z3, clifford.add(other.clifford));
    }

    public AlgebraicElement scale(int factor) {
        return new AlgebraicElement(z4, z3, clifford.scale(factor));
    }

    /**
     * Repeated product; {@code power(0)} is the identity.
     *
     * @throws NegativePowerException if {@code n < 0}
     */
    public AlgebraicElement power(int n) {
        if (n < 0) {
            throw new NegativePowerException(n);
        }
        AlgebraicElement result = IDENTITY;
        for (int i = 0; i < n; i++) {
            result = result.multiply(this);
        }
        return result;
    }

    public AlgebraicElement gradeInvolution() {
        return withClifford(clifford.gradeInvolution());
    }

    public AlgebraicElement reversion() {
        return withClifford(clifford.reversion());
    }

    public AlgebraicElement cliffordConjugation() {
        return withClifford(clifford.cliffordConjugation());
    }

    /** Keeps the grade-{@code g} part of the Clifford component; {@code z4} and {@code z3} are unchanged. */
    public AlgebraicElement gradeProject(int grade) {
        return withClifford(clifford.gradeProject(grade));
    }

    AlgebraicElement withClifford(Multivector part) {
        return new AlgebraicElement(z4, z3, part);
    }

    /**
     * Returns {@code true} for the image of a class index under lift: a single term with coefficient 1
     * on the scalar blade or on one generator.
     */
    public boolean isRank1() {
        if (clifford.size() != 1) {
            return false;
        }
        var entry = clifford.terms().entrySet().iterator().next();
        return entry.getValue() == 1 && entry.getKey().grade() <= 1;
    }

    public boolean isZero() {
        return clifford.isZero();
    }

    public boolean isIdentity() {
        return equals(IDENTITY);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        return o instanceof AlgebraicElement other
                && z4 == other.z4
                && z3 == other.z3
                && clifford.equals(other.clifford);
    }

    @Override
    public int hashCode() {
        return Objects.hash(z4, z3, clifford);
    }

    @Override
    public String toString() {
        return "r^" + z4 + " (x) tau^" + z3 + " (x) (" + clifford + ")";
    }
}
