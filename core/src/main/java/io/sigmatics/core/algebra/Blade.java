package io.sigmatics.core.algebra;

import io.sigmatics.core.error.InvalidGradeException;

/**
 * A basis blade of Cl(0,7): a set of generators {@code e1..e7} encoded as a bitmask, bit {@code i-1}
 * standing for {@code e_i}. The empty set is the scalar blade {@code 1}.
 */
public record Blade(int mask) implements Comparable<Blade> {

    public static final int GENERATORS = 7;
    public static final Blade SCALAR = new Blade(0);

    public Blade {
        if (mask < 0 || mask >= (1 << GENERATORS)) {
            throw new IllegalArgumentException("blade mask out of range: " + mask);
        }
    }

    /** The generator {@code e_i} for {@code i} in {@code 1..7}. */
    public static Blade generator(int i) {
        if (i < 1 || i > GENERATORS) {
            throw new IllegalArgumentException("generator index must be in 1..7, got " + i);
        }
        return new Blade(1 << (i - 1));
    }

    /** Builds a blade from generator indices, in any order and without repeats. */
    public static Blade of(int... generators) {
        int mask = 0;
        for (int g : generators) {
            int bit = generator(g).mask();
            if ((mask & bit) != 0) {
                throw new IllegalArgumentException("repeated generator e" + g);
            }
            mask |= bit;
        }
        return new Blade(mask);
    }

    public int grade() {
        return Integer.bitCount(mask);
    }

    /** For a grade-1 blade, the index of its generator; otherwise {@code 0}. */
    public int generatorIndex() {
        return grade() == 1 ? Integer.numberOfTrailingZeros(mask) + 1 : 0;
    }

    /**
     * Geometric product of two basis blades with the Cl(0,7) metric ({@code e_i^2 = -1}).
     *
     * @return the sign ({@code +1} or {@code -1}) of {@code this * other}; the blade is {@link #xor}
     */
    public int productSign(Blade other) {
        int swaps = 0;
        int a = mask >> 1;
        while (a != 0) {
            swaps += Integer.bitCount(a & other.mask);
            a >>= 1;
        }
        int squares = Integer.bitCount(mask & other.mask);
        return ((swaps + squares) & 1) == 0 ? 1 : -1;
    }

    public Blade xor(Blade other) {
        return new Blade(mask ^ other.mask);
    }

    static void requireGrade(int grade) {
        if (grade < 0 || grade > GENERATORS) {
            throw new InvalidGradeException(grade);
        }
    }

    @Override
    public int compareTo(Blade other) {
        int byGrade = Integer.compare(grade(), other.grade());
        return byGrade != 0 ? byGrade : Integer.compare(mask, other.mask);
    }

    /** {@code "1"} for the scalar blade, otherwise the generators in ascending order, e.g. {@code "e1e2"}. */
    @Override
    public String toString() {
        if (mask == 0) {
            return "1";
        }
        StringBuilder sb = new StringBuilder();
        for (int i = 1; i <= GENERATORS; i++) {
            if ((mask & (1 << (i - 1))) != 0) {
                sb.append('e').append(i);
            }
        }
        return sb.toString();
    }
}
