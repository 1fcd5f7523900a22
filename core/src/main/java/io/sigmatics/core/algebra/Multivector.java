package io.sigmatics.core.algebra;

import java.util.Collections;
import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;
import java.util.function.IntUnaryOperator;
import java.util.function.UnaryOperator;

/**
 * Immutable integer-coefficient multivector of Cl(0,7). Zero coefficients are never stored, so two
 * multivectors are equal exactly when their term maps are equal.
 */
public final class Multivector {

    private static final Multivector ZERO = new Multivector(new TreeMap<>());
    private static final Multivector ONE = scalar(1);

    private final TreeMap<Blade, Integer> terms;

    private Multivector(TreeMap<Blade, Integer> terms) {
        this.terms = terms;
    }

    public static Multivector zero() {
        return ZERO;
    }

    public static Multivector one() {
        return ONE;
    }

    public static Multivector scalar(int value) {
        return term(Blade.SCALAR, value);
    }

    /** The basis vector {@code e_i}, {@code i} in {@code 1..7}. */
    public static Multivector basis(int i) {
        return term(Blade.generator(i), 1);
    }

    public static Multivector term(Blade blade, int coefficient) {
        Objects.requireNonNull(blade, "blade must not be null");
        TreeMap<Blade, Integer> map = new TreeMap<>();
        if (coefficient != 0) {
            map.put(blade, coefficient);
        }
        return new Multivector(map);
    }

    public static Multivector of(Map<Blade, Integer> terms) {
        Objects.requireNonNull(terms, "terms must not be null");
        TreeMap<Blade, Integer> map = new TreeMap<>();
        terms.forEach((blade, c) -> accumulate(map, blade, c));
        return new Multivector(map);
    }

    /** Terms in blade order (grade first, then mask). */
    public Map<Blade, Integer> terms() {
        return Collections.unmodifiableMap(terms);
    }

    public int coefficient(Blade blade) {
        return terms.getOrDefault(blade, 0);
    }

    public int size() {
        return terms.size();
    }

    public boolean isZero() {
        return terms.isEmpty();
    }

    public Multivector add(Multivector other) {
        TreeMap<Blade, Integer> map = new TreeMap<>(terms);
        other.terms.forEach((blade, c) -> accumulate(map, blade, c));
        return new Multivector(map);
    }

    public Multivector subtract(Multivector other) {
        return add(other.negate());
    }

    public Multivector scale(int factor) {
        if (factor == 0) {
            return ZERO;
        }
        TreeMap<Blade, Integer> map = new TreeMap<>();
        terms.forEach((blade, c) -> map.put(blade, c * factor));
        return new Multivector(map);
    }

    public Multivector negate() {
        return scale(-1);
    }

    /** Geometric product {@code this * other}. */
    public Multivector multiply(Multivector other) {
        TreeMap<Blade, Integer> map = new TreeMap<>();
        for (Map.Entry<Blade, Integer> left : terms.entrySet()) {
            for (Map.Entry<Blade, Integer> right : other.terms.entrySet()) {
                Blade a = left.getKey();
                Blade b = right.getKey();
                accumulate(map, a.xor(b), a.productSign(b) * left.getValue() * right.getValue());
            }
        }
        return new Multivector(map);
    }

    /**
     * Keeps only the terms of the given grade.
     *
     * @throws io.sigmatics.core.error.InvalidGradeException if {@code grade} is outside {@code 0..7}
     */
    public Multivector gradeProject(int grade) {
        Blade.requireGrade(grade);
        TreeMap<Blade, Integer> map = new TreeMap<>();
        terms.forEach((blade, c) -> {
            if (blade.grade() == grade) {
                map.put(blade, c);
            }
        });
        return new Multivector(map);
    }

    /** Grade involution: sign {@code (-1)^g}. */
    public Multivector gradeInvolution() {
        return mapSigns(g -> (g & 1) == 0 ? 1 : -1);
    }

    /** Reversion: sign {@code (-1)^(g(g-1)/2)}. */
    public Multivector reversion() {
        return mapSigns(g -> ((g * (g - 1) / 2) & 1) == 0 ? 1 : -1);
    }

    /** Clifford conjugation: sign {@code (-1)^(g(g+1)/2)}. */
    public Multivector cliffordConjugation() {
        return mapSigns(g -> ((g * (g + 1) / 2) & 1) == 0 ? 1 : -1);
    }

    /** Relabels blades by a bijection; coefficients are carried over unchanged. */
    Multivector mapBlades(UnaryOperator<Blade> relabel) {
        TreeMap<Blade, Integer> map = new TreeMap<>();
        terms.forEach((blade, c) -> accumulate(map, relabel.apply(blade), c));
        return new Multivector(map);
    }

    private Multivector mapSigns(IntUnaryOperator signForGrade) {
        TreeMap<Blade, Integer> map = new TreeMap<>();
        terms.forEach((blade, c) -> map.put(blade, c * signForGrade.applyAsInt(blade.grade())));
        return new Multivector(map);
    }

    private static void accumulate(TreeMap<Blade, Integer> map, Blade blade, int coefficient) {
        int sum = map.getOrDefault(blade, 0) + coefficient;
        if (sum == 0) {
            map.remove(blade);
        } else {
            map.put(blade, sum);
        }
    }

    @Override
    public boolean equals(Object o) {
        return this == o || (o instanceof Multivector other && terms.equals(other.terms));
    }

    @Override
    public int hashCode() {
        return terms.hashCode();
    }

    /** Renders e.g. {@code "2 + e1 - 3e1e2"}; the zero multivector renders as {@code "0"}. */
    @Override
    public String toString() {
        if (terms.isEmpty()) {
            return "0";
        }
        StringBuilder sb = new StringBuilder();
        for (Map.Entry<Blade, Integer> e : terms.entrySet()) {
            int c = e.getValue();
            String blade = e.getKey().toString();
            if (sb.length() == 0) {
                sb.append(c < 0 ? "-" : "");
            } else {
                sb.append(c < 0 ? " - " : " + ");
            }
            int abs = Math.abs(c);
            if (e.getKey().equals(Blade.SCALAR)) {
                sb.append(abs);
            } else {
                sb.append(abs == 1 ? "" : String.valueOf(abs)).append(blade);
            }
        }
        return sb.toString();
    }
}
