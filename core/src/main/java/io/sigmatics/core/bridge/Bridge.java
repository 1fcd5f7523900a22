package io.sigmatics.core.bridge;

import io.sigmatics.core.algebra.AlgebraicElement;
import io.sigmatics.core.algebra.Blade;
import io.sigmatics.core.algebra.ClassIndex;
import io.sigmatics.core.error.NonRank1Exception;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.OptionalInt;

/**
 * Converts between class indices and rank-1 algebraic elements.
 *
 * <p>{@code lift} is injective and {@code project} is its left inverse on rank-1 elements:
 * {@code project(lift(i)) == i} for every class index. Composite elements (sums, higher grades,
 * coefficients other than 1) have no class index.
 */
public final class Bridge {

    private Bridge() {}

    /**
     * Lifts a class index to {@code r^h2 (x) tau^d (x) e_l} ({@code e_0 = 1}).
     *
     * @throws io.sigmatics.core.error.InvalidClassIndexException if the index is outside {@code 0..95}
     */
    public static AlgebraicElement lift(int classIndex) {
        ClassIndex.Coordinates c = ClassIndex.decompose(classIndex);
        return AlgebraicElement.rank1(c.h2(), c.d(), c.l());
    }

    /** Projects a rank-1 element to its class index, or empty for any other element. */
    public static OptionalInt project(AlgebraicElement element) {
        Objects.requireNonNull(element, "element must not be null");
        if (!element.isRank1()) {
            return OptionalInt.empty();
        }
        Map.Entry<Blade, Integer> term =
                element.clifford().terms().entrySet().iterator().next();
        int l = term.getKey().generatorIndex();
        return OptionalInt.of(ClassIndex.compose(element.z4(), element.z3(), l));
    }

    /**
     * Projects a rank-1 element to its class index.
     *
     * @throws NonRank1Exception if the element is not rank-1
     */
    public static int projectStrict(AlgebraicElement element) {
        return project(element).orElseThrow(() -> new NonRank1Exception(element.toString()));
    }

    public static boolean isRank1(AlgebraicElement element) {
        return element.isRank1();
    }

    /** Lifts each index, preserving order and length. */
    public static List<AlgebraicElement> liftAll(int... classIndices) {
        List<AlgebraicElement> result = new ArrayList<>(classIndices.length);
        for (int i : classIndices) {
            result.add(lift(i));
        }
        return List.copyOf(result);
    }

    /** Projects each element, preserving order and length; non-rank-1 entries are empty. */
    public static List<OptionalInt> projectAll(List<AlgebraicElement> elements) {
        List<OptionalInt> result = new ArrayList<>(elements.size());
        for (AlgebraicElement element : elements) {
            result.add(project(element));
        }
        return List.copyOf(result);
    }
}
