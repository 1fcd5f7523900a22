package io.sigmatics.core.algebra;

import java.util.ArrayList;
import java.util.List;

/**
 * The Fano plane on points {@code 1..7}, giving the cross product of the seven imaginary units. Each
 * line {@code (a, b, c)} gives {@code a x b = c}, {@code b x c = a} and
 * {@code c x a = b}; reversing the order flips the sign.
 */
public final class FanoPlane {

    /** The seven lines, each in positive cyclic order. */
    private static final int[][] LINES = {
        {1, 2, 4}, {2, 3, 5}, {3, 4, 6}, {4, 5, 7}, {5, 6, 1}, {6, 7, 2}, {7, 1, 3}
    };

    /** {@code PRODUCT[i][j]} holds the signed index of {@code e_i x e_j}; zero on the diagonal. */
    private static final int[][] PRODUCT = new int[8][8];

    static {
        for (int[] line : LINES) {
            for (int r = 0; r < 3; r++) {
                int a = line[r];
                int b = line[(r + 1) % 3];
                int c = line[(r + 2) % 3];
                PRODUCT[a][b] = c;
                PRODUCT[b][a] = -c;
            }
        }
    }

    private FanoPlane() {}

    /** Result of a cross product: the target index and its sign, or {@code (0, 0)} for {@code i == j}. */
    public record CrossResult(int index, int sign) {}

    /** A line of the plane in positive cyclic order. */
    public record Line(int a, int b, int c) {

        public boolean contains(int point) {
            return a == point || b == point || c == point;
        }

        public List<Integer> points() {
            return List.of(a, b, c);
        }
    }

    /**
     * Cross product of generators {@code e_i x e_j}.
     *
     * @throws IllegalArgumentException if either index is outside {@code 1..7}
     */
    public static CrossResult cross(int i, int j) {
        requirePoint(i);
        requirePoint(j);
        if (i == j) {
            return new CrossResult(0, 0);
        }
        int signed = PRODUCT[i][j];
        return new CrossResult(Math.abs(signed), signed > 0 ? 1 : -1);
    }

    public static List<Line> lines() {
        List<Line> result = new ArrayList<>(LINES.length);
        for (int[] line : LINES) {
            result.add(new Line(line[0], line[1], line[2]));
        }
        return List.copyOf(result);
    }

    /** The three lines through a point. */
    public static List<Line> linesContaining(int point) {
        requirePoint(point);
        return lines().stream().filter(line -> line.contains(point)).toList();
    }

    /** Returns {@code true} if {@code (a, b, c)} is a line in positive cyclic order (any rotation). */
    public static boolean isLine(int a, int b, int c) {
        for (int[] line : LINES) {
            for (int r = 0; r < 3; r++) {
                if (line[r] == a && line[(r + 1) % 3] == b && line[(r + 2) % 3] == c) {
                    return true;
                }
            }
        }
        return false;
    }

    /** Checks the incidence structure: every pair of distinct points lies on exactly one line. */
    public static boolean verify() {
        for (int i = 1; i <= 7; i++) {
            for (int j = i + 1; j <= 7; j++) {
                int count = 0;
                for (int[] line : LINES) {
                    boolean hasI = line[0] == i || line[1] == i || line[2] == i;
                    boolean hasJ = line[0] == j || line[1] == j || line[2] == j;
                    if (hasI && hasJ) {
                        count++;
                    }
                }
                if (count != 1) {
                    return false;
                }
            }
        }
        return true;
    }

    private static void requirePoint(int point) {
        if (point < 1 || point > 7) {
            throw new IllegalArgumentException("Fano index must be in 1..7, got " + point);
        }
    }
}
