package io.sigmatics.core.algebra;

import io.sigmatics.core.error.InvalidClassIndexException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Class-index arithmetic for the 96-class quotient of the byte space.
 *
 * <p>A class index {@code i} in {@code 0..95} decomposes uniquely as {@code i = 24*h2 + 8*d + l} with
 * {@code h2} in Z4 (quadrant), {@code d} in Z3 (modality) and {@code l} in Z8 (context slot). The
 * coordinate transforms defined here act on bare indices and are the class-level counterparts of
 * {@link ElementTransforms}.
 *
 * <p>Byte layout: bits 7..6 carry {@code h2}; bits 4 and 5 carry the modality as {@code (b4,b5)} with
 * {@code 00 -> 0}, {@code 10 -> 1}, {@code 01 -> 2} and the unused pattern {@code 11} folding to
 * {@code 0}; bits 3..1 carry {@code l}; bit 0 is ignored.
 */
public final class ClassIndex {

    /** Number of equivalence classes. */
    public static final int CLASS_COUNT = 96;

    public static final int QUADRANTS = 4;
    public static final int MODALITIES = 3;
    public static final int CONTEXTS = 8;

    private static final int[] BYTE_TO_CLASS = new int[256];

    static {
        for (int b = 0; b < 256; b++) {
            BYTE_TO_CLASS[b] = computeByteToClass(b);
        }
    }

    private ClassIndex() {}

    /** The {@code (h2, d, l)} coordinates of a class index. */
    public record Coordinates(int h2, int d, int l) {

        public Coordinates {
            if (h2 < 0 || h2 >= QUADRANTS || d < 0 || d >= MODALITIES || l < 0 || l >= CONTEXTS) {
                throw new IllegalArgumentException(
                        "coordinates out of range: h2=" + h2 + ", d=" + d + ", l=" + l);
            }
        }

        /** Recomposes these coordinates into a class index. */
        public int toClassIndex() {
            return compose(h2, d, l);
        }
    }

    /**
     * Validates a class index.
     *
     * @return the index unchanged
     * @throws InvalidClassIndexException if the index lies outside {@code 0..95}
     */
    public static int require(int classIndex) {
        if (!isValid(classIndex)) {
            throw new InvalidClassIndexException(classIndex);
        }
        return classIndex;
    }

    public static boolean isValid(int classIndex) {
        return classIndex >= 0 && classIndex < CLASS_COUNT;
    }

    public static Coordinates decompose(int classIndex) {
        require(classIndex);
        return new Coordinates(classIndex / 24, (classIndex % 24) / 8, classIndex % 8);
    }

    public static int compose(int h2, int d, int l) {
        return 24 * Math.floorMod(h2, QUADRANTS) + 8 * Math.floorMod(d, MODALITIES) + Math.floorMod(l, CONTEXTS);
    }

    // --- Byte mapping ---

    /** Maps a byte value {@code 0..255} to its class index. */
    public static int fromByte(int byteValue) {
        if (byteValue < 0 || byteValue > 255) {
            throw new IllegalArgumentException("Invalid byte: " + byteValue + ". Must be 0..255.");
        }
        return BYTE_TO_CLASS[byteValue];
    }

    /** The representative byte of a class: bit 0 cleared, modality encoded as {@code 00/10/01}. */
    public static int canonicalByte(int classIndex) {
        Coordinates c = decompose(classIndex);
        int b4 = c.d() == 1 ? 1 : 0;
        int b5 = c.d() == 2 ? 1 : 0;
        return (c.h2() << 6) | (b5 << 5) | (b4 << 4) | (c.l() << 1);
    }

    /** Returns {@code true} if both bytes fall in the same class. */
    public static boolean equivalent(int byteA, int byteB) {
        return fromByte(byteA) == fromByte(byteB);
    }

    /** All bytes belonging to a class, ascending. */
    public static List<Integer> equivalenceClass(int classIndex) {
        require(classIndex);
        List<Integer> bytes = new ArrayList<>();
        for (int b = 0; b < 256; b++) {
            if (BYTE_TO_CLASS[b] == classIndex) {
                bytes.add(b);
            }
        }
        return Collections.unmodifiableList(bytes);
    }

    /** The full byte-to-class table as a fresh array. */
    public static int[] byteClassMapping() {
        return BYTE_TO_CLASS.clone();
    }

    private static int computeByteToClass(int b) {
        int h2 = (b >> 6) & 0b11;
        int b4 = (b >> 4) & 1;
        int b5 = (b >> 5) & 1;
        int d;
        if (b4 == 1 && b5 == 0) {
            d = 1;
        } else if (b4 == 0 && b5 == 1) {
            d = 2;
        } else {
            d = 0;
        }
        int l = (b >> 1) & 0b111;
        return compose(h2, d, l);
    }

    // --- Coordinate transforms ---

    /** Quarter-turn rotation: {@code h2 -> h2 + k (mod 4)}. */
    public static int rotate(int classIndex, int k) {
        Coordinates c = decompose(classIndex);
        return compose(c.h2() + k, c.d(), c.l());
    }

    /** Triality rotation: {@code d -> d + k (mod 3)}. */
    public static int triality(int classIndex, int k) {
        Coordinates c = decompose(classIndex);
        return compose(c.h2(), c.d() + k, c.l());
    }

    /** Context rotation: {@code l -> l + k (mod 8)}. */
    public static int twist(int classIndex, int k) {
        Coordinates c = decompose(classIndex);
        return compose(c.h2(), c.d(), c.l() + k);
    }

    /** Mirror: {@code d -> (3 - d) mod 3}, swapping modalities 1 and 2. */
    public static int mirror(int classIndex) {
        Coordinates c = decompose(classIndex);
        return compose(c.h2(), (MODALITIES - c.d()) % MODALITIES, c.l());
    }
}
