package io.sigmatics.core.backend;

import io.sigmatics.core.algebra.ClassIndex;
import io.sigmatics.core.ir.RingOp;
import java.util.List;

/** Shared Z/96Z arithmetic so both backends agree on values and overflow flags. */
final class RingArithmetic {

    private static final int MOD = ClassIndex.CLASS_COUNT;

    private RingArithmetic() {}

    /** Value reduced into {@code 0..95} and whether the raw result lay outside that range. */
    record Outcome(int value, boolean overflow) {}

    static Outcome binary(RingOp op, int a, int b) {
        long raw = switch (op) {
            case ADD96 -> (long) a + b;
            case SUB96 -> (long) a - b;
            case MUL96 -> (long) a * b;
            case GCD96 -> gcd(Math.floorMod(a, MOD), Math.floorMod(b, MOD));
            case LCM96 -> lcm(Math.floorMod(a, MOD), Math.floorMod(b, MOD));
            case SUM96, PRODUCT96 -> throw new IllegalArgumentException(op.id() + " folds a list, not two operands");
        };
        return outcome(raw);
    }

    static Outcome fold(RingOp op, List<Integer> values) {
        long acc = op == RingOp.PRODUCT96 ? 1 : 0;
        boolean overflow = false;
        for (int v : values) {
            long raw = op == RingOp.PRODUCT96 ? acc * v : acc + v;
            overflow |= raw < 0 || raw >= MOD;
            acc = Math.floorMod(raw, MOD);
        }
        return new Outcome((int) acc, overflow);
    }

    private static Outcome outcome(long raw) {
        return new Outcome((int) Math.floorMod(raw, (long) MOD), raw < 0 || raw >= MOD);
    }

    private static long gcd(long a, long b) {
        while (b != 0) {
            long t = b;
            b = a % b;
            a = t;
        }
        return a;
    }

    private static long lcm(long a, long b) {
        if (a == 0 || b == 0) {
            return 0;
        }
        return a / gcd(a, b) * b;
    }
}
