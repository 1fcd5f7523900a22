package io.sigmatics.core.ir;

import java.util.Objects;

/**
 * A transform with its exponent already reduced modulo the kind's order. A mirror always carries
 * power 1.
 */
public record TransformOp(TransformKind kind, int power) {

    public TransformOp {
        Objects.requireNonNull(kind, "kind must not be null");
        if (kind == TransformKind.M) {
            if (power != 1) {
                throw new IllegalArgumentException("mirror carries no exponent, got " + power);
            }
        } else if (power <= 0 || power >= kind.order()) {
            throw new IllegalArgumentException(
                    kind + " exponent must be in 1.." + (kind.order() - 1) + ", got " + power);
        }
    }

    public static TransformOp mirror() {
        return new TransformOp(TransformKind.M, 1);
    }

    @Override
    public String toString() {
        return kind == TransformKind.M ? "M" : kind + "^" + power;
    }
}
