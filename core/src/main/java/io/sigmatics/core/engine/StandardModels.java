package io.sigmatics.core.engine;

import io.sigmatics.core.ir.OverflowMode;
import io.sigmatics.core.ir.TransformKind;
import io.sigmatics.core.model.BackendPreference;
import io.sigmatics.core.model.ModelDescriptor;

/** Descriptors for the standard library models. */
public final class StandardModels {

    public static final String RING = "stdlib.ring";
    public static final String TRANSFORMS = "stdlib.transforms";
    public static final String GRADE = "stdlib.grade";
    public static final String BRIDGE = "stdlib.bridge";

    private static final String VERSION = "1.0.0";

    private StandardModels() {}

    public static ModelDescriptor add96(OverflowMode mode) {
        return ring("add96", mode);
    }

    public static ModelDescriptor sub96(OverflowMode mode) {
        return ring("sub96", mode);
    }

    public static ModelDescriptor mul96(OverflowMode mode) {
        return ring("mul96", mode);
    }

    public static ModelDescriptor gcd96() {
        return binary("gcd96");
    }

    public static ModelDescriptor lcm96() {
        return binary("lcm96");
    }

    public static ModelDescriptor sum96() {
        return fold("sum96");
    }

    public static ModelDescriptor product96() {
        return fold("product96");
    }

    /** {@code R^k}, {@code D^k} or {@code T^k} applied to runtime {@code x}. */
    public static ModelDescriptor transform(TransformKind kind, int k) {
        if (kind == TransformKind.M) {
            return mirror();
        }
        return ModelDescriptor.builder(kind.name())
                .version(VERSION)
                .namespace(TRANSFORMS)
                .compiled("k", k)
                .runtime("x")
                .complexityHint("C1")
                .prefer(BackendPreference.AUTO)
                .build();
    }

    public static ModelDescriptor mirror() {
        return ModelDescriptor.builder("M")
                .version(VERSION)
                .namespace(TRANSFORMS)
                .runtime("x")
                .complexityHint("C1")
                .prefer(BackendPreference.AUTO)
                .build();
    }

    /** Grade projection of runtime {@code x}; always runs on the SGA backend. */
    public static ModelDescriptor projectGrade(int grade) {
        return ModelDescriptor.builder("project")
                .version(VERSION)
                .namespace(GRADE)
                .compiled("grade", grade)
                .runtime("x")
                .complexityHint("C2")
                .prefer(BackendPreference.SGA)
                .build();
    }

    /** The rank-1 element of a class index, folded at compile time. */
    public static ModelDescriptor lift(int classIndex) {
        return ModelDescriptor.builder("lift")
                .version(VERSION)
                .namespace(BRIDGE)
                .compiled("classIndex", classIndex)
                .complexityHint("C0")
                .prefer(BackendPreference.SGA)
                .build();
    }

    public static ModelDescriptor projectClass() {
        return ModelDescriptor.builder("projectClass")
                .version(VERSION)
                .namespace(BRIDGE)
                .runtime("x")
                .prefer(BackendPreference.SGA)
                .build();
    }

    private static ModelDescriptor ring(String name, OverflowMode mode) {
        return ModelDescriptor.builder(name)
                .version(VERSION)
                .namespace(RING)
                .compiled("overflowMode", mode.id())
                .runtime("a", "b")
                .complexityHint("C1")
                .prefer(BackendPreference.CLASS)
                .build();
    }

    private static ModelDescriptor binary(String name) {
        return ModelDescriptor.builder(name)
                .version(VERSION)
                .namespace(RING)
                .runtime("a", "b")
                .complexityHint("C1")
                .prefer(BackendPreference.CLASS)
                .build();
    }

    private static ModelDescriptor fold(String name) {
        return ModelDescriptor.builder(name)
                .version(VERSION)
                .namespace(RING)
                .runtime("values")
                .complexityHint("C1")
                .prefer(BackendPreference.CLASS)
                .build();
    }
}
