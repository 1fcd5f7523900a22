package io.sigmatics.core.backend;

import io.sigmatics.core.algebra.AlgebraicElement;
import io.sigmatics.core.bridge.Bridge;
import java.util.Objects;
import java.util.OptionalInt;

/**
 * Outcome of running a plan. Callers switch on {@link #kind()}; every plan yields exactly one of
 * these shapes.
 */
public sealed interface ExecutionResult {

    enum Kind {
        /** A bare class index. */
        CLASS_VALUE,
        /** A tracked ring result with its overflow flag. */
        RING_RESULT,
        /** An algebraic element. */
        ELEMENT,
        /** The plan established no value; reads as {@code 0}. */
        FALLBACK,
        /** A composite element has no class index. */
        ABSENT
    }

    Kind kind();

    /** The class index carried by this result, if any. Fallback reads as {@code 0}. */
    OptionalInt classIndex();

    static ExecutionResult value(int value) {
        return new ClassValue(value);
    }

    static ExecutionResult ring(int value, boolean overflow) {
        return new RingResult(value, overflow);
    }

    static ExecutionResult element(AlgebraicElement element) {
        return new ElementValue(element);
    }

    static ExecutionResult fallback() {
        return Fallback.INSTANCE;
    }

    static ExecutionResult absent() {
        return Absent.INSTANCE;
    }

    record ClassValue(int value) implements ExecutionResult {
        @Override
        public Kind kind() {
            return Kind.CLASS_VALUE;
        }

        @Override
        public OptionalInt classIndex() {
            return OptionalInt.of(value);
        }
    }

    record RingResult(int value, boolean overflow) implements ExecutionResult {
        @Override
        public Kind kind() {
            return Kind.RING_RESULT;
        }

        @Override
        public OptionalInt classIndex() {
            return OptionalInt.of(value);
        }
    }

    record ElementValue(AlgebraicElement element) implements ExecutionResult {
        public ElementValue {
            Objects.requireNonNull(element, "element must not be null");
        }

        @Override
        public Kind kind() {
            return Kind.ELEMENT;
        }

        @Override
        public OptionalInt classIndex() {
            return Bridge.project(element);
        }
    }

    record Fallback() implements ExecutionResult {
        static final Fallback INSTANCE = new Fallback();

        public int value() {
            return 0;
        }

        @Override
        public Kind kind() {
            return Kind.FALLBACK;
        }

        @Override
        public OptionalInt classIndex() {
            return OptionalInt.of(0);
        }
    }

    record Absent() implements ExecutionResult {
        static final Absent INSTANCE = new Absent();

        @Override
        public Kind kind() {
            return Kind.ABSENT;
        }

        @Override
        public OptionalInt classIndex() {
            return OptionalInt.empty();
        }
    }
}
