package io.sigmatics.core.backend;

import io.sigmatics.core.algebra.AlgebraicElement;
import io.sigmatics.core.error.MissingRuntimeParameterException;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/** Typed read access to the runtime parameter map handed to a plan. */
final class RuntimeInputs {

    private final Map<String, ?> params;
    private final String modelName;

    RuntimeInputs(Map<String, ?> params, String modelName) {
        this.params = params == null ? Map.of() : params;
        this.modelName = modelName;
    }

    boolean has(String name) {
        return params.get(name) != null;
    }

    Object require(String name, int opIndex) {
        Object value = params.get(name);
        if (value == null) {
            throw new MissingRuntimeParameterException(name, modelName, opIndex);
        }
        if (!(value instanceof Number) && !(value instanceof AlgebraicElement)) {
            throw new IllegalArgumentException("runtime parameter '" + name
                    + "' must be a number or an algebraic element, got " + value.getClass().getSimpleName());
        }
        return value instanceof Number n ? Integer.valueOf(n.intValue()) : value;
    }

    int requireInt(String name, int opIndex) {
        Object value = require(name, opIndex);
        if (value instanceof Integer i) {
            return i;
        }
        throw new IllegalArgumentException("runtime parameter '" + name + "' must be a number");
    }

    /** The list parameter {@code name}; accepts an {@code int[]} or a collection of numbers. */
    List<Integer> requireValues(String name, int opIndex) {
        Object value = params.get(name);
        if (value == null) {
            throw new MissingRuntimeParameterException(name, modelName, opIndex);
        }
        List<Integer> values = new ArrayList<>();
        if (value instanceof int[] array) {
            for (int v : array) {
                values.add(v);
            }
        } else if (value instanceof Iterable<?> iterable) {
            for (Object v : iterable) {
                if (!(v instanceof Number n)) {
                    throw new IllegalArgumentException("runtime parameter '" + name + "' must hold numbers only");
                }
                values.add(n.intValue());
            }
        } else {
            throw new IllegalArgumentException("runtime parameter '" + name + "' must be a list of numbers");
        }
        return values;
    }

    String modelName() {
        return modelName;
    }
}
