package io.sigmatics.core.engine;

import io.sigmatics.core.error.InvalidDescriptorException;
import io.sigmatics.core.error.UnknownModelException;
import io.sigmatics.core.ir.Ir;
import io.sigmatics.core.ir.IrNode;
import io.sigmatics.core.ir.OverflowMode;
import io.sigmatics.core.ir.TransformKind;
import io.sigmatics.core.model.ModelDescriptor;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Named recipes that turn a descriptor into an IR tree. Thread-safe; custom recipes may be
 * registered next to the built-in ones.
 *
 * <p>Built-in recipes and the compiled parameters they read:
 *
 * <ul>
 *   <li>{@code add96}, {@code sub96}, {@code mul96}: {@code overflowMode} ({@code drop} by default);
 *   <li>{@code gcd96}, {@code lcm96}, {@code sum96}, {@code product96}: none;
 *   <li>{@code R}, {@code D}, {@code T}: {@code k} (default 1), applied to {@code param("x")};
 *   <li>{@code M}: none, applied to {@code param("x")};
 *   <li>{@code project}: {@code grade} (default 0);
 *   <li>{@code lift}: {@code classIndex} (default 0);
 *   <li>{@code projectClass}: none.
 * </ul>
 */
public final class ModelRecipes {

    /** Builds the tree for one descriptor. */
    @FunctionalInterface
    public interface Recipe {
        IrNode build(ModelDescriptor descriptor);
    }

    private final Map<String, Recipe> recipes = new ConcurrentHashMap<>();

    /** A set holding every built-in recipe. */
    public static ModelRecipes standard() {
        ModelRecipes r = new ModelRecipes();
        r.register("add96", d -> Ir.add96(overflowMode(d)));
        r.register("sub96", d -> Ir.sub96(overflowMode(d)));
        r.register("mul96", d -> Ir.mul96(overflowMode(d)));
        r.register("gcd96", d -> Ir.gcd96());
        r.register("lcm96", d -> Ir.lcm96());
        r.register("sum96", d -> Ir.sum96());
        r.register("product96", d -> Ir.product96());
        for (TransformKind kind : List.of(TransformKind.R, TransformKind.D, TransformKind.T)) {
            r.register(kind.name(), d -> Ir.transform(kind, Ir.param("x"), d.compiledInt("k", 1)));
        }
        r.register("M", d -> Ir.mirror(Ir.param("x")));
        r.register("project", d -> Ir.projectGrade(d.compiledInt("grade", 0)));
        r.register("lift", d -> Ir.lift(d.compiledInt("classIndex", 0)));
        r.register("projectClass", d -> Ir.projectClass());
        return r;
    }

    /** Registers a recipe, replacing any existing one with the same name. */
    public void register(String name, Recipe recipe) {
        Objects.requireNonNull(name, "name must not be null");
        Objects.requireNonNull(recipe, "recipe must not be null");
        recipes.put(name, recipe);
    }

    public boolean has(String name) {
        return recipes.containsKey(name);
    }

    public Set<String> names() {
        return new TreeSet<>(recipes.keySet());
    }

    /**
     * @throws UnknownModelException if no recipe is registered under the descriptor's name
     */
    public IrNode build(ModelDescriptor descriptor) {
        Recipe recipe = recipes.get(descriptor.name());
        if (recipe == null) {
            throw new UnknownModelException(descriptor.name());
        }
        try {
            return recipe.build(descriptor);
        } catch (IllegalArgumentException e) {
            throw new InvalidDescriptorException(
                    "Invalid compiled parameters for model '" + descriptor.name() + "': " + e.getMessage(),
                    e,
                    descriptor.name(),
                    null);
        }
    }

    private static OverflowMode overflowMode(ModelDescriptor descriptor) {
        return OverflowMode.parse(descriptor.compiledString("overflowMode", OverflowMode.DROP.id()));
    }
}
