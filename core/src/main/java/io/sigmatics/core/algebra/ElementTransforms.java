package io.sigmatics.core.algebra;

/**
 * The four SGA endomorphisms acting on algebraic elements. Each one commutes with
 * {@link io.sigmatics.core.bridge.Bridge#lift lift}: transforming a lifted class index gives the
 * lift of the transformed index.
 *
 * <p>Orders: {@code R^4 = D^3 = T^8 = M^2 = id}.
 */
public final class ElementTransforms {

    private ElementTransforms() {}

    /** Quarter-turn rotation: shifts the Z4 coordinate. */
    public static AlgebraicElement rotate(AlgebraicElement element, int k) {
        return AlgebraicElement.of(element.z4() + k, element.z3(), element.clifford());
    }

    /** Triality rotation: shifts the Z3 coordinate. */
    public static AlgebraicElement triality(AlgebraicElement element, int k) {
        return AlgebraicElement.of(element.z4(), element.z3() + k, element.clifford());
    }

    /**
     * Context rotation: moves scalar and grade-1 blades along the 8-cycle {@code 1 -> e1 -> ... -> e7 ->
     * 1}. Blades of grade 2 and above are fixed.
     */
    public static AlgebraicElement twist(AlgebraicElement element, int k) {
        int shift = Math.floorMod(k, 8);
        if (shift == 0) {
            return element;
        }
        return element.withClifford(element.clifford().mapBlades(blade -> twistBlade(blade, shift)));
    }

    /** Mirror: inverts the Z3 coordinate, swapping modalities 1 and 2. */
    public static AlgebraicElement mirror(AlgebraicElement element) {
        return AlgebraicElement.of(element.z4(), -element.z3(), element.clifford());
    }

    private static Blade twistBlade(Blade blade, int shift) {
        if (blade.grade() > 1) {
            return blade;
        }
        int slot = (blade.generatorIndex() + shift) % 8;
        return slot == 0 ? Blade.SCALAR : Blade.generator(slot);
    }
}
