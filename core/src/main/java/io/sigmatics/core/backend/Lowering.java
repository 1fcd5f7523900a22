package io.sigmatics.core.backend;

import io.sigmatics.core.compiler.LeafChain;
import io.sigmatics.core.compiler.RewriteEngine;
import io.sigmatics.core.ir.AtomOp;
import io.sigmatics.core.ir.IrNode;
import io.sigmatics.core.ir.TransformOp;
import java.util.ArrayList;
import java.util.List;
import java.util.function.Function;

/**
 * Linearizes a tree leaf by leaf: each leaf's atom op, then its transform chain from the innermost
 * transform outwards. Leaves are emitted left to right.
 */
final class Lowering {

    private Lowering() {}

    static List<PlanOp> linearize(IrNode node, Function<AtomOp, PlanOp> atomLowering) {
        List<PlanOp> ops = new ArrayList<>();
        for (LeafChain leaf : RewriteEngine.extractTransforms(node)) {
            ops.add(atomLowering.apply(leaf.op()));
            List<TransformOp> chain = leaf.transforms();
            for (int i = chain.size() - 1; i >= 0; i--) {
                ops.add(new PlanOp.Transform(chain.get(i)));
            }
        }
        return ops;
    }
}
