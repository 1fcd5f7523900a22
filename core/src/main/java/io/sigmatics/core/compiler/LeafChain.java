package io.sigmatics.core.compiler;

import io.sigmatics.core.ir.AtomOp;
import io.sigmatics.core.ir.IrNode;
import io.sigmatics.core.ir.TransformOp;
import java.util.List;
import java.util.Objects;

/**
 * A leaf atom together with the transforms above it, listed from the root down to the leaf.
 * Evaluation applies them in reverse list order.
 */
public record LeafChain(IrNode.Atom atom, List<TransformOp> transforms) {

    public LeafChain {
        Objects.requireNonNull(atom, "atom must not be null");
        transforms = List.copyOf(transforms);
    }

    public AtomOp op() {
        return atom.op();
    }
}
