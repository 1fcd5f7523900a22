package io.sigmatics.core.ir;

/** Exhaustive visitor over the four IR node shapes. */
public interface IrVisitor<R> {

    R visitAtom(IrNode.Atom atom);

    R visitSeq(IrNode.Seq seq);

    R visitPar(IrNode.Par par);

    R visitTransform(IrNode.Transform transform);
}
