package io.sigmatics.core.compiler;

import io.sigmatics.core.ir.Ir;
import io.sigmatics.core.ir.IrNode;
import io.sigmatics.core.ir.IrPrinter;
import io.sigmatics.core.ir.IrVisitor;
import io.sigmatics.core.ir.TransformKind;
import io.sigmatics.core.ir.TransformOp;
import java.util.ArrayList;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Bottom-up normalizer for IR trees.
 *
 * <p>Children are normalized first, then the rules below are tried at the node in order, the first
 * match winning:
 *
 * <ol>
 *   <li>identity elimination: a transform reduced to exponent 0 is replaced by its child;
 *   <li>power folding: {@code X^a(X^b(x)) -> X^(a+b)(x)} for R (mod 4), D (mod 3) and T (mod 8);
 *   <li>mirror cancellation: {@code M(M(x)) -> x};
 *   <li>mirror conjugation: {@code M(D^k(x)) -> D^(3-k)(x)} and {@code M(T^k(x)) -> T^(8-k)(x)}. A
 *       mirror over R is left standing;
 *   <li>commutation: rotations of different kinds are swapped so a leaf chain reads R, D, T from the
 *       root down, which also brings separated powers of one kind together for folding;
 *   <li>distribution: a transform over {@code seq} or {@code par} is pushed into both branches.
 * </ol>
 *
 * <p>Every rule removes a node, shrinks an exponent, removes an out-of-order pair or moves a transform
 * strictly closer to the leaves, so rewriting terminates. The result is a fixed point: normalizing it
 * again returns an equal tree.
 */
public final class RewriteEngine {

    private static final Logger LOG = LoggerFactory.getLogger(RewriteEngine.class);

    /** Upper bound on whole-tree passes; a normal form is reached after the first one. */
    private static final int MAX_PASSES = 16;

    private RewriteEngine() {}

    public static IrNode normalize(IrNode node) {
        IrNode current = node;
        for (int pass = 1; pass <= MAX_PASSES; pass++) {
            IrNode next = current.accept(PASS);
            if (next.equals(current)) {
                if (LOG.isDebugEnabled()) {
                    LOG.debug("Rewrite fixed point: passes={}, tree={}", pass, IrPrinter.inline(next));
                }
                return next;
            }
            current = next;
        }
        throw new IllegalStateException("rewriting did not reach a fixed point: " + IrPrinter.inline(current));
    }

    /**
     * Lists every leaf of a tree with the transforms accumulated from the root, left to right.
     * Meant for normalized trees, where transforms sit directly above atoms.
     */
    public static List<LeafChain> extractTransforms(IrNode node) {
        List<LeafChain> leaves = new ArrayList<>();
        collect(node, new ArrayList<>(), leaves);
        return List.copyOf(leaves);
    }

    private static void collect(IrNode node, List<TransformOp> path, List<LeafChain> out) {
        if (node instanceof IrNode.Atom atom) {
            out.add(new LeafChain(atom, path));
        } else if (node instanceof IrNode.Seq seq) {
            collect(seq.left(), path, out);
            collect(seq.right(), path, out);
        } else if (node instanceof IrNode.Par par) {
            collect(par.left(), path, out);
            collect(par.right(), path, out);
        } else if (node instanceof IrNode.Transform transform) {
            List<TransformOp> extended = new ArrayList<>(path);
            extended.add(transform.op());
            collect(transform.child(), extended, out);
        }
    }

    private static final IrVisitor<IrNode> PASS = new IrVisitor<>() {
        @Override
        public IrNode visitAtom(IrNode.Atom atom) {
            return atom;
        }

        @Override
        public IrNode visitSeq(IrNode.Seq seq) {
            return Ir.seq(seq.left().accept(this), seq.right().accept(this));
        }

        @Override
        public IrNode visitPar(IrNode.Par par) {
            return Ir.par(par.left().accept(this), par.right().accept(this));
        }

        @Override
        public IrNode visitTransform(IrNode.Transform transform) {
            return rewrite(transform.op(), transform.child().accept(this));
        }
    };

    /** Applies {@code op} on top of an already normalized {@code child}. */
    private static IrNode rewrite(TransformOp op, IrNode child) {
        TransformKind kind = op.kind();
        if (child instanceof IrNode.Seq seq) {
            return Ir.seq(rewrite(op, seq.left()), rewrite(op, seq.right()));
        }
        if (child instanceof IrNode.Par par) {
            return Ir.par(rewrite(op, par.left()), rewrite(op, par.right()));
        }
        if (child instanceof IrNode.Transform inner) {
            TransformKind innerKind = inner.op().kind();
            if (kind == innerKind) {
                if (kind == TransformKind.M) {
                    return inner.child();
                }
                return rebuild(kind, inner.child(), op.power() + inner.op().power());
            }
            if (kind == TransformKind.M) {
                if (innerKind == TransformKind.D || innerKind == TransformKind.T) {
                    return rebuild(innerKind, inner.child(), innerKind.order() - inner.op().power());
                }
                return new IrNode.Transform(op, child);
            }
            if (innerKind.isRotation() && kind.ordinal() > innerKind.ordinal()) {
                return rewrite(inner.op(), rewrite(op, inner.child()));
            }
        }
        return new IrNode.Transform(op, child);
    }

    private static IrNode rebuild(TransformKind kind, IrNode child, int power) {
        int reduced = kind.reduce(power);
        if (reduced == 0) {
            return child;
        }
        return rewrite(new TransformOp(kind, reduced), child);
    }
}
