package io.sigmatics.core.compiler;

import io.sigmatics.core.backend.BackendKind;
import io.sigmatics.core.ir.AtomOp;
import io.sigmatics.core.ir.IrNode;
import io.sigmatics.core.ir.IrVisitor;
import io.sigmatics.core.model.BackendPreference;
import io.sigmatics.core.model.ComplexityClass;
import java.util.Map;
import java.util.Objects;

/**
 * Assigns a {@link ComplexityClass} to a normalized tree and picks a backend for it.
 *
 * <ul>
 *   <li>C0: a single atom, compiled parameters bound, no runtime inputs;
 *   <li>C3: {@code seqDepth > 5}, whatever the purity;
 *   <li>C1: class-pure;
 *   <li>C2: everything else (grade projection present, shallow).
 * </ul>
 */
public final class ComplexityAnalyzer {

    /** Deepest {@code seq} nesting still considered bounded. */
    public static final int MAX_BOUNDED_SEQ_DEPTH = 5;

    private ComplexityAnalyzer() {}

    public static ComplexitySignals analyze(IrNode node) {
        Objects.requireNonNull(node, "node must not be null");
        return node.accept(SIGNALS);
    }

    /**
     * @param compiledParams the descriptor's compile-time parameters; an empty map means nothing is bound
     */
    public static ComplexityClass classify(IrNode node, Map<String, ?> compiledParams) {
        ComplexitySignals signals = analyze(node);
        boolean compiled = compiledParams != null && !compiledParams.isEmpty();
        if (signals.singleAtom() && compiled && !signals.runtimeInputs()) {
            return ComplexityClass.C0;
        }
        if (signals.seqDepth() > MAX_BOUNDED_SEQ_DEPTH) {
            return ComplexityClass.C3;
        }
        return signals.classPure() ? ComplexityClass.C1 : ComplexityClass.C2;
    }

    public static boolean shouldUseClassBackend(IrNode node) {
        return analyze(node).classPure();
    }

    public static boolean requiresSgaBackend(IrNode node) {
        return !analyze(node).classPure();
    }

    /** {@code class} and {@code sga} force the backend; {@code auto} maps C0/C1 to class and C2/C3 to SGA. */
    public static BackendKind selectBackend(ComplexityClass complexity, BackendPreference preference) {
        Objects.requireNonNull(complexity, "complexity must not be null");
        Objects.requireNonNull(preference, "preference must not be null");
        return switch (preference) {
            case CLASS -> BackendKind.CLASS;
            case SGA -> BackendKind.SGA;
            case AUTO -> switch (complexity) {
                case C0, C1 -> BackendKind.CLASS;
                case C2, C3 -> BackendKind.SGA;
            };
        };
    }

    private static final IrVisitor<ComplexitySignals> SIGNALS = new IrVisitor<>() {
        @Override
        public ComplexitySignals visitAtom(IrNode.Atom atom) {
            AtomOp.Kind kind = atom.op().kind();
            // projections act on the runtime input x when nothing precedes them
            boolean runtime = kind == AtomOp.Kind.PARAM
                    || kind == AtomOp.Kind.RING
                    || kind == AtomOp.Kind.PROJECT_CLASS
                    || kind == AtomOp.Kind.PROJECT_GRADE;
            return new ComplexitySignals(0, kind != AtomOp.Kind.PROJECT_GRADE, runtime, true);
        }

        @Override
        public ComplexitySignals visitSeq(IrNode.Seq seq) {
            ComplexitySignals merged = merge(seq.left().accept(this), seq.right().accept(this));
            return new ComplexitySignals(
                    merged.seqDepth() + 1, merged.classPure(), merged.runtimeInputs(), false);
        }

        @Override
        public ComplexitySignals visitPar(IrNode.Par par) {
            return merge(par.left().accept(this), par.right().accept(this));
        }

        @Override
        public ComplexitySignals visitTransform(IrNode.Transform transform) {
            ComplexitySignals child = transform.child().accept(this);
            return new ComplexitySignals(child.seqDepth(), child.classPure(), child.runtimeInputs(), false);
        }

        private ComplexitySignals merge(ComplexitySignals a, ComplexitySignals b) {
            return new ComplexitySignals(
                    Math.max(a.seqDepth(), b.seqDepth()),
                    a.classPure() && b.classPure(),
                    a.runtimeInputs() || b.runtimeInputs(),
                    false);
        }
    };
}
