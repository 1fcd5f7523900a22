package io.sigmatics.core.ir;

/** Renders a tree as indented text for logs and test failure messages. */
public final class IrPrinter {

    private static final String INDENT = "  ";

    private IrPrinter() {}

    public static String print(IrNode node) {
        StringBuilder sb = new StringBuilder();
        append(sb, node, 0);
        return sb.toString();
    }

    /** Single-line rendering, e.g. {@code R^1(D^2(lit 7))}. */
    public static String inline(IrNode node) {
        return node.accept(new IrVisitor<>() {
            @Override
            public String visitAtom(IrNode.Atom atom) {
                return describe(atom.op());
            }

            @Override
            public String visitSeq(IrNode.Seq seq) {
                return "seq(" + inline(seq.left()) + ", " + inline(seq.right()) + ")";
            }

            @Override
            public String visitPar(IrNode.Par par) {
                return "par(" + inline(par.left()) + ", " + inline(par.right()) + ")";
            }

            @Override
            public String visitTransform(IrNode.Transform transform) {
                return transform.op() + "(" + inline(transform.child()) + ")";
            }
        });
    }

    private static void append(StringBuilder sb, IrNode node, int depth) {
        sb.append(INDENT.repeat(depth));
        if (node instanceof IrNode.Atom atom) {
            sb.append(describe(atom.op())).append('\n');
        } else if (node instanceof IrNode.Seq seq) {
            sb.append("seq\n");
            append(sb, seq.left(), depth + 1);
            append(sb, seq.right(), depth + 1);
        } else if (node instanceof IrNode.Par par) {
            sb.append("par\n");
            append(sb, par.left(), depth + 1);
            append(sb, par.right(), depth + 1);
        } else if (node instanceof IrNode.Transform transform) {
            sb.append(transform.op()).append('\n');
            append(sb, transform.child(), depth + 1);
        }
    }

    static String describe(AtomOp op) {
        return switch (op.kind()) {
            case CLASS_LITERAL -> "lit " + ((AtomOp.ClassLiteral) op).value();
            case PARAM -> "param " + ((AtomOp.Param) op).name();
            case LIFT -> "lift " + ((AtomOp.Lift) op).classIndex();
            case PROJECT_GRADE -> "project<" + ((AtomOp.ProjectGrade) op).grade() + ">";
            case PROJECT_CLASS -> "projectClass";
            case RING -> {
                AtomOp.Ring ring = (AtomOp.Ring) op;
                yield ring.op().tracksOverflow()
                        ? ring.op().id() + "[" + ring.overflowMode().id() + "]"
                        : ring.op().id();
            }
        };
    }
}
