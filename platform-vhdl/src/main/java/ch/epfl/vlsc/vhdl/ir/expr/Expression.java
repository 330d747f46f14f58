package ch.epfl.vlsc.vhdl.ir.expr;

import ch.epfl.vlsc.vhdl.ir.IRNode;
import ch.epfl.vlsc.vhdl.reporting.SourcePosition;

public abstract class Expression extends IRNode {

    protected Expression(SourcePosition position) {
        super(position);
    }

    public abstract <R> R accept(Visitor<R> visitor);

    /**
     * One method per expression kind. Every pass over expressions implements all of them.
     */
    public interface Visitor<R> {
        R visit(ExprLiteral literal);

        R visit(ExprVariable variable);

        R visit(ExprEdge edge);

        R visit(ExprEnumItem item);

        R visit(ExprBinaryOp binaryOp);

        R visit(ExprBoolOp boolOp);

        R visit(ExprUnaryOp unaryOp);

        R visit(ExprComparison comparison);

        R visit(ExprIndexer indexer);

        R visit(ExprSlice slice);

        R visit(ExprApplication application);
    }
}
