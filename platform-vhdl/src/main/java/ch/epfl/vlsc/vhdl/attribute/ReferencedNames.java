package ch.epfl.vlsc.vhdl.attribute;

import ch.epfl.vlsc.vhdl.ir.expr.ExprApplication;
import ch.epfl.vlsc.vhdl.ir.expr.ExprBinaryOp;
import ch.epfl.vlsc.vhdl.ir.expr.ExprBoolOp;
import ch.epfl.vlsc.vhdl.ir.expr.ExprComparison;
import ch.epfl.vlsc.vhdl.ir.expr.ExprEdge;
import ch.epfl.vlsc.vhdl.ir.expr.ExprEnumItem;
import ch.epfl.vlsc.vhdl.ir.expr.ExprIndexer;
import ch.epfl.vlsc.vhdl.ir.expr.ExprLiteral;
import ch.epfl.vlsc.vhdl.ir.expr.ExprSlice;
import ch.epfl.vlsc.vhdl.ir.expr.ExprUnaryOp;
import ch.epfl.vlsc.vhdl.ir.expr.ExprVariable;
import ch.epfl.vlsc.vhdl.ir.expr.Expression;

import java.util.Arrays;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Names read by an expression, in order of first appearance.
 */
public class ReferencedNames implements Expression.Visitor<Set<String>> {

    private Set<String> union(List<Expression> expressions) {
        Set<String> names = new LinkedHashSet<>();
        for (Expression expression : expressions) {
            names.addAll(expression.accept(this));
        }
        return names;
    }

    private Set<String> union(Expression... expressions) {
        return union(Arrays.asList(expressions));
    }

    @Override
    public Set<String> visit(ExprLiteral literal) {
        return new LinkedHashSet<>();
    }

    @Override
    public Set<String> visit(ExprVariable variable) {
        Set<String> names = new LinkedHashSet<>();
        names.add(variable.getName());
        return names;
    }

    @Override
    public Set<String> visit(ExprEdge edge) {
        Set<String> names = new LinkedHashSet<>();
        names.add(edge.getSignal());
        return names;
    }

    @Override
    public Set<String> visit(ExprEnumItem item) {
        return new LinkedHashSet<>();
    }

    @Override
    public Set<String> visit(ExprBinaryOp binaryOp) {
        return union(binaryOp.getLeft(), binaryOp.getRight());
    }

    @Override
    public Set<String> visit(ExprBoolOp boolOp) {
        return union(boolOp.getOperands());
    }

    @Override
    public Set<String> visit(ExprUnaryOp unaryOp) {
        return unaryOp.getOperand().accept(this);
    }

    @Override
    public Set<String> visit(ExprComparison comparison) {
        return union(comparison.getLeft(), comparison.getRight());
    }

    @Override
    public Set<String> visit(ExprIndexer indexer) {
        return union(indexer.getStructure(), indexer.getIndex());
    }

    @Override
    public Set<String> visit(ExprSlice slice) {
        Set<String> names = slice.getStructure().accept(this);
        slice.getHigh().ifPresent(h -> names.addAll(h.accept(this)));
        slice.getLow().ifPresent(l -> names.addAll(l.accept(this)));
        return names;
    }

    @Override
    public Set<String> visit(ExprApplication application) {
        return union(application.getArgs());
    }
}
