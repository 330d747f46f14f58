package ch.epfl.vlsc.vhdl.ir.expr;

import ch.epfl.vlsc.vhdl.reporting.SourcePosition;

import java.util.Objects;

public class ExprComparison extends Expression {

    public enum Operator {
        EQ, NE, LT, GT, LE, GE
    }

    private final Operator operator;
    private final Expression left;
    private final Expression right;

    public ExprComparison(Operator operator, Expression left, Expression right) {
        this(SourcePosition.UNKNOWN, operator, left, right);
    }

    public ExprComparison(SourcePosition position, Operator operator, Expression left, Expression right) {
        super(position);
        this.operator = Objects.requireNonNull(operator);
        this.left = Objects.requireNonNull(left);
        this.right = Objects.requireNonNull(right);
    }

    public Operator getOperator() {
        return operator;
    }

    public Expression getLeft() {
        return left;
    }

    public Expression getRight() {
        return right;
    }

    @Override
    public <R> R accept(Visitor<R> visitor) {
        return visitor.visit(this);
    }
}
