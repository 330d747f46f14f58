package ch.epfl.vlsc.vhdl.ir.expr;

import ch.epfl.vlsc.vhdl.reporting.SourcePosition;

import java.util.Objects;

public class ExprUnaryOp extends Expression {

    public enum Operator {
        PLUS, MINUS, INVERT, NOT
    }

    private final Operator operator;
    private final Expression operand;

    public ExprUnaryOp(Operator operator, Expression operand) {
        this(SourcePosition.UNKNOWN, operator, operand);
    }

    public ExprUnaryOp(SourcePosition position, Operator operator, Expression operand) {
        super(position);
        this.operator = Objects.requireNonNull(operator);
        this.operand = Objects.requireNonNull(operand);
    }

    public Operator getOperator() {
        return operator;
    }

    public Expression getOperand() {
        return operand;
    }

    @Override
    public <R> R accept(Visitor<R> visitor) {
        return visitor.visit(this);
    }
}
