package ch.epfl.vlsc.vhdl.ir.expr;

import ch.epfl.vlsc.vhdl.reporting.SourcePosition;
import com.google.common.collect.ImmutableList;

import java.util.List;
import java.util.Objects;

/**
 * Short-circuit boolean <code>and</code>/<code>or</code> over two or more operands.
 */
public class ExprBoolOp extends Expression {

    public enum Operator {
        AND, OR
    }

    private final Operator operator;
    private final ImmutableList<Expression> operands;

    public ExprBoolOp(Operator operator, List<Expression> operands) {
        this(SourcePosition.UNKNOWN, operator, operands);
    }

    public ExprBoolOp(SourcePosition position, Operator operator, List<Expression> operands) {
        super(position);
        this.operator = Objects.requireNonNull(operator);
        this.operands = ImmutableList.copyOf(operands);
        if (this.operands.size() < 2) {
            throw new IllegalArgumentException("A boolean operation needs at least two operands");
        }
    }

    public Operator getOperator() {
        return operator;
    }

    public ImmutableList<Expression> getOperands() {
        return operands;
    }

    @Override
    public <R> R accept(Visitor<R> visitor) {
        return visitor.visit(this);
    }
}
