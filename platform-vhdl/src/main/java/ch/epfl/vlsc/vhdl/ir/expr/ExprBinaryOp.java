package ch.epfl.vlsc.vhdl.ir.expr;

import ch.epfl.vlsc.vhdl.reporting.SourcePosition;

import java.util.Objects;

public class ExprBinaryOp extends Expression {

    public enum Operator {
        ADD("+"), SUB("-"), MUL("*"), FLOORDIV("//"), MOD("%"), POW("**"),
        LSHIFT("<<"), RSHIFT(">>"),
        BITAND("&"), BITOR("|"), BITXOR("^");

        private final String symbol;

        Operator(String symbol) {
            this.symbol = symbol;
        }

        public String getSymbol() {
            return symbol;
        }

        public boolean isArithmetic() {
            return this == ADD || this == SUB || this == MUL || this == FLOORDIV || this == MOD;
        }

        public boolean isShift() {
            return this == LSHIFT || this == RSHIFT;
        }

        public boolean isBitwise() {
            return this == BITAND || this == BITOR || this == BITXOR;
        }
    }

    private final Operator operator;
    private final Expression left;
    private final Expression right;

    public ExprBinaryOp(Operator operator, Expression left, Expression right) {
        this(SourcePosition.UNKNOWN, operator, left, right);
    }

    public ExprBinaryOp(SourcePosition position, Operator operator, Expression left, Expression right) {
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
