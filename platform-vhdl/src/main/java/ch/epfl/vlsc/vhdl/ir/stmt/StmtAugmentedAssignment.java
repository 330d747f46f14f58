package ch.epfl.vlsc.vhdl.ir.stmt;

import ch.epfl.vlsc.vhdl.ir.expr.ExprBinaryOp;
import ch.epfl.vlsc.vhdl.ir.expr.Expression;
import ch.epfl.vlsc.vhdl.ir.stmt.lvalue.LValue;
import ch.epfl.vlsc.vhdl.reporting.SourcePosition;

import java.util.Objects;
import java.util.Optional;

/**
 * <code>target op= value</code>.
 */
public class StmtAugmentedAssignment extends Statement {

    public enum Operator {
        ADD(ExprBinaryOp.Operator.ADD),
        SUB(ExprBinaryOp.Operator.SUB),
        MUL(ExprBinaryOp.Operator.MUL),
        FLOORDIV(ExprBinaryOp.Operator.FLOORDIV),
        MOD(ExprBinaryOp.Operator.MOD),
        POW(ExprBinaryOp.Operator.POW),
        LSHIFT(ExprBinaryOp.Operator.LSHIFT),
        RSHIFT(ExprBinaryOp.Operator.RSHIFT),
        BITAND(ExprBinaryOp.Operator.BITAND),
        BITOR(ExprBinaryOp.Operator.BITOR),
        BITXOR(ExprBinaryOp.Operator.BITXOR),
        TRUEDIV(null),
        MATMUL(null);

        private final ExprBinaryOp.Operator binary;

        Operator(ExprBinaryOp.Operator binary) {
            this.binary = binary;
        }

        /**
         * The binary operator applied, empty for operators that have no hardware meaning.
         */
        public Optional<ExprBinaryOp.Operator> getBinary() {
            return Optional.ofNullable(binary);
        }
    }

    private final Operator operator;
    private final LValue target;
    private final Expression value;

    public StmtAugmentedAssignment(Operator operator, LValue target, Expression value) {
        this(SourcePosition.UNKNOWN, operator, target, value);
    }

    public StmtAugmentedAssignment(SourcePosition position, Operator operator, LValue target, Expression value) {
        super(position);
        this.operator = Objects.requireNonNull(operator);
        this.target = Objects.requireNonNull(target);
        this.value = Objects.requireNonNull(value);
    }

    public Operator getOperator() {
        return operator;
    }

    public LValue getTarget() {
        return target;
    }

    public Expression getValue() {
        return value;
    }

    @Override
    public void accept(Visitor visitor) {
        visitor.visit(this);
    }
}
