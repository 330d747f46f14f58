package ch.epfl.vlsc.vhdl.ir.stmt;

import ch.epfl.vlsc.vhdl.ir.expr.Expression;
import ch.epfl.vlsc.vhdl.ir.stmt.lvalue.LValue;
import ch.epfl.vlsc.vhdl.reporting.SourcePosition;

import java.util.Objects;

public class StmtAssignment extends Statement {
    private final LValue target;
    private final Expression value;

    public StmtAssignment(LValue target, Expression value) {
        this(SourcePosition.UNKNOWN, target, value);
    }

    public StmtAssignment(SourcePosition position, LValue target, Expression value) {
        super(position);
        this.target = Objects.requireNonNull(target);
        this.value = Objects.requireNonNull(value);
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
