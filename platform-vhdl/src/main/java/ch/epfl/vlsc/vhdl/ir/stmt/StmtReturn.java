package ch.epfl.vlsc.vhdl.ir.stmt;

import ch.epfl.vlsc.vhdl.ir.expr.Expression;
import ch.epfl.vlsc.vhdl.reporting.SourcePosition;

import java.util.Optional;

public class StmtReturn extends Statement {
    private final Expression value;

    public StmtReturn(Expression value) {
        this(SourcePosition.UNKNOWN, value);
    }

    public StmtReturn(SourcePosition position, Expression value) {
        super(position);
        this.value = value;
    }

    public Optional<Expression> getValue() {
        return Optional.ofNullable(value);
    }

    @Override
    public void accept(Visitor visitor) {
        visitor.visit(this);
    }
}
