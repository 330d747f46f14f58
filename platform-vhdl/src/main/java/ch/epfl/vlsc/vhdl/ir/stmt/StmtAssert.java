package ch.epfl.vlsc.vhdl.ir.stmt;

import ch.epfl.vlsc.vhdl.ir.expr.Expression;
import ch.epfl.vlsc.vhdl.reporting.SourcePosition;

import java.util.Objects;
import java.util.Optional;

public class StmtAssert extends Statement {
    private final Expression condition;
    private final String message;

    public StmtAssert(Expression condition, String message) {
        this(SourcePosition.UNKNOWN, condition, message);
    }

    public StmtAssert(SourcePosition position, Expression condition, String message) {
        super(position);
        this.condition = Objects.requireNonNull(condition);
        this.message = message;
    }

    public Expression getCondition() {
        return condition;
    }

    public Optional<String> getMessage() {
        return Optional.ofNullable(message);
    }

    @Override
    public void accept(Visitor visitor) {
        visitor.visit(this);
    }
}
