package ch.epfl.vlsc.vhdl.ir.stmt;

import ch.epfl.vlsc.vhdl.ir.expr.ExprApplication;
import ch.epfl.vlsc.vhdl.reporting.SourcePosition;

import java.util.Objects;

/**
 * A call used as a statement, i.e. a procedure call.
 */
public class StmtCall extends Statement {
    private final ExprApplication call;

    public StmtCall(ExprApplication call) {
        this(SourcePosition.UNKNOWN, call);
    }

    public StmtCall(SourcePosition position, ExprApplication call) {
        super(position);
        this.call = Objects.requireNonNull(call);
    }

    public ExprApplication getCall() {
        return call;
    }

    @Override
    public void accept(Visitor visitor) {
        visitor.visit(this);
    }
}
