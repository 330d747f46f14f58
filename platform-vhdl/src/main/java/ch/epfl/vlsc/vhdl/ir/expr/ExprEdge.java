package ch.epfl.vlsc.vhdl.ir.expr;

import ch.epfl.vlsc.vhdl.ir.design.EdgeKind;
import ch.epfl.vlsc.vhdl.reporting.SourcePosition;

import java.util.Objects;

/**
 * <code>sig.posedge</code> or <code>sig.negedge</code>.
 */
public class ExprEdge extends Expression {
    private final String signal;
    private final EdgeKind kind;

    public ExprEdge(String signal, EdgeKind kind) {
        this(SourcePosition.UNKNOWN, signal, kind);
    }

    public ExprEdge(SourcePosition position, String signal, EdgeKind kind) {
        super(position);
        this.signal = Objects.requireNonNull(signal);
        this.kind = Objects.requireNonNull(kind);
    }

    public String getSignal() {
        return signal;
    }

    public EdgeKind getKind() {
        return kind;
    }

    @Override
    public <R> R accept(Visitor<R> visitor) {
        return visitor.visit(this);
    }
}
