package ch.epfl.vlsc.vhdl.ir.expr;

import ch.epfl.vlsc.vhdl.reporting.SourcePosition;

import java.util.Objects;

/**
 * A reference by name to a signal, variable, constant, memory, ROM, enumeration item or loop index.
 */
public class ExprVariable extends Expression {
    private final String name;

    public ExprVariable(String name) {
        this(SourcePosition.UNKNOWN, name);
    }

    public ExprVariable(SourcePosition position, String name) {
        super(position);
        this.name = Objects.requireNonNull(name);
    }

    public String getName() {
        return name;
    }

    @Override
    public <R> R accept(Visitor<R> visitor) {
        return visitor.visit(this);
    }
}
