package ch.epfl.vlsc.vhdl.ir.stmt.lvalue;

import ch.epfl.vlsc.vhdl.reporting.SourcePosition;

import java.util.Objects;

public class LValueVariable extends LValue {
    private final String name;

    public LValueVariable(String name) {
        this(SourcePosition.UNKNOWN, name);
    }

    public LValueVariable(SourcePosition position, String name) {
        super(position);
        this.name = Objects.requireNonNull(name);
    }

    public String getName() {
        return name;
    }

    @Override
    public boolean isSignal() {
        return false;
    }

    @Override
    public String getRootName() {
        return name;
    }

    @Override
    public <R> R accept(Visitor<R> visitor) {
        return visitor.visit(this);
    }
}
