package ch.epfl.vlsc.vhdl.ir.stmt.lvalue;

import ch.epfl.vlsc.vhdl.ir.expr.Expression;
import ch.epfl.vlsc.vhdl.reporting.SourcePosition;

import java.util.Objects;
import java.util.Optional;

public class LValueSlice extends LValue {
    private final LValue structure;
    private final Expression high;
    private final Expression low;

    public LValueSlice(LValue structure, Expression high, Expression low) {
        this(SourcePosition.UNKNOWN, structure, high, low);
    }

    public LValueSlice(SourcePosition position, LValue structure, Expression high, Expression low) {
        super(position);
        this.structure = Objects.requireNonNull(structure);
        this.high = high;
        this.low = low;
    }

    public LValue getStructure() {
        return structure;
    }

    public Optional<Expression> getHigh() {
        return Optional.ofNullable(high);
    }

    public Optional<Expression> getLow() {
        return Optional.ofNullable(low);
    }

    @Override
    public boolean isSignal() {
        return structure.isSignal();
    }

    @Override
    public String getRootName() {
        return structure.getRootName();
    }

    @Override
    public <R> R accept(Visitor<R> visitor) {
        return visitor.visit(this);
    }
}
