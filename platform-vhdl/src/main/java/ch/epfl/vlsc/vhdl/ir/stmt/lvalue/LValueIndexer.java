package ch.epfl.vlsc.vhdl.ir.stmt.lvalue;

import ch.epfl.vlsc.vhdl.ir.expr.Expression;
import ch.epfl.vlsc.vhdl.reporting.SourcePosition;

import java.util.Objects;

public class LValueIndexer extends LValue {
    private final LValue structure;
    private final Expression index;

    public LValueIndexer(LValue structure, Expression index) {
        this(SourcePosition.UNKNOWN, structure, index);
    }

    public LValueIndexer(SourcePosition position, LValue structure, Expression index) {
        super(position);
        this.structure = Objects.requireNonNull(structure);
        this.index = Objects.requireNonNull(index);
    }

    public LValue getStructure() {
        return structure;
    }

    public Expression getIndex() {
        return index;
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
