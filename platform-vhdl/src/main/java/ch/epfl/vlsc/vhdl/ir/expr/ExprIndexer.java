package ch.epfl.vlsc.vhdl.ir.expr;

import ch.epfl.vlsc.vhdl.reporting.SourcePosition;

import java.util.Objects;

/**
 * <code>structure[index]</code>: a bit of a vector, an element of a memory or an entry of a ROM.
 */
public class ExprIndexer extends Expression {
    private final Expression structure;
    private final Expression index;

    public ExprIndexer(Expression structure, Expression index) {
        this(SourcePosition.UNKNOWN, structure, index);
    }

    public ExprIndexer(SourcePosition position, Expression structure, Expression index) {
        super(position);
        this.structure = Objects.requireNonNull(structure);
        this.index = Objects.requireNonNull(index);
    }

    public Expression getStructure() {
        return structure;
    }

    public Expression getIndex() {
        return index;
    }

    @Override
    public <R> R accept(Visitor<R> visitor) {
        return visitor.visit(this);
    }
}
