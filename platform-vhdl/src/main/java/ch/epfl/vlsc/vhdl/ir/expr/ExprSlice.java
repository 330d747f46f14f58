package ch.epfl.vlsc.vhdl.ir.expr;

import ch.epfl.vlsc.vhdl.reporting.SourcePosition;

import java.util.Objects;
import java.util.Optional;

/**
 * <code>structure[high:low]</code>, selecting bits <code>high-1</code> down to <code>low</code>.
 * A missing high bound means the operand width, a missing low bound means zero.
 */
public class ExprSlice extends Expression {
    private final Expression structure;
    private final Expression high;
    private final Expression low;

    public ExprSlice(Expression structure, Expression high, Expression low) {
        this(SourcePosition.UNKNOWN, structure, high, low);
    }

    public ExprSlice(SourcePosition position, Expression structure, Expression high, Expression low) {
        super(position);
        this.structure = Objects.requireNonNull(structure);
        this.high = high;
        this.low = low;
    }

    public Expression getStructure() {
        return structure;
    }

    public Optional<Expression> getHigh() {
        return Optional.ofNullable(high);
    }

    public Optional<Expression> getLow() {
        return Optional.ofNullable(low);
    }

    @Override
    public <R> R accept(Visitor<R> visitor) {
        return visitor.visit(this);
    }
}
