package ch.epfl.vlsc.vhdl.ir.expr;

import ch.epfl.vlsc.vhdl.reporting.SourcePosition;

import java.util.Objects;

/**
 * <code>t_state.IDLE</code>: a member selected from an enumerated type bound in the symbol table.
 */
public class ExprEnumItem extends Expression {
    private final String type;
    private final String item;

    public ExprEnumItem(String type, String item) {
        this(SourcePosition.UNKNOWN, type, item);
    }

    public ExprEnumItem(SourcePosition position, String type, String item) {
        super(position);
        this.type = Objects.requireNonNull(type);
        this.item = Objects.requireNonNull(item);
    }

    public String getType() {
        return type;
    }

    public String getItem() {
        return item;
    }

    @Override
    public <R> R accept(Visitor<R> visitor) {
        return visitor.visit(this);
    }
}
