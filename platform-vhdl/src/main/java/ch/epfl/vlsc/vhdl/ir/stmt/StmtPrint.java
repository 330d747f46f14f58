package ch.epfl.vlsc.vhdl.ir.stmt;

import ch.epfl.vlsc.vhdl.ir.expr.Expression;
import ch.epfl.vlsc.vhdl.reporting.SourcePosition;
import com.google.common.collect.ImmutableList;

import java.util.List;

public class StmtPrint extends Statement {
    private final ImmutableList<Expression> items;

    public StmtPrint(List<Expression> items) {
        this(SourcePosition.UNKNOWN, items);
    }

    public StmtPrint(SourcePosition position, List<Expression> items) {
        super(position);
        this.items = ImmutableList.copyOf(items);
    }

    public ImmutableList<Expression> getItems() {
        return items;
    }

    @Override
    public void accept(Visitor visitor) {
        visitor.visit(this);
    }
}
