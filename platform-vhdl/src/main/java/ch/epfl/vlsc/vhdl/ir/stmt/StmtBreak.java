package ch.epfl.vlsc.vhdl.ir.stmt;

import ch.epfl.vlsc.vhdl.reporting.SourcePosition;

public class StmtBreak extends Statement {

    public StmtBreak() {
        this(SourcePosition.UNKNOWN);
    }

    public StmtBreak(SourcePosition position) {
        super(position);
    }

    @Override
    public void accept(Visitor visitor) {
        visitor.visit(this);
    }
}
