package ch.epfl.vlsc.vhdl.ir.stmt;

import ch.epfl.vlsc.vhdl.reporting.SourcePosition;

public class StmtContinue extends Statement {

    public StmtContinue() {
        this(SourcePosition.UNKNOWN);
    }

    public StmtContinue(SourcePosition position) {
        super(position);
    }

    @Override
    public void accept(Visitor visitor) {
        visitor.visit(this);
    }
}
