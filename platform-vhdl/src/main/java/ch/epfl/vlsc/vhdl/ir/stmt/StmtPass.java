package ch.epfl.vlsc.vhdl.ir.stmt;

import ch.epfl.vlsc.vhdl.reporting.SourcePosition;

public class StmtPass extends Statement {

    public StmtPass() {
        this(SourcePosition.UNKNOWN);
    }

    public StmtPass(SourcePosition position) {
        super(position);
    }

    @Override
    public void accept(Visitor visitor) {
        visitor.visit(this);
    }
}
