package ch.epfl.vlsc.vhdl.ir.stmt;

import ch.epfl.vlsc.vhdl.reporting.SourcePosition;

/**
 * <code>raise StopSimulation</code>: ends a testbench run.
 */
public class StmtStopSimulation extends Statement {

    public StmtStopSimulation() {
        this(SourcePosition.UNKNOWN);
    }

    public StmtStopSimulation(SourcePosition position) {
        super(position);
    }

    @Override
    public void accept(Visitor visitor) {
        visitor.visit(this);
    }
}
