package ch.epfl.vlsc.vhdl.ir.stmt;

import ch.epfl.vlsc.vhdl.ir.IRNode;
import ch.epfl.vlsc.vhdl.reporting.SourcePosition;

public abstract class Statement extends IRNode {

    protected Statement(SourcePosition position) {
        super(position);
    }

    public abstract void accept(Visitor visitor);

    public interface Visitor {
        void visit(StmtAssignment assignment);

        void visit(StmtAugmentedAssignment assignment);

        void visit(StmtIf stmt);

        void visit(StmtFor stmt);

        void visit(StmtWhile stmt);

        void visit(StmtBreak stmt);

        void visit(StmtContinue stmt);

        void visit(StmtReturn stmt);

        void visit(StmtCall call);

        void visit(StmtPass stmt);

        void visit(StmtPrint print);

        void visit(StmtStopSimulation stmt);

        void visit(StmtAssert stmt);

        void visit(StmtWait stmt);
    }
}
