package ch.epfl.vlsc.vhdl.ir.stmt.lvalue;

import ch.epfl.vlsc.vhdl.ir.IRNode;
import ch.epfl.vlsc.vhdl.reporting.SourcePosition;

/**
 * Target of an assignment.
 */
public abstract class LValue extends IRNode {

    protected LValue(SourcePosition position) {
        super(position);
    }

    public abstract <R> R accept(Visitor<R> visitor);

    /**
     * True when the target writes the next value of a signal.
     */
    public abstract boolean isSignal();

    /**
     * The name at the root of the target.
     */
    public abstract String getRootName();

    public interface Visitor<R> {
        R visit(LValueVariable variable);

        R visit(LValueNext next);

        R visit(LValueIndexer indexer);

        R visit(LValueSlice slice);
    }
}
