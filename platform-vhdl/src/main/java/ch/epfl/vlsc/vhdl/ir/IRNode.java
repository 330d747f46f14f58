package ch.epfl.vlsc.vhdl.ir;

import ch.epfl.vlsc.vhdl.reporting.SourcePosition;

/**
 * Base class of the statement and expression trees of a process.
 * Nodes are immutable; analysis results are kept in side tables keyed by node identity.
 */
public abstract class IRNode {
    private final SourcePosition position;

    protected IRNode(SourcePosition position) {
        this.position = position == null ? SourcePosition.UNKNOWN : position;
    }

    public SourcePosition getPosition() {
        return position;
    }
}
