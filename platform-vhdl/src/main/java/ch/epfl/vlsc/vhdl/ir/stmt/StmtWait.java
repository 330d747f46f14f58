package ch.epfl.vlsc.vhdl.ir.stmt;

import ch.epfl.vlsc.vhdl.ir.design.Sensitivity;
import ch.epfl.vlsc.vhdl.reporting.SourcePosition;
import com.google.common.collect.ImmutableList;

import java.util.List;

/**
 * Suspends an initial process on a delay, on edges or on signal changes.
 */
public class StmtWait extends Statement {
    private final ImmutableList<Sensitivity> waits;

    public StmtWait(List<Sensitivity> waits) {
        this(SourcePosition.UNKNOWN, waits);
    }

    public StmtWait(SourcePosition position, List<Sensitivity> waits) {
        super(position);
        this.waits = ImmutableList.copyOf(waits);
        if (this.waits.isEmpty()) {
            throw new IllegalArgumentException("Nothing to wait for");
        }
    }

    public ImmutableList<Sensitivity> getWaits() {
        return waits;
    }

    @Override
    public void accept(Visitor visitor) {
        visitor.visit(this);
    }
}
