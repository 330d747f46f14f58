package ch.epfl.vlsc.vhdl.ir.stmt;

import ch.epfl.vlsc.vhdl.reporting.SourcePosition;
import com.google.common.collect.ImmutableList;

import java.util.List;
import java.util.Optional;

/**
 * An <code>if</code>/<code>elif</code> chain with an optional <code>else</code>.
 */
public class StmtIf extends Statement {
    private final ImmutableList<IfBranch> branches;
    private final ImmutableList<Statement> elseBranch;

    public StmtIf(List<IfBranch> branches, List<Statement> elseBranch) {
        this(SourcePosition.UNKNOWN, branches, elseBranch);
    }

    public StmtIf(SourcePosition position, List<IfBranch> branches, List<Statement> elseBranch) {
        super(position);
        this.branches = ImmutableList.copyOf(branches);
        if (this.branches.isEmpty()) {
            throw new IllegalArgumentException("An if statement needs at least one branch");
        }
        this.elseBranch = elseBranch == null ? null : ImmutableList.copyOf(elseBranch);
    }

    public ImmutableList<IfBranch> getBranches() {
        return branches;
    }

    public Optional<ImmutableList<Statement>> getElseBranch() {
        return Optional.ofNullable(elseBranch);
    }

    @Override
    public void accept(Visitor visitor) {
        visitor.visit(this);
    }
}
