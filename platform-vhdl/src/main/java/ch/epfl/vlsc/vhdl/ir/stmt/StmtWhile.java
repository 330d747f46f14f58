package ch.epfl.vlsc.vhdl.ir.stmt;

import ch.epfl.vlsc.vhdl.ir.expr.Expression;
import ch.epfl.vlsc.vhdl.reporting.SourcePosition;
import com.google.common.collect.ImmutableList;

import java.util.List;
import java.util.Objects;

public class StmtWhile extends Statement {
    private final Expression condition;
    private final ImmutableList<Statement> body;

    public StmtWhile(Expression condition, List<Statement> body) {
        this(SourcePosition.UNKNOWN, condition, body);
    }

    public StmtWhile(SourcePosition position, Expression condition, List<Statement> body) {
        super(position);
        this.condition = Objects.requireNonNull(condition);
        this.body = ImmutableList.copyOf(body);
    }

    public Expression getCondition() {
        return condition;
    }

    public ImmutableList<Statement> getBody() {
        return body;
    }

    @Override
    public void accept(Visitor visitor) {
        visitor.visit(this);
    }
}
