package ch.epfl.vlsc.vhdl.ir.stmt;

import ch.epfl.vlsc.vhdl.ir.expr.Expression;
import ch.epfl.vlsc.vhdl.reporting.SourcePosition;
import com.google.common.collect.ImmutableList;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * <code>for i in range(start, stop, step)</code> or <code>for i in downrange(start, stop, step)</code>.
 * An absent start of an ascending range and an absent stop of a descending range are zero.
 */
public class StmtFor extends Statement {

    public enum Direction {
        ASCENDING, DESCENDING
    }

    private final String variable;
    private final Direction direction;
    private final Expression start;
    private final Expression stop;
    private final Expression step;
    private final ImmutableList<Statement> body;

    public StmtFor(String variable, Direction direction, Expression start, Expression stop, Expression step,
                   List<Statement> body) {
        this(SourcePosition.UNKNOWN, variable, direction, start, stop, step, body);
    }

    public StmtFor(SourcePosition position, String variable, Direction direction, Expression start, Expression stop,
                   Expression step, List<Statement> body) {
        super(position);
        this.variable = Objects.requireNonNull(variable);
        this.direction = Objects.requireNonNull(direction);
        this.start = start;
        this.stop = stop;
        this.step = step;
        this.body = ImmutableList.copyOf(body);
    }

    public static StmtFor range(String variable, Expression start, Expression stop, List<Statement> body) {
        return new StmtFor(variable, Direction.ASCENDING, start, stop, null, body);
    }

    public static StmtFor downrange(String variable, Expression start, Expression stop, List<Statement> body) {
        return new StmtFor(variable, Direction.DESCENDING, start, stop, null, body);
    }

    public String getVariable() {
        return variable;
    }

    public Direction getDirection() {
        return direction;
    }

    public Optional<Expression> getStart() {
        return Optional.ofNullable(start);
    }

    public Optional<Expression> getStop() {
        return Optional.ofNullable(stop);
    }

    public Optional<Expression> getStep() {
        return Optional.ofNullable(step);
    }

    public ImmutableList<Statement> getBody() {
        return body;
    }

    @Override
    public void accept(Visitor visitor) {
        visitor.visit(this);
    }
}
