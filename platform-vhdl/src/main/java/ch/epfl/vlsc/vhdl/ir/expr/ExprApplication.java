package ch.epfl.vlsc.vhdl.ir.expr;

import ch.epfl.vlsc.vhdl.reporting.SourcePosition;
import com.google.common.collect.ImmutableList;

import java.util.List;
import java.util.Objects;

/**
 * A call of a builtin (<code>bool</code>, <code>len</code>, <code>int</code>, <code>intbv</code>,
 * <code>concat</code>) or of a function/procedure bound in the symbol table.
 */
public class ExprApplication extends Expression {
    private final String function;
    private final ImmutableList<Expression> args;

    public ExprApplication(String function, List<Expression> args) {
        this(SourcePosition.UNKNOWN, function, args);
    }

    public ExprApplication(SourcePosition position, String function, List<Expression> args) {
        super(position);
        this.function = Objects.requireNonNull(function);
        this.args = ImmutableList.copyOf(args);
    }

    public String getFunction() {
        return function;
    }

    public ImmutableList<Expression> getArgs() {
        return args;
    }

    @Override
    public <R> R accept(Visitor<R> visitor) {
        return visitor.visit(this);
    }
}
