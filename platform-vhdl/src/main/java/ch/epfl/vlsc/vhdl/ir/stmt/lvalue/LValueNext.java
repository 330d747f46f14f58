package ch.epfl.vlsc.vhdl.ir.stmt.lvalue;

import ch.epfl.vlsc.vhdl.reporting.SourcePosition;

import java.util.Objects;

/**
 * <code>target.next</code>.
 */
public class LValueNext extends LValue {
    private final LValue target;

    public LValueNext(LValue target) {
        this(SourcePosition.UNKNOWN, target);
    }

    public LValueNext(SourcePosition position, LValue target) {
        super(position);
        this.target = Objects.requireNonNull(target);
    }

    /**
     * Shorthand for <code>name.next</code>.
     */
    public static LValueNext of(String name) {
        return new LValueNext(new LValueVariable(name));
    }

    public LValue getTarget() {
        return target;
    }

    @Override
    public boolean isSignal() {
        return true;
    }

    @Override
    public String getRootName() {
        return target.getRootName();
    }

    @Override
    public <R> R accept(Visitor<R> visitor) {
        return visitor.visit(this);
    }
}
