package ch.epfl.vlsc.vhdl.ir.design;

import java.math.BigInteger;

/**
 * An integer or boolean value captured from the enclosing scope of a process.
 */
public class Constant implements DesignObject {
    private final BigInteger value;
    private final boolean bool;

    private Constant(BigInteger value, boolean bool) {
        this.value = value;
        this.bool = bool;
    }

    public static Constant of(long value) {
        return new Constant(BigInteger.valueOf(value), false);
    }

    public static Constant of(BigInteger value) {
        return new Constant(value, false);
    }

    public static Constant of(boolean value) {
        return new Constant(value ? BigInteger.ONE : BigInteger.ZERO, true);
    }

    public BigInteger getValue() {
        return value;
    }

    public boolean isBool() {
        return bool;
    }
}
