package ch.epfl.vlsc.vhdl.platformutils.utils;

import java.math.BigInteger;

public class MathUtils {

    /**
     * Two's complement bit string of <code>value</code> truncated to <code>width</code> bits,
     * most significant bit first.
     *
     * @param value any integer, negative values are wrapped
     * @param width number of bits, must be positive
     * @return the bit string
     */
    public static String binary(BigInteger value, int width) {
        if (width <= 0) {
            throw new IllegalArgumentException("Width must be positive, got " + width);
        }
        BigInteger wrapped = wrap(value, width);
        StringBuilder bits = new StringBuilder(width);
        for (int i = width - 1; i >= 0; i--) {
            bits.append(wrapped.testBit(i) ? '1' : '0');
        }
        return bits.toString();
    }

    /**
     * Reduces <code>value</code> modulo 2^width.
     */
    public static BigInteger wrap(BigInteger value, int width) {
        return value.mod(BigInteger.ONE.shiftLeft(width));
    }

    /**
     * Interprets the low <code>width</code> bits of <code>value</code> as a two's complement number.
     */
    public static BigInteger wrapSigned(BigInteger value, int width) {
        BigInteger wrapped = wrap(value, width);
        if (wrapped.testBit(width - 1)) {
            return wrapped.subtract(BigInteger.ONE.shiftLeft(width));
        }
        return wrapped;
    }

    /**
     * Extracts bits <code>[high-1 .. low]</code> of <code>value</code>.
     */
    public static BigInteger slice(BigInteger value, int high, int low) {
        if (high <= low) {
            throw new IllegalArgumentException(String.format("Empty slice [%d:%d]", high, low));
        }
        return wrap(value.shiftRight(low), high - low);
    }
}
