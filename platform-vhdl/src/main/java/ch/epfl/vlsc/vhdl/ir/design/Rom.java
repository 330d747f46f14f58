package ch.epfl.vlsc.vhdl.ir.design;

import com.google.common.collect.ImmutableList;

import java.math.BigInteger;
import java.util.List;

/**
 * A constant tuple of integers indexed inside a process.
 */
public class Rom implements DesignObject {
    private final ImmutableList<BigInteger> table;

    public Rom(List<BigInteger> table) {
        if (table.isEmpty()) {
            throw new IllegalArgumentException("ROM table is empty");
        }
        this.table = ImmutableList.copyOf(table);
    }

    public static Rom of(long... values) {
        ImmutableList.Builder<BigInteger> builder = ImmutableList.builder();
        for (long value : values) {
            builder.add(BigInteger.valueOf(value));
        }
        return new Rom(builder.build());
    }

    public ImmutableList<BigInteger> getTable() {
        return table;
    }
}
