package ch.epfl.vlsc.vhdl.type;

/**
 * A single std_logic bit.
 */
public final class BitType extends VhdlType {
    public static final BitType INSTANCE = new BitType();

    private BitType() {
    }

    @Override
    public int getSize() {
        return 1;
    }

    @Override
    public String toString() {
        return "std_logic";
    }
}
