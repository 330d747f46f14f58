package ch.epfl.vlsc.vhdl.type;

public final class IntType extends VhdlType {
    public static final IntType INSTANCE = new IntType();

    private IntType() {
    }

    @Override
    public String toString() {
        return "integer";
    }
}
