package ch.epfl.vlsc.vhdl.type;

public final class BoolType extends VhdlType {
    public static final BoolType INSTANCE = new BoolType();

    private BoolType() {
    }

    @Override
    public String toString() {
        return "boolean";
    }
}
