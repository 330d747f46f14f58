package ch.epfl.vlsc.vhdl.ir.design;

public class EnumItem implements DesignObject {
    private final EnumType type;
    private final String name;
    private final int index;

    EnumItem(EnumType type, String name, int index) {
        this.type = type;
        this.name = name;
        this.index = index;
    }

    public EnumType getType() {
        return type;
    }

    public String getName() {
        return name;
    }

    public int getIndex() {
        return index;
    }

    @Override
    public String toString() {
        return name;
    }
}
