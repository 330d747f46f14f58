package ch.epfl.vlsc.vhdl.type;

import ch.epfl.vlsc.vhdl.ir.design.EnumType;

import java.util.Objects;

public final class EnumeratedType extends VhdlType {
    private final EnumType type;

    public EnumeratedType(EnumType type) {
        this.type = Objects.requireNonNull(type);
    }

    public EnumType getType() {
        return type;
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof EnumeratedType && ((EnumeratedType) o).type == type;
    }

    @Override
    public int hashCode() {
        return System.identityHashCode(type);
    }

    @Override
    public String toString() {
        return type.getTypeName();
    }
}
