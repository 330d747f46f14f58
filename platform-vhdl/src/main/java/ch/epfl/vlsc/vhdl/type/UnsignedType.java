package ch.epfl.vlsc.vhdl.type;

public final class UnsignedType extends VectorType {

    public UnsignedType(int size) {
        super(size);
    }

    @Override
    public boolean isSigned() {
        return false;
    }

    @Override
    public UnsignedType withSize(int size) {
        return new UnsignedType(size);
    }
}
