package ch.epfl.vlsc.vhdl.type;

public final class SignedType extends VectorType {

    public SignedType(int size) {
        super(size);
    }

    @Override
    public boolean isSigned() {
        return true;
    }

    @Override
    public SignedType withSize(int size) {
        return new SignedType(size);
    }
}
