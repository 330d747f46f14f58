package ch.epfl.vlsc.vhdl.type;

/**
 * A numeric_std signed or unsigned vector.
 */
public abstract class VectorType extends VhdlType {
    private final int size;

    protected VectorType(int size) {
        if (size < 0) {
            throw new IllegalArgumentException("Negative vector size " + size);
        }
        this.size = size;
    }

    @Override
    public int getSize() {
        return size;
    }

    @Override
    public boolean isVector() {
        return true;
    }

    public abstract boolean isSigned();

    /**
     * A vector of the same signedness with another size.
     */
    public abstract VectorType withSize(int size);

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        return size == ((VectorType) o).size;
    }

    @Override
    public int hashCode() {
        return 31 * getClass().hashCode() + size;
    }

    @Override
    public String toString() {
        return (isSigned() ? "signed(" : "unsigned(") + size + ")";
    }
}
