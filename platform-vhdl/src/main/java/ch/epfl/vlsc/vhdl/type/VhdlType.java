package ch.epfl.vlsc.vhdl.type;

/**
 * The VHDL view of an expression, an assignment target or a declared object.
 */
public abstract class VhdlType {

    /**
     * Bit width, 0 when the type has no width.
     */
    public int getSize() {
        return 0;
    }

    public boolean isVector() {
        return false;
    }
}
