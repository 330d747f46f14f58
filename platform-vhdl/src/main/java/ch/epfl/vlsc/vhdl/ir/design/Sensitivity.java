package ch.epfl.vlsc.vhdl.ir.design;

/**
 * One entry of a sensitivity list or of a wait statement.
 */
public abstract class Sensitivity {

    public enum Kind {
        EDGE, LEVEL, DELAY
    }

    public abstract Kind getKind();
}
