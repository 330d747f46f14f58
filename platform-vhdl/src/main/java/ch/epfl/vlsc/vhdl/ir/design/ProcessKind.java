package ch.epfl.vlsc.vhdl.ir.design;

public enum ProcessKind {
    /** Edge or level triggered, driven by an explicit sensitivity. */
    SEQUENTIAL,
    /** Sensitive to all the signals it reads. */
    COMBINATIONAL,
    /** Only signal assignments; written as concurrent statements. */
    SIMPLE_COMBINATIONAL,
    /** A sequential body waiting on an explicit list. */
    CUSTOM_SENSITIVITY,
    /** Runs once, may contain waits. */
    INITIAL,
    FUNCTION,
    PROCEDURE;

    public boolean isCallable() {
        return this == FUNCTION || this == PROCEDURE;
    }
}
