package ch.epfl.vlsc.vhdl.ir.design;

/**
 * Category of the value held by a signal, variable or memory element.
 */
public enum ValueKind {
    BOOL, INTEGER, UNSIGNED, SIGNED, ENUM
}
