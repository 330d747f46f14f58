package ch.epfl.vlsc.vhdl.ir.design;

/**
 * Anything a name in a process body can be bound to.
 */
public interface DesignObject {
}
