package ch.epfl.vlsc.vhdl.platform;

import ch.epfl.vlsc.vhdl.ir.design.Design;

/**
 * A top-level hardware description: building it gives an instance, and the instance is elaborated
 * into the design that is converted.
 *
 * @param <T> the type of the instance
 */
public interface TopLevel<T> {

    /**
     * Builds the instance, as an ordinary call would.
     */
    T instantiate(Object... args);

    /**
     * Analyzes the instance into a design.
     */
    Design elaborate(T instance, Object... args);
}
