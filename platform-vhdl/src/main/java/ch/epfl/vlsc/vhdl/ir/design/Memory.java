package ch.epfl.vlsc.vhdl.ir.design;

/**
 * A list of signals used as a memory.
 * It can only be declared as an array when its element signals belong to no other structure.
 */
public class Memory implements DesignObject {
    private final String name;
    private final int depth;
    private final Signal element;
    private final boolean declarable;

    public Memory(String name, int depth, Signal element) {
        this(name, depth, element, true);
    }

    public Memory(String name, int depth, Signal element, boolean declarable) {
        if (depth <= 0) {
            throw new IllegalArgumentException("Memory " + name + " must have at least one element");
        }
        this.name = name;
        this.depth = depth;
        this.element = element;
        this.declarable = declarable;
    }

    public String getName() {
        return name;
    }

    public int getDepth() {
        return depth;
    }

    /**
     * Prototype of the element signals, giving their type.
     */
    public Signal getElement() {
        return element;
    }

    public boolean isDeclarable() {
        return declarable;
    }
}
