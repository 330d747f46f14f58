package ch.epfl.vlsc.vhdl.ir.design;

import java.util.Objects;

/**
 * A process local variable or a parameter of a function or procedure.
 */
public class Variable implements DesignObject {
    private final String name;
    private final ValueKind kind;
    private final int width;
    private final EnumType enumType;

    private Variable(String name, ValueKind kind, int width, EnumType enumType) {
        this.name = Objects.requireNonNull(name);
        this.kind = kind;
        this.width = width;
        this.enumType = enumType;
    }

    public static Variable integer(String name) {
        return new Variable(name, ValueKind.INTEGER, 0, null);
    }

    public static Variable bool(String name) {
        return new Variable(name, ValueKind.BOOL, 1, null);
    }

    public static Variable unsigned(String name, int width) {
        return new Variable(name, ValueKind.UNSIGNED, width, null);
    }

    public static Variable signed(String name, int width) {
        return new Variable(name, ValueKind.SIGNED, width, null);
    }

    public static Variable enumerated(String name, EnumType type) {
        return new Variable(name, ValueKind.ENUM, 0, type);
    }

    /**
     * A variable of the same type as the signal.
     */
    public static Variable like(String name, Signal signal) {
        return new Variable(name, signal.getKind(), signal.getWidth(), signal.getEnumType());
    }

    public String getName() {
        return name;
    }

    public ValueKind getKind() {
        return kind;
    }

    public int getWidth() {
        return width;
    }

    public EnumType getEnumType() {
        return enumType;
    }
}
