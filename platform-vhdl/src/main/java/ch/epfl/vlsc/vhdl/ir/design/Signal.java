package ch.epfl.vlsc.vhdl.ir.design;

import com.google.common.base.Preconditions;

import java.math.BigInteger;
import java.util.Objects;

/**
 * A signal of the elaborated design.
 * <p>
 * The name and the driven/read flags are filled in by the analysis of the design and are
 * cleared again once a conversion has been written out.
 */
public class Signal implements DesignObject {
    private final String baseName;
    private String name;
    private final ValueKind kind;
    private final int width;
    private final EnumType enumType;
    private final BigInteger value;
    private final EnumItem enumValue;
    private boolean driven;
    private boolean read;

    private Signal(String name, ValueKind kind, int width, EnumType enumType, BigInteger value, EnumItem enumValue) {
        this.baseName = name;
        this.name = name;
        this.kind = kind;
        this.width = width;
        this.enumType = enumType;
        this.value = value;
        this.enumValue = enumValue;
    }

    public static Signal bool(String name, boolean initial) {
        return new Signal(name, ValueKind.BOOL, 1, null, initial ? BigInteger.ONE : BigInteger.ZERO, null);
    }

    public static Signal unsigned(String name, int width, long initial) {
        Preconditions.checkArgument(width > 0, "width must be positive");
        return new Signal(name, ValueKind.UNSIGNED, width, null, BigInteger.valueOf(initial), null);
    }

    public static Signal signed(String name, int width, long initial) {
        Preconditions.checkArgument(width > 0, "width must be positive");
        return new Signal(name, ValueKind.SIGNED, width, null, BigInteger.valueOf(initial), null);
    }

    public static Signal enumerated(String name, EnumItem initial) {
        return new Signal(name, ValueKind.ENUM, 0, initial.getType(), null, initial);
    }

    /**
     * The name given by the analysis. The name used in the output may differ, e.g. for a port.
     */
    public String getBaseName() {
        return baseName;
    }

    /**
     * The name used in the output. It is cleared when a conversion finishes.
     */
    public String getName() {
        return name;
    }

    public void setName(String name) {
        this.name = name;
    }

    public ValueKind getKind() {
        return kind;
    }

    /**
     * Bit width; 1 for a boolean signal and 0 for an enumerated one.
     */
    public int getWidth() {
        return width;
    }

    public EnumType getEnumType() {
        return enumType;
    }

    public BigInteger getValue() {
        return value;
    }

    public EnumItem getEnumValue() {
        return enumValue;
    }

    public boolean isDriven() {
        return driven;
    }

    public void setDriven(boolean driven) {
        this.driven = driven;
    }

    public boolean isRead() {
        return read;
    }

    public void setRead(boolean read) {
        this.read = read;
    }

    public void reset() {
        name = null;
        driven = false;
        read = false;
    }

    @Override
    public String toString() {
        return Objects.toString(name, baseName) + ": " + kind + (kind == ValueKind.ENUM ? "" : "(" + width + ")");
    }
}
