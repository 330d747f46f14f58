package ch.epfl.vlsc.vhdl.type;

import ch.epfl.vlsc.vhdl.ir.design.EnumType;
import ch.epfl.vlsc.vhdl.ir.design.Signal;
import ch.epfl.vlsc.vhdl.ir.design.ValueKind;
import ch.epfl.vlsc.vhdl.ir.design.Variable;

import java.util.Optional;

/**
 * Rules combining the types of operands.
 */
public final class TypeAlgebra {

    private TypeAlgebra() {
    }

    public static VhdlType of(ValueKind kind, int width, EnumType enumType) {
        switch (kind) {
            case BOOL:
                return BitType.INSTANCE;
            case INTEGER:
                return IntType.INSTANCE;
            case UNSIGNED:
                return new UnsignedType(width);
            case SIGNED:
                return new SignedType(width);
            case ENUM:
                return new EnumeratedType(enumType);
            default:
                throw new IllegalArgumentException("Unknown value kind " + kind);
        }
    }

    public static VhdlType of(Signal signal) {
        return of(signal.getKind(), signal.getWidth(), signal.getEnumType());
    }

    public static VhdlType of(Variable variable) {
        return of(variable.getKind(), variable.getWidth(), variable.getEnumType());
    }

    /**
     * Common type of two operands of a bitwise operation or a comparison.
     * Signed wins over unsigned, unsigned over a bit, and a bit over an integer; the size is the
     * largest of the two. An enumeration only combines with itself.
     */
    public static Optional<VhdlType> combine(VhdlType a, VhdlType b) {
        if (a instanceof EnumeratedType || b instanceof EnumeratedType) {
            return a.equals(b) ? Optional.of(a) : Optional.empty();
        }
        int size = Math.max(a.getSize(), b.getSize());
        if (a instanceof SignedType || b instanceof SignedType) {
            return Optional.of(new SignedType(size));
        }
        if (a instanceof UnsignedType || b instanceof UnsignedType) {
            return Optional.of(new UnsignedType(size));
        }
        if (a instanceof BitType || b instanceof BitType) {
            return Optional.of(BitType.INSTANCE);
        }
        if (a instanceof IntType || b instanceof IntType) {
            return Optional.of(IntType.INSTANCE);
        }
        if (a instanceof BoolType && b instanceof BoolType) {
            return Optional.of(a);
        }
        return Optional.empty();
    }

    /**
     * Result type of an arithmetic operation. Operands of one signedness, integers included, give a
     * vector of that signedness sized to the widest operand; two integers give an integer, and a
     * signed operand with an unsigned one is computed as an integer.
     */
    public static VhdlType arithmetic(VhdlType left, VhdlType right) {
        if (left instanceof IntType && right instanceof IntType) {
            return IntType.INSTANCE;
        }
        int size = Math.max(left.getSize(), right.getSize());
        if (isSignedOrInteger(left) && isSignedOrInteger(right)) {
            return new SignedType(size);
        }
        if (isUnsignedOrInteger(left) && isUnsignedOrInteger(right)) {
            return new UnsignedType(size);
        }
        return IntType.INSTANCE;
    }

    private static boolean isSignedOrInteger(VhdlType type) {
        return type instanceof SignedType || type instanceof IntType;
    }

    private static boolean isUnsignedOrInteger(VhdlType type) {
        return type instanceof UnsignedType || type instanceof IntType;
    }
}
