package ch.epfl.vlsc.vhdl.backend;

import ch.epfl.vlsc.vhdl.ir.design.Signal;
import ch.epfl.vlsc.vhdl.ir.design.ValueKind;
import ch.epfl.vlsc.vhdl.ir.design.Variable;
import ch.epfl.vlsc.vhdl.platformutils.utils.MathUtils;
import ch.epfl.vlsc.vhdl.reporting.ConversionErrors;
import ch.epfl.vlsc.vhdl.type.BitType;
import ch.epfl.vlsc.vhdl.type.BoolType;
import ch.epfl.vlsc.vhdl.type.EnumeratedType;
import ch.epfl.vlsc.vhdl.type.IntType;
import ch.epfl.vlsc.vhdl.type.TypeAlgebra;
import ch.epfl.vlsc.vhdl.type.VectorType;
import ch.epfl.vlsc.vhdl.type.VhdlType;

import java.math.BigInteger;

public interface TypesEvaluator {
    VhdlBackend backend();

    /**
     * The declared VHDL type, vectors with an explicit range.
     */
    default String type(VhdlType type) {
        if (type instanceof VectorType) {
            VectorType vector = (VectorType) type;
            return String.format("%s(%d downto 0)", vector.isSigned() ? "signed" : "unsigned", vector.getSize() - 1);
        }
        return unconstrained(type);
    }

    /**
     * The type of a subprogram parameter or result: vectors without range.
     */
    default String unconstrained(VhdlType type) {
        if (type instanceof VectorType) {
            return ((VectorType) type).isSigned() ? "signed" : "unsigned";
        } else if (type instanceof BitType) {
            return "std_logic";
        } else if (type instanceof BoolType) {
            return "boolean";
        } else if (type instanceof IntType) {
            return "integer";
        } else if (type instanceof EnumeratedType) {
            return ((EnumeratedType) type).getType().getTypeName();
        }
        throw ConversionErrors.UNSUPPORTED_TYPE.exception(String.valueOf(type));
    }

    default String type(Signal signal) {
        return type(TypeAlgebra.of(signal));
    }

    default String type(Variable variable) {
        return type(TypeAlgebra.of(variable));
    }

    /**
     * A literal of the given type: a character for a bit, decimal for an integer, a sized bit string
     * for a vector (two's complement when signed).
     */
    default String literal(BigInteger value, VhdlType type) {
        if (type instanceof BitType) {
            return value.signum() != 0 ? "'1'" : "'0'";
        } else if (type instanceof BoolType) {
            return value.signum() != 0 ? "True" : "False";
        } else if (type instanceof VectorType && type.getSize() > 0) {
            return "\"" + MathUtils.binary(value, type.getSize()) + "\"";
        } else if (type instanceof EnumeratedType) {
            throw ConversionErrors.UNSUPPORTED_TYPE.exception("integer " + value + " as " + type);
        }
        return value.signum() < 0 ? "(" + value + ")" : value.toString();
    }

    /**
     * The current value of a signal, written as a literal of its type.
     */
    default String initialValue(Signal signal) {
        if (signal.getKind() == ValueKind.ENUM) {
            return signal.getEnumValue().getName();
        }
        return literal(signal.getValue(), TypeAlgebra.of(signal));
    }
}
