package ch.epfl.vlsc.vhdl.attribute;

import ch.epfl.vlsc.vhdl.ir.IRNode;
import ch.epfl.vlsc.vhdl.ir.design.DesignObject;
import ch.epfl.vlsc.vhdl.ir.design.EdgeSensitivity;
import ch.epfl.vlsc.vhdl.ir.design.Process;
import ch.epfl.vlsc.vhdl.ir.design.Sensitivity;
import ch.epfl.vlsc.vhdl.ir.expr.Expression;
import ch.epfl.vlsc.vhdl.reporting.CompilationException;
import ch.epfl.vlsc.vhdl.reporting.ConversionErrors;

import java.math.BigInteger;
import java.util.List;
import java.util.Optional;

/**
 * Questions asked about the tree of a process while it is converted.
 */
public interface TreeQueries {

    /**
     * The object a name denotes inside a process: a local variable or parameter first, then a symbol.
     */
    Optional<DesignObject> lookup(Process process, String name);

    /**
     * The value of an expression that can be computed during conversion.
     */
    Optional<BigInteger> constantValue(Process process, Expression expression);

    /**
     * The edge of the sensitivity list that an asynchronous test refers to.
     */
    Optional<EdgeSensitivity> edgeOf(Process process, Expression test, List<Sensitivity> sensitivity);

    default CompilationException error(IRNode node, ConversionErrors error, String detail) {
        return error.exception(detail, node.getPosition());
    }

    default DesignObject resolve(Process process, IRNode node, String name) {
        return lookup(process, name).orElseThrow(() -> error(node, ConversionErrors.UNDEFINED_NAME, name));
    }

    default int constantInt(Process process, Expression expression) {
        BigInteger value = constantValue(process, expression)
                .orElseThrow(() -> error(expression, ConversionErrors.NOT_CONSTANT, "in process " + process.getName()));
        return checkedInt(expression, value);
    }

    /**
     * A folded value used as a bound, width or shift amount, which must fit in a VHDL integer.
     */
    default int checkedInt(IRNode node, BigInteger value) {
        if (value.bitLength() > 31) {
            throw error(node, ConversionErrors.NOT_SUPPORTED, "constant " + value + " is out of the integer range");
        }
        return value.intValue();
    }
}
