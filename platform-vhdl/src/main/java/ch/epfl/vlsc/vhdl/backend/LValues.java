package ch.epfl.vlsc.vhdl.backend;

import ch.epfl.vlsc.vhdl.ir.design.DesignObject;
import ch.epfl.vlsc.vhdl.ir.design.Memory;
import ch.epfl.vlsc.vhdl.ir.design.Signal;
import ch.epfl.vlsc.vhdl.ir.design.Variable;
import ch.epfl.vlsc.vhdl.ir.stmt.lvalue.LValue;
import ch.epfl.vlsc.vhdl.ir.stmt.lvalue.LValueIndexer;
import ch.epfl.vlsc.vhdl.ir.stmt.lvalue.LValueNext;
import ch.epfl.vlsc.vhdl.ir.stmt.lvalue.LValueSlice;
import ch.epfl.vlsc.vhdl.ir.stmt.lvalue.LValueVariable;
import ch.epfl.vlsc.vhdl.reporting.ConversionErrors;

public interface LValues extends LValue.Visitor<String> {
    VhdlBackend backend();

    default ExpressionEvaluator expressioneval() {
        return backend().expressioneval();
    }

    default String lvalue(LValue lvalue) {
        return lvalue.accept(this);
    }

    @Override
    default String visit(LValueVariable variable) {
        DesignObject object = backend().queries().resolve(backend().process(), variable, variable.getName());
        if (object instanceof Signal) {
            return ((Signal) object).getName();
        } else if (object instanceof Variable) {
            return ((Variable) object).getName();
        } else if (object instanceof Memory) {
            Memory memory = (Memory) object;
            if (!memory.isDeclarable()) {
                throw backend().queries().error(variable, ConversionErrors.LIST_ELEMENT_NOT_UNIQUE, memory.getName());
            }
            return memory.getName();
        }
        throw backend().queries().error(variable, ConversionErrors.UNSUPPORTED_TYPE, "assignment to " + variable.getName());
    }

    @Override
    default String visit(LValueNext next) {
        return lvalue(next.getTarget());
    }

    @Override
    default String visit(LValueIndexer indexer) {
        return String.format("%s(%s)", lvalue(indexer.getStructure()), expressioneval().evaluate(indexer.getIndex()));
    }

    @Override
    default String visit(LValueSlice slice) {
        int high = slice.getHigh().isPresent()
                ? backend().queries().constantInt(backend().process(), slice.getHigh().get())
                : backend().annotations().typeOf(slice.getStructure()).getSize();
        int low = slice.getLow().isPresent()
                ? backend().queries().constantInt(backend().process(), slice.getLow().get())
                : 0;
        return String.format("%s(%d downto %d)", lvalue(slice.getStructure()), high - 1, low);
    }
}
