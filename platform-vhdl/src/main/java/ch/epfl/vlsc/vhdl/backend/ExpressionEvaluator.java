package ch.epfl.vlsc.vhdl.backend;

import ch.epfl.vlsc.vhdl.ir.design.Constant;
import ch.epfl.vlsc.vhdl.ir.design.DesignObject;
import ch.epfl.vlsc.vhdl.ir.design.EnumItem;
import ch.epfl.vlsc.vhdl.ir.design.Memory;
import ch.epfl.vlsc.vhdl.ir.design.Process;
import ch.epfl.vlsc.vhdl.ir.design.Rom;
import ch.epfl.vlsc.vhdl.ir.design.Signal;
import ch.epfl.vlsc.vhdl.ir.design.ValueKind;
import ch.epfl.vlsc.vhdl.ir.design.Variable;
import ch.epfl.vlsc.vhdl.ir.expr.ExprApplication;
import ch.epfl.vlsc.vhdl.ir.expr.ExprBinaryOp;
import ch.epfl.vlsc.vhdl.ir.expr.ExprBoolOp;
import ch.epfl.vlsc.vhdl.ir.expr.ExprComparison;
import ch.epfl.vlsc.vhdl.ir.expr.ExprEdge;
import ch.epfl.vlsc.vhdl.ir.expr.ExprEnumItem;
import ch.epfl.vlsc.vhdl.ir.expr.ExprIndexer;
import ch.epfl.vlsc.vhdl.ir.expr.ExprLiteral;
import ch.epfl.vlsc.vhdl.ir.expr.ExprSlice;
import ch.epfl.vlsc.vhdl.ir.expr.ExprUnaryOp;
import ch.epfl.vlsc.vhdl.ir.expr.ExprVariable;
import ch.epfl.vlsc.vhdl.ir.expr.Expression;
import ch.epfl.vlsc.vhdl.reporting.ConversionErrors;
import ch.epfl.vlsc.vhdl.type.BitType;
import ch.epfl.vlsc.vhdl.type.BoolType;
import ch.epfl.vlsc.vhdl.type.IntType;
import ch.epfl.vlsc.vhdl.type.SignedType;
import ch.epfl.vlsc.vhdl.type.TypeAlgebra;
import ch.epfl.vlsc.vhdl.type.UnsignedType;
import ch.epfl.vlsc.vhdl.type.VhdlType;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Writes expressions. Every expression is written as the type it is viewed as in its context,
 * inserting the conversion functions of numeric_std where the inferred type differs.
 */
public interface ExpressionEvaluator extends Expression.Visitor<String> {
    VhdlBackend backend();

    default TypesEvaluator typeseval() {
        return backend().typeseval();
    }

    default Process process() {
        return backend().process();
    }

    default String evaluate(Expression expression) {
        return expression.accept(this);
    }

    default VhdlType viewOf(Expression expression) {
        return backend().viewOf(expression);
    }

    default VhdlType inferredOf(Expression expression) {
        return backend().annotations().typeOf(expression);
    }

    default void coerce(Expression expression, VhdlType type) {
        backend().coercions().put(expression, type);
    }

    default DesignObject resolve(Expression node, String name) {
        return backend().queries().resolve(process(), node, name);
    }

    /**
     * Writes a value assigned to, passed as or returned as the given type.
     */
    default String convert(Expression value, VhdlType target) {
        VhdlType source = viewOf(value);
        if ((target instanceof UnsignedType || target instanceof SignedType) && !target.equals(source)) {
            if (source.getClass() == target.getClass()) {
                coerce(value, target);
                return evaluate(value);
            }
            coerce(value, IntType.INSTANCE);
            return String.format("%s(%s, %d)", target instanceof SignedType ? "to_signed" : "to_unsigned",
                    evaluate(value), target.getSize());
        } else if (target instanceof BitType) {
            coerce(value, BitType.INSTANCE);
        } else if (target instanceof IntType && (source.isVector() || source instanceof BitType)) {
            coerce(value, IntType.INSTANCE);
        }
        return evaluate(value);
    }

    /**
     * Adapts text computing a value of type <code>natural</code> to the type <code>view</code>.
     */
    default String adapt(String text, VhdlType natural, VhdlType view) {
        if (natural.equals(view)) {
            return text;
        }
        if (natural instanceof BoolType && view instanceof BitType) {
            return "to_std_logic(" + text + ")";
        } else if (natural instanceof BitType && view instanceof BoolType) {
            return "(" + text + " = '1')";
        } else if (natural.isVector() && view instanceof BoolType) {
            return "(" + text + " /= 0)";
        } else if (natural.isVector() && view instanceof IntType) {
            return "to_integer(" + text + ")";
        } else if (natural.isVector() && natural.getClass() == view.getClass()) {
            return String.format("resize(%s, %d)", text, view.getSize());
        }
        return text;
    }

    /**
     * Writes a boolean valued operation, as a std_logic when a bit is expected.
     */
    default String booleanResult(String inner, Expression expression) {
        if (viewOf(expression) instanceof BitType) {
            return "to_std_logic(" + inner + ")";
        }
        return "(" + inner + ")";
    }

    /*
     * Literals and names
     */

    @Override
    default String visit(ExprLiteral literal) {
        if (literal.getKind() == ExprLiteral.Kind.STRING) {
            return "\"" + literal.getText().replace("\"", "\"\"") + "\"";
        }
        return typeseval().literal(literal.getValue(), viewOf(literal));
    }

    @Override
    default String visit(ExprVariable variable) {
        String name = variable.getName();
        if (backend().annotations().isLoopVariable(process(), name)) {
            return name;
        }
        DesignObject object = resolve(variable, name);
        VhdlType view = viewOf(variable);
        if (object instanceof Signal) {
            return adapt(((Signal) object).getName(), TypeAlgebra.of((Signal) object), view);
        } else if (object instanceof Variable) {
            return adapt(name, TypeAlgebra.of((Variable) object), view);
        } else if (object instanceof Constant) {
            return typeseval().literal(((Constant) object).getValue(), view);
        } else if (object instanceof EnumItem) {
            return ((EnumItem) object).getName();
        } else if (object instanceof Memory) {
            return memoryName(variable, (Memory) object);
        } else if (object instanceof Rom) {
            throw backend().queries().error(variable, ConversionErrors.NOT_SUPPORTED,
                    "ROM " + name + " read outside of an assignment");
        }
        throw backend().queries().error(variable, ConversionErrors.UNSUPPORTED_TYPE, name);
    }

    default String memoryName(Expression node, Memory memory) {
        if (!memory.isDeclarable()) {
            throw backend().queries().error(node, ConversionErrors.LIST_ELEMENT_NOT_UNIQUE, memory.getName());
        }
        return memory.getName();
    }

    @Override
    default String visit(ExprEdge edge) {
        Signal signal = (Signal) resolve(edge, edge.getSignal());
        String inner = String.format("%s(%s)", edge.getKind().getFunction(), signal.getName());
        return viewOf(edge) instanceof BitType ? "to_std_logic(" + inner + ")" : inner;
    }

    @Override
    default String visit(ExprEnumItem item) {
        return item.getItem();
    }

    /*
     * Operators
     */

    @Override
    default String visit(ExprBinaryOp binaryOp) {
        VhdlType view = viewOf(binaryOp);
        VhdlType natural = inferredOf(binaryOp);
        Expression left = binaryOp.getLeft();
        Expression right = binaryOp.getRight();
        switch (binaryOp.getOperator()) {
            case ADD:
            case SUB:
            case MUL:
            case FLOORDIV:
            case MOD:
            case POW:
                if (view instanceof IntType || natural instanceof IntType) {
                    coerce(left, IntType.INSTANCE);
                    coerce(right, IntType.INSTANCE);
                    natural = IntType.INSTANCE;
                } else if (isWidening(natural, view)) {
                    widen(left, view);
                    widen(right, view);
                    natural = view;
                }
                String text = String.format("(%s %s %s)", evaluate(left), arithmeticOperator(binaryOp.getOperator()),
                        evaluate(right));
                if (natural.isVector() && changesWidth(binaryOp)) {
                    text = String.format("resize(%s, %d)", text, natural.getSize());
                }
                return adapt(text, natural, view);
            case LSHIFT:
            case RSHIFT:
                return adapt(shift(binaryOp.getOperator(), left, right), natural, view);
            default:
                return adapt(String.format("(%s %s %s)", evaluate(left), bitwiseOperator(binaryOp.getOperator()),
                        evaluate(right)), natural, view);
        }
    }

    default boolean isWidening(VhdlType natural, VhdlType view) {
        return natural.isVector() && natural.getClass() == view.getClass() && view.getSize() > natural.getSize();
    }

    /**
     * Computes a vector operand at the width of the result, so that no carry is lost.
     */
    default void widen(Expression operand, VhdlType type) {
        if (viewOf(operand).isVector()) {
            coerce(operand, type);
        }
    }

    /**
     * True when the vector operator gives a result narrower or wider than its widest operand: a
     * product has the width of both operands together, a quotient the width of its left operand and
     * a remainder the width of its right one.
     */
    default boolean changesWidth(ExprBinaryOp binaryOp) {
        switch (binaryOp.getOperator()) {
            case MUL:
                return true;
            case FLOORDIV:
            case MOD:
                VhdlType left = viewOf(binaryOp.getLeft());
                VhdlType right = viewOf(binaryOp.getRight());
                return left.isVector() && right.isVector() && left.getSize() != right.getSize();
            default:
                return false;
        }
    }

    default String shift(ExprBinaryOp.Operator operator, Expression left, Expression right) {
        String l = evaluate(left);
        String r = evaluate(right);
        if (viewOf(left).isVector()) {
            return String.format("%s(%s, %s)", operator == ExprBinaryOp.Operator.LSHIFT ? "shift_left" : "shift_right", l, r);
        }
        return String.format("(%s %s (2 ** %s))", l, operator == ExprBinaryOp.Operator.LSHIFT ? "*" : "/", r);
    }

    default String arithmeticOperator(ExprBinaryOp.Operator operator) {
        switch (operator) {
            case ADD:
                return "+";
            case SUB:
                return "-";
            case MUL:
                return "*";
            case FLOORDIV:
                return "/";
            case MOD:
                return "mod";
            case POW:
                return "**";
            default:
                throw new IllegalArgumentException(operator.name());
        }
    }

    default String bitwiseOperator(ExprBinaryOp.Operator operator) {
        switch (operator) {
            case BITAND:
                return "and";
            case BITOR:
                return "or";
            case BITXOR:
                return "xor";
            default:
                throw new IllegalArgumentException(operator.name());
        }
    }

    @Override
    default String visit(ExprBoolOp boolOp) {
        List<String> operands = new ArrayList<>();
        for (Expression operand : boolOp.getOperands()) {
            operands.add(evaluate(operand));
        }
        String separator = boolOp.getOperator() == ExprBoolOp.Operator.AND ? " and " : " or ";
        return booleanResult(String.join(separator, operands), boolOp);
    }

    @Override
    default String visit(ExprUnaryOp unaryOp) {
        Expression operand = unaryOp.getOperand();
        VhdlType view = viewOf(unaryOp);
        switch (unaryOp.getOperator()) {
            case NOT:
                return booleanResult("not " + evaluate(operand), unaryOp);
            case MINUS:
                if (view instanceof IntType) {
                    coerce(operand, IntType.INSTANCE);
                }
                return adapt("(-" + evaluate(operand) + ")", view instanceof IntType ? view : inferredOf(unaryOp), view);
            case PLUS:
                return adapt(evaluate(operand), viewOf(operand), view);
            default:
                return adapt("(not " + evaluate(operand) + ")", inferredOf(unaryOp), view);
        }
    }

    @Override
    default String visit(ExprComparison comparison) {
        boolean signed = backend().annotations().isSignedContext(comparison);
        String left = signed ? promoted(comparison.getLeft()) : evaluate(comparison.getLeft());
        String right = signed ? promoted(comparison.getRight()) : evaluate(comparison.getRight());
        return booleanResult(String.format("%s %s %s", left, comparisonOperator(comparison.getOperator()), right),
                comparison);
    }

    /**
     * Writes an operand of a signed comparison. An unsigned name is widened by one bit and reinterpreted.
     */
    default String promoted(Expression operand) {
        if (operand instanceof ExprVariable && !backend().annotations().isLoopVariable(process(), ((ExprVariable) operand).getName())) {
            DesignObject object = resolve(operand, ((ExprVariable) operand).getName());
            String name = null;
            int width = 0;
            if (object instanceof Signal && ((Signal) object).getKind() == ValueKind.UNSIGNED) {
                name = ((Signal) object).getName();
                width = ((Signal) object).getWidth();
            } else if (object instanceof Variable && ((Variable) object).getKind() == ValueKind.UNSIGNED) {
                name = ((Variable) object).getName();
                width = ((Variable) object).getWidth();
            }
            if (name != null) {
                return String.format("signed(resize(%s, %d))", name, width + 1);
            }
        }
        return evaluate(operand);
    }

    default String comparisonOperator(ExprComparison.Operator operator) {
        switch (operator) {
            case EQ:
                return "=";
            case NE:
                return "/=";
            case LT:
                return "<";
            case GT:
                return ">";
            case LE:
                return "<=";
            case GE:
                return ">=";
            default:
                throw new IllegalArgumentException(operator.name());
        }
    }

    /*
     * Indexing and slicing
     */

    @Override
    default String visit(ExprIndexer indexer) {
        Expression structure = indexer.getStructure();
        if (structure instanceof ExprVariable && !backend().annotations().isLoopVariable(process(), ((ExprVariable) structure).getName())) {
            DesignObject object = resolve(structure, ((ExprVariable) structure).getName());
            if (object instanceof Rom) {
                throw backend().queries().error(indexer, ConversionErrors.NOT_SUPPORTED,
                        "ROM " + ((ExprVariable) structure).getName() + " read outside of an assignment");
            }
        }
        String text = String.format("%s(%s)", evaluate(structure), evaluate(indexer.getIndex()));
        return adapt(text, inferredOf(indexer), viewOf(indexer));
    }

    @Override
    default String visit(ExprSlice slice) {
        VhdlType view = viewOf(slice);
        Optional<BigInteger> constant = backend().queries().constantValue(process(), slice);
        if (constant.isPresent()) {
            return typeseval().literal(constant.get(), view);
        }
        String structure = evaluate(slice.getStructure());
        if (!slice.getHigh().isPresent() && !slice.getLow().isPresent()) {
            return adapt(structure, inferredOf(slice), view);
        }
        int high = slice.getHigh().isPresent()
                ? backend().queries().constantInt(process(), slice.getHigh().get())
                : viewOf(slice.getStructure()).getSize();
        int low = slice.getLow().isPresent() ? backend().queries().constantInt(process(), slice.getLow().get()) : 0;
        return adapt(String.format("%s(%d downto %d)", structure, high - 1, low), inferredOf(slice), view);
    }

    /*
     * Calls
     */

    @Override
    default String visit(ExprApplication application) {
        DesignObject callee = process().getSymbols().get(application.getFunction());
        if (callee instanceof Process) {
            return adapt(call(application, (Process) callee), inferredOf(application), viewOf(application));
        }
        List<Expression> args = application.getArgs();
        VhdlType view = viewOf(application);
        switch (application.getFunction()) {
            case "bool":
                return booleanResult(truth(args.get(0)), application);
            case "len":
                return typeseval().literal(BigInteger.valueOf(backend().queries().constantInt(process(), application)), view);
            case "int":
                return evaluate(args.get(0));
            case "intbv": {
                Optional<BigInteger> value = backend().queries().constantValue(process(), application);
                if (value.isPresent()) {
                    return typeseval().literal(value.get(), view);
                }
                coerce(args.get(0), IntType.INSTANCE);
                return evaluate(args.get(0));
            }
            case "concat": {
                List<String> parts = new ArrayList<>();
                for (Expression arg : args) {
                    parts.add(evaluate(arg));
                }
                return adapt("(" + String.join(" & ", parts) + ")", inferredOf(application), view);
            }
            default:
                throw backend().queries().error(application, ConversionErrors.NOT_SUPPORTED,
                        "call of " + application.getFunction());
        }
    }

    /**
     * The truth value of an expression as a VHDL boolean, without the enclosing parentheses.
     */
    default String truth(Expression expression) {
        VhdlType type = viewOf(expression);
        String text = evaluate(expression);
        if (type instanceof BitType) {
            return text + " /= '0'";
        } else if (type instanceof BoolType) {
            return text;
        }
        return text + " /= 0";
    }

    /**
     * Writes a call of a function or procedure, declaring it first if needed.
     */
    default String call(ExprApplication application, Process callee) {
        backend().callables().declare(callee);
        if (application.getArgs().isEmpty()) {
            return callee.getName();
        }
        List<String> args = new ArrayList<>();
        for (int i = 0; i < application.getArgs().size(); i++) {
            Expression arg = application.getArgs().get(i);
            String parameter = callee.getParameters().get(i);
            if (callee.getOutputs().contains(parameter)) {
                args.add(evaluate(arg));
            } else {
                args.add(convert(arg, TypeAlgebra.of(callee.getVariables().get(parameter))));
            }
        }
        return String.format("%s(%s)", callee.getName(), String.join(", ", args));
    }
}
