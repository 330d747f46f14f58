package ch.epfl.vlsc.vhdl.attribute;

import ch.epfl.vlsc.vhdl.ir.design.Constant;
import ch.epfl.vlsc.vhdl.ir.design.DesignObject;
import ch.epfl.vlsc.vhdl.ir.design.EdgeSensitivity;
import ch.epfl.vlsc.vhdl.ir.design.Memory;
import ch.epfl.vlsc.vhdl.ir.design.Process;
import ch.epfl.vlsc.vhdl.ir.design.Rom;
import ch.epfl.vlsc.vhdl.ir.design.Sensitivity;
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
import ch.epfl.vlsc.vhdl.platformutils.utils.MathUtils;
import ch.epfl.vlsc.vhdl.reporting.ConversionErrors;
import com.google.common.collect.ImmutableList;

import java.math.BigInteger;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Answers tree queries from the symbol tables of the processes.
 */
public class DesignQueries implements TreeQueries {

    @Override
    public Optional<DesignObject> lookup(Process process, String name) {
        Variable variable = process.getVariables().get(name);
        if (variable != null) {
            return Optional.of(variable);
        }
        return Optional.ofNullable(process.getSymbols().get(name));
    }

    @Override
    public Optional<BigInteger> constantValue(Process process, Expression expression) {
        return expression.accept(new ConstantFolder(process));
    }

    @Override
    public Optional<EdgeSensitivity> edgeOf(Process process, Expression test, List<Sensitivity> sensitivity) {
        if (test instanceof ExprEdge) {
            ExprEdge edge = (ExprEdge) test;
            Optional<DesignObject> signal = lookup(process, edge.getSignal());
            return edges(sensitivity).stream()
                    .filter(e -> signal.isPresent() && e.getSignal() == signal.get() && e.getEdge() == edge.getKind())
                    .findFirst();
        }
        Set<String> names = test.accept(new ReferencedNames());
        for (EdgeSensitivity edge : edges(sensitivity)) {
            for (String name : names) {
                Optional<DesignObject> object = lookup(process, name);
                if (object.isPresent() && object.get() == edge.getSignal()) {
                    return Optional.of(edge);
                }
            }
        }
        return Optional.empty();
    }

    private static List<EdgeSensitivity> edges(List<Sensitivity> sensitivity) {
        ImmutableList.Builder<EdgeSensitivity> edges = ImmutableList.builder();
        for (Sensitivity entry : sensitivity) {
            if (entry instanceof EdgeSensitivity) {
                edges.add((EdgeSensitivity) entry);
            }
        }
        return edges.build();
    }

    /**
     * Python semantics: the quotient is rounded towards negative infinity.
     */
    static BigInteger floorDiv(BigInteger a, BigInteger b) {
        BigInteger[] qr = a.divideAndRemainder(b);
        if (qr[1].signum() != 0 && qr[1].signum() != b.signum()) {
            return qr[0].subtract(BigInteger.ONE);
        }
        return qr[0];
    }

    static BigInteger floorMod(BigInteger a, BigInteger b) {
        return a.subtract(b.multiply(floorDiv(a, b)));
    }

    private class ConstantFolder implements Expression.Visitor<Optional<BigInteger>> {
        private final Process process;

        ConstantFolder(Process process) {
            this.process = process;
        }

        @Override
        public Optional<BigInteger> visit(ExprLiteral literal) {
            if (literal.getKind() == ExprLiteral.Kind.STRING) {
                return Optional.empty();
            }
            return Optional.of(literal.getValue());
        }

        @Override
        public Optional<BigInteger> visit(ExprVariable variable) {
            return lookup(process, variable.getName())
                    .filter(o -> o instanceof Constant)
                    .map(o -> ((Constant) o).getValue());
        }

        @Override
        public Optional<BigInteger> visit(ExprEdge edge) {
            return Optional.empty();
        }

        @Override
        public Optional<BigInteger> visit(ExprEnumItem item) {
            return Optional.empty();
        }

        @Override
        public Optional<BigInteger> visit(ExprBinaryOp binaryOp) {
            Optional<BigInteger> left = binaryOp.getLeft().accept(this);
            Optional<BigInteger> right = binaryOp.getRight().accept(this);
            if (!left.isPresent() || !right.isPresent()) {
                return Optional.empty();
            }
            BigInteger l = left.get();
            BigInteger r = right.get();
            switch (binaryOp.getOperator()) {
                case ADD:
                    return Optional.of(l.add(r));
                case SUB:
                    return Optional.of(l.subtract(r));
                case MUL:
                    return Optional.of(l.multiply(r));
                case FLOORDIV:
                    return r.signum() == 0 ? Optional.empty() : Optional.of(floorDiv(l, r));
                case MOD:
                    return r.signum() == 0 ? Optional.empty() : Optional.of(floorMod(l, r));
                case POW:
                    return r.signum() < 0 ? Optional.empty() : Optional.of(l.pow(checkedInt(binaryOp.getRight(), r)));
                case LSHIFT:
                    return Optional.of(l.shiftLeft(shiftAmount(binaryOp, r)));
                case RSHIFT:
                    return Optional.of(l.shiftRight(shiftAmount(binaryOp, r)));
                case BITAND:
                    return Optional.of(l.and(r));
                case BITOR:
                    return Optional.of(l.or(r));
                case BITXOR:
                    return Optional.of(l.xor(r));
                default:
                    return Optional.empty();
            }
        }

        @Override
        public Optional<BigInteger> visit(ExprBoolOp boolOp) {
            return Optional.empty();
        }

        @Override
        public Optional<BigInteger> visit(ExprUnaryOp unaryOp) {
            Optional<BigInteger> operand = unaryOp.getOperand().accept(this);
            switch (unaryOp.getOperator()) {
                case PLUS:
                    return operand;
                case MINUS:
                    return operand.map(BigInteger::negate);
                case INVERT:
                    return operand.map(BigInteger::not);
                default:
                    return Optional.empty();
            }
        }

        @Override
        public Optional<BigInteger> visit(ExprComparison comparison) {
            return Optional.empty();
        }

        @Override
        public Optional<BigInteger> visit(ExprIndexer indexer) {
            if (!(indexer.getStructure() instanceof ExprVariable)) {
                return Optional.empty();
            }
            Optional<DesignObject> rom = lookup(process, ((ExprVariable) indexer.getStructure()).getName())
                    .filter(o -> o instanceof Rom);
            Optional<BigInteger> index = indexer.getIndex().accept(this);
            if (!rom.isPresent() || !index.isPresent()) {
                return Optional.empty();
            }
            List<BigInteger> table = ((Rom) rom.get()).getTable();
            BigInteger i = index.get();
            if (i.signum() < 0 || i.compareTo(BigInteger.valueOf(table.size())) >= 0) {
                return Optional.empty();
            }
            return Optional.of(table.get(i.intValue()));
        }

        @Override
        public Optional<BigInteger> visit(ExprSlice slice) {
            Optional<BigInteger> value = slice.getStructure().accept(this);
            Optional<BigInteger> high = slice.getHigh().flatMap(h -> h.accept(this));
            Optional<BigInteger> low = slice.getLow().isPresent()
                    ? slice.getLow().get().accept(this) : Optional.of(BigInteger.ZERO);
            if (!value.isPresent() || !high.isPresent() || !low.isPresent()) {
                return Optional.empty();
            }
            int h = checkedInt(slice.getHigh().get(), high.get());
            int l = slice.getLow().isPresent() ? checkedInt(slice.getLow().get(), low.get()) : 0;
            return Optional.of(MathUtils.slice(value.get(), h, l));
        }

        private int shiftAmount(ExprBinaryOp binaryOp, BigInteger amount) {
            if (amount.signum() < 0) {
                throw error(binaryOp.getRight(), ConversionErrors.NOT_SUPPORTED, "negative shift count " + amount);
            }
            return checkedInt(binaryOp.getRight(), amount);
        }

        @Override
        public Optional<BigInteger> visit(ExprApplication application) {
            if (process.getSymbols().get(application.getFunction()) instanceof Process
                    || application.getArgs().isEmpty()) {
                return Optional.empty();
            }
            Expression arg = application.getArgs().get(0);
            switch (application.getFunction()) {
                case "len":
                    return length(arg);
                case "int":
                case "intbv":
                    return arg.accept(this);
                default:
                    return Optional.empty();
            }
        }

        private Optional<BigInteger> length(Expression arg) {
            if (!(arg instanceof ExprVariable)) {
                return Optional.empty();
            }
            Optional<DesignObject> object = lookup(process, ((ExprVariable) arg).getName());
            if (!object.isPresent()) {
                return Optional.empty();
            }
            DesignObject o = object.get();
            if (o instanceof Signal && ((Signal) o).getKind() != ValueKind.ENUM) {
                return Optional.of(BigInteger.valueOf(((Signal) o).getWidth()));
            } else if (o instanceof Variable && ((Variable) o).getWidth() > 0) {
                return Optional.of(BigInteger.valueOf(((Variable) o).getWidth()));
            } else if (o instanceof Memory) {
                return Optional.of(BigInteger.valueOf(((Memory) o).getDepth()));
            } else if (o instanceof Rom) {
                return Optional.of(BigInteger.valueOf(((Rom) o).getTable().size()));
            }
            return Optional.empty();
        }
    }
}
