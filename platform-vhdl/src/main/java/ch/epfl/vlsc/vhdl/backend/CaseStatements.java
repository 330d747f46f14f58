package ch.epfl.vlsc.vhdl.backend;

import ch.epfl.vlsc.vhdl.ir.design.DesignObject;
import ch.epfl.vlsc.vhdl.ir.design.EnumItem;
import ch.epfl.vlsc.vhdl.ir.design.EnumType;
import ch.epfl.vlsc.vhdl.ir.design.Rom;
import ch.epfl.vlsc.vhdl.ir.expr.ExprComparison;
import ch.epfl.vlsc.vhdl.ir.expr.ExprEnumItem;
import ch.epfl.vlsc.vhdl.ir.expr.ExprVariable;
import ch.epfl.vlsc.vhdl.ir.expr.Expression;
import ch.epfl.vlsc.vhdl.ir.stmt.IfBranch;
import ch.epfl.vlsc.vhdl.ir.stmt.StmtAssignment;
import ch.epfl.vlsc.vhdl.ir.stmt.StmtIf;
import ch.epfl.vlsc.vhdl.platformutils.Emitter;
import ch.epfl.vlsc.vhdl.platformutils.utils.MathUtils;
import ch.epfl.vlsc.vhdl.settings.VhdlSettings;
import ch.epfl.vlsc.vhdl.type.BitType;
import ch.epfl.vlsc.vhdl.type.EnumeratedType;
import ch.epfl.vlsc.vhdl.type.IntType;
import ch.epfl.vlsc.vhdl.type.SignedType;
import ch.epfl.vlsc.vhdl.type.VhdlType;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Case statements written in place of an if chain on one variable, and for reads of a ROM.
 */
public interface CaseStatements {
    VhdlBackend backend();

    default Emitter emitter() {
        return backend().emitter();
    }

    default ExpressionEvaluator expressioneval() {
        return backend().expressioneval();
    }

    /*
     * ROM reads
     */

    /**
     * Writes <code>target = rom[index]</code> as a case over the index with one branch per table entry.
     */
    default void romLookup(StmtAssignment assignment, Rom rom, Expression index) {
        VhdlType type = backend().annotations().typeOf(assignment.getTarget());
        String target = backend().lvalues().lvalue(assignment.getTarget());
        String operator = backend().statements().assignmentOperator(assignment);
        boolean lastIsDefault = backend().configuration().get(VhdlSettings.romDefaultLastEntry);
        List<BigInteger> table = rom.getTable();

        expressioneval().coerce(index, IntType.INSTANCE);
        emitter().emit("case %s is", expressioneval().evaluate(index));
        emitter().increaseIndentation();
        for (int i = 0; i < table.size(); i++) {
            String value = backend().typeseval().literal(table.get(i), type);
            if (lastIsDefault && i == table.size() - 1) {
                emitter().emit("when others => %s %s %s;", target, operator, value);
            } else {
                emitter().emit("when %d => %s %s %s;", i, target, operator, value);
            }
        }
        if (!lastIsDefault) {
            emitter().emit("when others => null;");
        }
        emitter().decreaseIndentation();
        emitter().emit("end case;");
    }

    /*
     * If chains
     */

    /**
     * Writes the if statement as a case statement when every branch compares the same variable for
     * equality against a distinct constant. A single test is kept as an if unless it selects an
     * enumeration item.
     *
     * @return false when nothing was written because the chain has another shape
     */
    default boolean asCase(StmtIf stmt) {
        Optional<String> subject = Optional.empty();
        Expression subjectExpression = null;
        List<String> choices = new ArrayList<>();
        Set<String> distinct = new LinkedHashSet<>();
        for (IfBranch branch : stmt.getBranches()) {
            if (!(branch.getCondition() instanceof ExprComparison)) {
                return false;
            }
            ExprComparison comparison = (ExprComparison) branch.getCondition();
            if (comparison.getOperator() != ExprComparison.Operator.EQ || !(comparison.getLeft() instanceof ExprVariable)) {
                return false;
            }
            String name = ((ExprVariable) comparison.getLeft()).getName();
            if (backend().annotations().isLoopVariable(backend().process(), name)
                    || subject.isPresent() && !subject.get().equals(name)) {
                return false;
            }
            if (!subject.isPresent()) {
                subject = Optional.of(name);
                subjectExpression = comparison.getLeft();
            }
            Optional<String> choice = choice(comparison.getRight(), expressioneval().viewOf(comparison.getLeft()));
            if (!choice.isPresent() || !distinct.add(choice.get())) {
                return false;
            }
            choices.add(choice.get());
        }
        if (choices.size() < 2 && !(expressioneval().viewOf(subjectExpression) instanceof EnumeratedType)) {
            return false;
        }

        emitter().emit("case %s is", expressioneval().evaluate(subjectExpression));
        emitter().increaseIndentation();
        for (int i = 0; i < choices.size(); i++) {
            emitter().emit("when %s =>", choices.get(i));
            emitter().increaseIndentation();
            backend().statements().execute(stmt.getBranches().get(i).getBody());
            emitter().decreaseIndentation();
        }
        if (stmt.getElseBranch().isPresent()) {
            emitter().emit("when others =>");
            emitter().increaseIndentation();
            backend().statements().execute(stmt.getElseBranch().get());
            emitter().decreaseIndentation();
        } else if (!isComplete(expressioneval().viewOf(subjectExpression), choices.size())) {
            emitter().emit("when others =>");
            emitter().increaseIndentation();
            emitter().emit("null;");
            emitter().decreaseIndentation();
        }
        emitter().decreaseIndentation();
        emitter().emit("end case;");
        return true;
    }

    /**
     * The choice matching a compared value, empty when the value is not a constant of the subject type.
     */
    default Optional<String> choice(Expression value, VhdlType type) {
        Optional<EnumItem> item = enumItem(value);
        if (type instanceof EnumeratedType) {
            return item.filter(i -> i.getType() == ((EnumeratedType) type).getType()).map(EnumItem::getName);
        }
        if (item.isPresent()) {
            return Optional.empty();
        }
        Optional<BigInteger> constant = backend().queries().constantValue(backend().process(), value);
        if (!constant.isPresent()) {
            return Optional.empty();
        }
        BigInteger v = constant.get();
        if (type.isVector()) {
            BigInteger inRange = type instanceof SignedType
                    ? MathUtils.wrapSigned(v, type.getSize())
                    : MathUtils.wrap(v, type.getSize());
            if (!inRange.equals(v)) {
                return Optional.empty();
            }
        } else if (type instanceof BitType && v.signum() != 0 && !v.equals(BigInteger.ONE)) {
            return Optional.empty();
        } else if (!(type instanceof BitType) && !(type instanceof IntType)) {
            return Optional.empty();
        }
        return Optional.of(backend().typeseval().literal(v, type));
    }

    default Optional<EnumItem> enumItem(Expression value) {
        if (value instanceof ExprEnumItem) {
            ExprEnumItem selected = (ExprEnumItem) value;
            DesignObject type = backend().process().getSymbols().get(selected.getType());
            if (type instanceof EnumType) {
                return ((EnumType) type).getItem(selected.getItem());
            }
        } else if (value instanceof ExprVariable) {
            Optional<DesignObject> object = backend().queries().lookup(backend().process(), ((ExprVariable) value).getName());
            if (object.isPresent() && object.get() instanceof EnumItem) {
                return Optional.of((EnumItem) object.get());
            }
        }
        return Optional.empty();
    }

    /**
     * True when the choices cover every value of the type. Only an enumeration can be covered: bits
     * and vectors also have the metalogical values of std_logic.
     */
    default boolean isComplete(VhdlType type, int choices) {
        return type instanceof EnumeratedType && choices == ((EnumeratedType) type).getType().getItems().size();
    }
}
