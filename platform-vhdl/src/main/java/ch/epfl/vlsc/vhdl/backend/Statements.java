package ch.epfl.vlsc.vhdl.backend;

import ch.epfl.vlsc.vhdl.ir.design.DelaySensitivity;
import ch.epfl.vlsc.vhdl.ir.design.DesignObject;
import ch.epfl.vlsc.vhdl.ir.design.EdgeSensitivity;
import ch.epfl.vlsc.vhdl.ir.design.Process;
import ch.epfl.vlsc.vhdl.ir.design.ProcessKind;
import ch.epfl.vlsc.vhdl.ir.design.Rom;
import ch.epfl.vlsc.vhdl.ir.design.Sensitivity;
import ch.epfl.vlsc.vhdl.ir.design.SignalSensitivity;
import ch.epfl.vlsc.vhdl.ir.expr.ExprBinaryOp;
import ch.epfl.vlsc.vhdl.ir.expr.ExprIndexer;
import ch.epfl.vlsc.vhdl.ir.expr.ExprLiteral;
import ch.epfl.vlsc.vhdl.ir.expr.ExprVariable;
import ch.epfl.vlsc.vhdl.ir.expr.Expression;
import ch.epfl.vlsc.vhdl.ir.stmt.IfBranch;
import ch.epfl.vlsc.vhdl.ir.stmt.Statement;
import ch.epfl.vlsc.vhdl.ir.stmt.StmtAssert;
import ch.epfl.vlsc.vhdl.ir.stmt.StmtAssignment;
import ch.epfl.vlsc.vhdl.ir.stmt.StmtAugmentedAssignment;
import ch.epfl.vlsc.vhdl.ir.stmt.StmtBreak;
import ch.epfl.vlsc.vhdl.ir.stmt.StmtCall;
import ch.epfl.vlsc.vhdl.ir.stmt.StmtContinue;
import ch.epfl.vlsc.vhdl.ir.stmt.StmtFor;
import ch.epfl.vlsc.vhdl.ir.stmt.StmtIf;
import ch.epfl.vlsc.vhdl.ir.stmt.StmtPass;
import ch.epfl.vlsc.vhdl.ir.stmt.StmtPrint;
import ch.epfl.vlsc.vhdl.ir.stmt.StmtReturn;
import ch.epfl.vlsc.vhdl.ir.stmt.StmtStopSimulation;
import ch.epfl.vlsc.vhdl.ir.stmt.StmtWait;
import ch.epfl.vlsc.vhdl.ir.stmt.StmtWhile;
import ch.epfl.vlsc.vhdl.platformutils.Emitter;
import ch.epfl.vlsc.vhdl.reporting.ConversionErrors;
import ch.epfl.vlsc.vhdl.settings.VhdlSettings;
import ch.epfl.vlsc.vhdl.type.BitType;
import ch.epfl.vlsc.vhdl.type.BoolType;
import ch.epfl.vlsc.vhdl.type.EnumeratedType;
import ch.epfl.vlsc.vhdl.type.IntType;
import ch.epfl.vlsc.vhdl.type.SignedType;
import ch.epfl.vlsc.vhdl.type.TypeAlgebra;
import ch.epfl.vlsc.vhdl.type.VhdlType;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

public interface Statements extends Statement.Visitor {
    VhdlBackend backend();

    default Emitter emitter() {
        return backend().emitter();
    }

    default ExpressionEvaluator expressioneval() {
        return backend().expressioneval();
    }

    default LValues lvalues() {
        return backend().lvalues();
    }

    default void execute(Statement statement) {
        statement.accept(this);
    }

    default void execute(List<Statement> statements) {
        statements.forEach(this::execute);
    }

    default String assignmentOperator(StmtAssignment assignment) {
        return assignment.getTarget().isSignal() ? "<=" : ":=";
    }

    /*
     * Assignments
     */

    @Override
    default void visit(StmtAssignment assignment) {
        Optional<Rom> rom = romRead(assignment.getValue());
        if (rom.isPresent()) {
            backend().casestatements().romLookup(assignment, rom.get(), ((ExprIndexer) assignment.getValue()).getIndex());
            return;
        }
        VhdlType type = backend().annotations().typeOf(assignment.getTarget());
        String target = lvalues().lvalue(assignment.getTarget());
        String value = expressioneval().convert(assignment.getValue(), type);
        emitter().emit("%s %s %s;", target, assignmentOperator(assignment), value);
    }

    /**
     * The ROM read by an assignment of the form <code>x = rom[i]</code>.
     */
    default Optional<Rom> romRead(Expression value) {
        if (!(value instanceof ExprIndexer)) {
            return Optional.empty();
        }
        Expression structure = ((ExprIndexer) value).getStructure();
        if (!(structure instanceof ExprVariable)) {
            return Optional.empty();
        }
        String name = ((ExprVariable) structure).getName();
        if (backend().annotations().isLoopVariable(backend().process(), name)) {
            return Optional.empty();
        }
        Optional<DesignObject> object = backend().queries().lookup(backend().process(), name);
        return object.filter(o -> o instanceof Rom).map(o -> (Rom) o);
    }

    @Override
    default void visit(StmtAugmentedAssignment assignment) {
        ExprBinaryOp.Operator operator = assignment.getOperator().getBinary().orElseThrow(() ->
                backend().queries().error(assignment, ConversionErrors.NOT_SUPPORTED,
                        "augmented assignment operator " + assignment.getOperator().name().toLowerCase()));
        VhdlType type = backend().annotations().typeOf(assignment.getTarget());
        String target = lvalues().lvalue(assignment.getTarget());
        Expression value = assignment.getValue();
        String result;
        if (operator.isShift()) {
            String amount = expressioneval().evaluate(value);
            if (type.isVector()) {
                result = String.format("%s(%s, %s)", operator == ExprBinaryOp.Operator.LSHIFT ? "shift_left" : "shift_right",
                        target, amount);
            } else {
                result = String.format("(%s %s (2 ** %s))", target, operator == ExprBinaryOp.Operator.LSHIFT ? "*" : "/", amount);
            }
        } else if (operator.isBitwise()) {
            if (type instanceof IntType) {
                throw backend().queries().error(assignment, ConversionErrors.NOT_SUPPORTED,
                        "bitwise augmented assignment to the integer " + target);
            }
            result = String.format("(%s %s %s)", target, expressioneval().bitwiseOperator(operator),
                    expressioneval().convert(value, type));
        } else {
            result = augmentedArithmetic(assignment, operator, target, type);
        }
        emitter().emit("%s %s %s;", target, assignment.getTarget().isSignal() ? "<=" : ":=", result);
    }

    default String augmentedArithmetic(StmtAugmentedAssignment assignment, ExprBinaryOp.Operator operator,
                                       String target, VhdlType type) {
        Expression value = assignment.getValue();
        String symbol = expressioneval().arithmeticOperator(operator);
        if (type instanceof IntType) {
            expressioneval().coerce(value, IntType.INSTANCE);
            return String.format("(%s %s %s)", target, symbol, expressioneval().evaluate(value));
        }
        if (!type.isVector()) {
            throw backend().queries().error(assignment, ConversionErrors.NOT_SUPPORTED,
                    "arithmetic augmented assignment to " + target);
        }
        String function = type instanceof SignedType ? "to_signed" : "to_unsigned";
        if (operator == ExprBinaryOp.Operator.POW) {
            expressioneval().coerce(value, IntType.INSTANCE);
            return String.format("%s(to_integer(%s) ** %s, %d)", function, target, expressioneval().evaluate(value),
                    type.getSize());
        }
        VhdlType valueType = expressioneval().viewOf(value);
        if (!valueType.isVector()) {
            expressioneval().coerce(value, IntType.INSTANCE);
        }
        String text = String.format("(%s %s %s)", target, symbol, expressioneval().evaluate(value));
        if (operator == ExprBinaryOp.Operator.MUL || valueType.isVector() && valueType.getSize() != type.getSize()) {
            return String.format("resize(%s, %d)", text, type.getSize());
        }
        return text;
    }

    /*
     * Control flow
     */

    @Override
    default void visit(StmtIf stmt) {
        if (backend().configuration().get(VhdlSettings.ifToCase)
                && !backend().edgeRewrites().containsKey(stmt)
                && backend().casestatements().asCase(stmt)) {
            return;
        }
        boolean first = true;
        for (IfBranch branch : stmt.getBranches()) {
            emitter().emit("%s %s then", first ? "if" : "elsif", expressioneval().evaluate(branch.getCondition()));
            emitter().increaseIndentation();
            execute(branch.getBody());
            emitter().decreaseIndentation();
            first = false;
        }
        if (stmt.getElseBranch().isPresent()) {
            List<EdgeSensitivity> edges = backend().edgeRewrites().get(stmt);
            if (edges != null) {
                List<String> tests = new ArrayList<>();
                for (EdgeSensitivity edge : edges) {
                    tests.add(String.format("%s(%s)", edge.getEdge().getFunction(), edge.getSignal().getName()));
                }
                emitter().emit("elsif %s then", String.join(" or ", tests));
            } else {
                emitter().emit("else");
            }
            emitter().increaseIndentation();
            execute(stmt.getElseBranch().get());
            emitter().decreaseIndentation();
        }
        emitter().emit("end if;");
    }

    @Override
    default void visit(StmtFor stmt) {
        Process process = backend().process();
        int start = stmt.getStart().isPresent() ? backend().queries().constantInt(process, stmt.getStart().get()) : 0;
        int stop = stmt.getStop().isPresent() ? backend().queries().constantInt(process, stmt.getStop().get()) : 0;
        if (stmt.getDirection() == StmtFor.Direction.ASCENDING) {
            emitter().emit("for %s in %d to %d loop", stmt.getVariable(), start, stop - 1);
        } else {
            emitter().emit("for %s in %d downto %d loop", stmt.getVariable(), start - 1, stop);
        }
        emitter().increaseIndentation();
        execute(stmt.getBody());
        emitter().decreaseIndentation();
        emitter().emit("end loop;");
    }

    @Override
    default void visit(StmtWhile stmt) {
        emitter().emit("while %s loop", expressioneval().evaluate(stmt.getCondition()));
        emitter().increaseIndentation();
        execute(stmt.getBody());
        emitter().decreaseIndentation();
        emitter().emit("end loop;");
    }

    @Override
    default void visit(StmtBreak stmt) {
        emitter().emit("exit;");
    }

    @Override
    default void visit(StmtContinue stmt) {
        emitter().emit("next;");
    }

    @Override
    default void visit(StmtPass stmt) {
        emitter().emit("null;");
    }

    @Override
    default void visit(StmtReturn stmt) {
        Process process = backend().process();
        if (stmt.getValue().isPresent() && process.getKind() == ProcessKind.FUNCTION) {
            VhdlType type = TypeAlgebra.of(process.getReturnValue().get());
            emitter().emit("return %s;", expressioneval().convert(stmt.getValue().get(), type));
        } else {
            emitter().emit("return;");
        }
    }

    @Override
    default void visit(StmtCall call) {
        DesignObject callee = backend().process().getSymbols().get(call.getCall().getFunction());
        if (!(callee instanceof Process)) {
            throw backend().queries().error(call, ConversionErrors.NOT_SUPPORTED, "call of " + call.getCall().getFunction());
        }
        emitter().emit("%s;", expressioneval().call(call.getCall(), (Process) callee));
    }

    /*
     * Simulation
     */

    @Override
    default void visit(StmtPrint print) {
        boolean first = true;
        for (Expression item : print.getItems()) {
            if (!first) {
                emitter().emit("write(L, string'(\" \"));");
            }
            emitter().emit("write(L, %s);", printed(item));
            first = false;
        }
        emitter().emit("writeline(output, L);");
    }

    default String printed(Expression item) {
        if (item instanceof ExprLiteral && ((ExprLiteral) item).getKind() == ExprLiteral.Kind.STRING) {
            return String.format("string'(%s)", expressioneval().evaluate(item));
        }
        VhdlType type = expressioneval().viewOf(item);
        String text = expressioneval().evaluate(item);
        if (type instanceof BitType) {
            return "to_bit(" + text + ")";
        } else if (type.isVector()) {
            return "to_integer(" + text + ")";
        } else if (type instanceof BoolType) {
            return "boolean'image(" + text + ")";
        } else if (type instanceof EnumeratedType) {
            return ((EnumeratedType) type).getType().getTypeName() + "'image(" + text + ")";
        }
        return text;
    }

    @Override
    default void visit(StmtStopSimulation stmt) {
        emitter().emit("assert False report \"End of Simulation\" severity Failure;");
    }

    @Override
    default void visit(StmtAssert stmt) {
        String condition = expressioneval().evaluate(stmt.getCondition());
        if (stmt.getMessage().isPresent()) {
            emitter().emit("assert %s report \"%s\" severity error;", condition,
                    stmt.getMessage().get().replace("\"", "\"\""));
        } else {
            emitter().emit("assert %s severity error;", condition);
        }
    }

    @Override
    default void visit(StmtWait stmt) {
        emitter().emit("%s;", waitClause(stmt.getWaits()));
    }

    /**
     * A wait statement, without the semicolon, suspending on a list of entries of one kind.
     */
    default String waitClause(List<Sensitivity> waits) {
        Sensitivity.Kind kind = waits.get(0).getKind();
        List<String> parts = new ArrayList<>();
        for (Sensitivity wait : waits) {
            if (wait.getKind() != kind) {
                throw ConversionErrors.SENSITIVITY_KIND.exception("in " + backend().process());
            }
            switch (kind) {
                case DELAY:
                    parts.add(Long.toString(((DelaySensitivity) wait).getNanoseconds()));
                    break;
                case EDGE:
                    EdgeSensitivity edge = (EdgeSensitivity) wait;
                    parts.add(String.format("%s(%s)", edge.getEdge().getFunction(), edge.getSignal().getName()));
                    break;
                default:
                    parts.add(((SignalSensitivity) wait).getSignal().getName());
                    break;
            }
        }
        switch (kind) {
            case DELAY:
                if (parts.size() != 1) {
                    throw ConversionErrors.SENSITIVITY_KIND.exception("several delays in " + backend().process());
                }
                return String.format("wait for %s ns", parts.get(0));
            case EDGE:
                return "wait until " + String.join(" or ", parts);
            default:
                return "wait on " + String.join(", ", parts);
        }
    }
}
