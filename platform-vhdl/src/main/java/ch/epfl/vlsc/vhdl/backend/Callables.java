package ch.epfl.vlsc.vhdl.backend;

import ch.epfl.vlsc.vhdl.ir.design.Process;
import ch.epfl.vlsc.vhdl.ir.design.ProcessKind;
import ch.epfl.vlsc.vhdl.ir.design.Variable;
import ch.epfl.vlsc.vhdl.ir.stmt.IfBranch;
import ch.epfl.vlsc.vhdl.ir.stmt.Statement;
import ch.epfl.vlsc.vhdl.ir.stmt.StmtAssignment;
import ch.epfl.vlsc.vhdl.ir.stmt.StmtAugmentedAssignment;
import ch.epfl.vlsc.vhdl.ir.stmt.StmtFor;
import ch.epfl.vlsc.vhdl.ir.stmt.StmtIf;
import ch.epfl.vlsc.vhdl.ir.stmt.StmtWhile;
import ch.epfl.vlsc.vhdl.ir.stmt.lvalue.LValue;
import ch.epfl.vlsc.vhdl.platformutils.Emitter;
import ch.epfl.vlsc.vhdl.reporting.ConversionErrors;
import ch.epfl.vlsc.vhdl.type.TypeAlgebra;
import org.apache.logging.log4j.LogManager;

import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Functions and procedures called from the processes. Each one is written once per conversion,
 * into its own buffer, and declared in the architecture before its callers.
 */
public interface Callables {
    VhdlBackend backend();

    default Emitter emitter() {
        return backend().emitter();
    }

    default void declare(Process callable) {
        if (!callable.getKind().isCallable()) {
            throw ConversionErrors.NOT_SUPPORTED.exception("call of the process " + callable.getName(), callable.getPosition());
        }
        if (!backend().context().declareCallable(callable)) {
            return;
        }
        LogManager.getLogger(Callables.class).debug("Writing {}", callable);
        Emitter buffer = backend().newEmitter();
        buffer.openBuffer();
        backend().pushEmitter(buffer);
        backend().enter(callable);
        try {
            if (callable.getKind() == ProcessKind.FUNCTION) {
                function(callable);
            } else {
                procedure(callable);
            }
        } finally {
            backend().leave();
            backend().popEmitter();
        }
        backend().callableTexts().add(buffer.closeBuffer());
    }

    default void function(Process function) {
        Variable result = function.getReturnValue().orElseThrow(() ->
                ConversionErrors.STRUCTURE.exception("function " + function.getName() + " has no return type",
                        function.getPosition()));
        String returnType = backend().typeseval().unconstrained(TypeAlgebra.of(result));
        if (function.getParameters().isEmpty()) {
            emitter().emit("function %s return %s is", function.getName(), returnType);
        } else {
            emitter().emit("function %s(", function.getName());
            parameters(function, null);
            emitter().emit(") return %s is", returnType);
        }
        body(function);
        emitter().emit("end function %s;", function.getName());
        emitter().emitNewLine();
    }

    default void procedure(Process procedure) {
        if (procedure.getParameters().isEmpty()) {
            emitter().emit("procedure %s is", procedure.getName());
        } else {
            Set<String> signals = new HashSet<>();
            signalTargets(procedure.getBody(), signals);
            emitter().emit("procedure %s(", procedure.getName());
            parameters(procedure, signals);
            emitter().emit(") is");
        }
        body(procedure);
        emitter().emit("end procedure %s;", procedure.getName());
        emitter().emitNewLine();
    }

    /**
     * Writes the parameter list. Function parameters are all inputs; procedure parameters take their
     * mode from what the body reads and writes.
     */
    default void parameters(Process callable, Set<String> signals) {
        List<String> parameters = callable.getParameters();
        emitter().increaseIndentation();
        for (int i = 0; i < parameters.size(); i++) {
            String name = parameters.get(i);
            String type = backend().typeseval().unconstrained(TypeAlgebra.of(callable.getVariables().get(name)));
            String separator = i == parameters.size() - 1 ? "" : ";";
            if (signals == null) {
                emitter().emit("%s: in %s%s", name, type, separator);
            } else {
                emitter().emit("%s%s: %s %s%s", signals.contains(name) ? "signal " : "", name, mode(callable, name),
                        type, separator);
            }
        }
        emitter().decreaseIndentation();
    }

    default String mode(Process procedure, String parameter) {
        boolean in = procedure.getInputs().contains(parameter);
        boolean out = procedure.getOutputs().contains(parameter);
        if (in && out) {
            return "inout";
        }
        return out ? "out" : "in";
    }

    default void body(Process callable) {
        emitter().increaseIndentation();
        backend().declarations().variables(callable);
        emitter().decreaseIndentation();
        emitter().emit("begin");
        emitter().increaseIndentation();
        backend().statements().execute(callable.getBody());
        emitter().decreaseIndentation();
    }

    /**
     * Collects the names assigned through <code>.next</code>.
     */
    default void signalTargets(List<Statement> statements, Set<String> names) {
        for (Statement statement : statements) {
            LValue target = null;
            if (statement instanceof StmtAssignment) {
                target = ((StmtAssignment) statement).getTarget();
            } else if (statement instanceof StmtAugmentedAssignment) {
                target = ((StmtAugmentedAssignment) statement).getTarget();
            } else if (statement instanceof StmtIf) {
                for (IfBranch branch : ((StmtIf) statement).getBranches()) {
                    signalTargets(branch.getBody(), names);
                }
                ((StmtIf) statement).getElseBranch().ifPresent(body -> signalTargets(body, names));
            } else if (statement instanceof StmtFor) {
                signalTargets(((StmtFor) statement).getBody(), names);
            } else if (statement instanceof StmtWhile) {
                signalTargets(((StmtWhile) statement).getBody(), names);
            }
            if (target != null && target.isSignal()) {
                names.add(target.getRootName());
            }
        }
    }
}
