package ch.epfl.vlsc.vhdl.backend;

import ch.epfl.vlsc.vhdl.ir.design.DelaySensitivity;
import ch.epfl.vlsc.vhdl.ir.design.DesignObject;
import ch.epfl.vlsc.vhdl.ir.design.EdgeSensitivity;
import ch.epfl.vlsc.vhdl.ir.design.Process;
import ch.epfl.vlsc.vhdl.ir.design.Sensitivity;
import ch.epfl.vlsc.vhdl.ir.design.Signal;
import ch.epfl.vlsc.vhdl.ir.design.SignalSensitivity;
import ch.epfl.vlsc.vhdl.ir.stmt.IfBranch;
import ch.epfl.vlsc.vhdl.ir.stmt.Statement;
import ch.epfl.vlsc.vhdl.ir.stmt.StmtAssignment;
import ch.epfl.vlsc.vhdl.ir.stmt.StmtIf;
import ch.epfl.vlsc.vhdl.platformutils.Emitter;
import ch.epfl.vlsc.vhdl.reporting.ConversionErrors;
import org.apache.logging.log4j.LogManager;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Writes the processes of the architecture body, one writer per process kind.
 */
public interface Processes {
    VhdlBackend backend();

    default Emitter emitter() {
        return backend().emitter();
    }

    default Statements statements() {
        return backend().statements();
    }

    default void generate(Process process) {
        LogManager.getLogger(Processes.class).debug("Writing {}", process);
        backend().enter(process);
        try {
            switch (process.getKind()) {
                case SEQUENTIAL:
                case CUSTOM_SENSITIVITY:
                    sequential(process);
                    break;
                case COMBINATIONAL:
                    combinational(process);
                    break;
                case SIMPLE_COMBINATIONAL:
                    simpleCombinational(process);
                    break;
                case INITIAL:
                    initial(process);
                    break;
                default:
                    throw ConversionErrors.ARG_TYPE.exception(process + " is not a process", process.getPosition());
            }
        } finally {
            backend().leave();
        }
    }

    /*
     * Header and footer
     */

    default void header(Process process, List<String> sensitivity) {
        if (sensitivity.isEmpty()) {
            emitter().emit("%s: process is", process.getName());
        } else {
            emitter().emit("%s: process (%s) is", process.getName(), String.join(", ", sensitivity));
        }
        emitter().increaseIndentation();
        backend().declarations().variables(process);
        emitter().decreaseIndentation();
        emitter().emit("begin");
        emitter().increaseIndentation();
    }

    default void footer(Process process) {
        emitter().decreaseIndentation();
        emitter().emit("end process %s;", process.getName());
        emitter().emitNewLine();
    }

    /*
     * Clocked processes
     */

    default void sequential(Process process) {
        List<Sensitivity> sensitivity = process.getSensitivity();
        if (sensitivity.isEmpty()) {
            throw ConversionErrors.STRUCTURE.exception(process + " has an empty sensitivity list", process.getPosition());
        }
        Sensitivity.Kind kind = sensitivity.get(0).getKind();
        for (Sensitivity entry : sensitivity) {
            if (entry.getKind() != kind) {
                throw ConversionErrors.SENSITIVITY_KIND.exception("in " + process, process.getPosition());
            }
        }
        switch (kind) {
            case EDGE:
                if (sensitivity.size() == 1) {
                    singleEdge(process, (EdgeSensitivity) sensitivity.get(0));
                } else {
                    asynchronousEdges(process);
                }
                break;
            case LEVEL:
                List<String> names = new ArrayList<>();
                for (Sensitivity entry : sensitivity) {
                    names.add(((SignalSensitivity) entry).getSignal().getName());
                }
                header(process, names);
                statements().execute(process.getBody());
                footer(process);
                break;
            default:
                if (sensitivity.size() != 1) {
                    throw ConversionErrors.SENSITIVITY_KIND.exception("several delays in " + process, process.getPosition());
                }
                header(process, new ArrayList<>());
                statements().execute(process.getBody());
                emitter().emit("wait for %d ns;", ((DelaySensitivity) sensitivity.get(0)).getNanoseconds());
                footer(process);
                break;
        }
    }

    default void singleEdge(Process process, EdgeSensitivity edge) {
        String clock = edge.getSignal().getName();
        List<String> names = new ArrayList<>();
        names.add(clock);
        header(process, names);
        emitter().emit("if %s(%s) then", edge.getEdge().getFunction(), clock);
        emitter().increaseIndentation();
        statements().execute(process.getBody());
        emitter().decreaseIndentation();
        emitter().emit("end if;");
        footer(process);
    }

    /**
     * Several edges: the first statement tests the asynchronous ones and its else branch is the
     * clocked part. The else branch becomes a test of the remaining edges.
     */
    default void asynchronousEdges(Process process) {
        List<Statement> body = process.getBody();
        if (body.isEmpty() || !(body.get(0) instanceof StmtIf)) {
            throw ConversionErrors.NO_EDGE_TEST.exception("in " + process, process.getPosition());
        }
        StmtIf test = (StmtIf) body.get(0);
        List<EdgeSensitivity> remaining = new ArrayList<>();
        for (Sensitivity entry : process.getSensitivity()) {
            remaining.add((EdgeSensitivity) entry);
        }
        for (IfBranch branch : test.getBranches()) {
            Optional<EdgeSensitivity> edge = backend().queries().edgeOf(process, branch.getCondition(),
                    process.getSensitivity());
            if (!edge.isPresent()) {
                throw backend().queries().error(branch, ConversionErrors.NO_EDGE_TEST, "in " + process);
            }
            remaining.remove(edge.get());
        }
        if (!test.getElseBranch().isPresent()) {
            throw backend().queries().error(test, ConversionErrors.NO_ELSE_TEST, "in " + process);
        }
        if (remaining.isEmpty()) {
            throw backend().queries().error(test, ConversionErrors.NO_EDGE_TEST, "no clock edge left in " + process);
        }
        backend().edgeRewrites().put(test, remaining);

        Set<String> names = new LinkedHashSet<>();
        for (Sensitivity entry : process.getSensitivity()) {
            names.add(((EdgeSensitivity) entry).getSignal().getName());
        }
        header(process, new ArrayList<>(names));
        statements().execute(body);
        footer(process);
    }

    /*
     * Combinational processes
     */

    default void combinational(Process process) {
        Set<String> names = new LinkedHashSet<>();
        for (Sensitivity entry : process.getSensitivity()) {
            if (entry instanceof SignalSensitivity) {
                names.add(((SignalSensitivity) entry).getSignal().getName());
            }
        }
        if (names.isEmpty()) {
            for (String input : process.getInputs()) {
                Optional<DesignObject> object = backend().queries().lookup(process, input);
                if (object.isPresent() && object.get() instanceof Signal) {
                    names.add(((Signal) object.get()).getName());
                }
            }
        }
        if (names.isEmpty()) {
            throw ConversionErrors.STRUCTURE.exception(process + " reads no signal", process.getPosition());
        }
        header(process, new ArrayList<>(names));
        statements().execute(process.getBody());
        footer(process);
    }

    /**
     * Only signal assignments: each one becomes a concurrent assignment.
     */
    default void simpleCombinational(Process process) {
        for (Statement statement : process.getBody()) {
            if (!(statement instanceof StmtAssignment) || !((StmtAssignment) statement).getTarget().isSignal()) {
                throw backend().queries().error(statement, ConversionErrors.STRUCTURE,
                        process.getName() + " can only assign signals");
            }
            if (statements().romRead(((StmtAssignment) statement).getValue()).isPresent()) {
                throw backend().queries().error(statement, ConversionErrors.NOT_SUPPORTED,
                        "ROM read in the concurrent assignments of " + process.getName());
            }
            statements().execute(statement);
        }
        emitter().emitNewLine();
    }

    /*
     * Testbench processes
     */

    default void initial(Process process) {
        header(process, new ArrayList<>());
        statements().execute(process.getBody());
        emitter().emit("wait;");
        footer(process);
    }
}
