package ch.epfl.vlsc.vhdl.backend;

import ch.epfl.vlsc.vhdl.ir.design.Design;
import ch.epfl.vlsc.vhdl.ir.design.DesignObject;
import ch.epfl.vlsc.vhdl.ir.design.EnumItem;
import ch.epfl.vlsc.vhdl.ir.design.EnumType;
import ch.epfl.vlsc.vhdl.ir.design.Memory;
import ch.epfl.vlsc.vhdl.ir.design.Process;
import ch.epfl.vlsc.vhdl.ir.design.Signal;
import ch.epfl.vlsc.vhdl.ir.design.ValueKind;
import ch.epfl.vlsc.vhdl.ir.design.Variable;
import ch.epfl.vlsc.vhdl.platformutils.Emitter;
import ch.epfl.vlsc.vhdl.reporting.ConversionErrors;
import ch.epfl.vlsc.vhdl.reporting.SourcePosition;
import com.google.common.collect.ImmutableList;

import java.util.ArrayList;
import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

public interface Declarations {
    VhdlBackend backend();

    default Emitter emitter() {
        return backend().emitter();
    }

    default TypesEvaluator typeseval() {
        return backend().typeseval();
    }

    default boolean isPort(Signal signal) {
        return backend().task().getTopInterface().getPorts().values().stream().anyMatch(port -> port == signal);
    }

    /*
     * Entity
     */

    default void entity() {
        Design design = backend().task();
        List<String> ports = design.getTopInterface().getArgNames();
        emitter().emit("entity %s is", design.getName());
        if (!ports.isEmpty()) {
            emitter().increaseIndentation();
            emitter().emit("port (");
            emitter().increaseIndentation();
            for (int i = 0; i < ports.size(); i++) {
                Signal signal = design.getTopInterface().getPorts().get(ports.get(i));
                emitter().emit("%s: %s %s%s", signal.getName(), portDirection(signal), portType(signal),
                        i == ports.size() - 1 ? "" : ";");
            }
            emitter().decreaseIndentation();
            emitter().emit(");");
            emitter().decreaseIndentation();
        }
        emitter().emit("end entity %s;", design.getName());
        emitter().emitNewLine();
    }

    default String portDirection(Signal signal) {
        return signal.isDriven() ? "out" : "in";
    }

    default String portType(Signal signal) {
        if (signal.getKind() == ValueKind.ENUM) {
            throw ConversionErrors.UNSUPPORTED_TYPE.exception("enumerated port " + signal.getName());
        }
        return typeseval().type(signal);
    }

    /*
     * Enumerations
     */

    /**
     * Declares every enumeration used by a signal, a memory, or a process variable or symbol.
     */
    default void enumTypes() {
        Design design = backend().task();
        Set<EnumType> types = new LinkedHashSet<>();
        for (Signal signal : design.getSignals()) {
            if (signal.getKind() == ValueKind.ENUM && (isPort(signal) || signal.isDriven() || signal.isRead())) {
                types.add(signal.getEnumType());
            }
        }
        for (Memory memory : design.getMemories()) {
            if (isDeclared(memory) && memory.getElement().getKind() == ValueKind.ENUM) {
                types.add(memory.getElement().getEnumType());
            }
        }
        Set<Process> visited = Collections.newSetFromMap(new IdentityHashMap<>());
        for (Process process : design.getProcesses()) {
            collectEnumTypes(process, types, visited);
        }
        types.forEach(this::enumType);
    }

    default void collectEnumTypes(Process process, Set<EnumType> types, Set<Process> visited) {
        if (!visited.add(process)) {
            return;
        }
        for (Variable variable : process.getVariables().values()) {
            if (variable.getKind() == ValueKind.ENUM) {
                types.add(variable.getEnumType());
            }
        }
        process.getReturnValue().filter(v -> v.getKind() == ValueKind.ENUM).ifPresent(v -> types.add(v.getEnumType()));
        for (DesignObject object : process.getSymbols().values()) {
            if (object instanceof EnumType) {
                types.add((EnumType) object);
            } else if (object instanceof EnumItem) {
                types.add(((EnumItem) object).getType());
            } else if (object instanceof Signal && ((Signal) object).getKind() == ValueKind.ENUM) {
                types.add(((Signal) object).getEnumType());
            } else if (object instanceof Process) {
                collectEnumTypes((Process) object, types, visited);
            }
        }
    }

    /**
     * Writes the type declaration of an enumeration, only the first time it is asked for.
     */
    default void enumType(EnumType type) {
        if (!backend().context().declareEnum(type)) {
            return;
        }
        List<String> items = new ArrayList<>();
        for (EnumItem item : type.getItems()) {
            items.add(item.getName());
        }
        emitter().emit("type %s is (%s);", type.getTypeName(), String.join(", ", items));
        if (type.getEncodings().isPresent()) {
            if (!backend().encodingAttributeBox().get()) {
                emitter().emit("attribute enum_encoding: string;");
                backend().encodingAttributeBox().set(true);
            }
            emitter().emit("attribute enum_encoding of %s: type is \"%s\";", type.getTypeName(),
                    String.join(" ", type.getEncodings().get()));
        }
    }

    /*
     * Signals and memories
     */

    /**
     * Declares the internal signals and reports the ones that are only driven or only read.
     *
     * @return the signals that are read but never driven; they get a constant assignment
     */
    default List<Signal> signals() {
        ImmutableList.Builder<Signal> constants = ImmutableList.builder();
        for (Signal signal : backend().task().getSignals()) {
            if (isPort(signal) || !signal.isDriven() && !signal.isRead()) {
                continue;
            }
            if (signal.getKind() == ValueKind.ENUM) {
                enumType(signal.getEnumType());
            }
            if (signal.isDriven() && !signal.isRead()) {
                backend().context().getReporter().report(
                        ConversionErrors.UNUSED_SIGNAL.diagnostic(signal.getName(), SourcePosition.UNKNOWN));
            }
            if (!signal.isDriven() && signal.isRead()) {
                backend().context().getReporter().report(
                        ConversionErrors.UNDRIVEN_SIGNAL.diagnostic(signal.getName(), SourcePosition.UNKNOWN));
                constants.add(signal);
            }
            emitter().emit("signal %s: %s;", signal.getName(), typeseval().type(signal));
        }
        return constants.build();
    }

    /**
     * A memory is declared as an array when it is declarable and some process refers to it.
     */
    default boolean isDeclared(Memory memory) {
        return memory.isDeclarable() && backend().annotations().isReferenced(memory);
    }

    default void memories() {
        for (Memory memory : backend().task().getMemories()) {
            if (!isDeclared(memory)) {
                continue;
            }
            Signal element = memory.getElement();
            if (element.getKind() == ValueKind.ENUM) {
                enumType(element.getEnumType());
            }
            emitter().emit("type t_array_%s is array(0 to %d) of %s;", memory.getName(), memory.getDepth() - 1,
                    typeseval().type(element));
            emitter().emit("signal %s: t_array_%1$s;", memory.getName());
        }
    }

    /*
     * Process variables
     */

    default void variables(Process process) {
        Map<String, Variable> variables = process.getVariables();
        for (Variable variable : variables.values()) {
            if (process.getParameters().contains(variable.getName())
                    || backend().annotations().isLoopVariable(process, variable.getName())) {
                continue;
            }
            if (variable.getKind() == ValueKind.ENUM) {
                enumType(variable.getEnumType());
            }
            emitter().emit("variable %s: %s;", variable.getName(), typeseval().type(variable));
        }
        if (process.usesOutputText()) {
            emitter().emit("variable L: line;");
        }
    }
}
