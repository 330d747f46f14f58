package ch.epfl.vlsc.vhdl.backend;

import ch.epfl.vlsc.vhdl.ir.design.Design;
import ch.epfl.vlsc.vhdl.ir.design.Process;
import ch.epfl.vlsc.vhdl.ir.design.Signal;
import ch.epfl.vlsc.vhdl.platformutils.Emitter;
import ch.epfl.vlsc.vhdl.settings.VhdlSettings;

import java.util.List;

/**
 * Writes the whole design file: the library clauses, the entity and the architecture body.
 */
public interface Architecture {
    VhdlBackend backend();

    default Emitter emitter() {
        return backend().emitter();
    }

    default void generateDesign() {
        Design design = backend().task();
        String architecture = backend().configuration().get(VhdlSettings.architectureName);

        libraries();
        backend().declarations().entity();

        emitter().emit("architecture %s of %s is", architecture, design.getName());
        emitter().emitNewLine();
        emitter().increaseIndentation();
        toStdLogic();
        emitter().emitNewLine();

        // -- Declarations and processes go to buffers, the callables used by the processes come between them
        Emitter declarations = backend().newEmitter();
        declarations.openBuffer();
        List<Signal> constants;
        backend().pushEmitter(declarations);
        try {
            backend().declarations().enumTypes();
            constants = backend().declarations().signals();
            backend().declarations().memories();
        } finally {
            backend().popEmitter();
        }
        String declared = declarations.closeBuffer();
        if (!declared.isEmpty()) {
            emitter().emitRawText(declared);
            emitter().emitNewLine();
        }

        Emitter block = backend().newEmitter();
        block.openBuffer();
        block.increaseIndentation();
        backend().pushEmitter(block);
        try {
            for (Process process : design.getProcesses()) {
                backend().processes().generate(process);
            }
        } finally {
            backend().popEmitter();
        }
        String processes = block.closeBuffer();
        for (String callable : backend().callableTexts()) {
            emitter().emitRawText(callable);
        }
        emitter().decreaseIndentation();
        emitter().emit("begin");
        emitter().emitNewLine();
        if (!constants.isEmpty()) {
            emitter().increaseIndentation();
            for (Signal signal : constants) {
                emitter().emit("%s <= %s;", signal.getName(), backend().typeseval().initialValue(signal));
            }
            emitter().decreaseIndentation();
            emitter().emitNewLine();
        }
        emitter().emitRawText(processes);
        emitter().emit("end architecture %s;", architecture);
    }

    default void libraries() {
        emitter().emit("library IEEE;");
        emitter().emit("use IEEE.std_logic_1164.all;");
        emitter().emit("use IEEE.numeric_std.all;");
        emitter().emit("use std.textio.all;");
        emitter().emitNewLine();
    }

    default void toStdLogic() {
        emitter().emit("function to_std_logic(arg: boolean) return std_logic is");
        emitter().emit("begin");
        emitter().increaseIndentation();
        emitter().emit("if arg then");
        emitter().increaseIndentation();
        emitter().emit("return '1';");
        emitter().decreaseIndentation();
        emitter().emit("else");
        emitter().increaseIndentation();
        emitter().emit("return '0';");
        emitter().decreaseIndentation();
        emitter().emit("end if;");
        emitter().decreaseIndentation();
        emitter().emit("end function to_std_logic;");
    }
}
