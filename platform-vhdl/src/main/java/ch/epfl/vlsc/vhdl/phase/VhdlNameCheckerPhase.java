package ch.epfl.vlsc.vhdl.phase;

import ch.epfl.vlsc.vhdl.ir.design.Design;
import ch.epfl.vlsc.vhdl.ir.design.DesignObject;
import ch.epfl.vlsc.vhdl.ir.design.EnumItem;
import ch.epfl.vlsc.vhdl.ir.design.EnumType;
import ch.epfl.vlsc.vhdl.ir.design.Memory;
import ch.epfl.vlsc.vhdl.ir.design.Process;
import ch.epfl.vlsc.vhdl.ir.design.Signal;
import ch.epfl.vlsc.vhdl.ir.design.Variable;
import ch.epfl.vlsc.vhdl.phases.Phase;
import ch.epfl.vlsc.vhdl.platform.ConversionContext;
import ch.epfl.vlsc.vhdl.reporting.CompilationException;
import ch.epfl.vlsc.vhdl.reporting.ConversionErrors;
import ch.epfl.vlsc.vhdl.reporting.Diagnostic;
import ch.epfl.vlsc.vhdl.reporting.SourcePosition;
import ch.epfl.vlsc.vhdl.settings.Setting;
import ch.epfl.vlsc.vhdl.settings.VhdlSettings;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Gives every signal its output name, checks that no internal signal takes the name of a port, and
 * renames the internal signals and processes named after a VHDL reserved word.
 */
public class VhdlNameCheckerPhase implements Phase<Design, ConversionContext> {
    private static final Logger LOGGER = LogManager.getLogger(VhdlNameCheckerPhase.class);

    private final ImmutableSet<String> keywords;
    private ConversionContext context;

    @Override
    public String getDescription() {
        return "checks the names of the design and renames the signals and processes named after VHDL keywords";
    }

    @Override
    public List<Setting<?>> getPhaseSettings() {
        return ImmutableList.of(VhdlSettings.checkReservedNames);
    }

    @Override
    public Design execute(Design design, ConversionContext context) throws CompilationException {
        LOGGER.info("Checking the names of {}", design.getName());
        this.context = context;

        Map<Signal, String> ports = new IdentityHashMap<>();
        design.getTopInterface().getPorts().forEach((name, signal) -> ports.put(signal, name));
        for (Signal signal : design.getSignals()) {
            String port = ports.get(signal);
            if (port != null) {
                signal.setName(port);
            } else if (signal.getName() == null) {
                signal.setName(signal.getBaseName());
            }
        }
        // VHDL identifiers are case-insensitive
        Set<String> portNames = design.getTopInterface().getPorts().keySet().stream()
                .map(name -> name.toLowerCase(Locale.ROOT))
                .collect(Collectors.toSet());
        for (Signal signal : design.getSignals()) {
            if (!ports.containsKey(signal) && portNames.contains(signal.getName().toLowerCase(Locale.ROOT))) {
                throw ConversionErrors.SHADOWING_SIGNAL.exception(signal.getName());
            }
        }

        if (!context.getConfiguration().get(VhdlSettings.checkReservedNames)) {
            return design;
        }
        for (Signal signal : design.getSignals()) {
            if (!isReserved(signal.getName())) {
                continue;
            }
            if (ports.containsKey(signal)) {
                throw ConversionErrors.RESERVED_NAME.exception("port " + signal.getName());
            }
            warn("signal", signal.getName());
            signal.setName(signal.getName() + "_renamed");
        }
        for (Memory memory : design.getMemories()) {
            if (isReserved(memory.getName())) {
                throw ConversionErrors.RESERVED_NAME.exception("memory " + memory.getName());
            }
        }
        Set<Process> checked = Collections.newSetFromMap(new IdentityHashMap<>());
        ImmutableList.Builder<Process> processes = ImmutableList.builder();
        for (Process process : design.getProcesses()) {
            checkProcess(process, checked);
            processes.add(renameProcess(process));
        }
        return design.withProcesses(processes.build());
    }

    private Process renameProcess(Process process) {
        if (isReserved(process.getName())) {
            warn("process", process.getName());
            return process.withName(process.getName() + "_renamed");
        }
        return process;
    }

    /**
     * Variables, called functions and enumeration items keep their name in the output, so a
     * reserved one cannot be converted.
     */
    private void checkProcess(Process process, Set<Process> checked) {
        if (!checked.add(process)) {
            return;
        }
        for (Variable variable : process.getVariables().values()) {
            if (isReserved(variable.getName())) {
                throw ConversionErrors.RESERVED_NAME.exception("variable " + variable.getName() + " in " + process.getName(),
                        process.getPosition());
            }
        }
        for (DesignObject object : process.getSymbols().values()) {
            if (object instanceof Process) {
                Process callable = (Process) object;
                if (callable.getKind().isCallable() && isReserved(callable.getName())) {
                    throw ConversionErrors.RESERVED_NAME.exception("function " + callable.getName(), callable.getPosition());
                }
                checkProcess(callable, checked);
            } else if (object instanceof EnumType) {
                for (EnumItem item : ((EnumType) object).getItems()) {
                    if (isReserved(item.getName())) {
                        throw ConversionErrors.RESERVED_NAME.exception("enumeration item " + item.getName());
                    }
                }
            }
        }
    }

    private void warn(String what, String name) {
        context.getReporter().report(new Diagnostic(Diagnostic.Kind.WARNING,
                String.format("Renaming %s %s to %2$s_renamed because %2$s is a reserved VHDL keyword", what, name),
                SourcePosition.UNKNOWN));
    }

    public boolean isReserved(String name) {
        return keywords.contains(name.toLowerCase(Locale.ROOT));
    }

    public VhdlNameCheckerPhase() {
        this.keywords = ImmutableSet.of(
                "abs", "access", "after", "alias", "all", "and", "architecture", "array", "assert", "assume",
                "assume_guarantee", "attribute", "begin", "block", "body", "buffer", "bus", "case", "component",
                "configuration", "constant", "context", "cover", "default", "disconnect", "downto", "else",
                "elsif", "end", "entity", "exit", "fairness", "file", "for", "force", "function", "generate",
                "generic", "group", "guarded", "if", "impure", "in", "inertial", "inout", "is", "label",
                "library", "linkage", "literal", "loop", "map", "mod", "nand", "new", "next", "nor", "not",
                "null", "of", "on", "open", "or", "others", "out", "package", "parameter", "port", "postponed",
                "procedure", "process", "property", "protected", "pure", "range", "record", "register",
                "reject", "release", "rem", "report", "restrict", "restrict_guarantee", "return", "rol", "ror",
                "select", "sequence", "severity", "shared", "signal", "sla", "sll", "sra", "srl", "strong",
                "subtype", "then", "to", "transport", "type", "unaffected", "units", "until", "use",
                "variable", "vmode", "vprop", "vunit", "wait", "when", "while", "with", "xnor", "xor");
    }
}
