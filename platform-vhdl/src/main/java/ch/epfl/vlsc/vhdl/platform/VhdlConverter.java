package ch.epfl.vlsc.vhdl.platform;

import ch.epfl.vlsc.vhdl.attribute.DesignQueries;
import ch.epfl.vlsc.vhdl.attribute.TreeQueries;
import ch.epfl.vlsc.vhdl.ir.design.Design;
import ch.epfl.vlsc.vhdl.ir.design.Memory;
import ch.epfl.vlsc.vhdl.ir.design.Process;
import ch.epfl.vlsc.vhdl.ir.design.Signal;
import ch.epfl.vlsc.vhdl.phase.TypeInferencePhase;
import ch.epfl.vlsc.vhdl.phase.VhdlBackendPhase;
import ch.epfl.vlsc.vhdl.phase.VhdlNameCheckerPhase;
import ch.epfl.vlsc.vhdl.phases.Phase;
import ch.epfl.vlsc.vhdl.platformutils.utils.Box;
import ch.epfl.vlsc.vhdl.reporting.CompilationException;
import ch.epfl.vlsc.vhdl.reporting.ConversionErrors;
import ch.epfl.vlsc.vhdl.reporting.Reporter;
import ch.epfl.vlsc.vhdl.settings.Configuration;
import com.google.common.collect.ImmutableList;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.StringWriter;
import java.nio.file.Path;
import java.util.List;

/**
 * Converts a design to a VHDL file.
 * <p>
 * A conversion runs the name checker, the type inference and the VHDL backend in that order. Whatever
 * the outcome, the transient names and flags of the signals are cleared afterwards so the design objects
 * can be analyzed and converted again.
 */
public class VhdlConverter {
    private static final Logger LOGGER = LogManager.getLogger(VhdlConverter.class);

    private final Configuration configuration;
    private final Reporter reporter;
    private final TreeQueries queries;

    // -- Context of the conversion in progress, empty when none is running
    private final Box<ConversionContext> active = Box.empty();

    public VhdlConverter() {
        this(Configuration.defaults());
    }

    public VhdlConverter(Configuration configuration) {
        this(configuration, Reporter.instance(), new DesignQueries());
    }

    public VhdlConverter(Configuration configuration, Reporter reporter, TreeQueries queries) {
        this.configuration = configuration;
        this.reporter = reporter;
        this.queries = queries;
    }

    public Configuration getConfiguration() {
        return configuration;
    }

    public Reporter getReporter() {
        return reporter;
    }

    public boolean isConverting() {
        return !active.isEmpty();
    }

    /**
     * Builds a top level and converts the design it elaborates to. When a conversion is already in
     * progress, the top level is only instantiated, so a converted sub-block is used as an ordinary call.
     *
     * @return the instance of the top level
     */
    public <T> T convert(TopLevel<T> top, Object... args) {
        if (top == null) {
            throw ConversionErrors.FIRST_ARG_TYPE.exception("no top level given");
        }
        if (isConverting()) {
            LOGGER.debug("Conversion in progress, instantiating {} as an ordinary call", top);
            return top.instantiate(args);
        }
        ConversionContext context = newContext();
        active.set(context);
        try {
            T instance = top.instantiate(args);
            Design design = top.elaborate(instance, args);
            if (design == null) {
                throw ConversionErrors.FIRST_ARG_TYPE.exception("the top level elaborated to nothing");
            }
            run(design, context, new VhdlBackendPhase());
            return instance;
        } finally {
            active.clear();
        }
    }

    /**
     * Converts an elaborated design to a file in the target directory.
     *
     * @return the generated file
     */
    public Path convert(Design design) {
        VhdlBackendPhase backend = new VhdlBackendPhase();
        runActive(design, backend);
        return backend.getTarget();
    }

    /**
     * Converts an elaborated design and returns the VHDL text instead of writing a file.
     */
    public String convertToString(Design design) {
        StringWriter writer = new StringWriter();
        runActive(design, new VhdlBackendPhase(writer));
        return writer.toString();
    }

    private void runActive(Design design, VhdlBackendPhase backend) {
        if (isConverting()) {
            throw ConversionErrors.NOT_SUPPORTED.exception("nested conversion of a design");
        }
        ConversionContext context = newContext();
        active.set(context);
        try {
            run(design, context, backend);
        } finally {
            active.clear();
        }
    }

    private ConversionContext newContext() {
        return new ConversionContext(configuration, reporter, queries);
    }

    private void run(Design design, ConversionContext context, VhdlBackendPhase backend) throws CompilationException {
        if (design == null) {
            throw ConversionErrors.FIRST_ARG_TYPE.exception("no design given");
        }
        validate(design);
        List<Phase<Design, ConversionContext>> phases = ImmutableList.of(
                new VhdlNameCheckerPhase(),
                new TypeInferencePhase(),
                backend);
        LOGGER.info("Converting {}", design.getName());
        try {
            Design task = design;
            for (Phase<Design, ConversionContext> phase : phases) {
                task = phase.execute(task, context);
            }
        } finally {
            reset(design);
            context.clear();
        }
    }

    private void validate(Design design) {
        for (Process process : design.getProcesses()) {
            if (process == null) {
                throw ConversionErrors.ARG_TYPE.exception("null process in " + design.getName());
            }
            if (process.getKind().isCallable()) {
                throw ConversionErrors.ARG_TYPE.exception(process + " is not a process", process.getPosition());
            }
        }
    }

    private void reset(Design design) {
        for (Signal signal : design.getSignals()) {
            signal.reset();
        }
        for (Memory memory : design.getMemories()) {
            memory.getElement().reset();
        }
    }
}
