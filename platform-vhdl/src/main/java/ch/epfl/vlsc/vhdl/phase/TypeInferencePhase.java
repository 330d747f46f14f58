package ch.epfl.vlsc.vhdl.phase;

import ch.epfl.vlsc.vhdl.attribute.TypeAnnotations;
import ch.epfl.vlsc.vhdl.ir.design.Design;
import ch.epfl.vlsc.vhdl.ir.design.Process;
import ch.epfl.vlsc.vhdl.phases.Phase;
import ch.epfl.vlsc.vhdl.platform.ConversionContext;
import ch.epfl.vlsc.vhdl.reporting.CompilationException;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.Set;

public class TypeInferencePhase implements Phase<Design, ConversionContext> {
    private static final Logger LOGGER = LogManager.getLogger(TypeInferencePhase.class);

    @Override
    public String getDescription() {
        return "Infers the VHDL type of every expression and assignment target";
    }

    @Override
    public Design execute(Design design, ConversionContext context) throws CompilationException {
        LOGGER.info("{} of {}", getDescription(), design.getName());
        TypeAnnotations.Builder annotations = TypeAnnotations.builder();
        Set<Process> inferred = Collections.newSetFromMap(new IdentityHashMap<>());
        for (Process process : design.getProcesses()) {
            new TypeInference(process, context.getQueries(), annotations, inferred).run();
        }
        TypeAnnotations result = annotations.build();
        LOGGER.debug("Inferred {} node types", result.size());
        context.setAnnotations(result);
        return design;
    }
}
