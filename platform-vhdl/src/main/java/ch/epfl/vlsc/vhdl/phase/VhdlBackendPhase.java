package ch.epfl.vlsc.vhdl.phase;

import ch.epfl.vlsc.vhdl.backend.VhdlBackend;
import ch.epfl.vlsc.vhdl.ir.design.Design;
import ch.epfl.vlsc.vhdl.phases.Phase;
import ch.epfl.vlsc.vhdl.platform.ConversionContext;
import ch.epfl.vlsc.vhdl.platformutils.Emitter;
import ch.epfl.vlsc.vhdl.platformutils.PathUtils;
import ch.epfl.vlsc.vhdl.reporting.CompilationException;
import ch.epfl.vlsc.vhdl.settings.Setting;
import ch.epfl.vlsc.vhdl.settings.VhdlSettings;
import com.google.common.collect.ImmutableList;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.IOException;
import java.io.Writer;
import java.nio.file.Path;
import java.util.List;

/**
 * Writes the VHDL file of a design, either to the target directory or to a given writer.
 */
public class VhdlBackendPhase implements Phase<Design, ConversionContext> {
    private static final Logger LOGGER = LogManager.getLogger(VhdlBackendPhase.class);

    /**
     * Output writer, null when the design is written to a file
     */
    private final Writer writer;

    /**
     * Generated file, set once the phase has run on a file
     */
    private Path target;

    public VhdlBackendPhase() {
        this.writer = null;
    }

    public VhdlBackendPhase(Writer writer) {
        this.writer = writer;
    }

    @Override
    public String getDescription() {
        return "Writes the VHDL entity and architecture of the design";
    }

    @Override
    public List<Setting<?>> getPhaseSettings() {
        return ImmutableList.of(
                VhdlSettings.targetPath,
                VhdlSettings.fileExtension,
                VhdlSettings.architectureName,
                VhdlSettings.indentationWidth,
                VhdlSettings.romDefaultLastEntry,
                VhdlSettings.ifToCase
        );
    }

    public Path getTarget() {
        return target;
    }

    @Override
    public Design execute(Design design, ConversionContext context) throws CompilationException {
        Emitter emitter = new Emitter(context.getConfiguration().get(VhdlSettings.indentationWidth));
        Path file = null;
        if (writer == null) {
            Path directory = PathUtils.createDirectory(context.getConfiguration().get(VhdlSettings.targetPath));
            file = directory.resolve(design.getName() + context.getConfiguration().get(VhdlSettings.fileExtension));
            LOGGER.info("{} of {} to {}", getDescription(), design.getName(), file);
            emitter.open(file);
        } else {
            LOGGER.info("{} of {}", getDescription(), design.getName());
            emitter.open(writer);
        }

        // -- Instantiate backend, bind current design and the context
        VhdlBackend backend = new VhdlBackend(design, context, emitter);
        try {
            backend.architecture().generateDesign();
        } catch (RuntimeException e) {
            emitter.close();
            if (file != null) {
                try {
                    PathUtils.discard(file);
                } catch (IOException suppressed) {
                    e.addSuppressed(suppressed);
                }
            }
            throw e;
        } finally {
            emitter.close();
        }
        target = file;
        return design;
    }
}
