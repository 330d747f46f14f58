package ch.epfl.vlsc.vhdl.reporting;

import com.google.common.collect.ImmutableList;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Keeps every diagnostic for the caller and forwards it to the log.
 */
public class LoggingReporter implements Reporter {
    private static final Logger LOGGER = LogManager.getLogger(LoggingReporter.class);

    private final List<Diagnostic> diagnostics = new ArrayList<>();
    private final Map<Diagnostic.Kind, Integer> counts = new EnumMap<>(Diagnostic.Kind.class);

    @Override
    public void report(Diagnostic diagnostic) {
        diagnostics.add(diagnostic);
        counts.merge(diagnostic.getKind(), 1, Integer::sum);
        switch (diagnostic.getKind()) {
            case ERROR:
                LOGGER.error(diagnostic.generateMessage());
                break;
            case WARNING:
                LOGGER.warn(diagnostic.generateMessage());
                break;
            default:
                LOGGER.info(diagnostic.generateMessage());
        }
    }

    @Override
    public int getMessageCount(Diagnostic.Kind kind) {
        return counts.getOrDefault(kind, 0);
    }

    @Override
    public List<Diagnostic> getDiagnostics() {
        return ImmutableList.copyOf(diagnostics);
    }
}
