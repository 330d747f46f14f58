package ch.epfl.vlsc.vhdl.reporting;

import java.util.List;

public interface Reporter {

    void report(Diagnostic diagnostic);

    int getMessageCount(Diagnostic.Kind kind);

    /**
     * All diagnostics reported so far, in reporting order.
     */
    List<Diagnostic> getDiagnostics();

    static Reporter instance() {
        return new LoggingReporter();
    }
}
