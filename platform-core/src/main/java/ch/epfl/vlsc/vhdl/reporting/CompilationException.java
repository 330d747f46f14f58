package ch.epfl.vlsc.vhdl.reporting;

import java.io.IOException;

/**
 * Aborts the running conversion. The carried diagnostic names the offending construct.
 */
public class CompilationException extends RuntimeException {
    private final Diagnostic diagnostic;

    public CompilationException(Diagnostic diagnostic) {
        super(diagnostic.generateMessage());
        this.diagnostic = diagnostic;
    }

    public CompilationException(Diagnostic diagnostic, Throwable cause) {
        super(diagnostic.generateMessage(), cause);
        this.diagnostic = diagnostic;
    }

    public static CompilationException from(IOException e) {
        return new CompilationException(new Diagnostic(Diagnostic.Kind.ERROR, "I/O error: " + e.getMessage()), e);
    }

    public Diagnostic getDiagnostic() {
        return diagnostic;
    }
}
