package ch.epfl.vlsc.vhdl.reporting;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertSame;

public class LoggingReporterTest {

    @Test
    public void countsDiagnosticsByKind() {
        Reporter reporter = Reporter.instance();
        reporter.report(new Diagnostic(Diagnostic.Kind.WARNING, "first"));
        reporter.report(new Diagnostic(Diagnostic.Kind.WARNING, "second"));
        reporter.report(new Diagnostic(Diagnostic.Kind.INFO, "third"));
        assertEquals(2, reporter.getMessageCount(Diagnostic.Kind.WARNING));
        assertEquals(1, reporter.getMessageCount(Diagnostic.Kind.INFO));
        assertEquals(0, reporter.getMessageCount(Diagnostic.Kind.ERROR));
        assertEquals("second", reporter.getDiagnostics().get(1).getMessage());
    }

    @Test
    public void messageShowsTheKnownPosition() {
        Diagnostic diagnostic = new Diagnostic(Diagnostic.Kind.ERROR, "bad", SourcePosition.of("top.py", 12));
        assertEquals("ERROR [" + diagnostic.getPosition() + "]: bad", diagnostic.generateMessage());
        assertEquals("WARNING: odd", new Diagnostic(Diagnostic.Kind.WARNING, "odd").generateMessage());
    }

    @Test
    public void exceptionCarriesItsDiagnostic() {
        Diagnostic diagnostic = new Diagnostic(Diagnostic.Kind.ERROR, "broken");
        CompilationException e = new CompilationException(diagnostic);
        assertSame(diagnostic, e.getDiagnostic());
        assertEquals("ERROR: broken", e.getMessage());
    }
}
