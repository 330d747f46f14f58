package ch.epfl.vlsc.vhdl.phase;

import ch.epfl.vlsc.vhdl.attribute.DesignQueries;
import ch.epfl.vlsc.vhdl.ir.design.Design;
import ch.epfl.vlsc.vhdl.ir.design.Process;
import ch.epfl.vlsc.vhdl.ir.design.ProcessKind;
import ch.epfl.vlsc.vhdl.ir.design.Signal;
import ch.epfl.vlsc.vhdl.ir.design.Variable;
import ch.epfl.vlsc.vhdl.platform.ConversionContext;
import ch.epfl.vlsc.vhdl.reporting.ConversionErrors;
import ch.epfl.vlsc.vhdl.reporting.Diagnostic;
import ch.epfl.vlsc.vhdl.reporting.Reporter;
import ch.epfl.vlsc.vhdl.settings.Configuration;
import ch.epfl.vlsc.vhdl.settings.VhdlSettings;
import org.junit.jupiter.api.Test;

import static ch.epfl.vlsc.vhdl.DesignFixtures.assertConversionError;
import static ch.epfl.vlsc.vhdl.DesignFixtures.name;
import static ch.epfl.vlsc.vhdl.DesignFixtures.next;
import static ch.epfl.vlsc.vhdl.DesignFixtures.read;
import static ch.epfl.vlsc.vhdl.DesignFixtures.used;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class VhdlNameCheckerPhaseTest {
    private final VhdlNameCheckerPhase phase = new VhdlNameCheckerPhase();
    private final Reporter reporter = Reporter.instance();

    private ConversionContext context(Configuration configuration) {
        return new ConversionContext(configuration, reporter, new DesignQueries());
    }

    private Design check(Design design) {
        return phase.execute(design, context(Configuration.defaults()));
    }

    private static Process copy(String processName, Signal from, Signal to) {
        return Process.builder(processName, ProcessKind.COMBINATIONAL)
                .signal(from)
                .signal(to)
                .body(next(to.getBaseName(), name(from.getBaseName())))
                .build();
    }

    @Test
    void reservedWordsIgnoreCase() {
        assertTrue(phase.isReserved("signal"));
        assertTrue(phase.isReserved("END"));
        assertTrue(phase.isReserved("Process"));
        assertFalse(phase.isReserved("count"));
    }

    @Test
    void signalsGetTheirOutputName() {
        Signal port = read(Signal.unsigned("din", 8, 0));
        Signal internal = used(Signal.unsigned("sig_3", 8, 0));
        port.setName("stale");
        internal.setName(null);
        check(Design.builder("top").port(port).signal(internal).build());
        assertEquals("din", port.getName());
        assertEquals("sig_3", internal.getName());
    }

    @Test
    void internalSignalNamedAfterKeywordIsRenamed() {
        Signal in = read(Signal.bool("din", false));
        Signal out = used(Signal.bool("out", false));
        Design design = Design.builder("top").port(in).signal(out).process(copy("logic", in, out)).build();
        check(design);
        assertEquals("out_renamed", out.getName());
        assertEquals(1, reporter.getMessageCount(Diagnostic.Kind.WARNING));
        assertEquals("Renaming signal out to out_renamed because out is a reserved VHDL keyword",
                reporter.getDiagnostics().get(0).getMessage());
    }

    @Test
    void portNamedAfterKeyword() {
        Signal in = read(Signal.bool("in", false));
        assertConversionError(ConversionErrors.RESERVED_NAME, () -> check(Design.builder("top").port(in).build()));
    }

    @Test
    void processNamedAfterKeywordIsRenamed() {
        Signal a = read(Signal.bool("a", false));
        Signal b = used(Signal.bool("b", false));
        Design checked = check(Design.builder("top").port(a).port(b).process(copy("process", a, b)).build());
        assertEquals("process_renamed", checked.getProcesses().get(0).getName());
    }

    @Test
    void variableNamedAfterKeyword() {
        Signal a = read(Signal.bool("a", false));
        Process process = Process.builder("logic", ProcessKind.COMBINATIONAL)
                .signal(a)
                .variable(Variable.integer("loop"))
                .build();
        assertConversionError(ConversionErrors.RESERVED_NAME,
                () -> check(Design.builder("top").port(a).process(process).build()));
    }

    @Test
    void internalSignalShadowingAPort() {
        Signal port = read(Signal.bool("a", false));
        Signal internal = used(Signal.bool("a", false));
        assertConversionError(ConversionErrors.SHADOWING_SIGNAL,
                () -> check(Design.builder("top").port(port).signal(internal).build()));
    }

    @Test
    void shadowingIgnoresTheCaseOfNames() {
        Signal port = read(Signal.bool("Din", false));
        Signal internal = used(Signal.bool("din", false));
        assertConversionError(ConversionErrors.SHADOWING_SIGNAL,
                () -> check(Design.builder("top").port(port).signal(internal).build()));
    }

    @Test
    void namesAreKeptWhenTheCheckIsOff() {
        Signal in = read(Signal.bool("din", false));
        Signal out = used(Signal.bool("out", false));
        Design design = Design.builder("top").port(in).signal(out).process(copy("process", in, out)).build();
        Configuration configuration = Configuration.builder().set(VhdlSettings.checkReservedNames, false).build();
        Design checked = phase.execute(design, context(configuration));
        assertEquals("out", out.getName());
        assertEquals("process", checked.getProcesses().get(0).getName());
        assertEquals(0, reporter.getMessageCount(Diagnostic.Kind.WARNING));
    }
}
