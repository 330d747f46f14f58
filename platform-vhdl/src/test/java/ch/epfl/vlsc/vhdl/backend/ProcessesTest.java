package ch.epfl.vlsc.vhdl.backend;

import ch.epfl.vlsc.vhdl.ir.design.DelaySensitivity;
import ch.epfl.vlsc.vhdl.ir.design.Design;
import ch.epfl.vlsc.vhdl.ir.design.Process;
import ch.epfl.vlsc.vhdl.ir.design.ProcessKind;
import ch.epfl.vlsc.vhdl.ir.design.Rom;
import ch.epfl.vlsc.vhdl.ir.design.Signal;
import ch.epfl.vlsc.vhdl.ir.design.SignalSensitivity;
import ch.epfl.vlsc.vhdl.ir.expr.ExprBinaryOp;
import ch.epfl.vlsc.vhdl.ir.expr.ExprIndexer;
import ch.epfl.vlsc.vhdl.ir.expr.ExprUnaryOp;
import ch.epfl.vlsc.vhdl.ir.stmt.StmtPrint;
import ch.epfl.vlsc.vhdl.reporting.ConversionErrors;
import org.junit.jupiter.api.Test;

import java.util.Collections;

import static ch.epfl.vlsc.vhdl.DesignFixtures.add;
import static ch.epfl.vlsc.vhdl.DesignFixtures.assertConversionError;
import static ch.epfl.vlsc.vhdl.DesignFixtures.branches;
import static ch.epfl.vlsc.vhdl.DesignFixtures.convert;
import static ch.epfl.vlsc.vhdl.DesignFixtures.driven;
import static ch.epfl.vlsc.vhdl.DesignFixtures.eq;
import static ch.epfl.vlsc.vhdl.DesignFixtures.falling;
import static ch.epfl.vlsc.vhdl.DesignFixtures.ifElse;
import static ch.epfl.vlsc.vhdl.DesignFixtures.ifThen;
import static ch.epfl.vlsc.vhdl.DesignFixtures.lines;
import static ch.epfl.vlsc.vhdl.DesignFixtures.literal;
import static ch.epfl.vlsc.vhdl.DesignFixtures.name;
import static ch.epfl.vlsc.vhdl.DesignFixtures.next;
import static ch.epfl.vlsc.vhdl.DesignFixtures.read;
import static ch.epfl.vlsc.vhdl.DesignFixtures.resettableCounter;
import static ch.epfl.vlsc.vhdl.DesignFixtures.rising;
import static ch.epfl.vlsc.vhdl.DesignFixtures.single;
import static ch.epfl.vlsc.vhdl.DesignFixtures.used;
import static ch.epfl.vlsc.vhdl.DesignFixtures.when;
import static org.junit.jupiter.api.Assertions.assertTrue;

public class ProcessesTest {

    private static Design resettable(Process.Builder seq) {
        Signal clk = read(Signal.bool("clk", false));
        Signal reset = read(Signal.bool("reset", true));
        Signal count = used(Signal.unsigned("count", 8, 0));
        seq.signal(clk).signal(reset).signal(count).sensitivity(rising(clk), falling(reset));
        return Design.builder("counter").port(clk).port(reset).port(count).process(seq.build()).build();
    }

    private static Process.Builder seq() {
        return Process.builder("seq", ProcessKind.SEQUENTIAL);
    }

    @Test
    public void asynchronousReset() {
        assertTrue(convert(resettableCounter()).contains(lines(
                "    seq: process (clk, reset) is",
                "    begin",
                "        if (reset = '0') then",
                "            count <= to_unsigned(0, 8);",
                "        elsif rising_edge(clk) then",
                "            count <= (count + 1);",
                "        end if;",
                "    end process seq;")));
    }

    @Test
    public void asynchronousTestNeedsAnElse() {
        Design design = resettable(seq().body(ifThen(when(eq(name("reset"), literal(0)), next("count", literal(0))))));
        assertConversionError(ConversionErrors.NO_ELSE_TEST, () -> convert(design));
    }

    @Test
    public void asynchronousProcessStartsWithATest() {
        Design design = resettable(seq().body(next("count", add(name("count"), literal(1)))));
        assertConversionError(ConversionErrors.NO_EDGE_TEST, () -> convert(design));
    }

    @Test
    public void asynchronousTestOnAnotherSignal() {
        Design design = resettable(seq().body(ifElse(
                branches(when(eq(name("count"), literal(0)), next("count", literal(1)))),
                next("count", add(name("count"), literal(1))))));
        assertConversionError(ConversionErrors.NO_EDGE_TEST, () -> convert(design));
    }

    @Test
    public void delayProcess() {
        Signal clk = used(Signal.bool("clk", false));
        Process clkgen = Process.builder("clkgen", ProcessKind.SEQUENTIAL)
                .signal(clk)
                .sensitivity(new DelaySensitivity(5))
                .body(next("clk", new ExprUnaryOp(ExprUnaryOp.Operator.INVERT, name("clk"))))
                .build();
        Design design = Design.builder("bench").signal(clk).process(clkgen).build();

        assertTrue(convert(design).contains(lines(
                "    clkgen: process is",
                "    begin",
                "        clk <= (not clk);",
                "        wait for 5 ns;",
                "    end process clkgen;")));
    }

    @Test
    public void levelSensitivity() {
        Signal a = read(Signal.bool("a", false));
        Signal b = read(Signal.bool("b", false));
        Signal y = driven(Signal.bool("y", false));
        Process.Builder logic = Process.builder("logic", ProcessKind.CUSTOM_SENSITIVITY)
                .sensitivity(new SignalSensitivity(a), new SignalSensitivity(b))
                .body(next("y", new ExprBinaryOp(ExprBinaryOp.Operator.BITAND, name("a"), name("b"))));

        assertTrue(convert(single(logic, a, b, y)).contains(lines(
                "    logic: process (a, b) is",
                "    begin",
                "        y <= (a and b);",
                "    end process logic;")));
    }

    @Test
    public void mixedSensitivity() {
        Signal clk = read(Signal.bool("clk", false));
        Signal y = driven(Signal.bool("y", false));
        Process.Builder logic = seq()
                .sensitivity(rising(clk), new SignalSensitivity(clk))
                .body(next("y", name("clk")));
        assertConversionError(ConversionErrors.SENSITIVITY_KIND, () -> convert(single(logic, clk, y)));
    }

    @Test
    public void emptySensitivity() {
        Signal clk = read(Signal.bool("clk", false));
        Signal y = driven(Signal.bool("y", false));
        assertConversionError(ConversionErrors.STRUCTURE,
                () -> convert(single(seq().body(next("y", name("clk"))), clk, y)));
    }

    @Test
    public void combinationalProcessReadingNothing() {
        Signal y = driven(Signal.bool("y", false));
        Process.Builder logic = Process.builder("logic", ProcessKind.COMBINATIONAL).body(next("y", literal(1)));
        assertConversionError(ConversionErrors.STRUCTURE, () -> convert(single(logic, y)));
    }

    @Test
    public void concurrentAssignments() {
        Signal a = read(Signal.unsigned("a", 4, 0));
        Signal y = driven(Signal.unsigned("y", 4, 0));
        Process.Builder logic = Process.builder("logic", ProcessKind.SIMPLE_COMBINATIONAL).body(next("y", name("a")));

        String vhdl = convert(single(logic, a, y));

        assertTrue(vhdl.contains("begin\n\n    y <= a;\n\nend architecture MyHDL;\n"));
    }

    @Test
    public void concurrentAssignmentsOnly() {
        Signal a = read(Signal.unsigned("a", 4, 0));
        Process.Builder logic = Process.builder("logic", ProcessKind.SIMPLE_COMBINATIONAL)
                .body(new StmtPrint(Collections.singletonList(name("a"))));
        assertConversionError(ConversionErrors.STRUCTURE, () -> convert(single(logic, a)));
    }

    @Test
    public void romReadInConcurrentAssignments() {
        Signal addr = read(Signal.unsigned("addr", 1, 0));
        Signal dout = driven(Signal.bool("dout", false));
        Process.Builder logic = Process.builder("logic", ProcessKind.SIMPLE_COMBINATIONAL)
                .symbol("table", Rom.of(1, 0))
                .body(next("dout", new ExprIndexer(name("table"), name("addr"))));
        assertConversionError(ConversionErrors.NOT_SUPPORTED, () -> convert(single(logic, addr, dout)));
    }
}
