package ch.epfl.vlsc.vhdl.backend;

import ch.epfl.vlsc.vhdl.ir.design.Design;
import ch.epfl.vlsc.vhdl.ir.design.Process;
import ch.epfl.vlsc.vhdl.ir.design.ProcessKind;
import ch.epfl.vlsc.vhdl.ir.design.Signal;
import ch.epfl.vlsc.vhdl.ir.design.Variable;
import ch.epfl.vlsc.vhdl.ir.expr.ExprApplication;
import ch.epfl.vlsc.vhdl.ir.stmt.StmtCall;
import ch.epfl.vlsc.vhdl.ir.stmt.StmtReturn;
import ch.epfl.vlsc.vhdl.reporting.ConversionErrors;
import org.junit.jupiter.api.Test;

import static ch.epfl.vlsc.vhdl.DesignFixtures.add;
import static ch.epfl.vlsc.vhdl.DesignFixtures.args;
import static ch.epfl.vlsc.vhdl.DesignFixtures.assertConversionError;
import static ch.epfl.vlsc.vhdl.DesignFixtures.combinational;
import static ch.epfl.vlsc.vhdl.DesignFixtures.convert;
import static ch.epfl.vlsc.vhdl.DesignFixtures.driven;
import static ch.epfl.vlsc.vhdl.DesignFixtures.lines;
import static ch.epfl.vlsc.vhdl.DesignFixtures.literal;
import static ch.epfl.vlsc.vhdl.DesignFixtures.name;
import static ch.epfl.vlsc.vhdl.DesignFixtures.next;
import static ch.epfl.vlsc.vhdl.DesignFixtures.read;
import static ch.epfl.vlsc.vhdl.DesignFixtures.single;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

public class CallablesTest {

    private static Process inc() {
        return Process.builder("inc", ProcessKind.FUNCTION)
                .parameter(Variable.unsigned("x", 8))
                .input("x")
                .returns(Variable.unsigned("result", 8))
                .body(new StmtReturn(add(name("x"), literal(1))))
                .build();
    }

    private static Process drive() {
        return Process.builder("drive", ProcessKind.PROCEDURE)
                .parameter(Variable.unsigned("o", 8))
                .parameter(Variable.unsigned("v", 8))
                .input("v")
                .output("o")
                .body(next("o", name("v")))
                .build();
    }

    private static int occurrences(String text, String part) {
        int count = 0;
        for (int i = text.indexOf(part); i >= 0; i = text.indexOf(part, i + 1)) {
            count++;
        }
        return count;
    }

    @Test
    public void functionIsDeclaredBeforeBegin() {
        Process.Builder logic = combinational()
                .symbol("inc", inc())
                .body(next("y", new ExprApplication("inc", args(name("a")))));

        String vhdl = convert(single(logic, read(Signal.unsigned("a", 8, 0)), driven(Signal.unsigned("y", 8, 0))));

        assertTrue(vhdl.contains(lines(
                "    end function to_std_logic;",
                "",
                "    function inc(",
                "        x: in unsigned",
                "    ) return unsigned is",
                "    begin",
                "        return (x + 1);",
                "    end function inc;",
                "",
                "begin")));
        assertTrue(vhdl.contains("        y <= inc(a);\n"));
    }

    @Test
    public void functionIsDeclaredOnce() {
        Process callee = inc();
        Signal a = read(Signal.unsigned("a", 8, 0));
        Signal y = driven(Signal.unsigned("y", 8, 0));
        Signal z = driven(Signal.unsigned("z", 8, 0));
        Process first = combinational()
                .signal(a).signal(y).input("a")
                .symbol("inc", callee)
                .body(next("y", new ExprApplication("inc", args(name("a")))))
                .build();
        Process second = Process.builder("other", ProcessKind.COMBINATIONAL)
                .signal(a).signal(z).input("a")
                .symbol("inc", callee)
                .body(next("z", new ExprApplication("inc", args(name("a")))))
                .build();
        Design design = Design.builder("top").port(a).port(y).port(z).process(first, second).build();

        String vhdl = convert(design);

        assertEquals(1, occurrences(vhdl, "end function inc;"));
        assertTrue(vhdl.contains("        y <= inc(a);\n"));
        assertTrue(vhdl.contains("        z <= inc(a);\n"));
    }

    @Test
    public void procedureParametersTakeTheirMode() {
        Process.Builder logic = combinational()
                .symbol("drive", drive())
                .body(new StmtCall(new ExprApplication("drive", args(name("y"), name("a")))));

        String vhdl = convert(single(logic, read(Signal.unsigned("a", 8, 0)), driven(Signal.unsigned("y", 8, 0))));

        assertTrue(vhdl.contains(lines(
                "    procedure drive(",
                "        signal o: out unsigned;",
                "        v: in unsigned",
                "    ) is",
                "    begin",
                "        o <= v;",
                "    end procedure drive;")));
        assertTrue(vhdl.contains("        drive(y, a);\n"));
    }

    @Test
    public void functionResultMustBeUsed() {
        Process.Builder logic = combinational()
                .symbol("inc", inc())
                .body(new StmtCall(new ExprApplication("inc", args(name("a")))));
        assertConversionError(ConversionErrors.NOT_SUPPORTED,
                () -> convert(single(logic, read(Signal.unsigned("a", 8, 0)))));
    }

    @Test
    public void argumentCountIsChecked() {
        Process.Builder logic = combinational()
                .symbol("inc", inc())
                .body(next("y", new ExprApplication("inc", args())));
        assertConversionError(ConversionErrors.ARG_TYPE,
                () -> convert(single(logic, read(Signal.unsigned("a", 8, 0)), driven(Signal.unsigned("y", 8, 0)))));
    }

    @Test
    public void processesCannotBeCalled() {
        Process other = Process.builder("other", ProcessKind.COMBINATIONAL).build();
        Process.Builder logic = combinational()
                .symbol("other", other)
                .body(next("y", new ExprApplication("other", args(name("a")))));
        assertConversionError(ConversionErrors.NOT_SUPPORTED,
                () -> convert(single(logic, read(Signal.unsigned("a", 8, 0)), driven(Signal.unsigned("y", 8, 0)))));
    }
}
