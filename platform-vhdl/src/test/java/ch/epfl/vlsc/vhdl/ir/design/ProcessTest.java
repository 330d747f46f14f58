package ch.epfl.vlsc.vhdl.ir.design;

import ch.epfl.vlsc.vhdl.ir.stmt.Statement;
import ch.epfl.vlsc.vhdl.ir.stmt.StmtPass;
import org.junit.jupiter.api.Test;

import java.util.Arrays;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertSame;

class ProcessTest {

    @Test
    void builderKeepsBodySensitivityAndParametersInOrder() {
        Signal clk = Signal.bool("clk", false);
        Signal reset = Signal.bool("reset", true);
        Statement first = new StmtPass();
        Statement second = new StmtPass();
        Statement third = new StmtPass();
        EdgeSensitivity rising = new EdgeSensitivity(clk, EdgeKind.RISING);
        EdgeSensitivity falling = new EdgeSensitivity(reset, EdgeKind.FALLING);

        Process process = Process.builder("step", ProcessKind.FUNCTION)
                .parameter(Variable.unsigned("x", 8))
                .parameter(Variable.integer("n"))
                .body(first, second)
                .body(Arrays.asList(third))
                .sensitivity(rising, falling)
                .build();

        assertEquals(3, process.getBody().size());
        assertSame(first, process.getBody().get(0));
        assertSame(third, process.getBody().get(2));
        assertEquals(Arrays.asList(rising, falling), process.getSensitivity());
        assertEquals(Arrays.asList("x", "n"), process.getParameters());
        assertEquals(8, process.getVariables().get("x").getWidth());
    }
}
