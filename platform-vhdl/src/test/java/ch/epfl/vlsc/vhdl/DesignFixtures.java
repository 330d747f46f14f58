package ch.epfl.vlsc.vhdl;

import ch.epfl.vlsc.vhdl.ir.design.Design;
import ch.epfl.vlsc.vhdl.ir.design.EdgeKind;
import ch.epfl.vlsc.vhdl.ir.design.EdgeSensitivity;
import ch.epfl.vlsc.vhdl.ir.design.Process;
import ch.epfl.vlsc.vhdl.ir.design.ProcessKind;
import ch.epfl.vlsc.vhdl.ir.design.Signal;
import ch.epfl.vlsc.vhdl.ir.expr.ExprBinaryOp;
import ch.epfl.vlsc.vhdl.ir.expr.ExprComparison;
import ch.epfl.vlsc.vhdl.ir.expr.ExprLiteral;
import ch.epfl.vlsc.vhdl.ir.expr.ExprVariable;
import ch.epfl.vlsc.vhdl.ir.expr.Expression;
import ch.epfl.vlsc.vhdl.ir.stmt.IfBranch;
import ch.epfl.vlsc.vhdl.ir.stmt.Statement;
import ch.epfl.vlsc.vhdl.ir.stmt.StmtAssignment;
import ch.epfl.vlsc.vhdl.ir.stmt.StmtIf;
import ch.epfl.vlsc.vhdl.ir.stmt.lvalue.LValueNext;
import ch.epfl.vlsc.vhdl.ir.stmt.lvalue.LValueVariable;
import ch.epfl.vlsc.vhdl.platform.VhdlConverter;
import ch.epfl.vlsc.vhdl.reporting.CompilationException;
import ch.epfl.vlsc.vhdl.reporting.ConversionErrors;
import ch.epfl.vlsc.vhdl.settings.Configuration;
import org.junit.jupiter.api.function.Executable;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * Small designs and tree builders shared by the tests. Signal flags are set here since the analysis
 * that normally sets them is not part of the converter.
 */
public final class DesignFixtures {

    private DesignFixtures() {
    }

    // -- Signals
    public static Signal driven(Signal signal) {
        signal.setDriven(true);
        return signal;
    }

    public static Signal read(Signal signal) {
        signal.setRead(true);
        return signal;
    }

    public static Signal used(Signal signal) {
        return read(driven(signal));
    }

    public static EdgeSensitivity rising(Signal signal) {
        return new EdgeSensitivity(signal, EdgeKind.RISING);
    }

    public static EdgeSensitivity falling(Signal signal) {
        return new EdgeSensitivity(signal, EdgeKind.FALLING);
    }

    // -- Expressions
    public static ExprVariable name(String name) {
        return new ExprVariable(name);
    }

    public static ExprLiteral literal(long value) {
        return ExprLiteral.integer(value);
    }

    public static ExprBinaryOp add(Expression left, Expression right) {
        return new ExprBinaryOp(ExprBinaryOp.Operator.ADD, left, right);
    }

    public static ExprComparison eq(Expression left, Expression right) {
        return new ExprComparison(ExprComparison.Operator.EQ, left, right);
    }

    // -- Statements
    public static StmtAssignment next(String signal, Expression value) {
        return new StmtAssignment(LValueNext.of(signal), value);
    }

    public static StmtAssignment assign(String variable, Expression value) {
        return new StmtAssignment(new LValueVariable(variable), value);
    }

    public static IfBranch when(Expression condition, Statement... body) {
        return new IfBranch(condition, Arrays.asList(body));
    }

    public static StmtIf ifThen(IfBranch... branches) {
        return new StmtIf(Arrays.asList(branches), null);
    }

    public static StmtIf ifElse(List<IfBranch> branches, Statement... elseBranch) {
        return new StmtIf(branches, Arrays.asList(elseBranch));
    }

    public static List<IfBranch> branches(IfBranch... branches) {
        return Arrays.asList(branches);
    }

    public static List<Expression> args(Expression... args) {
        return args.length == 0 ? Collections.emptyList() : Arrays.asList(args);
    }

    // -- Designs

    /**
     * An 8-bit counter incremented on the rising edge of <code>clk</code>.
     */
    public static Design counter() {
        Signal clk = read(Signal.bool("clk", false));
        Signal count = used(Signal.unsigned("count", 8, 0));
        Process logic = Process.builder("logic", ProcessKind.SEQUENTIAL)
                .signal(clk)
                .signal(count)
                .sensitivity(rising(clk))
                .body(next("count", add(name("count"), literal(1))))
                .build();
        return Design.builder("counter").port(clk).port(count).process(logic).build();
    }

    /**
     * The counter with an asynchronous active-low reset.
     */
    public static Design resettableCounter() {
        Signal clk = read(Signal.bool("clk", false));
        Signal reset = read(Signal.bool("reset", true));
        Signal count = used(Signal.unsigned("count", 8, 0));
        Process seq = Process.builder("seq", ProcessKind.SEQUENTIAL)
                .signal(clk)
                .signal(reset)
                .signal(count)
                .sensitivity(rising(clk), falling(reset))
                .body(ifElse(branches(when(eq(name("reset"), literal(0)), next("count", literal(0)))),
                        next("count", add(name("count"), literal(1)))))
                .build();
        return Design.builder("counter").port(clk).port(reset).port(count).process(seq).build();
    }

    /**
     * A design named <code>top</code> around one process. Every signal is a port bound in the process,
     * and the ones read are its inputs.
     */
    public static Design single(Process.Builder process, Signal... ports) {
        Design.Builder design = Design.builder("top");
        for (Signal port : ports) {
            process.signal(port);
            if (port.isRead()) {
                process.input(port.getBaseName());
            }
            design.port(port);
        }
        return design.process(process.build()).build();
    }

    public static Process.Builder combinational() {
        return Process.builder("logic", ProcessKind.COMBINATIONAL);
    }

    // -- Conversion
    public static String convert(Design design) {
        return convert(design, Configuration.defaults());
    }

    public static String convert(Design design, Configuration configuration) {
        return normalized(new VhdlConverter(configuration).convertToString(design));
    }

    // -- Assertions
    public static CompilationException assertConversionError(ConversionErrors error, Executable executable) {
        CompilationException e = assertThrows(CompilationException.class, executable);
        assertTrue(e.getDiagnostic().getMessage().startsWith(error.getMessage()),
                () -> "expected " + error + " but got: " + e.getMessage());
        return e;
    }

    /**
     * Joins lines with the line ending used in normalized output.
     */
    public static String lines(String... lines) {
        return String.join("\n", lines) + "\n";
    }

    public static String normalized(String text) {
        return text.replace("\r\n", "\n");
    }
}
